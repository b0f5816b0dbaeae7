package io.github.goodees.esp.core.subscription;

/*-
 * #%L
 * esp
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.time.Duration;

/**
 * How a live subscription waits for new events after it has read everything in the log.
 *
 * <p>Waiting must stay responsive to shutdown: implementations return {@link Wakeup#SHUTDOWN} as soon as shutdown of
 * the master is requested. A wait strategy belongs to single subscription, which closes it when it stops.
 *
 * @see PollingWaitStrategy
 * @see PushAssistedWaitStrategy
 */
public interface WaitStrategy extends AutoCloseable {

    enum Wakeup {
        /** New events were announced before timeout. */
        NOTIFIED,
        /** Nothing happened, time to poll. */
        TIMED_OUT,
        /** Shutdown was requested. */
        SHUTDOWN
    }

    /**
     * Block until there might be more events, timeout expires, or shutdown is requested.
     * @param timeout the polling interval
     * @param subscriptionMaster master whose shutdown ends the wait
     * @return reason of wakeup
     * @throws InterruptedException when the waiting thread is interrupted
     */
    Wakeup waitForMoreEvents(Duration timeout, SubscriptionMaster subscriptionMaster) throws InterruptedException;

    @Override
    default void close() {
    }
}
