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

import io.github.goodees.esp.core.store.NewEventNotifier;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wake up as soon as the store announces an append, and poll anyway when the interval expires.
 *
 * <p>Notifications that arrive while the subscription is processing are remembered, so the following wait returns
 * immediately. The notification is only a hint, the subscription always reads the store to find out what is new.
 */
public class PushAssistedWaitStrategy implements WaitStrategy {
    private final Lock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final NewEventNotifier.Registration registration;
    private boolean pending;

    public PushAssistedWaitStrategy(NewEventNotifier notifier) {
        this.registration = notifier.register(latestId -> signal());
    }

    void signal() {
        lock.lock();
        try {
            pending = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Wakeup waitForMoreEvents(Duration timeout, SubscriptionMaster subscriptionMaster)
            throws InterruptedException {
        try (SubscriptionMaster.Registration onShutdown = subscriptionMaster.onShutdownRequested(this::signal)) {
            long nanos = timeout.toNanos();
            lock.lock();
            try {
                while (true) {
                    if (subscriptionMaster.isShutdownRequested()) {
                        return Wakeup.SHUTDOWN;
                    }
                    if (pending) {
                        pending = false;
                        return Wakeup.NOTIFIED;
                    }
                    if (nanos <= 0) {
                        return Wakeup.TIMED_OUT;
                    }
                    nanos = wakeup.awaitNanos(nanos);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public void close() {
        registration.close();
    }
}
