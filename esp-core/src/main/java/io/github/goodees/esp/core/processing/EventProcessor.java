package io.github.goodees.esp.core.processing;

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

import io.github.goodees.esp.core.store.EventSource;
import io.github.goodees.esp.core.subscription.SubscriptionMaster;

/**
 * Named consumer of the event log, supervised by {@link EspProcess}.
 */
public interface EventProcessor {

    /**
     * Name of the processor. Checkpoints are tracked per name, therefore it needs to be stable across restarts.
     * @return the name
     */
    String getProcessorName();

    /**
     * Process events until shutdown is requested via the subscription master. Continues after the last checkpoint
     * of the processor.
     * @param eventSource the log to read
     * @param subscriptionMaster master signalling shutdown
     * @throws RuntimeException when processing fails. {@link io.github.goodees.esp.core.subscription.EventProcessingException}
     *         identifies the failing event
     */
    void subscribeTo(EventSource eventSource, SubscriptionMaster subscriptionMaster);
}
