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

import io.github.goodees.esp.core.subscription.SubscriptionMaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Translates process termination into a shutdown request. The request handler only sets a flag, actual stopping
 * happens at the next safe point of the processing loop.
 */
@FunctionalInterface
public interface ShutdownSignals {

    /**
     * Start translating termination signals.
     * @param requestShutdown action to run on termination
     * @return registration that stops the translation when closed
     */
    Registration install(Runnable requestShutdown);

    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Signals delivered by JVM shutdown hook, which is where SIGTERM and SIGINT end up. The hook requests shutdown and
     * then waits up to the grace period for running subscriptions of the master to finish their batch.
     * @param subscriptionMaster master whose subscriptions are awaited
     * @param gracePeriod maximum time the hook waits
     * @return the signals
     */
    static ShutdownSignals jvmShutdownHook(SubscriptionMaster subscriptionMaster, Duration gracePeriod) {
        return new JvmShutdownHook(subscriptionMaster, gracePeriod);
    }

    /**
     * Signals that never fire. For processes that are stopped only through their subscription master.
     * @return the signals
     */
    static ShutdownSignals none() {
        return requestShutdown -> () -> {
        };
    }

    final class JvmShutdownHook implements ShutdownSignals {
        private static final Logger logger = LoggerFactory.getLogger(JvmShutdownHook.class);

        private final SubscriptionMaster subscriptionMaster;
        private final Duration gracePeriod;

        JvmShutdownHook(SubscriptionMaster subscriptionMaster, Duration gracePeriod) {
            this.subscriptionMaster = Objects.requireNonNull(subscriptionMaster);
            this.gracePeriod = Objects.requireNonNull(gracePeriod);
        }

        @Override
        public Registration install(Runnable requestShutdown) {
            Thread hook = new Thread(shutdownAction(requestShutdown), "esp-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            return new HookRegistration(hook);
        }

        /**
         * Body of the hook thread. Requests shutdown and waits at most the grace period for subscriptions to stop.
         */
        Runnable shutdownAction(Runnable requestShutdown) {
            return () -> {
                requestShutdown.run();
                try {
                    if (!subscriptionMaster.awaitSubscriptionsStopped(gracePeriod)) {
                        logger.warn("Subscriptions {} did not stop within {}",
                            subscriptionMaster.activeSubscriptions(), gracePeriod);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
        }

        static final class HookRegistration implements Registration {
            private final Thread hook;

            HookRegistration(Thread hook) {
                this.hook = hook;
            }

            Thread getHook() {
                return hook;
            }

            @Override
            public void close() {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    logger.debug("JVM is already shutting down, hook stays registered");
                }
            }
        }
    }
}
