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

import io.github.goodees.esp.core.config.EspConfiguration;
import io.github.goodees.esp.core.store.EventSource;
import io.github.goodees.esp.core.subscription.EventProcessingException;
import io.github.goodees.esp.core.subscription.SubscriptionMaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Supervisor running single event processor on calling thread.
 *
 * <p>{@link #start()} subscribes the processor to the event source and keeps it running until shutdown is requested.
 * When the processor fails:
 * <ol>
 *     <li>the error handler is called and the failure is logged, once per failure</li>
 *     <li>with {@code stopOnFailure} the JVM is terminated with status {@value #FAILURE_EXIT_STATUS}</li>
 *     <li>otherwise the process waits for the delay given by {@link RetryStrategy} and subscribes again. The
 *     subscription continues from the durable checkpoint, so the failing event is delivered again.</li>
 * </ol>
 * <p>Failures are consecutive while the same event keeps failing. A failure of a different event means the processor
 * got past the previous one, and the retry strategy starts over.
 */
public class EspProcess {
    private static final Logger logger = LoggerFactory.getLogger(EspProcess.class);

    public static final int FAILURE_EXIT_STATUS = 1;
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

    private final EventProcessor processor;
    private final EventSource eventSource;
    private final EventProcessorErrorHandler onEventProcessorError;
    private final boolean stopOnFailure;
    private final RetryStrategy retryStrategy;
    private final SubscriptionMaster subscriptionMaster;
    private final ShutdownSignals shutdownSignals;

    protected EspProcess(Builder b) {
        this.processor = b.processor;
        this.eventSource = b.eventSource;
        this.onEventProcessorError = b.onEventProcessorError;
        this.stopOnFailure = b.stopOnFailure;
        this.retryStrategy = b.retryStrategy;
        this.subscriptionMaster = b.subscriptionMaster;
        this.shutdownSignals = b.shutdownSignals != null ? b.shutdownSignals
                : ShutdownSignals.jvmShutdownHook(b.subscriptionMaster, DEFAULT_SHUTDOWN_GRACE_PERIOD);
    }

    /**
     * Run the processor until shutdown is requested, or until it fails with {@code stopOnFailure} set.
     */
    public void start() {
        String processorName = processor.getProcessorName();
        try (ShutdownSignals.Registration signals = shutdownSignals.install(subscriptionMaster::requestShutdown)) {
            UUID lastFailedEvent = null;
            int consecutiveFailures = 0;
            Duration delay = null;
            while (!subscriptionMaster.isShutdownRequested()) {
                try {
                    processor.subscribeTo(eventSource, subscriptionMaster);
                    break;
                } catch (RuntimeException e) {
                    reportFailure(e, processorName);
                    if (stopOnFailure) {
                        logger.warn("Terminating after failure of processor {}", processorName);
                        terminate(FAILURE_EXIT_STATUS);
                        return;
                    }
                    UUID failedEvent = failedEventUuid(e);
                    if (failedEvent != null && lastFailedEvent != null && !failedEvent.equals(lastFailedEvent)) {
                        consecutiveFailures = 0;
                        delay = null;
                    }
                    if (failedEvent != null) {
                        lastFailedEvent = failedEvent;
                    }
                    consecutiveFailures++;
                    delay = retryStrategy.nextDelay(delay, consecutiveFailures);
                    if (subscriptionMaster.isShutdownRequested()) {
                        break;
                    }
                    logger.info("Retrying processor {} in {} (failure #{})", processorName, delay,
                        consecutiveFailures);
                    sleep(delay);
                }
            }
        }
        logger.info("Processor {} stopped", processorName);
    }

    private void reportFailure(RuntimeException e, String processorName) {
        try {
            onEventProcessorError.onError(e, processorName);
        } catch (RuntimeException callbackFailure) {
            logger.warn("Error handler failed for processor {}", processorName, callbackFailure);
        }
        logger.error("Processor {} failed", processorName, e);
    }

    private static UUID failedEventUuid(Throwable e) {
        return e instanceof EventProcessingException ? ((EventProcessingException) e).getEvent().uuid() : null;
    }

    /**
     * Wait before next attempt. Returns early when shutdown is requested.
     * @param delay the delay
     */
    protected void sleep(Duration delay) {
        try {
            subscriptionMaster.awaitShutdown(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscriptionMaster.requestShutdown();
        }
    }

    protected void terminate(int status) {
        System.exit(status);
    }

    public SubscriptionMaster getSubscriptionMaster() {
        return subscriptionMaster;
    }

    public String getProcessorName() {
        return processor.getProcessorName();
    }

    public static Builder builder(EventProcessor processor, EventSource eventSource) {
        return new Builder(processor, eventSource);
    }

    public static class Builder {
        private final EventProcessor processor;
        private final EventSource eventSource;
        private EventProcessorErrorHandler onEventProcessorError = EventProcessorErrorHandler.ignore();
        private boolean stopOnFailure;
        private RetryStrategy retryStrategy = RetryStrategy.constant();
        private SubscriptionMaster subscriptionMaster = new SubscriptionMaster();
        private ShutdownSignals shutdownSignals;

        Builder(EventProcessor processor, EventSource eventSource) {
            this.processor = Objects.requireNonNull(processor, "Processor must be specified");
            this.eventSource = Objects.requireNonNull(eventSource, "Event source must be specified");
        }

        /**
         * Take failure policy from configuration.
         * @param configuration the configuration
         * @return this builder
         */
        public Builder configure(EspConfiguration configuration) {
            this.stopOnFailure = configuration.isStopOnFailure();
            this.retryStrategy = configuration.getRetryStrategy();
            return this;
        }

        public Builder onEventProcessorError(EventProcessorErrorHandler handler) {
            this.onEventProcessorError = Objects.requireNonNull(handler);
            return this;
        }

        public Builder stopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = Objects.requireNonNull(retryStrategy);
            return this;
        }

        public Builder subscriptionMaster(SubscriptionMaster subscriptionMaster) {
            this.subscriptionMaster = Objects.requireNonNull(subscriptionMaster);
            return this;
        }

        /**
         * Source of termination signals, JVM shutdown hook by default.
         * @param shutdownSignals the signals
         * @return this builder
         */
        public Builder shutdownSignals(ShutdownSignals shutdownSignals) {
            this.shutdownSignals = shutdownSignals;
            return this;
        }

        public EspProcess build() {
            return new EspProcess(this);
        }
    }
}
