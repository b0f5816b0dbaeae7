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

import io.github.goodees.esp.core.Event;
import io.github.goodees.esp.core.store.EventSource;
import io.github.goodees.esp.core.tracking.CheckpointTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Delivers events of the log to a handler, starting after the checkpoint of the processor and continuing with events
 * appended later.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *     <li>{@link State#IDLE}: created, not started</li>
 *     <li>{@link State#CATCHING_UP}: reading full batches after the checkpoint. Every batch is handled event by event
 *     and the checkpoint is advanced to the last event of the batch.</li>
 *     <li>{@link State#LIVE}: first read returned fewer events than batch size. Subscription now waits by its
 *     {@link WaitStrategy} whenever it reads less than full batch.</li>
 *     <li>{@link State#STOPPED}: shutdown was requested via {@link SubscriptionMaster}, or handler failed.</li>
 * </ol>
 * <p>Shutdown is checked before every read and during waiting. A batch that is being handled is always finished and
 * checkpointed before the subscription stops.
 *
 * <h2>Failures</h2>
 * <p>When the handler throws, the events of the batch handled before the failing one are checkpointed, and the
 * failure propagates from {@link #start()} as {@link EventProcessingException}. Starting a new subscription
 * for the processor will redeliver the failing event.
 */
public class Subscription {
    private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final Duration DEFAULT_CALLBACK_INTERVAL = Duration.ofSeconds(10);

    public enum State {
        IDLE, CATCHING_UP, LIVE, STOPPED
    }

    private final String processorName;
    private final EventSource eventSource;
    private final CheckpointTracker tracker;
    private final EventHandler handler;
    private final SubscriptionMaster subscriptionMaster;
    private final WaitStrategy waitStrategy;
    private final Set<String> eventTypes;
    private final int batchSize;
    private final Duration callbackInterval;

    private volatile State state = State.IDLE;
    private volatile long cursor;

    private Subscription(Builder b) {
        this.processorName = b.processorName;
        this.eventSource = b.eventSource;
        this.tracker = b.tracker;
        this.handler = b.handler;
        this.subscriptionMaster = b.subscriptionMaster;
        this.waitStrategy = b.waitStrategy != null ? b.waitStrategy : new PollingWaitStrategy();
        this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.eventTypes));
        this.batchSize = b.batchSize;
        this.callbackInterval = b.callbackInterval;
    }

    /**
     * Run the subscription on calling thread. Returns after shutdown was requested.
     * @throws EventProcessingException when the handler fails
     * @throws IllegalStateException when the subscription was already started, or another subscription for same
     *         processor is running within the subscription master
     */
    public void start() {
        if (state != State.IDLE) {
            throw new IllegalStateException("Subscription " + processorName + " was already started");
        }
        subscriptionMaster.subscriptionStarted(processorName);
        try {
            cursor = tracker.lastProcessedId(processorName);
            state = State.CATCHING_UP;
            logger.info("Subscription {} catching up after event {}", processorName, cursor);
            while (!subscriptionMaster.isShutdownRequested()) {
                List<Event> events = eventSource.readAfter(cursor, eventTypes, batchSize);
                if (!events.isEmpty()) {
                    handleBatch(events);
                }
                if (events.size() >= batchSize) {
                    continue;
                }
                if (state == State.CATCHING_UP) {
                    state = State.LIVE;
                    logger.info("Subscription {} caught up at event {}", processorName, cursor);
                }
                if (waitForMoreEvents() == WaitStrategy.Wakeup.SHUTDOWN) {
                    break;
                }
            }
        } finally {
            state = State.STOPPED;
            waitStrategy.close();
            subscriptionMaster.subscriptionStopped(processorName);
            logger.info("Subscription {} stopped after event {}", processorName, cursor);
        }
    }

    private WaitStrategy.Wakeup waitForMoreEvents() {
        try {
            return waitStrategy.waitForMoreEvents(callbackInterval, subscriptionMaster);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Subscription {} interrupted while waiting for events", processorName);
            return WaitStrategy.Wakeup.SHUTDOWN;
        }
    }

    private void handleBatch(List<Event> events) {
        long handled = cursor;
        try {
            for (Event event : events) {
                handle(event);
                handled = event.id();
            }
        } catch (EventProcessingException e) {
            if (handled > cursor) {
                try {
                    checkpoint(handled);
                } catch (RuntimeException checkpointFailure) {
                    e.addSuppressed(checkpointFailure);
                }
            }
            throw e;
        }
        checkpoint(handled);
        logger.debug("Subscription {} processed {} events up to {}", processorName, events.size(), handled);
    }

    private void handle(Event event) {
        try {
            handler.handle(event);
        } catch (EventProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new EventProcessingException(event, e);
        }
    }

    private void checkpoint(long eventId) {
        tracker.advance(processorName, eventId);
        cursor = eventId;
    }

    public State getState() {
        return state;
    }

    /**
     * Id of last event that was handled and checkpointed.
     * @return the cursor
     */
    public long getCursor() {
        return cursor;
    }

    public String getProcessorName() {
        return processorName;
    }

    public static Builder builder(String processorName, EventSource eventSource, CheckpointTracker tracker,
            EventHandler handler, SubscriptionMaster subscriptionMaster) {
        return new Builder(processorName, eventSource, tracker, handler, subscriptionMaster);
    }

    public static class Builder {
        private final String processorName;
        private final EventSource eventSource;
        private final CheckpointTracker tracker;
        private final EventHandler handler;
        private final SubscriptionMaster subscriptionMaster;
        private WaitStrategy waitStrategy;
        private Set<String> eventTypes = Collections.emptySet();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration callbackInterval = DEFAULT_CALLBACK_INTERVAL;

        Builder(String processorName, EventSource eventSource, CheckpointTracker tracker, EventHandler handler,
                SubscriptionMaster subscriptionMaster) {
            this.processorName = Objects.requireNonNull(processorName, "Processor name must be specified");
            this.eventSource = Objects.requireNonNull(eventSource, "Event source must be specified");
            this.tracker = Objects.requireNonNull(tracker, "Checkpoint tracker must be specified");
            this.handler = Objects.requireNonNull(handler, "Event handler must be specified");
            this.subscriptionMaster = Objects.requireNonNull(subscriptionMaster,
                "Subscription master must be specified");
        }

        /**
         * Wait strategy for live mode, {@link PollingWaitStrategy} by default. The subscription closes it when it
         * stops.
         * @param waitStrategy the strategy
         * @return this builder
         */
        public Builder waitStrategy(WaitStrategy waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        /**
         * Deliver only events of given types. Empty collection, the default, delivers all events.
         * @param eventTypes types of events to deliver
         * @return this builder
         */
        public Builder eventTypes(Collection<String> eventTypes) {
            this.eventTypes = new LinkedHashSet<>(eventTypes);
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Maximum time to wait for new events in live mode before polling the store again.
         * @param callbackInterval the polling interval
         * @return this builder
         */
        public Builder callbackInterval(Duration callbackInterval) {
            if (callbackInterval.isNegative()) {
                throw new IllegalArgumentException("Callback interval must not be negative");
            }
            this.callbackInterval = callbackInterval;
            return this;
        }

        public Subscription build() {
            return new Subscription(this);
        }
    }
}
