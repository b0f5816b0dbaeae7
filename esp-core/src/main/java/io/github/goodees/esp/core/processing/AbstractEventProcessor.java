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

import io.github.goodees.esp.core.Event;
import io.github.goodees.esp.core.config.EspConfiguration;
import io.github.goodees.esp.core.store.EventSource;
import io.github.goodees.esp.core.subscription.EventHandler;
import io.github.goodees.esp.core.subscription.PollingWaitStrategy;
import io.github.goodees.esp.core.subscription.Subscription;
import io.github.goodees.esp.core.subscription.SubscriptionMaster;
import io.github.goodees.esp.core.subscription.WaitStrategy;
import io.github.goodees.esp.core.tracking.CheckpointTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base class for event processors handling events by their type.
 *
 * <p>Subclasses register handlers in their constructor:
 * <pre>{@code
 * class OrderTotals extends AbstractEventProcessor {
 *     OrderTotals(CheckpointTracker tracker, EspConfiguration config) {
 *         super("order_totals", tracker, config);
 *         handles("item_added", this::itemAdded);
 *         handles("item_removed", this::itemRemoved);
 *     }
 * }
 * }</pre>
 * <p>By default the subscription reads only the handled types. Processors that want to see every event override
 * {@link #subscribedEventTypes()} to return empty set, and events without handler are then treated according to
 * the configured {@link UnknownEventPolicy}.
 */
public abstract class AbstractEventProcessor implements EventProcessor, EventHandler {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String processorName;
    private final CheckpointTracker tracker;
    private final EspConfiguration configuration;
    private final Supplier<WaitStrategy> waitStrategies;
    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();

    protected AbstractEventProcessor(String processorName, CheckpointTracker tracker, EspConfiguration configuration) {
        this(processorName, tracker, configuration, PollingWaitStrategy::new);
    }

    /**
     * @param processorName name of the processor
     * @param tracker tracker of processor's checkpoint
     * @param configuration batch size, polling interval and unknown event policy are taken from here
     * @param waitStrategies supplies new wait strategy for every subscription
     */
    protected AbstractEventProcessor(String processorName, CheckpointTracker tracker, EspConfiguration configuration,
            Supplier<WaitStrategy> waitStrategies) {
        this.processorName = Objects.requireNonNull(processorName, "Processor name must be specified");
        this.tracker = Objects.requireNonNull(tracker, "Checkpoint tracker must be specified");
        this.configuration = Objects.requireNonNull(configuration, "Configuration must be specified");
        this.waitStrategies = Objects.requireNonNull(waitStrategies);
    }

    protected final void handles(String eventType, EventHandler handler) {
        if (handlers.putIfAbsent(eventType, handler) != null) {
            throw new IllegalArgumentException("Processor " + processorName + " already handles " + eventType);
        }
    }

    @Override
    public String getProcessorName() {
        return processorName;
    }

    public Set<String> handledEventTypes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(handlers.keySet()));
    }

    /**
     * Types of events the subscription reads.
     * @return handled event types, empty set for all events
     */
    protected Set<String> subscribedEventTypes() {
        return handledEventTypes();
    }

    @Override
    public void subscribeTo(EventSource eventSource, SubscriptionMaster subscriptionMaster) {
        Subscription.builder(processorName, eventSource, tracker, this, subscriptionMaster)
                .eventTypes(subscribedEventTypes())
                .batchSize(configuration.getBatchSize())
                .callbackInterval(configuration.getCallbackIntervalIfNoNewEvents())
                .waitStrategy(waitStrategies.get())
                .build()
                .start();
    }

    @Override
    public void handle(Event event) throws Exception {
        EventHandler handler = handlers.get(event.type());
        if (handler != null) {
            handler.handle(event);
        } else if (configuration.getOnUnknownEvent() == UnknownEventPolicy.RAISE) {
            throw new UnknownEventTypeException(processorName, event);
        } else {
            logger.warn("Processor {} ignores event {} of unknown type {}", processorName, event.id(), event.type());
        }
    }

    public long lastProcessedEventId() {
        return tracker.lastProcessedId(processorName);
    }

    protected EspConfiguration getConfiguration() {
        return configuration;
    }
}
