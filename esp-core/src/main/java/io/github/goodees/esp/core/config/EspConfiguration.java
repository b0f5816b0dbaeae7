package io.github.goodees.esp.core.config;

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

import io.github.goodees.esp.core.processing.RetryStrategy;
import io.github.goodees.esp.core.processing.UnknownEventPolicy;
import org.immutables.value.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings shared by event stores, trackers and processors. Built once at startup and passed explicitly.
 *
 * <pre>{@code
 * EspConfiguration config = EspConfiguration.builder()
 *         .callbackIntervalIfNoNewEvents(Duration.ofSeconds(2))
 *         .retryStrategy(RetryStrategy.exponential())
 *         .build();
 * }</pre>
 */
@Value.Immutable
public interface EspConfiguration {
    String PREFIX = "esp.";
    String CALLBACK_INTERVAL_IF_NO_NEW_EVENTS = PREFIX + "callback_interval_if_no_new_events";
    String EVENTS_TABLE_NAME = PREFIX + "events_table_name";
    String AGGREGATES_TABLE_NAME = PREFIX + "aggregates_table_name";
    String TRACKER_TABLE_NAME = PREFIX + "tracker_table_name";
    String LOCK_TABLE_NAME = PREFIX + "lock_table_name";
    String LOCK_TABLE_TO_GUARANTEE_LINEAR_SEQUENCE_ID_GROWTH = PREFIX
            + "lock_table_to_guarantee_linear_sequence_id_growth";
    String BATCH_SIZE = PREFIX + "batch_size";
    String AUTO_CREATE_PROCESSOR_TRACKER = PREFIX + "auto_create_processor_tracker";
    String ON_UNKNOWN_EVENT = PREFIX + "on_unknown_event";
    String RETRY_STRATEGY = PREFIX + "retry_strategy";
    String STOP_ON_FAILURE = PREFIX + "stop_on_failure";

    /**
     * Longest time a live subscription waits before polling the store again.
     * @return the interval, 10 seconds by default
     */
    @Value.Default
    default Duration getCallbackIntervalIfNoNewEvents() {
        return Duration.ofSeconds(10);
    }

    @Value.Default
    default String getEventsTableName() {
        return "events";
    }

    @Value.Default
    default String getAggregatesTableName() {
        return "aggregates";
    }

    @Value.Default
    default String getTrackerTableName() {
        return "event_processor_trackers";
    }

    @Value.Default
    default String getLockTableName() {
        return "events_lock";
    }

    /**
     * Serialize appends through a row lock, so that ids become visible in the order they were assigned. Turning it
     * off lets concurrent appends commit out of id order, and subscriptions may then skip events.
     * @return true by default
     */
    @Value.Default
    default boolean isLockTableToGuaranteeLinearSequenceIdGrowth() {
        return true;
    }

    @Value.Default
    default int getBatchSize() {
        return 1000;
    }

    @Value.Default
    default boolean isAutoCreateProcessorTracker() {
        return true;
    }

    @Value.Default
    default UnknownEventPolicy getOnUnknownEvent() {
        return UnknownEventPolicy.RAISE;
    }

    @Value.Default
    default RetryStrategy getRetryStrategy() {
        return RetryStrategy.constant();
    }

    @Value.Default
    default boolean isStopOnFailure() {
        return false;
    }

    @Value.Check
    default void check() {
        if (getBatchSize() <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, was " + getBatchSize());
        }
        if (getCallbackIntervalIfNoNewEvents().isNegative()) {
            throw new IllegalArgumentException("Callback interval must not be negative");
        }
    }

    static Builder builder() {
        return new Builder();
    }

    static EspConfiguration defaults() {
        return builder().build();
    }

    /**
     * Read configuration from properties. Options not present keep their default, unknown keys are ignored.
     * @param properties properties with keys prefixed {@value #PREFIX}
     * @return the configuration
     * @throws IllegalArgumentException when value of an option cannot be parsed
     */
    static EspConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);
        reader.read(CALLBACK_INTERVAL_IF_NO_NEW_EVENTS, v -> Duration.ofSeconds(Long.parseLong(v)),
            builder::callbackIntervalIfNoNewEvents);
        reader.read(EVENTS_TABLE_NAME, Function.identity(), builder::eventsTableName);
        reader.read(AGGREGATES_TABLE_NAME, Function.identity(), builder::aggregatesTableName);
        reader.read(TRACKER_TABLE_NAME, Function.identity(), builder::trackerTableName);
        reader.read(LOCK_TABLE_NAME, Function.identity(), builder::lockTableName);
        reader.read(LOCK_TABLE_TO_GUARANTEE_LINEAR_SEQUENCE_ID_GROWTH, PropertyReader::parseBoolean,
            builder::lockTableToGuaranteeLinearSequenceIdGrowth);
        reader.read(BATCH_SIZE, Integer::valueOf, builder::batchSize);
        reader.read(AUTO_CREATE_PROCESSOR_TRACKER, PropertyReader::parseBoolean, builder::autoCreateProcessorTracker);
        reader.read(ON_UNKNOWN_EVENT, v -> UnknownEventPolicy.valueOf(v.toUpperCase(Locale.ROOT)),
            builder::onUnknownEvent);
        reader.read(RETRY_STRATEGY, RetryStrategy::named, builder::retryStrategy);
        reader.read(STOP_ON_FAILURE, PropertyReader::parseBoolean, builder::stopOnFailure);
        return builder.build();
    }

    class Builder extends ImmutableEspConfiguration.Builder {

    }
}
