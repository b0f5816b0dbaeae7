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
import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EspConfigurationTest {

    @Test
    public void defaults() {
        EspConfiguration config = EspConfiguration.defaults();

        assertEquals(Duration.ofSeconds(10), config.getCallbackIntervalIfNoNewEvents());
        assertEquals("events", config.getEventsTableName());
        assertEquals("aggregates", config.getAggregatesTableName());
        assertEquals("event_processor_trackers", config.getTrackerTableName());
        assertEquals("events_lock", config.getLockTableName());
        assertTrue(config.isLockTableToGuaranteeLinearSequenceIdGrowth());
        assertEquals(1000, config.getBatchSize());
        assertTrue(config.isAutoCreateProcessorTracker());
        assertEquals(UnknownEventPolicy.RAISE, config.getOnUnknownEvent());
        assertThat(config.getRetryStrategy(), instanceOf(RetryStrategy.Constant.class));
        assertFalse(config.isStopOnFailure());
    }

    @Test
    public void options_are_read_from_properties() {
        Properties properties = new Properties();
        properties.setProperty("esp.callback_interval_if_no_new_events", "3");
        properties.setProperty("esp.events_table_name", "app_events");
        properties.setProperty("esp.lock_table_to_guarantee_linear_sequence_id_growth", "FALSE");
        properties.setProperty("esp.batch_size", " 250 ");
        properties.setProperty("esp.on_unknown_event", "ignore");
        properties.setProperty("esp.retry_strategy", "exponential");
        properties.setProperty("esp.stop_on_failure", "true");
        properties.setProperty("esp.something_else", "whatever");
        properties.setProperty("unrelated", "value");

        EspConfiguration config = EspConfiguration.fromProperties(properties);

        assertEquals(Duration.ofSeconds(3), config.getCallbackIntervalIfNoNewEvents());
        assertEquals("app_events", config.getEventsTableName());
        assertEquals("aggregates", config.getAggregatesTableName());
        assertFalse(config.isLockTableToGuaranteeLinearSequenceIdGrowth());
        assertEquals(250, config.getBatchSize());
        assertEquals(UnknownEventPolicy.IGNORE, config.getOnUnknownEvent());
        assertThat(config.getRetryStrategy(), instanceOf(RetryStrategy.Exponential.class));
        assertTrue(config.isStopOnFailure());
    }

    @Test
    public void malformed_value_names_the_option() {
        Properties properties = new Properties();
        properties.setProperty("esp.batch_size", "many");
        try {
            EspConfiguration.fromProperties(properties);
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("esp.batch_size"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_retry_strategy_is_rejected() {
        Properties properties = new Properties();
        properties.setProperty("esp.retry_strategy", "sometimes");
        EspConfiguration.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void non_boolean_flag_is_rejected() {
        Properties properties = new Properties();
        properties.setProperty("esp.stop_on_failure", "yes");
        EspConfiguration.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void batch_size_must_be_positive() {
        EspConfiguration.builder().batchSize(0).build();
    }
}
