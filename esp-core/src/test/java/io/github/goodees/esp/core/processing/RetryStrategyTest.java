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

import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class RetryStrategyTest {

    private static List<Long> delays(RetryStrategy strategy, int failures) {
        List<Long> result = new ArrayList<>();
        Duration delay = null;
        for (int i = 1; i <= failures; i++) {
            delay = strategy.nextDelay(delay, i);
            result.add(delay.getSeconds());
        }
        return result;
    }

    @Test
    public void constant_strategy_waits_one_second() {
        assertThat(delays(RetryStrategy.constant(), 4), contains(1L, 1L, 1L, 1L));
    }

    @Test
    public void exponential_strategy_doubles_up_to_cap() {
        assertThat(delays(RetryStrategy.exponential(), 9), contains(1L, 2L, 4L, 8L, 16L, 32L, 64L, 64L, 64L));
    }

    @Test
    public void exponential_strategy_starts_over_after_reset() {
        RetryStrategy strategy = RetryStrategy.exponential();

        assertEquals(Duration.ofSeconds(1), strategy.nextDelay(Duration.ofSeconds(16), 1));
    }

    @Test
    public void custom_bounds_are_respected() {
        RetryStrategy strategy = RetryStrategy.exponential(Duration.ofMillis(100), Duration.ofMillis(300));
        Duration delay = strategy.nextDelay(null, 1);
        delay = strategy.nextDelay(delay, 2);
        assertEquals(Duration.ofMillis(200), delay);
        assertEquals(Duration.ofMillis(300), strategy.nextDelay(delay, 3));
    }

    @Test
    public void strategies_are_selected_by_name() {
        assertThat(RetryStrategy.named("constant"), instanceOf(RetryStrategy.Constant.class));
        assertThat(RetryStrategy.named(" Exponential "), instanceOf(RetryStrategy.Exponential.class));
        assertEquals("exponential", RetryStrategy.exponential().name());
    }

    @Test
    public void unknown_name_is_rejected() {
        try {
            RetryStrategy.named("linear");
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown retry strategy linear, expected one of constant, exponential", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void cap_below_initial_delay_is_rejected() {
        RetryStrategy.exponential(Duration.ofSeconds(10), Duration.ofSeconds(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zero_delay_is_rejected() {
        RetryStrategy.constant(Duration.ZERO);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_initial_delay_is_rejected() {
        RetryStrategy.exponential(Duration.ofSeconds(-1), Duration.ofSeconds(1));
    }

    @Test
    public void missing_delay_names_the_parameter() {
        try {
            RetryStrategy.exponential(Duration.ofSeconds(1), null);
            fail("should have failed");
        } catch (NullPointerException e) {
            assertEquals("Max delay must be specified", e.getMessage());
        }
    }
}
