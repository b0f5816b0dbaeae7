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

import java.time.Duration;
import java.util.Objects;

/**
 * Delay between a failure of an event processor and its next attempt.
 *
 * <p>Strategies are pure functions of the previous delay and number of consecutive failures, {@link EspProcess}
 * keeps the state.
 */
public interface RetryStrategy {
    Duration DEFAULT_DELAY = Duration.ofSeconds(1);
    Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(64);

    /**
     * Compute delay before next attempt.
     * @param previousDelay delay used after previous failure, null for first failure
     * @param consecutiveFailures number of consecutive failures including the current one, at least 1
     * @return delay to wait before next attempt
     */
    Duration nextDelay(Duration previousDelay, int consecutiveFailures);

    /**
     * Name of the strategy, as accepted by {@link #named(String)}.
     * @return the name
     */
    String name();

    static RetryStrategy constant() {
        return new Constant(DEFAULT_DELAY);
    }

    static RetryStrategy constant(Duration delay) {
        return new Constant(delay);
    }

    /**
     * Delay of 1 second doubled with every consecutive failure, up to 64 seconds.
     * @return exponential strategy with default bounds
     */
    static RetryStrategy exponential() {
        return new Exponential(DEFAULT_DELAY, DEFAULT_MAX_DELAY);
    }

    static RetryStrategy exponential(Duration initialDelay, Duration maxDelay) {
        return new Exponential(initialDelay, maxDelay);
    }

    /**
     * Look up strategy with default parameters by its name.
     * @param name {@code constant} or {@code exponential}
     * @return the strategy
     * @throws IllegalArgumentException for any other name
     */
    static RetryStrategy named(String name) {
        switch (Objects.requireNonNull(name, "Retry strategy name must be specified").trim().toLowerCase()) {
            case Constant.NAME:
                return constant();
            case Exponential.NAME:
                return exponential();
            default:
                throw new IllegalArgumentException("Unknown retry strategy " + name
                        + ", expected one of constant, exponential");
        }
    }

    final class Constant implements RetryStrategy {
        static final String NAME = "constant";
        private final Duration delay;

        Constant(Duration delay) {
            this.delay = RetryDelays.requirePositive(delay, "Delay");
        }

        @Override
        public Duration nextDelay(Duration previousDelay, int consecutiveFailures) {
            return delay;
        }

        @Override
        public String name() {
            return NAME;
        }

        public Duration getDelay() {
            return delay;
        }

        @Override
        public String toString() {
            return "RetryStrategy.Constant{" + delay + "}";
        }
    }

    final class Exponential implements RetryStrategy {
        static final String NAME = "exponential";
        private final Duration initialDelay;
        private final Duration maxDelay;

        Exponential(Duration initialDelay, Duration maxDelay) {
            this.initialDelay = RetryDelays.requirePositive(initialDelay, "Initial delay");
            this.maxDelay = RetryDelays.requirePositive(maxDelay, "Max delay");
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than initial delay "
                        + initialDelay);
            }
        }

        @Override
        public Duration nextDelay(Duration previousDelay, int consecutiveFailures) {
            if (previousDelay == null || consecutiveFailures <= 1) {
                return initialDelay;
            }
            Duration doubled = previousDelay.multipliedBy(2);
            return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        }

        @Override
        public String name() {
            return NAME;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        @Override
        public String toString() {
            return "RetryStrategy.Exponential{" + initialDelay + ".." + maxDelay + "}";
        }
    }
}
