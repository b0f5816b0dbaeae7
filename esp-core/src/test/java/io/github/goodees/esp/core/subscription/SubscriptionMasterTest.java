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

import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SubscriptionMasterTest {
    private final SubscriptionMaster master = new SubscriptionMaster();

    @Test
    public void shutdown_request_is_idempotent() {
        AtomicInteger calls = new AtomicInteger();
        master.onShutdownRequested(calls::incrementAndGet);

        master.requestShutdown();
        master.requestShutdown();

        assertTrue(master.isShutdownRequested());
        assertEquals(1, calls.get());
    }

    @Test
    public void listener_registered_after_shutdown_runs_immediately() {
        master.requestShutdown();
        AtomicInteger calls = new AtomicInteger();
        master.onShutdownRequested(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    public void removed_listener_is_not_called() {
        AtomicInteger calls = new AtomicInteger();
        master.onShutdownRequested(calls::incrementAndGet).close();
        master.requestShutdown();

        assertEquals(0, calls.get());
    }

    @Test
    public void await_shutdown_is_bounded() throws InterruptedException {
        assertFalse(master.awaitShutdown(Duration.ofMillis(10)));
        master.requestShutdown();
        assertTrue(master.awaitShutdown(Duration.ofMinutes(1)));
    }

    @Test
    public void tracks_running_subscriptions() throws InterruptedException {
        master.subscriptionStarted("a");
        try {
            master.subscriptionStarted("a");
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertThat(master.activeSubscriptions(), contains("a"));
        }
        assertFalse(master.awaitSubscriptionsStopped(Duration.ofMillis(10)));

        Thread stopper = new Thread(() -> master.subscriptionStopped("a"));
        stopper.start();
        assertTrue(master.awaitSubscriptionsStopped(Duration.ofSeconds(5)));
        assertThat(master.activeSubscriptions(), empty());
        stopper.join();
    }
}
