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
import io.github.goodees.esp.core.store.EventSink;
import io.github.goodees.esp.core.store.EventSource;
import io.github.goodees.esp.core.store.EventStoreException;
import io.github.goodees.esp.core.tracking.CheckpointTracker;
import io.github.goodees.esp.store.inmemory.InMemoryCheckpointTracker;
import io.github.goodees.esp.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static io.github.goodees.esp.core.Eventually.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SubscriptionTest {
    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;
    private EventSink sink;
    private EventSource source;
    private CheckpointTracker tracker;
    private SubscriptionMaster master;
    private final List<Event> handled = new CopyOnWriteArrayList<>();
    private Thread background;

    @Before
    public void setUp() {
        store = new InMemoryEventStore();
        sink = new EventSink(store);
        source = new EventSource(store);
        tracker = new InMemoryCheckpointTracker();
        master = new SubscriptionMaster();
    }

    @After
    public void stop() throws InterruptedException {
        master.requestShutdown();
        if (background != null) {
            background.join(10_000);
            assertFalse("subscription thread should have stopped", background.isAlive());
        }
    }

    private String name() {
        return testName.getMethodName();
    }

    private List<Event> appendEvents(String type, int count) throws EventStoreException {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(Event.ofType(type).putBody("n", i).build());
        }
        return sink.append(name() + "-" + type, events);
    }

    private static List<Long> ids(List<Event> events) {
        return events.stream().map(Event::id).collect(Collectors.toList());
    }

    private Subscription.Builder subscription(EventHandler handler) {
        return Subscription.builder(name(), source, tracker, handler, master);
    }

    private void startInBackground(Subscription subscription) {
        background = new Thread(subscription::start, name());
        background.start();
    }

    @Test
    public void catches_up_with_all_events_then_goes_live() throws Exception {
        List<Event> appended = appendEvents("x", 25);
        Subscription subscription = subscription(handled::add).batchSize(10).build();
        assertEquals(Subscription.State.IDLE, subscription.getState());

        startInBackground(subscription);
        await("subscription is live", () -> subscription.getState() == Subscription.State.LIVE);

        assertEquals(ids(appended), ids(handled));
        assertEquals(appended.get(24).id(), tracker.lastProcessedId(name()));
        assertEquals(appended.get(24).id(), subscription.getCursor());

        master.requestShutdown();
        background.join(10_000);
        assertEquals(Subscription.State.STOPPED, subscription.getState());
        assertThat(master.activeSubscriptions(), empty());
    }

    @Test
    public void checkpoint_advances_after_every_batch() throws Exception {
        List<Event> appended = appendEvents("x", 25);
        List<Long> checkpointsSeen = new ArrayList<>();
        Subscription subscription = subscription(event -> {
            checkpointsSeen.add(tracker.lastProcessedId(name()));
            handled.add(event);
        }).batchSize(10).build();

        startInBackground(subscription);
        await("all events handled", () -> handled.size() == 25);

        assertEquals(0L, (long) checkpointsSeen.get(9));
        assertEquals(appended.get(9).id(), (long) checkpointsSeen.get(10));
        assertEquals(appended.get(19).id(), (long) checkpointsSeen.get(24));
    }

    @Test
    public void continues_after_stored_checkpoint() throws Exception {
        List<Event> appended = appendEvents("x", 5);
        tracker.advance(name(), appended.get(2).id());

        startInBackground(subscription(handled::add).build());
        await("remaining events handled", () -> handled.size() == 2);

        assertEquals(ids(appended.subList(3, 5)), ids(handled));
    }

    @Test
    public void push_notification_wakes_live_subscription() throws Exception {
        Subscription subscription = subscription(handled::add)
                .callbackInterval(Duration.ofMinutes(5))
                .waitStrategy(new PushAssistedWaitStrategy(store.getNotifier()))
                .build();
        startInBackground(subscription);
        await("subscription is live", () -> subscription.getState() == Subscription.State.LIVE);

        List<Event> appended = appendEvents("x", 1);
        await("event delivered long before polling interval", () -> handled.size() == 1, Duration.ofSeconds(5));
        assertEquals(ids(appended), ids(handled));

        master.requestShutdown();
        background.join(5_000);
        assertFalse(background.isAlive());
    }

    @Test
    public void polling_picks_up_new_events() throws Exception {
        Subscription subscription = subscription(handled::add)
                .callbackInterval(Duration.ofMillis(50))
                .build();
        startInBackground(subscription);
        await("subscription is live", () -> subscription.getState() == Subscription.State.LIVE);

        appendEvents("x", 3);
        await("events polled", () -> handled.size() == 3);
    }

    @Test
    public void shutdown_lets_batch_in_flight_finish() throws Exception {
        List<Event> appended = appendEvents("x", 10);
        Subscription subscription = subscription(event -> {
            handled.add(event);
            if (handled.size() == 2) {
                master.requestShutdown();
            }
        }).batchSize(5).build();

        subscription.start();

        assertEquals(ids(appended.subList(0, 5)), ids(handled));
        assertEquals(appended.get(4).id(), tracker.lastProcessedId(name()));
        assertEquals(Subscription.State.STOPPED, subscription.getState());
    }

    @Test
    public void failure_checkpoints_events_handled_before_it() throws Exception {
        List<Event> appended = appendEvents("x", 5);
        Subscription subscription = subscription(event -> {
            if (event.id() == appended.get(2).id()) {
                throw new IllegalArgumentException("cannot handle " + event.id());
            }
            handled.add(event);
        }).build();

        try {
            subscription.start();
            fail("should have failed");
        } catch (EventProcessingException e) {
            assertEquals(appended.get(2).uuid(), e.getEvent().uuid());
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
        assertEquals(appended.get(1).id(), tracker.lastProcessedId(name()));
        assertEquals(Subscription.State.STOPPED, subscription.getState());
        assertThat(master.activeSubscriptions(), empty());

        // next subscription starts with the failed event
        handled.clear();
        startInBackground(subscription(handled::add).build());
        await("failed event redelivered", () -> handled.size() == 3);
        assertEquals(ids(appended.subList(2, 5)), ids(handled));
    }

    @Test
    public void delivers_only_subscribed_types() throws Exception {
        appendEvents("x", 3);
        List<Event> wanted = appendEvents("y", 2);
        appendEvents("z", 3);

        startInBackground(subscription(handled::add).eventTypes(Collections.singleton("y")).build());
        await("wanted events handled", () -> handled.size() == 2);
        Thread.sleep(50);

        assertEquals(ids(wanted), ids(handled));
    }

    @Test
    public void subscription_cannot_be_started_twice() {
        master.requestShutdown();
        Subscription subscription = subscription(handled::add).build();
        subscription.start();
        try {
            subscription.start();
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertEquals(Subscription.State.STOPPED, subscription.getState());
        }
    }

    @Test
    public void processor_runs_once_within_master() {
        master.subscriptionStarted(name());
        try {
            subscription(handled::add).build().start();
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertThat(master.activeSubscriptions(), contains(name()));
        }
    }

    @Test
    public void invalid_batch_size_is_rejected() {
        try {
            subscription(handled::add).batchSize(0);
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertEquals("Batch size must be positive, was 0", e.getMessage());
        }
    }
}
