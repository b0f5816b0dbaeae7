package io.github.goodees.esp.core.tracking;

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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public abstract class AbstractCheckpointTrackerTest {
    @Rule
    public TestName testName = new TestName();

    protected abstract CheckpointTracker createTracker(boolean autoCreate);

    protected String name() {
        return testName.getMethodName();
    }

    @Test
    public void new_processor_starts_at_zero() {
        CheckpointTracker tracker = createTracker(true);

        assertEquals(0, tracker.lastProcessedId(name()));
        assertThat(tracker.trackedProcessors(), hasItem(name()));
    }

    @Test
    public void advance_moves_checkpoint() {
        CheckpointTracker tracker = createTracker(true);
        tracker.lastProcessedId(name());
        tracker.advance(name(), 5);
        tracker.advance(name(), 8);

        assertEquals(8, tracker.lastProcessedId(name()));
    }

    @Test
    public void advancing_to_current_checkpoint_is_accepted() {
        CheckpointTracker tracker = createTracker(true);
        tracker.advance(name(), 5);
        tracker.advance(name(), 5);

        assertEquals(5, tracker.lastProcessedId(name()));
    }

    @Test
    public void checkpoint_cannot_move_backwards() {
        CheckpointTracker tracker = createTracker(true);
        tracker.advance(name(), 5);
        try {
            tracker.advance(name(), 4);
            fail("should have failed");
        } catch (CheckpointRegressionException e) {
            assertEquals(name(), e.getProcessorName());
            assertEquals(5, e.getStoredId());
            assertEquals(4, e.getAttemptedId());
        }
        assertEquals(5, tracker.lastProcessedId(name()));
    }

    @Test
    public void advance_creates_missing_checkpoint() {
        CheckpointTracker tracker = createTracker(true);
        tracker.advance(name(), 3);

        assertEquals(3, tracker.lastProcessedId(name()));
    }

    @Test
    public void missing_checkpoint_is_not_created_when_auto_create_is_disabled() {
        CheckpointTracker tracker = createTracker(false);

        assertEquals(0, tracker.lastProcessedId(name()));
        assertThat(tracker.trackedProcessors(), not(hasItem(name())));
        try {
            tracker.advance(name(), 1);
            fail("should have failed");
        } catch (CheckpointRegressionException e) {
            fail("missing checkpoint is not a regression");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void reset_provisions_checkpoint_when_auto_create_is_disabled() {
        CheckpointTracker tracker = createTracker(false);
        tracker.reset(name());
        tracker.advance(name(), 2);

        assertEquals(2, tracker.lastProcessedId(name()));
    }

    @Test
    public void reset_moves_checkpoint_to_start() {
        CheckpointTracker tracker = createTracker(true);
        tracker.advance(name(), 42);
        tracker.reset(name());

        assertEquals(0, tracker.lastProcessedId(name()));
        tracker.advance(name(), 1);
        assertEquals(1, tracker.lastProcessedId(name()));
    }

    @Test
    public void tracked_processors_are_listed_by_name() {
        CheckpointTracker tracker = createTracker(true);
        tracker.lastProcessedId(name() + "-b");
        tracker.advance(name() + "-a", 1);

        assertThat(tracker.trackedProcessors(), contains(name() + "-a", name() + "-b"));
    }
}
