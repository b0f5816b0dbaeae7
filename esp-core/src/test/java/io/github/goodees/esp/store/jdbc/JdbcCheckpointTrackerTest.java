package io.github.goodees.esp.store.jdbc;

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
import io.github.goodees.esp.core.tracking.AbstractCheckpointTrackerTest;
import io.github.goodees.esp.core.tracking.CheckpointTracker;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;

public class JdbcCheckpointTrackerTest extends AbstractCheckpointTrackerTest {

    @BeforeClass
    public static void initDb() throws SQLException {
        JdbcTest.ensureDatabase();
    }

    @Before
    public void cleanDatabase() {
        JdbcTest.cleanDatabase();
    }

    @Override
    protected CheckpointTracker createTracker(boolean autoCreate) {
        return new JdbcCheckpointTracker(JdbcTest.ds, JdbcTest.defaultSchema(), autoCreate);
    }

    private int count(String sql, Object... params) {
        return JdbcTest.template.queryForObject(sql, Integer.class, params);
    }

    @Test
    public void advance_is_stored_in_tracker_table() {
        CheckpointTracker tracker = createTracker(true);
        tracker.advance(name(), 17);

        assertEquals(17, count("select last_processed_event_id from event_processor_trackers where name = ?",
            name()));
    }

    @Test
    public void configuration_selects_tracker_table() {
        EspConfiguration configuration = EspConfiguration.builder().trackerTableName("event_processor_trackers")
                .autoCreateProcessorTracker(false).build();
        CheckpointTracker tracker = new JdbcCheckpointTracker(JdbcTest.ds, configuration);

        assertEquals(0, tracker.lastProcessedId(name()));
        assertEquals(0, count("select count(*) from event_processor_trackers where name = ?", name()));
    }

    @Test
    public void concurrent_initialization_creates_single_row() throws Exception {
        int threads = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                CheckpointTracker tracker = createTracker(true);
                Callable<Long> init = () -> {
                    start.await();
                    return tracker.lastProcessedId(name());
                };
                results.add(executor.submit(init));
            }
            start.countDown();
            for (Future<Long> result : results) {
                assertEquals(0L, (long) result.get(30, TimeUnit.SECONDS));
            }
            assertEquals(1, count("select count(*) from event_processor_trackers where name = ?", name()));
        } finally {
            executor.shutdownNow();
        }
    }
}
