package io.github.goodees.esp.core.store;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process notification channel, fired by event stores after every committed append. Listeners must not block,
 * they are called on the appending thread.
 */
public class NewEventNotifier {
    private static final Logger logger = LoggerFactory.getLogger(NewEventNotifier.class);

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    @FunctionalInterface
    public interface Listener {
        /**
         * Events up to given id were committed.
         * @param latestId the highest id of the append
         */
        void eventsAppended(long latestId);
    }

    /**
     * Handle for removing registered listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public Registration register(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void eventsAppended(long latestId) {
        for (Listener listener : listeners) {
            try {
                listener.eventsAppended(latestId);
            } catch (RuntimeException e) {
                // the append is committed already, failing listener would only confuse the writer
                logger.warn("Listener {} failed on notification of event {}", listener, latestId, e);
            }
        }
    }

    int listenerCount() {
        return listeners.size();
    }
}
