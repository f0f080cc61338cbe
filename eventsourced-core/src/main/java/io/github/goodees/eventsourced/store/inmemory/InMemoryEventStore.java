package io.github.goodees.eventsourced.store.inmemory;

/*-
 * #%L
 * eventsourced-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
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

import io.github.goodees.eventsourced.Event;
import io.github.goodees.eventsourced.store.EventLog;
import io.github.goodees.eventsourced.store.EventStore;
import io.github.goodees.eventsourced.store.EventStoreException;
import io.github.goodees.eventsourced.store.StoredEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping the events in memory. Suitable for tests and prototypes.
 */
public class InMemoryEventStore implements EventStore, EventLog {
    private final ConcurrentMap<String, List<StoredEvent>> storage = new ConcurrentHashMap<>();

    private static long lastRevisionOf(List<StoredEvent> entityLog) {
        return entityLog.isEmpty() ? 0 : entityLog.get(entityLog.size() - 1).getRevision();
    }

    @Override
    public List<StoredEvent> append(String persistenceId, long expectedRevision, List<? extends Event<?>> events)
            throws EventStoreException {
        List<StoredEvent> entityLog = entityLog(persistenceId);
        synchronized (entityLog) {
            long lastRevision = lastRevisionOf(entityLog);
            if (lastRevision != expectedRevision) {
                throw EventStoreException.optimisticLock(persistenceId, expectedRevision, lastRevision);
            }
            Instant now = Instant.now();
            List<StoredEvent> stored = new ArrayList<>(events.size());
            long revision = expectedRevision;
            for (Event<?> event : events) {
                stored.add(new StoredEvent(persistenceId, ++revision, now, event));
            }
            entityLog.addAll(stored);
            return Collections.unmodifiableList(stored);
        }
    }

    @Override
    public long currentRevision(String persistenceId) {
        List<StoredEvent> entityLog = entityLog(persistenceId);
        synchronized (entityLog) {
            return lastRevisionOf(entityLog);
        }
    }

    private List<StoredEvent> entityLog(String persistenceId) {
        return storage.computeIfAbsent(persistenceId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public StoredEvents readEvents(String persistenceId, long afterRevision) {
        return new StoredEvents() {
            final List<StoredEvent> filteredEvents;
            boolean stop = false;

            {
                List<StoredEvent> events = entityLog(persistenceId);
                //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
                synchronized (events) {
                    filteredEvents = events.stream().filter(e -> e.getRevision() > afterRevision).collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super StoredEvent> consumer) {
                for (StoredEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super StoredEvent, R> reducer) {
                R result = initial;
                for (StoredEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
