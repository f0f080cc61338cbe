package io.github.goodees.eventsourced.runtime;

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
import io.github.goodees.eventsourced.store.EventStoreException;
import io.github.goodees.eventsourced.store.StoredEvent;
import io.github.goodees.eventsourced.store.inmemory.InMemoryEventStore;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class MockEventStore extends InMemoryEventStore {
    private final AtomicReference<EventStoreException> exception = new AtomicReference<>();
    private final AtomicInteger reads = new AtomicInteger();

    @Override
    public List<StoredEvent> append(String persistenceId, long expectedRevision, List<? extends Event<?>> events)
            throws EventStoreException {
        EventStoreException ex = exception.getAndSet(null);
        if (ex != null) {
            throw ex;
        }
        return super.append(persistenceId, expectedRevision, events);
    }

    @Override
    public StoredEvents readEvents(String persistenceId, long afterRevision) {
        reads.incrementAndGet();
        return super.readEvents(persistenceId, afterRevision);
    }

    void throwExceptionOnce(EventStoreException ex) {
        exception.set(ex);
    }

    int getReads() {
        return reads.get();
    }
}
