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

import io.github.goodees.eventsourced.store.EventLog;
import io.github.goodees.eventsourced.store.EventStore;
import io.github.goodees.eventsourced.store.SnapshotStore;
import io.github.goodees.eventsourced.store.inmemory.InMemoryEventStore;
import io.github.goodees.eventsourced.store.inmemory.InMemorySnapshotStore;

import java.util.Objects;

/**
 * Store collaborators of a runtime.
 */
public interface Persistence {
    /**
     * Event log of this runtime. EventLog must be consistent with EventStore used for this runtime, so it can always
     * return consistent set of events for an entity past specific revision. It is used for recovery of an entity.
     *
     * @return event log of this runtime
     */
    EventLog getEventLog();

    EventStore getEventStore();

    /**
     * The SnapshotStore of this runtime. Snapshot store will be called to store a snapshot of an entity whenever
     * its revision crosses multiple of configured snapshot cadence.
     *
     * @return SnapshotStore of this runtime
     */
    SnapshotStore<?> getSnapshotStore();

    static <T extends EventStore & EventLog> Persistence of(T eventStore, SnapshotStore<?> snapshotStore) {
        Objects.requireNonNull(eventStore, "Event store must be specified");
        Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        return new Persistence() {
            @Override
            public EventLog getEventLog() {
                return eventStore;
            }

            @Override
            public EventStore getEventStore() {
                return eventStore;
            }

            @Override
            public SnapshotStore<?> getSnapshotStore() {
                return snapshotStore;
            }
        };
    }

    /**
     * Fresh in-memory event and snapshot store.
     * @return new persistence
     */
    static Persistence inMemory() {
        return of(new InMemoryEventStore(), new InMemorySnapshotStore());
    }
}
