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

import io.github.goodees.eventsourced.store.SnapshotMetadata;
import io.github.goodees.eventsourced.store.SnapshotStore;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Snapshot store keeping state objects as they are, without serialization. Only safe for immutable states.
 */
public class InMemorySnapshotStore extends SnapshotStore<Object> {
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    @Override
    protected Object deserializeSnapshot(SnapshotRecord snapshotRecord) {
        return snapshotRecord.getPayload();
    }

    @Override
    protected SnapshotRecord serializeSnapshot(String persistenceId, long revision, Object state) {
        return new SnapshotRecord(new SnapshotMetadata.Default(persistenceId, Instant.now(), 1, revision), state);
    }

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String persistenceId) {
        return snapshotRecords.get(persistenceId);
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.merge(snapshotRecord.getHeader().persistenceId(), snapshotRecord,
            (existing, updated) -> existing.getHeader().revision() >= updated.getHeader().revision()
                    ? existing : updated);
    }
}
