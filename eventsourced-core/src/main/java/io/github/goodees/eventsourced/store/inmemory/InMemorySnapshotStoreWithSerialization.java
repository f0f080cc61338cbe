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

import io.github.goodees.eventsourced.store.Serialization;
import io.github.goodees.eventsourced.store.SnapshotMetadata;
import io.github.goodees.eventsourced.store.SnapshotStoreWithSerialization;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Snapshot store keeping serialized snapshots in memory. Exercises the serialization the same way a durable store
 * would.
 */
public class InMemorySnapshotStoreWithSerialization<T> extends SnapshotStoreWithSerialization<T> {
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    public InMemorySnapshotStoreWithSerialization(Serialization<T> serialization) {
        super(serialization);
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

    public Optional<String> getSerializedSnapshot(String persistenceId) {
        return Optional.ofNullable(retrieveSnapshotRecord(persistenceId)).map(SnapshotRecord::getPayload);
    }

    public OptionalInt getSerializedSnapshotVersion(String persistenceId) {
        SnapshotRecord record = retrieveSnapshotRecord(persistenceId);
        if (record != null) {
            return OptionalInt.of(record.getHeader().payloadVersion());
        } else {
            return OptionalInt.empty();
        }
    }

    /**
     * Put a serialized snapshot directly into the store, e. g. one written by older version of the application.
     * @param persistenceId persistence id of the entity
     * @param revision revision of the snapshot
     * @param payloadVersion version of serialization
     * @param payload serialized state
     */
    public void storeSnapshot(String persistenceId, long revision, int payloadVersion, String payload) {
        storeSnapshotRecord(new SnapshotRecord(new SnapshotMetadata.Default(persistenceId, Instant.now(),
            payloadVersion, revision), payload));
    }
}
