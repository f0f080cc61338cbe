package io.github.goodees.eventsourced.store;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for snapshot stores. Snapshot store is an optimization of recovery, therefore snapshot that cannot be
 * read or written is logged and ignored: entity is then recovered from entire event log.
 *
 * <p>A store keeps only the latest snapshot of an entity, and never replaces it with snapshot of a lower revision.</p>
 * @param <P> the type of payload. Most likely String.
 */
public abstract class SnapshotStore<P> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    public static class Snapshot {
        private final long revision;
        private final Object state;

        Snapshot(long revision, Object state) {
            this.revision = revision;
            this.state = state;
        }

        public long getRevision() {
            return revision;
        }

        public Object getState() {
            return state;
        }

        @Override
        public String toString() {
            return "Snapshot{revision=" + revision + ", state=" + state + '}';
        }
    }

    /**
     * Read latest snapshot of an entity.
     * @param persistenceId persistence id of the entity
     * @return the snapshot, or empty if there is none or it could not be deserialized
     */
    public Optional<Snapshot> readSnapshot(String persistenceId) {
        SnapshotRecord snapshotRecord = retrieveSnapshotRecord(persistenceId);
        if (snapshotRecord != null) {
            try {
                Object state = deserializeSnapshot(snapshotRecord);
                if (state != null) {
                    return Optional.of(new Snapshot(snapshotRecord.header.revision(), state));
                }
            } catch (Exception e) {
                logger.error("Failure during deserialization of snapshot of {}", persistenceId, e);
            }
        }
        return Optional.empty();
    }

    /**
     * Serialize state of an entity and store it.
     *
     * @param persistenceId persistence id of the entity
     * @param revision revision of the state
     * @param state state to be stored
     * @return true if the state was serialized and stored
     * @see #serializeSnapshot(String, long, Object)
     * @see #storeSnapshotRecord(SnapshotStore.SnapshotRecord)
     */
    public boolean store(String persistenceId, long revision, Object state) {
        try {
            SnapshotRecord existing = retrieveSnapshotRecord(persistenceId);
            if (existing != null && existing.header.revision() >= revision) {
                logger.debug("Snapshot of {} at revision {} is not newer than stored revision {}", persistenceId,
                    revision, existing.header.revision());
                return false;
            }
            SnapshotRecord snapshotRecord = serializeSnapshot(persistenceId, revision, state);
            if (snapshotRecord != null) {
                storeSnapshotRecord(snapshotRecord);
                return true;
            }
        } catch (Exception e) {
            logger.error("Creating snapshot of entity {} failed", persistenceId, e);
        }
        return false;
    }

    /**
     * Revision of latest stored snapshot.
     * @param persistenceId persistence id of the entity
     * @return revision of the snapshot, 0 if there is none
     */
    public long getSnapshotRevision(String persistenceId) {
        SnapshotRecord record = retrieveSnapshotRecord(persistenceId);
        return record == null ? 0 : record.getHeader().revision();
    }

    /**
     * Transform stored payload into entity state. Implementation will decide on header value, most
     * notably {@link SnapshotMetadata#payloadVersion()} on how to deserialize it.
     *
     * @param snapshotRecord the retrieved snapshot record
     * @return deserialized state
     */
    protected abstract Object deserializeSnapshot(SnapshotRecord snapshotRecord);

    /**
     * Serialize a state of an entity.
     *
     * @param persistenceId the identity of the entity
     * @param revision      revision of the entity
     * @param state         the state
     * @return header data and payload of the snapshot, null if the state is not supported
     */
    protected abstract SnapshotRecord serializeSnapshot(String persistenceId, long revision, Object state);

    /**
     * Retrieve most recent snapshot for an entity from store.
     *
     * @param persistenceId the identity of an entity
     * @return header and payload of the snapshot
     */
    protected abstract SnapshotRecord retrieveSnapshotRecord(String persistenceId);

    /**
     * Actually commit the snapshot record into underlying storage.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * The record about a snapshot.
     */
    protected class SnapshotRecord {
        protected final SnapshotMetadata header;
        protected final P payload;

        /**
         * Create new record
         *
         * @param header  header
         * @param payload payload
         */
        public SnapshotRecord(SnapshotMetadata header, P payload) {
            this.header = header;
            this.payload = payload;
        }

        public SnapshotMetadata getHeader() {
            return header;
        }

        public P getPayload() {
            return payload;
        }
    }

}
