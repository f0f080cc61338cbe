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

import java.time.Instant;

/**
 * Header data of a stored snapshot.
 */
public interface SnapshotMetadata {
    /**
     * Persistence id of the entity.
     * @return identity
     */
    String persistenceId();

    /**
     * Timestamp of the snapshot
     * @return the time when snapshot was created
     */
    Instant getTimestamp();

    /**
     * Payload version
     * @return version of serialization used for the payload
     */
    int payloadVersion();

    /**
     * Entity revision
     * @return the revision entity was at when this snapshot was generated
     */
    long revision();

    class Default implements SnapshotMetadata {

        private final String persistenceId;
        private final Instant timestamp;
        private final int payloadVersion;
        private final long revision;

        public Default(String persistenceId, Instant timestamp, int payloadVersion, long revision) {
            this.persistenceId = persistenceId;
            this.timestamp = timestamp;
            this.payloadVersion = payloadVersion;
            this.revision = revision;
        }

        @Override
        public String persistenceId() {
            return persistenceId;
        }

        @Override
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public int payloadVersion() {
            return payloadVersion;
        }

        @Override
        public long revision() {
            return revision;
        }
    }
}
