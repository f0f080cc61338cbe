package io.github.goodees.eventsourced;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-entity configuration. Only {@code entityType} and {@code snapshotEvery} are interpreted by the runtime, the
 * remaining options belong to the schema and serialization collaborators and are passed through unmodified.
 */
public final class EntityConfiguration {
    public static final int DEFAULT_SNAPSHOT_EVERY = 100;

    private final String entityType;
    private final int snapshotEvery;
    private final List<String> includeDirs;
    private final boolean serializeAllowPrimitives;
    private final boolean serializeFallbackToJson;

    private EntityConfiguration(Builder builder) {
        this.entityType = builder.entityType;
        this.snapshotEvery = builder.snapshotEvery;
        this.includeDirs = Collections.unmodifiableList(new ArrayList<>(builder.includeDirs));
        this.serializeAllowPrimitives = builder.serializeAllowPrimitives;
        this.serializeFallbackToJson = builder.serializeFallbackToJson;
    }

    public static Builder builder(String entityType) {
        return new Builder(entityType);
    }

    /**
     * Persistence namespace of the entity. Prefixed onto every entity id when storing events and snapshots.
     * @return entity type
     */
    public String getEntityType() {
        return entityType;
    }

    /**
     * Number of events between snapshots.
     * @return snapshot cadence, always positive
     */
    public int getSnapshotEvery() {
        return snapshotEvery;
    }

    public List<String> getIncludeDirs() {
        return includeDirs;
    }

    public boolean isSerializeAllowPrimitives() {
        return serializeAllowPrimitives;
    }

    public boolean isSerializeFallbackToJson() {
        return serializeFallbackToJson;
    }

    /**
     * Key under which events and snapshots of an entity instance are stored.
     * @param entityId the identity of the entity
     * @return entity id prefixed with entity type
     */
    public String persistenceId(String entityId) {
        return entityType + "/" + entityId;
    }

    /**
     * Decide whether moving from one revision to another passes a snapshot point, i. e. a multiple of
     * {@link #getSnapshotEvery()}.
     * @param previousRevision revision before the command
     * @param revision revision after the command
     * @return true if a snapshot is due
     */
    public boolean isSnapshotDue(long previousRevision, long revision) {
        return revision > previousRevision && revision / snapshotEvery > previousRevision / snapshotEvery;
    }

    @Override
    public String toString() {
        return "EntityConfiguration{entityType=" + entityType + ", snapshotEvery=" + snapshotEvery
                + ", includeDirs=" + includeDirs + ", serializeAllowPrimitives=" + serializeAllowPrimitives
                + ", serializeFallbackToJson=" + serializeFallbackToJson + '}';
    }

    public static class Builder {
        private final String entityType;
        private int snapshotEvery = DEFAULT_SNAPSHOT_EVERY;
        private List<String> includeDirs = Collections.singletonList("./");
        private boolean serializeAllowPrimitives = true;
        private boolean serializeFallbackToJson = true;

        Builder(String entityType) {
            this.entityType = entityType;
        }

        public Builder snapshotEvery(int snapshotEvery) {
            this.snapshotEvery = snapshotEvery;
            return this;
        }

        public Builder includeDirs(String... includeDirs) {
            this.includeDirs = Arrays.asList(includeDirs);
            return this;
        }

        public Builder serializeAllowPrimitives(boolean serializeAllowPrimitives) {
            this.serializeAllowPrimitives = serializeAllowPrimitives;
            return this;
        }

        public Builder serializeFallbackToJson(boolean serializeFallbackToJson) {
            this.serializeFallbackToJson = serializeFallbackToJson;
            return this;
        }

        /**
         * Validate and build the configuration.
         * @return the configuration
         * @throws EntityConfigurationException when entity type is blank or snapshot cadence is not positive
         */
        public EntityConfiguration build() {
            if (entityType == null || entityType.trim().isEmpty()) {
                throw new EntityConfigurationException("Entity type must be specified");
            }
            if (snapshotEvery <= 0) {
                throw new EntityConfigurationException("snapshotEvery of entity " + entityType
                        + " must be positive, was " + snapshotEvery);
            }
            Objects.requireNonNull(includeDirs, "Include dirs must not be null");
            return new EntityConfiguration(this);
        }
    }
}
