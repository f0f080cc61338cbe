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

/**
 * In-memory instance of an entity: its state and revision. Instances are only accessed from within tasks of the
 * dispatcher, therefore by single thread at time.
 *
 * @param <S> type of state
 */
public final class EntityInstance<S> {
    private final String entityId;
    private final String persistenceId;
    private volatile EntityLifecycle lifecycle = EntityLifecycle.UNLOADED;
    private volatile S state;
    private volatile long revision;

    EntityInstance(String entityId, String persistenceId) {
        this.entityId = entityId;
        this.persistenceId = persistenceId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getPersistenceId() {
        return persistenceId;
    }

    public EntityLifecycle getLifecycle() {
        return lifecycle;
    }

    public S getState() {
        return state;
    }

    public long getRevision() {
        return revision;
    }

    void startLoading() {
        this.lifecycle = EntityLifecycle.LOADING;
    }

    void loadingFailed() {
        this.lifecycle = EntityLifecycle.UNLOADED;
        this.state = null;
        this.revision = 0;
    }

    void recovered(S state, long revision) {
        if (lifecycle != EntityLifecycle.LOADING) {
            throw new IllegalStateException("Entity " + persistenceId + " is not loading, but " + lifecycle);
        }
        this.state = state;
        this.revision = revision;
        this.lifecycle = EntityLifecycle.READY;
    }

    void advance(S state, long revision) {
        if (lifecycle != EntityLifecycle.READY) {
            throw new IllegalStateException("Entity " + persistenceId + " is not ready, but " + lifecycle);
        }
        if (revision < this.revision) {
            throw new IllegalStateException("Entity " + persistenceId + " cannot go back from revision "
                    + this.revision + " to " + revision);
        }
        this.state = state;
        this.revision = revision;
    }

    @Override
    public String toString() {
        return "EntityInstance{" + persistenceId + "@" + revision + ", " + lifecycle + '}';
    }
}
