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

import io.github.goodees.eventsourced.Event;

import java.util.List;

/**
 * Durable append-only log of events.
 * <p>Appending constitutes a separate non-distributed transaction: either all of the events are stored, or none.</p>
 * <p>Event store needs also guarantee the consistency of event log across processes, by rejecting appends that do not
 * continue from the current revision of the entity.</p>
 */
public interface EventStore {

    /**
     * Persist events synchronously. The runtime advances the entity state only after this method completes without
     * exception.
     * @param persistenceId persistence id of the entity
     * @param expectedRevision revision the entity is known to be at. Events are stored with revisions following it.
     * @param events events to store, in order
     * @return stored events with assigned revisions
     * @throws EventStoreException when storing fails, or with {@link EventStoreException.Fault#OPTIMISTIC_LOCK} if the
     *         log contains events after expected revision
     */
    List<StoredEvent> append(String persistenceId, long expectedRevision, List<? extends Event<?>> events)
            throws EventStoreException;
}
