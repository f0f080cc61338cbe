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

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Read access to the event log.
 */
public interface EventLog {
    /**
     * Read all events of an entity that happened after specified revision.
     * @param persistenceId persistence id of the entity
     * @param afterRevision events that happened after this revision. 0 stands for uninitialized, will therefore
     *                      return entire history
     * @return accessor for the events in order they appeared in history
     * @throws EventStoreException when the log cannot be read
     */
    StoredEvents readEvents(String persistenceId, long afterRevision) throws EventStoreException;

    /**
     * The revision of the latest event of an entity.
     * @param persistenceId persistence id of the entity
     * @return revision of latest event, 0 if there are none
     * @throws EventStoreException when the log cannot be read
     */
    long currentRevision(String persistenceId) throws EventStoreException;

    /**
     * Compare the revision of an in-memory entity with the state known in the log. This is used by the runtime to
     * prevent passing commands to an entity that is stale.
     * @param persistenceId persistence id of the entity
     * @param revision revision of in-memory state
     * @return true if no newer events are known for the entity
     * @throws EventStoreException when the log cannot be read
     */
    default boolean confirmsRevisionIsCurrent(String persistenceId, long revision) throws EventStoreException {
        return currentRevision(persistenceId) <= revision;
    }

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a
     * JDBC ResultSet. This also means that only one of methods foreach and reduce may be called on single instance,
     * and only once.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super StoredEvent> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super StoredEvent, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
