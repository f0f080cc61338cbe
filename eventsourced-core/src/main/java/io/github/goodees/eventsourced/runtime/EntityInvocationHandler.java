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

import io.github.goodees.eventsourced.CommandResult;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.EntityConfiguration;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.Event;
import io.github.goodees.eventsourced.EventType;
import io.github.goodees.eventsourced.engine.CommandProcessor;
import io.github.goodees.eventsourced.store.EventLog;
import io.github.goodees.eventsourced.store.EventStoreException;
import io.github.goodees.eventsourced.store.SnapshotStore;
import io.github.goodees.eventsourced.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common logic of executing commands against persistent entities. It instantiates the entity instances, recovers
 * their state, commits their events and requests their snapshots. In order for recovery to work, the handler needs
 * {@link EventLog} to see the past events, and {@link SnapshotStore} for the snapshots.
 * <p>This class does not prescribe any specific execution and dispatching methods. Caller must guarantee that for
 * given entity id at most one method is executing at time, {@link EntityRuntime} does so with a
 * {@link io.github.goodees.eventsourced.dispatch.Dispatcher}.</p>
 * <h2>Lifecycles</h2>
 * {@link #handleCommand(String, String, Object)} describes the lifecycle of single command execution.
 * {@link #lookup(String)} describes the process of obtaining an initialized entity.
 *
 * @param <S> the type of state of the entity
 */
public class EntityInvocationHandler<S> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EntityDescriptor<S> descriptor;
    private final CommandProcessor<S> processor;
    private final Persistence persistence;
    private final WorkingMemory<S> memory;
    private final SnapshotWriter snapshotWriter;

    public EntityInvocationHandler(EntityDescriptor<S> descriptor, Persistence persistence, WorkingMemory<S> memory,
            SnapshotWriter snapshotWriter) {
        this.descriptor = Objects.requireNonNull(descriptor, "Descriptor must be specified");
        this.processor = new CommandProcessor<>(descriptor);
        this.persistence = Objects.requireNonNull(persistence, "Persistence must be specified");
        this.memory = Objects.requireNonNull(memory, "Working memory must be specified");
        this.snapshotWriter = Objects.requireNonNull(snapshotWriter, "Snapshot writer must be specified");
    }

    /**
     * Execute a command. When command is due for invocation, the handler will perform following steps:
     * <ol>
     * <li>Obtain an up-to-date instance, as described by {@link #lookup(String)}</li>
     * <li>Pass the command to the {@link CommandProcessor}, which invokes the command handler and folds the events
     * it emitted</li>
     * <li>If the command failed, or emitted no events, the result is returned and nothing changes</li>
     * <li>Otherwise the events are appended to the event store, expecting the instance's revision. Only after the
     * store accepts them the instance adopts the new state and revision. If store fails, the instance is removed from
     * working memory, so it would be recovered into fresh state on next command</li>
     * <li>If the revision crossed a snapshot point, snapshot of the new state is requested</li>
     * </ol>
     *
     * @param entityId the identity of the entity
     * @param commandName the command
     * @param payload payload of the command
     * @return result of the command
     * @throws EventStoreException if recovery or storing of events fails
     * @throws DispatchException if the command could not be dispatched
     */
    public CommandResult<S, Object> handleCommand(String entityId, String commandName, Object payload)
            throws EventStoreException {
        EntityInstance<S> instance = lookup(entityId);
        CommandResult<S, Object> result = processor.process(entityId, instance.getState(), instance.getRevision(),
            commandName, payload);
        if (result.isSuccessful() && !result.getEvents().isEmpty()) {
            commit(instance, result.getEvents(), result.getState());
        }
        return result;
    }

    /**
     * Apply single event directly, without a command. The event is persisted the same way events emitted by a command
     * are.
     * @param entityId the identity of the entity
     * @param eventName name of the event
     * @param payload payload of the event
     * @return new state of the entity
     * @throws EventStoreException if recovery or storing of the event fails
     * @throws DispatchException if there is no handler for the event, or it fails
     */
    public S handleEvent(String entityId, String eventName, Object payload) throws EventStoreException {
        EntityInstance<S> instance = lookup(entityId);
        EntityDescriptor.EventBinding<S, ?> binding = descriptor.eventHandler(eventName)
                .orElseThrow(() -> DispatchException.unknownEvent(descriptor.getEntityType(), eventName));
        Event<?> event = createEvent(binding.getType(), payload);
        S newState = processor.applyEvent(instance.getState(), event);
        commit(instance, Collections.singletonList(event), newState);
        return descriptor.readOnlyView(newState);
    }

    private <P> Event<P> createEvent(EventType<P> type, Object payload) {
        if (!type.getPayloadType().isInstance(payload)) {
            throw DispatchException.payloadMismatch(descriptor.getEntityType(), type.getName(), type.getPayloadType(),
                payload);
        }
        return type.create(type.getPayloadType().cast(payload));
    }

    /**
     * Current state of an entity.
     * @param entityId the identity of the entity
     * @return read-only view of the state
     * @throws EventStoreException if recovery fails
     */
    public S getState(String entityId) throws EventStoreException {
        return descriptor.readOnlyView(lookup(entityId).getState());
    }

    /**
     * Remove entity instance from working memory. Next command will recover it from the store.
     * @param entityId the identity of the entity
     */
    public void passivate(String entityId) {
        memory.remove(entityId);
        logger.debug("Passivated {} {}", descriptor.getEntityType(), entityId);
    }

    public boolean isActive(String entityId) {
        return memory.contains(entityId);
    }

    private void commit(EntityInstance<S> instance, List<Event<?>> events, S newState) throws EventStoreException {
        long previousRevision = instance.getRevision();
        List<StoredEvent> stored;
        try {
            stored = persistence.getEventStore().append(instance.getPersistenceId(), previousRevision, events);
        } catch (EventStoreException | RuntimeException e) {
            logger.warn("Storing events of {} after revision {} failed. Instance is evicted",
                instance.getPersistenceId(), previousRevision, e);
            passivate(instance.getEntityId());
            throw e;
        }
        long revision = previousRevision + events.size();
        if (stored.size() != events.size() || stored.get(stored.size() - 1).getRevision() != revision) {
            passivate(instance.getEntityId());
            throw EventStoreException.nonMonotonic(instance.getPersistenceId(), revision,
                stored.isEmpty() ? previousRevision : stored.get(stored.size() - 1).getRevision());
        }
        instance.advance(newState, revision);
        EntityConfiguration configuration = descriptor.getConfiguration();
        if (configuration.isSnapshotDue(previousRevision, revision)) {
            snapshotWriter.request(instance.getPersistenceId(), revision, newState);
        }
    }

    /**
     * Common logic for obtaining entity instance from the working memory.
     * <h1>Detailed flow of instantiation of an entity:</h1>
     * <ol>
     * <li>If the working memory has an instance that reflects latest revision in the event log, it is used</li>
     * <li>Otherwise, if snapshot exists in {@link Persistence#getSnapshotStore() SnapshotStore} and holds state of
     * expected type, it is used as starting point. If not, the entity starts from its initial state.</li>
     * <li>All events from the history past the starting revision are applied, in order they were created</li>
     * </ol>
     * After these steps the instance is {@link EntityLifecycle#READY} and commands will be passed to it. If recovery
     * fails the instance is removed and exception propagates to the caller.
     *
     * @param entityId the identity of an entity
     * @return instance in latest known state
     * @throws EventStoreException when the event log cannot be read
     */
    EntityInstance<S> lookup(String entityId) throws EventStoreException {
        EntityInstance<S> instance = memory.lookup(entityId,
            id -> new EntityInstance<>(id, descriptor.getConfiguration().persistenceId(id)));
        if (instance.getLifecycle() != EntityLifecycle.READY) {
            recover(instance);
        } else if (!persistence.getEventLog().confirmsRevisionIsCurrent(instance.getPersistenceId(),
            instance.getRevision())) {
            logger.info("Instance {} is stale, recovering", instance);
            recover(instance);
        }
        return instance;
    }

    private void recover(EntityInstance<S> instance) throws EventStoreException {
        instance.startLoading();
        try {
            Recovery recovery = startingPoint(instance);
            replay(instance.getPersistenceId(), recovery);
            instance.recovered(recovery.state, recovery.revision);
            logger.debug("Recovered {}", instance);
        } catch (EventStoreException | RuntimeException e) {
            logger.warn("Recovery of {} failed", instance.getPersistenceId(), e);
            instance.loadingFailed();
            memory.remove(instance.getEntityId());
            throw e;
        }
    }

    private Recovery startingPoint(EntityInstance<S> instance) {
        Optional<SnapshotStore.Snapshot> snapshot = persistence.getSnapshotStore()
                .readSnapshot(instance.getPersistenceId());
        if (snapshot.isPresent()) {
            Object state = snapshot.get().getState();
            if (descriptor.getStateType().isInstance(state)) {
                return new Recovery(descriptor.getStateType().cast(state), snapshot.get().getRevision());
            }
            logger.warn("Snapshot of {} is of type {}, expected {}. Replaying all events",
                instance.getPersistenceId(), state.getClass().getName(), descriptor.getStateType().getName());
        }
        return new Recovery(descriptor.initialState(instance.getEntityId()), 0);
    }

    private void replay(String persistenceId, Recovery recovery) throws EventStoreException {
        try (EventLog.StoredEvents events = persistence.getEventLog().readEvents(persistenceId, recovery.revision)) {
            events.foreach(stored -> {
                if (stored.getRevision() != recovery.revision + 1) {
                    recovery.unexpectedRevision = stored.getRevision();
                    events.stop();
                } else {
                    recovery.state = processor.applyEvent(recovery.state, stored.getEvent());
                    recovery.revision = stored.getRevision();
                }
            });
        }
        if (recovery.unexpectedRevision != null) {
            throw EventStoreException.nonMonotonic(persistenceId, recovery.revision + 1, recovery.unexpectedRevision);
        }
    }

    private class Recovery {
        S state;
        long revision;
        Long unexpectedRevision;

        Recovery(S state, long revision) {
            this.state = state;
            this.revision = revision;
        }
    }
}
