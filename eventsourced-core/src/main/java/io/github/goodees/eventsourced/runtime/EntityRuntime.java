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

import io.github.goodees.eventsourced.Command;
import io.github.goodees.eventsourced.CommandFailedException;
import io.github.goodees.eventsourced.CommandResult;
import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.dispatch.Dispatcher;
import io.github.goodees.eventsourced.dispatch.DispatcherConfiguration;
import io.github.goodees.eventsourced.dispatch.EntityTask;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Facade to speaking with persistent entities of one type. Commands of single entity are executed one at time by a
 * {@link Dispatcher}, commands of different entities run in parallel.
 *
 * <p>Returned futures complete exceptionally with
 * <ul>
 *     <li>{@link CommandFailedException} when the command handler signalled domain failure,</li>
 *     <li>{@link io.github.goodees.eventsourced.DispatchException} when the command could not be dispatched,</li>
 *     <li>{@link io.github.goodees.eventsourced.store.EventStoreException} when recovery or storing failed,</li>
 *     <li>{@link java.util.concurrent.CancellationException} when the command timed out before it started.</li>
 * </ul>
 * In neither case the entity state changes.
 * <p>Clients should not call any mutation methods of the returned futures, such as
 * {@linkplain CompletableFuture#complete(Object)}. They may throw an UnsupportedOperationException.</p>
 *
 * @param <S> type of state
 */
public class EntityRuntime<S> {
    private final EntityDescriptor<S> descriptor;
    private final Dispatcher dispatcher;
    private final SnapshotWriter snapshotWriter;
    private final EntityInvocationHandler<S> handler;

    public EntityRuntime(EntityDescriptor<S> descriptor, Persistence persistence,
            DispatcherConfiguration dispatcherConfiguration) {
        this.descriptor = Objects.requireNonNull(descriptor, "Descriptor must be specified");
        Objects.requireNonNull(persistence, "Persistence must be specified");
        Objects.requireNonNull(dispatcherConfiguration, "Dispatcher configuration must be specified");
        this.dispatcher = new Dispatcher(dispatcherConfiguration);
        this.snapshotWriter = new SnapshotWriter(persistence.getSnapshotStore(),
                dispatcherConfiguration.snapshotExecutor());
        this.handler = new EntityInvocationHandler<>(descriptor, persistence, new MapBasedWorkingMemory<>(),
                snapshotWriter);
    }

    public EntityDescriptor<S> getDescriptor() {
        return descriptor;
    }

    public String getEntityType() {
        return descriptor.getEntityType();
    }

    /**
     * Execute a command.
     * @param entityId the identity of the entity
     * @param commandName name of the command
     * @param payload payload of the command
     * @return future of the response of command handler
     */
    public CompletableFuture<Object> handleCommand(String entityId, String commandName, Object payload) {
        return dispatcher.execute(entityId, commandTask(entityId, commandName, payload));
    }

    public CompletableFuture<Object> handleCommand(Command command) {
        return handleCommand(command.getEntityId(), command.getName(), command.getPayload());
    }

    /**
     * Execute a command of known type.
     * @param entityId the identity of the entity
     * @param type type of the command
     * @param payload payload of the command
     * @param <P> type of payload
     * @param <R> type of response
     * @return future of the response of command handler
     */
    public <P, R> CompletableFuture<R> handleCommand(String entityId, CommandType<P, R> type, P payload) {
        EntityTask<Object> command = commandTask(entityId, type.getName(), payload);
        return dispatcher.execute(entityId, () -> {
            descriptor.verifyCommandType(type);
            return type.getResponseType().cast(command.run());
        });
    }

    /**
     * Execute a command, that needs to start within given time. Command that already started always completes.
     * @param entityId the identity of the entity
     * @param commandName name of the command
     * @param payload payload of the command
     * @param timeout the timeout
     * @param unit unit of timeout
     * @return future of the response of command handler
     */
    public CompletableFuture<Object> handleCommandWithTimeout(String entityId, String commandName, Object payload,
            long timeout, TimeUnit unit) {
        return dispatcher.executeWithTimeout(entityId, commandTask(entityId, commandName, payload), timeout, unit);
    }

    private EntityTask<Object> commandTask(String entityId, String commandName, Object payload) {
        return new EntityTask<Object>() {
            @Override
            public Object run() throws Exception {
                CommandResult<S, Object> result = handler.handleCommand(entityId, commandName, payload);
                if (!result.isSuccessful()) {
                    throw new CommandFailedException(entityId, commandName, result.getFailure().get());
                }
                return result.getResponse();
            }

            @Override
            public String toString() {
                return "Command[" + commandName + "]";
            }
        };
    }

    /**
     * Apply and persist an event without a command.
     * @param entityId the identity of the entity
     * @param eventName name of the event
     * @param payload payload of the event
     * @return future of the new state
     */
    public CompletableFuture<S> handleEvent(String entityId, String eventName, Object payload) {
        return dispatcher.execute(entityId, () -> handler.handleEvent(entityId, eventName, payload));
    }

    /**
     * Read current state of an entity, recovering it if needed.
     * @param entityId the identity of the entity
     * @return future of read-only state
     */
    public CompletableFuture<S> getState(String entityId) {
        return dispatcher.execute(entityId, () -> handler.getState(entityId));
    }

    /**
     * Drop the in-memory instance of an entity after commands queued before this call complete. The entity is
     * recovered from the store on next command.
     * @param entityId the identity of the entity
     * @return future completing after the instance was removed
     */
    public CompletableFuture<Void> passivate(String entityId) {
        return dispatcher.execute(entityId, () -> {
            handler.passivate(entityId);
            return null;
        });
    }

    public boolean isActive(String entityId) {
        return handler.isActive(entityId);
    }

    /**
     * Future that completes when snapshot writes requested so far are done.
     * @return future of pending snapshot writes
     */
    public CompletableFuture<Void> flushSnapshots() {
        return snapshotWriter.whenIdle();
    }
}
