package io.github.goodees.eventsourced.gateway;

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
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.EntityConfigurationException;
import io.github.goodees.eventsourced.dispatch.Dispatcher;
import io.github.goodees.eventsourced.runtime.EntityRuntime;
import io.github.goodees.eventsourced.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of a transport: routes commands to runtimes by entity type and turns every outcome into a
 * {@link Reply}. Futures returned by the gateway never complete exceptionally.
 */
public class EntityGateway {
    private static final Logger logger = LoggerFactory.getLogger(EntityGateway.class);

    private final ConcurrentMap<String, EntityRuntime<?>> runtimes = new ConcurrentHashMap<>();
    private final long timeout;
    private final TimeUnit timeoutUnit;

    /**
     * Gateway without timeouts.
     */
    public EntityGateway() {
        this(0, TimeUnit.MILLISECONDS);
    }

    /**
     * Gateway which replies with error to commands that did not start within the timeout.
     * @param timeout the timeout, 0 for none
     * @param timeoutUnit unit of timeout
     */
    public EntityGateway(long timeout, TimeUnit timeoutUnit) {
        if (timeout < 0) {
            throw new IllegalArgumentException("Timeout must not be negative");
        }
        this.timeout = timeout;
        this.timeoutUnit = timeoutUnit;
    }

    /**
     * Register a runtime under its entity type.
     * @param runtime the runtime
     * @return this gateway
     * @throws EntityConfigurationException if a runtime of the same entity type is registered already
     */
    public EntityGateway register(EntityRuntime<?> runtime) {
        if (runtimes.putIfAbsent(runtime.getEntityType(), runtime) != null) {
            throw new EntityConfigurationException("Entity type " + runtime.getEntityType()
                    + " is already registered");
        }
        logger.info("Registered entity {} with commands {}", runtime.getEntityType(),
            runtime.getDescriptor().getCommandNames());
        return this;
    }

    public Set<String> getEntityTypes() {
        return Collections.unmodifiableSet(runtimes.keySet());
    }

    public Optional<EntityRuntime<?>> runtime(String entityType) {
        return Optional.ofNullable(runtimes.get(entityType));
    }

    public CompletableFuture<Reply> handle(String entityType, Command command) {
        return handle(entityType, command.getEntityId(), command.getName(), command.getPayload());
    }

    /**
     * Route a command to its entity.
     * @param entityType type of the entity
     * @param entityId the identity of the entity
     * @param commandName name of the command
     * @param payload payload of the command
     * @return future of the reply
     */
    public CompletableFuture<Reply> handle(String entityType, String entityId, String commandName, Object payload) {
        EntityRuntime<?> runtime = runtimes.get(entityType);
        if (runtime == null) {
            logger.warn("Command {} for unknown entity type {}", commandName, entityType);
            return CompletableFuture.completedFuture(Reply.error("Unknown entity type " + entityType));
        }
        CompletableFuture<Object> response;
        try {
            response = timeout > 0
                    ? runtime.handleCommandWithTimeout(entityId, commandName, payload, timeout, timeoutUnit)
                    : runtime.handleCommand(entityId, commandName, payload);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(toReply(entityType, entityId, commandName, e));
        }
        return response.handle((r, t) -> t == null ? Reply.ok(r) : toReply(entityType, entityId, commandName, t));
    }

    private Reply toReply(String entityType, String entityId, String commandName, Throwable throwable) {
        Throwable cause = Dispatcher.unwrapCompletionException(throwable);
        if (cause instanceof CommandFailedException) {
            logger.debug("Command {} of {} {} failed: {}", commandName, entityType, entityId, cause.getMessage());
            return Reply.failed(cause.getMessage());
        } else if (Dispatcher.isTimeout(cause)) {
            logger.warn("Command {} of {} {} timed out", commandName, entityType, entityId);
            return Reply.error("Command " + commandName + " of " + entityType + " " + entityId + " timed out");
        } else if (cause instanceof DispatchException || cause instanceof EventStoreException) {
            logger.warn("Command {} of {} {} could not be executed", commandName, entityType, entityId, cause);
            return Reply.error(cause.getMessage());
        } else {
            logger.error("Command {} of {} {} failed unexpectedly", commandName, entityType, entityId, cause);
            return Reply.error("Command " + commandName + " failed: " + cause);
        }
    }
}
