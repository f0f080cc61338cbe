package io.github.goodees.eventsourced.engine;

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

import io.github.goodees.eventsourced.CommandContext;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-use context of one command invocation. Buffers emitted events until the handler returns.
 */
final class InvocationContext implements CommandContext {
    private static final Logger logger = LoggerFactory.getLogger(InvocationContext.class);

    private final EntityDescriptor<?> descriptor;
    private final String entityId;
    private final String commandName;
    private final long revision;
    private final List<Event<?>> emitted = new ArrayList<>();
    private String failure;
    private boolean active = true;

    InvocationContext(EntityDescriptor<?> descriptor, String entityId, String commandName, long revision) {
        this.descriptor = descriptor;
        this.entityId = entityId;
        this.commandName = commandName;
        this.revision = revision;
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public String commandName() {
        return commandName;
    }

    @Override
    public long revision() {
        return revision;
    }

    @Override
    public void emit(Event<?> event) {
        Objects.requireNonNull(event, "Emitted event must not be null");
        assertActive();
        if (failure != null) {
            logger.warn("Entity {} emitted {} after command {} failed. The event is ignored", entityId, event,
                commandName);
            return;
        }
        if (!descriptor.eventHandler(event.getTypeName()).isPresent()) {
            throw DispatchException.unknownEvent(descriptor.getEntityType(), event.getTypeName());
        }
        emitted.add(event);
    }

    @Override
    public void fail(String message) {
        assertActive();
        if (failure != null) {
            throw new IllegalStateException("Command " + commandName + " of entity " + entityId
                    + " has already failed with: " + failure);
        }
        failure = message == null ? "Command " + commandName + " failed" : message;
        emitted.clear();
    }

    @Override
    public boolean isFailed() {
        return failure != null;
    }

    String getFailure() {
        return failure;
    }

    List<Event<?>> getEmitted() {
        return Collections.unmodifiableList(emitted);
    }

    /**
     * End the invocation. Any later use of the context is an error.
     */
    void close() {
        active = false;
    }

    private void assertActive() {
        if (!active) {
            throw new IllegalStateException("Context of command " + commandName + " of entity " + entityId
                    + " is no longer active");
        }
    }
}
