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

import io.github.goodees.eventsourced.CommandResult;
import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Dispatch and fold engine. Given a state and a command it invokes the matching command handler, collects the events
 * it emits and folds them, in emission order, through their event handlers.
 *
 * <p>The processor holds no state of its own. It never modifies the state it is given: the result carries the new
 * state, and the caller decides whether to adopt it. This makes every invocation all-or-nothing, a failure at any step
 * leaves the caller's state as it was.</p>
 *
 * @param <S> type of state
 */
public class CommandProcessor<S> {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final EntityDescriptor<S> descriptor;

    public CommandProcessor(EntityDescriptor<S> descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "Entity descriptor must be specified");
    }

    public EntityDescriptor<S> getDescriptor() {
        return descriptor;
    }

    /**
     * Process a command identified by its name.
     * @param entityId identity of the entity
     * @param state current state
     * @param revision current revision
     * @param commandName name of the command
     * @param payload command payload
     * @return successful result or domain failure
     * @throws DispatchException when the command is unknown, its payload or response has unexpected type, or any of
     *         the handlers fails
     */
    public CommandResult<S, Object> process(String entityId, S state, long revision, String commandName,
            Object payload) {
        EntityDescriptor.CommandBinding<S, ?, ?> binding = descriptor.commandHandler(commandName)
                .orElseThrow(() -> DispatchException.unknownCommand(descriptor.getEntityType(), commandName));
        return invoke(binding, entityId, state, revision, payload);
    }

    /**
     * Process a command of known type.
     * @param entityId identity of the entity
     * @param state current state
     * @param revision current revision
     * @param type type of the command
     * @param payload command payload
     * @param <P> type of payload
     * @param <R> type of response
     * @return successful result or domain failure
     * @see #process(String, Object, long, String, Object)
     */
    public <P, R> CommandResult<S, R> process(String entityId, S state, long revision, CommandType<P, R> type,
            P payload) {
        descriptor.verifyCommandType(type);
        CommandResult<S, Object> result = process(entityId, state, revision, type.getName(), payload);
        if (!result.isSuccessful()) {
            return CommandResult.failure(result.getFailure().get(), state, revision);
        }
        return CommandResult.success(type.getResponseType().cast(result.getResponse()), result.getEvents(),
            result.getState(), result.getRevision());
    }

    private CommandResult<S, Object> invoke(EntityDescriptor.CommandBinding<S, ?, ?> binding, String entityId,
            S state, long revision, Object payload) {
        String commandName = binding.getType().getName();
        if (!binding.accepts(payload)) {
            throw DispatchException.payloadMismatch(descriptor.getEntityType(), commandName,
                binding.getType().getPayloadType(), payload);
        }
        InvocationContext context = new InvocationContext(descriptor, entityId, commandName, revision);
        Object response;
        try {
            response = binding.invoke(payload, descriptor.readOnlyView(state), context);
        } catch (DispatchException e) {
            throw e;
        } catch (Exception e) {
            throw DispatchException.commandHandlerFailed(descriptor.getEntityType(), commandName, e);
        } finally {
            context.close();
        }
        if (context.isFailed()) {
            logger.debug("Command {} of {} {} failed: {}", commandName, descriptor.getEntityType(), entityId,
                context.getFailure());
            return CommandResult.failure(context.getFailure(), state, revision);
        }
        if (response != null && !binding.getType().getResponseType().isInstance(response)) {
            throw DispatchException.responseMismatch(descriptor.getEntityType(), commandName,
                binding.getType().getResponseType(), response);
        }
        List<Event<?>> events = context.getEmitted();
        S newState = fold(state, events);
        logger.debug("Command {} of {} {} emitted {} events", commandName, descriptor.getEntityType(), entityId,
            events.size());
        return CommandResult.success(response, events, newState, revision + events.size());
    }

    /**
     * Apply single event through its event handler.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     * @throws DispatchException if there is no handler for the event, or the handler fails
     */
    public S applyEvent(S state, Event<?> event) {
        return applyEvent(state, event.getTypeName(), event.getPayload());
    }

    /**
     * Apply single event given by its name and payload.
     * @param state state before the event
     * @param eventName name of the event type
     * @param payload payload of the event
     * @return state after the event
     * @throws DispatchException if there is no handler for the event, payload is of wrong type or the handler fails
     */
    public S applyEvent(S state, String eventName, Object payload) {
        EntityDescriptor.EventBinding<S, ?> binding = descriptor.eventHandler(eventName)
                .orElseThrow(() -> DispatchException.unknownEvent(descriptor.getEntityType(), eventName));
        if (!binding.accepts(payload)) {
            throw DispatchException.payloadMismatch(descriptor.getEntityType(), eventName,
                binding.getType().getPayloadType(), payload);
        }
        S newState;
        try {
            newState = binding.apply(payload, state);
        } catch (RuntimeException e) {
            throw DispatchException.eventHandlerFailed(descriptor.getEntityType(), eventName, e);
        }
        if (newState == null) {
            throw DispatchException.eventHandlerFailed(descriptor.getEntityType(), eventName,
                new IllegalStateException("Event handler returned null state"));
        }
        return newState;
    }

    /**
     * Fold events over the state, in order. Fold of each event observes the state produced by the previous ones.
     * @param state initial state
     * @param events events to apply
     * @return resulting state
     */
    public S fold(S state, List<? extends Event<?>> events) {
        S result = state;
        for (Event<?> event : events) {
            result = applyEvent(result, event);
        }
        return result;
    }
}
