package io.github.goodees.eventsourced.testkit;

/*-
 * #%L
 * eventsourced-testkit
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
import io.github.goodees.eventsourced.EventType;
import io.github.goodees.eventsourced.engine.CommandProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * In-memory harness driving single entity through commands and events, without any store. Records the state, all
 * events applied so far and the failure of last command.
 *
 * <pre>{@code
 * MockEventSourcedEntity<Cart> cart = new MockEventSourcedEntity<>(CartEntity.descriptor(), "user-1");
 * LineItem item = cart.handleCommand(CartEntity.ADD_ITEM, lineItem);
 * assertThat(cart.getEvents(), hasSize(1));
 * }</pre>
 *
 * @param <S> type of state
 */
public class MockEventSourcedEntity<S> {
    private static final Logger logger = LoggerFactory.getLogger(MockEventSourcedEntity.class);

    private final CommandProcessor<S> processor;
    private final String entityId;
    private final List<Event<?>> events = new ArrayList<>();
    private S state;
    private String error;

    public MockEventSourcedEntity(EntityDescriptor<S> descriptor, String entityId) {
        this.processor = new CommandProcessor<>(Objects.requireNonNull(descriptor, "Descriptor must be specified"));
        this.entityId = Objects.requireNonNull(entityId, "Entity id must be specified");
        this.state = descriptor.initialState(entityId);
    }

    public String getEntityId() {
        return entityId;
    }

    public S getState() {
        return state;
    }

    /**
     * All events emitted by successful commands and applied directly, in order.
     * @return read-only list of events
     */
    public List<Event<?>> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Failure message of the last command.
     * @return the message, null if last command succeeded
     */
    public String getError() {
        return error;
    }

    public long getRevision() {
        return events.size();
    }

    /**
     * Execute a command. On success, events are appended and state updated. On domain failure, {@link #getError()}
     * holds the message and null is returned.
     * @param commandName name of the command
     * @param payload payload of the command
     * @return the response of command handler, null on failure
     * @throws DispatchException if command cannot be dispatched
     */
    public Object handleCommand(String commandName, Object payload) {
        error = null;
        CommandResult<S, Object> result = processor.process(entityId, state, getRevision(), commandName, payload);
        return complete(result);
    }

    /**
     * Execute a command of known type.
     * @param type type of the command
     * @param payload payload of the command
     * @param <P> type of payload
     * @param <R> type of response
     * @return the response of command handler, null on failure
     * @see #handleCommand(String, Object)
     */
    public <P, R> R handleCommand(CommandType<P, R> type, P payload) {
        error = null;
        return complete(processor.process(entityId, state, getRevision(), type, payload));
    }

    private <R> R complete(CommandResult<S, R> result) {
        if (result.isSuccessful()) {
            events.addAll(result.getEvents());
            state = result.getState();
            return result.getResponse();
        } else {
            error = result.getFailure().get();
            logger.debug("Command on {} failed: {}", entityId, error);
            return null;
        }
    }

    /**
     * Apply single event through its handler, bypassing command handlers.
     * @param event the event
     * @return new state
     * @throws DispatchException if there is no handler for the event
     */
    public S handleEvent(Event<?> event) {
        state = processor.applyEvent(state, event);
        events.add(event);
        return state;
    }

    public <P> S handleEvent(EventType<P> type, P payload) {
        return handleEvent(type.create(payload));
    }

    /**
     * Apply single event given by name.
     * @param eventName name of the event
     * @param payload payload of the event
     * @return new state
     * @throws DispatchException if there is no handler for the event, or payload has wrong type
     */
    public S handleEvent(String eventName, Object payload) {
        EntityDescriptor.EventBinding<S, ?> binding = processor.getDescriptor().eventHandler(eventName)
                .orElseThrow(() -> DispatchException.unknownEvent(processor.getDescriptor().getEntityType(),
                    eventName));
        return handleEvent(createEvent(binding.getType(), payload));
    }

    private <P> Event<P> createEvent(EventType<P> type, Object payload) {
        if (!type.getPayloadType().isInstance(payload)) {
            throw DispatchException.payloadMismatch(processor.getDescriptor().getEntityType(), type.getName(),
                type.getPayloadType(), payload);
        }
        return type.create(type.getPayloadType().cast(payload));
    }
}
