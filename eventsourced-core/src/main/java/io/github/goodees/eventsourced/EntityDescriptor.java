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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Complete description of an event sourced entity: how its initial state is created, which commands it accepts, how
 * every event it emits changes its state, and how it is persisted. A descriptor is an immutable value, created once at
 * registration and passed to whatever executes the entity, be it
 * {@link io.github.goodees.eventsourced.runtime.EntityRuntime} or a test harness.
 *
 * <p>Handlers are resolved by name of the command or event. All registrations are validated when the descriptor is
 * built, a misconfigured entity never gets to serve requests.</p>
 *
 * @param <S> type of state
 */
public final class EntityDescriptor<S> {
    private final Class<S> stateType;
    private final EntityConfiguration configuration;
    private final Function<String, S> initialState;
    private final UnaryOperator<S> readOnlyView;
    private final Map<String, CommandBinding<S, ?, ?>> commandHandlers;
    private final Map<String, EventBinding<S, ?>> eventHandlers;

    private EntityDescriptor(Builder<S> builder) {
        this.stateType = builder.stateType;
        this.configuration = builder.configuration;
        this.initialState = builder.initialState;
        this.readOnlyView = builder.readOnlyView;
        this.commandHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commandHandlers));
        this.eventHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.eventHandlers));
    }

    public static <S> Builder<S> builder(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    public Class<S> getStateType() {
        return stateType;
    }

    public EntityConfiguration getConfiguration() {
        return configuration;
    }

    public String getEntityType() {
        return configuration.getEntityType();
    }

    /**
     * Create initial state of an entity, that has neither snapshot nor events.
     * @param entityId the identity of the entity
     * @return initial state
     */
    public S initialState(String entityId) {
        S state = initialState.apply(entityId);
        if (state == null) {
            throw new IllegalStateException("Initial state factory of " + getEntityType() + " returned null for "
                    + entityId);
        }
        return state;
    }

    /**
     * The view of the state that is passed to command handlers.
     * @param state current state
     * @return read-only view of the state
     */
    public S readOnlyView(S state) {
        return readOnlyView.apply(state);
    }

    public Optional<CommandBinding<S, ?, ?>> commandHandler(String commandName) {
        return Optional.ofNullable(commandHandlers.get(commandName));
    }

    /**
     * Verify that a typed command matches the command registered under its name.
     * @param type requested command type
     * @throws DispatchException if no command of that name is registered, or it is registered with different payload
     *         or response type
     */
    public void verifyCommandType(CommandType<?, ?> type) {
        CommandBinding<S, ?, ?> binding = commandHandler(type.getName())
                .orElseThrow(() -> DispatchException.unknownCommand(getEntityType(), type.getName()));
        if (!binding.getType().equals(type)) {
            throw DispatchException.commandTypeMismatch(getEntityType(), type, binding.getType());
        }
    }

    public Optional<EventBinding<S, ?>> eventHandler(String eventName) {
        return Optional.ofNullable(eventHandlers.get(eventName));
    }

    public Set<String> getCommandNames() {
        return commandHandlers.keySet();
    }

    public Set<String> getEventNames() {
        return eventHandlers.keySet();
    }

    @Override
    public String toString() {
        return "EntityDescriptor{" + configuration + ", commands=" + getCommandNames() + ", events="
                + getEventNames() + '}';
    }

    /**
     * Command handler bound to its command type.
     * @param <S> type of state
     * @param <P> type of payload
     * @param <R> type of response
     */
    public static final class CommandBinding<S, P, R> {
        private final CommandType<P, R> type;
        private final CommandHandler<S, P, R> handler;

        CommandBinding(CommandType<P, R> type, CommandHandler<S, P, R> handler) {
            this.type = type;
            this.handler = handler;
        }

        public CommandType<P, R> getType() {
            return type;
        }

        public boolean accepts(Object payload) {
            return type.getPayloadType().isInstance(payload);
        }

        /**
         * Invoke the handler. Caller is responsible for checking the payload is {@linkplain #accepts(Object) accepted}.
         * @param payload command payload
         * @param state read-only state
         * @param context invocation context
         * @return the response
         * @throws Exception whatever the handler throws
         */
        public R invoke(Object payload, S state, CommandContext context) throws Exception {
            return handler.handle(type.getPayloadType().cast(payload), state, context);
        }
    }

    /**
     * Event handler bound to its event type.
     * @param <S> type of state
     * @param <P> type of payload
     */
    public static final class EventBinding<S, P> {
        private final EventType<P> type;
        private final EventHandler<S, P> handler;

        EventBinding(EventType<P> type, EventHandler<S, P> handler) {
            this.type = type;
            this.handler = handler;
        }

        public EventType<P> getType() {
            return type;
        }

        public boolean accepts(Object payload) {
            return type.getPayloadType().isInstance(payload);
        }

        public S apply(Object payload, S state) {
            return handler.apply(type.getPayloadType().cast(payload), state);
        }
    }

    public static class Builder<S> {
        private final Class<S> stateType;
        private EntityConfiguration configuration;
        private Function<String, S> initialState;
        private UnaryOperator<S> readOnlyView = UnaryOperator.identity();
        private final Map<String, CommandBinding<S, ?, ?>> commandHandlers = new LinkedHashMap<>();
        private final Map<String, EventBinding<S, ?>> eventHandlers = new LinkedHashMap<>();

        Builder(Class<S> stateType) {
            this.stateType = Objects.requireNonNull(stateType, "State type must be specified");
        }

        public Builder<S> configuration(EntityConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "Configuration must not be null");
            return this;
        }

        /**
         * Factory for the state of an entity that has no snapshot and no events yet.
         * @param initialState function of entity id to its initial state
         * @return this builder
         */
        public Builder<S> initialState(Function<String, S> initialState) {
            this.initialState = Objects.requireNonNull(initialState, "Initial state factory must not be null");
            return this;
        }

        /**
         * Function wrapping the state before it is passed to command handlers. Only needed for mutable state types,
         * e.g. {@code Collections::unmodifiableMap}.
         * @param readOnlyView view function
         * @return this builder
         */
        public Builder<S> readOnlyView(UnaryOperator<S> readOnlyView) {
            this.readOnlyView = Objects.requireNonNull(readOnlyView, "Read only view must not be null");
            return this;
        }

        public <P, R> Builder<S> onCommand(CommandType<P, R> type, CommandHandler<S, P, R> handler) {
            Objects.requireNonNull(type, "Command type must not be null");
            Objects.requireNonNull(handler, () -> "Handler of command " + type.getName() + " must not be null");
            if (commandHandlers.putIfAbsent(type.getName(), new CommandBinding<>(type, handler)) != null) {
                throw EntityConfigurationException.duplicateCommand(entityTypeForMessages(), type.getName());
            }
            return this;
        }

        public <P> Builder<S> onEvent(EventType<P> type, EventHandler<S, P> handler) {
            Objects.requireNonNull(type, "Event type must not be null");
            Objects.requireNonNull(handler, () -> "Handler of event " + type.getName() + " must not be null");
            if (eventHandlers.putIfAbsent(type.getName(), new EventBinding<>(type, handler)) != null) {
                throw EntityConfigurationException.duplicateEvent(entityTypeForMessages(), type.getName());
            }
            return this;
        }

        private String entityTypeForMessages() {
            return configuration == null ? stateType.getSimpleName() : configuration.getEntityType();
        }

        /**
         * Validate and build the descriptor.
         * @return the descriptor
         * @throws EntityConfigurationException if configuration or initial state factory is missing, or the entity
         *         accepts no commands
         */
        public EntityDescriptor<S> build() {
            if (configuration == null) {
                throw new EntityConfigurationException("Entity with state " + stateType.getName()
                        + " has no configuration");
            }
            if (initialState == null) {
                throw new EntityConfigurationException("Entity " + configuration.getEntityType()
                        + " has no initial state factory");
            }
            if (commandHandlers.isEmpty()) {
                throw new EntityConfigurationException("Entity " + configuration.getEntityType()
                        + " does not handle any command");
            }
            return new EntityDescriptor<>(this);
        }
    }
}
