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

/**
 * Capabilities of a command handler during single invocation. The context is created fresh for every command and
 * becomes unusable once the handler returns.
 *
 * <p>A handler may {@linkplain #emit(Event) emit} any number of events, which will be folded into the state in order of
 * emission after the handler returns. Alternatively it may {@linkplain #fail(String) fail} the command, in which case
 * all events emitted so far are discarded and the state stays untouched. A handler that does neither is a pure query.
 */
public interface CommandContext {

    /**
     * Identity of the entity executing the command.
     * @return the entity id
     */
    String entityId();

    /**
     * The name of the command being executed.
     * @return the command name
     */
    String commandName();

    /**
     * Revision of the entity at the moment the command started, i. e. number of events persisted so far.
     * @return current revision
     */
    long revision();

    /**
     * Emit an event. The event must be of a type the entity has an {@link EventHandler} for.
     * Emitting after {@link #fail(String)} has no effect.
     * @param event the event
     * @throws DispatchException when no handler is registered for the event type
     * @throws IllegalStateException when the invocation has already finished
     */
    void emit(Event<?> event);

    /**
     * Emit an event of given type.
     * @param type event type
     * @param payload event payload
     * @param <P> type of payload
     * @see #emit(Event)
     */
    default <P> void emit(EventType<P> type, P payload) {
        emit(type.create(payload));
    }

    /**
     * Fail the command with a domain failure. The failure is reported to the caller, no events are persisted.
     * May only be called once per invocation.
     * @param message failure description for the caller
     * @throws IllegalStateException if the command has already failed, or the invocation has already finished
     */
    void fail(String message);

    /**
     * Whether {@link #fail(String)} was called.
     * @return true if the command failed
     */
    boolean isFailed();
}
