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
 * A command or event could not be dispatched to a handler, or the handler broke. Fatal for the invocation, the state of
 * the entity is not affected.
 */
public class DispatchException extends RuntimeException {

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DispatchException unknownCommand(String entityType, String commandName) {
        return new DispatchException("Entity " + entityType + " has no handler for command " + commandName, null);
    }

    public static DispatchException unknownEvent(String entityType, String eventName) {
        return new DispatchException("Entity " + entityType + " has no handler for event " + eventName, null);
    }

    public static DispatchException payloadMismatch(String entityType, String name, Class<?> expected,
            Object payload) {
        return new DispatchException("Entity " + entityType + " expects payload of type " + expected.getName()
                + " for " + name + ", was given " + (payload == null ? "null" : payload.getClass().getName()), null);
    }

    public static DispatchException responseMismatch(String entityType, String commandName, Class<?> expected,
            Object response) {
        return new DispatchException("Handler of command " + commandName + " in entity " + entityType
                + " returned " + response.getClass().getName() + " instead of " + expected.getName(), null);
    }

    public static DispatchException commandTypeMismatch(String entityType, CommandType<?, ?> requested,
            CommandType<?, ?> registered) {
        return new DispatchException("Entity " + entityType + " registers " + registered + ", was asked for "
                + requested, null);
    }

    public static DispatchException commandHandlerFailed(String entityType, String commandName, Throwable cause) {
        return new DispatchException("Handler of command " + commandName + " in entity " + entityType + " failed: "
                + cause.getMessage(), cause);
    }

    public static DispatchException eventHandlerFailed(String entityType, String eventName, Throwable cause) {
        return new DispatchException("Handler of event " + eventName + " in entity " + entityType + " failed: "
                + cause.getMessage(), cause);
    }
}
