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

import java.util.Objects;

/**
 * Tag of a command an entity accepts: its name, the class of its payload and the class of the response the handler
 * returns.
 *
 * @param <P> type of payload
 * @param <R> type of response
 */
public final class CommandType<P, R> {
    private final String name;
    private final Class<P> payloadType;
    private final Class<R> responseType;

    private CommandType(String name, Class<P> payloadType, Class<R> responseType) {
        this.name = Objects.requireNonNull(name, "Command name must be specified");
        this.payloadType = Objects.requireNonNull(payloadType, "Payload type must be specified");
        this.responseType = Objects.requireNonNull(responseType, "Response type must be specified");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
    }

    public static <P, R> CommandType<P, R> of(String name, Class<P> payloadType, Class<R> responseType) {
        return new CommandType<>(name, payloadType, responseType);
    }

    public String getName() {
        return name;
    }

    public Class<P> getPayloadType() {
        return payloadType;
    }

    public Class<R> getResponseType() {
        return responseType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CommandType)) {
            return false;
        }
        CommandType<?, ?> other = (CommandType<?, ?>) o;
        return name.equals(other.name) && payloadType.equals(other.payloadType)
                && responseType.equals(other.responseType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payloadType, responseType);
    }

    @Override
    public String toString() {
        return "CommandType[" + name + ", " + payloadType.getSimpleName() + " -> " + responseType.getSimpleName() + "]";
    }
}
