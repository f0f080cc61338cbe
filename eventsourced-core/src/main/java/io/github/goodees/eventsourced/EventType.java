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
 * Tag of an event. Every entity defines a closed set of event types, each pairing the name under which the event is
 * persisted with the class of its payload. The name is the discriminant used for dispatching the event to its handler,
 * both when the event is emitted and when it is replayed from the log.
 *
 * @param <P> the type of payload
 * @see EntityDescriptor.Builder#onEvent(EventType, EventHandler)
 */
public final class EventType<P> {
    private final String name;
    private final Class<P> payloadType;

    private EventType(String name, Class<P> payloadType) {
        this.name = Objects.requireNonNull(name, "Event name must be specified");
        this.payloadType = Objects.requireNonNull(payloadType, "Payload type must be specified");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Event name must not be blank");
        }
    }

    public static <P> EventType<P> of(String name, Class<P> payloadType) {
        return new EventType<>(name, payloadType);
    }

    public String getName() {
        return name;
    }

    public Class<P> getPayloadType() {
        return payloadType;
    }

    /**
     * Create an event of this type.
     * @param payload payload of the event
     * @return new event
     */
    public Event<P> create(P payload) {
        return new Event<>(this, payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventType)) {
            return false;
        }
        EventType<?> other = (EventType<?>) o;
        return name.equals(other.name) && payloadType.equals(other.payloadType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payloadType);
    }

    @Override
    public String toString() {
        return "EventType[" + name + ", " + payloadType.getSimpleName() + "]";
    }
}
