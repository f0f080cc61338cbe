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
 * Immutable fact about the business domain that became true.
 *
 * <p>An event is a tagged value: its {@linkplain EventType type} is the discriminant, the payload carries the data.
 * Events are the only means by which the state of an entity changes. They are emitted by command handlers through
 * {@link CommandContext#emit(Event)}, folded into the state by the matching {@link EventHandler}, and persisted as
 * {@link io.github.goodees.eventsourced.store.StoredEvent}.</p>
 *
 * <p>The payload should be immutable as well; the event does not copy it.</p>
 *
 * @param <P> type of payload
 */
public final class Event<P> {
    private final EventType<P> type;
    private final P payload;

    Event(EventType<P> type, P payload) {
        this.type = Objects.requireNonNull(type, "Event type must be specified");
        this.payload = Objects.requireNonNull(payload, () -> "Payload of event " + type.getName() + " is null");
        if (!type.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Event " + type.getName() + " expects payload of type "
                    + type.getPayloadType().getName() + ", was given " + payload.getClass().getName());
        }
    }

    public static <P> Event<P> of(EventType<P> type, P payload) {
        return new Event<>(type, payload);
    }

    public EventType<P> getType() {
        return type;
    }

    /**
     * The discriminant of the event.
     * @return name of event type
     */
    public String getTypeName() {
        return type.getName();
    }

    public P getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event<?> other = (Event<?>) o;
        return type.equals(other.type) && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return "Event[" + type.getName() + ": " + payload + "]";
    }
}
