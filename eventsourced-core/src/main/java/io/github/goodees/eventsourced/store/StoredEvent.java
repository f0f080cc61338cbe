package io.github.goodees.eventsourced.store;

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

import io.github.goodees.eventsourced.Event;

import java.time.Instant;
import java.util.Objects;

/**
 * Event as recorded in the event log, with persistence metadata. Revisions of single persistence id start at 1 and
 * have no gaps.
 */
public final class StoredEvent {
    private final String persistenceId;
    private final long revision;
    private final Instant timestamp;
    private final Event<?> event;

    public StoredEvent(String persistenceId, long revision, Instant timestamp, Event<?> event) {
        this.persistenceId = Objects.requireNonNull(persistenceId, "Persistence id must not be null");
        this.revision = revision;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must not be null");
        this.event = Objects.requireNonNull(event, "Event must not be null");
    }

    public String getPersistenceId() {
        return persistenceId;
    }

    public long getRevision() {
        return revision;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Event<?> getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return "StoredEvent{" + persistenceId + "@" + revision + ", " + event + '}';
    }
}
