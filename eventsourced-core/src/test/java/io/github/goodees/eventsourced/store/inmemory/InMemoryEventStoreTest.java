package io.github.goodees.eventsourced.store.inmemory;

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
import io.github.goodees.eventsourced.EventType;
import io.github.goodees.eventsourced.store.EventLog;
import io.github.goodees.eventsourced.store.EventStoreException;
import io.github.goodees.eventsourced.store.StoredEvent;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class InMemoryEventStoreTest {
    private static final EventType<String> NOTED = EventType.of("Noted", String.class);

    private final InMemoryEventStore store = new InMemoryEventStore();

    private List<Event<String>> notes(String... notes) {
        return Arrays.stream(notes).map(NOTED::create).collect(toList());
    }

    @Test
    public void appended_events_get_consecutive_revisions() throws EventStoreException {
        List<StoredEvent> first = store.append("note/1", 0, notes("a", "b"));
        List<StoredEvent> second = store.append("note/1", 2, notes("c"));

        assertEquals(Arrays.asList(1L, 2L), first.stream().map(StoredEvent::getRevision).collect(toList()));
        assertEquals(3, second.get(0).getRevision());
        assertEquals("note/1", second.get(0).getPersistenceId());
        assertEquals(3, store.currentRevision("note/1"));
        assertEquals(0, store.currentRevision("note/2"));
    }

    @Test
    public void append_with_stale_revision_is_rejected() throws EventStoreException {
        store.append("note/1", 0, notes("a"));
        EventStoreException e = assertThrows(EventStoreException.class, () -> store.append("note/1", 0, notes("b")));
        assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        assertEquals(1, store.currentRevision("note/1"));
    }

    @Test
    public void events_are_read_after_revision() throws EventStoreException {
        store.append("note/1", 0, notes("a", "b", "c"));
        List<Object> payloads = new ArrayList<>();
        try (EventLog.StoredEvents events = store.readEvents("note/1", 1)) {
            events.foreach(e -> payloads.add(e.getEvent().getPayload()));
        }
        assertThat(payloads, contains("b", "c"));
    }

    @Test
    public void reading_can_be_stopped() throws EventStoreException {
        store.append("note/1", 0, notes("a", "b", "c"));
        try (EventLog.StoredEvents events = store.readEvents("note/1", 0)) {
            long lastSeen = events.reduce(0L, (last, e) -> {
                if (e.getRevision() == 2) {
                    events.stop();
                }
                return e.getRevision();
            });
            assertEquals(2L, lastSeen);
        }
    }

    @Test
    public void revision_is_current_unless_log_moved_on() throws EventStoreException {
        store.append("note/1", 0, notes("a", "b"));
        assertTrue(store.confirmsRevisionIsCurrent("note/1", 2));
        assertFalse(store.confirmsRevisionIsCurrent("note/1", 1));
    }
}
