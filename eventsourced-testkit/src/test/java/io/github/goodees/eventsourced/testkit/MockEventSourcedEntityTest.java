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

import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.EntityConfiguration;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.EventType;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class MockEventSourcedEntityTest {
    static final CommandType<String, Integer> VOTE = CommandType.of("Vote", String.class, Integer.class);
    static final CommandType<String, Integer> COUNT = CommandType.of("Count", String.class, Integer.class);
    static final EventType<String> VOTED = EventType.of("Voted", String.class);

    static final EntityDescriptor<Integer> BALLOT = EntityDescriptor.builder(Integer.class)
            .configuration(EntityConfiguration.builder("ballot").build())
            .initialState(id -> 0)
            .onCommand(VOTE, (candidate, votes, ctx) -> {
                if (candidate.isEmpty()) {
                    ctx.fail("Candidate must be named");
                    return null;
                }
                ctx.emit(VOTED, candidate);
                return votes + 1;
            })
            .onCommand(COUNT, (request, votes, ctx) -> votes)
            .onEvent(VOTED, (candidate, votes) -> votes + 1)
            .build();

    private final MockEventSourcedEntity<Integer> entity = new MockEventSourcedEntity<>(BALLOT, "b1");

    @Test
    public void starts_in_initial_state() {
        assertEquals("b1", entity.getEntityId());
        assertEquals(Integer.valueOf(0), entity.getState());
        assertEquals(0, entity.getRevision());
        assertTrue(entity.getEvents().isEmpty());
        assertNull(entity.getError());
    }

    @Test
    public void successful_command_records_events_and_state() {
        assertEquals(Integer.valueOf(1), entity.handleCommand(VOTE, "ada"));
        assertEquals(2, entity.handleCommand("Vote", "alan"));
        assertEquals(Arrays.asList(VOTED.create("ada"), VOTED.create("alan")), entity.getEvents());
        assertEquals(Integer.valueOf(2), entity.getState());
        assertEquals(2, entity.getRevision());
    }

    @Test
    public void failure_is_recorded_and_cleared_by_next_command() {
        entity.handleCommand(VOTE, "ada");
        assertNull(entity.handleCommand(VOTE, ""));
        assertEquals("Candidate must be named", entity.getError());
        assertEquals(Integer.valueOf(1), entity.getState());
        assertEquals(1, entity.getEvents().size());

        assertEquals(Integer.valueOf(1), entity.handleCommand(COUNT, ""));
        assertNull(entity.getError());
    }

    @Test
    public void events_can_be_applied_directly() {
        entity.handleEvent(VOTED, "ada");
        assertEquals(Integer.valueOf(2), entity.handleEvent("Voted", "alan"));
        assertEquals(2, entity.getRevision());
        assertThrows(DispatchException.class, () -> entity.handleEvent("Voted", 3));
        assertThrows(DispatchException.class, () -> entity.handleEvent("Unvoted", "ada"));
        assertEquals(2, entity.getRevision());
    }

    @Test
    public void dispatch_errors_are_thrown() {
        assertThrows(DispatchException.class, () -> entity.handleCommand("Abstain", ""));
        assertNull(entity.getError());
    }

    @Test
    public void events_cannot_be_modified_by_caller() {
        assertThrows(UnsupportedOperationException.class, () -> entity.getEvents().add(VOTED.create("eve")));
    }
}
