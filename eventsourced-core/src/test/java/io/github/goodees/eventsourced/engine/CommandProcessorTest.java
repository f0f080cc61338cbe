package io.github.goodees.eventsourced.engine;

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

import io.github.goodees.eventsourced.CommandResult;
import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.Event;
import io.github.goodees.eventsourced.TestEntities;
import io.github.goodees.eventsourced.TestEntities.Counter;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static io.github.goodees.eventsourced.TestEntities.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class CommandProcessorTest {
    private final CommandProcessor<Counter> processor = new CommandProcessor<>(TestEntities.counter());
    private final Counter initial = new Counter("c1");

    @Test
    public void command_emits_and_folds_events() {
        CommandResult<Counter, Integer> result = processor.process("c1", initial, 0, ADD, 5);
        assertTrue(result.isSuccessful());
        assertEquals(Integer.valueOf(5), result.getResponse());
        assertEquals(5, result.getState().getValue());
        assertEquals(1, result.getRevision());
        assertEquals(Arrays.asList(ADDED.create(5)), result.getEvents());
    }

    @Test
    public void events_are_folded_in_emission_order() {
        Counter three = processor.process("c1", initial, 0, ADD, 3).getState();
        CommandResult<Counter, Integer> result = processor.process("c1", three, 1, ADD_AND_DOUBLE, 2);

        // doubled after added: (3 + 2) * 2
        assertEquals(10, result.getState().getValue());
        assertEquals(3, result.getRevision());
        assertThat(result.getState().getApplied(), contains("Added", "Added", "Doubled"));
        assertThat(result.getEvents().stream().map(Event::getTypeName).collect(Collectors.toList()),
            contains("Added", "Doubled"));
        assertEquals(processor.applyEvent(processor.applyEvent(three, ADDED.create(2)), DOUBLED.create("x2")),
            result.getState());
    }

    @Test
    public void failed_command_has_no_effect() {
        Counter five = processor.process("c1", initial, 0, ADD, 5).getState();
        CommandResult<Counter, Integer> result = processor.process("c1", five, 1, ADD_THEN_REJECT, 7);

        assertFalse(result.isSuccessful());
        assertEquals("Rejected 7", result.getFailure().get());
        assertNull(result.getResponse());
        assertThat(result.getEvents(), empty());
        assertSame(five, result.getState());
        assertEquals(1, result.getRevision());
    }

    @Test
    public void query_does_not_change_state() {
        Counter five = processor.process("c1", initial, 0, ADD, 5).getState();
        CommandResult<Counter, Integer> result = processor.process("c1", five, 1, GET, "");

        assertTrue(result.isSuccessful());
        assertEquals(Integer.valueOf(5), result.getResponse());
        assertThat(result.getEvents(), empty());
        assertSame(five, result.getState());
        assertEquals(1, result.getRevision());
    }

    @Test
    public void folding_same_events_twice_gives_equal_states() {
        List<Event<?>> events = Arrays.asList(ADDED.create(1), DOUBLED.create("a"), ADDED.create(-4),
            DOUBLED.create("b"));
        Counter first = processor.fold(initial, events);
        Counter second = processor.fold(new Counter("c1"), events);
        assertEquals(first, second);
        assertEquals(-4, first.getValue());
    }

    @Test
    public void untyped_command_returns_raw_response() {
        CommandResult<Counter, Object> result = processor.process("c1", initial, 0, "Add", 2);
        assertEquals(2, result.getResponse());
    }

    @Test
    public void unknown_command_is_dispatch_error() {
        DispatchException e = assertThrows(DispatchException.class,
            () -> processor.process("c1", initial, 0, "Subtract", 1));
        assertThat(e.getMessage(), containsString("Subtract"));
    }

    @Test
    public void payload_of_wrong_type_is_dispatch_error() {
        assertThrows(DispatchException.class, () -> processor.process("c1", initial, 0, "Add", "one"));
    }

    @Test
    public void response_of_wrong_type_is_dispatch_error() {
        assertThrows(DispatchException.class, () -> processor.process("c1", initial, 0, "WrongResponse", "x"));
    }

    @Test
    public void typed_command_declaring_other_response_type_is_dispatch_error() {
        CommandType<Integer, String> addAsText = CommandType.of("Add", Integer.class, String.class);
        DispatchException e = assertThrows(DispatchException.class,
            () -> processor.process("c1", initial, 0, addAsText, 2));
        assertThat(e.getMessage(), containsString("Add"));
    }

    @Test
    public void typed_command_with_unknown_name_is_dispatch_error() {
        CommandType<Integer, Integer> subtract = CommandType.of("Subtract", Integer.class, Integer.class);
        assertThrows(DispatchException.class, () -> processor.process("c1", initial, 0, subtract, 2));
    }

    @Test
    public void throwing_handler_is_dispatch_error() {
        DispatchException e = assertThrows(DispatchException.class,
            () -> processor.process("c1", initial, 0, BREAK, "now"));
        assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
    }

    @Test
    public void failing_event_handler_aborts_whole_command() {
        DispatchException e = assertThrows(DispatchException.class,
            () -> processor.process("c1", initial, 0, EXPLODE, "boom"));
        assertThat(e.getMessage(), containsString("Exploded"));
        assertEquals(0, initial.getValue());
    }

    @Test
    public void unknown_event_cannot_be_applied() {
        assertThrows(DispatchException.class, () -> processor.applyEvent(initial, "Unregistered", "x"));
    }
}
