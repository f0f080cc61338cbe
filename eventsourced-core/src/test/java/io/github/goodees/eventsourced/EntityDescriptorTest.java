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

import io.github.goodees.eventsourced.TestEntities.Counter;
import io.github.goodees.eventsourced.engine.CommandProcessor;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.goodees.eventsourced.TestEntities.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class EntityDescriptorTest {
    private final EntityConfiguration config = EntityConfiguration.builder("counter").build();

    @Test
    public void handlers_are_resolved_by_name() {
        EntityDescriptor<Counter> descriptor = TestEntities.counter();
        assertEquals("counter", descriptor.getEntityType());
        assertEquals(Counter.class, descriptor.getStateType());
        assertTrue(descriptor.commandHandler("Add").isPresent());
        assertFalse(descriptor.commandHandler("Added").isPresent());
        assertTrue(descriptor.eventHandler("Added").isPresent());
        assertFalse(descriptor.eventHandler("Unregistered").isPresent());
        assertThat(descriptor.getEventNames(), containsInAnyOrder("Added", "Doubled", "Exploded"));
        assertEquals(new Counter("c7"), descriptor.initialState("c7"));
    }

    @Test
    public void duplicate_command_is_rejected() {
        EntityDescriptor.Builder<Counter> builder = EntityDescriptor.builder(Counter.class)
                .configuration(config)
                .onCommand(GET, (request, state, ctx) -> 0);
        EntityConfigurationException e = assertThrows(EntityConfigurationException.class,
            () -> builder.onCommand(CommandType.of("Get", Integer.class, String.class), (request, state, ctx) -> ""));
        assertThat(e.getMessage(), containsString("Get"));
    }

    @Test
    public void duplicate_event_is_rejected() {
        EntityDescriptor.Builder<Counter> builder = EntityDescriptor.builder(Counter.class)
                .onEvent(ADDED, (delta, state) -> state);
        assertThrows(EntityConfigurationException.class, () -> builder.onEvent(ADDED, (delta, state) -> state));
    }

    @Test
    public void incomplete_descriptor_is_rejected() {
        assertThrows(EntityConfigurationException.class,
            () -> EntityDescriptor.builder(Counter.class).initialState(Counter::new).onCommand(GET,
                (request, state, ctx) -> 0).build());
        assertThrows(EntityConfigurationException.class,
            () -> EntityDescriptor.builder(Counter.class).configuration(config).onCommand(GET,
                (request, state, ctx) -> 0).build());
        assertThrows(EntityConfigurationException.class,
            () -> EntityDescriptor.builder(Counter.class).configuration(config).initialState(Counter::new).build());
    }

    @Test
    public void null_initial_state_is_rejected() {
        EntityDescriptor<Counter> descriptor = EntityDescriptor.builder(Counter.class)
                .configuration(config)
                .initialState(id -> null)
                .onCommand(GET, (request, state, ctx) -> 0)
                .build();
        assertThrows(IllegalStateException.class, () -> descriptor.initialState("c1"));
    }

    @Test
    public void read_only_view_is_passed_to_command_handlers() {
        CommandType<String, String> put = CommandType.of("Put", String.class, String.class);
        EventType<String> stored = EventType.of("Stored", String.class);
        EntityDescriptor<Tags> descriptor = EntityDescriptor.builder(Tags.class)
                .configuration(config)
                .initialState(id -> new Tags(new ArrayList<>()))
                .readOnlyView(Tags::readOnly)
                .onCommand(put, (key, state, ctx) -> {
                    state.values.add(key);
                    return key;
                })
                .onEvent(stored, (key, state) -> state)
                .build();
        Tags state = new Tags(new ArrayList<>());
        DispatchException e = assertThrows(DispatchException.class,
            () -> new CommandProcessor<>(descriptor).process("t1", state, 0, put, "k"));
        assertThat(e.getCause(), instanceOf(UnsupportedOperationException.class));
        assertTrue(state.values.isEmpty());
    }

    @Test
    public void typed_command_must_match_registered_type() {
        EntityDescriptor<Counter> descriptor = TestEntities.counter();
        descriptor.verifyCommandType(ADD);
        assertThrows(DispatchException.class,
            () -> descriptor.verifyCommandType(CommandType.of("Add", Integer.class, String.class)));
        assertThrows(DispatchException.class,
            () -> descriptor.verifyCommandType(CommandType.of("Add", String.class, Integer.class)));
        assertThrows(DispatchException.class,
            () -> descriptor.verifyCommandType(CommandType.of("Subtract", Integer.class, Integer.class)));
    }

    /**
     * Mutable state, that hands out a read-only view of itself.
     */
    static final class Tags {
        final List<String> values;

        Tags(List<String> values) {
            this.values = values;
        }

        Tags readOnly() {
            return new Tags(Collections.unmodifiableList(values));
        }
    }
}
