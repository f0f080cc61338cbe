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

import io.github.goodees.eventsourced.CommandContext;
import io.github.goodees.eventsourced.CommandResult;
import io.github.goodees.eventsourced.DispatchException;
import io.github.goodees.eventsourced.TestEntities;
import io.github.goodees.eventsourced.TestEntities.Counter;
import org.junit.Test;

import static io.github.goodees.eventsourced.TestEntities.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class InvocationContextTest {
    private final CommandProcessor<Counter> processor = new CommandProcessor<>(TestEntities.counter());

    @Test
    public void context_describes_invocation() {
        InvocationContext ctx = new InvocationContext(TestEntities.counter(), "c1", "Add", 4);
        assertEquals("c1", ctx.entityId());
        assertEquals("Add", ctx.commandName());
        assertEquals(4, ctx.revision());
        assertFalse(ctx.isFailed());
    }

    @Test
    public void emit_after_fail_is_ignored() {
        InvocationContext ctx = new InvocationContext(TestEntities.counter(), "c1", "Add", 0);
        ctx.emit(ADDED, 1);
        ctx.fail("no");
        ctx.emit(ADDED, 2);
        assertTrue(ctx.isFailed());
        assertEquals("no", ctx.getFailure());
        assertThat(ctx.getEmitted(), empty());
    }

    @Test
    public void second_fail_is_rejected() {
        DispatchException e = assertThrows(DispatchException.class,
            () -> processor.process("c1", new Counter("c1"), 0, REJECT_TWICE, ""));
        assertThat(e.getCause(), instanceOf(IllegalStateException.class));
    }

    @Test
    public void emitting_unregistered_event_is_dispatch_error() {
        InvocationContext ctx = new InvocationContext(TestEntities.counter(), "c1", "EmitUnknown", 0);
        assertThrows(DispatchException.class, () -> ctx.emit(UNREGISTERED, "x"));
        assertThrows(DispatchException.class,
            () -> processor.process("c1", new Counter("c1"), 0, EMIT_UNKNOWN, "x"));
    }

    @Test
    public void context_cannot_be_used_after_invocation() {
        CommandResult<Counter, Integer> result = processor.process("c1", new Counter("c1"), 0, LEAK_CONTEXT, "");
        assertTrue(result.isSuccessful());
        CommandContext leaked = leakedContext.getAndSet(null);
        assertNotNull(leaked);
        assertThrows(IllegalStateException.class, () -> leaked.emit(ADDED, 1));
        assertThrows(IllegalStateException.class, () -> leaked.fail("late"));
    }
}
