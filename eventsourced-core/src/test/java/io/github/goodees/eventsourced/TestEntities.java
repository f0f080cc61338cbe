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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Counter entity used across the tests. Its state remembers every applied event, so that order of folding is visible.
 */
public final class TestEntities {
    public static final CommandType<Integer, Integer> ADD = CommandType.of("Add", Integer.class, Integer.class);
    public static final CommandType<Integer, Integer> ADD_AND_DOUBLE =
            CommandType.of("AddAndDouble", Integer.class, Integer.class);
    public static final CommandType<String, Integer> GET = CommandType.of("Get", String.class, Integer.class);
    public static final CommandType<Integer, Integer> ADD_THEN_REJECT =
            CommandType.of("AddThenReject", Integer.class, Integer.class);
    public static final CommandType<String, Integer> REJECT_TWICE =
            CommandType.of("RejectTwice", String.class, Integer.class);
    public static final CommandType<String, Integer> BREAK = CommandType.of("Break", String.class, Integer.class);
    public static final CommandType<String, Integer> EMIT_UNKNOWN =
            CommandType.of("EmitUnknown", String.class, Integer.class);
    public static final CommandType<String, Integer> EXPLODE = CommandType.of("Explode", String.class, Integer.class);
    public static final CommandType<String, Integer> LEAK_CONTEXT =
            CommandType.of("LeakContext", String.class, Integer.class);
    public static final CommandType<String, Integer> OVERFLOW = CommandType.of("Overflow", String.class, Integer.class);
    public static final CommandType<Integer, Integer> SLEEP = CommandType.of("Sleep", Integer.class, Integer.class);
    // boxed response never is an instance of the primitive class
    public static final CommandType<String, Integer> WRONG_RESPONSE =
            CommandType.of("WrongResponse", String.class, int.class);

    public static final EventType<Integer> ADDED = EventType.of("Added", Integer.class);
    public static final EventType<String> DOUBLED = EventType.of("Doubled", String.class);
    public static final EventType<String> EXPLODED = EventType.of("Exploded", String.class);
    public static final EventType<String> UNREGISTERED = EventType.of("Unregistered", String.class);

    public static final AtomicReference<CommandContext> leakedContext = new AtomicReference<>();

    private TestEntities() {
    }

    public static EntityDescriptor<Counter> counter() {
        return counter(EntityConfiguration.builder("counter").build());
    }

    public static EntityDescriptor<Counter> counter(EntityConfiguration configuration) {
        return EntityDescriptor.builder(Counter.class)
                .configuration(configuration)
                .initialState(Counter::new)
                .onCommand(ADD, (delta, state, ctx) -> {
                    ctx.emit(ADDED, delta);
                    return state.getValue() + delta;
                })
                .onCommand(ADD_AND_DOUBLE, (delta, state, ctx) -> {
                    ctx.emit(ADDED, delta);
                    ctx.emit(DOUBLED, "x2");
                    return (state.getValue() + delta) * 2;
                })
                .onCommand(GET, (request, state, ctx) -> state.getValue())
                .onCommand(ADD_THEN_REJECT, (delta, state, ctx) -> {
                    ctx.emit(ADDED, delta);
                    ctx.fail("Rejected " + delta);
                    ctx.emit(ADDED, delta);
                    return null;
                })
                .onCommand(REJECT_TWICE, (request, state, ctx) -> {
                    ctx.fail("first");
                    ctx.fail("second");
                    return null;
                })
                .onCommand(BREAK, (request, state, ctx) -> {
                    throw new IllegalArgumentException("Broken " + request);
                })
                .onCommand(EMIT_UNKNOWN, (request, state, ctx) -> {
                    ctx.emit(UNREGISTERED, request);
                    return 0;
                })
                .onCommand(EXPLODE, (request, state, ctx) -> {
                    ctx.emit(ADDED, 1);
                    ctx.emit(EXPLODED, request);
                    return 0;
                })
                .onCommand(LEAK_CONTEXT, (request, state, ctx) -> {
                    leakedContext.set(ctx);
                    return state.getValue();
                })
                .onCommand(SLEEP, (millis, state, ctx) -> {
                    LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(millis));
                    return state.getValue();
                })
                .onCommand(OVERFLOW, (request, state, ctx) -> {
                    ctx.emit(ADDED, 1);
                    throw new StackOverflowError(request);
                })
                .onCommand(WRONG_RESPONSE, (request, state, ctx) -> 42)
                .onEvent(ADDED, (delta, state) -> state.apply("Added", state.getValue() + delta))
                .onEvent(DOUBLED, (label, state) -> state.apply("Doubled", state.getValue() * 2))
                .onEvent(EXPLODED, (label, state) -> {
                    throw new IllegalStateException("Cannot apply " + label);
                })
                .build();
    }

    /**
     * Immutable state of the counter.
     */
    public static final class Counter {
        private final String id;
        private final int value;
        private final List<String> applied;

        public Counter(String id) {
            this(id, 0, Collections.emptyList());
        }

        Counter(String id, int value, List<String> applied) {
            this.id = id;
            this.value = value;
            this.applied = applied;
        }

        public String getId() {
            return id;
        }

        public int getValue() {
            return value;
        }

        public List<String> getApplied() {
            return applied;
        }

        Counter apply(String eventName, int newValue) {
            List<String> newApplied = new ArrayList<>(applied);
            newApplied.add(eventName);
            return new Counter(id, newValue, Collections.unmodifiableList(newApplied));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Counter counter = (Counter) o;
            return value == counter.value && id.equals(counter.id) && applied.equals(counter.applied);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, value, applied);
        }

        @Override
        public String toString() {
            return "Counter{" + id + "=" + value + ", applied=" + applied + '}';
        }
    }
}
