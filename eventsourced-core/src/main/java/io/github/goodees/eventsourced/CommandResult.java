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
import java.util.Optional;

/**
 * Outcome of processing a command: either the response, the emitted events and the new state, or a domain failure. A
 * failed result carries the state and revision the command started with.
 *
 * @param <S> type of state
 * @param <R> type of response
 */
public final class CommandResult<S, R> {
    private final R response;
    private final List<Event<?>> events;
    private final S state;
    private final long revision;
    private final String failure;

    private CommandResult(R response, List<Event<?>> events, S state, long revision, String failure) {
        this.response = response;
        this.events = events;
        this.state = state;
        this.revision = revision;
        this.failure = failure;
    }

    public static <S, R> CommandResult<S, R> success(R response, List<? extends Event<?>> events, S state,
            long revision) {
        return new CommandResult<>(response, Collections.unmodifiableList(new ArrayList<>(events)), state, revision,
                null);
    }

    public static <S, R> CommandResult<S, R> failure(String message, S state, long revision) {
        return new CommandResult<>(null, Collections.emptyList(), state, revision, message);
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Value returned by the command handler, independent of events and state.
     * @return the response, null when the command failed or the handler returned nothing
     */
    public R getResponse() {
        return response;
    }

    /**
     * Events emitted by the command, in emission order. Empty for failed commands and queries.
     * @return read-only list of events
     */
    public List<Event<?>> getEvents() {
        return events;
    }

    /**
     * State after all events were folded.
     * @return the state
     */
    public S getState() {
        return state;
    }

    /**
     * Revision after the events were applied.
     * @return the revision
     */
    public long getRevision() {
        return revision;
    }

    @Override
    public String toString() {
        if (isSuccessful()) {
            return "CommandResult{response=" + response + ", events=" + events + ", revision=" + revision + '}';
        } else {
            return "CommandResult{failure=" + failure + ", revision=" + revision + '}';
        }
    }
}
