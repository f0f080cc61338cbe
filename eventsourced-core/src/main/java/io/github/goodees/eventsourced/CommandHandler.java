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

/**
 * Handles a single type of command. Validates the command against current state and translates it into events, emitted
 * via the context. The state passed to the handler must not be modified, the only way to change it is emitting
 * an event.
 *
 * @param <S> type of state
 * @param <P> type of command payload
 * @param <R> type of response
 */
@FunctionalInterface
public interface CommandHandler<S, P, R> {

    /**
     * Handle the command.
     * @param command command payload
     * @param state read-only view of current state
     * @param context invocation context for emitting events or failing the command
     * @return the response for the caller, ignored if the command fails. May be null.
     * @throws Exception when handling breaks unexpectedly; it is reported as a {@link DispatchException}
     */
    R handle(P command, S state, CommandContext context) throws Exception;
}
