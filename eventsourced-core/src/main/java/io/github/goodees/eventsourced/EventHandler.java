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
 * Folds an event into the state. Must be a pure function: it is called both during command processing and during
 * replay of persisted events, and must give the same result in both cases. It must not perform I/O.
 *
 * @param <S> type of state
 * @param <P> type of event payload
 */
@FunctionalInterface
public interface EventHandler<S, P> {

    /**
     * Compute the state after the event.
     * @param event event payload
     * @param state state before the event
     * @return state after the event
     */
    S apply(P event, S state);
}
