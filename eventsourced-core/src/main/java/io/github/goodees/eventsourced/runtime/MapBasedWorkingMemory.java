package io.github.goodees.eventsourced.runtime;

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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

public class MapBasedWorkingMemory<S> implements WorkingMemory<S> {
    private final ConcurrentMap<String, EntityInstance<S>> map = new ConcurrentHashMap<>();

    @Override
    public EntityInstance<S> lookup(String id, Function<String, EntityInstance<S>> instantiator) {
        return map.computeIfAbsent(id, instantiator);
    }

    @Override
    public void remove(String id) {
        map.remove(id);
    }

    @Override
    public boolean contains(String id) {
        return map.containsKey(id);
    }
}
