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

import java.util.Objects;

/**
 * Inbound request for an entity, as handed over by a transport. Commands are never persisted.
 */
public final class Command {
    private final String entityId;
    private final String name;
    private final Object payload;

    public Command(String entityId, String name, Object payload) {
        this.entityId = Objects.requireNonNull(entityId, "Entity id must be specified");
        this.name = Objects.requireNonNull(name, "Command name must be specified");
        this.payload = Objects.requireNonNull(payload, "Command payload must be specified");
    }

    public String getEntityId() {
        return entityId;
    }

    public String getName() {
        return name;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "Command[entity=" + entityId + ", name=" + name + ", payload=" + payload + "]";
    }
}
