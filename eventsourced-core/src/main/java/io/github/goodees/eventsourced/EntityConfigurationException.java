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
 * Entity is misconfigured. Thrown while the entity is being registered, so that it never starts serving.
 */
public class EntityConfigurationException extends RuntimeException {

    public EntityConfigurationException(String message) {
        super(message);
    }

    public static EntityConfigurationException duplicateCommand(String entityType, String commandName) {
        return new EntityConfigurationException("Entity " + entityType + " registers command " + commandName
                + " more than once");
    }

    public static EntityConfigurationException duplicateEvent(String entityType, String eventName) {
        return new EntityConfigurationException("Entity " + entityType + " registers event " + eventName
                + " more than once");
    }
}
