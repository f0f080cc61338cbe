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
 * The command was rejected by its handler via {@link CommandContext#fail(String)}. Not fatal, the entity stays usable
 * and its state is unchanged.
 */
public class CommandFailedException extends Exception {
    private final String entityId;
    private final String commandName;

    public CommandFailedException(String entityId, String commandName, String message) {
        super(message);
        this.entityId = entityId;
        this.commandName = commandName;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCommandName() {
        return commandName;
    }
}
