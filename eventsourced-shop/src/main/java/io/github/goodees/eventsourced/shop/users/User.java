package io.github.goodees.eventsourced.shop.users;

/*-
 * #%L
 * eventsourced-shop
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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * State of the users entity.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableUser.class)
public interface User {
    String getId();

    Optional<String> getName();

    Optional<String> getEmailAddress();

    List<String> getOrderIds();

    /**
     * Whether the user was created by {@code AddUser}.
     * @return true if the user exists
     */
    @Value.Default
    default boolean isCreated() {
        return false;
    }

    static User unknown(String id) {
        return new Builder().id(id).build();
    }

    class Builder extends ImmutableUser.Builder {

    }
}
