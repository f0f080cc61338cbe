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

/**
 * Reference of an order placed by a user. Details of the order are held by the orders entity.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableUserOrder.class)
public interface UserOrder {
    String getId();

    String getOrderId();

    static UserOrder of(String id, String orderId) {
        return new Builder().id(id).orderId(orderId).build();
    }

    class Builder extends ImmutableUserOrder.Builder {

    }
}
