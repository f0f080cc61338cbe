package io.github.goodees.eventsourced.shop.orders;

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
 * State of the orders entity. User id is known once the first order was added.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableOrderHistory.class)
public interface OrderHistory {
    Optional<String> getUserId();

    List<Order> getOrders();

    default Optional<Order> findOrder(String orderId) {
        return getOrders().stream().filter(o -> o.getOrderId().equals(orderId)).findFirst();
    }

    static OrderHistory empty() {
        return new Builder().build();
    }

    class Builder extends ImmutableOrderHistory.Builder {

    }
}
