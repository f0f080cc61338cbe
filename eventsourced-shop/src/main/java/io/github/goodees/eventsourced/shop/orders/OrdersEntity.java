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

import io.github.goodees.eventsourced.CommandContext;
import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.EntityConfiguration;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Order history of a user.
 */
public final class OrdersEntity {
    private static final Logger logger = LoggerFactory.getLogger(OrdersEntity.class);

    public static final String ENTITY_TYPE = "orders";

    public static final CommandType<Order, Order> ADD_ORDER = CommandType.of("AddOrder", Order.class, Order.class);
    public static final CommandType<OrderRequest, Order> GET_ORDER_DETAILS =
            CommandType.of("GetOrderDetails", OrderRequest.class, Order.class);
    public static final CommandType<OrderHistoryRequest, OrderHistory> GET_ALL_ORDERS =
            CommandType.of("GetAllOrders", OrderHistoryRequest.class, OrderHistory.class);

    public static final EventType<OrderAdded> ORDER_ADDED = EventType.of("OrderAdded", OrderAdded.class);

    private OrdersEntity() {
    }

    public static EntityDescriptor<OrderHistory> descriptor() {
        return EntityDescriptor.builder(OrderHistory.class)
                .configuration(EntityConfiguration.builder(ENTITY_TYPE).build())
                .initialState(userId -> OrderHistory.empty())
                .onCommand(ADD_ORDER, OrdersEntity::addOrder)
                .onCommand(GET_ORDER_DETAILS, OrdersEntity::getOrderDetails)
                .onCommand(GET_ALL_ORDERS, OrdersEntity::getAllOrders)
                .onEvent(ORDER_ADDED, OrdersEntity::orderAdded)
                .build();
    }

    static Order addOrder(Order order, OrderHistory history, CommandContext ctx) {
        logger.info("Adding order {} to the history of user {}", order.getOrderId(), order.getUserId());
        ctx.emit(ORDER_ADDED, OrderAdded.of(order));
        return order;
    }

    static Order getOrderDetails(OrderRequest request, OrderHistory history, CommandContext ctx) {
        Optional<Order> found = history.findOrder(request.getOrderId());
        if (!found.isPresent()) {
            ctx.fail("Unable to find " + request.getOrderId() + " for user " + request.getUserId());
            return null;
        }
        return found.get();
    }

    static OrderHistory getAllOrders(OrderHistoryRequest request, OrderHistory history, CommandContext ctx) {
        logger.debug("Getting all orders for {}", request.getUserId());
        return history;
    }

    static OrderHistory orderAdded(OrderAdded event, OrderHistory history) {
        Order order = event.getOrder();
        return new OrderHistory.Builder().from(history)
                .userId(history.getUserId().orElse(order.getUserId()))
                .addOrder(order)
                .build();
    }
}
