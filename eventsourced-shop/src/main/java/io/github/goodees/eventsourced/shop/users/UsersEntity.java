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

import io.github.goodees.eventsourced.CommandContext;
import io.github.goodees.eventsourced.CommandType;
import io.github.goodees.eventsourced.EntityConfiguration;
import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User account. Order ids are only appended by {@code OrderAdded}, never by the command handler.
 */
public final class UsersEntity {
    private static final Logger logger = LoggerFactory.getLogger(UsersEntity.class);

    public static final String ENTITY_TYPE = "users";

    public static final CommandType<NewUser, NewUser> ADD_USER = CommandType.of("AddUser", NewUser.class,
        NewUser.class);
    public static final CommandType<UserRequest, User> GET_USER_DETAILS =
            CommandType.of("GetUserDetails", UserRequest.class, User.class);
    public static final CommandType<UserOrder, UserOrder> UPDATE_USER_ORDERS =
            CommandType.of("UpdateUserOrders", UserOrder.class, UserOrder.class);

    public static final EventType<UserCreated> USER_CREATED = EventType.of("UserCreated", UserCreated.class);
    public static final EventType<OrderAdded> ORDER_ADDED = EventType.of("OrderAdded", OrderAdded.class);

    private UsersEntity() {
    }

    public static EntityDescriptor<User> descriptor() {
        return EntityDescriptor.builder(User.class)
                .configuration(EntityConfiguration.builder(ENTITY_TYPE).build())
                .initialState(User::unknown)
                .onCommand(ADD_USER, UsersEntity::addUser)
                .onCommand(GET_USER_DETAILS, (request, user, ctx) -> user)
                .onCommand(UPDATE_USER_ORDERS, UsersEntity::updateUserOrders)
                .onEvent(USER_CREATED, UsersEntity::userCreated)
                .onEvent(ORDER_ADDED, UsersEntity::orderAdded)
                .build();
    }

    static NewUser addUser(NewUser user, User current, CommandContext ctx) {
        logger.info("Creating a new user for {}", user.getId());
        ctx.emit(USER_CREATED, UserCreated.of(user));
        return user;
    }

    static UserOrder updateUserOrders(UserOrder request, User user, CommandContext ctx) {
        if (!user.isCreated()) {
            ctx.fail("User " + request.getId() + " does not exist");
            return null;
        }
        logger.info("Adding order {} to {}", request.getOrderId(), request.getId());
        ctx.emit(ORDER_ADDED, OrderAdded.of(request));
        return request;
    }

    static User userCreated(UserCreated event, User user) {
        NewUser created = event.getUser();
        return new User.Builder().from(user)
                .id(created.getId())
                .name(created.getName())
                .emailAddress(created.getEmailAddress())
                .created(true)
                .build();
    }

    static User orderAdded(OrderAdded event, User user) {
        return new User.Builder().from(user).addOrderId(event.getOrder().getOrderId()).build();
    }
}
