package io.github.goodees.eventsourced.shop.cart;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shopping cart. Items of the same product are merged.
 */
public final class CartEntity {
    private static final Logger logger = LoggerFactory.getLogger(CartEntity.class);

    public static final String ENTITY_TYPE = "cart";

    public static final CommandType<LineItem, LineItem> ADD_ITEM =
            CommandType.of("AddItem", LineItem.class, LineItem.class);
    public static final CommandType<RemoveLineItem, LineItem> REMOVE_ITEM =
            CommandType.of("RemoveItem", RemoveLineItem.class, LineItem.class);
    public static final CommandType<GetShoppingCart, Cart> GET_CART =
            CommandType.of("GetCart", GetShoppingCart.class, Cart.class);

    public static final EventType<ItemAdded> ITEM_ADDED = EventType.of("ItemAdded", ItemAdded.class);
    public static final EventType<ItemRemoved> ITEM_REMOVED = EventType.of("ItemRemoved", ItemRemoved.class);

    private CartEntity() {
    }

    public static EntityDescriptor<Cart> descriptor() {
        return EntityDescriptor.builder(Cart.class)
                .configuration(EntityConfiguration.builder(ENTITY_TYPE).build())
                .initialState(Cart::empty)
                .onCommand(ADD_ITEM, CartEntity::addItem)
                .onCommand(REMOVE_ITEM, CartEntity::removeItem)
                .onCommand(GET_CART, (request, cart, ctx) -> cart)
                .onEvent(ITEM_ADDED, CartEntity::itemAdded)
                .onEvent(ITEM_REMOVED, CartEntity::itemRemoved)
                .build();
    }

    static LineItem addItem(LineItem item, Cart cart, CommandContext ctx) {
        if (item.getQuantity() <= 0) {
            ctx.fail("Quantity of item " + item.getProductId() + " must be positive, was " + item.getQuantity());
            return null;
        }
        logger.debug("Adding {} of {} to cart of {}", item.getQuantity(), item.getProductId(), ctx.entityId());
        ctx.emit(ITEM_ADDED, ItemAdded.of(item));
        return item;
    }

    static LineItem removeItem(RemoveLineItem request, Cart cart, CommandContext ctx) {
        Optional<LineItem> item = cart.findItem(request.getProductId());
        if (!item.isPresent()) {
            ctx.fail("Cannot remove item " + request.getProductId() + " because it is not in the cart");
            return null;
        }
        ctx.emit(ITEM_REMOVED, ItemRemoved.of(request.getProductId()));
        return item.get();
    }

    static Cart itemAdded(ItemAdded event, Cart cart) {
        LineItem added = event.getItem();
        List<LineItem> items = new ArrayList<>(cart.getItems());
        Optional<LineItem> existing = cart.findItem(added.getProductId());
        if (existing.isPresent()) {
            items.set(items.indexOf(existing.get()), LineItem.builder().from(existing.get())
                    .quantity(existing.get().getQuantity() + added.getQuantity())
                    .build());
        } else {
            items.add(added);
        }
        return new Cart.Builder().from(cart).items(items).build();
    }

    static Cart itemRemoved(ItemRemoved event, Cart cart) {
        List<LineItem> items = new ArrayList<>(cart.getItems());
        items.removeIf(i -> i.getProductId().equals(event.getProductId()));
        return new Cart.Builder().from(cart).items(items).build();
    }
}
