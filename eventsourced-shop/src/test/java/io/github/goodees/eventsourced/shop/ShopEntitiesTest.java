package io.github.goodees.eventsourced.shop;

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

import io.github.goodees.eventsourced.EntityDescriptor;
import io.github.goodees.eventsourced.dispatch.SimpleDispatcherConfiguration;
import io.github.goodees.eventsourced.gateway.EntityGateway;
import io.github.goodees.eventsourced.gateway.Reply;
import io.github.goodees.eventsourced.runtime.EntityRuntime;
import io.github.goodees.eventsourced.shop.cart.Cart;
import io.github.goodees.eventsourced.shop.cart.CartEntity;
import io.github.goodees.eventsourced.shop.cart.GetShoppingCart;
import io.github.goodees.eventsourced.shop.cart.LineItem;
import io.github.goodees.eventsourced.shop.cart.RemoveLineItem;
import io.github.goodees.eventsourced.shop.users.NewUser;
import io.github.goodees.eventsourced.shop.users.User;
import io.github.goodees.eventsourced.shop.users.UserOrder;
import io.github.goodees.eventsourced.shop.users.UserRequest;
import io.github.goodees.eventsourced.shop.users.UsersEntity;
import io.github.goodees.eventsourced.shop.warehouse.Product;
import io.github.goodees.eventsourced.shop.warehouse.Stock;
import io.github.goodees.eventsourced.shop.warehouse.WarehouseEntity;
import io.github.goodees.eventsourced.store.JacksonSerialization;
import io.github.goodees.eventsourced.store.inmemory.InMemorySnapshotStoreWithSerialization;
import org.junit.After;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class ShopEntitiesTest {
    private final SimpleDispatcherConfiguration dispatcherConfiguration =
            SimpleDispatcherConfiguration.withThreads("shop", 2);
    private final EntityGateway gateway = ShopEntities.register(new EntityGateway(), ShopEntities::inMemoryJson,
        dispatcherConfiguration);

    private final LineItem mat = LineItem.builder().userId("retgits").productId("2").name("Mat").quantity(3).build();

    @After
    public void tearDown() {
        dispatcherConfiguration.shutdown();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(2, TimeUnit.SECONDS);
    }

    @Test
    public void all_entities_are_registered() {
        assertThat(gateway.getEntityTypes(), containsInAnyOrder("cart", "orders", "users", "warehouse"));
        assertEquals(4, ShopEntities.descriptors().size());
    }

    @Test
    public void cart_is_served_through_gateway() throws Exception {
        assertEquals(Reply.ok(mat), await(gateway.handle("cart", "retgits", "AddItem", mat)));

        Reply cart = await(gateway.handle("cart", "retgits", "GetCart", GetShoppingCart.of("retgits")));
        assertTrue(cart.isOk());
        assertEquals(Arrays.asList(mat), ((Cart) cart.getResponse()).getItems());

        Reply missing = await(gateway.handle("cart", "retgits", "RemoveItem", RemoveLineItem.of("retgits", "9")));
        assertEquals(Reply.Status.FAILED, missing.getStatus());
        assertEquals("Cannot remove item 9 because it is not in the cart", missing.getMessage());
    }

    @Test
    public void entities_of_different_types_are_independent() throws Exception {
        await(gateway.handle("users", "1", "AddUser", NewUser.of("1", "retgits", "retgits@example.com")));
        await(gateway.handle("users", "1", "UpdateUserOrders", UserOrder.of("1", "4557")));
        await(gateway.handle("cart", "1", "AddItem", mat));

        User user = (User) await(gateway.handle("users", "1", "GetUserDetails", UserRequest.of("1"))).getResponse();
        assertThat(user.getOrderIds(), contains("4557"));
        assertEquals(Reply.Status.ERROR, await(gateway.handle("users", "1", "AddItem", mat)).getStatus());
    }

    @Test
    public void state_is_recovered_after_passivation() throws Exception {
        EntityDescriptor<Cart> descriptor = CartEntity.descriptor();
        EntityRuntime<Cart> carts = new EntityRuntime<>(descriptor, ShopEntities.inMemoryJson(descriptor),
                dispatcherConfiguration);
        await(carts.handleCommand("retgits", CartEntity.ADD_ITEM, mat));
        await(carts.handleCommand("retgits", CartEntity.ADD_ITEM, mat));
        Cart live = await(carts.getState("retgits"));

        await(carts.passivate("retgits"));
        assertFalse(carts.isActive("retgits"));
        Cart recovered = await(carts.getState("retgits"));
        assertEquals(live, recovered);
        assertEquals(6, recovered.findItem("2").get().getQuantity());
    }

    @Test
    public void state_survives_json_snapshot() {
        Cart cart = new Cart.Builder().userId("retgits").addItem(mat).build();
        assertEquals(cart, roundTrip(CartEntity.descriptor(), cart));

        User user = new User.Builder().id("1").name("retgits").created(true).addOrderId("4557").build();
        assertEquals(user, roundTrip(UsersEntity.descriptor(), user));
        assertEquals(User.unknown("2"), roundTrip(UsersEntity.descriptor(), User.unknown("2")));

        Product product = Product.builder().id("5c61f497e5fdadefe84ff9b9").name("Yoga Mat")
                .description("Limited Edition Mat").imageUrl("/static/images/yogamat_square.jpg")
                .price(new BigDecimal("62.5")).stock(5).addTag("mat").build();
        Stock stock = new Stock.Builder().product(product).build();
        assertEquals(stock, roundTrip(WarehouseEntity.descriptor(), stock));
        assertEquals(Optional.empty(), ((Stock) roundTrip(WarehouseEntity.descriptor(), Stock.empty())).getProduct());
    }

    private static <S> Object roundTrip(EntityDescriptor<S> descriptor, S state) {
        InMemorySnapshotStoreWithSerialization<S> store =
                new InMemorySnapshotStoreWithSerialization<>(new JacksonSerialization<>(descriptor.getStateType()));
        assertTrue(store.store("shop/1", 1, state));
        return store.readSnapshot("shop/1").get().getState();
    }
}
