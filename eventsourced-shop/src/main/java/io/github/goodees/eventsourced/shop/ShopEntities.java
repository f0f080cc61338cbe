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
import io.github.goodees.eventsourced.dispatch.DispatcherConfiguration;
import io.github.goodees.eventsourced.gateway.EntityGateway;
import io.github.goodees.eventsourced.runtime.EntityRuntime;
import io.github.goodees.eventsourced.runtime.Persistence;
import io.github.goodees.eventsourced.shop.cart.CartEntity;
import io.github.goodees.eventsourced.shop.orders.OrdersEntity;
import io.github.goodees.eventsourced.shop.users.UsersEntity;
import io.github.goodees.eventsourced.shop.warehouse.WarehouseEntity;
import io.github.goodees.eventsourced.store.JacksonSerialization;
import io.github.goodees.eventsourced.store.inmemory.InMemoryEventStore;
import io.github.goodees.eventsourced.store.inmemory.InMemorySnapshotStoreWithSerialization;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Registers all entities of the shop into a gateway.
 */
public final class ShopEntities {

    private ShopEntities() {
    }

    public static List<EntityDescriptor<?>> descriptors() {
        return Arrays.asList(CartEntity.descriptor(), OrdersEntity.descriptor(), UsersEntity.descriptor(),
            WarehouseEntity.descriptor());
    }

    /**
     * Create a runtime for every shop entity and register it.
     * @param gateway gateway to register into
     * @param persistenceFactory creates the stores of every entity type
     * @param dispatcherConfiguration thread pools of the runtimes
     * @return the gateway
     */
    public static EntityGateway register(EntityGateway gateway,
            Function<EntityDescriptor<?>, Persistence> persistenceFactory,
            DispatcherConfiguration dispatcherConfiguration) {
        for (EntityDescriptor<?> descriptor : descriptors()) {
            gateway.register(runtime(descriptor, persistenceFactory.apply(descriptor), dispatcherConfiguration));
        }
        return gateway;
    }

    private static <S> EntityRuntime<S> runtime(EntityDescriptor<S> descriptor, Persistence persistence,
            DispatcherConfiguration dispatcherConfiguration) {
        return new EntityRuntime<>(descriptor, persistence, dispatcherConfiguration);
    }

    /**
     * In-memory stores, with snapshots serialized to JSON.
     * @param descriptor the entity
     * @return new persistence for the entity
     */
    public static <S> Persistence inMemoryJson(EntityDescriptor<S> descriptor) {
        return Persistence.of(new InMemoryEventStore(),
            new InMemorySnapshotStoreWithSerialization<>(new JacksonSerialization<>(descriptor.getStateType())));
    }
}
