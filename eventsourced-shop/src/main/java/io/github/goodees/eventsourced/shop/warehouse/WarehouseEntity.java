package io.github.goodees.eventsourced.shop.warehouse;

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
 * Single product in the warehouse with its stock level.
 */
public final class WarehouseEntity {
    private static final Logger logger = LoggerFactory.getLogger(WarehouseEntity.class);

    public static final String ENTITY_TYPE = "warehouse";

    public static final CommandType<Product, Product> RECEIVE_PRODUCT =
            CommandType.of("ReceiveProduct", Product.class, Product.class);
    public static final CommandType<StockUpdate, Product> UPDATE_STOCK =
            CommandType.of("UpdateStock", StockUpdate.class, Product.class);
    public static final CommandType<ProductRequest, Product> GET_PRODUCT_DETAILS =
            CommandType.of("GetProductDetails", ProductRequest.class, Product.class);

    public static final EventType<ProductReceived> PRODUCT_RECEIVED =
            EventType.of("ProductReceived", ProductReceived.class);
    public static final EventType<StockChanged> STOCK_CHANGED = EventType.of("StockChanged", StockChanged.class);

    private WarehouseEntity() {
    }

    public static EntityDescriptor<Stock> descriptor() {
        return EntityDescriptor.builder(Stock.class)
                .configuration(EntityConfiguration.builder(ENTITY_TYPE).build())
                .initialState(productId -> Stock.empty())
                .onCommand(RECEIVE_PRODUCT, WarehouseEntity::receiveProduct)
                .onCommand(UPDATE_STOCK, WarehouseEntity::updateStock)
                .onCommand(GET_PRODUCT_DETAILS, WarehouseEntity::getProductDetails)
                .onEvent(PRODUCT_RECEIVED, WarehouseEntity::productReceived)
                .onEvent(STOCK_CHANGED, WarehouseEntity::stockChanged)
                .build();
    }

    static Product receiveProduct(Product product, Stock stock, CommandContext ctx) {
        logger.info("Receiving product {} ({})", product.getId(), product.getName());
        ctx.emit(PRODUCT_RECEIVED, ProductReceived.of(product));
        return product;
    }

    static Product updateStock(StockUpdate update, Stock stock, CommandContext ctx) {
        Optional<Product> product = stock.getProduct();
        if (!product.isPresent()) {
            ctx.fail("Product " + update.getId() + " was not received");
            return null;
        }
        int newStock = product.get().getStock() + update.getStock();
        if (newStock < 0) {
            ctx.fail("Stock of " + update.getId() + " cannot go below zero, " + product.get().getStock()
                    + " in stock");
            return null;
        }
        logger.debug("Changing stock of {} by {}", update.getId(), update.getStock());
        ctx.emit(STOCK_CHANGED, StockChanged.of(update.getId(), update.getStock()));
        return withStock(product.get(), newStock);
    }

    static Product getProductDetails(ProductRequest request, Stock stock, CommandContext ctx) {
        if (!stock.getProduct().isPresent()) {
            ctx.fail("Product " + request.getId() + " was not received");
            return null;
        }
        return stock.getProduct().get();
    }

    static Stock productReceived(ProductReceived event, Stock stock) {
        return new Stock.Builder().product(event.getProduct()).build();
    }

    static Stock stockChanged(StockChanged event, Stock stock) {
        Product product = stock.getProduct()
                .orElseThrow(() -> new IllegalStateException("Stock of unknown product " + event.getProductId()
                        + " changed"));
        return new Stock.Builder().product(withStock(product, product.getStock() + event.getQuantity())).build();
    }

    private static Product withStock(Product product, int stock) {
        return Product.builder().from(product).stock(stock).build();
    }
}
