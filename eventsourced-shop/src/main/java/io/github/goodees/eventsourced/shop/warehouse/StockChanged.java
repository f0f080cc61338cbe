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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

/**
 * Stock of a product changed by quantity.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableStockChanged.class)
public interface StockChanged {
    String getProductId();

    int getQuantity();

    static StockChanged of(String productId, int quantity) {
        return new Builder().productId(productId).quantity(quantity).build();
    }

    class Builder extends ImmutableStockChanged.Builder {

    }
}
