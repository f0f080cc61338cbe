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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * State of the cart entity.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableCart.class)
public interface Cart {
    String getUserId();

    List<LineItem> getItems();

    default Optional<LineItem> findItem(String productId) {
        return getItems().stream().filter(i -> i.getProductId().equals(productId)).findFirst();
    }

    static Cart empty(String userId) {
        return new Builder().userId(userId).build();
    }

    class Builder extends ImmutableCart.Builder {

    }
}
