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

import java.math.BigDecimal;
import java.util.List;

@Value.Immutable
@JsonDeserialize(as = ImmutableProduct.class)
public interface Product {
    String getId();

    String getName();

    String getDescription();

    String getImageUrl();

    BigDecimal getPrice();

    int getStock();

    List<String> getTags();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableProduct.Builder {

    }
}
