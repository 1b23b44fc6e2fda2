/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.catchup.domain;

import java.util.Objects;

public class OrderPlaced implements OrderEvent {

    private String orderId;
    private String customerId;
    private long amountInCents;

    @SuppressWarnings("unused")
    OrderPlaced() {
    }

    public OrderPlaced(String orderId, String customerId, long amountInCents) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.amountInCents = amountInCents;
    }

    @Override
    public String getOrderId() {
        return orderId;
    }

    public String getCustomerId() {
        return customerId;
    }

    public long getAmountInCents() {
        return amountInCents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderPlaced)) return false;
        OrderPlaced that = (OrderPlaced) o;
        return amountInCents == that.amountInCents && Objects.equals(orderId, that.orderId) && Objects.equals(customerId, that.customerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, customerId, amountInCents);
    }

    @Override
    public String toString() {
        return "OrderPlaced{" +
                "orderId='" + orderId + '\'' +
                ", customerId='" + customerId + '\'' +
                ", amountInCents=" + amountInCents +
                '}';
    }
}
