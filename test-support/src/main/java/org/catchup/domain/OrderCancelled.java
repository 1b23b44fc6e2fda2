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

public class OrderCancelled implements OrderEvent {

    private String orderId;
    private String reason;

    @SuppressWarnings("unused")
    OrderCancelled() {
    }

    public OrderCancelled(String orderId, String reason) {
        this.orderId = orderId;
        this.reason = reason;
    }

    @Override
    public String getOrderId() {
        return orderId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderCancelled)) return false;
        OrderCancelled that = (OrderCancelled) o;
        return Objects.equals(orderId, that.orderId) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, reason);
    }

    @Override
    public String toString() {
        return "OrderCancelled{" +
                "orderId='" + orderId + '\'' +
                ", reason='" + reason + '\'' +
                '}';
    }
}
