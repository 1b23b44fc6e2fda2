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

public class OrderShipped implements OrderEvent {

    private String orderId;
    private String trackingNumber;

    @SuppressWarnings("unused")
    OrderShipped() {
    }

    public OrderShipped(String orderId, String trackingNumber) {
        this.orderId = orderId;
        this.trackingNumber = trackingNumber;
    }

    @Override
    public String getOrderId() {
        return orderId;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderShipped)) return false;
        OrderShipped that = (OrderShipped) o;
        return Objects.equals(orderId, that.orderId) && Objects.equals(trackingNumber, that.trackingNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, trackingNumber);
    }

    @Override
    public String toString() {
        return "OrderShipped{" +
                "orderId='" + orderId + '\'' +
                ", trackingNumber='" + trackingNumber + '\'' +
                '}';
    }
}
