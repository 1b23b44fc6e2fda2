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

package org.catchup.eventsource;

import java.util.Objects;

/**
 * A {@link SubscriptionPosition} in its string form, typically the result of reading a position back from storage.
 */
public class StringBasedSubscriptionPosition implements SubscriptionPosition {
    private final String value;

    public StringBasedSubscriptionPosition(String value) {
        Objects.requireNonNull(value, "Subscription position value cannot be null");
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringBasedSubscriptionPosition)) return false;
        StringBasedSubscriptionPosition that = (StringBasedSubscriptionPosition) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "StringBasedSubscriptionPosition{" +
                "value='" + value + '\'' +
                '}';
    }

    @Override
    public String asString() {
        return value;
    }
}
