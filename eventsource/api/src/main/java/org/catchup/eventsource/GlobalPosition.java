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

import org.jspecify.annotations.NullMarked;

/**
 * The position of an event in the global ("all") event log. Positions are totally ordered and the first event
 * in the log has position {@code 1}.
 */
@NullMarked
public final class GlobalPosition implements SubscriptionPosition, Comparable<GlobalPosition> {
    private final long value;

    private GlobalPosition(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Global position cannot be negative");
        }
        this.value = value;
    }

    public static GlobalPosition of(long value) {
        return new GlobalPosition(value);
    }

    /**
     * Recreate a {@link GlobalPosition} from any {@link SubscriptionPosition}, for example one read from a checkpoint store.
     *
     * @throws IllegalArgumentException If the position is not a global position
     */
    public static GlobalPosition from(SubscriptionPosition subscriptionPosition) {
        if (subscriptionPosition instanceof GlobalPosition) {
            return (GlobalPosition) subscriptionPosition;
        }
        return parse(subscriptionPosition.asString());
    }

    public static GlobalPosition parse(String value) {
        try {
            return new GlobalPosition(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("\"" + value + "\" is not a valid " + GlobalPosition.class.getSimpleName(), e);
        }
    }

    public long value() {
        return value;
    }

    public GlobalPosition next() {
        return new GlobalPosition(value + 1);
    }

    public boolean isAfter(GlobalPosition other) {
        return compareTo(other) > 0;
    }

    @Override
    public String asString() {
        return Long.toString(value);
    }

    @Override
    public int compareTo(GlobalPosition o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlobalPosition)) return false;
        GlobalPosition that = (GlobalPosition) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "GlobalPosition{" + value + '}';
    }
}
