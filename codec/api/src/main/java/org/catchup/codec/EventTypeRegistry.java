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

package org.catchup.codec;

import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps event type names, as stored in the event log, to the classes that represent them. Event types that are not
 * registered are unknown to a projection and are skipped.
 * <p>
 * Example:
 * <pre>
 * EventTypeRegistry&lt;OrderEvent&gt; registry = EventTypeRegistry.&lt;OrderEvent&gt;builder()
 *         .register(OrderPlaced.class)
 *         .register("order-shipped", OrderShipped.class)
 *         .build();
 * </pre>
 *
 * @param <T> The base type of the domain events
 */
@NullMarked
public final class EventTypeRegistry<T> {
    private final Map<String, Class<? extends T>> typeToClass;
    private final Map<Class<? extends T>, String> classToType;

    private EventTypeRegistry(Map<String, Class<? extends T>> typeToClass) {
        this.typeToClass = Collections.unmodifiableMap(new LinkedHashMap<>(typeToClass));
        Map<Class<? extends T>, String> classToType = new LinkedHashMap<>();
        typeToClass.forEach((type, clazz) -> classToType.putIfAbsent(clazz, type));
        this.classToType = Collections.unmodifiableMap(classToType);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * @return The class registered for the given event type name, or {@link Optional#empty()} if the type is unknown.
     */
    public Optional<Class<? extends T>> resolve(String eventType) {
        requireNonNull(eventType, "eventType cannot be null");
        return Optional.ofNullable(typeToClass.get(eventType));
    }

    /**
     * @return The event type name that {@code clazz} is registered under.
     * @throws IllegalArgumentException If {@code clazz} is not registered
     */
    public String eventTypeOf(Class<?> clazz) {
        requireNonNull(clazz, "clazz cannot be null");
        String eventType = classToType.get(clazz);
        if (eventType == null) {
            throw new IllegalArgumentException(clazz.getName() + " is not registered");
        }
        return eventType;
    }

    public Set<String> eventTypes() {
        return typeToClass.keySet();
    }

    @Override
    public String toString() {
        return "EventTypeRegistry" + typeToClass.keySet();
    }

    public static final class Builder<T> {
        private final Map<String, Class<? extends T>> typeToClass = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register {@code clazz} under its simple name.
         */
        public Builder<T> register(Class<? extends T> clazz) {
            requireNonNull(clazz, "clazz cannot be null");
            return register(clazz.getSimpleName(), clazz);
        }

        public Builder<T> register(String eventType, Class<? extends T> clazz) {
            requireNonNull(eventType, "eventType cannot be null");
            requireNonNull(clazz, "clazz cannot be null");
            if (eventType.isBlank()) {
                throw new IllegalArgumentException("eventType cannot be blank");
            } else if (eventType.startsWith("$")) {
                throw new IllegalArgumentException("Event types starting with $ are reserved for system events: " + eventType);
            }
            Class<? extends T> existing = typeToClass.putIfAbsent(eventType, clazz);
            if (existing != null && !existing.equals(clazz)) {
                throw new IllegalArgumentException("Event type " + eventType + " is already registered for " + existing.getName());
            }
            return this;
        }

        public EventTypeRegistry<T> build() {
            return new EventTypeRegistry<>(typeToClass);
        }
    }
}
