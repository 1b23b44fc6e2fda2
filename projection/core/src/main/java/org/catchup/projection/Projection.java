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

package org.catchup.projection;

/**
 * A read model that is built from the events in the event log. Each projection has its own checkpoint and subscription,
 * so projections progress independently of each other.
 * <p>
 * Events are delivered <i>at-least-once</i>: an event can be handled again if the process crashes after {@link #handle(Object)}
 * returned but before the checkpoint was saved. Implementations must therefore be idempotent.
 * </p>
 *
 * @param <T> The type of the domain events
 */
public interface Projection<T> {

    /**
     * @return The unique name of the projection. It's used as checkpoint key and subscription name.
     */
    String name();

    /**
     * Handle a domain event. Throwing an exception drops the subscription, which is then restarted from the last checkpoint.
     */
    void handle(T domainEvent);
}
