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

import org.catchup.eventsource.SubscriptionPosition;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Emitted after a domain event has been handled by a projection and its checkpoint has been saved.
 *
 * @param timestamp      When the event was projected
 * @param streamId       The stream the event was written to, if known
 * @param domainEvent    The domain event that was handled
 * @param projectionName The name of the projection that handled the event
 * @param position       The position of the event, which is now the checkpoint of the projection
 */
public record ProjectedEvent<T>(Instant timestamp, @Nullable String streamId, T domainEvent, String projectionName, SubscriptionPosition position) {
    public ProjectedEvent {
        requireNonNull(timestamp, "timestamp cannot be null");
        requireNonNull(domainEvent, "domainEvent cannot be null");
        requireNonNull(projectionName, "projectionName cannot be null");
        requireNonNull(position, SubscriptionPosition.class.getSimpleName() + " cannot be null");
    }
}
