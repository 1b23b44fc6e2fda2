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

import org.catchup.eventsource.StartAt;
import org.catchup.eventsource.api.SubscriptionDropReason;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Receives notifications about what happens to projections, for example to log or to collect metrics. All methods have an
 * empty default implementation so that you only need to implement the ones you're interested in.
 * <p>
 * Notifications for a single projection are never delivered concurrently, but notifications for different projections may be.
 * An exception thrown by an observer is logged and doesn't affect the projection.
 */
public interface ProjectionObserver {

    /**
     * A domain event was handled and the checkpoint of the projection was saved.
     */
    default void eventProjected(ProjectedEvent<?> projectedEvent) {
    }

    /**
     * A subscription for the projection was opened.
     */
    default void subscribed(String projectionName, StartAt startAt) {
    }

    /**
     * The projection has caught up with the end of the log and now receives live events.
     */
    default void liveProcessingStarted(String projectionName) {
    }

    default void dropped(String projectionName, SubscriptionDropReason reason, @Nullable Throwable error) {
    }

    /**
     * A new subscription will be opened after {@code backoff}.
     *
     * @param attemptNumber The number of consecutive attempts to subscribe, including the upcoming one
     */
    default void restarting(String projectionName, int attemptNumber, Duration backoff) {
    }

    default void stopped(String projectionName) {
    }

    /**
     * The projection failed and will not be restarted.
     */
    default void failed(String projectionName, String description, @Nullable Throwable error) {
    }
}
