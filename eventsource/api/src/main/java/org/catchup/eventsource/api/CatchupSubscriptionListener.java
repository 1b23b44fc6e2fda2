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

package org.catchup.eventsource.api;

import org.catchup.eventsource.PositionAwareCloudEvent;
import org.jspecify.annotations.Nullable;

/**
 * Callbacks invoked by an {@link EventSource} for a single {@link CatchupSubscription}. Callbacks for one subscription
 * are never invoked concurrently and events arrive in log order.
 */
public interface CatchupSubscriptionListener {

    /**
     * Invoked once per delivered event. Throwing an exception drops the subscription with
     * {@link SubscriptionDropReason#EVENT_HANDLER_EXCEPTION}.
     */
    void eventAppeared(CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent);

    /**
     * Invoked once when the subscription has replayed all historic events and switches to live delivery.
     */
    default void liveProcessingStarted(CatchupSubscription subscription) {
    }

    /**
     * Invoked once when the subscription is dropped.
     *
     * @param error The failure that caused the drop, if any
     */
    default void subscriptionDropped(CatchupSubscription subscription, SubscriptionDropReason reason, @Nullable Throwable error) {
    }
}
