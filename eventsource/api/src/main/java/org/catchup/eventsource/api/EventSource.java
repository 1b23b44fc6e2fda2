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

import org.catchup.eventsource.StartAt;
import org.jspecify.annotations.Nullable;

/**
 * An ordered, append-only event log that can be subscribed to. A catch-up subscription first replays the historic
 * events after the start position and then transparently switches to live delivery.
 */
public interface EventSource {

    /**
     * Subscribe to all events in the log, starting with the first event after {@code startAt}.
     * Delivery is asynchronous, this method returns as soon as the subscription has been created.
     *
     * @param startAt     Where to start
     * @param settings    The subscription settings
     * @param listener    The callbacks that receive events and life-cycle notifications
     * @param credentials Credentials to use, or {@code null} to use the default ones of the event source
     * @return The subscription
     */
    CatchupSubscription subscribeToAllFrom(StartAt startAt, CatchupSubscriptionSettings settings, CatchupSubscriptionListener listener, @Nullable UserCredentials credentials);

    /**
     * Subscribe to all events in the log using the default credentials.
     *
     * @see #subscribeToAllFrom(StartAt, CatchupSubscriptionSettings, CatchupSubscriptionListener, UserCredentials)
     */
    default CatchupSubscription subscribeToAllFrom(StartAt startAt, CatchupSubscriptionSettings settings, CatchupSubscriptionListener listener) {
        return subscribeToAllFrom(startAt, settings, listener, null);
    }
}
