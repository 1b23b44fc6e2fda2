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

import org.jspecify.annotations.NullMarked;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * A live subscription to the event log. A subscription is dropped exactly once, either because it was stopped
 * or because of a failure, and is never reused after that.
 */
@NullMarked
public interface CatchupSubscription {

    /**
     * @return The name of the subscription
     */
    String subscriptionName();

    /**
     * @return {@code true} if the subscription has caught up with the end of the log and receives live events.
     */
    boolean isLive();

    /**
     * Stop the subscription and release its resources. The listener's
     * {@link CatchupSubscriptionListener#subscriptionDropped} is invoked with {@link SubscriptionDropReason#USER_INITIATED}
     * unless the subscription has already been dropped. Calling this method more than once has no effect.
     */
    void stop();

    /**
     * Synchronous, <strong>blocking</strong> call returns once the {@link CatchupSubscription} has started.
     */
    default void waitUntilStarted() {
        waitUntilStarted(ChronoUnit.FOREVER.getDuration());
    }

    /**
     * Synchronous, <strong>blocking</strong> call returns once the {@link CatchupSubscription} has started or
     * {@link Duration timeout} exceeds.
     *
     * @return <code>true</code> if the subscription was started within the given Duration, <code>false</code> otherwise.
     */
    boolean waitUntilStarted(Duration timeout);
}
