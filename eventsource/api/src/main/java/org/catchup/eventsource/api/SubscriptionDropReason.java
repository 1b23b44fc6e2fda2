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

/**
 * The reason an event source gives when it drops a {@link CatchupSubscription}.
 */
public enum SubscriptionDropReason {
    /**
     * The subscription was stopped by calling {@link CatchupSubscription#stop()}.
     */
    USER_INITIATED,
    NOT_AUTHENTICATED,
    ACCESS_DENIED,
    /**
     * The subscription could not be established.
     */
    SUBSCRIBING_ERROR,
    SERVER_ERROR,
    CONNECTION_CLOSED,
    /**
     * Reading historic events failed during catch-up.
     */
    CATCH_UP_ERROR,
    /**
     * More live events were buffered than the subscription's {@code maxLiveQueueSize} allows.
     */
    PROCESSING_QUEUE_OVERFLOW,
    /**
     * The listener threw an exception while handling an event.
     */
    EVENT_HANDLER_EXCEPTION,
    MAX_SUBSCRIBERS_REACHED,
    PERSISTENT_SUBSCRIPTION_DELETED,
    NOT_FOUND,
    UNKNOWN
}
