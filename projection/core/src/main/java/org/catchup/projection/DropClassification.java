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

import org.catchup.eventsource.api.SubscriptionDropReason;

import static java.util.Objects.requireNonNull;

/**
 * How a projection reacts when its subscription is dropped.
 */
public enum DropClassification {
    /**
     * The subscription was stopped on request, the projection is stopped.
     */
    USER_INITIATED,
    /**
     * The subscription is restarted from the last checkpoint.
     */
    TRANSIENT,
    /**
     * The projection fails and is not restarted.
     */
    FATAL;

    public static DropClassification classify(SubscriptionDropReason reason) {
        requireNonNull(reason, SubscriptionDropReason.class.getSimpleName() + " cannot be null");
        switch (reason) {
            case USER_INITIATED:
                return USER_INITIATED;
            case SUBSCRIBING_ERROR:
            case SERVER_ERROR:
            case CONNECTION_CLOSED:
            case CATCH_UP_ERROR:
            case PROCESSING_QUEUE_OVERFLOW:
            case EVENT_HANDLER_EXCEPTION:
                return TRANSIENT;
            default:
                return FATAL;
        }
    }
}
