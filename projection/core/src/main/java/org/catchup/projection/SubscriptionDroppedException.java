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
 * Handed to the {@link org.catchup.retry.RetryStrategy} of a projection when its subscription was dropped without an error,
 * for example on {@link SubscriptionDropReason#PROCESSING_QUEUE_OVERFLOW}. This allows a
 * {@link org.catchup.retry.RetryStrategy.Retry#retryIf(java.util.function.Predicate) retry predicate} to act on the drop reason.
 */
public class SubscriptionDroppedException extends RuntimeException {
    private final String projectionName;
    private final SubscriptionDropReason reason;

    public SubscriptionDroppedException(String projectionName, SubscriptionDropReason reason) {
        super("Subscription of projection " + projectionName + " was dropped with reason " + reason);
        requireNonNull(reason, SubscriptionDropReason.class.getSimpleName() + " cannot be null");
        this.projectionName = projectionName;
        this.reason = reason;
    }

    public String getProjectionName() {
        return projectionName;
    }

    public SubscriptionDropReason getReason() {
        return reason;
    }
}
