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

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Settings for a catch-up subscription.
 */
public final class CatchupSubscriptionSettings {
    public static final int DEFAULT_MAX_LIVE_QUEUE_SIZE = 10_000;
    public static final int DEFAULT_READ_BATCH_SIZE = 500;

    /**
     * Max number of live events that may be buffered while waiting to be processed.
     */
    public final int maxLiveQueueSize;
    /**
     * Number of events to read per page while catching up.
     */
    public final int readBatchSize;
    /**
     * Whether link records should be resolved to the events they point to.
     */
    public final boolean resolveLinkTos;
    /**
     * Name of the subscription, used for logging and diagnostics.
     */
    public final String subscriptionName;

    public CatchupSubscriptionSettings(int maxLiveQueueSize, int readBatchSize, boolean resolveLinkTos, String subscriptionName) {
        if (maxLiveQueueSize < 1) {
            throw new IllegalArgumentException("maxLiveQueueSize must be greater than 0");
        } else if (readBatchSize < 1) {
            throw new IllegalArgumentException("readBatchSize must be greater than 0");
        }
        requireNonNull(subscriptionName, "subscriptionName cannot be null");
        this.maxLiveQueueSize = maxLiveQueueSize;
        this.readBatchSize = readBatchSize;
        this.resolveLinkTos = resolveLinkTos;
        this.subscriptionName = subscriptionName;
    }

    public static CatchupSubscriptionSettings defaults(String subscriptionName) {
        return new CatchupSubscriptionSettings(DEFAULT_MAX_LIVE_QUEUE_SIZE, DEFAULT_READ_BATCH_SIZE, true, subscriptionName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatchupSubscriptionSettings)) return false;
        CatchupSubscriptionSettings that = (CatchupSubscriptionSettings) o;
        return maxLiveQueueSize == that.maxLiveQueueSize && readBatchSize == that.readBatchSize && resolveLinkTos == that.resolveLinkTos && Objects.equals(subscriptionName, that.subscriptionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLiveQueueSize, readBatchSize, resolveLinkTos, subscriptionName);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CatchupSubscriptionSettings.class.getSimpleName() + "[", "]")
                .add("maxLiveQueueSize=" + maxLiveQueueSize)
                .add("readBatchSize=" + readBatchSize)
                .add("resolveLinkTos=" + resolveLinkTos)
                .add("subscriptionName='" + subscriptionName + "'")
                .toString();
    }
}
