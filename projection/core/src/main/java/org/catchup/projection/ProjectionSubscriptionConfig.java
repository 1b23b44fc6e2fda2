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

import org.catchup.eventsource.api.CatchupSubscriptionSettings;
import org.catchup.eventsource.api.UserCredentials;
import org.catchup.retry.RetryStrategy;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;
import static org.catchup.eventsource.api.CatchupSubscriptionSettings.DEFAULT_MAX_LIVE_QUEUE_SIZE;
import static org.catchup.eventsource.api.CatchupSubscriptionSettings.DEFAULT_READ_BATCH_SIZE;

/**
 * Configuration of the subscription that a {@link SubscriptionCoordinator} opens for its projection. Instances are immutable,
 * use the {@code with} methods to derive a new configuration.
 */
public class ProjectionSubscriptionConfig {

    public final int maxLiveQueueSize;
    public final int readBatchSize;
    @Nullable
    public final UserCredentials credentials;
    public final RetryStrategy restartStrategy;

    /**
     * Create a {@code ProjectionSubscriptionConfig} with a max live queue size of {@value CatchupSubscriptionSettings#DEFAULT_MAX_LIVE_QUEUE_SIZE},
     * a read batch size of {@value CatchupSubscriptionSettings#DEFAULT_READ_BATCH_SIZE}, no credentials and the {@link #defaultRestartStrategy()}.
     */
    public ProjectionSubscriptionConfig() {
        this(DEFAULT_MAX_LIVE_QUEUE_SIZE, DEFAULT_READ_BATCH_SIZE, null, defaultRestartStrategy());
    }

    public ProjectionSubscriptionConfig(int maxLiveQueueSize, int readBatchSize, @Nullable UserCredentials credentials, RetryStrategy restartStrategy) {
        if (maxLiveQueueSize < 1) {
            throw new IllegalArgumentException("maxLiveQueueSize must be greater than 0");
        } else if (readBatchSize < 1) {
            throw new IllegalArgumentException("readBatchSize must be greater than 0");
        }
        requireNonNull(restartStrategy, "restartStrategy cannot be null");
        this.maxLiveQueueSize = maxLiveQueueSize;
        this.readBatchSize = readBatchSize;
        this.credentials = credentials;
        this.restartStrategy = restartStrategy;
    }

    /**
     * Restart after 100 ms, doubling the wait time for every consecutive failed attempt up to 30 seconds, with 20% jitter. Never gives up.
     */
    public static RetryStrategy defaultRestartStrategy() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(30), 2.0).jitter(0.2);
    }

    public ProjectionSubscriptionConfig maxLiveQueueSize(int maxLiveQueueSize) {
        return new ProjectionSubscriptionConfig(maxLiveQueueSize, readBatchSize, credentials, restartStrategy);
    }

    public ProjectionSubscriptionConfig readBatchSize(int readBatchSize) {
        return new ProjectionSubscriptionConfig(maxLiveQueueSize, readBatchSize, credentials, restartStrategy);
    }

    public ProjectionSubscriptionConfig credentials(@Nullable UserCredentials credentials) {
        return new ProjectionSubscriptionConfig(maxLiveQueueSize, readBatchSize, credentials, restartStrategy);
    }

    public ProjectionSubscriptionConfig restartStrategy(RetryStrategy restartStrategy) {
        return new ProjectionSubscriptionConfig(maxLiveQueueSize, readBatchSize, credentials, restartStrategy);
    }

    /**
     * @return The settings of the catch-up subscription for the given projection. Links are always resolved.
     */
    CatchupSubscriptionSettings subscriptionSettings(String projectionName) {
        return new CatchupSubscriptionSettings(maxLiveQueueSize, readBatchSize, true, projectionName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionSubscriptionConfig)) return false;
        ProjectionSubscriptionConfig that = (ProjectionSubscriptionConfig) o;
        return maxLiveQueueSize == that.maxLiveQueueSize && readBatchSize == that.readBatchSize && Objects.equals(credentials, that.credentials) && Objects.equals(restartStrategy, that.restartStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLiveQueueSize, readBatchSize, credentials, restartStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProjectionSubscriptionConfig.class.getSimpleName() + "[", "]")
                .add("maxLiveQueueSize=" + maxLiveQueueSize)
                .add("readBatchSize=" + readBatchSize)
                .add("credentials=" + credentials)
                .add("restartStrategy=" + restartStrategy)
                .toString();
    }
}
