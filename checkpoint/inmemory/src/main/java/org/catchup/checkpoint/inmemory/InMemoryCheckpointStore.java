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

package org.catchup.checkpoint.inmemory;

import org.catchup.checkpoint.CheckpointStore;
import org.catchup.eventsource.SubscriptionPosition;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CheckpointStore} that keeps checkpoints in memory. Checkpoints are lost when the JVM exits so this is mainly
 * useful for testing or for projections that are rebuilt from scratch on every start.
 */
public class InMemoryCheckpointStore implements CheckpointStore {
    private final Map<String, SubscriptionPosition> checkpoints = new ConcurrentHashMap<>();

    @Override
    public SubscriptionPosition read(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        return checkpoints.get(projectionName);
    }

    @Override
    public SubscriptionPosition save(String projectionName, SubscriptionPosition subscriptionPosition) {
        requireNonNull(projectionName, "projectionName cannot be null");
        requireNonNull(subscriptionPosition, SubscriptionPosition.class.getSimpleName() + " cannot be null");
        checkpoints.put(projectionName, subscriptionPosition);
        return subscriptionPosition;
    }

    @Override
    public void delete(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        checkpoints.remove(projectionName);
    }

    @Override
    public boolean exists(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        return checkpoints.containsKey(projectionName);
    }
}
