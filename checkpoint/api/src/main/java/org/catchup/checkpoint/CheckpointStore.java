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

package org.catchup.checkpoint;

import org.catchup.eventsource.SubscriptionPosition;
import org.jspecify.annotations.Nullable;

/**
 * A {@code CheckpointStore} provides means to read and write the position of the last event that a projection has handled.
 * This makes it possible for a projection to continue where it left off after a restart, by passing the position returned by
 * {@link #read(String)} to the event source when subscribing.
 * <p>
 * Checkpoints are keyed by projection name, implementations must allow different projections to read and write their
 * checkpoints concurrently.
 */
public interface CheckpointStore {

    /**
     * Read the last committed position for the given projection.
     *
     * @param projectionName The name of the projection whose checkpoint to find
     * @return The {@link SubscriptionPosition} of the last handled event, or {@code null} if the projection has no checkpoint.
     */
    @Nullable
    SubscriptionPosition read(String projectionName);

    /**
     * Save the position for the supplied projection and then return it for easier chaining. The checkpoint must be
     * durable when this method returns.
     */
    SubscriptionPosition save(String projectionName, SubscriptionPosition subscriptionPosition);

    /**
     * Delete the checkpoint for the supplied {@code projectionName}, the projection will then replay the log from the beginning
     * the next time it's started.
     *
     * @param projectionName The name of the projection to delete the checkpoint for.
     */
    void delete(String projectionName);

    /**
     * Check if a checkpoint exists for the given projection.
     *
     * @param projectionName The name of the projection
     * @return {@code true} if a checkpoint exists, {@code false} otherwise.
     */
    boolean exists(String projectionName);
}
