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

package org.catchup.eventsource;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Where a catch-up subscription should start reading the event log.
 */
public sealed interface StartAt {

    default boolean isBeginningOfLog() {
        return this instanceof BeginningOfLog;
    }

    final class BeginningOfLog implements StartAt {
        private static final BeginningOfLog INSTANCE = new BeginningOfLog();

        private BeginningOfLog() {
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName();
        }
    }

    /**
     * Start with the first event <i>after</i> the given position.
     */
    final class StartAtSubscriptionPosition implements StartAt {
        public final SubscriptionPosition subscriptionPosition;

        private StartAtSubscriptionPosition(SubscriptionPosition subscriptionPosition) {
            requireNonNull(subscriptionPosition, SubscriptionPosition.class.getSimpleName() + " cannot be null");
            this.subscriptionPosition = subscriptionPosition;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StartAtSubscriptionPosition)) return false;
            StartAtSubscriptionPosition that = (StartAtSubscriptionPosition) o;
            return Objects.equals(subscriptionPosition, that.subscriptionPosition);
        }

        @Override
        public int hashCode() {
            return Objects.hash(subscriptionPosition);
        }

        @Override
        public String toString() {
            return subscriptionPosition.asString();
        }
    }

    /**
     * Replay the event log from the very first event
     */
    static StartAt beginningOfLog() {
        return BeginningOfLog.INSTANCE;
    }

    /**
     * Start subscribing after the given subscription position
     */
    static StartAt subscriptionPosition(SubscriptionPosition subscriptionPosition) {
        return new StartAtSubscriptionPosition(subscriptionPosition);
    }

    /**
     * Start after the last checkpoint if there is one, otherwise from the beginning of the log.
     */
    static StartAt checkpoint(@Nullable SubscriptionPosition lastCheckpoint) {
        return lastCheckpoint == null ? beginningOfLog() : subscriptionPosition(lastCheckpoint);
    }
}
