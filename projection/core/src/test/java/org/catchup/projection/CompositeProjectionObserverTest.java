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
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CompositeProjectionObserverTest {

    @Test
    void observer_that_throws_does_not_prevent_other_observers_from_being_notified() {
        // Given
        ProjectionObserver throwing = new ProjectionObserver() {
            @Override
            public void dropped(String projectionName, SubscriptionDropReason reason, Throwable error) {
                throw new IllegalStateException("expected");
            }
        };
        RecordingObserver recording = new RecordingObserver();
        CompositeProjectionObserver composite = new CompositeProjectionObserver(List.of(throwing, recording));

        // When
        composite.dropped("orders", SubscriptionDropReason.SERVER_ERROR, null);

        // Then
        assertThat(recording.drops).containsExactly(SubscriptionDropReason.SERVER_ERROR);
    }

    @Test
    void observers_are_notified_in_order() {
        // Given
        StringBuilder order = new StringBuilder();
        CompositeProjectionObserver composite = new CompositeProjectionObserver(List.of(
                new ProjectionObserver() {
                    @Override
                    public void stopped(String projectionName) {
                        order.append("first;");
                    }
                },
                new ProjectionObserver() {
                    @Override
                    public void stopped(String projectionName) {
                        order.append("second;");
                    }
                }));

        // When
        composite.stopped("orders");

        // Then
        assertThat(order).hasToString("first;second;");
    }
}
