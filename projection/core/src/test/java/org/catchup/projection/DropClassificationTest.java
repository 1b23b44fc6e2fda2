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

import io.cloudevents.CloudEvent;
import org.catchup.checkpoint.inmemory.InMemoryCheckpointStore;
import org.catchup.codec.DecodeResult;
import org.catchup.codec.EventCodec;
import org.catchup.eventsource.api.SubscriptionDropReason;
import org.catchup.retry.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.catchup.eventsource.api.SubscriptionDropReason.*;
import static org.junit.jupiter.params.provider.EnumSource.Mode.EXCLUDE;
import static org.junit.jupiter.params.provider.EnumSource.Mode.INCLUDE;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DropClassificationTest {

    private ScheduledExecutorService scheduler;
    private FakeEventSource eventSource;
    private SubscriptionCoordinator<Object> coordinator;

    @BeforeEach
    void start_coordinator() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        eventSource = new FakeEventSource();
        EventCodec<Object> codec = new EventCodec<>() {
            @Override
            public DecodeResult<Object> decode(CloudEvent cloudEvent) {
                return DecodeResult.unknownEventType(cloudEvent.getType());
            }

            @Override
            public CloudEvent encode(Object domainEvent, String streamId) {
                throw new UnsupportedOperationException();
            }
        };
        Projection<Object> projection = new Projection<>() {
            @Override
            public String name() {
                return "projection";
            }

            @Override
            public void handle(Object domainEvent) {
            }
        };
        // Restart far in the future so that the status after the drop can be observed
        coordinator = new SubscriptionCoordinator<>(projection, eventSource, new InMemoryCheckpointStore(), codec,
                new ProjectionSubscriptionConfig().restartStrategy(RetryStrategy.fixed(Duration.ofHours(1))), new RecordingObserver(), scheduler);
        coordinator.start();
    }

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @ParameterizedTest
    @EnumSource(value = SubscriptionDropReason.class, names = {"SUBSCRIBING_ERROR", "SERVER_ERROR", "CONNECTION_CLOSED", "CATCH_UP_ERROR", "PROCESSING_QUEUE_OVERFLOW", "EVENT_HANDLER_EXCEPTION"}, mode = INCLUDE)
    void transient_drop_reasons_schedule_a_restart(SubscriptionDropReason reason) {
        // When
        eventSource.subscription(0).drop(reason, new RuntimeException("expected"));

        // Then
        assertThat(DropClassification.classify(reason)).isEqualTo(DropClassification.TRANSIENT);
        assertThat(coordinator.status()).isEqualTo(ProjectionStatus.DROPPED);
        assertThat(eventSource.subscription(0).stopped).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = SubscriptionDropReason.class, names = {"NOT_AUTHENTICATED", "ACCESS_DENIED", "NOT_FOUND", "MAX_SUBSCRIBERS_REACHED", "PERSISTENT_SUBSCRIPTION_DELETED", "UNKNOWN"}, mode = INCLUDE)
    void other_drop_reasons_fail_the_projection(SubscriptionDropReason reason) {
        // When
        eventSource.subscription(0).drop(reason, null);

        // Then
        assertThat(DropClassification.classify(reason)).isEqualTo(DropClassification.FATAL);
        assertThat(coordinator.status()).isEqualTo(ProjectionStatus.FAILED);
        assertThat(eventSource.subscriptions).hasSize(1);
    }

    @ParameterizedTest
    @EnumSource(value = SubscriptionDropReason.class, names = "USER_INITIATED", mode = INCLUDE)
    void user_initiated_drop_stops_the_projection(SubscriptionDropReason reason) {
        // When
        eventSource.subscription(0).drop(reason, null);

        // Then
        assertThat(DropClassification.classify(reason)).isEqualTo(DropClassification.USER_INITIATED);
        assertThat(coordinator.status()).isEqualTo(ProjectionStatus.STOPPED);
    }

    @ParameterizedTest
    @EnumSource(value = SubscriptionDropReason.class, names = "USER_INITIATED", mode = EXCLUDE)
    void drops_after_the_projection_was_stopped_are_ignored(SubscriptionDropReason reason) {
        // Given
        coordinator.stop();

        // When
        eventSource.subscription(0).drop(reason, null);

        // Then
        assertThat(coordinator.status()).isEqualTo(ProjectionStatus.STOPPED);
        assertThat(eventSource.subscriptions).hasSize(1);
    }
}
