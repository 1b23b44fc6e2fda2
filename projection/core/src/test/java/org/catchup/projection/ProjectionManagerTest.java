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

import org.catchup.checkpoint.CheckpointStore;
import org.catchup.checkpoint.file.FileCheckpointStore;
import org.catchup.checkpoint.inmemory.InMemoryCheckpointStore;
import org.catchup.domain.OrderEvent;
import org.catchup.eventsource.GlobalPosition;
import org.catchup.eventsource.SubscriptionPosition;
import org.catchup.eventsource.api.UserCredentials;
import org.catchup.eventsource.inmemory.InMemoryEventSource;
import org.catchup.retry.RetryStrategy;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.catchup.projection.ProjectionStatus.*;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
@Timeout(30)
class ProjectionManagerTest {

    private InMemoryEventSource eventSource;
    private InMemoryCheckpointStore checkpointStore;
    private Orders orders;
    private ProjectionManager<OrderEvent> projectionManager;

    @BeforeEach
    void create_event_source() {
        eventSource = new InMemoryEventSource();
        checkpointStore = new InMemoryCheckpointStore();
        orders = new Orders(eventSource);
    }

    @AfterEach
    void shutdown() {
        if (projectionManager != null) {
            projectionManager.shutdown();
        }
        eventSource.shutdown();
    }

    @Test
    void all_projections_are_started_and_receive_all_events() {
        // Given
        orders.placeOrders(1, 5);
        RecordingProjection customers = new RecordingProjection("customers");
        RecordingProjection revenue = new RecordingProjection("revenue");
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec).projections(customers, revenue).build();

        // When
        projectionManager.startAll().join();
        orders.shipped("order-1");

        // Then
        assertThat(projectionManager.status("customers")).isEqualTo(SUBSCRIBED);
        assertThat(projectionManager.status("revenue")).isEqualTo(SUBSCRIBED);
        await().until(() -> customers.handled.size() + revenue.handled.size(), is(12));
        await().until(() -> projectionManager.isLive("customers") && projectionManager.isLive("revenue"));
        await().until(() -> checkpointOf(checkpointStore, "customers"), is(6L));
        assertThat(projectionManager.projectionNames()).containsExactly("customers", "revenue");
    }

    @Test
    void failing_projection_does_not_affect_other_projections() {
        // Given
        orders.placeOrders(1, 3);
        RecordingProjection broken = new RecordingProjection("broken").beforeHandle(e -> {
            throw new IllegalStateException("always failing");
        });
        RecordingProjection healthy = new RecordingProjection("healthy");
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                .projections(broken, healthy)
                .restartStrategy(RetryStrategy.fixed(10).maxAttempts(2))
                .build();

        // When
        projectionManager.startAll().join();
        orders.placed("order-4");

        // Then
        await().until(() -> projectionManager.status("broken"), is(FAILED));
        await().until(() -> healthy.handled.size(), is(4));
        assertThat(projectionManager.status("healthy")).isEqualTo(SUBSCRIBED);
        assertThat(projectionManager.failureCause("broken")).containsInstanceOf(IllegalStateException.class);
        assertThat(checkpointStore.exists("broken")).isFalse();
    }

    @Test
    void stop_all_stops_every_projection() {
        // Given
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                .projections(new RecordingProjection("a"), new RecordingProjection("b"))
                .build();
        projectionManager.startAll().join();

        // When
        projectionManager.stopAll();

        // Then
        assertThat(projectionManager.status("a")).isEqualTo(STOPPED);
        assertThat(projectionManager.status("b")).isEqualTo(STOPPED);
        await().until(eventSource::numberOfActiveSubscriptions, is(0));
    }

    @Test
    void stopped_projections_are_started_again_from_their_checkpoint() {
        // Given
        orders.placed("order-1");
        RecordingProjection projection = new RecordingProjection("orders");
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec).projections(projection).build();
        projectionManager.startAll().join();
        await().until(() -> checkpointOf(checkpointStore, "orders"), is(1L));
        projectionManager.stopAll();

        // When
        orders.placed("order-2");
        projectionManager.startAll().join();

        // Then
        await().until(projection::handledOrderIds, contains("order-1", "order-2"));
        assertThat(projectionManager.status("orders")).isEqualTo(SUBSCRIBED);
        await().until(() -> checkpointOf(checkpointStore, "orders"), is(2L));
    }

    @Test
    void failed_projection_can_be_started_again() {
        // Given
        orders.placed("order-1");
        AtomicBoolean failing = new AtomicBoolean(true);
        RecordingProjection projection = new RecordingProjection("orders").beforeHandle(e -> {
            if (failing.get()) {
                throw new IllegalStateException("expected");
            }
        });
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                .projections(projection)
                .restartStrategy(RetryStrategy.none())
                .build();
        projectionManager.startAll().join();
        await().until(() -> projectionManager.status("orders"), is(FAILED));

        // When
        failing.set(false);
        ProjectionStatus status = projectionManager.start("orders").join();

        // Then
        assertThat(status).isEqualTo(SUBSCRIBED);
        await().until(projection::handledOrderIds, contains("order-1"));
        assertThat(projectionManager.failureCause("orders")).isEmpty();
    }

    @Test
    void starting_a_running_projection_has_no_effect() {
        // Given
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec).projections(new RecordingProjection("orders")).build();
        projectionManager.startAll().join();

        // When
        ProjectionStatus status = projectionManager.start("orders").join();
        projectionManager.startAll().join();

        // Then
        assertThat(status).isEqualTo(SUBSCRIBED);
        await().until(eventSource::numberOfActiveSubscriptions, is(1));
    }

    @Test
    void projection_is_started_while_other_projections_are_stuck_reading_their_checkpoints() {
        // Given
        orders.placed("order-1");
        CountDownLatch releaseCheckpointReads = new CountDownLatch(1);
        DelegatingCheckpointStore slowForAllButE = new DelegatingCheckpointStore(checkpointStore) {
            @Override
            public SubscriptionPosition read(String projectionName) {
                if (!projectionName.equals("e")) {
                    try {
                        releaseCheckpointReads.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.read(projectionName);
            }
        };
        RecordingProjection unblocked = new RecordingProjection("e");
        projectionManager = ProjectionManager.builder(eventSource, slowForAllButE, orders.codec)
                .projections(new RecordingProjection("a"), new RecordingProjection("b"), new RecordingProjection("c"), new RecordingProjection("d"), unblocked)
                .build();

        try {
            // When
            CompletableFuture<Void> started = projectionManager.startAll();

            // Then
            await().until(() -> projectionManager.status("e"), is(SUBSCRIBED));
            await().until(() -> unblocked.handled.size(), is(1));
            assertThat(projectionManager.status("a")).isEqualTo(STARTING);
            assertThat(started).isNotDone();
        } finally {
            releaseCheckpointReads.countDown();
        }
        await().until(() -> projectionManager.status("a"), is(SUBSCRIBED));
    }

    @Test
    void projections_resume_from_file_checkpoints_after_the_manager_is_recreated(@TempDir Path checkpoints) {
        // Given
        orders.placeOrders(1, 3);
        RecordingProjection first = new RecordingProjection("orders");
        projectionManager = ProjectionManager.builder(eventSource, new FileCheckpointStore(checkpoints), orders.codec).projections(first).build();
        projectionManager.startAll().join();
        await().until(() -> first.handled.size(), is(3));
        await().until(() -> checkpointOf(new FileCheckpointStore(checkpoints), "orders"), is(3L));
        projectionManager.shutdown();

        // When
        orders.placeOrders(4, 4);
        RecordingProjection second = new RecordingProjection("orders");
        projectionManager = ProjectionManager.builder(eventSource, new FileCheckpointStore(checkpoints), orders.codec).projections(second).build();
        projectionManager.startAll().join();

        // Then
        await().until(() -> projectionManager.isLive("orders"));
        assertThat(second.handledOrderIds()).containsExactly("order-4");
    }

    @Test
    void observers_are_notified_about_projected_events() {
        // Given
        orders.placed("order-1");
        List<String> projectedBy = new CopyOnWriteArrayList<>();
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                .projections(new RecordingProjection("orders"))
                .verboseLogging(true)
                .observer(new ProjectionObserver() {
                    @Override
                    public void eventProjected(ProjectedEvent<?> projectedEvent) {
                        projectedBy.add(projectedEvent.projectionName());
                    }
                })
                .build();

        // When
        projectionManager.startAll();

        // Then
        await().until(() -> projectedBy, contains("orders"));
    }

    @Test
    void projection_subscribing_with_invalid_credentials_fails() {
        // Given
        eventSource.shutdown();
        eventSource = new InMemoryEventSource(new UserCredentials("admin", "changeit"));
        orders = new Orders(eventSource);
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                .projections(new RecordingProjection("orders"))
                .credentials(new UserCredentials("admin", "wrong"))
                .build();

        // When
        projectionManager.startAll().join();

        // Then
        await().until(() -> projectionManager.status("orders"), is(FAILED));
    }

    @Test
    void start_all_completes_immediately_without_projections() {
        // Given
        projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec).build();

        // When
        projectionManager.startAll().join();

        // Then
        assertThat(projectionManager.projectionNames()).isEmpty();
    }

    private static Long checkpointOf(CheckpointStore checkpointStore, String projectionName) {
        SubscriptionPosition position = checkpointStore.read(projectionName);
        return position == null ? null : GlobalPosition.from(position).value();
    }

    @Nested
    @DisplayName("builder")
    class BuilderTest {

        @Test
        void duplicate_projection_names_are_rejected() {
            // When
            Throwable throwable = catchThrowable(() -> ProjectionManager.builder(eventSource, checkpointStore, orders.codec)
                    .projections(new RecordingProjection("orders"), new RecordingProjection("orders"))
                    .build());

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Duplicate projection name: orders");
        }

        @Test
        void non_positive_read_batch_size_is_rejected() {
            // When
            Throwable throwable = catchThrowable(() -> ProjectionManager.builder(eventSource, checkpointStore, orders.codec).readBatchSize(0));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void non_positive_max_live_queue_size_is_rejected() {
            // When
            Throwable throwable = catchThrowable(() -> ProjectionManager.builder(eventSource, checkpointStore, orders.codec).maxLiveQueueSize(-1));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void event_source_is_required() {
            // When
            Throwable throwable = catchThrowable(() -> ProjectionManager.builder(null, checkpointStore, orders.codec));

            // Then
            assertThat(throwable).isExactlyInstanceOf(NullPointerException.class);
        }

        @Test
        void status_of_unknown_projection_throws_iae() {
            // Given
            projectionManager = ProjectionManager.builder(eventSource, checkpointStore, orders.codec).build();

            // When
            Throwable throwable = catchThrowable(() -> projectionManager.status("unknown"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }
}
