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

package org.catchup.eventsource.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.catchup.eventsource.EventLogExtensions;
import org.catchup.eventsource.GlobalPosition;
import org.catchup.eventsource.PositionAwareCloudEvent;
import org.catchup.eventsource.StartAt;
import org.catchup.eventsource.api.*;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
@Timeout(20)
class InMemoryEventSourceTest {

    private InMemoryEventSource eventSource;

    @BeforeEach
    void create_event_source() {
        eventSource = new InMemoryEventSource();
    }

    @AfterEach
    void shutdown() {
        eventSource.shutdown();
    }

    @Nested
    @DisplayName("append")
    class AppendTest {

        @Test
        void positions_start_at_one_and_are_global_across_streams() {
            // When
            GlobalPosition first = eventSource.append("order-1", event("OrderPlaced"), event("OrderShipped"));
            GlobalPosition second = eventSource.append("order-2", event("OrderPlaced"));

            // Then
            assertThat(first).isEqualTo(GlobalPosition.of(2));
            assertThat(second).isEqualTo(GlobalPosition.of(3));
            assertThat(eventSource.headPosition()).isEqualTo(GlobalPosition.of(3));
        }

        @Test
        void head_position_of_empty_log_is_zero() {
            assertThat(eventSource.headPosition()).isEqualTo(GlobalPosition.of(0));
        }

        @Test
        void stream_id_and_stream_version_are_added_to_appended_events() {
            // Given
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.append("order-1", event("OrderPlaced"), event("OrderShipped"));
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener);

            // Then
            await().until(() -> listener.events.size(), is(2));
            assertThat(listener.events).extracting(PositionAwareCloudEvent::getStreamId).containsOnly("order-1");
            assertThat(listener.events).extracting(EventLogExtensions::getStreamVersion).containsExactly(1L, 2L);
        }

        @Test
        void cannot_link_to_a_position_that_does_not_exist() {
            // Given
            eventSource.append("order-1", event("OrderPlaced"));

            // When
            Throwable throwable = catchThrowable(() -> eventSource.appendLink("$ce-order", GlobalPosition.of(2)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("catch-up subscription")
    class CatchupTest {

        @Test
        void replays_history_from_beginning_of_log_in_batches_and_then_goes_live() {
            // Given
            appendEvents(7);
            RecordingListener listener = new RecordingListener();

            // When
            CatchupSubscription subscription = eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), new CatchupSubscriptionSettings(100, 3, true, "test"), listener);

            // Then
            await().until(listener.liveProcessingStarted::get);
            assertThat(subscription.isLive()).isTrue();
            assertThat(listener.positions()).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
        }

        @Test
        void delivers_only_events_strictly_after_the_start_position() {
            // Given
            appendEvents(5);
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.subscriptionPosition(GlobalPosition.of(3)), CatchupSubscriptionSettings.defaults("test"), listener);

            // Then
            await().until(listener.liveProcessingStarted::get);
            assertThat(listener.positions()).containsExactly(4L, 5L);
        }

        @Test
        void events_appended_while_catching_up_are_delivered_exactly_once_and_in_order() {
            // Given
            appendEvents(200);
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), new CatchupSubscriptionSettings(10_000, 7, true, "test"), listener);
            IntStream.range(0, 200).forEach(i -> eventSource.append("order-live", event("OrderPlaced")));

            // Then
            await().until(() -> listener.events.size(), is(400));
            assertThat(listener.positions()).isEqualTo(LongStream.rangeClosed(1, 400).boxed().collect(Collectors.toList()));
        }

        @Test
        void live_events_are_delivered_after_live_processing_started() {
            // Given
            RecordingListener listener = new RecordingListener();
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener);
            await().until(listener.liveProcessingStarted::get);

            // When
            eventSource.append("order-1", event("OrderPlaced"));

            // Then
            await().until(() -> listener.events.size(), is(1));
            assertThat(listener.events.get(0).getSubscriptionPosition()).isEqualTo(GlobalPosition.of(1));
        }

        @Test
        void resolves_links_when_configured_to_do_so() {
            // Given
            GlobalPosition target = eventSource.append("order-1", event("OrderPlaced"));
            eventSource.appendLink("$ce-order", target);
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), new CatchupSubscriptionSettings(100, 10, true, "test"), listener);

            // Then
            await().until(() -> listener.events.size(), is(2));
            PositionAwareCloudEvent resolved = listener.events.get(1);
            assertThat(resolved.getType()).isEqualTo("OrderPlaced");
            assertThat(resolved.getOriginalType()).isEqualTo(EventLogExtensions.LINK_EVENT_TYPE);
            assertThat(resolved.getSubscriptionPosition()).isEqualTo(GlobalPosition.of(2));
        }

        @Test
        void delivers_link_records_as_is_when_links_are_not_resolved() {
            // Given
            GlobalPosition target = eventSource.append("order-1", event("OrderPlaced"));
            eventSource.appendLink("$ce-order", target);
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), new CatchupSubscriptionSettings(100, 10, false, "test"), listener);

            // Then
            await().until(() -> listener.events.size(), is(2));
            assertThat(listener.events.get(1).getType()).isEqualTo(EventLogExtensions.LINK_EVENT_TYPE);
            assertThat(listener.events.get(1).getOriginalType()).isEqualTo(EventLogExtensions.LINK_EVENT_TYPE);
        }

        @Test
        void wait_until_started_returns_true_once_the_subscription_runs() {
            // When
            CatchupSubscription subscription = eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), new RecordingListener());

            // Then
            assertThat(subscription.waitUntilStarted(Duration.ofSeconds(5))).isTrue();
            assertThat(subscription.subscriptionName()).isEqualTo("test");
        }
    }

    @Nested
    @DisplayName("drops")
    class DropTest {

        @Test
        void stop_drops_the_subscription_exactly_once_with_user_initiated() {
            // Given
            RecordingListener listener = new RecordingListener();
            CatchupSubscription subscription = eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener);
            await().until(listener.liveProcessingStarted::get);

            // When
            subscription.stop();
            subscription.stop();

            // Then
            await().until(() -> listener.drops.size(), is(1));
            await().during(Duration.ofMillis(300)).until(() -> listener.drops.size(), is(1));
            assertThat(listener.drops).containsExactly(SubscriptionDropReason.USER_INITIATED);
            assertThat(subscription.isLive()).isFalse();
            assertThat(eventSource.numberOfActiveSubscriptions()).isZero();
        }

        @Test
        void listener_exception_drops_the_subscription_with_event_handler_exception() {
            // Given
            appendEvents(3);
            IllegalStateException boom = new IllegalStateException("expected");
            RecordingListener listener = new RecordingListener() {
                @Override
                public void eventAppeared(CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent) {
                    if (GlobalPosition.from(cloudEvent.getSubscriptionPosition()).value() == 2) {
                        throw boom;
                    }
                    super.eventAppeared(subscription, cloudEvent);
                }
            };

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener);

            // Then
            await().until(() -> listener.drops.size(), is(1));
            assertThat(listener.drops).containsExactly(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION);
            assertThat(listener.errors).containsExactly(boom);
            assertThat(listener.positions()).containsExactly(1L);
        }

        @Test
        void live_queue_overflow_drops_the_subscription_with_processing_queue_overflow() throws InterruptedException {
            // Given
            CountDownLatch blockHandler = new CountDownLatch(1);
            RecordingListener listener = new RecordingListener() {
                @Override
                public void eventAppeared(CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent) {
                    try {
                        blockHandler.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    super.eventAppeared(subscription, cloudEvent);
                }
            };
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), new CatchupSubscriptionSettings(2, 10, true, "test"), listener);
            await().until(listener.liveProcessingStarted::get);

            // When
            appendEvents(5);
            blockHandler.countDown();

            // Then
            await().until(() -> listener.drops.size(), is(1));
            assertThat(listener.drops).containsExactly(SubscriptionDropReason.PROCESSING_QUEUE_OVERFLOW);
        }

        @Test
        void subscription_with_invalid_credentials_is_dropped_with_not_authenticated() {
            // Given
            eventSource.shutdown();
            eventSource = new InMemoryEventSource(new UserCredentials("admin", "changeit"));
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener, new UserCredentials("admin", "wrong"));

            // Then
            await().until(() -> listener.drops.size(), is(1));
            assertThat(listener.drops).containsExactly(SubscriptionDropReason.NOT_AUTHENTICATED);
            assertThat(listener.errors.get(0)).isInstanceOf(SecurityException.class);
        }

        @Test
        void subscription_with_valid_credentials_is_not_dropped() {
            // Given
            eventSource.shutdown();
            UserCredentials credentials = new UserCredentials("admin", "changeit");
            eventSource = new InMemoryEventSource(credentials);
            RecordingListener listener = new RecordingListener();

            // When
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), listener, new UserCredentials("admin", "changeit"));

            // Then
            await().until(listener.liveProcessingStarted::get);
            assertThat(listener.drops).isEmpty();
        }

        @Test
        void drop_all_subscriptions_reports_the_given_reason_and_error() {
            // Given
            RecordingListener listener1 = new RecordingListener();
            RecordingListener listener2 = new RecordingListener();
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test1"), listener1);
            eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test2"), listener2);
            await().until(() -> listener1.liveProcessingStarted.get() && listener2.liveProcessingStarted.get());
            RuntimeException connectionLost = new RuntimeException("connection lost");

            // When
            eventSource.dropAllSubscriptions(SubscriptionDropReason.CONNECTION_CLOSED, connectionLost);

            // Then
            await().until(() -> listener1.drops.size() + listener2.drops.size(), is(2));
            assertThat(listener1.drops).containsExactly(SubscriptionDropReason.CONNECTION_CLOSED);
            assertThat(listener2.errors).containsExactly(connectionLost);
        }

        @Test
        void subscribing_throws_ise_when_the_executor_rejects_the_subscription() {
            // Given
            eventSource.shutdown();
            ExecutorService executor = Executors.newSingleThreadExecutor();
            executor.shutdown();
            eventSource = new InMemoryEventSource(executor, null);

            // When
            Throwable throwable = catchThrowable(() -> eventSource.subscribeToAllFrom(StartAt.beginningOfLog(), CatchupSubscriptionSettings.defaults("test"), new RecordingListener()));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
            assertThat(eventSource.numberOfActiveSubscriptions()).isZero();
        }
    }

    private void appendEvents(int count) {
        List<CloudEvent> events = IntStream.range(0, count).mapToObj(__ -> event("OrderPlaced")).collect(Collectors.toList());
        eventSource.append("order-" + UUID.randomUUID(), events.stream());
    }

    private static CloudEvent event(String type) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(URI.create("urn:test"))
                .withType(type)
                .withTime(OffsetDateTime.now(UTC))
                .withData("application/json", "{}".getBytes(UTF_8))
                .build();
    }

    private static class RecordingListener implements CatchupSubscriptionListener {
        final List<PositionAwareCloudEvent> events = new CopyOnWriteArrayList<>();
        final List<SubscriptionDropReason> drops = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final AtomicBoolean liveProcessingStarted = new AtomicBoolean();

        @Override
        public void eventAppeared(CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent) {
            events.add(cloudEvent);
        }

        @Override
        public void liveProcessingStarted(CatchupSubscription subscription) {
            liveProcessingStarted.set(true);
        }

        @Override
        public void subscriptionDropped(CatchupSubscription subscription, SubscriptionDropReason reason, @Nullable Throwable error) {
            drops.add(reason);
            if (error != null) {
                errors.add(error);
            }
        }

        List<Long> positions() {
            return events.stream().map(e -> GlobalPosition.from(e.getSubscriptionPosition()).value()).collect(Collectors.toList());
        }
    }
}
