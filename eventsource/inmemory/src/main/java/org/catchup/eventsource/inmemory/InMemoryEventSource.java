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
import io.cloudevents.SpecVersion;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.catchup.eventsource.GlobalPosition;
import org.catchup.eventsource.PositionAwareCloudEvent;
import org.catchup.eventsource.StartAt;
import org.catchup.eventsource.StartAt.StartAtSubscriptionPosition;
import org.catchup.eventsource.api.*;
import org.catchup.eventsource.internal.ExecutorShutdown;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static org.catchup.eventsource.EventLogExtensions.*;

/**
 * An {@link EventSource} that keeps a single, globally ordered event log in memory. This is mainly useful for testing
 * and/or demo purposes.
 * <p>
 * Every subscription runs on its own thread from the supplied executor. It first replays the historic events in pages of
 * {@link CatchupSubscriptionSettings#readBatchSize} and then switches to live delivery. The switch is atomic with regard to
 * {@link #append(String, Stream)}, so no event is missed or delivered twice at the switch. Live events are buffered in a queue
 * bounded by {@link CatchupSubscriptionSettings#maxLiveQueueSize}, the subscription is dropped with
 * {@link SubscriptionDropReason#PROCESSING_QUEUE_OVERFLOW} if the queue is full.
 * </p>
 */
public class InMemoryEventSource implements EventSource {
    private static final URI LINK_SOURCE = URI.create("urn:catchup:link");

    private final Object lock = new Object();
    // The event at index i has global position i + 1
    private final List<StoredEvent> log = new ArrayList<>();
    private final Map<String, Long> streamVersions = new HashMap<>();
    private final Set<InMemoryCatchupSubscription> liveSubscriptions = new HashSet<>();
    private final Set<InMemoryCatchupSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    private final ExecutorService subscriptionExecutor;
    private final UserCredentials requiredCredentials;

    private volatile boolean shutdown = false;

    /**
     * Create an {@link InMemoryEventSource} that doesn't require credentials and runs every subscription on a thread from
     * an unbounded cached thread pool.
     */
    public InMemoryEventSource() {
        this(Executors.newCachedThreadPool(), null);
    }

    /**
     * Create an {@link InMemoryEventSource} that only accepts subscriptions made with the given credentials.
     * Subscriptions with other credentials are dropped with {@link SubscriptionDropReason#NOT_AUTHENTICATED}.
     */
    public InMemoryEventSource(UserCredentials requiredCredentials) {
        this(Executors.newCachedThreadPool(), requireNonNull(requiredCredentials, UserCredentials.class.getSimpleName() + " cannot be null"));
    }

    /**
     * Create an instance of {@link InMemoryEventSource} with the given parameters
     *
     * @param subscriptionExecutor The executor that runs the subscriptions, one task per subscription
     * @param requiredCredentials  The credentials subscriptions must supply, or {@code null} if none are required
     */
    public InMemoryEventSource(ExecutorService subscriptionExecutor, @Nullable UserCredentials requiredCredentials) {
        requireNonNull(subscriptionExecutor, "subscriptionExecutor cannot be null");
        this.subscriptionExecutor = subscriptionExecutor;
        this.requiredCredentials = requiredCredentials;
    }

    /**
     * Append events to the end of the log.
     *
     * @param streamId The stream the events belong to
     * @param events   The events to append, must be CloudEvents 1.0
     * @return The global position of the last appended event, or the current head position if {@code events} was empty.
     */
    public GlobalPosition append(String streamId, Stream<CloudEvent> events) {
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(events, "events cannot be null");
        List<CloudEvent> cloudEvents = events.peek(e -> {
            if (e.getSpecVersion() != SpecVersion.V1) {
                throw new IllegalArgumentException("Spec version needs to be " + SpecVersion.V1);
            }
        }).collect(Collectors.toList());

        synchronized (lock) {
            assertNotShutdown();
            long streamVersion = streamVersions.getOrDefault(streamId, 0L);
            for (CloudEvent cloudEvent : cloudEvents) {
                streamVersion++;
                CloudEvent stored = CloudEventBuilder.v1(cloudEvent)
                        .withExtension(STREAM_ID, streamId)
                        .withExtension(STREAM_VERSION, streamVersion)
                        .build();
                StoredEvent storedEvent = new StoredEvent(GlobalPosition.of(log.size() + 1), stored);
                log.add(storedEvent);
                publishToLiveSubscriptions(storedEvent);
            }
            streamVersions.put(streamId, streamVersion);
            return headPosition();
        }
    }

    public GlobalPosition append(String streamId, CloudEvent... events) {
        return append(streamId, Stream.of(events));
    }

    /**
     * Append a link record to {@code streamId} that points to the event at {@code target}. Subscriptions with
     * {@link CatchupSubscriptionSettings#resolveLinkTos} receive the target event (with the {@value org.catchup.eventsource.EventLogExtensions#ORIGINAL_TYPE}
     * extension set to {@value org.catchup.eventsource.EventLogExtensions#LINK_EVENT_TYPE}), other subscriptions receive the link record itself.
     *
     * @return The global position of the link record
     */
    public GlobalPosition appendLink(String streamId, GlobalPosition target) {
        requireNonNull(target, "target cannot be null");
        synchronized (lock) {
            if (target.value() < 1 || target.value() > log.size()) {
                throw new IllegalArgumentException("There's no event at " + target);
            }
        }
        CloudEvent link = CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(LINK_SOURCE)
                .withType(LINK_EVENT_TYPE)
                .withTime(OffsetDateTime.now(UTC))
                .withData("text/plain", target.asString().getBytes(StandardCharsets.UTF_8))
                .build();
        return append(streamId, link);
    }

    /**
     * @return The position of the last event in the log, {@code GlobalPosition.of(0)} if the log is empty.
     */
    public GlobalPosition headPosition() {
        synchronized (lock) {
            return GlobalPosition.of(log.size());
        }
    }

    /**
     * Drop all current subscriptions with the given reason, e.g. to simulate that the connection to a real event log was lost.
     */
    public void dropAllSubscriptions(SubscriptionDropReason reason, @Nullable Throwable error) {
        requireNonNull(reason, SubscriptionDropReason.class.getSimpleName() + " cannot be null");
        subscriptions.forEach(subscription -> subscription.requestDrop(reason, error));
    }

    /**
     * @return The number of subscriptions that have not yet been dropped
     */
    public int numberOfActiveSubscriptions() {
        return subscriptions.size();
    }

    @Override
    public CatchupSubscription subscribeToAllFrom(StartAt startAt, CatchupSubscriptionSettings settings, CatchupSubscriptionListener listener, @Nullable UserCredentials credentials) {
        requireNonNull(startAt, StartAt.class.getSimpleName() + " cannot be null");
        requireNonNull(settings, CatchupSubscriptionSettings.class.getSimpleName() + " cannot be null");
        requireNonNull(listener, "listener cannot be null");
        assertNotShutdown();

        final GlobalPosition from;
        if (startAt instanceof StartAtSubscriptionPosition) {
            from = GlobalPosition.from(((StartAtSubscriptionPosition) startAt).subscriptionPosition);
        } else {
            from = GlobalPosition.of(0);
        }

        InMemoryCatchupSubscription subscription = new InMemoryCatchupSubscription(this, settings, listener, credentials, from);
        subscriptions.add(subscription);
        try {
            subscriptionExecutor.execute(subscription);
        } catch (RejectedExecutionException e) {
            subscriptions.remove(subscription);
            throw new IllegalStateException("Cannot start subscription " + settings.subscriptionName + " because the executor is shutdown or saturated", e);
        }
        return subscription;
    }

    /**
     * Stop all subscriptions and shutdown the executor. An {@code InMemoryEventSource} that is shutdown cannot be used again.
     */
    public void shutdown() {
        shutdown = true;
        subscriptions.forEach(InMemoryCatchupSubscription::stop);
        ExecutorShutdown.shutdownSafely(subscriptionExecutor, 5, TimeUnit.SECONDS);
    }

    List<StoredEvent> readForward(GlobalPosition after, int maxCount) {
        synchronized (lock) {
            int fromIndex = (int) Math.min(after.value(), log.size());
            int toIndex = Math.min(log.size(), fromIndex + maxCount);
            return new ArrayList<>(log.subList(fromIndex, toIndex));
        }
    }

    /**
     * Register the subscription for live events if it has read everything up to the head of the log.
     *
     * @return {@code true} if the subscription is now live, {@code false} if there are more historic events to read.
     */
    boolean goLiveIfCaughtUp(InMemoryCatchupSubscription subscription, GlobalPosition lastPosition) {
        synchronized (lock) {
            if (log.size() > lastPosition.value()) {
                return false;
            }
            liveSubscriptions.add(subscription);
            return true;
        }
    }

    void unregister(InMemoryCatchupSubscription subscription) {
        synchronized (lock) {
            liveSubscriptions.remove(subscription);
        }
        subscriptions.remove(subscription);
    }

    boolean isAuthorized(@Nullable UserCredentials credentials) {
        return requiredCredentials == null || requiredCredentials.equals(credentials);
    }

    PositionAwareCloudEvent toDeliverable(StoredEvent storedEvent, boolean resolveLinkTos) {
        CloudEvent cloudEvent = storedEvent.cloudEvent;
        if (resolveLinkTos && LINK_EVENT_TYPE.equals(cloudEvent.getType())) {
            CloudEvent target = resolveLink(cloudEvent);
            CloudEvent resolved = CloudEventBuilder.v1(target).withExtension(ORIGINAL_TYPE, LINK_EVENT_TYPE).build();
            return new PositionAwareCloudEvent(resolved, storedEvent.position);
        }
        return new PositionAwareCloudEvent(cloudEvent, storedEvent.position);
    }

    private CloudEvent resolveLink(CloudEvent link) {
        GlobalPosition target = GlobalPosition.parse(new String(requireNonNull(link.getData(), "link data cannot be null").toBytes(), StandardCharsets.UTF_8));
        synchronized (lock) {
            return log.get((int) target.value() - 1).cloudEvent;
        }
    }

    // Must be called while holding the lock
    private void publishToLiveSubscriptions(StoredEvent storedEvent) {
        Iterator<InMemoryCatchupSubscription> iterator = liveSubscriptions.iterator();
        while (iterator.hasNext()) {
            InMemoryCatchupSubscription subscription = iterator.next();
            if (!subscription.offerLiveEvent(storedEvent)) {
                iterator.remove();
                subscription.requestDrop(SubscriptionDropReason.PROCESSING_QUEUE_OVERFLOW, null);
            }
        }
    }

    private void assertNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException(InMemoryEventSource.class.getSimpleName() + " is shutdown");
        }
    }

    static final class StoredEvent {
        final GlobalPosition position;
        final CloudEvent cloudEvent;

        private StoredEvent(GlobalPosition position, CloudEvent cloudEvent) {
            this.position = position;
            this.cloudEvent = cloudEvent;
        }
    }
}
