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
import org.catchup.codec.DecodeResult;
import org.catchup.codec.EventCodec;
import org.catchup.codec.EventDeserializationException;
import org.catchup.eventsource.PositionAwareCloudEvent;
import org.catchup.eventsource.StartAt;
import org.catchup.eventsource.SubscriptionPosition;
import org.catchup.eventsource.api.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;
import static org.catchup.eventsource.EventLogExtensions.STREAM_ID;
import static org.catchup.eventsource.EventLogExtensions.isSystemEventType;
import static org.catchup.projection.ProjectionStatus.*;

/**
 * Keeps a single {@link Projection} subscribed to the event log.
 * <p>
 * On start the coordinator reads the checkpoint of the projection and opens a catch-up subscription after it. Every event
 * that the projection's codec recognizes is handled by the projection and then checkpointed, so a restarted projection resumes
 * after the last handled event. Events whose type starts with {@code $} and events of unknown types are skipped.
 * </p>
 * <p>
 * When the subscription is dropped for a transient reason (see {@link DropClassification}) a new subscription is opened from the
 * last checkpoint after a backoff decided by the {@link ProjectionSubscriptionConfig#restartStrategy}. The number of consecutive
 * failed attempts is reset when an event is checkpointed or the subscription goes live. The projection fails, and is never
 * restarted, if the restart strategy gives up, if the drop reason is not transient, or if a recognized event cannot be deserialized.
 * </p>
 * <p>
 * Subscribing, which reads the checkpoint and opens the subscription, runs on the {@code subscribeExecutor}. The
 * {@code scheduler} only times the backoff before a restart.
 * </p>
 * <p>
 * Only the latest subscription is honored: callbacks from a subscription that has been replaced, or that arrive after the
 * projection was stopped or failed, are ignored.
 * </p>
 *
 * @param <T> The type of the domain events
 */
public class SubscriptionCoordinator<T> {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionCoordinator.class);

    private final Projection<T> projection;
    private final String projectionName;
    private final EventSource eventSource;
    private final CheckpointStore checkpointStore;
    private final EventCodec<T> codec;
    private final ProjectionSubscriptionConfig config;
    private final CatchupSubscriptionSettings subscriptionSettings;
    private final ProjectionObserver observer;
    private final ScheduledExecutorService scheduler;
    private final Executor subscribeExecutor;
    private final Clock clock;

    private final CompletableFuture<ProjectionStatus> firstAttempt = new CompletableFuture<>();

    private final Object lock = new Object();
    // Guarded by lock
    private ProjectionStatus status = IDLE;
    private long generation = 0;
    private Attempt currentAttempt;
    private int consecutiveFailedAttempts = 0;
    private ScheduledFuture<?> pendingRestart;
    private Throwable failureCause;

    private volatile boolean live = false;

    public SubscriptionCoordinator(Projection<T> projection, EventSource eventSource, CheckpointStore checkpointStore, EventCodec<T> codec,
                                   ProjectionSubscriptionConfig config, ProjectionObserver observer, ScheduledExecutorService scheduler) {
        this(projection, eventSource, checkpointStore, codec, config, observer, scheduler, scheduler);
    }

    /**
     * @param scheduler         Times the backoff before a restart
     * @param subscribeExecutor Runs restarts, i.e. reading the checkpoint and opening a new subscription
     */
    public SubscriptionCoordinator(Projection<T> projection, EventSource eventSource, CheckpointStore checkpointStore, EventCodec<T> codec,
                                   ProjectionSubscriptionConfig config, ProjectionObserver observer, ScheduledExecutorService scheduler,
                                   Executor subscribeExecutor) {
        this(projection, eventSource, checkpointStore, codec, config, observer, scheduler, subscribeExecutor, Clock.systemUTC());
    }

    SubscriptionCoordinator(Projection<T> projection, EventSource eventSource, CheckpointStore checkpointStore, EventCodec<T> codec,
                            ProjectionSubscriptionConfig config, ProjectionObserver observer, ScheduledExecutorService scheduler,
                            Executor subscribeExecutor, Clock clock) {
        requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        requireNonNull(eventSource, EventSource.class.getSimpleName() + " cannot be null");
        requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
        requireNonNull(codec, EventCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ProjectionSubscriptionConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(observer, ProjectionObserver.class.getSimpleName() + " cannot be null");
        requireNonNull(scheduler, "scheduler cannot be null");
        requireNonNull(subscribeExecutor, "subscribeExecutor cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.projection = projection;
        this.projectionName = requireNonNull(projection.name(), "Projection name cannot be null");
        this.eventSource = eventSource;
        this.checkpointStore = checkpointStore;
        this.codec = codec;
        this.config = config;
        this.subscriptionSettings = config.subscriptionSettings(projectionName);
        this.observer = observer;
        this.scheduler = scheduler;
        this.subscribeExecutor = subscribeExecutor;
        this.clock = clock;
    }

    /**
     * Start the projection. The subscription is opened on the calling thread.
     *
     * @return A future that is completed with the status of the projection once the first subscription attempt has either
     * succeeded ({@link ProjectionStatus#SUBSCRIBED}) or failed ({@link ProjectionStatus#DROPPED} with a pending restart, or
     * {@link ProjectionStatus#FAILED}). The future is never completed exceptionally.
     * @throws IllegalStateException If the projection has already been started
     */
    public CompletableFuture<ProjectionStatus> start() {
        return start(Runnable::run);
    }

    /**
     * Same as {@link #start()} but the first subscription attempt runs on the given executor. The status is
     * {@link ProjectionStatus#STARTING} when this method returns.
     */
    CompletableFuture<ProjectionStatus> start(Executor executor) {
        synchronized (lock) {
            if (status != IDLE) {
                throw new IllegalStateException("Projection " + projectionName + " has already been started (status=" + status + ")");
            }
            status = STARTING;
        }
        try {
            executor.execute(this::subscribe);
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                status = FAILED;
                failureCause = e;
            }
            observer.failed(projectionName, "Cannot start projection since the executor is shutdown", e);
            firstAttempt.complete(FAILED);
        }
        return firstAttempt;
    }

    /**
     * Stop the projection. A pending restart is cancelled and the current subscription is stopped. A stopped projection cannot
     * be started again. Calling this method on a projection that is already stopped or failed has no effect.
     */
    public void stop() {
        final Attempt attempt;
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            status = STOPPED;
            live = false;
            cancelPendingRestart();
            attempt = currentAttempt;
        }
        if (attempt != null) {
            attempt.stopSubscription();
        }
        firstAttempt.complete(STOPPED);
        observer.stopped(projectionName);
    }

    public String name() {
        return projectionName;
    }

    public ProjectionStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    /**
     * @return {@code true} if the projection has caught up with the end of the log and processes live events.
     */
    public boolean isLive() {
        return live;
    }

    /**
     * @return The error that made the projection fail, if any.
     */
    public Optional<Throwable> failureCause() {
        synchronized (lock) {
            return Optional.ofNullable(failureCause);
        }
    }

    private void subscribe() {
        final Attempt attempt;
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            status = STARTING;
            live = false;
            pendingRestart = null;
            attempt = new Attempt(++generation);
            currentAttempt = attempt;
        }

        final StartAt startAt;
        final CatchupSubscription subscription;
        try {
            SubscriptionPosition checkpoint = checkpointStore.read(projectionName);
            startAt = StartAt.checkpoint(checkpoint);
            log.debug("Subscribing projection {} (attempt={}, startAt={})", projectionName, attempt.generation, startAt);
            subscription = eventSource.subscribeToAllFrom(startAt, subscriptionSettings, attempt, config.credentials);
        } catch (Exception e) {
            log.debug("Failed to subscribe projection {}", projectionName, e);
            dropped(attempt, SubscriptionDropReason.SUBSCRIBING_ERROR, e);
            return;
        }
        attempt.subscription = subscription;

        boolean subscribed = false;
        boolean stopSubscription = false;
        synchronized (lock) {
            if (currentAttempt == attempt && status == STARTING) {
                status = SUBSCRIBED;
                subscribed = true;
            } else if (currentAttempt == attempt && status.isTerminal()) {
                // Stopped or failed while subscribing
                stopSubscription = true;
            }
        }

        if (stopSubscription) {
            subscription.stop();
        } else if (subscribed) {
            observer.subscribed(projectionName, startAt);
            firstAttempt.complete(SUBSCRIBED);
        }
    }

    private void eventAppeared(Attempt attempt, CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent) {
        if (!isActive(attempt)) {
            return;
        }

        String originalType = cloudEvent.getOriginalType();
        if (isSystemEventType(originalType)) {
            log.trace("Projection {} skips system event {} at {}", projectionName, originalType, cloudEvent.getSubscriptionPosition());
            return;
        }

        final DecodeResult<T> decodeResult;
        try {
            decodeResult = codec.decode(cloudEvent);
        } catch (EventDeserializationException e) {
            fail(attempt, subscription, "Cannot deserialize event " + cloudEvent.getId() + " of type " + cloudEvent.getType() + " at position " + cloudEvent.getSubscriptionPosition().asString(), e);
            return;
        }

        if (decodeResult instanceof DecodeResult.UnknownEventType) {
            log.trace("Projection {} skips event of unknown type {} at {}", projectionName, cloudEvent.getType(), cloudEvent.getSubscriptionPosition());
            return;
        }

        T domainEvent = ((DecodeResult.Decoded<T>) decodeResult).domainEvent();
        SubscriptionPosition position = cloudEvent.getSubscriptionPosition();
        projection.handle(domainEvent);
        checkpointStore.save(projectionName, position);

        synchronized (lock) {
            if (currentAttempt == attempt) {
                consecutiveFailedAttempts = 0;
            }
        }

        Object streamId = cloudEvent.getExtension(STREAM_ID);
        observer.eventProjected(new ProjectedEvent<>(clock.instant(), streamId == null ? null : streamId.toString(), domainEvent, projectionName, position));
    }

    private void liveProcessingStarted(Attempt attempt) {
        synchronized (lock) {
            if (currentAttempt != attempt || status.isTerminal()) {
                return;
            }
            live = true;
            consecutiveFailedAttempts = 0;
        }
        observer.liveProcessingStarted(projectionName);
    }

    private void dropped(Attempt attempt, SubscriptionDropReason reason, @Nullable Throwable error) {
        DropClassification classification = DropClassification.classify(reason);
        final ProjectionStatus newStatus;
        int attemptNumber = 0;
        Duration backoff = null;
        synchronized (lock) {
            if (currentAttempt != attempt || status.isTerminal()) {
                log.debug("Ignoring drop (reason={}) of a superseded subscription for projection {}", reason, projectionName);
                return;
            }
            live = false;
            switch (classification) {
                case USER_INITIATED:
                    status = STOPPED;
                    break;
                case TRANSIENT:
                    consecutiveFailedAttempts++;
                    attemptNumber = consecutiveFailedAttempts + 1;
                    Throwable cause = error == null ? new SubscriptionDroppedException(projectionName, reason) : error;
                    Optional<Duration> nextBackoff = config.restartStrategy.backoffBeforeAttempt(attemptNumber, cause);
                    if (nextBackoff.isPresent()) {
                        backoff = nextBackoff.get();
                        status = DROPPED;
                    } else {
                        status = FAILED;
                    }
                    break;
                default:
                    status = FAILED;
            }
            if (status == FAILED) {
                failureCause = error;
            }
            newStatus = status;
        }

        if (newStatus == STOPPED) {
            observer.stopped(projectionName);
        } else {
            observer.dropped(projectionName, reason, error);
            if (newStatus == DROPPED) {
                observer.restarting(projectionName, attemptNumber, backoff);
            } else if (classification == DropClassification.TRANSIENT) {
                observer.failed(projectionName, "Gave up restarting after " + (attemptNumber - 1) + " consecutive failed attempt(s), last drop reason was " + reason, error);
            } else {
                observer.failed(projectionName, "Subscription was dropped with reason " + reason, error);
            }
        }

        // Observers see the drop before the restart is scheduled
        if (newStatus == DROPPED && !scheduleRestart(attempt, backoff)) {
            firstAttempt.complete(FAILED);
        } else {
            firstAttempt.complete(newStatus);
        }
    }

    private void fail(Attempt attempt, CatchupSubscription subscription, String description, Throwable error) {
        synchronized (lock) {
            if (currentAttempt != attempt || status.isTerminal()) {
                return;
            }
            status = FAILED;
            live = false;
            failureCause = error;
            cancelPendingRestart();
        }
        subscription.stop();
        observer.failed(projectionName, description, error);
        firstAttempt.complete(FAILED);
    }

    /**
     * @return {@code false} if the projection failed since the restart could not be scheduled
     */
    private boolean scheduleRestart(Attempt attempt, Duration backoff) {
        RejectedExecutionException rejected;
        synchronized (lock) {
            if (currentAttempt != attempt || status != DROPPED) {
                // Stopped while the drop was reported
                return true;
            }
            try {
                pendingRestart = scheduler.schedule(this::restart, backoff.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (RejectedExecutionException e) {
                log.warn("Cannot restart projection {} since the scheduler is shutdown", projectionName);
                status = FAILED;
                failureCause = e;
                rejected = e;
            }
        }
        observer.failed(projectionName, "Cannot schedule restart since the scheduler is shutdown", rejected);
        return false;
    }

    private void restart() {
        try {
            subscribeExecutor.execute(this::subscribe);
        } catch (RejectedExecutionException e) {
            log.warn("Cannot restart projection {} since the subscribe executor is shutdown", projectionName);
            synchronized (lock) {
                if (status != DROPPED) {
                    return;
                }
                status = FAILED;
                failureCause = e;
            }
            observer.failed(projectionName, "Cannot restart since the subscribe executor is shutdown", e);
        }
    }

    // Must be called while holding the lock
    private void cancelPendingRestart() {
        if (pendingRestart != null) {
            pendingRestart.cancel(false);
            pendingRestart = null;
        }
    }

    private boolean isActive(Attempt attempt) {
        synchronized (lock) {
            return currentAttempt == attempt && !status.isTerminal();
        }
    }

    @Override
    public String toString() {
        return "SubscriptionCoordinator{" + "projectionName='" + projectionName + '\'' + ", status=" + status() + ", live=" + live + '}';
    }

    /**
     * The listener of a single subscription attempt.
     */
    private final class Attempt implements CatchupSubscriptionListener {
        private final long generation;
        private volatile CatchupSubscription subscription;

        private Attempt(long generation) {
            this.generation = generation;
        }

        @Override
        public void eventAppeared(CatchupSubscription subscription, PositionAwareCloudEvent cloudEvent) {
            SubscriptionCoordinator.this.eventAppeared(this, subscription, cloudEvent);
        }

        @Override
        public void liveProcessingStarted(CatchupSubscription subscription) {
            SubscriptionCoordinator.this.liveProcessingStarted(this);
        }

        @Override
        public void subscriptionDropped(CatchupSubscription subscription, SubscriptionDropReason reason, @Nullable Throwable error) {
            subscription.stop();
            SubscriptionCoordinator.this.dropped(this, reason, error);
        }

        private void stopSubscription() {
            CatchupSubscription subscription = this.subscription;
            if (subscription != null) {
                subscription.stop();
            }
        }
    }
}
