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
import org.catchup.codec.EventCodec;
import org.catchup.eventsource.api.EventSource;
import org.catchup.eventsource.api.UserCredentials;
import org.catchup.eventsource.internal.ExecutorShutdown;
import org.catchup.retry.RetryStrategy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Runs a set of projections, each with its own {@link SubscriptionCoordinator}. Projections are independent of each other,
 * a projection that fails or is restarted never affects the others.
 * <p>
 * Example:
 * <pre>
 * ProjectionManager&lt;OrderEvent&gt; projectionManager = ProjectionManager.builder(eventSource, checkpointStore, codec)
 *         .projections(ordersPerCustomer, revenue)
 *         .readBatchSize(200)
 *         .verboseLogging(true)
 *         .build();
 * projectionManager.startAll().join();
 * </pre>
 * </p>
 *
 * @param <T> The type of the domain events
 */
public class ProjectionManager<T> {
    private static final Logger log = LoggerFactory.getLogger(ProjectionManager.class);

    private final Map<String, Projection<T>> projections;
    private final Function<Projection<T>, SubscriptionCoordinator<T>> coordinatorFactory;
    // Guarded by itself
    private final Map<String, SubscriptionCoordinator<T>> coordinators = new HashMap<>();
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService subscribeExecutor;

    private ProjectionManager(Map<String, Projection<T>> projections, Function<Projection<T>, SubscriptionCoordinator<T>> coordinatorFactory,
                              ScheduledExecutorService scheduler, boolean ownsScheduler, ExecutorService subscribeExecutor) {
        this.projections = projections;
        this.coordinatorFactory = coordinatorFactory;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.subscribeExecutor = subscribeExecutor;
        projections.values().forEach(projection -> coordinators.put(projection.name(), coordinatorFactory.apply(projection)));
    }

    public static <T> Builder<T> builder(EventSource eventSource, CheckpointStore checkpointStore, EventCodec<T> codec) {
        return new Builder<>(eventSource, checkpointStore, codec);
    }

    /**
     * Start all projections concurrently. Projections that are already running are left as they are, projections that
     * were stopped or have failed are started again from their checkpoint.
     *
     * @return A future that is completed when the first subscription attempt of every projection has either succeeded or failed.
     * Use {@link #status(String)} to find out how it went for a specific projection.
     */
    public CompletableFuture<Void> startAll() {
        log.info("Starting {} projection(s): {}", projections.size(), projections.keySet());
        CompletableFuture<?>[] started = projections.keySet().stream()
                .map(this::start)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(started);
    }

    /**
     * Start a single projection. A projection that is {@link ProjectionStatus#STOPPED stopped} or
     * {@link ProjectionStatus#FAILED failed} gets a new subscription coordinator that resumes after the projection's checkpoint.
     * Starting a projection that is already running has no effect.
     *
     * @return A future that is completed with the status of the projection once its first subscription attempt has either
     * succeeded or failed, or immediately with the current status if the projection is already running.
     * @throws IllegalArgumentException If there's no projection with the given name
     */
    public CompletableFuture<ProjectionStatus> start(String projectionName) {
        Projection<T> projection = projection(projectionName);
        synchronized (coordinators) {
            SubscriptionCoordinator<T> coordinator = coordinators.get(projectionName);
            ProjectionStatus status = coordinator.status();
            if (status.isTerminal()) {
                log.info("Starting {} projection {} again", status.name().toLowerCase(Locale.ROOT), projectionName);
                coordinator = coordinatorFactory.apply(projection);
                coordinators.put(projectionName, coordinator);
            } else if (status != ProjectionStatus.IDLE) {
                log.debug("Projection {} is already running (status={})", projectionName, status);
                return CompletableFuture.completedFuture(status);
            }
            return coordinator.start(subscribeExecutor);
        }
    }

    /**
     * Stop all projections.
     */
    public void stopAll() {
        projections.keySet().forEach(name -> coordinator(name).stop());
    }

    /**
     * Stop a single projection. It can be started again with {@link #start(String)}.
     *
     * @throws IllegalArgumentException If there's no projection with the given name
     */
    public void stop(String projectionName) {
        coordinator(projectionName).stop();
    }

    /**
     * @throws IllegalArgumentException If there's no projection with the given name
     */
    public ProjectionStatus status(String projectionName) {
        return coordinator(projectionName).status();
    }

    /**
     * @throws IllegalArgumentException If there's no projection with the given name
     */
    public boolean isLive(String projectionName) {
        return coordinator(projectionName).isLive();
    }

    /**
     * @throws IllegalArgumentException If there's no projection with the given name
     */
    public Optional<Throwable> failureCause(String projectionName) {
        return coordinator(projectionName).failureCause();
    }

    /**
     * @return The names of the projections in the order they were added
     */
    public Set<String> projectionNames() {
        return projections.keySet();
    }

    /**
     * Stop all projections and release the executors of the manager. The restart scheduler is only shutdown if it was not
     * supplied to the {@link Builder}.
     */
    public void shutdown() {
        stopAll();
        if (ownsScheduler) {
            ExecutorShutdown.shutdownSafely(scheduler, 5, TimeUnit.SECONDS);
        }
        ExecutorShutdown.shutdownSafely(subscribeExecutor, 5, TimeUnit.SECONDS);
    }

    private Projection<T> projection(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        Projection<T> projection = projections.get(projectionName);
        if (projection == null) {
            throw new IllegalArgumentException("There's no projection named " + projectionName);
        }
        return projection;
    }

    private SubscriptionCoordinator<T> coordinator(String projectionName) {
        projection(projectionName);
        synchronized (coordinators) {
            return coordinators.get(projectionName);
        }
    }

    public static final class Builder<T> {
        private final EventSource eventSource;
        private final CheckpointStore checkpointStore;
        private final EventCodec<T> codec;
        private final List<Projection<T>> projections = new ArrayList<>();
        private final List<ProjectionObserver> observers = new ArrayList<>();
        private ProjectionSubscriptionConfig config = new ProjectionSubscriptionConfig();
        private boolean verboseLogging = false;
        private ScheduledExecutorService scheduler;

        private Builder(EventSource eventSource, CheckpointStore checkpointStore, EventCodec<T> codec) {
            requireNonNull(eventSource, EventSource.class.getSimpleName() + " cannot be null");
            requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
            requireNonNull(codec, EventCodec.class.getSimpleName() + " cannot be null");
            this.eventSource = eventSource;
            this.checkpointStore = checkpointStore;
            this.codec = codec;
        }

        @SafeVarargs
        public final Builder<T> projections(Projection<T>... projections) {
            requireNonNull(projections, "projections cannot be null");
            return projections(Arrays.asList(projections));
        }

        public Builder<T> projections(Collection<? extends Projection<T>> projections) {
            requireNonNull(projections, "projections cannot be null");
            projections.forEach(projection -> this.projections.add(requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null")));
            return this;
        }

        /**
         * @param maxLiveQueueSize The max number of live events to buffer per projection. Default is {@value org.catchup.eventsource.api.CatchupSubscriptionSettings#DEFAULT_MAX_LIVE_QUEUE_SIZE}.
         */
        public Builder<T> maxLiveQueueSize(int maxLiveQueueSize) {
            config = config.maxLiveQueueSize(maxLiveQueueSize);
            return this;
        }

        /**
         * @param readBatchSize The number of historic events to read per page during catch-up. Default is {@value org.catchup.eventsource.api.CatchupSubscriptionSettings#DEFAULT_READ_BATCH_SIZE}.
         */
        public Builder<T> readBatchSize(int readBatchSize) {
            config = config.readBatchSize(readBatchSize);
            return this;
        }

        /**
         * @param verboseLogging Log every projected event on {@code INFO} level instead of {@code DEBUG}. Default is {@code false}.
         */
        public Builder<T> verboseLogging(boolean verboseLogging) {
            this.verboseLogging = verboseLogging;
            return this;
        }

        public Builder<T> credentials(@Nullable UserCredentials credentials) {
            config = config.credentials(credentials);
            return this;
        }

        /**
         * @param restartStrategy Decides when to restart a projection whose subscription was dropped for a transient reason.
         *                        Default is {@link ProjectionSubscriptionConfig#defaultRestartStrategy()}.
         */
        public Builder<T> restartStrategy(RetryStrategy restartStrategy) {
            config = config.restartStrategy(restartStrategy);
            return this;
        }

        /**
         * Add an observer that is notified in addition to the logging observer that is always installed.
         */
        public Builder<T> observer(ProjectionObserver observer) {
            observers.add(requireNonNull(observer, ProjectionObserver.class.getSimpleName() + " cannot be null"));
            return this;
        }

        /**
         * Use the given scheduler to time the backoff before restarting projections. The scheduler is not shutdown by
         * {@link ProjectionManager#shutdown()}. Starts and restarts themselves run on threads owned by the manager.
         */
        public Builder<T> scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = requireNonNull(scheduler, "scheduler cannot be null");
            return this;
        }

        /**
         * @throws IllegalArgumentException If two projections have the same name
         */
        public ProjectionManager<T> build() {
            Map<String, Projection<T>> projectionsByName = new LinkedHashMap<>();
            for (Projection<T> projection : projections) {
                String name = requireNonNull(projection.name(), "Projection name cannot be null");
                if (projectionsByName.putIfAbsent(name, projection) != null) {
                    throw new IllegalArgumentException("Duplicate projection name: " + name);
                }
            }

            boolean ownsScheduler = scheduler == null;
            ScheduledExecutorService schedulerToUse = ownsScheduler ? newScheduler(projectionsByName.size()) : scheduler;
            ExecutorService subscribeExecutor = Executors.newCachedThreadPool(daemonThreadFactory("projection-subscriber-"));

            List<ProjectionObserver> allObservers = new ArrayList<>();
            allObservers.add(new LoggingProjectionObserver(verboseLogging));
            allObservers.addAll(observers);
            ProjectionObserver observer = new CompositeProjectionObserver(allObservers);

            ProjectionSubscriptionConfig config = this.config;
            Function<Projection<T>, SubscriptionCoordinator<T>> coordinatorFactory = projection ->
                    new SubscriptionCoordinator<>(projection, eventSource, checkpointStore, codec, config, observer, schedulerToUse, subscribeExecutor);
            return new ProjectionManager<>(Collections.unmodifiableMap(projectionsByName), coordinatorFactory, schedulerToUse, ownsScheduler, subscribeExecutor);
        }

        private static ScheduledExecutorService newScheduler(int numberOfProjections) {
            return Executors.newScheduledThreadPool(Math.max(1, Math.min(numberOfProjections, 4)), daemonThreadFactory("projection-restart-scheduler-"));
        }

        private static ThreadFactory daemonThreadFactory(String namePrefix) {
            AtomicInteger threadNumber = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, namePrefix + threadNumber.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
