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

import org.catchup.eventsource.StartAt;
import org.catchup.eventsource.api.SubscriptionDropReason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Delegates to several observers. An observer that throws is logged and the remaining observers are still notified.
 */
class CompositeProjectionObserver implements ProjectionObserver {
    private static final Logger log = LoggerFactory.getLogger(CompositeProjectionObserver.class);

    private final List<ProjectionObserver> observers;

    CompositeProjectionObserver(List<ProjectionObserver> observers) {
        requireNonNull(observers, "observers cannot be null");
        this.observers = List.copyOf(observers);
    }

    @Override
    public void eventProjected(ProjectedEvent<?> projectedEvent) {
        notifyObservers(observer -> observer.eventProjected(projectedEvent));
    }

    @Override
    public void subscribed(String projectionName, StartAt startAt) {
        notifyObservers(observer -> observer.subscribed(projectionName, startAt));
    }

    @Override
    public void liveProcessingStarted(String projectionName) {
        notifyObservers(observer -> observer.liveProcessingStarted(projectionName));
    }

    @Override
    public void dropped(String projectionName, SubscriptionDropReason reason, @Nullable Throwable error) {
        notifyObservers(observer -> observer.dropped(projectionName, reason, error));
    }

    @Override
    public void restarting(String projectionName, int attemptNumber, Duration backoff) {
        notifyObservers(observer -> observer.restarting(projectionName, attemptNumber, backoff));
    }

    @Override
    public void stopped(String projectionName) {
        notifyObservers(observer -> observer.stopped(projectionName));
    }

    @Override
    public void failed(String projectionName, String description, @Nullable Throwable error) {
        notifyObservers(observer -> observer.failed(projectionName, description, error));
    }

    private void notifyObservers(Consumer<ProjectionObserver> notification) {
        for (ProjectionObserver observer : observers) {
            try {
                notification.accept(observer);
            } catch (RuntimeException e) {
                log.warn("Projection observer {} threw exception, ignoring.", observer.getClass().getName(), e);
            }
        }
    }
}
