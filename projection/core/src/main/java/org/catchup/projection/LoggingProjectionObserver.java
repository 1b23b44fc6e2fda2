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

/**
 * A {@link ProjectionObserver} that logs using SLF4J. Projected events are logged on {@code DEBUG} level, or on {@code INFO}
 * level if verbose logging is enabled.
 */
public class LoggingProjectionObserver implements ProjectionObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingProjectionObserver.class);

    private final boolean verbose;

    public LoggingProjectionObserver(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void eventProjected(ProjectedEvent<?> projectedEvent) {
        if (verbose) {
            log.info("Projection {} handled {} from stream {} at position {}", projectedEvent.projectionName(), projectedEvent.domainEvent(), projectedEvent.streamId(), projectedEvent.position().asString());
        } else if (log.isDebugEnabled()) {
            log.debug("Projection {} handled {} from stream {} at position {}", projectedEvent.projectionName(), projectedEvent.domainEvent().getClass().getSimpleName(), projectedEvent.streamId(), projectedEvent.position().asString());
        }
    }

    @Override
    public void subscribed(String projectionName, StartAt startAt) {
        if (startAt.isBeginningOfLog()) {
            log.info("Projection {} subscribed from the beginning of the log", projectionName);
        } else {
            log.info("Projection {} subscribed from checkpoint {}", projectionName, startAt);
        }
    }

    @Override
    public void liveProcessingStarted(String projectionName) {
        log.info("Projection {} has caught up and is processing live events", projectionName);
    }

    @Override
    public void dropped(String projectionName, SubscriptionDropReason reason, @Nullable Throwable error) {
        if (error == null) {
            log.warn("Subscription for projection {} was dropped (reason={})", projectionName, reason);
        } else {
            log.warn("Subscription for projection {} was dropped (reason={}): {}", projectionName, reason, error.getMessage(), error);
        }
    }

    @Override
    public void restarting(String projectionName, int attemptNumber, Duration backoff) {
        log.info("Restarting projection {} in {} ms (attempt {})", projectionName, backoff.toMillis(), attemptNumber);
    }

    @Override
    public void stopped(String projectionName) {
        log.info("Projection {} stopped", projectionName);
    }

    @Override
    public void failed(String projectionName, String description, @Nullable Throwable error) {
        log.error("Projection {} failed and will not be restarted: {}", projectionName, description, error);
    }
}
