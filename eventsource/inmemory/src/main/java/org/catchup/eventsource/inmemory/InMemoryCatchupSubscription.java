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

import org.catchup.eventsource.GlobalPosition;
import org.catchup.eventsource.inmemory.InMemoryEventSource.StoredEvent;
import org.catchup.eventsource.api.CatchupSubscription;
import org.catchup.eventsource.api.CatchupSubscriptionListener;
import org.catchup.eventsource.api.CatchupSubscriptionSettings;
import org.catchup.eventsource.api.SubscriptionDropReason;
import org.catchup.eventsource.api.UserCredentials;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.catchup.eventsource.api.SubscriptionDropReason.*;

/**
 * A subscription to an {@link InMemoryEventSource}. It's started by the event source and runs until it's dropped.
 */
class InMemoryCatchupSubscription implements CatchupSubscription, Runnable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatchupSubscription.class);
    private static final long POLL_INTERVAL_MILLIS = 100;

    private final InMemoryEventSource eventSource;
    private final CatchupSubscriptionSettings settings;
    private final CatchupSubscriptionListener listener;
    private final UserCredentials credentials;
    private final BlockingQueue<StoredEvent> liveQueue;
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicBoolean dropped = new AtomicBoolean(false);
    private final AtomicReference<PendingDrop> pendingDrop = new AtomicReference<>();

    private volatile boolean stopRequested = false;
    private volatile boolean live = false;
    private GlobalPosition lastPosition;

    InMemoryCatchupSubscription(InMemoryEventSource eventSource, CatchupSubscriptionSettings settings, CatchupSubscriptionListener listener,
                                @Nullable UserCredentials credentials, GlobalPosition startAfter) {
        this.eventSource = eventSource;
        this.settings = settings;
        this.listener = listener;
        this.credentials = credentials;
        this.liveQueue = new LinkedBlockingQueue<>(settings.maxLiveQueueSize);
        this.lastPosition = startAfter;
    }

    @Override
    public void run() {
        started.countDown();
        boolean catchingUp = true;
        try {
            if (!eventSource.isAuthorized(credentials)) {
                drop(NOT_AUTHENTICATED, new SecurityException("Invalid credentials for subscription " + settings.subscriptionName));
                return;
            }

            while (catchingUp) {
                if (dropRequested()) {
                    return;
                }
                List<StoredEvent> batch = eventSource.readForward(lastPosition, settings.readBatchSize);
                if (batch.isEmpty()) {
                    catchingUp = !eventSource.goLiveIfCaughtUp(this, lastPosition);
                } else {
                    log.trace("Subscription {} read {} historic events after {}", settings.subscriptionName, batch.size(), lastPosition);
                    for (StoredEvent storedEvent : batch) {
                        if (dropRequested() || !deliver(storedEvent)) {
                            return;
                        }
                    }
                }
            }

            live = true;
            listener.liveProcessingStarted(this);

            while (!dropRequested()) {
                StoredEvent storedEvent = liveQueue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                if (storedEvent != null && !deliver(storedEvent)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drop(stopRequested ? USER_INITIATED : CONNECTION_CLOSED, stopRequested ? null : e);
        } catch (Exception e) {
            log.error("Subscription {} failed", settings.subscriptionName, e);
            drop(catchingUp ? CATCH_UP_ERROR : SERVER_ERROR, e);
        } finally {
            eventSource.unregister(this);
        }
    }

    /**
     * @return {@code false} if the listener threw an exception and the subscription was dropped
     */
    private boolean deliver(StoredEvent storedEvent) {
        if (!storedEvent.position.isAfter(lastPosition)) {
            return true;
        }
        try {
            listener.eventAppeared(this, eventSource.toDeliverable(storedEvent, settings.resolveLinkTos));
        } catch (Exception e) {
            log.debug("Event handler of subscription {} threw exception when handling event at {}", settings.subscriptionName, storedEvent.position, e);
            drop(EVENT_HANDLER_EXCEPTION, e);
            return false;
        }
        lastPosition = storedEvent.position;
        return true;
    }

    private boolean dropRequested() {
        if (stopRequested) {
            drop(USER_INITIATED, null);
            return true;
        }
        PendingDrop drop = pendingDrop.get();
        if (drop != null) {
            drop(drop.reason, drop.error);
            return true;
        }
        return false;
    }

    private void drop(SubscriptionDropReason reason, @Nullable Throwable error) {
        if (dropped.compareAndSet(false, true)) {
            live = false;
            eventSource.unregister(this);
            log.debug("Subscription {} dropped (reason={})", settings.subscriptionName, reason);
            listener.subscriptionDropped(this, reason, error);
        }
    }

    boolean offerLiveEvent(StoredEvent storedEvent) {
        return liveQueue.offer(storedEvent);
    }

    /**
     * Request the subscription to be dropped with the given reason. The drop is reported from the subscription thread.
     */
    void requestDrop(SubscriptionDropReason reason, @Nullable Throwable error) {
        pendingDrop.compareAndSet(null, new PendingDrop(reason, error));
    }

    @Override
    public String subscriptionName() {
        return settings.subscriptionName;
    }

    @Override
    public boolean isLive() {
        return live;
    }

    @Override
    public void stop() {
        stopRequested = true;
    }

    @Override
    public boolean waitUntilStarted(Duration timeout) {
        try {
            return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return "InMemoryCatchupSubscription{" + "subscriptionName='" + settings.subscriptionName + '\'' + ", live=" + live + ", lastPosition=" + lastPosition + '}';
    }

    private static final class PendingDrop {
        private final SubscriptionDropReason reason;
        private final Throwable error;

        private PendingDrop(SubscriptionDropReason reason, @Nullable Throwable error) {
            this.reason = reason;
            this.error = error;
        }
    }
}
