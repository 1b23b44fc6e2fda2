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

package org.catchup.retry;

import org.catchup.retry.internal.RetryImpl;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Decides whether, and after how long, a failed attempt should be made again.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, so you can change the settings at any time without impacting the original instance.
 * For example this is perfectly valid:
 * <p>
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(30), 2.0).jitter(0.2);
 * // Same backoff, but give up after the tenth attempt
 * RetryStrategy bounded = retryStrategy.maxAttempts(10);
 * </pre>
 * </p>
 */
public interface RetryStrategy {
    /**
     * Create a retry strategy that retries forever without waiting between attempts.
     *
     * @return {@link RetryImpl}
     * @see RetryImpl
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't perform retries (i.e. retries are disabled).
     *
     * @return {@link DontRetry}
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut to create a retry strategy with exponential backoff. This is the same as doing:
     *
     * <pre>
     * RetryStrategy.retry().backoff(Backoff.exponential(..));
     * </pre>
     *
     * @param initial    The initial wait time before retrying the first time
     * @param max        Max wait time
     * @param multiplier Multiplier between retries
     * @return A retry strategy with exponential backoff
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Shortcut to create a retry strategy with fixed backoff. This is the same as doing:
     *
     * <pre>
     * RetryStrategy.retry().backoff(Backoff.fixed(..));
     * </pre>
     *
     * @param duration The duration to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Shortcut to create a retry strategy with fixed backoff.
     *
     * @param millis The number of millis to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Find out how long to wait before making attempt number {@code attemptNumber}, given that the previous attempt failed.
     * The first attempt is attempt number {@code 1}, so the first retry is attempt number {@code 2}.
     *
     * @param attemptNumber The number of the attempt that is about to be made, must be greater than or equal to 2.
     * @param cause         The error that made the previous attempt fail, if any.
     * @return The backoff to wait before the attempt, or {@link Optional#empty()} if no more attempts should be made.
     */
    Optional<Duration> backoffBeforeAttempt(int attemptNumber, @Nullable Throwable cause);

    /**
     * A retry strategy that doesn't retry at all.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public Optional<Duration> backoffBeforeAttempt(int attemptNumber, @Nullable Throwable cause) {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * Configure the backoff settings for the retry strategy.
         *
         * @param backoff The backoff to use.
         * @return A new instance of {@link Retry} with the backoff settings applied.
         * @see Backoff
         */
        Retry backoff(Backoff backoff);

        /**
         * Randomize each backoff by up to {@code factor} in both directions, e.g. {@code 0.2} turns a 1 second backoff into
         * a backoff between 800 and 1200 millis. This spreads out retries from many clients that failed at the same time.
         *
         * @param factor A value between {@code 0} (no jitter) and {@code 1}.
         * @return A new instance of {@link Retry} with jitter applied.
         */
        Retry jitter(double factor);

        /**
         * Retry an infinite number of times (this is default).
         *
         * @return A new instance of {@link Retry} with infinite number of retry attempts.
         * @see #maxAttempts(int)
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of attempts, the first attempt included, before giving up.
         *
         * @return A new instance of {@link Retry} with the max number of attempts configured.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         * The predicate is only tested when {@link #backoffBeforeAttempt(int, Throwable)} is called with a cause.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Allows you to specify a retry predicate by basing it on the current retry predicate.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry mapRetryPredicate(Function<Predicate<Throwable>, Predicate<Throwable>> retryPredicateFn);
    }
}
