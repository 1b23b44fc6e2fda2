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

package org.catchup.retry.internal;

import org.catchup.retry.Backoff;
import org.catchup.retry.MaxAttempts;
import org.catchup.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.catchup.retry.MaxAttempts.Infinite.infinite;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>No jitter</li>
 *     <li>Infinite number of retries</li>
 *     <li>Retries all exceptions</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final DoubleSupplier RANDOM = () -> ThreadLocalRandom.current().nextDouble();

    final Backoff backoff;
    final double jitter;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    private final DoubleSupplier random;

    private RetryImpl(Backoff backoff, double jitter, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, DoubleSupplier random) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        Objects.requireNonNull(random, "Random cannot be null");
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("Jitter must be between 0 and 1");
        }
        this.backoff = backoff;
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.random = random;
    }

    public RetryImpl() {
        this(Backoff.none(), 0, infinite(), __ -> true, RANDOM);
    }

    // Visible for testing
    RetryImpl withRandom(DoubleSupplier random) {
        return new RetryImpl(backoff, jitter, maxAttempts, retryPredicate, random);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, jitter, maxAttempts, retryPredicate, random);
    }

    @Override
    public Retry jitter(double factor) {
        return new RetryImpl(backoff, factor, maxAttempts, retryPredicate, random);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, jitter, infinite(), retryPredicate, random);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, jitter, new MaxAttempts.Limit(maxAttempts), retryPredicate, random);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, jitter, maxAttempts, retryPredicate, random);
    }

    @Override
    public Retry mapRetryPredicate(Function<Predicate<Throwable>, Predicate<Throwable>> retryPredicateFn) {
        Objects.requireNonNull(retryPredicateFn, "Retry predicate function cannot be null");
        return new RetryImpl(backoff, jitter, maxAttempts, retryPredicateFn.apply(retryPredicate), random);
    }

    @Override
    public Optional<Duration> backoffBeforeAttempt(int attemptNumber, @Nullable Throwable cause) {
        if (attemptNumber < 2) {
            throw new IllegalArgumentException("Attempt number must be greater than or equal to 2 when retrying");
        }
        if (maxAttempts.isExhaustedBy(attemptNumber) || (cause != null && !retryPredicate.test(cause))) {
            return Optional.empty();
        }
        long millis = applyJitter(baseBackoffMillis(attemptNumber - 1));
        return Optional.of(millis == 0 ? Duration.ZERO : Duration.ofMillis(millis));
    }

    private long baseBackoffMillis(int retryCount) {
        if (backoff instanceof Backoff.None) {
            return 0;
        } else if (backoff instanceof Backoff.Fixed fixed) {
            return fixed.millis;
        } else if (backoff instanceof Backoff.Exponential exponential) {
            long maxMillis = exponential.max.toMillis();
            double millis = exponential.initial.toMillis() * Math.pow(exponential.multiplier, retryCount - 1);
            return millis >= maxMillis ? maxMillis : Math.round(millis);
        }
        throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
    }

    private long applyJitter(long millis) {
        if (jitter == 0 || millis == 0) {
            return millis;
        }
        double factor = 1 - jitter + (2 * jitter * random.getAsDouble());
        long jittered = Math.round(millis * factor);
        if (backoff instanceof Backoff.Exponential exponential) {
            jittered = Math.min(jittered, exponential.max.toMillis());
        }
        return Math.max(0, jittered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl)) return false;
        RetryImpl retry = (RetryImpl) o;
        return Double.compare(retry.jitter, jitter) == 0 && Objects.equals(backoff, retry.backoff) && Objects.equals(maxAttempts, retry.maxAttempts) && Objects.equals(retryPredicate, retry.retryPredicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, jitter, maxAttempts, retryPredicate);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("jitter=" + jitter)
                .add("maxAttempts=" + maxAttempts)
                .add("retryPredicate=" + retryPredicate)
                .toString();
    }
}
