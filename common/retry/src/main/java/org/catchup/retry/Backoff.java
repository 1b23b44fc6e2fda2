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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Defines how long to wait before the next attempt is made.
 */
public sealed interface Backoff {

    /**
     * @return A backoff that doesn't wait at all between attempts.
     */
    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    static Backoff fixed(Duration duration) {
        requireNonNull(duration, "Duration cannot be null");
        return new Fixed(duration.toMillis());
    }

    /**
     * Exponential backoff that starts with {@code initial} and is multiplied by {@code multiplier} for every attempt, but
     * never waits longer than {@code max}.
     *
     * @param initial    The wait time before the first retry
     * @param max        Max wait time
     * @param multiplier Multiplier between retries
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    final class None implements Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    final class Fixed implements Backoff {
        public final long millis;

        private Fixed(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("Fixed backoff cannot be negative");
            }
            this.millis = millis;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Fixed)) return false;
            Fixed fixed = (Fixed) o;
            return millis == fixed.millis;
        }

        @Override
        public int hashCode() {
            return Objects.hash(millis);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Fixed.class.getSimpleName() + "[", "]")
                    .add("millis=" + millis)
                    .toString();
        }
    }

    final class Exponential implements Backoff {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;

        private Exponential(Duration initial, Duration max, double multiplier) {
            requireNonNull(initial, "Initial duration cannot be null");
            requireNonNull(max, "Max duration cannot be null");
            if (initial.isNegative()) {
                throw new IllegalArgumentException("Initial duration cannot be negative");
            } else if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("Max duration cannot be less than the initial duration");
            } else if (multiplier < 1) {
                throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
            }
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Exponential)) return false;
            Exponential that = (Exponential) o;
            return Double.compare(that.multiplier, multiplier) == 0 && Objects.equals(initial, that.initial) && Objects.equals(max, that.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initial, max, multiplier);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Exponential.class.getSimpleName() + "[", "]")
                    .add("initial=" + initial)
                    .add("max=" + max)
                    .add("multiplier=" + multiplier)
                    .toString();
        }
    }
}
