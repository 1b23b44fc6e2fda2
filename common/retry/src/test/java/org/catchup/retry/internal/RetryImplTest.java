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
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class RetryImplTest {

    @Test
    void jitter_uses_the_random_value_to_spread_the_backoff() {
        // Given
        RetryImpl retry = (RetryImpl) new RetryImpl().backoff(Backoff.fixed(1000)).jitter(0.2);

        // When
        Duration lowest = retry.withRandom(() -> 0.0).backoffBeforeAttempt(2, null).orElseThrow();
        Duration middle = retry.withRandom(() -> 0.5).backoffBeforeAttempt(2, null).orElseThrow();
        Duration highest = retry.withRandom(() -> 1.0).backoffBeforeAttempt(2, null).orElseThrow();

        // Then
        assertAll(
                () -> assertThat(lowest).isEqualTo(Duration.ofMillis(800)),
                () -> assertThat(middle).isEqualTo(Duration.ofMillis(1000)),
                () -> assertThat(highest).isEqualTo(Duration.ofMillis(1200))
        );
    }

    @Test
    void zero_backoff_is_not_jittered() {
        // Given
        RetryImpl retry = (RetryImpl) new RetryImpl().jitter(1.0);

        // When
        Duration backoff = retry.withRandom(() -> 1.0).backoffBeforeAttempt(5, null).orElseThrow();

        // Then
        assertThat(backoff).isZero();
    }
}
