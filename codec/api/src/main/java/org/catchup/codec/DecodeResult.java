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

package org.catchup.codec;

import static java.util.Objects.requireNonNull;

/**
 * The result of decoding a raw event. Either the event type is recognized and the payload was deserialized
 * ({@link Decoded}), or the type is not known by the codec ({@link UnknownEventType}).
 */
public sealed interface DecodeResult<T> {

    static <T> DecodeResult<T> decoded(T domainEvent) {
        return new Decoded<>(domainEvent);
    }

    static <T> DecodeResult<T> unknownEventType(String eventType) {
        return new UnknownEventType<>(eventType);
    }

    record Decoded<T>(T domainEvent) implements DecodeResult<T> {
        public Decoded {
            requireNonNull(domainEvent, "domainEvent cannot be null");
        }
    }

    record UnknownEventType<T>(String eventType) implements DecodeResult<T> {
        public UnknownEventType {
            requireNonNull(eventType, "eventType cannot be null");
        }
    }
}
