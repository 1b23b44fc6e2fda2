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

import io.cloudevents.CloudEvent;

/**
 * Converts between raw events ({@link CloudEvent}) and domain events.
 *
 * @param <T> The base type of the domain events
 */
public interface EventCodec<T> {

    /**
     * Decode a raw event.
     *
     * @param cloudEvent The raw event
     * @return {@link DecodeResult.Decoded} if the event type is known, {@link DecodeResult.UnknownEventType} otherwise.
     * @throws EventDeserializationException If the event type is known but the payload cannot be deserialized
     */
    DecodeResult<T> decode(CloudEvent cloudEvent);

    /**
     * Encode a domain event so that it can be appended to the given stream.
     */
    CloudEvent encode(T domainEvent, String streamId);
}
