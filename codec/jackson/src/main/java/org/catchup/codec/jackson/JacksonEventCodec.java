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

package org.catchup.codec.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.catchup.codec.DecodeResult;
import org.catchup.codec.EventCodec;
import org.catchup.codec.EventDeserializationException;
import org.catchup.codec.EventTypeRegistry;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static org.catchup.eventsource.EventLogExtensions.STREAM_ID;

/**
 * An {@link EventCodec} that uses a Jackson {@link ObjectMapper} to read and write domain events as JSON (content type {@value #DEFAULT_CONTENT_TYPE})
 * that is used as data in a {@link CloudEvent}. The cloud event type is looked up in an {@link EventTypeRegistry}.
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonEventCodec<T> implements EventCodec<T> {
    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry<T> eventTypeRegistry;
    private final URI cloudEventSource;
    private final Function<T, String> idMapper;
    private final Function<T, OffsetDateTime> timeMapper;

    /**
     * Create a new instance of the {@link JacksonEventCodec} that uses a random UUID as cloud event id and {@code OffsetDateTime.now(UTC)} as
     * cloud event time when encoding. Use {@link Builder} for more advanced configuration.
     *
     * @param objectMapper      The ObjectMapper instance to use
     * @param eventTypeRegistry The registry of known event types
     * @param cloudEventSource  The cloud event source of encoded events
     */
    public JacksonEventCodec(ObjectMapper objectMapper, EventTypeRegistry<T> eventTypeRegistry, URI cloudEventSource) {
        this(objectMapper, eventTypeRegistry, cloudEventSource, __ -> UUID.randomUUID().toString(), __ -> OffsetDateTime.now(UTC));
    }

    private JacksonEventCodec(ObjectMapper objectMapper, EventTypeRegistry<T> eventTypeRegistry, URI cloudEventSource, Function<T, String> idMapper, Function<T, OffsetDateTime> timeMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeRegistry, EventTypeRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        requireNonNull(timeMapper, "timeMapper cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeRegistry = eventTypeRegistry;
        this.cloudEventSource = cloudEventSource;
        this.idMapper = idMapper;
        this.timeMapper = timeMapper;
    }

    @SuppressWarnings("unchecked")
    @Override
    public DecodeResult<T> decode(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Optional<Class<? extends T>> domainEventType = eventTypeRegistry.resolve(cloudEvent.getType());
        if (domainEventType.isEmpty()) {
            return DecodeResult.unknownEventType(cloudEvent.getType());
        }

        CloudEventData data = cloudEvent.getData();
        if (data == null) {
            throw new EventDeserializationException(cloudEvent.getType(), cloudEvent.getId(), "cloud event data is missing");
        }

        final T domainEvent;
        try {
            if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
                Map<String, Object> value = (Map<String, Object>) ((PojoCloudEventData<?>) data).getValue();
                domainEvent = objectMapper.convertValue(value, domainEventType.get());
            } else {
                domainEvent = objectMapper.readValue(data.toBytes(), domainEventType.get());
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new EventDeserializationException(cloudEvent.getType(), cloudEvent.getId(), e);
        }

        if (domainEvent == null) {
            throw new EventDeserializationException(cloudEvent.getType(), cloudEvent.getId(), "cloud event data is null");
        }
        return DecodeResult.decoded(domainEvent);
    }

    @Override
    public CloudEvent encode(T domainEvent, String streamId) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        requireNonNull(streamId, "streamId cannot be null");
        final byte[] data;
        try {
            data = objectMapper.writeValueAsBytes(domainEvent);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize " + domainEvent.getClass().getName(), e);
        }
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(domainEvent))
                .withSource(cloudEventSource)
                .withType(eventTypeRegistry.eventTypeOf(domainEvent.getClass()))
                .withTime(timeMapper.apply(domainEvent))
                .withDataContentType(DEFAULT_CONTENT_TYPE)
                .withExtension(STREAM_ID, streamId)
                .withData(data)
                .build();
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final EventTypeRegistry<T> eventTypeRegistry;
        private final URI cloudEventSource;
        private Function<T, String> idMapper = __ -> UUID.randomUUID().toString();
        private Function<T, OffsetDateTime> timeMapper = __ -> OffsetDateTime.now(UTC);

        public Builder(ObjectMapper objectMapper, EventTypeRegistry<T> eventTypeRegistry, URI cloudEventSource) {
            this.objectMapper = objectMapper;
            this.eventTypeRegistry = eventTypeRegistry;
            this.cloudEventSource = cloudEventSource;
        }

        /**
         * @param idMapper A function that generates the cloud event id based on the domain event. By default, a random UUID is used.
         */
        public Builder<T> idMapper(Function<T, String> idMapper) {
            this.idMapper = idMapper;
            return this;
        }

        /**
         * @param timeMapper A function that generates the cloud event time based on the domain event. By default, {@code OffsetDateTime.now(UTC)} is always returned.
         */
        public Builder<T> timeMapper(Function<T, OffsetDateTime> timeMapper) {
            this.timeMapper = timeMapper;
            return this;
        }

        public JacksonEventCodec<T> build() {
            return new JacksonEventCodec<>(objectMapper, eventTypeRegistry, cloudEventSource, idMapper, timeMapper);
        }
    }
}
