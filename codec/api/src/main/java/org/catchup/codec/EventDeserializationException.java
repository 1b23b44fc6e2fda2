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

/**
 * Thrown when the type of an event is recognized but its payload cannot be deserialized into the registered class.
 */
public class EventDeserializationException extends RuntimeException {
    private final String eventType;
    private final String eventId;

    public EventDeserializationException(String eventType, String eventId, Throwable cause) {
        super("Failed to deserialize event " + eventId + " of type " + eventType + ": " + cause.getMessage(), cause);
        this.eventType = eventType;
        this.eventId = eventId;
    }

    public EventDeserializationException(String eventType, String eventId, String message) {
        super("Failed to deserialize event " + eventId + " of type " + eventType + ": " + message);
        this.eventType = eventType;
        this.eventId = eventId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventId() {
        return eventId;
    }
}
