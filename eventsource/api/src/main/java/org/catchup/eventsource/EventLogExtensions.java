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

package org.catchup.eventsource;

import io.cloudevents.CloudEvent;

/**
 * {@link CloudEvent} extensions that an event source adds to the events it delivers:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #STREAM_ID}</td><td>The id of the event stream the event was written to</td></tr>
 *     <tr><td>{@value #STREAM_VERSION}</td><td>The version of the event in its event stream</td></tr>
 *     <tr><td>{@value #ORIGINAL_TYPE}</td><td>The type of the stored record when a link has been resolved to its target</td></tr>
 * </table>
 */
public final class EventLogExtensions {
    public static final String STREAM_ID = "streamid";
    public static final String STREAM_VERSION = "streamversion";
    public static final String ORIGINAL_TYPE = "originaltype";

    /**
     * Event types starting with this prefix are reserved for the event log's own bookkeeping.
     */
    public static final String SYSTEM_EVENT_TYPE_PREFIX = "$";

    /**
     * The type of a record that points to an event stored elsewhere in the log.
     */
    public static final String LINK_EVENT_TYPE = "$>";

    private EventLogExtensions() {
    }

    public static String getStreamId(CloudEvent cloudEvent) {
        Object streamId = cloudEvent.getExtension(STREAM_ID);
        if (streamId == null) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + STREAM_ID + " key");
        }
        return streamId.toString();
    }

    public static long getStreamVersion(CloudEvent cloudEvent) {
        Object streamVersion = cloudEvent.getExtension(STREAM_VERSION);
        if (!(streamVersion instanceof Number)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + STREAM_VERSION + " value that is a number");
        }
        return ((Number) streamVersion).longValue();
    }

    public static String getOriginalType(CloudEvent cloudEvent) {
        Object originalType = cloudEvent.getExtension(ORIGINAL_TYPE);
        return originalType == null ? cloudEvent.getType() : originalType.toString();
    }

    public static boolean isSystemEventType(String type) {
        return type.startsWith(SYSTEM_EVENT_TYPE_PREFIX);
    }
}
