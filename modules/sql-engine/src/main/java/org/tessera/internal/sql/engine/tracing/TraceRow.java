/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tessera.internal.sql.engine.tracing;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One message of a reconstructed session trace.
 */
public final class TraceRow {
    private final int spanIndex;

    private final int messageIndex;

    private final Instant timestamp;

    private final @Nullable Duration duration;

    private final @Nullable String operation;

    private final String location;

    private final String tag;

    private final String message;

    /**
     * Constructor.
     *
     * @param spanIndex Position of the span in the reduced span list.
     * @param messageIndex Position of the message within the span, {@code 0} for the span start marker.
     * @param timestamp Message time.
     * @param duration Span duration, only on the start marker of a finished span.
     * @param operation Span operation, only on the start marker.
     * @param location Source location the message was logged at, empty if unknown.
     * @param tag Message tag, empty if none.
     * @param message Message text.
     */
    public TraceRow(
            int spanIndex,
            int messageIndex,
            Instant timestamp,
            @Nullable Duration duration,
            @Nullable String operation,
            String location,
            String tag,
            String message
    ) {
        this.spanIndex = spanIndex;
        this.messageIndex = messageIndex;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.duration = duration;
        this.operation = operation;
        this.location = Objects.requireNonNull(location, "location");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.message = Objects.requireNonNull(message, "message");
    }

    public int spanIndex() {
        return spanIndex;
    }

    public int messageIndex() {
        return messageIndex;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public @Nullable Duration duration() {
        return duration;
    }

    public @Nullable String operation() {
        return operation;
    }

    public String location() {
        return location;
    }

    public String tag() {
        return tag;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        TraceRow that = (TraceRow) o;

        return spanIndex == that.spanIndex && messageIndex == that.messageIndex && timestamp.equals(that.timestamp)
                && Objects.equals(duration, that.duration) && Objects.equals(operation, that.operation)
                && location.equals(that.location) && tag.equals(that.tag) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanIndex, messageIndex, timestamp, duration, operation, location, tag, message);
    }

    @Override
    public String toString() {
        return "TraceRow [span=" + spanIndex + ", msg=" + messageIndex + ", timestamp=" + timestamp + ", duration=" + duration
                + ", operation=" + operation + ", location=" + location + ", tag=" + tag + ", message=" + message + ']';
    }
}
