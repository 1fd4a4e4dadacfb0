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

package org.tessera.internal.tracing;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a span captured by a recording.
 */
public final class RecordedSpan {
    /** Parent identifier of a span that has no parent. */
    public static final long ROOT_SPAN_ID = 0;

    private final long spanId;

    private final long parentSpanId;

    private final String operation;

    private final Instant startTime;

    private final Duration duration;

    private final List<LogRecord> logs;

    /**
     * Constructor.
     *
     * @param spanId Span identifier.
     * @param parentSpanId Parent span identifier, {@link #ROOT_SPAN_ID} for a root.
     * @param operation Operation name.
     * @param startTime Start time.
     * @param duration Duration, {@link Duration#ZERO} while the span is still open.
     * @param logs Log entries in time order.
     */
    public RecordedSpan(long spanId, long parentSpanId, String operation, Instant startTime, Duration duration, List<LogRecord> logs) {
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.logs = List.copyOf(logs);
    }

    public long spanId() {
        return spanId;
    }

    public long parentSpanId() {
        return parentSpanId;
    }

    public String operation() {
        return operation;
    }

    public Instant startTime() {
        return startTime;
    }

    public Duration duration() {
        return duration;
    }

    /** Returns {@code true} if the span has not been finished when it was captured. */
    public boolean isOpen() {
        return duration.isZero();
    }

    public List<LogRecord> logs() {
        return logs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        RecordedSpan that = (RecordedSpan) o;

        return spanId == that.spanId && parentSpanId == that.parentSpanId && operation.equals(that.operation)
                && startTime.equals(that.startTime) && duration.equals(that.duration) && logs.equals(that.logs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanId, parentSpanId, operation, startTime, duration, logs);
    }

    @Override
    public String toString() {
        return "RecordedSpan [spanId=" + spanId + ", parentSpanId=" + parentSpanId + ", operation=" + operation
                + ", startTime=" + startTime + ", duration=" + duration + ", logs=" + logs.size() + ']';
    }
}
