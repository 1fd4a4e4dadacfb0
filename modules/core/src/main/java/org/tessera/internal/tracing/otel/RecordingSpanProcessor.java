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

package org.tessera.internal.tracing.otel;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.tessera.internal.tracing.LogField;
import org.tessera.internal.tracing.LogRecord;
import org.tessera.internal.tracing.RecordedSpan;
import org.tessera.internal.tracing.RecordingType;

/**
 * Span processor that keeps spans belonging to active recordings.
 *
 * <p>A recording is keyed by the span it was started on. Every span started while its parent belongs to an active recording joins
 * that recording too, so a recording covers the whole subtree created after it started.
 */
class RecordingSpanProcessor implements SpanProcessor {
    /** Name OpenTelemetry gives to events created by {@code Span#recordException}. */
    static final String EXCEPTION_EVENT_NAME = "exception";

    private static final AttributeKey<String> EXCEPTION_MESSAGE = AttributeKey.stringKey("exception.message");

    private static final AttributeKey<String> EXCEPTION_TYPE = AttributeKey.stringKey("exception.type");

    /** Recording root span id -> recording. */
    private final Map<String, Recording> recordings = new ConcurrentHashMap<>();

    /** Span id -> recordings the span belongs to. */
    private final Map<String, List<Recording>> memberships = new ConcurrentHashMap<>();

    void startRecording(ReadableSpan root, RecordingType type) {
        String rootId = root.getSpanContext().getSpanId();
        Recording recording = new Recording(type);

        if (recordings.putIfAbsent(rootId, recording) != null) {
            return;
        }

        recording.spans.add(root);
        join(rootId, recording);
    }

    void stopRecording(String rootId) {
        Recording recording = recordings.remove(rootId);

        if (recording == null) {
            return;
        }

        recording.active = false;

        for (ReadableSpan span : recording.spans) {
            memberships.computeIfPresent(span.getSpanContext().getSpanId(), (id, list) -> {
                list.remove(recording);

                return list.isEmpty() ? null : list;
            });
        }
    }

    List<RecordedSpan> recording(String rootId) {
        Recording recording = recordings.get(rootId);

        if (recording == null) {
            return List.of();
        }

        List<RecordedSpan> result = new ArrayList<>(recording.spans.size());

        for (ReadableSpan span : recording.spans) {
            result.add(toRecordedSpan(span.toSpanData()));
        }

        result.sort(Comparator.comparing(RecordedSpan::startTime));

        return result;
    }

    boolean isRecording(String spanId) {
        return memberships.containsKey(spanId);
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        SpanContext parent = span.getParentSpanContext();

        if (!parent.isValid()) {
            return;
        }

        List<Recording> parentRecordings = memberships.get(parent.getSpanId());

        if (parentRecordings == null) {
            return;
        }

        for (Recording recording : parentRecordings) {
            if (!recording.active || (parent.isRemote() && recording.type == RecordingType.SINGLE_NODE)) {
                continue;
            }

            recording.spans.add(span);
            join(span.getSpanContext().getSpanId(), recording);
        }
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        // Ended spans stay in their recordings until those are stopped.
    }

    @Override
    public boolean isEndRequired() {
        return false;
    }

    private void join(String spanId, Recording recording) {
        memberships.computeIfAbsent(spanId, id -> new CopyOnWriteArrayList<>()).add(recording);
    }

    static long parseSpanId(String hex) {
        return Long.parseUnsignedLong(hex, 16);
    }

    static RecordedSpan toRecordedSpan(SpanData data) {
        long parentId = data.getParentSpanContext().isValid() ? parseSpanId(data.getParentSpanId()) : RecordedSpan.ROOT_SPAN_ID;

        Duration duration = data.hasEnded()
                ? Duration.ofNanos(data.getEndEpochNanos() - data.getStartEpochNanos())
                : Duration.ZERO;

        List<LogRecord> logs = new ArrayList<>(data.getEvents().size());

        for (EventData event : data.getEvents()) {
            logs.add(new LogRecord(toInstant(event.getEpochNanos()), toFields(event)));
        }

        return new RecordedSpan(
                parseSpanId(data.getSpanId()),
                parentId,
                data.getName(),
                toInstant(data.getStartEpochNanos()),
                duration,
                logs
        );
    }

    private static List<LogField> toFields(EventData event) {
        if (EXCEPTION_EVENT_NAME.equals(event.getName())) {
            String msg = event.getAttributes().get(EXCEPTION_MESSAGE);

            if (msg == null) {
                msg = event.getAttributes().get(EXCEPTION_TYPE);
            }

            return List.of(LogField.error(msg == null ? EXCEPTION_EVENT_NAME : msg));
        }

        List<LogField> fields = new ArrayList<>(1 + event.getAttributes().size());

        fields.add(LogField.event(event.getName()));
        event.getAttributes().forEach((key, val) -> fields.add(new LogField(key.getKey(), String.valueOf(val))));

        return fields;
    }

    private static Instant toInstant(long epochNanos) {
        return Instant.ofEpochSecond(0, epochNanos);
    }

    private static class Recording {
        private final RecordingType type;

        private final List<ReadableSpan> spans = new CopyOnWriteArrayList<>();

        private volatile boolean active = true;

        private Recording(RecordingType type) {
            this.type = type;
        }
    }
}
