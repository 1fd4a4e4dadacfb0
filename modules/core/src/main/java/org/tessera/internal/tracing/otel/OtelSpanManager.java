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

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.Clock;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.tracing.RecordedSpan;
import org.tessera.internal.tracing.RecordingType;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;

/**
 * {@link SpanManager} on top of the OpenTelemetry SDK. Spans are created by an own tracer provider whose span processor keeps
 * recordings in memory.
 */
public class OtelSpanManager implements SpanManager, AutoCloseable {
    private static final TesseraLogger LOG = Loggers.forClass(OtelSpanManager.class);

    private static final String INSTRUMENTATION_NAME = "org.tessera.sql";

    private final RecordingSpanProcessor processor = new RecordingSpanProcessor();

    private final SdkTracerProvider tracerProvider;

    private final Tracer tracer;

    /** Creates a manager that timestamps spans with the system clock. */
    public OtelSpanManager() {
        this(Clock.getDefault());
    }

    /**
     * Creates a manager that timestamps spans with the given clock.
     *
     * @param clock Clock for span and event timestamps.
     */
    public OtelSpanManager(Clock clock) {
        tracerProvider = SdkTracerProvider.builder()
                .setClock(clock)
                .addSpanProcessor(processor)
                .build();

        tracer = tracerProvider.get(INSTRUMENTATION_NAME);
    }

    @Override
    public TraceSpan create(@Nullable TraceSpan parentSpan, String operation) {
        SpanBuilder builder = tracer.spanBuilder(operation);

        Context parentCtx = parentSpan != null && parentSpan.isValid() ? parentSpan.<Context>getContext() : null;

        if (parentCtx != null) {
            builder.setParent(parentCtx);
        } else {
            builder.setNoParent();
            parentCtx = Context.root();
        }

        Span span = builder.startSpan();

        return new OtelTraceSpan(parentCtx.with(span), span, operation);
    }

    @Override
    public void startRecording(TraceSpan span, RecordingType type) {
        ReadableSpan readable = readable(span);

        if (readable == null) {
            return;
        }

        processor.startRecording(readable, type);

        LOG.debug("Recording started [span={}, type={}]", span, type);
    }

    @Override
    public void stopRecording(TraceSpan span) {
        ReadableSpan readable = readable(span);

        if (readable == null) {
            return;
        }

        processor.stopRecording(readable.getSpanContext().getSpanId());

        LOG.debug("Recording stopped [span={}]", span);
    }

    @Override
    public List<RecordedSpan> recording(TraceSpan span) {
        ReadableSpan readable = readable(span);

        return readable == null ? List.of() : processor.recording(readable.getSpanContext().getSpanId());
    }

    /**
     * Returns {@code true} if the given span belongs to at least one active recording.
     *
     * @param span Span to check.
     * @return Whether the span is being recorded.
     */
    public boolean isRecording(TraceSpan span) {
        ReadableSpan readable = readable(span);

        return readable != null && processor.isRecording(readable.getSpanContext().getSpanId());
    }

    @Override
    public void close() {
        tracerProvider.close();
    }

    private static @Nullable ReadableSpan readable(TraceSpan span) {
        if (!(span instanceof OtelTraceSpan)) {
            return null;
        }

        Span otelSpan = ((OtelTraceSpan) span).unwrap();

        return otelSpan instanceof ReadableSpan ? (ReadableSpan) otelSpan : null;
    }
}
