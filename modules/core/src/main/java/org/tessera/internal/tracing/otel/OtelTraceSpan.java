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

import static org.tessera.internal.tracing.otel.RecordingSpanProcessor.parseSpanId;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.tracing.TraceSpan;

/**
 * {@link TraceSpan} backed by an OpenTelemetry span. The span is never made current: its context is handed to children explicitly.
 */
public class OtelTraceSpan implements TraceSpan {
    private final Context ctx;

    private final Span span;

    private final String operation;

    OtelTraceSpan(Context ctx, Span span, String operation) {
        this.ctx = ctx;
        this.span = span;
        this.operation = operation;
    }

    @Override
    public long spanId() {
        return isValid() ? parseSpanId(span.getSpanContext().getSpanId()) : 0;
    }

    @Override
    public String operation() {
        return operation;
    }

    @Override
    public TraceSpan addEvent(Supplier<String> evtSupplier) {
        if (isValid()) {
            span.addEvent(evtSupplier.get());
        }

        return this;
    }

    @Override
    public boolean isValid() {
        return span.getSpanContext().isValid();
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getContext() {
        return (T) ctx;
    }

    @Override
    public void recordException(Throwable exception) {
        span.recordException(exception);
    }

    @Override
    public void end() {
        span.end();
    }

    Span unwrap() {
        return span;
    }

    @Override
    public String toString() {
        return "OtelTraceSpan [operation=" + operation + ", spanId=" + span.getSpanContext().getSpanId() + ']';
    }
}
