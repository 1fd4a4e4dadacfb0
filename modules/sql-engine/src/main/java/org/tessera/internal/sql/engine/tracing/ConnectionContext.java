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

import java.util.Objects;
import org.tessera.internal.tracing.NoopTraceSpan;
import org.tessera.internal.tracing.TraceSpan;

/**
 * Execution context of a client connection. Every operation started on the connection takes its parent span from here.
 *
 * <p>Session tracing temporarily replaces the span with its own one ("hijacks" the context), so that all following operations of the
 * connection, inside and outside of transactions, end up in the recording.
 */
public class ConnectionContext {
    private final Object mux = new Object();

    private final TraceSpan originalSpan;

    private volatile TraceSpan currentSpan;

    /** Creates a context without a connection span. */
    public ConnectionContext() {
        this(NoopTraceSpan.INSTANCE);
    }

    /**
     * Constructor.
     *
     * @param span Span of the connection.
     */
    public ConnectionContext(TraceSpan span) {
        this.originalSpan = Objects.requireNonNull(span, "span");
        this.currentSpan = span;
    }

    /**
     * Returns the span new operations of the connection must be children of.
     *
     * @return Current span, {@link NoopTraceSpan#INSTANCE} if the connection is not traced.
     */
    public TraceSpan currentSpan() {
        return currentSpan;
    }

    /**
     * Returns {@code true} if the context is hijacked.
     */
    public boolean hijacked() {
        return currentSpan != originalSpan;
    }

    /**
     * Replaces the current span until {@link #unhijack()}.
     *
     * @param span Span to use.
     * @throws IllegalStateException If the context is already hijacked.
     */
    public void hijack(TraceSpan span) {
        Objects.requireNonNull(span, "span");

        synchronized (mux) {
            if (currentSpan != originalSpan) {
                throw new IllegalStateException("Connection context is already hijacked [span=" + currentSpan + ']');
            }

            currentSpan = span;
        }
    }

    /**
     * Restores the span the context was created with. Does nothing if the context is not hijacked.
     */
    public void unhijack() {
        synchronized (mux) {
            currentSpan = originalSpan;
        }
    }
}
