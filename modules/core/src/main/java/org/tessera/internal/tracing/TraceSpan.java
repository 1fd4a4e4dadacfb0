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

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

/**
 * Span of a trace: a named operation with a start, an end and timestamped events. Spans are created by a {@link SpanManager}.
 */
public interface TraceSpan {
    /** Returns the id of the span, {@code 0} for an invalid span. */
    long spanId();

    /** Returns the operation name the span was created with. */
    String operation();

    /**
     * Adds an event timestamped with the current time. Event texts follow the {@code [location] [tag] text} form that
     * {@code SHOW TRACE} splits into columns.
     *
     * @param evtSupplier Event text, not computed for an invalid span.
     * @return {@code this}.
     */
    TraceSpan addEvent(Supplier<String> evtSupplier);

    /** Returns {@code true} if the span is recorded by a real tracer. */
    boolean isValid();

    /**
     * Returns the tracer context of the span, used to parent children.
     *
     * @return Context, {@code null} for an invalid span.
     */
    <T> @Nullable T getContext();

    /**
     * Adds an error event.
     *
     * @param exception Error.
     */
    void recordException(Throwable exception);

    /** Ends the span. Calls after the first one are ignored. */
    void end();
}
