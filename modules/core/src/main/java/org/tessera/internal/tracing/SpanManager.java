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

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Manager for {@link TraceSpan} instances and their recordings.
 *
 * <p>A recording is started on a span and captures that span together with every descendant created while the recording is active.
 */
public interface SpanManager {
    /**
     * Creates a span with the given operation name.
     *
     * @param parentSpan Parent span, {@code null} or an invalid span to create a root.
     * @param operation Operation name.
     * @return Created span.
     */
    TraceSpan create(@Nullable TraceSpan parentSpan, String operation);

    /**
     * Starts recording the given span and its future descendants. Does nothing if the span is already being recorded.
     *
     * @param span Span to record.
     * @param type Recording type.
     */
    void startRecording(TraceSpan span, RecordingType type);

    /**
     * Stops the recording started on the given span. Does nothing if there is no such recording.
     *
     * @param span Span the recording was started on.
     */
    void stopRecording(TraceSpan span);

    /**
     * Returns what has been recorded so far for the recording started on the given span, ordered by start time.
     *
     * @param span Span the recording was started on.
     * @return Recorded spans, empty if the span is not being recorded.
     */
    List<RecordedSpan> recording(TraceSpan span);
}
