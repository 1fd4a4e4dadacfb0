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
 * Noop implementation of {@link SpanManager}.
 */
public class NoopSpanManager implements SpanManager {
    /** Instance. */
    public static final SpanManager INSTANCE = new NoopSpanManager();

    @Override
    public TraceSpan create(@Nullable TraceSpan parentSpan, String operation) {
        return NoopTraceSpan.INSTANCE;
    }

    @Override
    public void startRecording(TraceSpan span, RecordingType type) {
        // No-op.
    }

    @Override
    public void stopRecording(TraceSpan span) {
        // No-op.
    }

    @Override
    public List<RecordedSpan> recording(TraceSpan span) {
        return List.of();
    }
}
