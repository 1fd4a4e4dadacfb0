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
import java.util.ArrayList;
import java.util.List;

/**
 * Shape of the {@code session_trace} virtual table.
 */
public final class SessionTraceTable {
    /** Table name. */
    public static final String NAME = "session_trace";

    /** Column names, in row order. */
    public static final List<String> COLUMN_NAMES = List.of(
            "span_idx",
            "message_idx",
            "timestamp",
            "duration",
            "operation",
            "location",
            "tag",
            "message"
    );

    /** Column types, in row order. */
    public static final List<Class<?>> COLUMN_TYPES = List.of(
            Integer.class,
            Integer.class,
            Instant.class,
            Duration.class,
            String.class,
            String.class,
            String.class,
            String.class
    );

    private SessionTraceTable() {
        // No-op.
    }

    /**
     * Converts a trace row into a table row.
     *
     * @param row Trace row.
     * @return Column values in the order of {@link #COLUMN_NAMES}.
     */
    public static Object[] toRow(TraceRow row) {
        return new Object[] {
                row.spanIndex(),
                row.messageIndex(),
                row.timestamp(),
                row.duration(),
                row.operation(),
                row.location(),
                row.tag(),
                row.message()
        };
    }

    /**
     * Reads the table for a session.
     *
     * @param tracing Tracing of the session.
     * @return Table rows.
     */
    public static List<Object[]> scan(SessionTracing tracing) {
        List<TraceRow> trace = tracing.getRecording();
        List<Object[]> rows = new ArrayList<>(trace.size());

        for (TraceRow row : trace) {
            rows.add(toRow(row));
        }

        return rows;
    }
}
