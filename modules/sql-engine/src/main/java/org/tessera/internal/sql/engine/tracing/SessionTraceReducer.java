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

import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Tracing.DUPLICATE_SPAN_ERR;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.sql.engine.tracing.TraceMessageParser.ParsedMessage;
import org.tessera.internal.tracing.LogField;
import org.tessera.internal.tracing.LogRecord;
import org.tessera.internal.tracing.RecordedSpan;

/**
 * Flattens a forest of recorded spans into one ordered list of trace messages.
 *
 * <p>Every span contributes a start marker at its start time, followed by its own log messages merged by time with the messages of
 * its children. A child is inserted as a whole, at the position where it started relative to the parent's messages, so sibling
 * subtrees never interleave. On equal timestamps the parent's message goes first. Trees are emitted in the order their roots appear
 * in the input; a root is a span without a parent or whose parent is not part of the input.
 *
 * <p>Span ids must be unique and the parent links must form a forest. Anything else fails the whole reduction: no partial result is
 * produced.
 */
public final class SessionTraceReducer {
    /** Text of the synthetic message starting every span. */
    static final String SPAN_START_MESSAGE = "=== SPAN START: {} ===";

    /** Text used for a log record without a message. */
    static final String MISSING_EVENT_MESSAGE = "<event missing in trace message>";

    static final String ERROR_PREFIX = "error:";

    private SessionTraceReducer() {
        // No-op.
    }

    /**
     * Reduces recorded spans to trace rows.
     *
     * @param spans Recorded spans, in any order.
     * @return Trace rows, span indexes refer to positions in {@code spans}.
     * @throws TesseraInternalException With {@code DUPLICATE_SPAN_ERR} if a span id repeats or the spans form a cycle, with
     *      {@code MALFORMED_TRACE_MESSAGE_ERR} if a message cannot be parsed.
     */
    public static List<TraceRow> generateSessionTrace(List<RecordedSpan> spans) {
        return new Reduction(spans).run();
    }

    /** The first {@code event} or {@code error} field of the record gives its text. */
    static String messageOf(LogRecord log) {
        for (LogField field : log.fields()) {
            if (LogField.EVENT_KEY.equals(field.key())) {
                return field.value();
            }

            if (LogField.ERROR_KEY.equals(field.key())) {
                return ERROR_PREFIX + field.value();
            }
        }

        return MISSING_EVENT_MESSAGE;
    }

    private static final class Reduction {
        private final List<RecordedSpan> spans;

        /** Children positions of every span, ordered by start time. */
        private final IntArrayList[] children;

        private final IntArrayList roots = new IntArrayList();

        private final boolean[] visited;

        private final List<TraceRow> rows = new ArrayList<>();

        Reduction(List<RecordedSpan> spans) {
            this.spans = spans;
            this.children = new IntArrayList[spans.size()];
            this.visited = new boolean[spans.size()];
        }

        List<TraceRow> run() {
            buildIndex();

            for (int i = 0; i < roots.size(); i++) {
                expand(roots.getInt(i));
            }

            for (int i = 0; i < visited.length; i++) {
                if (!visited[i]) {
                    throw new TesseraInternalException(DUPLICATE_SPAN_ERR,
                            format("Span is its own ancestor [spanId={}]", spans.get(i).spanId()));
                }
            }

            return rows;
        }

        private void buildIndex() {
            Long2IntOpenHashMap positions = new Long2IntOpenHashMap(spans.size());
            positions.defaultReturnValue(-1);

            for (int i = 0; i < spans.size(); i++) {
                long spanId = spans.get(i).spanId();

                if (positions.put(spanId, i) != -1) {
                    throw new TesseraInternalException(DUPLICATE_SPAN_ERR, format("Duplicate span [spanId={}]", spanId));
                }

                children[i] = new IntArrayList();
            }

            for (int i = 0; i < spans.size(); i++) {
                long parentId = spans.get(i).parentSpanId();

                int parent = parentId == RecordedSpan.ROOT_SPAN_ID ? -1 : positions.get(parentId);

                if (parent == -1) {
                    roots.add(i);
                } else {
                    children[parent].add(i);
                }
            }

            for (IntArrayList list : children) {
                if (list.size() > 1) {
                    // Merge sort is stable: siblings starting at the same instant keep the input order.
                    IntArrays.mergeSort(list.elements(), 0, list.size(), (a, b) -> startTime(a).compareTo(startTime(b)));
                }
            }
        }

        private void expand(int pos) {
            if (visited[pos]) {
                throw new TesseraInternalException(DUPLICATE_SPAN_ERR,
                        format("Span is reachable twice [spanId={}]", spans.get(pos).spanId()));
            }

            visited[pos] = true;

            RecordedSpan span = spans.get(pos);

            addRow(pos, 0, span.startTime(), span.isOpen() ? null : span.duration(), format(SPAN_START_MESSAGE, span.operation()));

            List<LogRecord> logs = span.logs();
            IntArrayList kids = children[pos];

            int logIdx = 0;
            int kidIdx = 0;

            while (logIdx < logs.size() || kidIdx < kids.size()) {
                boolean takeLog = kidIdx == kids.size()
                        || (logIdx < logs.size() && !logs.get(logIdx).time().isAfter(startTime(kids.getInt(kidIdx))));

                if (takeLog) {
                    LogRecord log = logs.get(logIdx);

                    addRow(pos, ++logIdx, log.time(), null, messageOf(log));
                } else {
                    expand(kids.getInt(kidIdx++));
                }
            }
        }

        private void addRow(int pos, int msgIdx, Instant time, @Nullable Duration duration, String msg) {
            ParsedMessage parsed = TraceMessageParser.parse(msg);

            rows.add(new TraceRow(
                    pos,
                    msgIdx,
                    time,
                    duration,
                    msgIdx == 0 ? spans.get(pos).operation() : null,
                    parsed.location,
                    parsed.tag,
                    parsed.text
            ));
        }

        private Instant startTime(int pos) {
            return spans.get(pos).startTime();
        }
    }
}
