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
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.TestOnly;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.tracing.RecordingType;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;

/**
 * Logs the trace of every transaction that runs longer than a threshold. Transactions are recorded from their start, so the trace is
 * only available if the logger is enabled before the transaction begins. A zero threshold disables the logger.
 */
public class TransactionTraceThresholdLogger {
    private final SpanManager spanManager;

    private final Duration threshold;

    private final TesseraLogger log;

    /**
     * Constructor.
     *
     * @param spanManager Span manager.
     * @param threshold Duration starting from which a transaction trace is logged, zero to disable.
     */
    public TransactionTraceThresholdLogger(SpanManager spanManager, Duration threshold) {
        this(spanManager, threshold, Loggers.forClass(TransactionTraceThresholdLogger.class));
    }

    @TestOnly
    TransactionTraceThresholdLogger(SpanManager spanManager, Duration threshold, TesseraLogger log) {
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("Negative threshold: " + threshold);
        }

        this.spanManager = Objects.requireNonNull(spanManager, "spanManager");
        this.threshold = threshold;
        this.log = log;
    }

    /** Returns {@code true} if transaction traces are collected. */
    public boolean enabled() {
        return !threshold.isZero();
    }

    /**
     * Starts recording a transaction.
     *
     * @param txnSpan Span of the transaction.
     */
    public void onTransactionStart(TraceSpan txnSpan) {
        if (enabled()) {
            spanManager.startRecording(txnSpan, RecordingType.SNOWBALL);
        }
    }

    /**
     * Stops recording a transaction and logs its trace if the transaction took too long.
     *
     * @param txnSpan Span of the transaction.
     * @param elapsed Transaction duration.
     * @return {@code true} if the trace was logged. A trace that cannot be reduced is reported as a warning instead.
     */
    public boolean onTransactionFinish(TraceSpan txnSpan, Duration elapsed) {
        if (!enabled()) {
            return false;
        }

        try {
            if (elapsed.compareTo(threshold) < 0) {
                return false;
            }

            List<TraceRow> trace;

            try {
                trace = SessionTraceReducer.generateSessionTrace(spanManager.recording(txnSpan));
            } catch (TesseraInternalException e) {
                log.warn("Failed to reduce the trace of a slow SQL transaction [elapsed={}ms]", e, elapsed.toMillis());

                return false;
            }

            log.info("SQL transaction took {}ms, exceeding tracing threshold of {}ms:\n{}",
                    elapsed.toMillis(), threshold.toMillis(), formatTrace(trace));

            return true;
        } finally {
            spanManager.stopRecording(txnSpan);
        }
    }

    /**
     * Renders a trace as text, one row per line.
     *
     * @param trace Trace rows.
     * @return Text.
     */
    static String formatTrace(List<TraceRow> trace) {
        StringBuilder sb = new StringBuilder();

        for (TraceRow row : trace) {
            sb.append(row.timestamp()).append(' ').append(row.spanIndex()).append('.').append(row.messageIndex()).append(' ');

            if (!row.location().isEmpty()) {
                sb.append(row.location()).append(' ');
            }

            if (!row.tag().isEmpty()) {
                sb.append(row.tag()).append(' ');
            }

            sb.append(row.message()).append('\n');
        }

        return sb.toString();
    }
}
