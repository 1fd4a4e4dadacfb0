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

import static org.tessera.lang.ErrorGroups.Tracing.MISSING_TXN_SPAN_ERR;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.tracing.RecordedSpan;
import org.tessera.internal.tracing.RecordingType;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;

/**
 * Session tracing, the state behind {@code SET TRACING}.
 *
 * <p>Starting the tracing records the open transaction, if any, and creates a "session recording" span that replaces the span of the
 * connection context, so everything the session runs afterwards is recorded as well, across transaction boundaries. Stopping it
 * restores the connection context and keeps the reconstructed trace until the next cycle.
 *
 * <p>The state may be read from other threads: all of it is guarded by one monitor.
 */
public class SessionTracing {
    /** Operation name of the span wrapping the connection while tracing. */
    public static final String SESSION_RECORDING_OPERATION = "session recording";

    private static final TesseraLogger LOG = Loggers.forClass(SessionTracing.class);

    private final Object mux = new Object();

    private final SpanManager spanManager;

    private final ConnectionContext connCtx;

    private final TransactionState txState;

    private boolean enabled;

    private boolean kvTracingEnabled;

    private RecordingType recordingType = RecordingType.SNOWBALL;

    /** Span of the transaction open when the tracing started. */
    private @Nullable TraceSpan firstTxnSpan;

    /** Span installed into the connection context. */
    private @Nullable TraceSpan connSpan;

    private List<TraceRow> lastRecording = List.of();

    /**
     * Constructor.
     *
     * @param spanManager Span manager.
     * @param connCtx Connection context of the session.
     * @param txState Transaction state of the session.
     */
    public SessionTracing(SpanManager spanManager, ConnectionContext connCtx, TransactionState txState) {
        this.spanManager = Objects.requireNonNull(spanManager, "spanManager");
        this.connCtx = Objects.requireNonNull(connCtx, "connCtx");
        this.txState = Objects.requireNonNull(txState, "txState");
    }

    /**
     * Starts tracing the session. Does nothing if the tracing is already on.
     *
     * @param type Recording type.
     * @param kvTracingEnabled Whether storage level operations are traced too.
     * @throws TesseraInternalException With {@code MISSING_TXN_SPAN_ERR} if the open transaction has no span.
     */
    public void startTracing(RecordingType type, boolean kvTracingEnabled) {
        Objects.requireNonNull(type, "type");

        synchronized (mux) {
            if (enabled) {
                return;
            }

            TraceSpan txnSpan = null;

            if (txState.inTransaction()) {
                txnSpan = txState.transactionSpan();

                if (txnSpan == null || !txnSpan.isValid()) {
                    throw new TesseraInternalException(MISSING_TXN_SPAN_ERR, "The open transaction has no trace span");
                }
            }

            TraceSpan span = spanManager.create(connCtx.currentSpan(), SESSION_RECORDING_OPERATION);

            try {
                connCtx.hijack(span);
            } catch (IllegalStateException e) {
                span.end();

                throw e;
            }

            if (txnSpan != null) {
                spanManager.startRecording(txnSpan, type);
            }

            spanManager.startRecording(span, type);

            this.firstTxnSpan = txnSpan;
            this.connSpan = span;
            this.recordingType = type;
            this.kvTracingEnabled = kvTracingEnabled;
            this.enabled = true;
        }

        LOG.debug("Session tracing started [type={}, kvTracing={}]", type, kvTracingEnabled);
    }

    /**
     * Stops tracing the session and stores the reconstructed trace. Does nothing if the tracing is off.
     *
     * @throws TesseraInternalException If the recorded spans cannot be reduced. The tracing is stopped anyway and the stored trace
     *      is empty.
     */
    public void stopTracing() {
        synchronized (mux) {
            if (!enabled) {
                return;
            }

            enabled = false;

            List<RecordedSpan> spans = new ArrayList<>();

            if (firstTxnSpan != null) {
                spans.addAll(spanManager.recording(firstTxnSpan));

                spanManager.stopRecording(firstTxnSpan);
            }

            assert connSpan != null;

            connSpan.end();

            spans.addAll(spanManager.recording(connSpan));

            spanManager.stopRecording(connSpan);

            connCtx.unhijack();

            firstTxnSpan = null;
            connSpan = null;

            // A failed reduction leaves no trace rather than the one of the previous cycle.
            lastRecording = List.of();
            lastRecording = SessionTraceReducer.generateSessionTrace(spans);
        }

        LOG.debug("Session tracing stopped");
    }

    /**
     * Returns the trace of the session: the one kept from the last tracing cycle if the tracing is off, what has been recorded so
     * far otherwise.
     *
     * @return Trace rows.
     * @throws TesseraInternalException If the recorded spans cannot be reduced.
     */
    public List<TraceRow> getRecording() {
        List<RecordedSpan> spans = new ArrayList<>();

        synchronized (mux) {
            if (!enabled) {
                return lastRecording;
            }

            if (firstTxnSpan != null) {
                spans.addAll(spanManager.recording(firstTxnSpan));
            }

            assert connSpan != null;

            spans.addAll(spanManager.recording(connSpan));
        }

        return SessionTraceReducer.generateSessionTrace(spans);
    }

    /** Returns {@code true} if the session is being traced. */
    public boolean enabled() {
        synchronized (mux) {
            return enabled;
        }
    }

    /** Returns {@code true} if storage level operations are traced too. */
    public boolean kvTracingEnabled() {
        synchronized (mux) {
            return kvTracingEnabled;
        }
    }

    /** Returns the type of the current or the last recording. */
    public RecordingType recordingType() {
        synchronized (mux) {
            return recordingType;
        }
    }
}
