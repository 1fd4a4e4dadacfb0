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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.tessera.internal.testframework.TesseraTestUtils.assertThrowsWithCode;
import static org.tessera.internal.testframework.TesseraTestUtils.runRace;
import static org.tessera.lang.ErrorGroups.Tracing.DUPLICATE_SPAN_ERR;
import static org.tessera.lang.ErrorGroups.Tracing.MISSING_TXN_SPAN_ERR;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.testframework.BaseTesseraAbstractTest;
import org.tessera.internal.tracing.NoopTraceSpan;
import org.tessera.internal.tracing.RecordedSpan;
import org.tessera.internal.tracing.RecordingType;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;
import org.tessera.internal.tracing.otel.OtelSpanManager;

/**
 * Tests for {@link SessionTracing}.
 */
public class SessionTracingTest extends BaseTesseraAbstractTest {
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private final ManualClock clock = new ManualClock(START);

    private final OtelSpanManager spanManager = new OtelSpanManager(clock);

    private final ConnectionContext connCtx = new ConnectionContext();

    @AfterEach
    public void tearDown() {
        spanManager.close();
    }

    @Test
    public void tracesStatementsOutsideTransaction() {
        SessionTracing tracing = new SessionTracing(spanManager, connCtx, TransactionState.NONE);

        tracing.startTracing(RecordingType.SNOWBALL, false);

        assertTrue(tracing.enabled());
        assertTrue(connCtx.hijacked());
        assertEquals(SessionTracing.SESSION_RECORDING_OPERATION, connCtx.currentSpan().operation());

        tick();
        TraceSpan stmt = spanManager.create(connCtx.currentSpan(), "stmt");

        tick();
        stmt.addEvent(() -> "sql/Exec.java:10 [n1] running");

        tick();
        stmt.end();

        tick();
        tracing.stopTracing();

        assertFalse(tracing.enabled());
        assertFalse(connCtx.hijacked());
        assertSame(NoopTraceSpan.INSTANCE, connCtx.currentSpan());

        assertEquals(
                List.of(
                        new TraceRow(0, 0, at(0), Duration.ofMillis(4), "session recording", "", "",
                                "=== SPAN START: session recording ==="),
                        new TraceRow(1, 0, at(1), Duration.ofMillis(2), "stmt", "", "", "=== SPAN START: stmt ==="),
                        new TraceRow(1, 1, at(2), null, null, "sql/Exec.java:10", "[n1]", "running")
                ),
                tracing.getRecording()
        );
    }

    @Test
    public void recordsTransactionOpenAtStart() {
        TraceSpan txnSpan = spanManager.create(null, "txn");

        SessionTracing tracing = new SessionTracing(spanManager, connCtx, inTransaction(txnSpan));

        tick();
        tracing.startTracing(RecordingType.SNOWBALL, true);

        assertTrue(spanManager.isRecording(txnSpan));
        assertTrue(tracing.kvTracingEnabled());

        tick();
        TraceSpan txnStmt = spanManager.create(txnSpan, "txn stmt");

        tick();
        txnStmt.end();

        tracing.stopTracing();

        assertFalse(spanManager.isRecording(txnSpan));

        List<TraceRow> rows = tracing.getRecording();

        assertThat(operations(rows), contains("txn", "txn stmt", "session recording"));

        // The transaction is still open.
        assertNull(rows.get(0).duration());
        assertEquals(Duration.ofMillis(1), rows.get(1).duration());
    }

    @Test
    public void missingTransactionSpanFails() {
        SpanManager mgr = mock(SpanManager.class);

        for (TraceSpan txnSpan : new TraceSpan[] {null, NoopTraceSpan.INSTANCE}) {
            SessionTracing tracing = new SessionTracing(mgr, connCtx, inTransaction(txnSpan));

            assertThrowsWithCode(
                    TesseraInternalException.class,
                    MISSING_TXN_SPAN_ERR,
                    () -> tracing.startTracing(RecordingType.SNOWBALL, false),
                    "no trace span"
            );

            assertFalse(tracing.enabled());
            assertFalse(connCtx.hijacked());
        }

        verifyNoInteractions(mgr);
    }

    @Test
    public void secondStartIsNoop() {
        SpanManager mgr = mock(SpanManager.class);
        TraceSpan span = mock(TraceSpan.class);

        when(mgr.create(any(), anyString())).thenReturn(span);

        SessionTracing tracing = new SessionTracing(mgr, connCtx, TransactionState.NONE);

        tracing.startTracing(RecordingType.SNOWBALL, true);
        tracing.startTracing(RecordingType.SINGLE_NODE, false);

        verify(mgr, times(1)).create(any(), anyString());
        verify(mgr, times(1)).startRecording(span, RecordingType.SNOWBALL);

        assertEquals(RecordingType.SNOWBALL, tracing.recordingType());
        assertTrue(tracing.kvTracingEnabled());
        assertSame(span, connCtx.currentSpan());

        tracing.stopTracing();
        tracing.stopTracing();

        verify(span, times(1)).end();
        verify(mgr, times(1)).stopRecording(span);
        assertFalse(connCtx.hijacked());
    }

    @Test
    public void stopWhenIdleIsNoop() {
        SpanManager mgr = mock(SpanManager.class);

        SessionTracing tracing = new SessionTracing(mgr, connCtx, TransactionState.NONE);

        tracing.stopTracing();

        assertFalse(tracing.enabled());
        assertThat(tracing.getRecording(), empty());
        verifyNoInteractions(mgr);
    }

    @Test
    public void recordingWhileTracingDoesNotStopIt() {
        SessionTracing tracing = new SessionTracing(spanManager, connCtx, TransactionState.NONE);

        tracing.startTracing(RecordingType.SINGLE_NODE, false);

        tick();
        spanManager.create(connCtx.currentSpan(), "first").end();

        List<TraceRow> partial = tracing.getRecording();

        assertThat(operations(partial), contains("session recording", "first"));
        assertNull(partial.get(0).duration());
        assertTrue(tracing.enabled());
        assertTrue(connCtx.hijacked());

        tick();
        spanManager.create(connCtx.currentSpan(), "second").end();

        tracing.stopTracing();

        assertThat(operations(tracing.getRecording()), contains("session recording", "first", "second"));
    }

    @Test
    public void lastRecordingKeptUntilNextCycle() {
        SessionTracing tracing = new SessionTracing(spanManager, connCtx, TransactionState.NONE);

        tracing.startTracing(RecordingType.SNOWBALL, false);
        spanManager.create(connCtx.currentSpan(), "first cycle").end();
        tracing.stopTracing();

        List<TraceRow> first = tracing.getRecording();

        // Not recorded: tracing is off.
        spanManager.create(connCtx.currentSpan(), "untraced").end();

        assertThat(tracing.getRecording(), sameInstance(first));

        tick();
        tracing.startTracing(RecordingType.SNOWBALL, false);
        tick();
        spanManager.create(connCtx.currentSpan(), "second cycle").end();
        tracing.stopTracing();

        assertThat(operations(tracing.getRecording()), contains("session recording", "second cycle"));
    }

    @Test
    public void failedReductionDropsPreviousTrace() {
        SpanManager mgr = mock(SpanManager.class);
        TraceSpan span = mock(TraceSpan.class);
        RecordedSpan recorded = new RecordedSpan(1, RecordedSpan.ROOT_SPAN_ID, "session recording", at(0), Duration.ofMillis(1), List.of());
        RecordedSpan dup = new RecordedSpan(2, RecordedSpan.ROOT_SPAN_ID, "session recording", at(5), Duration.ofMillis(1), List.of());

        when(mgr.create(any(), anyString())).thenReturn(span);
        when(mgr.recording(span)).thenReturn(List.of(recorded)).thenReturn(List.of(dup, dup));

        SessionTracing tracing = new SessionTracing(mgr, connCtx, TransactionState.NONE);

        tracing.startTracing(RecordingType.SNOWBALL, false);
        tracing.stopTracing();

        assertThat(tracing.getRecording(), hasSize(1));

        tracing.startTracing(RecordingType.SNOWBALL, false);

        assertThrowsWithCode(TesseraInternalException.class, DUPLICATE_SPAN_ERR, tracing::stopTracing, null);

        assertFalse(tracing.enabled());
        assertFalse(connCtx.hijacked());
        assertThat(tracing.getRecording(), empty());
    }

    @Test
    public void readsRaceWithStartStop() {
        SessionTracing tracing = new SessionTracing(spanManager, connCtx, TransactionState.NONE);

        runRace(
                () -> {
                    for (int i = 0; i < 100; i++) {
                        tracing.startTracing(RecordingType.SNOWBALL, false);
                        spanManager.create(connCtx.currentSpan(), "stmt " + i).end();
                        tracing.stopTracing();
                    }
                },
                () -> {
                    for (int i = 0; i < 100; i++) {
                        tracing.getRecording();
                        tracing.enabled();
                    }
                }
        );

        assertFalse(tracing.enabled());
        assertThat(tracing.getRecording(), hasSize(2));
    }

    private static TransactionState inTransaction(TraceSpan txnSpan) {
        TransactionState txState = mock(TransactionState.class);

        when(txState.inTransaction()).thenReturn(true);
        when(txState.transactionSpan()).thenReturn(txnSpan);

        return txState;
    }

    private static List<String> operations(List<TraceRow> rows) {
        return rows.stream()
                .filter(r -> r.messageIndex() == 0)
                .map(TraceRow::operation)
                .collect(Collectors.toList());
    }

    private void tick() {
        clock.advance(Duration.ofMillis(1));
    }

    private static Instant at(long ms) {
        return START.plusMillis(ms);
    }
}
