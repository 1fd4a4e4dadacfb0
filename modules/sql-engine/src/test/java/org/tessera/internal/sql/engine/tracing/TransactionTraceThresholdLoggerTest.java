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
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;
import static org.tessera.lang.ErrorGroups.Tracing.DUPLICATE_SPAN_ERR;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.sql.engine.config.SqlSessionConfiguration;
import org.tessera.internal.testframework.BaseTesseraAbstractTest;
import org.tessera.internal.tracing.RecordedSpan;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;
import org.tessera.internal.tracing.otel.OtelSpanManager;

/**
 * Tests for {@link TransactionTraceThresholdLogger}.
 */
@ExtendWith(MockitoExtension.class)
public class TransactionTraceThresholdLoggerTest extends BaseTesseraAbstractTest {
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private final ManualClock clock = new ManualClock(START);

    private final OtelSpanManager spanManager = new OtelSpanManager(clock);

    @Mock
    private TesseraLogger txnLog;

    @AfterEach
    public void tearDown() {
        spanManager.close();
    }

    @Test
    public void slowTransactionIsLogged() {
        var thresholdLogger = new TransactionTraceThresholdLogger(spanManager, Duration.ofMillis(10), txnLog);

        TraceSpan txn = spanManager.create(null, "txn");

        thresholdLogger.onTransactionStart(txn);

        clock.advance(Duration.ofMillis(5));
        spanManager.create(txn, "update").addEvent(() -> "[n1] writing").end();

        clock.advance(Duration.ofMillis(10));
        txn.end();

        assertTrue(thresholdLogger.onTransactionFinish(txn, Duration.ofMillis(15)));
        assertFalse(spanManager.isRecording(txn));

        ArgumentCaptor<String> trace = ArgumentCaptor.forClass(String.class);

        verify(txnLog).info(eq("SQL transaction took {}ms, exceeding tracing threshold of {}ms:\n{}"), eq(15L), eq(10L), trace.capture());

        assertThat(trace.getValue(), containsString("0.0 === SPAN START: txn ==="));
        assertThat(trace.getValue(), containsString("1.1 [n1] writing"));
    }

    @Test
    public void fastTransactionIsNotLogged() {
        var thresholdLogger = new TransactionTraceThresholdLogger(spanManager, Duration.ofSeconds(1), txnLog);

        TraceSpan txn = spanManager.create(null, "txn");

        thresholdLogger.onTransactionStart(txn);

        assertTrue(spanManager.isRecording(txn));
        assertFalse(thresholdLogger.onTransactionFinish(txn, Duration.ofMillis(999)));
        assertFalse(spanManager.isRecording(txn));

        verifyNoInteractions(txnLog);
    }

    @Test
    public void unreducibleTraceIsReportedAsWarning() {
        SpanManager mgr = mock(SpanManager.class);
        TraceSpan txn = mock(TraceSpan.class);
        RecordedSpan dup = new RecordedSpan(7, RecordedSpan.ROOT_SPAN_ID, "txn", START, Duration.ofMillis(20), List.of());

        when(mgr.recording(txn)).thenReturn(List.of(dup, dup));

        var thresholdLogger = new TransactionTraceThresholdLogger(mgr, Duration.ofMillis(10), txnLog);

        thresholdLogger.onTransactionStart(txn);

        assertFalse(thresholdLogger.onTransactionFinish(txn, Duration.ofMillis(20)));

        ArgumentCaptor<Throwable> err = ArgumentCaptor.forClass(Throwable.class);

        verify(txnLog).warn(eq("Failed to reduce the trace of a slow SQL transaction [elapsed={}ms]"), err.capture(), eq(20L));
        verifyNoMoreInteractions(txnLog);
        verify(mgr).stopRecording(txn);

        assertEquals(DUPLICATE_SPAN_ERR, ((TesseraInternalException) err.getValue()).code());
    }

    @Test
    public void zeroThresholdDisablesLogger() {
        SpanManager mgr = mock(SpanManager.class);
        TraceSpan txn = mock(TraceSpan.class);

        var thresholdLogger = new TransactionTraceThresholdLogger(mgr, SqlSessionConfiguration.defaults().txnTraceThreshold(), txnLog);

        assertFalse(thresholdLogger.enabled());

        thresholdLogger.onTransactionStart(txn);

        assertFalse(thresholdLogger.onTransactionFinish(txn, Duration.ofHours(1)));

        verifyNoInteractions(mgr, txnLog);
    }

    @Test
    public void negativeThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TransactionTraceThresholdLogger(mock(SpanManager.class), Duration.ofMillis(-1)));
    }

    @Test
    public void formatTrace() {
        Instant ts = Instant.parse("2024-03-01T10:00:00.005Z");

        String text = TransactionTraceThresholdLogger.formatTrace(List.of(
                new TraceRow(0, 0, ts, null, "txn", "", "", "=== SPAN START: txn ==="),
                new TraceRow(0, 1, ts, null, null, "kv/Store.java:7", "[n2]", "put")
        ));

        assertEquals(
                "2024-03-01T10:00:00.005Z 0.0 === SPAN START: txn ===\n"
                        + "2024-03-01T10:00:00.005Z 0.1 kv/Store.java:7 [n2] put\n",
                text
        );
    }
}
