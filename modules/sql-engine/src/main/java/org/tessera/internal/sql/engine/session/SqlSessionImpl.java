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

package org.tessera.internal.sql.engine.session;

import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Session.QUERY_NOT_FOUND_ERR;
import static org.tessera.lang.ErrorGroups.Sql.EXECUTION_CANCELLED_ERR;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.hlc.HybridClock;
import org.tessera.internal.hlc.HybridTimestamp;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.sql.engine.config.SqlSessionConfiguration;
import org.tessera.internal.sql.engine.statement.SqlStatement;
import org.tessera.internal.sql.engine.tracing.ConnectionContext;
import org.tessera.internal.sql.engine.tracing.SessionTracing;
import org.tessera.internal.sql.engine.tracing.TransactionState;
import org.tessera.internal.sql.engine.tracing.TransactionTraceThresholdLogger;
import org.tessera.internal.tracing.SpanManager;
import org.tessera.internal.tracing.TraceSpan;
import org.tessera.lang.CancelHandle;
import org.tessera.lang.TesseraException;

/**
 * SQL session of a client connection.
 *
 * <p>Keeps the queries running in the session from the moment they start preparing until they finish. Every query gets a span, child
 * of the current span of the connection context, so the queries are part of the session trace while tracing is on.
 */
public class SqlSessionImpl implements RegisteredSession {
    /** Operation name of query spans. */
    public static final String QUERY_OPERATION = "sql query";

    private static final TesseraLogger LOG = Loggers.forClass(SqlSessionImpl.class);

    private final ClusterWideId id;

    private final int nodeId;

    private final String user;

    private final String applicationName;

    private final String clientAddress;

    private final Instant start;

    private final HybridClock clock;

    private final SpanManager spanManager;

    private final ConnectionContext connCtx;

    private final SessionTracing tracing;

    private final TransactionTraceThresholdLogger txnTraceLogger;

    private final boolean eventLogEnabled;

    private final CancelHandle cancelHandle = CancelHandle.create();

    private final Object mux = new Object();

    /** Guarded by {@link #mux}. */
    private final Map<ClusterWideId, QueryMetadata> activeQueries = new LinkedHashMap<>();

    /** Guarded by {@link #mux}. */
    private final Map<ClusterWideId, TraceSpan> querySpans = new LinkedHashMap<>();

    private volatile @Nullable SqlStatement lastActiveQuery;

    /**
     * Constructor.
     *
     * @param nodeId Id of the node the client is connected to.
     * @param user Owner of the session.
     * @param applicationName Application name reported by the client.
     * @param clientAddress Client address.
     * @param clock Node clock, used to generate ids.
     * @param spanManager Span manager.
     * @param txState Transaction state of the session.
     * @param configuration Configuration.
     */
    public SqlSessionImpl(
            int nodeId,
            String user,
            String applicationName,
            String clientAddress,
            HybridClock clock,
            SpanManager spanManager,
            TransactionState txState,
            SqlSessionConfiguration configuration
    ) {
        this.nodeId = nodeId;
        this.user = Objects.requireNonNull(user, "user");
        this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
        this.clientAddress = Objects.requireNonNull(clientAddress, "clientAddress");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.spanManager = Objects.requireNonNull(spanManager, "spanManager");
        this.eventLogEnabled = configuration.sessionEventLogEnabled();

        HybridTimestamp now = clock.now();

        this.id = ClusterWideId.generate(now, nodeId);
        this.start = now.toInstant();
        this.connCtx = new ConnectionContext();
        this.tracing = new SessionTracing(spanManager, connCtx, txState);
        this.txnTraceLogger = new TransactionTraceThresholdLogger(spanManager, configuration.txnTraceThreshold());
    }

    public ClusterWideId id() {
        return id;
    }

    @Override
    public String user() {
        return user;
    }

    public ConnectionContext connectionContext() {
        return connCtx;
    }

    public SessionTracing tracing() {
        return tracing;
    }

    /**
     * Notifies the session that it opened a transaction.
     *
     * @param txnSpan Span of the transaction.
     */
    public void transactionStarted(TraceSpan txnSpan) {
        txnTraceLogger.onTransactionStart(txnSpan);
    }

    /**
     * Notifies the session that its transaction committed or rolled back. The trace of the transaction is logged if it ran longer
     * than the configured threshold.
     *
     * @param txnSpan Span of the transaction.
     * @param elapsed Transaction duration.
     * @return {@code true} if the trace was logged.
     */
    public boolean transactionFinished(TraceSpan txnSpan, Duration elapsed) {
        return txnTraceLogger.onTransactionFinish(txnSpan, elapsed);
    }

    /** Returns {@code true} if the session was cancelled. */
    public boolean cancelled() {
        return cancelHandle.isCancelled();
    }

    /**
     * Registers a query that starts preparing.
     *
     * @param statement Statement of the query.
     * @return Query metadata.
     * @throws TesseraException With {@code EXECUTION_CANCELLED_ERR} if the session was cancelled.
     */
    public QueryMetadata beginQuery(SqlStatement statement) {
        HybridTimestamp now = clock.now();
        QueryMetadata query = new QueryMetadata(ClusterWideId.generate(now, nodeId), now.toInstant(), statement, CancelHandle.create());

        synchronized (mux) {
            if (cancelHandle.isCancelled()) {
                throw new TesseraException(EXECUTION_CANCELLED_ERR, format("The session was cancelled [sessionId={}]", id));
            }

            TraceSpan span = spanManager.create(connCtx.currentSpan(), QUERY_OPERATION);

            span.addEvent(() -> "preparing");

            activeQueries.put(query.id(), query);
            querySpans.put(query.id(), span);
        }

        logEvent("query started", query.id());

        return query;
    }

    /**
     * Moves a query to the execution phase.
     *
     * @param queryId Query id.
     * @param distributed Whether the query plan runs on several nodes.
     * @throws TesseraException With {@code QUERY_NOT_FOUND_ERR} if the query is not running in this session.
     */
    public void startExecution(ClusterWideId queryId, boolean distributed) {
        QueryMetadata query;
        TraceSpan span;

        synchronized (mux) {
            query = activeQueries.get(queryId);
            span = querySpans.get(queryId);
        }

        if (query == null) {
            throw new TesseraException(QUERY_NOT_FOUND_ERR, format("query ID {} not found", queryId));
        }

        query.startExecution(distributed);

        span.addEvent(() -> distributed ? "executing distributed plan" : "executing local plan");
    }

    /**
     * Removes a finished query, whatever the outcome. Does nothing for an unknown query.
     *
     * @param queryId Query id.
     */
    public void finishQuery(ClusterWideId queryId) {
        QueryMetadata query;
        TraceSpan span;

        synchronized (mux) {
            query = activeQueries.remove(queryId);
            span = querySpans.remove(queryId);
        }

        if (query == null) {
            return;
        }

        span.end();

        lastActiveQuery = query.statement();

        logEvent("query finished", queryId);
    }

    @Override
    public boolean cancelQuery(ClusterWideId queryId) {
        QueryMetadata query;

        synchronized (mux) {
            query = activeQueries.get(queryId);
        }

        if (query == null) {
            return false;
        }

        query.cancelHandle().cancelAsync();

        logEvent("query cancel requested", queryId);

        return true;
    }

    @Override
    public void cancelSession() {
        List<QueryMetadata> queries;

        synchronized (mux) {
            queries = new ArrayList<>(activeQueries.values());

            cancelHandle.cancelAsync();
        }

        for (QueryMetadata query : queries) {
            query.cancelHandle().cancelAsync();
        }

        logEvent("session cancel requested", null);
    }

    @Override
    public SessionInfo serialize() {
        List<ActiveQueryInfo> queries = new ArrayList<>();

        synchronized (mux) {
            for (QueryMetadata query : activeQueries.values()) {
                if (!query.hidden()) {
                    queries.add(query.toActiveQueryInfo());
                }
            }
        }

        SqlStatement last = lastActiveQuery;

        return new SessionInfo(
                nodeId,
                id,
                user,
                clientAddress,
                applicationName,
                start,
                queries,
                last == null ? null : ActiveQueryInfo.truncateSql(last.toAnonymizedString())
        );
    }

    private void logEvent(String event, @Nullable ClusterWideId queryId) {
        if (eventLogEnabled) {
            LOG.info("Session event [sessionId={}, user={}, event={}, queryId={}]", id, user, event, queryId);
        }
    }

    @Override
    public String toString() {
        return "SqlSessionImpl [id=" + id + ", user=" + user + ", applicationName=" + applicationName + ']';
    }
}
