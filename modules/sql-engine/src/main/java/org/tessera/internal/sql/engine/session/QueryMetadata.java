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

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.tessera.internal.sql.engine.statement.SqlStatement;
import org.tessera.lang.CancelHandle;
import org.tessera.lang.CancelHandleHelper;

/**
 * Bookkeeping of a query from the moment it starts preparing until it finishes. Owned by the session running the query.
 */
public class QueryMetadata {
    private final ClusterWideId id;

    private final Instant start;

    private final SqlStatement statement;

    private final CancelHandle cancelHandle;

    private final boolean hidden;

    private volatile QueryPhase phase = QueryPhase.PREPARING;

    private volatile boolean distributed;

    /**
     * Constructor.
     *
     * @param id Query id.
     * @param start Start time.
     * @param statement Statement being run.
     * @param cancelHandle Handle cancelling the query execution.
     */
    public QueryMetadata(ClusterWideId id, Instant start, SqlStatement statement, CancelHandle cancelHandle) {
        this.id = Objects.requireNonNull(id, "id");
        this.start = Objects.requireNonNull(start, "start");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.cancelHandle = Objects.requireNonNull(cancelHandle, "cancelHandle");
        this.hidden = statement.hiddenFromShowQueries();
    }

    /**
     * Moves the query to the execution phase.
     *
     * @param distributed Whether the query plan is executed on several nodes.
     * @throws IllegalStateException If the query is already executing.
     */
    public synchronized void startExecution(boolean distributed) {
        if (phase != QueryPhase.PREPARING) {
            throw new IllegalStateException("Query is already executing [id=" + id + ']');
        }

        this.distributed = distributed;
        this.phase = QueryPhase.EXECUTING;
    }

    /**
     * Binds the query execution to the cancel handle of the query. The action runs right away if the query is already cancelled.
     *
     * @param cancelAction Action interrupting the execution.
     * @param completionFut Future completed once the execution has released its resources.
     */
    public void addCancelAction(Runnable cancelAction, CompletableFuture<?> completionFut) {
        CancelHandleHelper.addCancelAction(cancelHandle.token(), cancelAction, completionFut);
    }

    public ClusterWideId id() {
        return id;
    }

    public Instant start() {
        return start;
    }

    public SqlStatement statement() {
        return statement;
    }

    public CancelHandle cancelHandle() {
        return cancelHandle;
    }

    /** Returns {@code true} if the query must not be listed in session snapshots. */
    public boolean hidden() {
        return hidden;
    }

    public QueryPhase phase() {
        return phase;
    }

    /** Returns {@code true} if the query is executing a distributed plan, always {@code false} while preparing. */
    public boolean distributed() {
        return phase == QueryPhase.EXECUTING && distributed;
    }

    /**
     * Creates a snapshot of the query.
     *
     * @return Query snapshot.
     */
    public synchronized ActiveQueryInfo toActiveQueryInfo() {
        return new ActiveQueryInfo(id, start, statement.toSqlString(), distributed(), phase);
    }
}
