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

/**
 * Snapshot of a query running in a session.
 */
public final class ActiveQueryInfo {
    /** Longest SQL text kept in a snapshot, including the trailing ellipsis. */
    public static final int MAX_SQL_BYTES = 1000;

    static final String ELLIPSIS = "…";

    private final ClusterWideId id;

    private final Instant start;

    private final String sql;

    private final boolean distributed;

    private final QueryPhase phase;

    /**
     * Constructor.
     *
     * @param id Query id.
     * @param start Query start time.
     * @param sql SQL text, truncated to {@link #MAX_SQL_BYTES} if longer.
     * @param distributed Whether the query is executed on several nodes.
     * @param phase Query phase.
     */
    public ActiveQueryInfo(ClusterWideId id, Instant start, String sql, boolean distributed, QueryPhase phase) {
        this.id = Objects.requireNonNull(id, "id");
        this.start = Objects.requireNonNull(start, "start");
        this.sql = truncateSql(sql);
        this.distributed = distributed;
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    /**
     * Cuts the SQL text so that, together with the ellipsis marking the cut, it fits into {@link #MAX_SQL_BYTES}.
     *
     * @param sql SQL text.
     * @return The text itself if short enough, otherwise its prefix followed by an ellipsis.
     */
    static String truncateSql(String sql) {
        if (sql.length() <= MAX_SQL_BYTES) {
            return sql;
        }

        int end = MAX_SQL_BYTES - ELLIPSIS.length();

        // Do not split a surrogate pair.
        if (Character.isHighSurrogate(sql.charAt(end - 1))) {
            end--;
        }

        return sql.substring(0, end) + ELLIPSIS;
    }

    public ClusterWideId id() {
        return id;
    }

    public Instant start() {
        return start;
    }

    public String sql() {
        return sql;
    }

    public boolean distributed() {
        return distributed;
    }

    public QueryPhase phase() {
        return phase;
    }

    @Override
    public String toString() {
        return "ActiveQueryInfo [id=" + id + ", start=" + start + ", phase=" + phase + ", distributed=" + distributed
                + ", sql=" + sql + ']';
    }
}
