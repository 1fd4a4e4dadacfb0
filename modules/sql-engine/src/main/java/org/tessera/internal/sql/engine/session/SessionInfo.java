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
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of a registered session, the form in which sessions are reported to other nodes and to clients.
 */
public final class SessionInfo {
    private final int nodeId;

    private final ClusterWideId sessionId;

    private final String username;

    private final String clientAddress;

    private final String applicationName;

    private final Instant start;

    private final List<ActiveQueryInfo> activeQueries;

    private final @Nullable String lastActiveQuery;

    /**
     * Constructor.
     *
     * @param nodeId Id of the node the session is connected to.
     * @param sessionId Session id.
     * @param username Owner of the session.
     * @param clientAddress Client address.
     * @param applicationName Application name reported by the client.
     * @param start Session start time.
     * @param activeQueries Queries running in the session.
     * @param lastActiveQuery Anonymized text of the last finished query, {@code null} if none.
     */
    public SessionInfo(
            int nodeId,
            ClusterWideId sessionId,
            String username,
            String clientAddress,
            String applicationName,
            Instant start,
            List<ActiveQueryInfo> activeQueries,
            @Nullable String lastActiveQuery
    ) {
        this.nodeId = nodeId;
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.username = Objects.requireNonNull(username, "username");
        this.clientAddress = Objects.requireNonNull(clientAddress, "clientAddress");
        this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
        this.start = Objects.requireNonNull(start, "start");
        this.activeQueries = List.copyOf(activeQueries);
        this.lastActiveQuery = lastActiveQuery;
    }

    public int nodeId() {
        return nodeId;
    }

    public ClusterWideId sessionId() {
        return sessionId;
    }

    public String username() {
        return username;
    }

    public String clientAddress() {
        return clientAddress;
    }

    public String applicationName() {
        return applicationName;
    }

    public Instant start() {
        return start;
    }

    public List<ActiveQueryInfo> activeQueries() {
        return activeQueries;
    }

    public @Nullable String lastActiveQuery() {
        return lastActiveQuery;
    }

    @Override
    public String toString() {
        return "SessionInfo [nodeId=" + nodeId + ", sessionId=" + sessionId + ", username=" + username
                + ", clientAddress=" + clientAddress + ", applicationName=" + applicationName + ", start=" + start
                + ", activeQueries=" + activeQueries.size() + ']';
    }
}
