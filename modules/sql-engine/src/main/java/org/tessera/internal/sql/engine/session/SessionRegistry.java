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
import static org.tessera.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.tessera.lang.ErrorGroups.Session.MALFORMED_ID_ERR;
import static org.tessera.lang.ErrorGroups.Session.QUERY_NOT_FOUND_ERR;
import static org.tessera.lang.ErrorGroups.Session.SESSION_NOT_FOUND_ERR;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.TestOnly;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.lang.TesseraException;

/**
 * Node-wide registry of the sessions connected to the node.
 *
 * <p>Cancellation requests are authorized against the session owner: a user that is neither the owner nor the superuser does not see
 * the session at all, so for such a user a session of somebody else and a missing session are reported the same way.
 */
public class SessionRegistry {
    /** Name of the user allowed to cancel any session or query. */
    public static final String SUPERUSER = "root";

    private static final TesseraLogger LOG = Loggers.forClass(SessionRegistry.class);

    private final Object mux = new Object();

    /** Guarded by {@link #mux}. */
    private final Map<ClusterWideId, RegisteredSession> sessions = new HashMap<>();

    /** Guarded by {@link #mux}. */
    private final Map<RegisteredSession, ClusterWideId> ids = new IdentityHashMap<>();

    /**
     * Registers a session. Registering the same session under the same id again does nothing.
     *
     * @param id Session id.
     * @param session Session.
     * @throws TesseraInternalException If the id is taken by another session or the session is registered under another id.
     */
    public void register(ClusterWideId id, RegisteredSession session) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(session, "session");

        synchronized (mux) {
            RegisteredSession existing = sessions.get(id);

            if (existing == session) {
                return;
            }

            if (existing != null) {
                throw new TesseraInternalException(INTERNAL_ERR, format("Session ID is already in use [id={}]", id));
            }

            ClusterWideId existingId = ids.get(session);

            if (existingId != null) {
                throw new TesseraInternalException(INTERNAL_ERR,
                        format("Session is already registered under another ID [id={}, existingId={}]", id, existingId));
            }

            sessions.put(id, session);
            ids.put(session, id);
        }

        LOG.debug("Session registered [id={}, user={}]", id, session.user());
    }

    /**
     * Removes a session from the registry. Does nothing if there is no session with the given id.
     *
     * @param id Session id.
     */
    public void deregister(ClusterWideId id) {
        RegisteredSession removed;

        synchronized (mux) {
            removed = sessions.remove(id);

            if (removed != null) {
                ids.remove(removed);
            }
        }

        if (removed != null) {
            LOG.debug("Session deregistered [id={}]", id);
        }
    }

    /**
     * Cancels a query running in any of the sessions visible to the user.
     *
     * @param queryIdText Query id in the textual form.
     * @param user User requesting the cancellation.
     * @return {@code true} if the query was found and signalled.
     * @throws TesseraException With {@code MALFORMED_ID_ERR} if the id cannot be parsed, or {@code QUERY_NOT_FOUND_ERR} if no
     *      session visible to the user runs the query.
     */
    public boolean cancelQuery(String queryIdText, String user) {
        ClusterWideId queryId = parseQueryId(queryIdText);

        synchronized (mux) {
            for (RegisteredSession session : sessions.values()) {
                if (!visibleTo(session, user)) {
                    continue;
                }

                if (session.cancelQuery(queryId)) {
                    LOG.info("Query cancelled [queryId={}, user={}]", queryId, user);

                    return true;
                }
            }
        }

        throw new TesseraException(QUERY_NOT_FOUND_ERR, format("query ID {} not found", queryId));
    }

    /**
     * Cancels a session visible to the user.
     *
     * @param sessionIdBytes Session id in the binary form.
     * @param user User requesting the cancellation.
     * @return {@code true} if the session was found and signalled.
     * @throws TesseraException With {@code MALFORMED_ID_ERR} if the id cannot be decoded, or {@code SESSION_NOT_FOUND_ERR} if there is
     *      no such session visible to the user.
     */
    public boolean cancelSession(byte[] sessionIdBytes, String user) {
        ClusterWideId sessionId = ClusterWideId.fromBytes(sessionIdBytes);

        synchronized (mux) {
            RegisteredSession session = sessions.get(sessionId);

            if (session != null && visibleTo(session, user)) {
                session.cancelSession();

                LOG.info("Session cancelled [sessionId={}, user={}]", sessionId, user);

                return true;
            }
        }

        throw new TesseraException(SESSION_NOT_FOUND_ERR, format("session ID {} not found", sessionId));
    }

    /**
     * Takes snapshots of all registered sessions, in no particular order.
     *
     * @return Session snapshots.
     */
    public List<SessionInfo> serializeAll() {
        synchronized (mux) {
            List<SessionInfo> res = new ArrayList<>(sessions.size());

            for (RegisteredSession session : sessions.values()) {
                res.add(session.serialize());
            }

            return res;
        }
    }

    @TestOnly
    int size() {
        synchronized (mux) {
            return sessions.size();
        }
    }

    private static boolean visibleTo(RegisteredSession session, String user) {
        return SUPERUSER.equals(user) || session.user().equals(user);
    }

    private static ClusterWideId parseQueryId(String queryIdText) {
        try {
            return ClusterWideId.fromString(queryIdText);
        } catch (TesseraException e) {
            throw new TesseraException(MALFORMED_ID_ERR, format("query ID {} malformed", queryIdText), e);
        }
    }
}
