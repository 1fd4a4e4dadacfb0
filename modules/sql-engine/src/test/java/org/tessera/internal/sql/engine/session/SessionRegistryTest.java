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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.tessera.internal.testframework.TesseraTestUtils.assertThrowsWithCode;
import static org.tessera.internal.testframework.TesseraTestUtils.runRace;
import static org.tessera.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.tessera.lang.ErrorGroups.Session.MALFORMED_ID_ERR;
import static org.tessera.lang.ErrorGroups.Session.QUERY_NOT_FOUND_ERR;
import static org.tessera.lang.ErrorGroups.Session.SESSION_NOT_FOUND_ERR;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.tessera.internal.hlc.HybridClock;
import org.tessera.internal.hlc.HybridClockImpl;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.sql.engine.config.SqlSessionConfiguration;
import org.tessera.internal.sql.engine.statement.TestStatement;
import org.tessera.internal.sql.engine.tracing.TransactionState;
import org.tessera.internal.testframework.BaseTesseraAbstractTest;
import org.tessera.internal.tracing.NoopSpanManager;
import org.tessera.lang.TesseraException;

/**
 * Tests for {@link SessionRegistry}.
 */
public class SessionRegistryTest extends BaseTesseraAbstractTest {
    private static final ClusterWideId SESSION_ID = new ClusterWideId(1, 1);

    private static final ClusterWideId QUERY_ID = new ClusterWideId(2, 1);

    private final SessionRegistry registry = new SessionRegistry();

    private final HybridClock clock = new HybridClockImpl();

    @Test
    public void registerAndDeregister() {
        RegisteredSession session = session("alice");

        registry.register(SESSION_ID, session);
        registry.register(SESSION_ID, session);

        assertEquals(1, registry.size());

        registry.deregister(SESSION_ID);
        registry.deregister(SESSION_ID);
        registry.deregister(new ClusterWideId(9, 9));

        assertEquals(0, registry.size());
    }

    @Test
    public void sessionIsRegisteredUnderOneIdOnly() {
        RegisteredSession session = session("alice");

        registry.register(SESSION_ID, session);

        assertThrowsWithCode(
                TesseraInternalException.class,
                INTERNAL_ERR,
                () -> registry.register(SESSION_ID, session("bob")),
                "Session ID is already in use"
        );

        assertThrowsWithCode(
                TesseraInternalException.class,
                INTERNAL_ERR,
                () -> registry.register(new ClusterWideId(5, 5), session),
                "already registered under another ID"
        );

        assertEquals(1, registry.size());
    }

    @Test
    public void cancelQueryWithMalformedId() {
        registry.register(SESSION_ID, session("alice"));

        assertThrowsWithCode(
                TesseraException.class,
                MALFORMED_ID_ERR,
                () -> registry.cancelQuery("not-an-id", "alice"),
                "query ID not-an-id malformed"
        );
    }

    @Test
    public void cancelQueryByOwner() {
        RegisteredSession session = session("alice");

        when(session.cancelQuery(QUERY_ID)).thenReturn(true);

        registry.register(SESSION_ID, session);

        assertTrue(registry.cancelQuery(QUERY_ID.toString(), "alice"));

        verify(session).cancelQuery(QUERY_ID);
    }

    @Test
    public void cancelQueryBySuperuser() {
        RegisteredSession session = session("alice");

        when(session.cancelQuery(QUERY_ID)).thenReturn(true);

        registry.register(SESSION_ID, session);

        assertTrue(registry.cancelQuery(QUERY_ID.toString(), SessionRegistry.SUPERUSER));
    }

    @Test
    public void cancelQueryLooksThroughAllSessions() {
        RegisteredSession other = session("alice");
        RegisteredSession owner = session("alice");

        when(owner.cancelQuery(QUERY_ID)).thenReturn(true);

        registry.register(new ClusterWideId(1, 2), other);
        registry.register(SESSION_ID, owner);

        assertTrue(registry.cancelQuery(QUERY_ID.toString(), "alice"));

        verify(owner).cancelQuery(QUERY_ID);
    }

    @Test
    public void unknownQuery() {
        registry.register(SESSION_ID, session("alice"));

        assertThrowsWithCode(
                TesseraException.class,
                QUERY_NOT_FOUND_ERR,
                () -> registry.cancelQuery(QUERY_ID.toString(), "alice"),
                "query ID " + QUERY_ID + " not found"
        );
    }

    @Test
    public void foreignQueryLooksLikeUnknownQuery() {
        RegisteredSession session = session("bob");

        when(session.cancelQuery(QUERY_ID)).thenReturn(true);

        registry.register(SESSION_ID, session);

        TesseraException foreign = assertThrowsWithCode(
                TesseraException.class,
                QUERY_NOT_FOUND_ERR,
                () -> registry.cancelQuery(QUERY_ID.toString(), "alice"),
                null
        );

        registry.deregister(SESSION_ID);

        TesseraException missing = assertThrowsWithCode(
                TesseraException.class,
                QUERY_NOT_FOUND_ERR,
                () -> registry.cancelQuery(QUERY_ID.toString(), "alice"),
                null
        );

        assertEquals(missing.getMessage(), foreign.getMessage());

        verify(session, never()).cancelQuery(any());
    }

    @Test
    public void cancelSession() {
        RegisteredSession session = session("alice");

        registry.register(SESSION_ID, session);

        assertTrue(registry.cancelSession(SESSION_ID.toBytes(), "alice"));

        verify(session).cancelSession();
    }

    @Test
    public void foreignSessionLooksLikeUnknownSession() {
        RegisteredSession session = session("bob");

        registry.register(SESSION_ID, session);

        TesseraException foreign = assertThrowsWithCode(
                TesseraException.class,
                SESSION_NOT_FOUND_ERR,
                () -> registry.cancelSession(SESSION_ID.toBytes(), "alice"),
                "session ID " + SESSION_ID + " not found"
        );

        registry.deregister(SESSION_ID);

        TesseraException missing = assertThrowsWithCode(
                TesseraException.class,
                SESSION_NOT_FOUND_ERR,
                () -> registry.cancelSession(SESSION_ID.toBytes(), "alice"),
                null
        );

        assertEquals(missing.getMessage(), foreign.getMessage());

        verify(session, never()).cancelSession();
    }

    @Test
    public void cancelSessionWithMalformedId() {
        assertThrowsWithCode(
                TesseraException.class,
                MALFORMED_ID_ERR,
                () -> registry.cancelSession(new byte[3], SessionRegistry.SUPERUSER),
                null
        );
    }

    @Test
    public void serializeAll() {
        assertThat(registry.serializeAll(), empty());

        SqlSessionImpl alice = newSession("alice");
        SqlSessionImpl bob = newSession("bob");

        registry.register(alice.id(), alice);
        registry.register(bob.id(), bob);

        List<String> users = registry.serializeAll().stream().map(SessionInfo::username).collect(Collectors.toList());

        assertThat(users, containsInAnyOrder("alice", "bob"));
    }

    @Test
    public void superuserCancelsQueryOfAnotherUser() {
        SqlSessionImpl alice = newSession("alice");
        SqlSessionImpl bob = newSession("bob");

        registry.register(alice.id(), alice);
        registry.register(bob.id(), bob);

        QueryMetadata query = bob.beginQuery(new TestStatement("SELECT * FROM t WHERE name = 'secret'"));

        assertThrowsWithCode(
                TesseraException.class,
                QUERY_NOT_FOUND_ERR,
                () -> registry.cancelQuery(query.id().toString(), "alice"),
                "not found"
        );

        assertFalse(query.cancelHandle().isCancelled());

        assertTrue(registry.cancelQuery(query.id().toString(), SessionRegistry.SUPERUSER));

        assertTrue(query.cancelHandle().isCancelled());
    }

    @Test
    public void finishedQueryCannotBeCancelled() {
        SqlSessionImpl bob = newSession("bob");

        registry.register(bob.id(), bob);

        QueryMetadata query = bob.beginQuery(new TestStatement("SELECT 1"));

        bob.finishQuery(query.id());

        assertThrowsWithCode(
                TesseraException.class,
                QUERY_NOT_FOUND_ERR,
                () -> registry.cancelQuery(query.id().toString(), "bob"),
                null
        );
    }

    @Test
    public void concurrentRegistration() {
        int sessions = 100;

        runRace(
                () -> {
                    for (int i = 0; i < sessions; i++) {
                        registry.register(new ClusterWideId(1, i), newSession("alice"));
                    }
                },
                () -> {
                    for (int i = 0; i < sessions; i++) {
                        registry.register(new ClusterWideId(2, i), newSession("bob"));
                        registry.deregister(new ClusterWideId(2, i));
                    }
                },
                () -> {
                    for (int i = 0; i < sessions; i++) {
                        registry.serializeAll();
                    }
                }
        );

        assertEquals(sessions, registry.size());
    }

    private SqlSessionImpl newSession(String user) {
        return new SqlSessionImpl(
                1,
                user,
                "test",
                "127.0.0.1:10800",
                clock,
                NoopSpanManager.INSTANCE,
                TransactionState.NONE,
                SqlSessionConfiguration.defaults()
        );
    }

    private static RegisteredSession session(String user) {
        RegisteredSession session = mock(RegisteredSession.class);

        when(session.user()).thenReturn(user);
        when(session.serialize()).thenReturn(
                new SessionInfo(1, SESSION_ID, user, "127.0.0.1", "test", Instant.EPOCH, List.of(), null));

        return session;
    }
}
