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

package org.tessera.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.tessera.lang.ErrorGroup.errorMessage;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.tessera.lang.ErrorGroups.Session;
import org.tessera.lang.ErrorGroups.Sql;
import org.tessera.lang.ErrorGroups.Table;

/**
 * Tests Tessera exceptions.
 */
public class TesseraExceptionTest {
    @Test
    public void testCodeAndMessage() {
        var traceId = UUID.randomUUID();
        var ex = new TesseraException(traceId, Session.SESSION_NOT_FOUND_ERR, "session ID 01 not found", null);

        assertEquals("TSR-SESSION-3", ex.codeAsString());
        assertEquals(Session.SESSION_ERR_GROUP.groupCode(), ex.groupCode());
        assertEquals(3, ex.errorCode());
        assertEquals("session ID 01 not found", ex.getMessage());
        assertEquals(
                TesseraException.class.getName() + ": " + errorMessage(traceId, Session.SESSION_NOT_FOUND_ERR, "session ID 01 not found"),
                ex.toString()
        );
    }

    @Test
    public void testTraceIdIsInheritedFromCause() {
        var cause = new TesseraException(Table.TABLE_NOT_FOUND_ERR, "Table not found");
        var wrapped = new TesseraException(Sql.RUNTIME_ERR, "Unexpected error", new IllegalStateException(cause));

        assertEquals(cause.traceId(), wrapped.traceId());
        assertSame(cause, wrapped.getCause().getCause());
    }

    @Test
    public void testCauseMessageIsUsedWhenNoMessageGiven() {
        var cause = new IllegalArgumentException("bad");
        var ex = new TesseraException(Sql.STMT_PARSE_ERR, cause);

        assertEquals("bad", ex.getMessage());
        assertNotEquals(null, ex.traceId());
    }
}
