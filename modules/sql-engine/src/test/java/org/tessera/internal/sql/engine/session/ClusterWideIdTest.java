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
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.tessera.internal.testframework.TesseraTestUtils.assertThrowsWithCode;
import static org.tessera.lang.ErrorGroups.Session.MALFORMED_ID_ERR;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tessera.internal.hlc.HybridClock;
import org.tessera.internal.hlc.HybridClockImpl;
import org.tessera.internal.hlc.HybridTimestamp;
import org.tessera.internal.testframework.BaseTesseraAbstractTest;
import org.tessera.lang.TesseraException;

/**
 * Tests for {@link ClusterWideId}.
 */
public class ClusterWideIdTest extends BaseTesseraAbstractTest {
    @Test
    public void generate() {
        ClusterWideId id = ClusterWideId.generate(new HybridTimestamp(1_700_000_000_000L, 5), 7);

        assertEquals(1_700_000_000_000L, id.hi());
        assertEquals((5L << 32) | 7, id.lo());
        assertEquals(7, id.nodeId());

        assertEquals(-1, ClusterWideId.generate(new HybridTimestamp(1, 0), -1).nodeId());
    }

    @Test
    public void generatedIdsAreUnique() {
        HybridClock clock = new HybridClockImpl() {
            @Override
            protected long physicalTime() {
                return 1_000;
            }
        };

        Set<ClusterWideId> ids = new HashSet<>();

        for (int i = 0; i < 1_000; i++) {
            ids.add(ClusterWideId.generate(clock.now(), 1));
        }

        assertEquals(1_000, ids.size());
        HybridTimestamp ts = new HybridTimestamp(1_000, 1);

        assertNotEquals(ClusterWideId.generate(ts, 1), ClusterWideId.generate(ts, 2));
    }

    @Test
    public void textForm() {
        ClusterWideId id = new ClusterWideId(0x1L, 0xabL);

        assertEquals("000000000000000100000000000000ab", id.toString());
        assertEquals(id, ClusterWideId.fromString(id.toString()));
        assertEquals(new ClusterWideId(-1L, -1L), ClusterWideId.fromString("ffffffffffffffffffffffffffffffff"));
    }

    @Test
    public void shortTextIsLeftPadded() {
        assertEquals(new ClusterWideId(0, 0xab), ClusterWideId.fromString("ab"));
        assertEquals(new ClusterWideId(0, 0xab), ClusterWideId.fromString("AB"));
        assertEquals(new ClusterWideId(0x1, 0), ClusterWideId.fromString("10000000000000000"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"xyz", "-1", "+1", " 1", "1 ", "0x1", "123456789012345678901234567890123",
            "\uFF11\u0663", "\u0661\u0662", "ab\uFF21", "\u0967"})
    public void malformedText(String text) {
        assertThrowsWithCode(
                TesseraException.class,
                MALFORMED_ID_ERR,
                () -> ClusterWideId.fromString(text),
                "Malformed cluster-wide ID"
        );
    }

    @Test
    public void byteForm() {
        ClusterWideId id = new ClusterWideId(0x0102030405060708L, 0x090a0b0c0d0e0f10L);

        byte[] bytes = id.toBytes();

        assertArrayEquals(new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16}, bytes);
        assertEquals(id, ClusterWideId.fromBytes(bytes));
        assertEquals(ClusterWideId.fromString(id.toString()), ClusterWideId.fromBytes(bytes));
    }

    @Test
    public void malformedBytes() {
        assertThrowsWithCode(TesseraException.class, MALFORMED_ID_ERR, () -> ClusterWideId.fromBytes(new byte[15]), "[length=15]");
        assertThrowsWithCode(TesseraException.class, MALFORMED_ID_ERR, () -> ClusterWideId.fromBytes(new byte[17]), "[length=17]");
        assertThrowsWithCode(TesseraException.class, MALFORMED_ID_ERR, () -> ClusterWideId.fromBytes(null), "[length=null]");
    }

    @Test
    public void orderIsUnsigned() {
        assertThat(new ClusterWideId(-1, 0).compareTo(new ClusterWideId(1, 0)), greaterThan(0));
        assertThat(new ClusterWideId(1, 1).compareTo(new ClusterWideId(1, -1)), lessThan(0));
        assertEquals(0, new ClusterWideId(3, 4).compareTo(new ClusterWideId(3, 4)));
    }
}
