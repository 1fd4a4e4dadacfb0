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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.tessera.internal.sql.engine.tracing.TraceMessageParser.ParsedMessage;
import org.tessera.internal.testframework.BaseTesseraAbstractTest;

/**
 * Tests for {@link TraceMessageParser}.
 */
public class TraceMessageParserTest extends BaseTesseraAbstractTest {
    private static Stream<Arguments> messages() {
        return Stream.of(
                Arguments.of("plain text", "", "", "plain text"),
                Arguments.of("", "", "", ""),
                Arguments.of("sql/exec/Planner.java:12 planning", "sql/exec/Planner.java:12", "", "planning"),
                Arguments.of("[n1] started", "", "[n1]", "started"),
                Arguments.of("[n1,txn=[abc]] nested tag", "", "[n1,txn=[abc]]", "nested tag"),
                Arguments.of("kv/Store.java:7 [n2]   spaced   out", "kv/Store.java:7", "[n2]", "spaced   out"),
                Arguments.of("kv/Store.java:7 [n2]", "kv/Store.java:7", "[n2]", ""),
                Arguments.of("Store.java:7 no directory", "", "", "Store.java:7 no directory"),
                Arguments.of("[unclosed tag", "", "", "[unclosed tag"),
                Arguments.of("first line\nsecond line", "", "", "first line\nsecond line")
        );
    }

    @ParameterizedTest
    @MethodSource("messages")
    public void parse(String msg, String location, String tag, String text) {
        ParsedMessage parsed = TraceMessageParser.parse(msg);

        assertEquals(location, parsed.location);
        assertEquals(tag, parsed.tag);
        assertEquals(text, parsed.text);
    }
}
