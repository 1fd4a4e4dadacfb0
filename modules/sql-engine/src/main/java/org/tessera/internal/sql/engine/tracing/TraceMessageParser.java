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

import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Tracing.MALFORMED_TRACE_MESSAGE_ERR;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.tessera.internal.lang.TesseraInternalException;

/**
 * Splits a raw trace message into an optional source location ({@code dir/file.ext:line}), an optional bracketed tag (one level of
 * nested brackets allowed) and the free text.
 */
final class TraceMessageParser {
    private static final Pattern MESSAGE_PATTERN = Pattern.compile(
            "^((?:[^\\]\\[ :]+/[^\\]\\[ :]+\\.[^\\]\\[ :]+:[0-9]+)?) *((?:\\[(?:[^\\]\\[]|\\[[^\\]]*\\])*\\])?) *(.*)",
            Pattern.DOTALL
    );

    private TraceMessageParser() {
        // No-op.
    }

    static ParsedMessage parse(String msg) {
        Matcher matcher = MESSAGE_PATTERN.matcher(msg);

        if (!matcher.matches()) {
            throw new TesseraInternalException(
                    MALFORMED_TRACE_MESSAGE_ERR,
                    format("Trace message does not match the expected format [msg={}]", msg)
            );
        }

        return new ParsedMessage(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    static final class ParsedMessage {
        final String location;

        final String tag;

        final String text;

        ParsedMessage(String location, String tag, String text) {
            this.location = location;
            this.tag = tag;
            this.text = text;
        }
    }
}
