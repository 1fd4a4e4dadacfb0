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

package org.tessera.internal.lang;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages with {@code {}} anchors, substituting the given arguments in order. Anchors without a matching argument are kept
 * as is, extra arguments are ignored. Arrays are rendered with {@link Arrays#deepToString}.
 */
public final class TesseraStringFormatter {
    private static final String ANCHOR = "{}";

    private TesseraStringFormatter() {
    }

    /**
     * Formats the given message pattern.
     *
     * @param messagePattern Message pattern with {@code {}} anchors.
     * @param params Arguments to substitute.
     * @return Formatted message.
     */
    public static String format(@Nullable String messagePattern, @Nullable Object... params) {
        if (messagePattern == null || params == null || params.length == 0) {
            return messagePattern;
        }

        var sb = new StringBuilder(messagePattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchorIdx = messagePattern.indexOf(ANCHOR, from);

            if (anchorIdx < 0) {
                break;
            }

            sb.append(messagePattern, from, anchorIdx);
            appendParam(sb, params[paramIdx++]);

            from = anchorIdx + ANCHOR.length();
        }

        sb.append(messagePattern, from, messagePattern.length());

        return sb.toString();
    }

    private static void appendParam(StringBuilder sb, @Nullable Object param) {
        if (param == null) {
            sb.append("null");
        } else if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else {
            sb.append(param);
        }
    }
}
