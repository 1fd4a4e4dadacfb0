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

import java.util.BitSet;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * Error codes of one component. A full error code packs the group code into the upper 16 bits and the code within the group into
 * the lower 16 bits; it is rendered as {@code TSR-<GROUP>-<code>}.
 *
 * <p>Groups are created by {@link ErrorGroups#registerGroup(String, short)}.
 */
public class ErrorGroup {
    /** Prefix of every rendered error code. */
    public static final String ERR_PREFIX = "TSR-";

    private final String name;

    private final short groupCode;

    /** Registered codes within the group, as unsigned values. */
    private final BitSet codes = new BitSet();

    ErrorGroup(String name, short groupCode) {
        this.name = name;
        this.groupCode = groupCode;
    }

    public String name() {
        return name;
    }

    public short groupCode() {
        return groupCode;
    }

    /**
     * Registers a code within the group.
     *
     * @param errorCode Code within the group.
     * @return Full error code.
     * @throws IllegalArgumentException If the code is already registered.
     */
    public synchronized int registerErrorCode(short errorCode) {
        int unsigned = Short.toUnsignedInt(errorCode);

        if (codes.get(unsigned)) {
            throw new IllegalArgumentException("Error code already registered [errorCode=" + errorCode + ", group=" + name + ']');
        }

        codes.set(unsigned);

        return (groupCode << 16) | unsigned;
    }

    /** Returns the group code of a full error code. */
    public static short extractGroupCode(int code) {
        return (short) (code >>> 16);
    }

    /** Returns the code within the group of a full error code. */
    public static short extractErrorCode(int code) {
        return (short) code;
    }

    /**
     * Renders a full error code, for example {@code TSR-SESSION-2}.
     *
     * @param code Full error code of a registered group.
     * @return Rendered code.
     */
    public static String codeAsString(int code) {
        return ERR_PREFIX + ErrorGroups.errorGroupByCode(code).name() + '-' + Short.toUnsignedInt(extractErrorCode(code));
    }

    /**
     * Builds the text of an error as shown to users and in logs: the rendered code, the message if any, and the first eight
     * characters of the trace id.
     *
     * @param traceId Trace id of the error.
     * @param code Full error code.
     * @param message Message, may be {@code null}.
     * @return Error text.
     */
    public static String errorMessage(UUID traceId, int code, @Nullable String message) {
        var sb = new StringBuilder(codeAsString(code));

        if (message != null && !message.isEmpty()) {
            sb.append(' ').append(message);
        }

        return sb.append(" TraceId:").append(traceId.toString(), 0, 8).toString();
    }

    @Override
    public String toString() {
        return "ErrorGroup [name=" + name + ", groupCode=" + groupCode + ']';
    }
}
