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

import static org.tessera.lang.util.TraceIdUtils.getOrCreateTraceId;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.tessera.lang.ErrorGroup;
import org.tessera.lang.ErrorGroups;
import org.tessera.lang.TraceableException;

/**
 * Signals a broken invariant inside the engine, such as a malformed span forest, rather than a user error. Carries an error code
 * and a trace id like {@link org.tessera.lang.TesseraException}.
 */
public class TesseraInternalException extends RuntimeException implements TraceableException {
    private static final long serialVersionUID = -2167424561183315367L;

    private final int code;

    private final UUID traceId;

    /**
     * Constructor.
     *
     * @param code Full error code.
     * @param message Message.
     */
    public TesseraInternalException(int code, String message) {
        this(UUID.randomUUID(), code, message, null);
    }

    /**
     * Creates an exception with the message of its cause.
     *
     * @param code Full error code.
     * @param cause Cause.
     */
    public TesseraInternalException(int code, @Nullable Throwable cause) {
        this(getOrCreateTraceId(cause), code, cause == null ? null : cause.getLocalizedMessage(), cause);
    }

    /**
     * Constructor. The trace id is taken from the cause chain if it has one.
     *
     * @param code Full error code.
     * @param message Message.
     * @param cause Cause.
     */
    public TesseraInternalException(int code, String message, @Nullable Throwable cause) {
        this(getOrCreateTraceId(cause), code, message, cause);
    }

    /**
     * Constructor.
     *
     * @param traceId Trace id.
     * @param code Full error code.
     * @param message Message.
     * @param cause Cause.
     */
    public TesseraInternalException(UUID traceId, int code, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);

        ErrorGroups.errorGroupByCode(code);

        this.traceId = traceId;
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public UUID traceId() {
        return traceId;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + ErrorGroup.errorMessage(traceId, code, getLocalizedMessage());
    }
}
