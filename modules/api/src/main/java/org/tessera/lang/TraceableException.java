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

import java.util.UUID;

/**
 * Exception carrying a full error code (see {@link ErrorGroup}) and a trace id that ties together the log records of one failure.
 */
public interface TraceableException {
    /** Returns the trace id. Wrapping exceptions inherit it from their cause. */
    UUID traceId();

    /** Returns the full error code. */
    int code();

    /** Returns the group code part of {@link #code()}. */
    default short groupCode() {
        return ErrorGroup.extractGroupCode(code());
    }

    /** Returns the code within the group. */
    default short errorCode() {
        return ErrorGroup.extractErrorCode(code());
    }

    /** Returns the rendered code, for example {@code TSR-SQL-4}. */
    default String codeAsString() {
        return ErrorGroup.codeAsString(code());
    }
}
