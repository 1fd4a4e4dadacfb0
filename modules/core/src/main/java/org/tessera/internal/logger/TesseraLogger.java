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

package org.tessera.internal.logger;

import org.jetbrains.annotations.Nullable;

/**
 * Logger facade of the node components. Message patterns use {@code {}} anchors that are replaced with the parameters in order,
 * so a message costs nothing when its level is off.
 *
 * <p>Instances are obtained from {@link Loggers}.
 */
public interface TesseraLogger {
    /**
     * Logs an informational message, for example a cancellation requested by a user.
     *
     * @param msg Message pattern.
     * @param params Values for the anchors.
     */
    void info(String msg, Object... params);

    /**
     * Logs a debug message.
     *
     * @param msg Message pattern.
     * @param params Values for the anchors.
     */
    void debug(String msg, Object... params);

    /**
     * Logs a debug message with an associated error.
     *
     * @param msg Message pattern.
     * @param th Error, {@code null} if none.
     * @param params Values for the anchors.
     */
    void debug(String msg, @Nullable Throwable th, Object... params);

    /**
     * Logs a warning.
     *
     * @param msg Message pattern.
     * @param params Values for the anchors.
     */
    void warn(String msg, Object... params);

    /**
     * Logs a warning with an associated error.
     *
     * @param msg Message pattern.
     * @param th Error, {@code null} if none.
     * @param params Values for the anchors.
     */
    void warn(String msg, @Nullable Throwable th, Object... params);

    /** Returns {@code true} if debug messages are written. */
    boolean isDebugEnabled();
}
