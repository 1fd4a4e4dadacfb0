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

package org.tessera.lang.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.tessera.lang.TraceableException;

/**
 * Trace id propagation between wrapped exceptions.
 */
public final class TraceIdUtils {
    private TraceIdUtils() {
    }

    /**
     * Returns the trace id of the nearest {@link TraceableException} in the cause chain, starting with the given throwable itself.
     * A fresh random id is returned when there is none.
     *
     * @param t Throwable, may be {@code null}.
     * @return Trace id.
     */
    public static UUID getOrCreateTraceId(@Nullable Throwable t) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Throwable e = t; e != null && seen.add(e); e = e.getCause()) {
            if (e instanceof TraceableException) {
                return ((TraceableException) e).traceId();
            }
        }

        return UUID.randomUUID();
    }
}
