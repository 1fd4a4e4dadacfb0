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

package org.tessera.internal.sql.engine.schema;

import java.util.Objects;
import org.tessera.internal.hlc.HybridTimestamp;

/**
 * Context of one attempt to execute a {@link SchemaChangeJob}.
 */
public final class SchemaChangeContext {
    private final HybridTimestamp timestamp;

    private final int attempt;

    /**
     * Constructor.
     *
     * @param timestamp Timestamp the attempt reads the schema at.
     * @param attempt Attempt number, starting from 1.
     */
    public SchemaChangeContext(HybridTimestamp timestamp, int attempt) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.attempt = attempt;
    }

    public HybridTimestamp timestamp() {
        return timestamp;
    }

    public int attempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "SchemaChangeContext [timestamp=" + timestamp + ", attempt=" + attempt + ']';
    }
}
