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

import java.util.List;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * Hooks into the schema change execution for tests.
 */
public final class SchemaChangeTestingKnobs {
    /** No hooks. */
    public static final SchemaChangeTestingKnobs NONE = new SchemaChangeTestingKnobs(null);

    private final @Nullable Consumer<List<SchemaChangeJob>> syncFilter;

    private SchemaChangeTestingKnobs(@Nullable Consumer<List<SchemaChangeJob>> syncFilter) {
        this.syncFilter = syncFilter;
    }

    /**
     * Creates knobs with a filter called with the queued jobs before any of them runs. Not called for an empty queue.
     *
     * @param syncFilter Filter.
     * @return Knobs.
     */
    public static SchemaChangeTestingKnobs withSyncFilter(Consumer<List<SchemaChangeJob>> syncFilter) {
        return new SchemaChangeTestingKnobs(syncFilter);
    }

    public @Nullable Consumer<List<SchemaChangeJob>> syncFilter() {
        return syncFilter;
    }
}
