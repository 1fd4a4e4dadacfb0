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

import org.jetbrains.annotations.Nullable;
import org.tessera.internal.tracing.TraceSpan;

/**
 * Transaction state of a session, as far as tracing is concerned.
 */
public interface TransactionState {
    /** State of a session that never opens transactions. */
    TransactionState NONE = new TransactionState() {
        @Override
        public boolean inTransaction() {
            return false;
        }

        @Override
        public @Nullable TraceSpan transactionSpan() {
            return null;
        }
    };

    /**
     * Returns {@code true} if the session has an open transaction.
     */
    boolean inTransaction();

    /**
     * Returns the span of the open transaction.
     *
     * @return Transaction span, {@code null} if there is no transaction or it is not traced.
     */
    @Nullable TraceSpan transactionSpan();
}
