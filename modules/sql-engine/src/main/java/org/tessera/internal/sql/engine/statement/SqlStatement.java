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

package org.tessera.internal.sql.engine.statement;

/**
 * Parsed SQL statement as seen by the session layer.
 */
public interface SqlStatement {
    /**
     * Returns the statement text.
     *
     * @return SQL text.
     */
    String toSqlString();

    /**
     * Returns the statement text with literals and identifiers that may carry user data replaced by placeholders.
     *
     * @return Anonymized SQL text.
     */
    String toAnonymizedString();

    /**
     * Returns {@code true} for statements that are never listed among the active queries of a session, like the statement listing
     * them.
     */
    default boolean hiddenFromShowQueries() {
        return false;
    }
}
