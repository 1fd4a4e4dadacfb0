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

import java.util.List;
import org.tessera.lang.TesseraException;

/**
 * SQL parser.
 */
@FunctionalInterface
public interface SqlParser {
    /**
     * Parses a script into statements.
     *
     * @param sql SQL text, possibly containing several statements.
     * @return Statements in script order.
     * @throws TesseraException With {@code STMT_PARSE_ERR} if the text is not valid SQL.
     */
    List<SqlStatement> parse(String sql);
}
