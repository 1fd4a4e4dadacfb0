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

import static java.util.stream.Collectors.joining;
import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Common.INTERNAL_ERR;

import java.util.List;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;

/**
 * Helpers for reporting statements in errors that may leave the node, without leaking user data.
 */
public final class StatementReporting {
    private static final TesseraLogger LOG = Loggers.forClass(StatementReporting.class);

    /** Longest anonymized text included into a report. */
    static final int MAX_REPORTED_LENGTH = 500;

    static final String CUT_MARKER = " [...]";

    private StatementReporting() {
        // No-op.
    }

    /**
     * Wraps an unexpected error raised while processing a SQL script into an internal exception whose message carries the anonymized
     * statements of the script.
     *
     * @param parser Parser for the script.
     * @param action What was being done with the statements, like {@code "executing"}.
     * @param sql Script text.
     * @param cause Unexpected error.
     * @return Exception to report.
     */
    public static TesseraInternalException anonymizeStatementsForReporting(SqlParser parser, String action, String sql, Throwable cause) {
        List<SqlStatement> statements;

        try {
            statements = parser.parse(sql);
        } catch (RuntimeException e) {
            LOG.debug("Statements could not be parsed for reporting [action={}]", e, action);

            statements = List.of();
        }

        String anonymized = statements.stream()
                .map(SqlStatement::toAnonymizedString)
                .collect(joining("; "));

        if (anonymized.length() > MAX_REPORTED_LENGTH) {
            anonymized = anonymized.substring(0, MAX_REPORTED_LENGTH) + CUT_MARKER;
        }

        return new TesseraInternalException(
                INTERNAL_ERR,
                format("Unexpected error while {} {} statements: {}", action, statements.size(), anonymized),
                cause
        );
    }
}
