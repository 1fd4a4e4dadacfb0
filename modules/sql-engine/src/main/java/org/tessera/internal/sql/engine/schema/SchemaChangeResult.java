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

import static org.tessera.lang.ErrorGroups.Sql.CONSTRAINT_VIOLATION_ERR;
import static org.tessera.lang.ErrorGroups.Sql.STMT_VALIDATION_ERR;
import static org.tessera.lang.ErrorGroups.Table.COLUMN_ALREADY_EXISTS_ERR;
import static org.tessera.lang.ErrorGroups.Table.COLUMN_NOT_FOUND_ERR;
import static org.tessera.lang.ErrorGroups.Table.TABLE_ALREADY_EXISTS_ERR;
import static org.tessera.lang.ErrorGroups.Table.TABLE_NOT_FOUND_ERR;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.jetbrains.annotations.Nullable;
import org.tessera.lang.TraceableException;

/**
 * Outcome of an attempt to execute a {@link SchemaChangeJob}.
 */
public final class SchemaChangeResult {
    /** Outcome kind. */
    public enum Kind {
        /** The job is done. */
        SUCCESS,

        /** The object the job works on is gone, concurrently dropped. Nothing left to do. */
        TARGET_MISSING,

        /** The job cannot succeed. Not retried. */
        PERMANENT,

        /** The attempt failed for a transient reason. Retried. */
        RETRYABLE
    }

    private static final SchemaChangeResult SUCCESS = new SchemaChangeResult(Kind.SUCCESS, null);

    private static final Set<Integer> PERMANENT_CODES = Set.of(
            CONSTRAINT_VIOLATION_ERR,
            STMT_VALIDATION_ERR,
            TABLE_ALREADY_EXISTS_ERR,
            COLUMN_ALREADY_EXISTS_ERR,
            COLUMN_NOT_FOUND_ERR
    );

    private final Kind kind;

    private final @Nullable Throwable error;

    private SchemaChangeResult(Kind kind, @Nullable Throwable error) {
        this.kind = kind;
        this.error = error;
    }

    public static SchemaChangeResult success() {
        return SUCCESS;
    }

    public static SchemaChangeResult targetMissing(@Nullable Throwable error) {
        return new SchemaChangeResult(Kind.TARGET_MISSING, error);
    }

    public static SchemaChangeResult permanent(Throwable error) {
        return new SchemaChangeResult(Kind.PERMANENT, Objects.requireNonNull(error, "error"));
    }

    public static SchemaChangeResult retryable(Throwable error) {
        return new SchemaChangeResult(Kind.RETRYABLE, Objects.requireNonNull(error, "error"));
    }

    /**
     * Classifies an error by its code: a missing table means the target is gone, errors that repeat on every attempt are permanent,
     * everything else, including errors without a code, is retryable.
     *
     * @param error Error thrown by an attempt.
     * @return Result of the attempt.
     */
    public static SchemaChangeResult classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof TraceableException) {
            int code = ((TraceableException) cause).code();

            if (code == TABLE_NOT_FOUND_ERR) {
                return targetMissing(error);
            }

            if (PERMANENT_CODES.contains(code)) {
                return permanent(error);
            }
        }

        return retryable(error);
    }

    public Kind kind() {
        return kind;
    }

    /** Returns the error of the attempt, {@code null} on success. */
    public @Nullable Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return "SchemaChangeResult [kind=" + kind + ", error=" + error + ']';
    }

    private static Throwable unwrap(Throwable e) {
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }

        return e;
    }
}
