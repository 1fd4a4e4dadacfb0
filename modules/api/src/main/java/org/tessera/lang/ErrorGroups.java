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

import it.unimi.dsi.fastutil.shorts.Short2ObjectMap;
import it.unimi.dsi.fastutil.shorts.Short2ObjectOpenHashMap;
import java.util.Locale;

/**
 * Registry of error groups and the codes of each group. Groups are declared as nested classes below and registered when a nested
 * class is first loaded, or all at once by {@link #initialize()}.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    /** Registered groups by group code. Guarded by the class monitor. */
    private static final Short2ObjectMap<ErrorGroup> GROUPS = new Short2ObjectOpenHashMap<>();

    /** Loads every nested group class. */
    public static synchronized void initialize() {
        for (Class<?> cls : ErrorGroups.class.getDeclaredClasses()) {
            try {
                Class.forName(cls.getName(), true, cls.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("Failed to load error group " + cls.getName(), e);
            }
        }
    }

    /**
     * Registers a group. The name is stored upper-cased.
     *
     * @param groupName Group name, unique ignoring case.
     * @param groupCode Group code, unique.
     * @return Group.
     * @throws IllegalArgumentException If the name is empty or the name or code is taken.
     */
    public static synchronized ErrorGroup registerGroup(String groupName, short groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        String name = groupName.toUpperCase(Locale.ENGLISH);

        ErrorGroup existing = GROUPS.get(groupCode);

        if (existing == null) {
            existing = GROUPS.values().stream().filter(g -> g.name().equals(name)).findFirst().orElse(null);
        }

        if (existing != null) {
            throw new IllegalArgumentException("Error group already registered [groupName=" + name + ", groupCode=" + groupCode
                    + ", registeredGroup=" + existing + ']');
        }

        ErrorGroup group = new ErrorGroup(name, groupCode);

        GROUPS.put(groupCode, group);

        return group;
    }

    /**
     * Returns the group of a full error code.
     *
     * @param code Full error code.
     * @return Group.
     * @throws IllegalArgumentException If no group has the code's group code.
     */
    public static synchronized ErrorGroup errorGroupByCode(int code) {
        ErrorGroup group = GROUPS.get(ErrorGroup.extractGroupCode(code));

        if (group == null) {
            throw new IllegalArgumentException("Unknown error group [code=" + code + ']');
        }

        return group;
    }

    /** Common error group. */
    public static class Common {
        /** Group. */
        public static final ErrorGroup COMMON_ERR_GROUP = registerGroup("CMN", (short) 1);

        /** An argument or a configuration value is invalid. */
        public static final int ILLEGAL_ARGUMENT_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 1);

        /** A broken invariant inside the node. Not recoverable by retrying. */
        public static final int INTERNAL_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 0xFFFF);
    }

    /** Schema objects error group. */
    public static class Table {
        /** Group. */
        public static final ErrorGroup TABLE_ERR_GROUP = registerGroup("TBL", (short) 2);

        /** Table already exists. */
        public static final int TABLE_ALREADY_EXISTS_ERR = TABLE_ERR_GROUP.registerErrorCode((short) 1);

        /** Table not found. */
        public static final int TABLE_NOT_FOUND_ERR = TABLE_ERR_GROUP.registerErrorCode((short) 2);

        /** Column already exists. */
        public static final int COLUMN_ALREADY_EXISTS_ERR = TABLE_ERR_GROUP.registerErrorCode((short) 3);

        /** Column not found. */
        public static final int COLUMN_NOT_FOUND_ERR = TABLE_ERR_GROUP.registerErrorCode((short) 4);
    }

    /** SQL error group. */
    public static class Sql {
        /** Group. */
        public static final ErrorGroup SQL_ERR_GROUP = registerGroup("SQL", (short) 3);

        /** SQL text could not be parsed. */
        public static final int STMT_PARSE_ERR = SQL_ERR_GROUP.registerErrorCode((short) 1);

        /** A parsed statement refers to objects or types that do not fit, for example an index on a missing column. */
        public static final int STMT_VALIDATION_ERR = SQL_ERR_GROUP.registerErrorCode((short) 2);

        /** Data violates a constraint, for example a unique index being built over duplicate values. */
        public static final int CONSTRAINT_VIOLATION_ERR = SQL_ERR_GROUP.registerErrorCode((short) 3);

        /** The statement or its session was cancelled. */
        public static final int EXECUTION_CANCELLED_ERR = SQL_ERR_GROUP.registerErrorCode((short) 4);

        /** Failure while executing a statement. Schema changes retry on it. */
        public static final int RUNTIME_ERR = SQL_ERR_GROUP.registerErrorCode((short) 5);
    }

    /** Session control error group. */
    public static class Session {
        /** Group. */
        public static final ErrorGroup SESSION_ERR_GROUP = registerGroup("SESSION", (short) 4);

        /** A query or session identifier could not be parsed. */
        public static final int MALFORMED_ID_ERR = SESSION_ERR_GROUP.registerErrorCode((short) 1);

        /** No running query with the given identifier. */
        public static final int QUERY_NOT_FOUND_ERR = SESSION_ERR_GROUP.registerErrorCode((short) 2);

        /** No registered session with the given identifier. */
        public static final int SESSION_NOT_FOUND_ERR = SESSION_ERR_GROUP.registerErrorCode((short) 3);
    }

    /** Tracing error group. */
    public static class Tracing {
        /** Group. */
        public static final ErrorGroup TRACING_ERR_GROUP = registerGroup("TRACING", (short) 5);

        /** The same span was reached twice while reducing a recording, or some spans were never reached. */
        public static final int DUPLICATE_SPAN_ERR = TRACING_ERR_GROUP.registerErrorCode((short) 1);

        /** An event message could not be split into location, tag and text. */
        public static final int MALFORMED_TRACE_MESSAGE_ERR = TRACING_ERR_GROUP.registerErrorCode((short) 2);

        /** Session tracing was requested while the current transaction has no span. */
        public static final int MISSING_TXN_SPAN_ERR = TRACING_ERR_GROUP.registerErrorCode((short) 3);
    }
}
