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

package org.tessera.internal.tracing;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Timestamped log entry of a recorded span, made of ordered key/value fields.
 */
public final class LogRecord {
    private final Instant time;

    private final List<LogField> fields;

    public LogRecord(Instant time, List<LogField> fields) {
        this.time = Objects.requireNonNull(time, "time");
        this.fields = List.copyOf(fields);
    }

    public Instant time() {
        return time;
    }

    public List<LogField> fields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        LogRecord that = (LogRecord) o;

        return time.equals(that.time) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, fields);
    }

    @Override
    public String toString() {
        return "LogRecord [time=" + time + ", fields=" + fields + ']';
    }
}
