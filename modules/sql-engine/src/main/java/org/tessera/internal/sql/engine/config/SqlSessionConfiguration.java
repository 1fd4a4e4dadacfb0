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

package org.tessera.internal.sql.engine.config;

import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Common.ILLEGAL_ARGUMENT_ERR;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.tessera.lang.TesseraException;

/**
 * Configuration of the SQL session layer, read from HOCON under the {@value #ROOT} root. Values missing from the given config are
 * taken from the bundled {@value #DEFAULTS_RESOURCE}.
 */
public class SqlSessionConfiguration {
    /** Root of the configuration tree. */
    public static final String ROOT = "tessera.sql";

    /** Class path resource with the defaults. */
    public static final String DEFAULTS_RESOURCE = "sql-session.conf";

    static final String TXN_TRACE_THRESHOLD = "trace.txn.enableThreshold";

    static final String SESSION_EVENT_LOG_ENABLED = "trace.sessionEventLog.enabled";

    static final String RETRY_INITIAL_BACKOFF = "schemaChange.retry.initialBackoff";

    static final String RETRY_MAX_BACKOFF = "schemaChange.retry.maxBackoff";

    static final String RETRY_MULTIPLIER = "schemaChange.retry.multiplier";

    static final String RETRY_JITTER = "schemaChange.retry.jitter";

    private final Duration txnTraceThreshold;

    private final boolean sessionEventLogEnabled;

    private final Duration schemaChangeInitialBackoff;

    private final Duration schemaChangeMaxBackoff;

    private final double schemaChangeBackoffMultiplier;

    private final boolean schemaChangeBackoffJitter;

    private SqlSessionConfiguration(Config cfg) {
        txnTraceThreshold = cfg.getDuration(TXN_TRACE_THRESHOLD);
        sessionEventLogEnabled = cfg.getBoolean(SESSION_EVENT_LOG_ENABLED);
        schemaChangeInitialBackoff = cfg.getDuration(RETRY_INITIAL_BACKOFF);
        schemaChangeMaxBackoff = cfg.getDuration(RETRY_MAX_BACKOFF);
        schemaChangeBackoffMultiplier = cfg.getDouble(RETRY_MULTIPLIER);
        schemaChangeBackoffJitter = cfg.getBoolean(RETRY_JITTER);

        validate();
    }

    /**
     * Returns the default configuration.
     *
     * @return Configuration.
     */
    public static SqlSessionConfiguration defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Parses a HOCON string, for example {@code tessera.sql.trace.txn.enableThreshold = 5s}.
     *
     * @param hocon HOCON text.
     * @return Configuration.
     * @throws TesseraException With {@code ILLEGAL_ARGUMENT_ERR} if the text cannot be parsed or holds invalid values.
     */
    public static SqlSessionConfiguration parse(String hocon) {
        try {
            return fromConfig(ConfigFactory.parseString(hocon));
        } catch (ConfigException e) {
            throw new TesseraException(ILLEGAL_ARGUMENT_ERR, "Failed to parse SQL session configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the configuration from a config tree.
     *
     * @param config Config with the {@value #ROOT} subtree, possibly partial.
     * @return Configuration.
     * @throws TesseraException With {@code ILLEGAL_ARGUMENT_ERR} if some value is invalid.
     */
    public static SqlSessionConfiguration fromConfig(Config config) {
        Config defaults = ConfigFactory.parseResources(SqlSessionConfiguration.class.getClassLoader(), DEFAULTS_RESOURCE);

        try {
            return new SqlSessionConfiguration(config.withFallback(defaults).resolve().getConfig(ROOT));
        } catch (ConfigException e) {
            throw new TesseraException(ILLEGAL_ARGUMENT_ERR, "Invalid SQL session configuration: " + e.getMessage(), e);
        }
    }

    /** Returns the duration starting from which transaction traces are logged, zero if disabled. */
    public Duration txnTraceThreshold() {
        return txnTraceThreshold;
    }

    public boolean sessionEventLogEnabled() {
        return sessionEventLogEnabled;
    }

    public Duration schemaChangeInitialBackoff() {
        return schemaChangeInitialBackoff;
    }

    public Duration schemaChangeMaxBackoff() {
        return schemaChangeMaxBackoff;
    }

    public double schemaChangeBackoffMultiplier() {
        return schemaChangeBackoffMultiplier;
    }

    public boolean schemaChangeBackoffJitter() {
        return schemaChangeBackoffJitter;
    }

    private void validate() {
        if (txnTraceThreshold.isNegative()) {
            throw invalid(TXN_TRACE_THRESHOLD, txnTraceThreshold);
        }

        if (schemaChangeInitialBackoff.toMillis() <= 0 || schemaChangeInitialBackoff.toMillis() > Integer.MAX_VALUE) {
            throw invalid(RETRY_INITIAL_BACKOFF, schemaChangeInitialBackoff);
        }

        if (schemaChangeMaxBackoff.compareTo(schemaChangeInitialBackoff) < 0 || schemaChangeMaxBackoff.toMillis() > Integer.MAX_VALUE) {
            throw invalid(RETRY_MAX_BACKOFF, schemaChangeMaxBackoff);
        }

        if (!(schemaChangeBackoffMultiplier >= 1.0)) {
            throw invalid(RETRY_MULTIPLIER, schemaChangeBackoffMultiplier);
        }
    }

    private static TesseraException invalid(String key, Object value) {
        return new TesseraException(ILLEGAL_ARGUMENT_ERR, format("Invalid value of {}.{}: {}", ROOT, key, value));
    }

    @Override
    public String toString() {
        return "SqlSessionConfiguration [txnTraceThreshold=" + txnTraceThreshold + ", sessionEventLogEnabled=" + sessionEventLogEnabled
                + ", schemaChangeInitialBackoff=" + schemaChangeInitialBackoff + ", schemaChangeMaxBackoff=" + schemaChangeMaxBackoff
                + ", schemaChangeBackoffMultiplier=" + schemaChangeBackoffMultiplier
                + ", schemaChangeBackoffJitter=" + schemaChangeBackoffJitter + ']';
    }
}
