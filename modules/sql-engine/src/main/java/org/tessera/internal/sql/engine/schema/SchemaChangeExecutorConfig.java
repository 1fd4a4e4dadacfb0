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
import org.tessera.internal.hlc.HybridClock;
import org.tessera.internal.sql.engine.config.SqlSessionConfiguration;
import org.tessera.internal.util.KeyBasedExponentialBackoffTimeoutStrategy;
import org.tessera.internal.util.TimeoutStrategy;

/**
 * Everything the {@link SchemaChangeRunner} needs besides the jobs.
 */
public class SchemaChangeExecutorConfig {
    private final HybridClock clock;

    private final TimeoutStrategy retryStrategy;

    private final SchemaChangeTestingKnobs testingKnobs;

    /**
     * Constructor.
     *
     * @param clock Clock giving every attempt its timestamp.
     * @param retryStrategy Delays between attempts of a job.
     * @param testingKnobs Testing hooks.
     */
    public SchemaChangeExecutorConfig(HybridClock clock, TimeoutStrategy retryStrategy, SchemaChangeTestingKnobs testingKnobs) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy");
        this.testingKnobs = Objects.requireNonNull(testingKnobs, "testingKnobs");
    }

    /**
     * Creates a config with the retry back-off taken from the session configuration.
     *
     * @param clock Clock.
     * @param configuration Session configuration.
     * @return Config.
     */
    public static SchemaChangeExecutorConfig create(HybridClock clock, SqlSessionConfiguration configuration) {
        TimeoutStrategy strategy = new KeyBasedExponentialBackoffTimeoutStrategy(
                (int) configuration.schemaChangeInitialBackoff().toMillis(),
                (int) configuration.schemaChangeMaxBackoff().toMillis(),
                configuration.schemaChangeBackoffMultiplier(),
                configuration.schemaChangeBackoffJitter()
        );

        return new SchemaChangeExecutorConfig(clock, strategy, SchemaChangeTestingKnobs.NONE);
    }

    public HybridClock clock() {
        return clock;
    }

    public TimeoutStrategy retryStrategy() {
        return retryStrategy;
    }

    public SchemaChangeTestingKnobs testingKnobs() {
        return testingKnobs;
    }
}
