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

import static org.tessera.lang.ErrorGroups.Common.INTERNAL_ERR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.tessera.internal.lang.TesseraInternalException;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;
import org.tessera.internal.util.TimeoutStrategy;

/**
 * Schema change jobs queued by the statements of one transaction.
 *
 * <p>After the transaction commits, {@link #executeQueued} runs the jobs one by one in statement order. A job whose target was
 * dropped meanwhile counts as done. A job failing permanently is not retried; the first such failure of the run is returned to be
 * reported to the statement that queued the job, and the remaining jobs still run. Any other failure is retried with back-off until
 * the job completes one way or the other.
 *
 * <p>Not thread safe: a transaction queues and executes its jobs from one thread.
 */
public class SchemaChangeRunner {
    private static final TesseraLogger LOG = Loggers.forClass(SchemaChangeRunner.class);

    /** Back-off keys are unique per run: the retry strategy of a config is shared by all the transactions using it. */
    private static final AtomicLong RUN_ID_GEN = new AtomicLong();

    private final List<SchemaChangeJob> queue = new ArrayList<>();

    /**
     * Adds a job to the end of the queue.
     *
     * @param job Job.
     */
    public void queueSchemaChange(SchemaChangeJob job) {
        queue.add(Objects.requireNonNull(job, "job"));
    }

    /** Returns a read-only view of the queued jobs. */
    public List<SchemaChangeJob> queuedJobs() {
        return Collections.unmodifiableList(queue);
    }

    /**
     * Executes the queued jobs and clears the queue.
     *
     * @param cfg Execution config.
     * @return The first permanent error, {@code null} if there was none.
     * @throws TesseraInternalException If the thread is interrupted while waiting for a retry. The queue is cleared anyway.
     */
    public @Nullable Throwable executeQueued(SchemaChangeExecutorConfig cfg) {
        try {
            Consumer<List<SchemaChangeJob>> syncFilter = cfg.testingKnobs().syncFilter();

            if (syncFilter != null && !queue.isEmpty()) {
                syncFilter.accept(queuedJobs());
            }

            long runId = RUN_ID_GEN.incrementAndGet();

            Throwable firstError = null;

            for (int i = 0; i < queue.size(); i++) {
                Throwable err = execute("schema-change-" + runId + '-' + i, queue.get(i), cfg);

                if (err != null && firstError == null) {
                    firstError = err;
                }
            }

            return firstError;
        } finally {
            queue.clear();
        }
    }

    private static @Nullable Throwable execute(String retryKey, SchemaChangeJob job, SchemaChangeExecutorConfig cfg) {
        TimeoutStrategy retryStrategy = cfg.retryStrategy();

        try {
            for (int attempt = 1; ; attempt++) {
                SchemaChangeResult res = attempt(job, new SchemaChangeContext(cfg.clock().now(), attempt));

                switch (res.kind()) {
                    case SUCCESS:
                        return null;

                    case TARGET_MISSING:
                        LOG.debug("Schema change target no longer exists [job={}, attempt={}]", job.description(), attempt);

                        return null;

                    case PERMANENT:
                        LOG.warn("Schema change failed [job={}, attempt={}]", res.error(), job.description(), attempt);

                        return res.error();

                    case RETRYABLE:
                        int delay = retryStrategy.next(retryKey);

                        if (LOG.isDebugEnabled()) {
                            LOG.debug("Schema change will be retried [job={}, attempt={}, delay={}ms]", res.error(), job.description(),
                                    attempt, delay);
                        }

                        sleep(delay);

                        break;

                    default:
                        throw new IllegalStateException("Unexpected result kind: " + res.kind());
                }
            }
        } finally {
            retryStrategy.reset(retryKey);
        }
    }

    private static SchemaChangeResult attempt(SchemaChangeJob job, SchemaChangeContext ctx) {
        try {
            return job.execute(ctx);
        } catch (RuntimeException e) {
            return SchemaChangeResult.classify(e);
        }
    }

    private static void sleep(int delay) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            throw new TesseraInternalException(INTERNAL_ERR, "Interrupted while waiting to retry a schema change", e);
        }
    }
}
