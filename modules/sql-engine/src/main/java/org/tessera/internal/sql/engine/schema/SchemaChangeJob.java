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

/**
 * Follow-up work of a DDL statement, run after the transaction that executed the statement commits.
 */
public interface SchemaChangeJob {
    /**
     * Returns a human readable description of the job, used in logs.
     *
     * @return Description.
     */
    String description();

    /**
     * Makes one attempt to execute the job.
     *
     * <p>The outcome is normally reported through the result. An exception thrown instead is classified with
     * {@link SchemaChangeResult#classify(Throwable)}.
     *
     * @param ctx Context of the attempt.
     * @return Outcome of the attempt.
     */
    SchemaChangeResult execute(SchemaChangeContext ctx);
}
