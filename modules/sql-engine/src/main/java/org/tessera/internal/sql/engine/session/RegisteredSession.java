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

package org.tessera.internal.sql.engine.session;

/**
 * Session that can be registered in the {@link SessionRegistry}. The registry does not own the session: whoever created it registers
 * and deregisters it.
 */
public interface RegisteredSession {
    /**
     * Returns the name of the user owning the session.
     *
     * @return User name.
     */
    String user();

    /**
     * Requests cancellation of a query running in this session. Only signals the query, does not wait for it to stop.
     *
     * @param queryId Query id.
     * @return {@code true} if the query was found in this session, {@code false} otherwise.
     */
    boolean cancelQuery(ClusterWideId queryId);

    /**
     * Requests cancellation of the whole session. Only signals the session, does not wait for it to stop.
     */
    void cancelSession();

    /**
     * Produces an immutable snapshot of the session state.
     *
     * @return Session snapshot.
     */
    SessionInfo serialize();
}
