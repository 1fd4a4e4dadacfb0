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

import java.util.concurrent.CompletableFuture;

/**
 * Handle to cancel a running query, or every query of a session. Operations attach themselves to the handle's
 * {@link #token()}; cancelling the handle runs their cancel actions.
 */
public interface CancelHandle {
    /** Creates a handle. */
    static CancelHandle create() {
        return new CancelHandleImpl();
    }

    /**
     * Cancels the attached operations and waits until all of them have released their resources.
     */
    void cancel();

    /**
     * Signals the attached operations to stop and returns without waiting.
     *
     * @return Future completed once all attached operations have released their resources.
     */
    CompletableFuture<Void> cancelAsync();

    /** Returns {@code true} once cancellation has been requested, even if it has not completed yet. */
    boolean isCancelled();

    /**
     * Returns the token of the handle. The same token may be shared by several operations that are cancelled together.
     */
    CancellationToken token();
}
