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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Node-side access to {@link CancellationToken}s: the public API only lets users cancel, while the engine also has to attach its
 * operations to a token.
 */
public final class CancelHandleHelper {
    private CancelHandleHelper() {
    }

    /**
     * Attaches an operation to a token. Cancelling the token's handle runs {@code cancelAction}; the handle's cancellation completes
     * once {@code completionFut} does.
     *
     * <p>If the handle is already cancelled, {@code cancelAction} is run immediately and {@code completionFut} is not waited for.
     *
     * @param token Token.
     * @param cancelAction Stops the operation.
     * @param completionFut Completed when the operation has released its resources.
     */
    public static void addCancelAction(CancellationToken token, Runnable cancelAction, CompletableFuture<?> completionFut) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(cancelAction, "cancelAction");
        Objects.requireNonNull(completionFut, "completionFut");

        unwrap(token).addCancelAction(cancelAction, completionFut);
    }

    /**
     * Returns {@code true} once the token's handle has been cancelled.
     *
     * @param token Token.
     * @return Whether cancellation was requested.
     */
    public static boolean isCancelled(CancellationToken token) {
        return unwrap(token).isCancelled();
    }

    private static CancelHandleImpl.Token unwrap(CancellationToken token) {
        if (!(token instanceof CancelHandleImpl.Token)) {
            throw new IllegalArgumentException("Unexpected CancellationToken: " + token.getClass());
        }

        return (CancelHandleImpl.Token) token;
    }
}
