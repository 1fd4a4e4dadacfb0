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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;
import org.tessera.lang.ErrorGroups.Common;

/** Implementation of {@link CancelHandle}. */
final class CancelHandleImpl implements CancelHandle {
    /** Completed when every operation attached before the cancellation has completed. */
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    private final Token token = new Token();

    @Override
    public void cancel() {
        token.cancel();

        cancelled.join();
    }

    @Override
    public CompletableFuture<Void> cancelAsync() {
        token.cancel();

        return cancelled.copy();
    }

    @Override
    public boolean isCancelled() {
        return token.isCancelled();
    }

    @Override
    public CancellationToken token() {
        return token;
    }

    /** Token keeping the attached operations until the handle is cancelled. */
    final class Token implements CancellationToken {
        /** Attached operations, {@code null} once cancelled. Guarded by {@code this}. */
        private @Nullable List<Operation> operations = new ArrayList<>();

        void addCancelAction(Runnable cancelAction, CompletableFuture<?> completionFut) {
            synchronized (this) {
                if (operations != null) {
                    operations.add(new Operation(cancelAction, completionFut));

                    return;
                }
            }

            // The handle is already cancelled.
            cancelAction.run();
        }

        synchronized boolean isCancelled() {
            return operations == null;
        }

        void cancel() {
            List<Operation> toCancel;

            synchronized (this) {
                if (operations == null) {
                    return;
                }

                toCancel = operations;
                operations = null;
            }

            CompletableFuture.allOf(toCancel.stream().map(op -> op.completionFut).toArray(CompletableFuture[]::new))
                    .whenComplete((res, err) -> cancelled.complete(null));

            TesseraException failure = null;

            for (Operation op : toCancel) {
                try {
                    op.cancelAction.run();
                } catch (Throwable t) {
                    if (failure == null) {
                        failure = new TesseraException(Common.INTERNAL_ERR, "Failed to cancel an operation");
                    }

                    failure.addSuppressed(t);
                }
            }

            if (failure != null) {
                throw failure;
            }
        }
    }

    private static final class Operation {
        private final Runnable cancelAction;

        /** Completed when the operation has released its resources. */
        private final CompletableFuture<?> completionFut;

        Operation(Runnable cancelAction, CompletableFuture<?> completionFut) {
            this.cancelAction = cancelAction;
            this.completionFut = completionFut;
        }
    }
}
