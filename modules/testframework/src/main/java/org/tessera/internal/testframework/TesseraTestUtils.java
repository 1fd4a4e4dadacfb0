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

package org.tessera.internal.testframework;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.function.Executable;
import org.tessera.lang.ErrorGroup;
import org.tessera.lang.TraceableException;

/**
 * Utility methods for tests.
 */
public final class TesseraTestUtils {
    private TesseraTestUtils() {
    }

    /**
     * Checks whether runnable throws an exception of the given class carrying the given error code.
     *
     * @param expectedClass Expected exception class, either a public or an internal Tessera exception.
     * @param expectedErrorCode Expected full error code.
     * @param run Runnable to check.
     * @param errorMessageFragment Fragment of the error text in the expected exception, {@code null} if not to be checked.
     * @return Thrown throwable.
     */
    public static <T extends Throwable> T assertThrowsWithCode(
            Class<T> expectedClass,
            int expectedErrorCode,
            Executable run,
            @Nullable String errorMessageFragment
    ) {
        try {
            run.execute();
        } catch (Throwable throwable) {
            try {
                assertInstanceOf(expectedClass, throwable);
                assertInstanceOf(TraceableException.class, throwable);
            } catch (AssertionError err) {
                // An AssertionError from assertInstanceOf has nothing but a class name of the original exception.
                AssertionError assertionError = new AssertionError(err);

                assertionError.addSuppressed(throwable);

                throw assertionError;
            }

            int code = ((TraceableException) throwable).code();

            assertEquals(expectedErrorCode, code, "Invalid error code: " + ErrorGroup.codeAsString(code));

            if (errorMessageFragment != null) {
                assertThat(throwable.getMessage(), containsString(errorMessageFragment));
            }

            return expectedClass.cast(throwable);
        }

        throw new AssertionError("Exception has not been thrown.");
    }

    /**
     * Runs the actions concurrently with a timeout of 10 seconds, see {@link #runRace(long, RunnableX...)}.
     */
    public static void runRace(RunnableX... actions) {
        runRace(TimeUnit.SECONDS.toMillis(10), actions);
    }

    /**
     * Runs every action in its own thread. The threads wait on a common barrier so that the actions start together.
     *
     * @param timeoutMillis Time for all actions to complete.
     * @param actions Actions.
     * @throws AssertionError If the time runs out or some action fails; failures are attached as suppressed exceptions.
     */
    public static void runRace(long timeoutMillis, RunnableX... actions) {
        if (actions.length == 0) {
            return;
        }

        CyclicBarrier barrier = new CyclicBarrier(actions.length);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        List<Thread> threads = new ArrayList<>(actions.length);

        for (int i = 0; i < actions.length; i++) {
            RunnableX action = actions[i];

            threads.add(new Thread(() -> {
                try {
                    barrier.await();

                    action.run();
                } catch (Throwable e) {
                    failures.add(e);
                }
            }, "race-runner-" + i));
        }

        threads.forEach(Thread::start);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);

        try {
            for (Thread thread : threads) {
                thread.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (threads.stream().anyMatch(Thread::isAlive)) {
            threads.forEach(Thread::interrupt);

            fail("Race operations took too long.");
        }

        if (!failures.isEmpty()) {
            AssertionError err = new AssertionError("One or several threads have failed.");

            failures.forEach(err::addSuppressed);

            throw err;
        }
    }
}
