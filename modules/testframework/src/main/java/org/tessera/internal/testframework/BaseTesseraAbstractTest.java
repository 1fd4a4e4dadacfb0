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

import java.lang.reflect.Method;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.mockito.Mockito;
import org.tessera.internal.logger.Loggers;
import org.tessera.internal.logger.TesseraLogger;

/**
 * Base class of the tests. Marks the start and the end of every test in the log, so that the node log records of a failed test are
 * easy to find.
 */
public abstract class BaseTesseraAbstractTest {
    /** Logger of the concrete test class. */
    protected final TesseraLogger log = Loggers.forClass(getClass());

    private long startNanos;

    /** Releases inline mocks created by the test class. */
    @AfterAll
    static void clearInlineMocks() {
        Mockito.framework().clearInlineMocks();
    }

    @BeforeEach
    void logTestStart(TestInfo testInfo) {
        log.info(">>> Starting test: {}", testName(testInfo));

        startNanos = System.nanoTime();
    }

    @AfterEach
    void logTestStop(TestInfo testInfo) {
        log.info(">>> Stopping test: {}, cost: {}ms", testName(testInfo), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private static String testName(TestInfo testInfo) {
        return testInfo.getTestClass().map(Class::getSimpleName).orElse("<null>") + '#'
                + testInfo.getTestMethod().map(Method::getName).orElse("<null>")
                + " [" + testInfo.getDisplayName() + ']';
    }
}
