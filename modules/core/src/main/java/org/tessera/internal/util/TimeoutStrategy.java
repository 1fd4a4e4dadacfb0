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

package org.tessera.internal.util;

/**
 * Produces retry delays for independent keys. Every key keeps its own back-off state until it is reset.
 */
public interface TimeoutStrategy {
    /**
     * Returns the current state of the given key without advancing it.
     *
     * @param key Key, for example a job identifier.
     * @return Current state, the initial one if the key has no state yet.
     */
    TimeoutState getCurrent(String key);

    /**
     * Advances the state of the given key and returns the delay to wait before the next attempt.
     *
     * @param key Key, for example a job identifier.
     * @return Delay in milliseconds.
     */
    int next(String key);

    /**
     * Forgets the state of the given key.
     *
     * @param key Key.
     */
    void reset(String key);

    /** Forgets the state of every key. */
    void resetAll();

    /** Back-off state of a single key. */
    class TimeoutState {
        /** Last delay produced, before jitter, in milliseconds. */
        private final int currentTimeout;

        /** Number of delays produced so far. */
        private final int attempt;

        /**
         * Constructor.
         *
         * @param currentTimeout Last delay produced, in milliseconds.
         * @param attempt Number of delays produced so far.
         */
        public TimeoutState(int currentTimeout, int attempt) {
            this.currentTimeout = currentTimeout;
            this.attempt = attempt;
        }

        public int getCurrentTimeout() {
            return currentTimeout;
        }

        public int getAttempt() {
            return attempt;
        }
    }
}
