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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential back-off kept per key. The first delay of a key is the initial timeout, every following one is the previous delay
 * multiplied by the back-off coefficient and capped by the max timeout. With jitter enabled the returned delay is drawn uniformly
 * from {@code [delay / 2, delay * 3 / 2]}, while the stored state keeps the exact delay.
 */
public class KeyBasedExponentialBackoffTimeoutStrategy implements TimeoutStrategy {
    /** Default backoff coefficient to calculate next timeout based on backoff strategy. */
    private static final double DEFAULT_BACKOFF_COEFFICIENT = 2.0;

    /** Default max timeout that strategy could generate, ms. */
    private static final int DEFAULT_TIMEOUT_MS_MAX = 1_000;

    private final int initialTimeout;

    private final int maxTimeout;

    private final double backoffCoefficient;

    private final boolean jitter;

    private final ConcurrentHashMap<String, TimeoutState> registry = new ConcurrentHashMap<>();

    /**
     * Creates a strategy with default max timeout and coefficient and no jitter.
     *
     * @param initialTimeout First delay of every key, ms.
     */
    public KeyBasedExponentialBackoffTimeoutStrategy(int initialTimeout) {
        this(initialTimeout, DEFAULT_TIMEOUT_MS_MAX, DEFAULT_BACKOFF_COEFFICIENT, false);
    }

    /**
     * Constructor.
     *
     * @param initialTimeout First delay of every key, ms.
     * @param maxTimeout Upper bound of a delay before jitter, ms.
     * @param backoffCoefficient Multiplier applied to the previous delay.
     * @param jitter Whether to randomize returned delays.
     */
    public KeyBasedExponentialBackoffTimeoutStrategy(
            int initialTimeout,
            int maxTimeout,
            double backoffCoefficient,
            boolean jitter
    ) {
        if (initialTimeout <= 0 || maxTimeout < initialTimeout || backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("Invalid back-off [initialTimeout=" + initialTimeout + ", maxTimeout=" + maxTimeout
                    + ", backoffCoefficient=" + backoffCoefficient + ']');
        }

        this.initialTimeout = initialTimeout;
        this.maxTimeout = maxTimeout;
        this.backoffCoefficient = backoffCoefficient;
        this.jitter = jitter;
    }

    /** {@inheritDoc} */
    @Override
    public TimeoutState getCurrent(String key) {
        return registry.getOrDefault(key, new TimeoutState(initialTimeout, 0));
    }

    /** {@inheritDoc} */
    @Override
    public int next(String key) {
        int timeout = registry.compute(key, (k, prev) -> {
            if (prev == null) {
                return new TimeoutState(initialTimeout, 1);
            }

            int raw = (int) Math.min((long) (prev.getCurrentTimeout() * backoffCoefficient), maxTimeout);

            return new TimeoutState(raw, prev.getAttempt() + 1);
        }).getCurrentTimeout();

        return jitter ? applyJitter(timeout) : timeout;
    }

    /** {@inheritDoc} */
    @Override
    public void reset(String key) {
        registry.remove(key);
    }

    /** {@inheritDoc} */
    @Override
    public void resetAll() {
        registry.clear();
    }

    private static int applyJitter(int raw) {
        int lo = raw / 2;
        int hi = raw + lo;

        return lo + ThreadLocalRandom.current().nextInt(hi - lo + 1);
    }
}
