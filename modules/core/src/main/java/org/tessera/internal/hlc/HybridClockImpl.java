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

package org.tessera.internal.hlc;

import static org.tessera.internal.hlc.HybridTimestamp.LOGICAL_TIME_BITS_SIZE;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hybrid clock over the wall clock. When the wall clock stands still or goes back, the logical part of the latest reading is
 * incremented instead.
 */
public class HybridClockImpl implements HybridClock {
    /** Latest reading in the packed form of {@link HybridTimestamp#longValue()}. */
    private final AtomicLong latest = new AtomicLong();

    @Override
    public final HybridTimestamp now() {
        long wall = physicalTime() << LOGICAL_TIME_BITS_SIZE;

        return HybridTimestamp.hybridTimestamp(latest.updateAndGet(prev -> Math.max(prev + 1, wall)));
    }

    /**
     * Returns the wall clock time. Tests override it to control the clock.
     *
     * @return Milliseconds since the epoch.
     */
    protected long physicalTime() {
        return System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return "HybridClockImpl [latest=" + latest.get() + ']';
    }
}
