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

import java.io.Serializable;
import java.time.Instant;

/**
 * Reading of a {@link HybridClock}: milliseconds since the epoch and a 16-bit logical counter, packed into one {@code long} that
 * orders readings the same way as the pair does.
 */
public final class HybridTimestamp implements Comparable<HybridTimestamp>, Serializable {
    private static final long serialVersionUID = 2171396216461519305L;

    /** Width of the logical part. */
    public static final int LOGICAL_TIME_BITS_SIZE = 16;

    private static final long LOGICAL_TIME_MASK = (1L << LOGICAL_TIME_BITS_SIZE) - 1;

    private static final long MAX_PHYSICAL = (1L << (Long.SIZE - 1 - LOGICAL_TIME_BITS_SIZE)) - 1;

    private final long time;

    /**
     * Constructor.
     *
     * @param physical Milliseconds since the epoch.
     * @param logical Logical counter, {@code 0..65535}.
     */
    public HybridTimestamp(long physical, int logical) {
        if (physical < 0 || physical > MAX_PHYSICAL) {
            throw new IllegalArgumentException("Physical time is out of bounds: " + physical);
        }

        if (logical < 0 || logical > LOGICAL_TIME_MASK) {
            throw new IllegalArgumentException("Logical time is out of bounds: " + logical);
        }

        this.time = checkPositive((physical << LOGICAL_TIME_BITS_SIZE) | logical);
    }

    private HybridTimestamp(long time) {
        this.time = checkPositive(time);
    }

    /**
     * Unpacks a timestamp produced by {@link #longValue()}.
     *
     * @param time Packed timestamp.
     * @return Timestamp.
     * @throws IllegalArgumentException If the value is not positive.
     */
    public static HybridTimestamp hybridTimestamp(long time) {
        return new HybridTimestamp(time);
    }

    /** Returns milliseconds since the epoch. */
    public long getPhysical() {
        return time >>> LOGICAL_TIME_BITS_SIZE;
    }

    /** Returns the logical counter. */
    public int getLogical() {
        return (int) (time & LOGICAL_TIME_MASK);
    }

    /** Returns the packed form. */
    public long longValue() {
        return time;
    }

    /** Returns the physical part as an instant; the logical part is dropped. */
    public Instant toInstant() {
        return Instant.ofEpochMilli(getPhysical());
    }

    private static long checkPositive(long time) {
        // Zero is not a valid reading.
        if (time <= 0) {
            throw new IllegalArgumentException("Time is out of bounds: " + time);
        }

        return time;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HybridTimestamp && time == ((HybridTimestamp) o).time;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(time);
    }

    @Override
    public int compareTo(HybridTimestamp other) {
        return Long.compare(time, other.time);
    }

    @Override
    public String toString() {
        return "HybridTimestamp [physical=" + getPhysical() + ", logical=" + getLogical() + ']';
    }
}
