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

import static org.tessera.internal.lang.TesseraStringFormatter.format;
import static org.tessera.lang.ErrorGroups.Session.MALFORMED_ID_ERR;

import java.io.Serializable;
import java.nio.ByteBuffer;
import org.tessera.internal.hlc.HybridTimestamp;
import org.tessera.lang.TesseraException;

/**
 * 128-bit identifier of a session or a query, unique across the cluster.
 *
 * <p>Generated identifiers put the physical part of a hybrid timestamp into the high half and the logical part together with the
 * generating node id into the low half, so two nodes never produce the same value and a node never repeats one. The textual form is
 * 32 lowercase hex digits, the binary form is 16 big-endian bytes; both describe the same identity.
 */
public final class ClusterWideId implements Comparable<ClusterWideId>, Serializable {
    private static final long serialVersionUID = 4093641532470811617L;

    /** Length of the binary form. */
    public static final int BYTES = 2 * Long.BYTES;

    private static final int HEX_DIGITS = 2 * BYTES;

    private static final int HALF_HEX_DIGITS = HEX_DIGITS / 2;

    private final long hi;

    private final long lo;

    /**
     * Constructor.
     *
     * @param hi High 64 bits.
     * @param lo Low 64 bits.
     */
    public ClusterWideId(long hi, long lo) {
        this.hi = hi;
        this.lo = lo;
    }

    /**
     * Generates an identifier from a timestamp of the node's hybrid clock.
     *
     * @param timestamp Timestamp, must be unique on the node.
     * @param nodeId Id of the generating node.
     * @return Identifier.
     */
    public static ClusterWideId generate(HybridTimestamp timestamp, int nodeId) {
        return new ClusterWideId(timestamp.getPhysical(), ((long) timestamp.getLogical() << Integer.SIZE) | Integer.toUnsignedLong(nodeId));
    }

    /**
     * Parses the textual form: from 1 to 32 hex digits, shorter strings are treated as left-padded with zeros.
     *
     * @param text Text to parse.
     * @return Identifier.
     * @throws TesseraException With {@code MALFORMED_ID_ERR} if the text is not a valid identifier.
     */
    public static ClusterWideId fromString(String text) {
        if (text == null || text.isEmpty() || text.length() > HEX_DIGITS) {
            throw malformed(text);
        }

        for (int i = 0; i < text.length(); i++) {
            if (!isHexDigit(text.charAt(i))) {
                throw malformed(text);
            }
        }

        String padded = "0".repeat(HEX_DIGITS - text.length()) + text;

        return new ClusterWideId(
                Long.parseUnsignedLong(padded.substring(0, HALF_HEX_DIGITS), 16),
                Long.parseUnsignedLong(padded.substring(HALF_HEX_DIGITS), 16)
        );
    }

    /**
     * Decodes the binary form.
     *
     * @param bytes Exactly {@link #BYTES} bytes, big-endian.
     * @return Identifier.
     * @throws TesseraException With {@code MALFORMED_ID_ERR} if the array has a wrong length.
     */
    public static ClusterWideId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTES) {
            throw new TesseraException(MALFORMED_ID_ERR, format("Malformed cluster-wide ID [length={}]",
                    bytes == null ? null : bytes.length));
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes);

        return new ClusterWideId(buf.getLong(), buf.getLong());
    }

    /**
     * Encodes this identifier into the binary form.
     *
     * @return New array of {@link #BYTES} bytes.
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putLong(hi).putLong(lo).array();
    }

    public long hi() {
        return hi;
    }

    public long lo() {
        return lo;
    }

    /** Returns the id of the node that generated this identifier. */
    public int nodeId() {
        return (int) lo;
    }

    @Override
    public int compareTo(ClusterWideId other) {
        int res = Long.compareUnsigned(hi, other.hi);

        return res != 0 ? res : Long.compareUnsigned(lo, other.lo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ClusterWideId that = (ClusterWideId) o;

        return hi == that.hi && lo == that.lo;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(hi) + Long.hashCode(lo);
    }

    @Override
    public String toString() {
        return String.format("%016x%016x", hi, lo);
    }

    /** ASCII only: {@link Character#digit} also accepts digits of other scripts. */
    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static TesseraException malformed(String text) {
        return new TesseraException(MALFORMED_ID_ERR, format("Malformed cluster-wide ID [id={}]", text));
    }
}
