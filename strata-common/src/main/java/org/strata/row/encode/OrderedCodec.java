/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.strata.row.encode;

import org.strata.annotation.Internal;
import org.strata.types.DataTypeRoot;
import org.strata.utils.StringUtils;

import javax.annotation.Nullable;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Memcomparable encoding of key datums: the unsigned byte order of two encodings equals the order
 * of the encoded values, and every encoding is self-delimiting so datums can be concatenated into
 * composite keys and decoded back.
 *
 * <ul>
 *   <li>NULL: flag {@code 0x00}. Sorts before every value.
 *   <li>BIGINT: flag {@code 0x03} followed by 8 bytes big-endian of {@code value ^ Long.MIN_VALUE}.
 *   <li>STRING: flag {@code 0x01} followed by the UTF-8 bytes in groups of 8. Every group is
 *       right-padded with {@code 0x00} and followed by the marker {@code 0xFF - padCount}; the last
 *       group always has padding (a full group of zeros when the length is a multiple of 8).
 * </ul>
 */
@Internal
public class OrderedCodec {

    public static final byte NULL_FLAG = 0x00;
    public static final byte BYTES_FLAG = 0x01;
    public static final byte LONG_FLAG = 0x03;

    static final int GROUP_SIZE = 8;
    static final int MARKER = 0xFF;
    static final byte PAD = 0x00;

    private OrderedCodec() {}

    /**
     * Serializes a long so that byte order equals numeric order: {@code Long.MIN_VALUE} maps to
     * {@code 0x0000000000000000} and {@code Long.MAX_VALUE} to {@code 0xFFFFFFFFFFFFFFFF}.
     */
    public static byte[] serializeLong(long value) {
        long unsigned = value ^ Long.MIN_VALUE;

        byte[] bytes = new byte[8];
        bytes[0] = (byte) (unsigned >> 56);
        bytes[1] = (byte) (unsigned >> 48);
        bytes[2] = (byte) (unsigned >> 40);
        bytes[3] = (byte) (unsigned >> 32);
        bytes[4] = (byte) (unsigned >> 24);
        bytes[5] = (byte) (unsigned >> 16);
        bytes[6] = (byte) (unsigned >> 8);
        bytes[7] = (byte) (unsigned);
        return bytes;
    }

    /** Reads a long written by {@link #serializeLong(long)} at the given offset. */
    public static long deserializeLong(byte[] bytes, int offset) {
        if (bytes.length < offset + 8) {
            throw new IllegalArgumentException(
                    "Need 8 bytes at offset " + offset + ", but key has " + bytes.length);
        }
        long unsigned =
                ((((long) bytes[offset] & 0xFF) << 56)
                        | (((long) bytes[offset + 1] & 0xFF) << 48)
                        | (((long) bytes[offset + 2] & 0xFF) << 40)
                        | (((long) bytes[offset + 3] & 0xFF) << 32)
                        | (((long) bytes[offset + 4] & 0xFF) << 24)
                        | (((long) bytes[offset + 5] & 0xFF) << 16)
                        | (((long) bytes[offset + 6] & 0xFF) << 8)
                        | (((long) bytes[offset + 7] & 0xFF)));
        return unsigned ^ Long.MIN_VALUE;
    }

    /** Writes a flagged datum of the given type, NULL when {@code value} is null. */
    public static void writeDatum(
            ByteArrayOutputStream out, @Nullable Object value, DataTypeRoot type) {
        if (value == null) {
            out.write(NULL_FLAG);
            return;
        }
        switch (type) {
            case BIGINT:
                out.write(LONG_FLAG);
                out.writeBytes(serializeLong((Long) value));
                break;
            case STRING:
                out.write(BYTES_FLAG);
                writeGroups(out, StringUtils.toUtf8((String) value));
                break;
            default:
                throw new IllegalArgumentException("Unsupported key type: " + type);
        }
    }

    public static byte[] encodeDatum(@Nullable Object value, DataTypeRoot type) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeDatum(out, value, type);
        return out.toByteArray();
    }

    private static void writeGroups(ByteArrayOutputStream out, byte[] data) {
        for (int idx = 0; idx <= data.length; idx += GROUP_SIZE) {
            int remain = data.length - idx;
            int padCount = 0;
            if (remain >= GROUP_SIZE) {
                out.write(data, idx, GROUP_SIZE);
            } else {
                padCount = GROUP_SIZE - remain;
                out.write(data, idx, remain);
                for (int i = 0; i < padCount; i++) {
                    out.write(PAD);
                }
            }
            out.write((byte) (MARKER - padCount));
        }
    }

    /** Sequential reader of the datums of a key. */
    public static final class Reader {
        private final byte[] key;
        private int position;

        public Reader(byte[] key, int position) {
            this.key = key;
            this.position = position;
        }

        public int position() {
            return position;
        }

        public boolean hasRemaining() {
            return position < key.length;
        }

        /** Reads the next datum, which must be NULL or of the given type. */
        public @Nullable Object readDatum(DataTypeRoot type) {
            byte flag = key[position++];
            if (flag == NULL_FLAG) {
                return null;
            }
            switch (type) {
                case BIGINT:
                    checkFlag(flag, LONG_FLAG, type);
                    long value = deserializeLong(key, position);
                    position += 8;
                    return value;
                case STRING:
                    checkFlag(flag, BYTES_FLAG, type);
                    return new String(readGroups(), StandardCharsets.UTF_8);
                default:
                    throw new IllegalArgumentException("Unsupported key type: " + type);
            }
        }

        private byte[] readGroups() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            while (true) {
                if (key.length - position < GROUP_SIZE + 1) {
                    throw new IllegalArgumentException("Insufficient bytes to decode string group");
                }
                int marker = key[position + GROUP_SIZE] & 0xFF;
                int padCount = MARKER - marker;
                if (padCount > GROUP_SIZE) {
                    throw new IllegalArgumentException("Invalid group marker " + marker);
                }
                int realGroupSize = GROUP_SIZE - padCount;
                out.write(key, position, realGroupSize);
                for (int i = realGroupSize; i < GROUP_SIZE; i++) {
                    if (key[position + i] != PAD) {
                        throw new IllegalArgumentException("Invalid padding byte in string group");
                    }
                }
                position += GROUP_SIZE + 1;
                if (padCount != 0) {
                    return out.toByteArray();
                }
            }
        }

        private void checkFlag(byte actual, byte expected, DataTypeRoot type) {
            if (actual != expected) {
                throw new IllegalArgumentException(
                        "Unexpected flag " + actual + " for a datum of type " + type);
            }
        }
    }
}
