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

package org.strata.utils;

import javax.annotation.Nullable;

import java.util.Arrays;

/** Utils for byte arrays that are compared as unsigned, lexicographically ordered keys. */
public class BytesUtils {

    private BytesUtils() {}

    /** Returns whether {@code bytes} starts with {@code prefix}. */
    public static boolean prefixEquals(byte[] prefix, byte[] bytes) {
        if (prefix.length > bytes.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (prefix[i] != bytes[i]) {
                return false;
            }
        }
        return true;
    }

    /** Unsigned lexicographical comparison, a shorter array is smaller when it is a prefix. */
    public static int compare(byte[] key1, byte[] key2) {
        int minLength = Math.min(key1.length, key2.length);
        for (int i = 0; i < minLength; i++) {
            int diff = (key1[i] & 0xFF) - (key2[i] & 0xFF);
            if (diff != 0) {
                return diff;
            }
        }
        return Integer.compare(key1.length, key2.length);
    }

    /**
     * Returns the smallest key that is greater than every key starting with {@code prefix}, or
     * null if there is no such key (the prefix is empty or consists of 0xFF bytes only).
     */
    public static @Nullable byte[] prefixNext(byte[] prefix) {
        for (int i = prefix.length - 1; i >= 0; i--) {
            if (prefix[i] != (byte) 0xFF) {
                byte[] next = Arrays.copyOf(prefix, i + 1);
                next[i]++;
                return next;
            }
        }
        return null;
    }

    public static byte[] concat(byte[] first, byte[] second) {
        byte[] result = new byte[first.length + second.length];
        System.arraycopy(first, 0, result, 0, first.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
