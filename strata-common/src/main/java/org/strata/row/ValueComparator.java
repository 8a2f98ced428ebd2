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

package org.strata.row;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * Compares non-null field values the way their key encodings compare: longs numerically and
 * strings by their unsigned UTF-8 bytes.
 */
public final class ValueComparator implements Comparator<Object> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {}

    @Override
    public int compare(Object left, Object right) {
        if (left instanceof Long && right instanceof Long) {
            return Long.compare((Long) left, (Long) right);
        }
        if (left instanceof String && right instanceof String) {
            if (left.equals(right)) {
                return 0;
            }
            return compareUtf8((String) left, (String) right);
        }
        throw new IllegalArgumentException(
                "Cannot compare "
                        + left.getClass().getName()
                        + " with "
                        + right.getClass().getName());
    }

    private static int compareUtf8(String left, String right) {
        byte[] l = left.getBytes(StandardCharsets.UTF_8);
        byte[] r = right.getBytes(StandardCharsets.UTF_8);
        int n = Math.min(l.length, r.length);
        for (int i = 0; i < n; i++) {
            int cmp = (l[i] & 0xff) - (r[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return l.length - r.length;
    }
}
