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

package org.strata.rpc.messages;

import org.strata.utils.BytesUtils;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/** A half-open key interval {@code [start, end)}; a null end is unbounded. */
public final class KeyRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final byte[] start;
    private final @Nullable byte[] end;

    public KeyRange(byte[] start, @Nullable byte[] end) {
        this.start = Objects.requireNonNull(start);
        this.end = end;
    }

    /** The range of every key starting with {@code prefix}. */
    public static KeyRange prefix(byte[] prefix) {
        return new KeyRange(prefix, BytesUtils.prefixNext(prefix));
    }

    public byte[] getStart() {
        return start;
    }

    public @Nullable byte[] getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return end != null && BytesUtils.compare(start, end) >= 0;
    }

    /** Whether {@code key} lies before the end of this range. */
    public boolean beforeEnd(byte[] key) {
        return end == null || BytesUtils.compare(key, end) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeyRange that = (KeyRange) o;
        return Arrays.equals(start, that.start) && Arrays.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(start) + Arrays.hashCode(end);
    }

    @Override
    public String toString() {
        return "["
                + BytesUtils.toHex(start)
                + ", "
                + (end == null ? "+inf" : BytesUtils.toHex(end))
                + ")";
    }
}
