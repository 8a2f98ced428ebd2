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

package org.strata.client.plan;

import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.predicate.RangeCondition;
import org.strata.row.encode.IndexKeyEncoder;
import org.strata.row.encode.OrderedCodec;
import org.strata.row.encode.TableCodec;
import org.strata.rpc.messages.KeyRange;
import org.strata.types.DataTypeRoot;
import org.strata.utils.BytesUtils;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Turns the matched predicates of an access path into key ranges.
 *
 * <p>With {@code P} the key prefix of the equality-bound columns, a range on the next column
 * starts at {@code P + enc(lo)} (inclusive), {@code prefixNext(P + enc(lo))} (exclusive) or,
 * without a lower bound, right after the NULL datum of index keys. It ends at {@code
 * prefixNext(P + enc(hi))} (inclusive), {@code P + enc(hi)} (exclusive) or {@code
 * prefixNext(P)}. A range that turns out empty yields no key range at all.
 */
public final class KeyRangeBuilder {

    private static final byte[] SKIP_NULL = new byte[] {OrderedCodec.NULL_FLAG + 1};

    private KeyRangeBuilder() {}

    public static List<KeyRange> indexRanges(
            TableInfo tableInfo,
            IndexInfo indexInfo,
            List<Object> equalValues,
            @Nullable RangeCondition range) {
        byte[] prefix =
                new IndexKeyEncoder(tableInfo, indexInfo).encodePrefix(equalValues.toArray());
        if (range == null) {
            return Collections.singletonList(KeyRange.prefix(prefix));
        }
        int rangeColumn = indexInfo.getColumnPositions()[equalValues.size()];
        DataTypeRoot type = tableInfo.getRowType().getTypeAt(rangeColumn).getTypeRoot();
        return build(prefix, value -> OrderedCodec.encodeDatum(value, type), true, range);
    }

    /** Ranges of record keys for a handle equal to {@code handle} or within {@code range}. */
    public static List<KeyRange> tableRanges(
            long tableId, @Nullable Long handle, @Nullable RangeCondition range) {
        if (handle != null) {
            return Collections.singletonList(
                    KeyRange.prefix(TableCodec.recordKey(tableId, handle)));
        }
        byte[] prefix = TableCodec.recordPrefix(tableId);
        if (range == null) {
            return Collections.singletonList(KeyRange.prefix(prefix));
        }
        return build(prefix, value -> OrderedCodec.serializeLong((Long) value), false, range);
    }

    private static List<KeyRange> build(
            byte[] prefix,
            Function<Object, byte[]> encoder,
            boolean skipNulls,
            RangeCondition range) {
        byte[] start;
        Object lower = range.getLowerBound();
        if (lower == null) {
            start = skipNulls ? BytesUtils.concat(prefix, SKIP_NULL) : prefix;
        } else {
            byte[] lowerKey = BytesUtils.concat(prefix, encoder.apply(lower));
            start = range.isLowerInclusive() ? lowerKey : BytesUtils.prefixNext(lowerKey);
            if (start == null) {
                return Collections.emptyList();
            }
        }

        byte[] end;
        Object upper = range.getUpperBound();
        if (upper == null) {
            end = BytesUtils.prefixNext(prefix);
        } else {
            byte[] upperKey = BytesUtils.concat(prefix, encoder.apply(upper));
            end = range.isUpperInclusive() ? BytesUtils.prefixNext(upperKey) : upperKey;
        }

        KeyRange keyRange = new KeyRange(start, end);
        return keyRange.isEmpty()
                ? Collections.emptyList()
                : Collections.singletonList(keyRange);
    }

    /**
     * Describes a range in column values, for example {@code [1 10,1 20)} for {@code a = 1 and 10
     * <= b < 20}.
     */
    public static String describe(
            List<Object> equalValues, @Nullable RangeCondition range, boolean skipNulls) {
        List<String> lower = new ArrayList<>();
        List<String> upper = new ArrayList<>();
        for (Object value : equalValues) {
            lower.add(format(value));
            upper.add(format(value));
        }
        String open = "[";
        String close = "]";
        if (range != null) {
            Object lowerBound = range.getLowerBound();
            Object upperBound = range.getUpperBound();
            if (lowerBound != null) {
                open = range.isLowerInclusive() ? "[" : "(";
                lower.add(format(lowerBound));
            } else {
                open = skipNulls ? "(" : "[";
                lower.add(skipNulls ? "NULL" : "-inf");
            }
            if (upperBound != null) {
                close = range.isUpperInclusive() ? "]" : ")";
                upper.add(format(upperBound));
            } else {
                upper.add("+inf");
            }
        } else if (equalValues.isEmpty()) {
            lower.add("-inf");
            upper.add("+inf");
        }
        return open + String.join(" ", lower) + "," + String.join(" ", upper) + close;
    }

    private static String format(Object value) {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
