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

package org.strata.aggregate;

import org.strata.row.GenericRow;
import org.strata.row.InternalRow;
import org.strata.types.DataField;
import org.strata.types.RowType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.strata.utils.Preconditions.checkArgument;

/**
 * Hash aggregation of rows by group key, used on both tiers.
 *
 * <p>In {@link AggMode#PARTIAL} and {@link AggMode#COMPLETE} mode the input is a raw row and the
 * group-by and argument positions index into it. In {@link AggMode#FINAL} mode the input is a
 * partial row: the group values in the first {@code groupCount} fields followed by one partial
 * state per call.
 *
 * <p>The output rows hold the group values followed by one partial state ({@code PARTIAL}) or one
 * final value per call. Groups are emitted in first-seen order. Without grouping, {@code FINAL}
 * and {@code COMPLETE} always emit exactly one row while {@code PARTIAL} emits none for an empty
 * input.
 */
public class HashAggregator {

    private final int[] groupByIndexes;
    private final List<AggCall> calls;
    private final AggMode mode;
    private final Map<GroupKey, Accumulator[]> groups = new LinkedHashMap<>();

    private long inputRows;

    public HashAggregator(int[] groupByIndexes, List<AggCall> calls, AggMode mode) {
        this.groupByIndexes = groupByIndexes;
        this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
        this.mode = mode;
        if (mode != AggMode.COMPLETE) {
            for (AggCall call : calls) {
                checkArgument(
                        call.getKind().isDecomposable(),
                        "%s cannot run in %s mode.",
                        call,
                        mode);
            }
        }
    }

    public void addRow(InternalRow row) {
        inputRows++;
        int groupCount = groupByIndexes.length;
        Object[] groupValues = new Object[groupCount];
        for (int i = 0; i < groupCount; i++) {
            groupValues[i] =
                    mode == AggMode.FINAL ? row.getField(i) : row.getField(groupByIndexes[i]);
        }
        Accumulator[] accumulators =
                groups.computeIfAbsent(new GroupKey(groupValues), k -> createAccumulators());
        for (int i = 0; i < accumulators.length; i++) {
            AggCall call = calls.get(i);
            if (mode == AggMode.FINAL) {
                accumulators[i].merge(row.getField(groupCount + i));
            } else if (call.isCountStar()) {
                accumulators[i].add(Boolean.TRUE);
            } else {
                accumulators[i].add(row.getField(call.getArgIndex()));
            }
        }
    }

    private Accumulator[] createAccumulators() {
        Accumulator[] accumulators = new Accumulator[calls.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = calls.get(i).createAccumulator();
        }
        return accumulators;
    }

    public long getInputRows() {
        return inputRows;
    }

    public int getGroupCount() {
        return groups.size();
    }

    public List<InternalRow> getOutput() {
        if (groups.isEmpty() && groupByIndexes.length == 0 && mode != AggMode.PARTIAL) {
            groups.put(new GroupKey(new Object[0]), createAccumulators());
        }
        List<InternalRow> output = new ArrayList<>(groups.size());
        int groupCount = groupByIndexes.length;
        for (Map.Entry<GroupKey, Accumulator[]> entry : groups.entrySet()) {
            GenericRow row = new GenericRow(groupCount + calls.size());
            Object[] groupValues = entry.getKey().values;
            for (int i = 0; i < groupCount; i++) {
                row.setField(i, groupValues[i]);
            }
            Accumulator[] accumulators = entry.getValue();
            for (int i = 0; i < accumulators.length; i++) {
                row.setField(
                        groupCount + i,
                        mode == AggMode.PARTIAL
                                ? accumulators[i].partial()
                                : accumulators[i].result());
            }
            output.add(row);
        }
        return output;
    }

    /**
     * The row type of the aggregation output: the group-by fields of the input followed by one
     * field per call, named by its display name. Partial and final rows share this type.
     */
    public static RowType outputRowType(
            RowType inputRowType, int[] groupByIndexes, List<AggCall> calls) {
        List<DataField> fields = new ArrayList<>(groupByIndexes.length + calls.size());
        for (int index : groupByIndexes) {
            fields.add(inputRowType.getFields().get(index));
        }
        for (AggCall call : calls) {
            fields.add(new DataField(call.getDisplayName(), call.getResultType()));
        }
        return new RowType(fields);
    }

    private static final class GroupKey {
        private final Object[] values;
        private final int hash;

        private GroupKey(Object[] values) {
            this.values = values;
            this.hash = Arrays.hashCode(values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof GroupKey)) {
                return false;
            }
            return Arrays.equals(values, ((GroupKey) o).values);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
