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

package org.strata.client.plan.node;

import org.strata.aggregate.AggCall;
import org.strata.aggregate.AggMode;
import org.strata.aggregate.HashAggregator;
import org.strata.types.RowType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Hash aggregation. A {@link AggMode#PARTIAL} node runs inside coprocessor tasks; the root runs
 * {@link AggMode#FINAL} over partial rows or {@link AggMode#COMPLETE} over raw rows.
 */
public final class HashAggNode extends PlanNode {

    private final AggMode mode;
    private final int[] groupByIndexes;
    private final List<String> groupByNames;
    private final List<AggCall> aggCalls;

    /**
     * @param inputRowType the raw rows the aggregation is bound to; for a final aggregation the
     *     raw rows its partial input was computed from
     */
    public HashAggNode(
            int id,
            TaskType taskType,
            AggMode mode,
            RowType inputRowType,
            int[] groupByIndexes,
            List<AggCall> aggCalls,
            PlanNode child) {
        super(
                id,
                taskType,
                HashAggregator.outputRowType(inputRowType, groupByIndexes, aggCalls),
                child);
        this.mode = mode;
        this.groupByIndexes = groupByIndexes.clone();
        List<String> names = new ArrayList<>(groupByIndexes.length);
        for (int index : groupByIndexes) {
            names.add(inputRowType.getFieldNames().get(index));
        }
        this.groupByNames = Collections.unmodifiableList(names);
        this.aggCalls = Collections.unmodifiableList(new ArrayList<>(aggCalls));
    }

    public AggMode getMode() {
        return mode;
    }

    public int[] getGroupByIndexes() {
        return groupByIndexes.clone();
    }

    public List<AggCall> getAggCalls() {
        return aggCalls;
    }

    @Override
    public String getOperatorName() {
        return "HashAgg";
    }

    @Override
    public String getOperatorInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("mode:").append(mode.name().toLowerCase(Locale.ROOT));
        if (!groupByNames.isEmpty()) {
            sb.append(", group by:").append(String.join(", ", groupByNames));
        }
        if (!aggCalls.isEmpty()) {
            sb.append(", funcs:")
                    .append(
                            aggCalls.stream()
                                    .map(AggCall::getDisplayName)
                                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
