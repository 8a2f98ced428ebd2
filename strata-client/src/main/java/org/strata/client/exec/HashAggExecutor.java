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

package org.strata.client.exec;

import org.strata.aggregate.HashAggregator;
import org.strata.client.plan.node.HashAggNode;
import org.strata.row.InternalRow;

import javax.annotation.Nullable;

import java.util.Iterator;

/** Aggregates all rows of its child on open, merging partial rows or consuming raw rows. */
public class HashAggExecutor extends AbstractExecutor {

    private final HashAggNode aggNode;
    private Iterator<InternalRow> output;

    public HashAggExecutor(ExecutionContext context, HashAggNode aggNode, Executor child) {
        super(context, aggNode, child);
        this.aggNode = aggNode;
    }

    @Override
    protected void doOpen() {
        HashAggregator aggregator =
                new HashAggregator(
                        aggNode.getGroupByIndexes(), aggNode.getAggCalls(), aggNode.getMode());
        InternalRow row;
        while ((row = child().next()) != null) {
            aggregator.addRow(row);
        }
        stats.putDetail(
                "agg",
                "{input rows:"
                        + aggregator.getInputRows()
                        + ", groups:"
                        + aggregator.getGroupCount()
                        + "}");
        this.output = aggregator.getOutput().iterator();
    }

    @Override
    protected @Nullable InternalRow doNext() {
        return output.hasNext() ? output.next() : null;
    }
}
