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

import org.strata.client.plan.node.PlanNode;
import org.strata.client.plan.node.ScanNode;
import org.strata.client.plan.node.SelectionNode;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.ScanStatistics;

import java.util.List;

/** The summed statistics of the coprocessor tasks of one operator. */
final class CopTaskStats {

    private int tasks;
    private long keysScanned;
    private long rowsMatched;
    private long rowsReturned;
    private long bytesReturned;
    private long maxElapsedNanos;

    void add(CoprocessorResponse response) {
        ScanStatistics statistics = response.getStatistics();
        tasks++;
        keysScanned += statistics.getKeysScanned();
        rowsMatched += statistics.getRowsMatched();
        rowsReturned += statistics.getRowsReturned();
        bytesReturned += statistics.getBytesReturned();
        maxElapsedNanos = Math.max(maxElapsedNanos, statistics.getElapsedNanos());
    }

    long getRowsReturned() {
        return rowsReturned;
    }

    /**
     * Attributes the statistics to the operators the tasks ran, from the scan up: the scan
     * produced one row per key, a selection the matched rows, the top operator the returned rows.
     */
    void recordTo(ExecutionContext context, List<PlanNode> copChain) {
        for (PlanNode node : copChain) {
            OperatorStats stats = context.getOperatorStats(node);
            stats.addLoops(tasks);
            if (node instanceof ScanNode) {
                stats.addRows(keysScanned);
            } else if (node instanceof SelectionNode) {
                stats.addRows(rowsMatched);
            } else {
                stats.addRows(rowsReturned);
            }
        }
    }

    String describe() {
        return "{num:"
                + tasks
                + ", max:"
                + OperatorStats.formatDuration(maxElapsedNanos)
                + ", keys scanned:"
                + keysScanned
                + ", rows returned:"
                + rowsReturned
                + ", bytes:"
                + bytesReturned
                + "}";
    }
}
