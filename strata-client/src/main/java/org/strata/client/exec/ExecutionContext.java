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
import org.strata.client.query.ExecutionStats;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.TableInfo;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.strata.utils.Preconditions.checkArgument;

/** The state shared by the executors of one query. */
public final class ExecutionContext {

    private final TableInfo tableInfo;
    private final CoprocessorDispatcher dispatcher;
    private final int lookupBatchSize;
    private final int lookupConcurrency;
    private final ExecutionStats.Collector statsCollector = new ExecutionStats.Collector();
    private final Map<Integer, OperatorStats> operatorStats = new ConcurrentHashMap<>();

    public ExecutionContext(
            TableInfo tableInfo, CoprocessorDispatcher dispatcher, Configuration conf) {
        this.tableInfo = tableInfo;
        this.dispatcher = dispatcher;
        this.lookupBatchSize = conf.get(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE);
        this.lookupConcurrency = conf.get(ConfigOptions.CLIENT_LOOKUP_CONCURRENCY);
        checkArgument(lookupBatchSize > 0, "Lookup batch size must be positive.");
        checkArgument(lookupConcurrency > 0, "Lookup concurrency must be positive.");
    }

    public TableInfo getTableInfo() {
        return tableInfo;
    }

    public CoprocessorDispatcher getDispatcher() {
        return dispatcher;
    }

    public int getLookupBatchSize() {
        return lookupBatchSize;
    }

    public int getLookupConcurrency() {
        return lookupConcurrency;
    }

    public ExecutionStats.Collector getStatsCollector() {
        return statsCollector;
    }

    public OperatorStats getOperatorStats(PlanNode planNode) {
        return operatorStats.computeIfAbsent(planNode.getId(), id -> new OperatorStats());
    }

    /** The statistics of every operator that ran, by plan node id. */
    public Map<Integer, OperatorStats> getAllOperatorStats() {
        return Collections.unmodifiableMap(operatorStats);
    }
}
