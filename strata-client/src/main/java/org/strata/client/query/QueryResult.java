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

package org.strata.client.query;

import org.strata.annotation.PublicEvolving;
import org.strata.client.exec.OperatorStats;
import org.strata.client.explain.ExplainFormatter;
import org.strata.client.plan.PhysicalPlan;
import org.strata.row.InternalRow;
import org.strata.types.RowType;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** The rows of an executed query together with its plan and what running it cost. */
@PublicEvolving
public final class QueryResult {

    private final PhysicalPlan plan;
    private final RowType rowType;
    private final List<InternalRow> rows;
    private final ExecutionStats executionStats;
    private final Map<Integer, OperatorStats> operatorStats;

    public QueryResult(
            PhysicalPlan plan,
            RowType rowType,
            List<InternalRow> rows,
            ExecutionStats executionStats,
            Map<Integer, OperatorStats> operatorStats) {
        this.plan = plan;
        this.rowType = rowType;
        this.rows = Collections.unmodifiableList(rows);
        this.executionStats = executionStats;
        this.operatorStats = operatorStats;
    }

    public PhysicalPlan getPlan() {
        return plan;
    }

    public RowType getRowType() {
        return rowType;
    }

    /** The result rows. Their order is not specified unless the query aggregates globally. */
    public List<InternalRow> getRows() {
        return rows;
    }

    public ExecutionStats getExecutionStats() {
        return executionStats;
    }

    public Map<Integer, OperatorStats> getOperatorStats() {
        return operatorStats;
    }

    /** Renders the executed plan with the runtime statistics of every operator. */
    public String explainAnalyze() {
        return ExplainFormatter.explainAnalyze(plan.getRoot(), operatorStats);
    }
}
