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

package org.strata.client.table;

import org.strata.client.exec.CoprocessorDispatcher;
import org.strata.client.exec.ExecutionContext;
import org.strata.client.exec.Executor;
import org.strata.client.exec.ExecutorBuilder;
import org.strata.client.explain.ExplainFormatter;
import org.strata.client.plan.PhysicalPlan;
import org.strata.client.plan.PlanChooser;
import org.strata.client.query.Query;
import org.strata.client.query.QueryResult;
import org.strata.client.table.writer.UpsertWriter;
import org.strata.client.table.writer.UpsertWriterImpl;
import org.strata.config.Configuration;
import org.strata.metadata.TableInfo;
import org.strata.row.InternalRow;
import org.strata.rpc.gateway.ServerLocator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** The default implementation of {@link Table}. */
public class StrataTable implements Table {

    private static final Logger LOG = LoggerFactory.getLogger(StrataTable.class);

    private final TableInfo tableInfo;
    private final Configuration conf;
    private final CoprocessorDispatcher dispatcher;
    private final PlanChooser planChooser;

    public StrataTable(TableInfo tableInfo, ServerLocator serverLocator, Configuration conf) {
        this.tableInfo = tableInfo;
        this.conf = conf;
        this.dispatcher = new CoprocessorDispatcher(tableInfo, serverLocator);
        this.planChooser = new PlanChooser(tableInfo, conf);
    }

    @Override
    public TableInfo getTableInfo() {
        return tableInfo;
    }

    @Override
    public UpsertWriter newUpsertWriter() {
        return new UpsertWriterImpl(tableInfo, dispatcher);
    }

    @Override
    public QueryResult execute(Query query) {
        PhysicalPlan plan = planChooser.choose(query);
        ExecutionContext context = new ExecutionContext(tableInfo, dispatcher, conf);
        Executor executor = new ExecutorBuilder(context).build(plan.getRoot());
        List<InternalRow> rows = new ArrayList<>();
        try {
            executor.open();
            InternalRow row;
            while ((row = executor.next()) != null) {
                rows.add(row);
            }
        } finally {
            executor.close();
        }
        QueryResult result =
                new QueryResult(
                        plan,
                        executor.getOutputRowType(),
                        rows,
                        context.getStatsCollector().finish(),
                        context.getAllOperatorStats());
        LOG.debug("Executed {}: {}", query, result.getExecutionStats());
        return result;
    }

    @Override
    public String explain(Query query) {
        return ExplainFormatter.explain(planChooser.choose(query).getRoot());
    }

    @Override
    public String explainAnalyze(Query query) {
        return execute(query).explainAnalyze();
    }
}
