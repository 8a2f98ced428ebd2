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

import org.strata.client.plan.node.HashAggNode;
import org.strata.client.plan.node.IndexLookUpNode;
import org.strata.client.plan.node.LimitNode;
import org.strata.client.plan.node.PlanNode;
import org.strata.client.plan.node.PlanNodeVisitor;
import org.strata.client.plan.node.ProjectionNode;
import org.strata.client.plan.node.ReaderNode;
import org.strata.client.plan.node.SelectionNode;

/** Builds the executor tree of a plan. Coprocessor operators are run by their reader. */
public class ExecutorBuilder implements PlanNodeVisitor<Executor> {

    private final ExecutionContext context;

    public ExecutorBuilder(ExecutionContext context) {
        this.context = context;
    }

    public Executor build(PlanNode root) {
        return root.accept(this);
    }

    private Executor buildChild(PlanNode node) {
        return node.getChildren().get(0).accept(this);
    }

    @Override
    public Executor visit(ReaderNode reader) {
        return new ReaderExecutor(context, reader);
    }

    @Override
    public Executor visit(IndexLookUpNode indexLookUp) {
        return new IndexLookUpExecutor(context, indexLookUp);
    }

    @Override
    public Executor visit(SelectionNode selection) {
        return new SelectionExecutor(context, selection, buildChild(selection));
    }

    @Override
    public Executor visit(HashAggNode hashAgg) {
        return new HashAggExecutor(context, hashAgg, buildChild(hashAgg));
    }

    @Override
    public Executor visit(ProjectionNode projection) {
        return new ProjectionExecutor(context, projection, buildChild(projection));
    }

    @Override
    public Executor visit(LimitNode limit) {
        return new LimitExecutor(context, limit, buildChild(limit));
    }
}
