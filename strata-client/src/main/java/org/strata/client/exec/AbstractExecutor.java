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
import org.strata.row.InternalRow;
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base of executors. Opens and closes the children and records the rows, loops and time of the
 * operator in the {@link OperatorStats} of its plan node.
 */
public abstract class AbstractExecutor implements Executor {

    protected final ExecutionContext context;
    protected final PlanNode planNode;
    protected final List<Executor> children;
    protected final OperatorStats stats;

    private boolean opened;
    private boolean closed;

    protected AbstractExecutor(ExecutionContext context, PlanNode planNode, Executor... children) {
        this.context = context;
        this.planNode = planNode;
        this.children = Collections.unmodifiableList(Arrays.asList(children));
        this.stats = context.getOperatorStats(planNode);
    }

    @Override
    public final void open() {
        if (opened) {
            throw new IllegalStateException(planNode.getExplainId() + " is already open.");
        }
        opened = true;
        long start = System.nanoTime();
        for (Executor child : children) {
            child.open();
        }
        doOpen();
        stats.addTime(System.nanoTime() - start);
    }

    @Override
    public final @Nullable InternalRow next() {
        if (!opened || closed) {
            throw new IllegalStateException(planNode.getExplainId() + " is not open.");
        }
        long start = System.nanoTime();
        InternalRow row = doNext();
        stats.addLoops(1);
        if (row != null) {
            stats.addRows(1);
        }
        stats.addTime(System.nanoTime() - start);
        return row;
    }

    @Override
    public RowType getOutputRowType() {
        return planNode.getOutputRowType();
    }

    @Override
    public final void close() {
        if (closed) {
            return;
        }
        closed = true;
        doClose();
        for (Executor child : children) {
            child.close();
        }
    }

    protected void doOpen() {}

    protected abstract @Nullable InternalRow doNext();

    protected void doClose() {}

    protected Executor child() {
        return children.get(0);
    }
}
