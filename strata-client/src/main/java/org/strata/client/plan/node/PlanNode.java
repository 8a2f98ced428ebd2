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

import org.strata.types.RowType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An operator of a physical plan. Every node has an id unique within its plan, runs in a {@link
 * TaskType} and produces rows of its output row type.
 */
public abstract class PlanNode {

    private final int id;
    private final TaskType taskType;
    private final RowType outputRowType;
    private final List<PlanNode> children;

    protected PlanNode(int id, TaskType taskType, RowType outputRowType, PlanNode... children) {
        this.id = id;
        this.taskType = taskType;
        this.outputRowType = outputRowType;
        this.children = Collections.unmodifiableList(Arrays.asList(children));
    }

    public int getId() {
        return id;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public RowType getOutputRowType() {
        return outputRowType;
    }

    public List<PlanNode> getChildren() {
        return children;
    }

    public abstract String getOperatorName();

    /** The id shown by explain, for example {@code HashAgg_4}. */
    public String getExplainId() {
        return getOperatorName() + "_" + id;
    }

    /** The suffix explain appends to the id of the i-th child. */
    public String getChildLabel(int childIndex) {
        return "";
    }

    /** The table and index the operator reads, empty for operators that read no storage. */
    public String getAccessObject() {
        return "";
    }

    public abstract String getOperatorInfo();

    public abstract <R> R accept(PlanNodeVisitor<R> visitor);

    @Override
    public String toString() {
        return getExplainId();
    }
}
