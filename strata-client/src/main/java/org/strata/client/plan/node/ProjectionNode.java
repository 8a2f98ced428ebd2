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

/** Picks and renames fields of its input rows. */
public final class ProjectionNode extends PlanNode {

    private final int[] fieldIndexes;

    public ProjectionNode(int id, int[] fieldIndexes, RowType outputRowType, PlanNode child) {
        super(id, TaskType.ROOT, outputRowType, child);
        this.fieldIndexes = fieldIndexes.clone();
    }

    public int[] getFieldIndexes() {
        return fieldIndexes.clone();
    }

    @Override
    public String getOperatorName() {
        return "Projection";
    }

    @Override
    public String getOperatorInfo() {
        return String.join(", ", getOutputRowType().getFieldNames());
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
