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

import org.strata.predicate.Selection;

/** Keeps the rows passing a conjunction of predicates. */
public final class SelectionNode extends PlanNode {

    private final Selection selection;

    public SelectionNode(int id, TaskType taskType, Selection selection, PlanNode child) {
        super(id, taskType, child.getOutputRowType(), child);
        this.selection = selection;
    }

    public Selection getSelection() {
        return selection;
    }

    @Override
    public String getOperatorName() {
        return "Selection";
    }

    @Override
    public String getOperatorInfo() {
        return selection.toString();
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
