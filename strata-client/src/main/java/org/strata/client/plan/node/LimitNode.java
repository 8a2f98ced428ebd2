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

/** Stops after a number of rows. Pushed into coprocessor tasks it bounds each task. */
public final class LimitNode extends PlanNode {

    private final int limit;

    public LimitNode(int id, TaskType taskType, int limit, PlanNode child) {
        super(id, taskType, child.getOutputRowType(), child);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String getOperatorName() {
        return "Limit";
    }

    @Override
    public String getOperatorInfo() {
        return "offset:0, count:" + limit;
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
