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

import org.strata.client.plan.CopTask;
import org.strata.types.RowType;

import java.util.List;

/**
 * Scans an index for handles (the build side) and reads the records of the handles by batched
 * point lookups (the probe side). Produces full table rows.
 */
public final class IndexLookUpNode extends PlanNode {

    private final CopTask indexTask;

    public IndexLookUpNode(
            int id,
            CopTask indexTask,
            RowType tableRowType,
            PlanNode buildSide,
            ScanNode probeSide) {
        super(id, TaskType.ROOT, tableRowType, buildSide, probeSide);
        this.indexTask = indexTask;
    }

    public CopTask getIndexTask() {
        return indexTask;
    }

    /** The operators of the index-side coprocessor task, from the scan up. */
    public List<PlanNode> getBuildNodes() {
        return ReaderNode.collectCopChain(getChildren().get(0));
    }

    public ScanNode getProbeNode() {
        return (ScanNode) getChildren().get(1);
    }

    @Override
    public String getChildLabel(int childIndex) {
        return childIndex == 0 ? "(Build)" : "(Probe)";
    }

    @Override
    public String getOperatorName() {
        return "IndexLookUp";
    }

    @Override
    public String getOperatorInfo() {
        return "";
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
