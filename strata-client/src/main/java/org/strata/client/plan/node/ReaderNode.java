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
import org.strata.rpc.messages.ScanType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sends a coprocessor task to every bucket and gathers the returned rows. The child is the top of
 * the operator chain the task runs on the storage tier.
 */
public final class ReaderNode extends PlanNode {

    private final CopTask copTask;

    public ReaderNode(int id, CopTask copTask, PlanNode copRoot) {
        super(id, TaskType.ROOT, copTask.getOutputRowType(), copRoot);
        this.copTask = copTask;
    }

    public CopTask getCopTask() {
        return copTask;
    }

    /** The operators of the coprocessor task, from the scan up. */
    public List<PlanNode> getCopNodes() {
        return collectCopChain(getChildren().get(0));
    }

    static List<PlanNode> collectCopChain(PlanNode copRoot) {
        List<PlanNode> chain = new ArrayList<>();
        PlanNode node = copRoot;
        while (true) {
            chain.add(node);
            if (node.getChildren().isEmpty()) {
                break;
            }
            node = node.getChildren().get(0);
        }
        Collections.reverse(chain);
        return chain;
    }

    @Override
    public String getOperatorName() {
        return copTask.getScanType() == ScanType.INDEX ? "IndexReader" : "TableReader";
    }

    @Override
    public String getOperatorInfo() {
        String prefix = copTask.getScanType() == ScanType.INDEX ? "index:" : "data:";
        return prefix + getChildren().get(0).getExplainId();
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
