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

package org.strata.client.plan;

import org.strata.client.plan.node.PlanNode;
import org.strata.client.query.Query;

/** The plan chosen for a query: its operator tree and the decisions behind it. */
public final class PhysicalPlan {

    private final Query query;
    private final Query rewrittenQuery;
    private final AccessPath accessPath;
    private final boolean aggregationPushedDown;
    private final PlanNode root;

    PhysicalPlan(
            Query query,
            Query rewrittenQuery,
            AccessPath accessPath,
            boolean aggregationPushedDown,
            PlanNode root) {
        this.query = query;
        this.rewrittenQuery = rewrittenQuery;
        this.accessPath = accessPath;
        this.aggregationPushedDown = aggregationPushedDown;
        this.root = root;
    }

    public Query getQuery() {
        return query;
    }

    /** The query the plan actually computes, equal to the query if nothing was rewritten. */
    public Query getRewrittenQuery() {
        return rewrittenQuery;
    }

    public AccessPath getAccessPath() {
        return accessPath;
    }

    /** Whether partial aggregation runs in the coprocessor tasks. */
    public boolean isAggregationPushedDown() {
        return aggregationPushedDown;
    }

    public PlanNode getRoot() {
        return root;
    }
}
