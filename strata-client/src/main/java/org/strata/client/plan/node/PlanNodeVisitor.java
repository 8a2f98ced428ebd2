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

/** Visitor of the root operators of a physical plan. */
public interface PlanNodeVisitor<R> {

    R visit(ReaderNode reader);

    R visit(IndexLookUpNode indexLookUp);

    R visit(SelectionNode selection);

    R visit(HashAggNode hashAgg);

    R visit(ProjectionNode projection);

    R visit(LimitNode limit);

    /** Scans only exist inside coprocessor tasks, which are run by their reader. */
    default R visit(ScanNode scan) {
        throw new UnsupportedOperationException(scan + " can only run inside a coprocessor task");
    }
}
