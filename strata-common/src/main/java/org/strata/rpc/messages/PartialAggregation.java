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

package org.strata.rpc.messages;

import org.strata.aggregate.AggCall;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An aggregation pushed to the storage tier, bound to positions of the scanned row type. */
public final class PartialAggregation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int[] groupByIndexes;
    private final List<AggCall> aggCalls;

    public PartialAggregation(int[] groupByIndexes, List<AggCall> aggCalls) {
        this.groupByIndexes = groupByIndexes.clone();
        this.aggCalls = Collections.unmodifiableList(new ArrayList<>(aggCalls));
    }

    public int[] getGroupByIndexes() {
        return groupByIndexes.clone();
    }

    public List<AggCall> getAggCalls() {
        return aggCalls;
    }
}
