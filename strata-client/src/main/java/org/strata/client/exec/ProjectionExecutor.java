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

import org.strata.client.plan.node.ProjectionNode;
import org.strata.row.GenericRow;
import org.strata.row.InternalRow;

import javax.annotation.Nullable;

/** Picks fields of the rows of its child. */
public class ProjectionExecutor extends AbstractExecutor {

    private final int[] fieldIndexes;

    public ProjectionExecutor(ExecutionContext context, ProjectionNode node, Executor child) {
        super(context, node, child);
        this.fieldIndexes = node.getFieldIndexes();
    }

    @Override
    protected @Nullable InternalRow doNext() {
        InternalRow row = child().next();
        if (row == null) {
            return null;
        }
        GenericRow projected = new GenericRow(fieldIndexes.length);
        for (int i = 0; i < fieldIndexes.length; i++) {
            projected.setField(i, row.getField(fieldIndexes[i]));
        }
        return projected;
    }
}
