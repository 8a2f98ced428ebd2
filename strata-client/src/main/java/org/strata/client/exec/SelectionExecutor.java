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

import org.strata.client.plan.node.SelectionNode;
import org.strata.predicate.Selection;
import org.strata.row.InternalRow;

import javax.annotation.Nullable;

/** Keeps the rows of its child passing a selection. */
public class SelectionExecutor extends AbstractExecutor {

    private final Selection selection;

    public SelectionExecutor(ExecutionContext context, SelectionNode node, Executor child) {
        super(context, node, child);
        this.selection = node.getSelection();
    }

    @Override
    protected @Nullable InternalRow doNext() {
        InternalRow row;
        while ((row = child().next()) != null) {
            if (selection.test(row)) {
                return row;
            }
        }
        return null;
    }
}
