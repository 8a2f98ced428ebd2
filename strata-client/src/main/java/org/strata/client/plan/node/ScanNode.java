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

import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.types.RowType;

import javax.annotation.Nullable;

/** A scan of record keys or index keys inside a coprocessor task. */
public final class ScanNode extends PlanNode {

    /** Kinds of scans. */
    public enum Kind {
        TABLE_FULL_SCAN("TableFullScan"),
        TABLE_RANGE_SCAN("TableRangeScan"),
        INDEX_FULL_SCAN("IndexFullScan"),
        INDEX_RANGE_SCAN("IndexRangeScan"),
        /** Point reads of records by the handles an index scan produced. */
        TABLE_ROW_ID_SCAN("TableRowIDScan");

        private final String operatorName;

        Kind(String operatorName) {
            this.operatorName = operatorName;
        }
    }

    private final Kind kind;
    private final TableInfo tableInfo;
    private final @Nullable IndexInfo indexInfo;
    private final String rangeInfo;

    public ScanNode(
            int id,
            Kind kind,
            RowType outputRowType,
            TableInfo tableInfo,
            @Nullable IndexInfo indexInfo,
            String rangeInfo) {
        super(id, TaskType.COP, outputRowType);
        this.kind = kind;
        this.tableInfo = tableInfo;
        this.indexInfo = indexInfo;
        this.rangeInfo = rangeInfo;
    }

    public Kind getKind() {
        return kind;
    }

    public @Nullable IndexInfo getIndexInfo() {
        return indexInfo;
    }

    @Override
    public String getOperatorName() {
        return kind.operatorName;
    }

    @Override
    public String getAccessObject() {
        String table = "table:" + tableInfo.getTablePath().getTableName();
        if (indexInfo == null) {
            return table;
        }
        return table
                + ", index:"
                + indexInfo.getIndexName()
                + "("
                + String.join(", ", indexInfo.getColumnNames())
                + ")";
    }

    @Override
    public String getOperatorInfo() {
        switch (kind) {
            case TABLE_FULL_SCAN:
            case INDEX_FULL_SCAN:
                return "keep order:false";
            case TABLE_ROW_ID_SCAN:
                return "handle lookup";
            default:
                return "range:" + rangeInfo + ", keep order:false";
        }
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
