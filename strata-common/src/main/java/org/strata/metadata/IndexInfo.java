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

package org.strata.metadata;

import org.strata.annotation.PublicEvolving;
import org.strata.types.DataField;
import org.strata.types.RowType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/** An {@link IndexDescriptor} registered in a table, with its id and resolved columns. */
@PublicEvolving
public class IndexInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long indexId;
    private final IndexDescriptor descriptor;
    private final int[] columnPositions;
    private final RowType indexRowType;

    public IndexInfo(
            long indexId, IndexDescriptor descriptor, RowType tableRowType, String handle) {
        this.indexId = indexId;
        this.descriptor = descriptor;
        List<String> columns = descriptor.getColumnNames();
        this.columnPositions = new int[columns.size()];
        List<DataField> fields = new ArrayList<>(columns.size() + 1);
        for (int i = 0; i < columns.size(); i++) {
            columnPositions[i] = tableRowType.getFieldIndex(columns.get(i));
            fields.add(tableRowType.getFields().get(columnPositions[i]));
        }
        fields.add(tableRowType.getFields().get(tableRowType.getFieldIndex(handle)));
        this.indexRowType = new RowType(fields);
    }

    public long getIndexId() {
        return indexId;
    }

    public String getIndexName() {
        return descriptor.getIndexName();
    }

    public List<String> getColumnNames() {
        return descriptor.getColumnNames();
    }

    public boolean isUnique() {
        return descriptor.isUnique();
    }

    /** Positions of the index columns in the table row, in index order. */
    public int[] getColumnPositions() {
        return columnPositions;
    }

    /**
     * The row type an index-only scan produces: the index columns in index order followed by the
     * handle.
     */
    public RowType getIndexRowType() {
        return indexRowType;
    }

    @Override
    public String toString() {
        return descriptor + "#" + indexId;
    }
}
