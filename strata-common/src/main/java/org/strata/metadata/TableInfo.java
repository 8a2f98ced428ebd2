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
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Information of a registered table: path, id, bucket count and resolved indexes. */
@PublicEvolving
public final class TableInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TablePath tablePath;
    private final long tableId;
    private final TableDescriptor descriptor;
    private final int numBuckets;
    private final List<IndexInfo> indexes;

    public TableInfo(
            TablePath tablePath,
            long tableId,
            TableDescriptor descriptor,
            int numBuckets,
            List<IndexInfo> indexes) {
        this.tablePath = Objects.requireNonNull(tablePath);
        this.tableId = tableId;
        this.descriptor = Objects.requireNonNull(descriptor);
        this.numBuckets = numBuckets;
        this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
    }

    public TablePath getTablePath() {
        return tablePath;
    }

    public long getTableId() {
        return tableId;
    }

    public TableDescriptor getDescriptor() {
        return descriptor;
    }

    public RowType getRowType() {
        return descriptor.getRowType();
    }

    public int getNumBuckets() {
        return numBuckets;
    }

    public String getHandleColumn() {
        return descriptor.getHandleColumn();
    }

    public int getHandleIndex() {
        return getRowType().getFieldIndex(descriptor.getHandleColumn());
    }

    public List<IndexInfo> getIndexes() {
        return indexes;
    }

    public @Nullable IndexInfo getIndex(String indexName) {
        for (IndexInfo index : indexes) {
            if (index.getIndexName().equals(indexName)) {
                return index;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "TableInfo{"
                + "tablePath="
                + tablePath
                + ", tableId="
                + tableId
                + ", numBuckets="
                + numBuckets
                + ", indexes="
                + indexes
                + '}';
    }
}
