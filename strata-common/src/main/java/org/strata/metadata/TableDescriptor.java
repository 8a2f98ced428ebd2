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
import org.strata.types.DataType;
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static org.strata.utils.Preconditions.checkArgument;
import static org.strata.utils.Preconditions.checkNotNull;

/**
 * Represents the definition of a table: its columns, the BIGINT handle column that identifies a
 * row, its secondary indexes and its bucket count.
 */
@PublicEvolving
public final class TableDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RowType rowType;
    private final String handleColumn;
    private final List<IndexDescriptor> indexes;
    private final @Nullable Integer bucketCount;
    private final @Nullable String comment;

    private TableDescriptor(
            RowType rowType,
            String handleColumn,
            List<IndexDescriptor> indexes,
            @Nullable Integer bucketCount,
            @Nullable String comment) {
        this.rowType = rowType;
        this.handleColumn = handleColumn;
        this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
        this.bucketCount = bucketCount;
        this.comment = comment;
        validate();
    }

    private void validate() {
        int handleIndex = rowType.getFieldIndex(handleColumn);
        checkArgument(
                handleIndex >= 0,
                "Handle column %s does not exist in %s.",
                handleColumn,
                rowType.getFieldNames());
        DataType handleType = rowType.getTypeAt(handleIndex);
        checkArgument(
                handleType.getTypeRoot() == DataTypeRoot.BIGINT && !handleType.isNullable(),
                "Handle column %s must be of type BIGINT NOT NULL, but is %s.",
                handleColumn,
                handleType);
        checkArgument(
                bucketCount == null || bucketCount > 0,
                "Bucket count must be positive, but is %s.",
                bucketCount);

        Set<String> indexNames = new HashSet<>();
        for (IndexDescriptor index : indexes) {
            checkArgument(
                    indexNames.add(index.getIndexName()),
                    "Duplicate index name %s.",
                    index.getIndexName());
            checkArgument(
                    !index.getColumnNames().isEmpty(),
                    "Index %s must have at least one column.",
                    index.getIndexName());
            Set<String> columns = new HashSet<>();
            for (String column : index.getColumnNames()) {
                checkArgument(
                        rowType.getFieldIndex(column) >= 0,
                        "Column %s of index %s does not exist in %s.",
                        column,
                        index.getIndexName(),
                        rowType.getFieldNames());
                checkArgument(
                        !column.equals(handleColumn),
                        "Index %s must not contain the handle column %s, "
                                + "every index entry carries the handle already.",
                        index.getIndexName(),
                        handleColumn);
                checkArgument(
                        columns.add(column),
                        "Column %s appears twice in index %s.",
                        column,
                        index.getIndexName());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public RowType getRowType() {
        return rowType;
    }

    public String getHandleColumn() {
        return handleColumn;
    }

    public List<IndexDescriptor> getIndexes() {
        return indexes;
    }

    public Optional<Integer> getBucketCount() {
        return Optional.ofNullable(bucketCount);
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableDescriptor that = (TableDescriptor) o;
        return rowType.equals(that.rowType)
                && handleColumn.equals(that.handleColumn)
                && indexes.equals(that.indexes)
                && Objects.equals(bucketCount, that.bucketCount)
                && Objects.equals(comment, that.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowType, handleColumn, indexes, bucketCount, comment);
    }

    @Override
    public String toString() {
        return "TableDescriptor{rowType="
                + rowType
                + ", handle="
                + handleColumn
                + ", indexes="
                + indexes
                + ", bucketCount="
                + bucketCount
                + '}';
    }

    /** Builder for {@link TableDescriptor}. */
    @PublicEvolving
    public static class Builder {
        private RowType rowType;
        private String handleColumn;
        private final List<IndexDescriptor> indexes = new ArrayList<>();
        private @Nullable Integer bucketCount;
        private @Nullable String comment;

        public Builder schema(RowType rowType) {
            this.rowType = rowType;
            return this;
        }

        public Builder handle(String handleColumn) {
            this.handleColumn = handleColumn;
            return this;
        }

        public Builder index(IndexDescriptor index) {
            this.indexes.add(index);
            return this;
        }

        public Builder distributedBy(int bucketCount) {
            this.bucketCount = bucketCount;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public TableDescriptor build() {
            checkNotNull(rowType, "schema must be set");
            checkNotNull(handleColumn, "handle column must be set");
            return new TableDescriptor(rowType, handleColumn, indexes, bucketCount, comment);
        }
    }
}
