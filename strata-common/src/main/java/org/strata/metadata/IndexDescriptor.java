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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A secondary index of a table: an ordered list of columns whose encoded values, followed by the
 * handle of the row, form the index key. A unique index allows at most one row per non-null key.
 */
@PublicEvolving
public class IndexDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String indexName;
    private final List<String> columnNames;
    private final boolean unique;

    private IndexDescriptor(String indexName, List<String> columnNames, boolean unique) {
        this.indexName = Objects.requireNonNull(indexName, "index name cannot be null");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.unique = unique;
    }

    public static IndexDescriptor of(String indexName, String... columnNames) {
        return new IndexDescriptor(indexName, Arrays.asList(columnNames), false);
    }

    public static IndexDescriptor unique(String indexName, String... columnNames) {
        return new IndexDescriptor(indexName, Arrays.asList(columnNames), true);
    }

    public String getIndexName() {
        return indexName;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexDescriptor that = (IndexDescriptor) o;
        return unique == that.unique
                && indexName.equals(that.indexName)
                && columnNames.equals(that.columnNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexName, columnNames, unique);
    }

    @Override
    public String toString() {
        return (unique ? "UNIQUE INDEX " : "INDEX ") + indexName + columnNames;
    }
}
