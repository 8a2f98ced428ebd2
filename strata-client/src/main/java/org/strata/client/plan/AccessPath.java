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

import org.strata.client.query.Filter;
import org.strata.metadata.IndexInfo;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A way to read the rows of a query: the table itself, an index alone, or an index followed by
 * row lookups. It records which filters bound the key range: a prefix of equality filters
 * followed by at most one range filter on the next column.
 */
public final class AccessPath {

    /** Kinds of access paths. */
    public enum Kind {
        /** Scan record keys, over the handle range when the handle is filtered. */
        TABLE_SCAN,
        /** Scan index keys and answer the query from them, the index covers the query. */
        INDEX_ONLY,
        /** Scan index keys for handles, then look up the records of the handles. */
        INDEX_LOOKUP
    }

    private final Kind kind;
    private final @Nullable IndexInfo indexInfo;
    private final List<Filter> equalityFilters;
    private final @Nullable Filter rangeFilter;

    private AccessPath(
            Kind kind,
            @Nullable IndexInfo indexInfo,
            List<Filter> equalityFilters,
            @Nullable Filter rangeFilter) {
        this.kind = kind;
        this.indexInfo = indexInfo;
        this.equalityFilters = Collections.unmodifiableList(new ArrayList<>(equalityFilters));
        this.rangeFilter = rangeFilter;
    }

    public static AccessPath table(List<Filter> handleEqualities, @Nullable Filter handleRange) {
        return new AccessPath(Kind.TABLE_SCAN, null, handleEqualities, handleRange);
    }

    public static AccessPath index(
            IndexInfo indexInfo,
            boolean covering,
            List<Filter> equalityFilters,
            @Nullable Filter rangeFilter) {
        return new AccessPath(
                covering ? Kind.INDEX_ONLY : Kind.INDEX_LOOKUP,
                Objects.requireNonNull(indexInfo),
                equalityFilters,
                rangeFilter);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCovering() {
        return kind != Kind.INDEX_LOOKUP;
    }

    public @Nullable IndexInfo getIndexInfo() {
        return indexInfo;
    }

    public List<Filter> getEqualityFilters() {
        return equalityFilters;
    }

    public @Nullable Filter getRangeFilter() {
        return rangeFilter;
    }

    /** The filters that bound the key range and need no further check. */
    public List<Filter> getKeyFilters() {
        List<Filter> keyFilters = new ArrayList<>(equalityFilters);
        if (rangeFilter != null) {
            keyFilters.add(rangeFilter);
        }
        return keyFilters;
    }

    /** Whether no filter bounds the key range. */
    public boolean isFullScan() {
        return equalityFilters.isEmpty() && rangeFilter == null;
    }

    /** Equality-bound columns count one, a range-bound column counts one half. */
    public double getMatchScore() {
        return equalityFilters.size() + (rangeFilter != null ? 0.5 : 0.0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (indexInfo != null) {
            sb.append("(").append(indexInfo.getIndexName()).append(")");
        }
        List<Filter> keyFilters = getKeyFilters();
        if (!keyFilters.isEmpty()) {
            sb.append(" on ").append(keyFilters);
        }
        return sb.toString();
    }
}
