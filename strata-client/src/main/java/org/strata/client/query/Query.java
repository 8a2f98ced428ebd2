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

package org.strata.client.query;

import org.strata.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A query on one table: a conjunction of filters, the projected columns, aggregate calls with
 * optional grouping, and an optional limit.
 *
 * <p>The output of a query without aggregation is the projected columns. The output of an
 * aggregating query is the projected columns, which must be grouping columns, followed by one
 * column per aggregate call named by its display name.
 */
@PublicEvolving
public final class Query {

    private final List<String> selectedColumns;
    private final List<Filter> filters;
    private final List<Aggregate> aggregates;
    private final List<String> groupByColumns;
    private final @Nullable Integer limit;

    private Query(Builder builder) {
        this.selectedColumns = Collections.unmodifiableList(new ArrayList<>(builder.selected));
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(builder.aggregates));
        this.groupByColumns = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.selected.addAll(selectedColumns);
        builder.filters.addAll(filters);
        builder.aggregates.addAll(aggregates);
        builder.groupBy.addAll(groupByColumns);
        builder.limit = limit;
        return builder;
    }

    public List<String> getSelectedColumns() {
        return selectedColumns;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public List<Aggregate> getAggregates() {
        return aggregates;
    }

    public List<String> getGroupByColumns() {
        return groupByColumns;
    }

    public @Nullable Integer getLimit() {
        return limit;
    }

    public boolean hasAggregation() {
        return !aggregates.isEmpty() || !groupByColumns.isEmpty();
    }

    /** Every column the query reads: projected, filtered, aggregated and grouped columns. */
    public Set<String> getReferencedColumns() {
        Set<String> columns = new LinkedHashSet<>(selectedColumns);
        for (Filter filter : filters) {
            columns.add(filter.getColumn());
        }
        for (Aggregate aggregate : aggregates) {
            if (!aggregate.isCountStar()) {
                columns.add(aggregate.getColumn());
            }
        }
        columns.addAll(groupByColumns);
        return columns;
    }

    /** The names of the output columns. */
    public List<String> getOutputNames() {
        List<String> names = new ArrayList<>(selectedColumns);
        for (Aggregate aggregate : aggregates) {
            names.add(aggregate.getDisplayName());
        }
        return names;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(String.join(", ", getOutputNames()));
        if (!filters.isEmpty()) {
            sb.append(" WHERE ")
                    .append(
                            filters.stream()
                                    .map(Filter::toString)
                                    .collect(Collectors.joining(" AND ")));
        }
        if (!groupByColumns.isEmpty()) {
            sb.append(" GROUP BY ").append(String.join(", ", groupByColumns));
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        return sb.toString();
    }

    /** Builder of {@link Query}. */
    public static final class Builder {
        private final List<String> selected = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private final List<Aggregate> aggregates = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private @Nullable Integer limit;

        private Builder() {}

        public Builder select(String... columns) {
            selected.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder where(Filter filter) {
            filters.add(filter);
            return this;
        }

        public Builder aggregate(Aggregate aggregate) {
            aggregates.add(aggregate);
            return this;
        }

        public Builder aggregates(List<Aggregate> newAggregates) {
            aggregates.clear();
            aggregates.addAll(newAggregates);
            return this;
        }

        public Builder groupBy(String... columns) {
            groupBy.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
