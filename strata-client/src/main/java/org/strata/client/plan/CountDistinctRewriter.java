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

import org.strata.aggregate.AggFunctionKind;
import org.strata.client.query.Aggregate;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.types.RowType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replaces deduplicating counts that uniqueness makes redundant.
 *
 * <p>{@code count(distinct c)} becomes {@code count(c)} when the handle is {@code c}, or when a
 * unique index contains {@code c} and every other column of it is bound by an equality filter.
 * Among the filtered rows every non-null {@code c} then occurs once, so both counts agree. {@code
 * count(c)} in turn becomes {@code count(*)} when {@code c} cannot be null. The rewritten calls
 * are decomposable and reference fewer columns, which lets the aggregation be pushed down and the
 * scan stay on an index.
 */
public final class CountDistinctRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(CountDistinctRewriter.class);

    private CountDistinctRewriter() {}

    public static Query rewrite(TableInfo tableInfo, Query query) {
        if (query.getAggregates().isEmpty()) {
            return query;
        }
        Set<String> equalityBound = new HashSet<>();
        for (Filter filter : query.getFilters()) {
            if (filter.isEquality()) {
                equalityBound.add(filter.getColumn());
            }
        }

        List<Aggregate> rewritten = new ArrayList<>(query.getAggregates().size());
        boolean changed = false;
        for (Aggregate aggregate : query.getAggregates()) {
            Aggregate result = aggregate;
            if (aggregate.getKind() == AggFunctionKind.COUNT_DISTINCT
                    && isUnique(tableInfo, aggregate.getColumn(), equalityBound)) {
                result = Aggregate.count(aggregate.getColumn());
            }
            if (result.getKind() == AggFunctionKind.COUNT
                    && !result.isCountStar()
                    && !isNullable(tableInfo.getRowType(), result.getColumn())) {
                result = Aggregate.countStar();
            }
            if (!result.equals(aggregate)) {
                LOG.debug(
                        "Rewrote {} to {} on table {}.",
                        aggregate,
                        result,
                        tableInfo.getTablePath());
                changed = true;
            }
            rewritten.add(result);
        }
        return changed ? query.toBuilder().aggregates(rewritten).build() : query;
    }

    /** Whether the filtered rows hold each non-null value of {@code column} at most once. */
    static boolean isUnique(TableInfo tableInfo, String column, Set<String> equalityBound) {
        if (tableInfo.getHandleColumn().equals(column)) {
            return true;
        }
        for (IndexInfo index : tableInfo.getIndexes()) {
            if (!index.isUnique() || !index.getColumnNames().contains(column)) {
                continue;
            }
            boolean othersBound = true;
            for (String indexColumn : index.getColumnNames()) {
                if (!indexColumn.equals(column) && !equalityBound.contains(indexColumn)) {
                    othersBound = false;
                    break;
                }
            }
            if (othersBound) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNullable(RowType rowType, String column) {
        return rowType.getTypeAt(rowType.getFieldIndex(column)).isNullable();
    }
}
