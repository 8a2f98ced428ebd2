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
import org.strata.exception.InvalidQueryException;
import org.strata.metadata.TableInfo;
import org.strata.predicate.RangeCondition;
import org.strata.types.DataType;
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Checks a {@link Query} against the schema of its table. */
public final class QueryValidator {

    private QueryValidator() {}

    /** @throws InvalidQueryException if the query cannot run on the table */
    public static void validate(TableInfo tableInfo, Query query) {
        RowType rowType = tableInfo.getRowType();
        String table = tableInfo.getTablePath().toString();

        if (query.getSelectedColumns().isEmpty() && !query.hasAggregation()) {
            throw new InvalidQueryException("Query must project columns or aggregate.");
        }
        for (String column : query.getReferencedColumns()) {
            if (rowType.getFieldIndex(column) < 0) {
                throw new InvalidQueryException(
                        "Column " + column + " does not exist in table " + table + ".");
            }
        }
        checkNoDuplicates(query.getSelectedColumns(), "projected column");
        checkNoDuplicates(query.getGroupByColumns(), "group by column");
        checkNoDuplicates(query.getAggregates(), "aggregate call");

        for (Filter filter : query.getFilters()) {
            DataType type = rowType.getTypeAt(rowType.getFieldIndex(filter.getColumn()));
            if (filter.isEquality()) {
                checkValue(filter, type, filter.getValue());
            } else {
                RangeCondition condition = filter.getRangeCondition();
                if (condition.getLowerBound() != null) {
                    checkValue(filter, type, condition.getLowerBound());
                }
                if (condition.getUpperBound() != null) {
                    checkValue(filter, type, condition.getUpperBound());
                }
            }
        }

        for (Aggregate aggregate : query.getAggregates()) {
            if (aggregate.getKind() == AggFunctionKind.SUM) {
                DataType type = rowType.getTypeAt(rowType.getFieldIndex(aggregate.getColumn()));
                if (type.getTypeRoot() != DataTypeRoot.BIGINT) {
                    throw new InvalidQueryException(
                            "Cannot apply " + aggregate + " to a column of type " + type + ".");
                }
            }
        }
        if (query.hasAggregation()) {
            for (String column : query.getSelectedColumns()) {
                if (!query.getGroupByColumns().contains(column)) {
                    throw new InvalidQueryException(
                            "Projected column "
                                    + column
                                    + " must be a group by column of an aggregating query.");
                }
            }
        }

        Integer limit = query.getLimit();
        if (limit != null && limit < 0) {
            throw new InvalidQueryException("Limit must not be negative, got " + limit + ".");
        }
    }

    private static void checkValue(Filter filter, DataType type, Object value) {
        if (!type.accepts(value)) {
            throw new InvalidQueryException(
                    "Filter "
                            + filter
                            + " compares column of type "
                            + type
                            + " with "
                            + value.getClass().getSimpleName()
                            + " value "
                            + value
                            + ".");
        }
    }

    private static void checkNoDuplicates(List<?> items, String what) {
        Set<Object> seen = new HashSet<>();
        for (Object item : items) {
            if (!seen.add(item)) {
                throw new InvalidQueryException("Duplicate " + what + " " + item + ".");
            }
        }
    }
}
