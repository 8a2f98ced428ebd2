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
import org.strata.predicate.FieldPredicate;
import org.strata.predicate.RangeCondition;

import javax.annotation.Nullable;

import java.util.Objects;

/** A condition on one column of a query: an equality or a {@link RangeCondition}. */
@PublicEvolving
public final class Filter {

    /** Kinds of filters. */
    public enum Kind {
        EQUAL,
        RANGE
    }

    private final Kind kind;
    private final String column;
    private final @Nullable Object value;
    private final @Nullable RangeCondition rangeCondition;

    private Filter(
            Kind kind,
            String column,
            @Nullable Object value,
            @Nullable RangeCondition rangeCondition) {
        this.kind = kind;
        this.column = Objects.requireNonNull(column, "Column cannot be null");
        this.value = value;
        this.rangeCondition = rangeCondition;
    }

    /** {@code column = value}. The value cannot be null. */
    public static Filter equal(String column, Object value) {
        return new Filter(
                Kind.EQUAL,
                column,
                Objects.requireNonNull(value, "Equality value cannot be null"),
                null);
    }

    public static Filter range(RangeCondition condition) {
        return new Filter(Kind.RANGE, condition.getColumn(), null, condition);
    }

    /** {@code lower <= column <= upper}, a null bound is unbounded. */
    public static Filter between(
            String column, @Nullable Object lowerBound, @Nullable Object upperBound) {
        return range(RangeCondition.between(column, lowerBound, upperBound));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEquality() {
        return kind == Kind.EQUAL;
    }

    public String getColumn() {
        return column;
    }

    public Object getValue() {
        return Objects.requireNonNull(value, "Not an equality filter");
    }

    public RangeCondition getRangeCondition() {
        return Objects.requireNonNull(rangeCondition, "Not a range filter");
    }

    /** Binds the filter to the position of its column in the row it will be evaluated on. */
    public FieldPredicate bind(int fieldIndex) {
        if (kind == Kind.EQUAL) {
            return FieldPredicate.equal(fieldIndex, column, getValue());
        }
        return FieldPredicate.inRange(fieldIndex, getRangeCondition());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Filter filter = (Filter) o;
        return kind == filter.kind
                && column.equals(filter.column)
                && Objects.equals(value, filter.value)
                && Objects.equals(rangeCondition, filter.rangeCondition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, column, value, rangeCondition);
    }

    @Override
    public String toString() {
        if (kind == Kind.EQUAL) {
            return "eq(" + column + ", " + value + ")";
        }
        return "in(" + column + ", " + getRangeCondition().toIntervalString() + ")";
    }
}
