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

package org.strata.predicate;

import org.strata.annotation.PublicEvolving;
import org.strata.row.ValueComparator;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

/**
 * An interval over the values of one column. Either end may be open ({@code -inf} / {@code
 * +inf}). NULL column values are outside every interval.
 */
@PublicEvolving
public final class RangeCondition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String column;
    private final @Nullable Bound lower;
    private final @Nullable Bound upper;

    private RangeCondition(String column, @Nullable Bound lower, @Nullable Bound upper) {
        this.column = Objects.requireNonNull(column, "column");
        this.lower = lower;
        this.upper = upper;
    }

    /** {@code lo <= column <= hi}; a null end leaves that side unbounded. */
    public static RangeCondition between(
            String column, @Nullable Object lo, @Nullable Object hi) {
        return between(column, lo, hi, true, true);
    }

    public static RangeCondition between(
            String column,
            @Nullable Object lo,
            @Nullable Object hi,
            boolean loInclusive,
            boolean hiInclusive) {
        return new RangeCondition(column, Bound.of(lo, loInclusive), Bound.of(hi, hiInclusive));
    }

    public static RangeCondition atLeast(String column, Object lo) {
        return new RangeCondition(column, Bound.of(lo, true), null);
    }

    public static RangeCondition greaterThan(String column, Object lo) {
        return new RangeCondition(column, Bound.of(lo, false), null);
    }

    public static RangeCondition atMost(String column, Object hi) {
        return new RangeCondition(column, null, Bound.of(hi, true));
    }

    public static RangeCondition lessThan(String column, Object hi) {
        return new RangeCondition(column, null, Bound.of(hi, false));
    }

    public String getColumn() {
        return column;
    }

    public @Nullable Object getLowerBound() {
        return lower == null ? null : lower.value;
    }

    public @Nullable Object getUpperBound() {
        return upper == null ? null : upper.value;
    }

    /** Inclusive when unbounded. */
    public boolean isLowerInclusive() {
        return lower == null || lower.inclusive;
    }

    /** Inclusive when unbounded. */
    public boolean isUpperInclusive() {
        return upper == null || upper.inclusive;
    }

    public boolean test(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (lower != null && !lower.admitsFromAbove(value)) {
            return false;
        }
        return upper == null || upper.admitsFromBelow(value);
    }

    /** Formats the interval, for example {@code [10, 20)} or {@code (-inf, 20]}. */
    public String toIntervalString() {
        String left = lower == null ? "(-inf" : (lower.inclusive ? "[" : "(") + lower.value;
        String right = upper == null ? "+inf)" : upper.value + (upper.inclusive ? "]" : ")");
        return left + ", " + right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeCondition)) {
            return false;
        }
        RangeCondition other = (RangeCondition) o;
        return column.equals(other.column)
                && Objects.equals(lower, other.lower)
                && Objects.equals(upper, other.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, lower, upper);
    }

    @Override
    public String toString() {
        return column + " in " + toIntervalString();
    }

    /** One end of the interval. */
    private static final class Bound implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Object value;
        private final boolean inclusive;

        private Bound(Object value, boolean inclusive) {
            this.value = value;
            this.inclusive = inclusive;
        }

        @Nullable
        static Bound of(@Nullable Object value, boolean inclusive) {
            return value == null ? null : new Bound(value, inclusive);
        }

        boolean admitsFromAbove(Object candidate) {
            int cmp = ValueComparator.INSTANCE.compare(candidate, value);
            return cmp > 0 || (cmp == 0 && inclusive);
        }

        boolean admitsFromBelow(Object candidate) {
            int cmp = ValueComparator.INSTANCE.compare(candidate, value);
            return cmp < 0 || (cmp == 0 && inclusive);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Bound)) {
                return false;
            }
            Bound other = (Bound) o;
            return inclusive == other.inclusive && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return 31 * value.hashCode() + (inclusive ? 1 : 0);
        }
    }
}
