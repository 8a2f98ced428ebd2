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

import org.strata.aggregate.AggCall;
import org.strata.aggregate.AggFunctionKind;
import org.strata.annotation.PublicEvolving;
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.util.Objects;

/** An aggregate call of a query, naming its argument column. */
@PublicEvolving
public final class Aggregate {

    private final AggFunctionKind kind;
    private final @Nullable String column;

    private Aggregate(AggFunctionKind kind, @Nullable String column) {
        this.kind = kind;
        this.column = column;
    }

    public static Aggregate countStar() {
        return new Aggregate(AggFunctionKind.COUNT, null);
    }

    public static Aggregate count(String column) {
        return new Aggregate(AggFunctionKind.COUNT, Objects.requireNonNull(column));
    }

    public static Aggregate countDistinct(String column) {
        return new Aggregate(AggFunctionKind.COUNT_DISTINCT, Objects.requireNonNull(column));
    }

    public static Aggregate sum(String column) {
        return new Aggregate(AggFunctionKind.SUM, Objects.requireNonNull(column));
    }

    public static Aggregate min(String column) {
        return new Aggregate(AggFunctionKind.MIN, Objects.requireNonNull(column));
    }

    public static Aggregate max(String column) {
        return new Aggregate(AggFunctionKind.MAX, Objects.requireNonNull(column));
    }

    public AggFunctionKind getKind() {
        return kind;
    }

    public boolean isCountStar() {
        return column == null;
    }

    public @Nullable String getColumn() {
        return column;
    }

    /** Binds the argument to its position in the given input row type. */
    public AggCall bind(RowType inputRowType) {
        if (column == null) {
            return AggCall.countStar();
        }
        int index = inputRowType.getFieldIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "Column " + column + " is not in " + inputRowType.getFieldNames());
        }
        return AggCall.of(kind, index, column, inputRowType.getTypeAt(index));
    }

    /** The output field name, for example {@code count(distinct b)}. */
    public String getDisplayName() {
        if (column == null) {
            return "count(*)";
        }
        if (kind == AggFunctionKind.COUNT_DISTINCT) {
            return "count(distinct " + column + ")";
        }
        return kind.getSqlName() + "(" + column + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Aggregate that = (Aggregate) o;
        return kind == that.kind && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, column);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
