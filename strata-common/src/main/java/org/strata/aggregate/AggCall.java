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

package org.strata.aggregate;

import org.strata.types.DataType;
import org.strata.types.DataTypeRoot;
import org.strata.types.DataTypes;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

/**
 * An aggregate function applied to one field of its input, or to no field for {@code COUNT(*)}.
 * The argument is bound to a field position of the input row type.
 */
public final class AggCall implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AggFunctionKind kind;
    private final int argIndex;
    private final @Nullable String argName;
    private final @Nullable DataType argType;

    private AggCall(
            AggFunctionKind kind,
            int argIndex,
            @Nullable String argName,
            @Nullable DataType argType) {
        this.kind = Objects.requireNonNull(kind);
        this.argIndex = argIndex;
        this.argName = argName;
        this.argType = argType;
    }

    public static AggCall countStar() {
        return new AggCall(AggFunctionKind.COUNT, -1, null, null);
    }

    public static AggCall of(AggFunctionKind kind, int argIndex, String argName, DataType argType) {
        if (kind == AggFunctionKind.SUM && argType.getTypeRoot() != DataTypeRoot.BIGINT) {
            throw new IllegalArgumentException("SUM requires a BIGINT argument, got " + argType);
        }
        return new AggCall(kind, argIndex, argName, argType);
    }

    public AggFunctionKind getKind() {
        return kind;
    }

    public boolean isCountStar() {
        return argIndex < 0;
    }

    /** Position of the argument in the input row, -1 for {@code COUNT(*)}. */
    public int getArgIndex() {
        return argIndex;
    }

    public @Nullable String getArgName() {
        return argName;
    }

    public @Nullable DataType getArgType() {
        return argType;
    }

    /** Returns the same call with its argument bound to another input position. */
    public AggCall rebind(int newArgIndex) {
        if (isCountStar()) {
            return this;
        }
        return new AggCall(kind, newArgIndex, argName, argType);
    }

    /** The type of the final value. The partial state of a decomposable call has the same type. */
    public DataType getResultType() {
        switch (kind) {
            case COUNT:
            case COUNT_DISTINCT:
                return DataTypes.BIGINT().copy(false);
            case SUM:
                return DataTypes.BIGINT();
            case MIN:
            case MAX:
                return Objects.requireNonNull(argType).copy(true);
            default:
                throw new IllegalStateException("Unknown aggregate function " + kind);
        }
    }

    public Accumulator createAccumulator() {
        switch (kind) {
            case COUNT:
                return new Accumulators.CountAccumulator(isCountStar());
            case COUNT_DISTINCT:
                return new Accumulators.DistinctCountAccumulator();
            case SUM:
                return new Accumulators.SumAccumulator(getDisplayName());
            case MIN:
                return new Accumulators.MinMaxAccumulator(false);
            case MAX:
                return new Accumulators.MinMaxAccumulator(true);
            default:
                throw new IllegalStateException("Unknown aggregate function " + kind);
        }
    }

    /** The display name, which is also the output field name: {@code count(distinct a)}. */
    public String getDisplayName() {
        if (isCountStar()) {
            return "count(*)";
        }
        if (kind == AggFunctionKind.COUNT_DISTINCT) {
            return "count(distinct " + argName + ")";
        }
        return kind.getSqlName() + "(" + argName + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggCall that = (AggCall) o;
        return argIndex == that.argIndex
                && kind == that.kind
                && Objects.equals(argName, that.argName)
                && Objects.equals(argType, that.argType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argIndex, argName, argType);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
