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

import org.strata.row.InternalRow;
import org.strata.row.ValueComparator;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * A predicate on one field of a row, bound to the position of the field in the row type it is
 * evaluated against. The field name is kept for plan output only.
 */
public abstract class FieldPredicate implements Predicate {

    private static final long serialVersionUID = 1L;

    protected final int fieldIndex;
    protected final String fieldName;

    protected FieldPredicate(int fieldIndex, String fieldName) {
        this.fieldIndex = fieldIndex;
        this.fieldName = Objects.requireNonNull(fieldName);
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    public String getFieldName() {
        return fieldName;
    }

    /** Returns a predicate with the same condition, bound to another field position. */
    public abstract FieldPredicate rebind(int newFieldIndex);

    public static FieldPredicate equal(int fieldIndex, String fieldName, Object value) {
        return new EqualTo(fieldIndex, fieldName, value);
    }

    public static FieldPredicate inRange(int fieldIndex, RangeCondition condition) {
        return new InRange(fieldIndex, condition);
    }

    /** {@code field = value}; a NULL field never matches. */
    public static final class EqualTo extends FieldPredicate {

        private static final long serialVersionUID = 1L;

        private final Object value;

        EqualTo(int fieldIndex, String fieldName, Object value) {
            super(fieldIndex, fieldName);
            this.value = Objects.requireNonNull(value, "Equality value cannot be null");
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean test(InternalRow row) {
            @Nullable Object fieldValue = row.getField(fieldIndex);
            return fieldValue != null && ValueComparator.INSTANCE.compare(fieldValue, value) == 0;
        }

        @Override
        public FieldPredicate rebind(int newFieldIndex) {
            return new EqualTo(newFieldIndex, fieldName, value);
        }

        @Override
        public String toString() {
            return "eq(" + fieldName + ", " + value + ")";
        }
    }

    /** {@code field} within a {@link RangeCondition}. */
    public static final class InRange extends FieldPredicate {

        private static final long serialVersionUID = 1L;

        private final RangeCondition condition;

        InRange(int fieldIndex, RangeCondition condition) {
            super(fieldIndex, condition.getColumn());
            this.condition = condition;
        }

        public RangeCondition getCondition() {
            return condition;
        }

        @Override
        public boolean test(InternalRow row) {
            return condition.test(row.getField(fieldIndex));
        }

        @Override
        public FieldPredicate rebind(int newFieldIndex) {
            return new InRange(newFieldIndex, condition);
        }

        @Override
        public String toString() {
            return "in(" + fieldName + ", " + condition.toIntervalString() + ")";
        }
    }
}
