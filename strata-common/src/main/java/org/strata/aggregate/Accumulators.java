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

import org.strata.exception.NumericOverflowException;
import org.strata.row.ValueComparator;

import javax.annotation.Nullable;

import java.util.HashSet;
import java.util.Set;

/** The {@link Accumulator}s of the supported aggregate functions. */
final class Accumulators {

    private Accumulators() {}

    /** COUNT(*) counts rows, COUNT(col) counts non-null values. Partial state: the count. */
    static final class CountAccumulator implements Accumulator {
        private final boolean countStar;
        private long count;

        CountAccumulator(boolean countStar) {
            this.countStar = countStar;
        }

        @Override
        public void add(@Nullable Object value) {
            if (countStar || value != null) {
                count++;
            }
        }

        @Override
        public void merge(@Nullable Object partialState) {
            if (partialState != null) {
                count += (Long) partialState;
            }
        }

        @Override
        public Object partial() {
            return count;
        }

        @Override
        public Object result() {
            return count;
        }
    }

    /** SUM over BIGINT, NULL when no non-null value was seen. */
    static final class SumAccumulator implements Accumulator {
        private final String callName;
        private @Nullable Long sum;

        SumAccumulator(String callName) {
            this.callName = callName;
        }

        @Override
        public void add(@Nullable Object value) {
            if (value == null) {
                return;
            }
            if (sum == null) {
                sum = (Long) value;
                return;
            }
            try {
                sum = Math.addExact(sum, (Long) value);
            } catch (ArithmeticException e) {
                throw new NumericOverflowException(
                        "BIGINT value is out of range in " + callName + ".", e);
            }
        }

        @Override
        public void merge(@Nullable Object partialState) {
            add(partialState);
        }

        @Override
        public @Nullable Object partial() {
            return sum;
        }

        @Override
        public @Nullable Object result() {
            return sum;
        }
    }

    /** MIN or MAX, NULL when no non-null value was seen. */
    static final class MinMaxAccumulator implements Accumulator {
        private final boolean max;
        private @Nullable Object current;

        MinMaxAccumulator(boolean max) {
            this.max = max;
        }

        @Override
        public void add(@Nullable Object value) {
            if (value == null) {
                return;
            }
            if (current == null) {
                current = value;
                return;
            }
            int cmp = ValueComparator.INSTANCE.compare(value, current);
            if (max ? cmp > 0 : cmp < 0) {
                current = value;
            }
        }

        @Override
        public void merge(@Nullable Object partialState) {
            add(partialState);
        }

        @Override
        public @Nullable Object partial() {
            return current;
        }

        @Override
        public @Nullable Object result() {
            return current;
        }
    }

    /** COUNT(DISTINCT col). Needs all values, so it has no partial state. */
    static final class DistinctCountAccumulator implements Accumulator {
        private final Set<Object> seen = new HashSet<>();

        @Override
        public void add(@Nullable Object value) {
            if (value != null) {
                seen.add(value);
            }
        }

        @Override
        public void merge(@Nullable Object partialState) {
            throw new UnsupportedOperationException("count(distinct) cannot merge partial states");
        }

        @Override
        public Object partial() {
            throw new UnsupportedOperationException("count(distinct) has no partial state");
        }

        @Override
        public Object result() {
            return (long) seen.size();
        }
    }
}
