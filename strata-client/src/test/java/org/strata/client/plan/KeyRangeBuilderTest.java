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

import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.predicate.RangeCondition;
import org.strata.row.encode.IndexKeyEncoder;
import org.strata.row.encode.TableCodec;
import org.strata.rpc.messages.KeyRange;
import org.strata.utils.BytesUtils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.client.testutils.TestTables.index;
import static org.strata.client.testutils.TestTables.order;
import static org.strata.client.testutils.TestTables.ordersInfo;

/** Tests for {@link KeyRangeBuilder}. */
class KeyRangeBuilderTest {

    private final TableInfo tableInfo = ordersInfo();
    private final IndexInfo customerRef = index(tableInfo, "uk_customer_ref");
    private final IndexKeyEncoder encoder = new IndexKeyEncoder(tableInfo, customerRef);

    @Test
    void testEqualityPrefix() {
        List<KeyRange> ranges =
                KeyRangeBuilder.indexRanges(
                        tableInfo, customerRef, Collections.singletonList(1L), null);

        assertThat(ranges).containsExactly(KeyRange.prefix(encoder.encodePrefix(1L)));
        assertThat(contains(ranges, encoder.encodeKey(order(5)))).isTrue();
        assertThat(contains(ranges, encoder.encodeKey(order(6)))).isFalse();
    }

    @Test
    void testRangeAfterEqualityPrefix() {
        // customer 1 holds refs 1, 5, 9, 13 and 17
        List<KeyRange> ranges =
                KeyRangeBuilder.indexRanges(
                        tableInfo,
                        customerRef,
                        Collections.singletonList(1L),
                        RangeCondition.between("ref", 5L, 13L, false, true));

        assertThat(ranges).hasSize(1);
        assertThat(contains(ranges, encoder.encodeKey(order(5)))).isFalse();
        assertThat(contains(ranges, encoder.encodeKey(order(9)))).isTrue();
        assertThat(contains(ranges, encoder.encodeKey(order(13)))).isTrue();
        assertThat(contains(ranges, encoder.encodeKey(order(17)))).isFalse();
    }

    @Test
    void testOpenLowerBoundSkipsNulls() {
        IndexInfo email = index(tableInfo, "uk_email");
        IndexKeyEncoder emailEncoder = new IndexKeyEncoder(tableInfo, email);
        List<KeyRange> ranges =
                KeyRangeBuilder.indexRanges(
                        tableInfo,
                        email,
                        Collections.emptyList(),
                        RangeCondition.lessThan("email", "zzz"));

        assertThat(contains(ranges, emailEncoder.encodeKey(order(1)))).isTrue();
        // the last order has a null email
        assertThat(contains(ranges, emailEncoder.encodeKey(order(20)))).isFalse();
    }

    @Test
    void testEmptyRange() {
        assertThat(
                        KeyRangeBuilder.indexRanges(
                                tableInfo,
                                customerRef,
                                Collections.singletonList(1L),
                                RangeCondition.between("ref", 9L, 5L)))
                .isEmpty();
        assertThat(
                        KeyRangeBuilder.tableRanges(
                                tableInfo.getTableId(),
                                null,
                                RangeCondition.between("id", 3L, 3L, false, false)))
                .isEmpty();
    }

    @Test
    void testTableRanges() {
        long tableId = tableInfo.getTableId();
        assertThat(KeyRangeBuilder.tableRanges(tableId, 7L, null))
                .containsExactly(KeyRange.prefix(TableCodec.recordKey(tableId, 7L)));
        assertThat(KeyRangeBuilder.tableRanges(tableId, null, null))
                .containsExactly(KeyRange.prefix(TableCodec.recordPrefix(tableId)));

        List<KeyRange> ranges =
                KeyRangeBuilder.tableRanges(tableId, null, RangeCondition.between("id", 5L, 8L));
        for (long handle : Arrays.asList(4L, 5L, 8L, 9L)) {
            assertThat(contains(ranges, TableCodec.recordKey(tableId, handle)))
                    .as("handle %s", handle)
                    .isEqualTo(handle >= 5L && handle <= 8L);
        }
    }

    @Test
    void testDescribe() {
        assertThat(KeyRangeBuilder.describe(Collections.emptyList(), null, true))
                .isEqualTo("[-inf,+inf]");
        assertThat(KeyRangeBuilder.describe(Collections.singletonList("a"), null, true))
                .isEqualTo("[\"a\",\"a\"]");
        assertThat(
                        KeyRangeBuilder.describe(
                                Collections.singletonList(1L),
                                RangeCondition.between("b", 10L, 20L, true, false),
                                true))
                .isEqualTo("[1 10,1 20)");
        assertThat(
                        KeyRangeBuilder.describe(
                                Collections.emptyList(), RangeCondition.lessThan("b", 5L), true))
                .isEqualTo("(NULL,5)");
        assertThat(
                        KeyRangeBuilder.describe(
                                Collections.emptyList(),
                                RangeCondition.greaterThan("id", 5L),
                                false))
                .isEqualTo("(5,+inf]");
    }

    private static boolean contains(List<KeyRange> ranges, byte[] key) {
        for (KeyRange range : ranges) {
            if (BytesUtils.compare(key, range.getStart()) >= 0 && range.beforeEnd(key)) {
                return true;
            }
        }
        return false;
    }
}
