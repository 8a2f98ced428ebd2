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
import org.strata.metadata.TableInfo;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.client.testutils.TestTables.ordersInfo;

/** Tests for {@link CountDistinctRewriter}. */
class CountDistinctRewriterTest {

    private final TableInfo tableInfo = ordersInfo();

    @Test
    void testDistinctHandleBecomesCountStar() {
        Query rewritten =
                CountDistinctRewriter.rewrite(
                        tableInfo,
                        Query.builder().aggregate(Aggregate.countDistinct("id")).build());

        assertThat(rewritten.getAggregates()).containsExactly(Aggregate.countStar());
        // output names follow the rewritten calls, the plan keeps the original names
        assertThat(rewritten.getOutputNames()).containsExactly("count(*)");
    }

    @Test
    void testDistinctOfNullableUniqueColumnBecomesCount() {
        Query rewritten =
                CountDistinctRewriter.rewrite(
                        tableInfo,
                        Query.builder().aggregate(Aggregate.countDistinct("email")).build());

        assertThat(rewritten.getAggregates()).containsExactly(Aggregate.count("email"));
        assertThat(rewritten.getAggregates().get(0).getKind()).isEqualTo(AggFunctionKind.COUNT);
    }

    @Test
    void testCountOfNotNullColumnBecomesCountStar() {
        Query rewritten =
                CountDistinctRewriter.rewrite(
                        tableInfo, Query.builder().aggregate(Aggregate.count("id")).build());

        assertThat(rewritten.getAggregates()).containsExactly(Aggregate.countStar());
    }

    @Test
    void testCompositeUniqueIndexNeedsTheOtherColumnsBound() {
        Query unbound = Query.builder().aggregate(Aggregate.countDistinct("ref")).build();
        Query bound =
                Query.builder()
                        .aggregate(Aggregate.countDistinct("ref"))
                        .where(Filter.equal("customer", 2L))
                        .build();

        assertThat(CountDistinctRewriter.rewrite(tableInfo, unbound)).isSameAs(unbound);
        assertThat(CountDistinctRewriter.rewrite(tableInfo, bound).getAggregates())
                .containsExactly(Aggregate.count("ref"));
        assertThat(
                        CountDistinctRewriter.isUnique(
                                tableInfo, "ref", Collections.singleton("customer")))
                .isTrue();
        assertThat(CountDistinctRewriter.isUnique(tableInfo, "ref", Collections.emptySet()))
                .isFalse();
    }

    @Test
    void testNonUniqueColumnIsKept() {
        Query query =
                Query.builder()
                        .select("customer")
                        .aggregate(Aggregate.countDistinct("status"))
                        .groupBy("customer")
                        .build();

        assertThat(CountDistinctRewriter.rewrite(tableInfo, query)).isSameAs(query);
    }

    @Test
    void testQueryWithoutAggregatesIsKept() {
        Query query = Query.builder().select("id").where(Filter.equal("status", "open")).build();

        assertThat(CountDistinctRewriter.rewrite(tableInfo, query)).isSameAs(query);
    }
}
