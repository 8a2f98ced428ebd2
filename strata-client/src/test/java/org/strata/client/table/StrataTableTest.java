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

package org.strata.client.table;

import org.strata.aggregate.AggFunctionKind;
import org.strata.client.plan.AccessPath;
import org.strata.client.query.Aggregate;
import org.strata.client.query.ExecutionStats;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.client.query.QueryResult;
import org.strata.client.table.writer.UpsertWriter;
import org.strata.client.testutils.ClientTestBase;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.exception.InvalidQueryException;
import org.strata.row.GenericRow;
import org.strata.row.InternalRow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.client.testutils.TestTables.ORDER_COUNT;
import static org.strata.client.testutils.TestTables.order;

/** Queries against a table served by a local cluster. */
class StrataTableTest extends ClientTestBase {

    private Table table;

    @BeforeEach
    void setUp() throws Exception {
        writeOrders();
        table = ordersTable();
    }

    @Test
    void testCoveringIndexQueryReadsNoRecords() {
        QueryResult result =
                table.execute(
                        Query.builder()
                                .select("id", "status")
                                .where(Filter.equal("customer", 1L))
                                .build());

        assertThat(result.getPlan().getAccessPath().getKind())
                .isEqualTo(AccessPath.Kind.INDEX_ONLY);
        assertThat(longs(result, 0)).containsExactlyInAnyOrder(1L, 5L, 9L, 13L, 17L);
        assertThat(result.getRows())
                .allSatisfy(row -> assertThat(row.getString(1)).isEqualTo("open"));
        assertThat(result.getExecutionStats().getRowLookups()).isZero();
        assertThat(result.getRowType().getFieldNames()).containsExactly("id", "status");
    }

    @Test
    void testIndexLookUp() {
        QueryResult result =
                table.execute(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.equal("customer", 1L))
                                .build());

        assertThat(result.getPlan().getAccessPath().getKind())
                .isEqualTo(AccessPath.Kind.INDEX_LOOKUP);
        Map<Long, Long> amounts = new HashMap<>();
        for (InternalRow row : result.getRows()) {
            amounts.put(row.getLong(0), row.getLong(1));
        }
        assertThat(amounts)
                .containsOnly(
                        Map.entry(1L, 10L),
                        Map.entry(5L, 50L),
                        Map.entry(9L, 90L),
                        Map.entry(13L, 130L),
                        Map.entry(17L, 170L));
        ExecutionStats stats = result.getExecutionStats();
        assertThat(stats.getRowLookups()).isEqualTo(5);
        assertThat(stats.getLookupRoundTrips()).isPositive();
    }

    @Test
    void testLookUpBatchSize() {
        Configuration oneHandlePerBatch = new Configuration(conf);
        oneHandlePerBatch.set(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE, 1);
        QueryResult result =
                new StrataTable(table.getTableInfo(), cluster, oneHandlePerBatch)
                        .execute(
                                Query.builder()
                                        .select("amount")
                                        .where(Filter.equal("customer", 1L))
                                        .build());

        assertThat(longs(result, 0)).containsExactlyInAnyOrder(10L, 50L, 90L, 130L, 170L);
        assertThat(result.getExecutionStats().getLookupRoundTrips()).isEqualTo(5);
        assertThat(result.explainAnalyze()).contains("rpc:5");
    }

    @Test
    void testResidualFilterAfterLookUp() {
        QueryResult result =
                table.execute(
                        Query.builder()
                                .select("id")
                                .where(Filter.equal("customer", 1L))
                                .where(Filter.between("amount", 100L, null))
                                .build());

        assertThat(longs(result, 0)).containsExactlyInAnyOrder(13L, 17L);
    }

    @Test
    void testPushedDownAggregationTransfersPartialsOnly() {
        Query query =
                Query.builder()
                        .select("status")
                        .aggregate(Aggregate.countStar())
                        .groupBy("status")
                        .build();

        QueryResult result = table.execute(query);

        assertThat(result.getPlan().isAggregationPushedDown()).isTrue();
        assertThat(countsByStatus(result))
                .containsOnly(Map.entry("open", 10L), Map.entry("paid", 10L));
        // at most one partial per group and bucket
        assertThat(result.getExecutionStats().getRowsTransferred())
                .isLessThanOrEqualTo(2 * BUCKETS);
        assertThat(result.getExecutionStats().getCopTasks()).isEqualTo(BUCKETS);
        assertThat(result.getExecutionStats().getBytesTransferred()).isPositive();

        Configuration noPushdown = new Configuration(conf);
        noPushdown.set(ConfigOptions.COPROCESSOR_AGGREGATION_PUSHDOWN_ENABLED, false);
        QueryResult unpushed =
                new StrataTable(table.getTableInfo(), cluster, noPushdown).execute(query);

        assertThat(unpushed.getPlan().isAggregationPushedDown()).isFalse();
        assertThat(countsByStatus(unpushed)).isEqualTo(countsByStatus(result));
        assertThat(unpushed.getExecutionStats().getRowsTransferred()).isEqualTo(ORDER_COUNT);
    }

    @Test
    void testCountStar() {
        QueryResult result =
                table.execute(Query.builder().aggregate(Aggregate.countStar()).build());

        assertThat(longs(result, 0)).containsExactly((long) ORDER_COUNT);
        assertThat(result.getExecutionStats().getRowsTransferred()).isLessThanOrEqualTo(BUCKETS);
        assertThat(result.getRowType().getFieldNames()).containsExactly("count(*)");
    }

    @Test
    void testAggregationAfterLookUp() {
        QueryResult result =
                table.execute(
                        Query.builder()
                                .select("customer")
                                .aggregate(Aggregate.sum("amount"))
                                .aggregate(Aggregate.min("amount"))
                                .aggregate(Aggregate.max("amount"))
                                .where(Filter.equal("customer", 2L))
                                .groupBy("customer")
                                .build());

        assertThat(result.getPlan().isAggregationPushedDown()).isFalse();
        assertThat(result.getRows()).hasSize(1);
        InternalRow row = result.getRows().get(0);
        assertThat(row.getLong(0)).isEqualTo(2L);
        assertThat(row.getLong(1)).isEqualTo(500L);
        assertThat(row.getLong(2)).isEqualTo(20L);
        assertThat(row.getLong(3)).isEqualTo(180L);
    }

    @Test
    void testNarrowingFilterScansNoMoreKeys() {
        long all = keysScanned(Query.builder().aggregate(Aggregate.countStar()).build());
        long customer =
                keysScanned(
                        Query.builder()
                                .aggregate(Aggregate.countStar())
                                .where(Filter.equal("customer", 1L))
                                .build());
        long customerAndStatus =
                keysScanned(
                        Query.builder()
                                .aggregate(Aggregate.countStar())
                                .where(Filter.equal("customer", 1L))
                                .where(Filter.equal("status", "open"))
                                .build());

        assertThat(customer).isLessThanOrEqualTo(all);
        assertThat(customerAndStatus).isLessThanOrEqualTo(customer);
    }

    @Test
    void testCountDistinctRewriteKeepsTheResult() {
        Query query = Query.builder().aggregate(Aggregate.countDistinct("email")).build();

        QueryResult rewritten = table.execute(query);

        Configuration noRewrite = new Configuration(conf);
        noRewrite.set(ConfigOptions.PLANNER_COUNT_DISTINCT_REWRITE_ENABLED, false);
        QueryResult original =
                new StrataTable(table.getTableInfo(), cluster, noRewrite).execute(query);

        assertThat(rewritten.getPlan().getRewrittenQuery().getAggregates().get(0).getKind())
                .isEqualTo(AggFunctionKind.COUNT);
        assertThat(original.getPlan().getRewrittenQuery().getAggregates().get(0).getKind())
                .isEqualTo(AggFunctionKind.COUNT_DISTINCT);
        // the last order has no email
        assertThat(longs(rewritten, 0)).containsExactly(ORDER_COUNT - 1L);
        assertThat(longs(original, 0)).containsExactly(ORDER_COUNT - 1L);
        assertThat(rewritten.getRowType().getFieldNames()).containsExactly("count(distinct email)");
        assertThat(rewritten.getPlan().isAggregationPushedDown()).isTrue();
        assertThat(original.getPlan().isAggregationPushedDown()).isFalse();
    }

    @Test
    void testCountDistinctOfNonUniqueColumn() {
        QueryResult result =
                table.execute(Query.builder().aggregate(Aggregate.countDistinct("status")).build());

        assertThat(longs(result, 0)).containsExactly(2L);
    }

    @Test
    void testLimit() {
        assertThat(table.execute(Query.builder().select("id").limit(3).build()).getRows())
                .hasSize(3);
        assertThat(table.execute(Query.builder().select("id").limit(0).build()).getRows())
                .isEmpty();
    }

    @Test
    void testHandleFilters() {
        QueryResult range =
                table.execute(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.between("id", 5L, 8L))
                                .build());
        QueryResult point =
                table.execute(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.equal("id", 7L))
                                .build());

        assertThat(range.getPlan().getAccessPath().getKind()).isEqualTo(AccessPath.Kind.TABLE_SCAN);
        assertThat(longs(range, 1)).containsExactlyInAnyOrder(50L, 60L, 70L, 80L);
        assertThat(range.getExecutionStats().getKeysScanned()).isEqualTo(4);
        assertThat(longs(point, 1)).containsExactly(70L);
    }

    @Test
    void testUpsertReplacesIndexEntries() throws Exception {
        UpsertWriter writer = table.newUpsertWriter();
        writer.upsert(GenericRow.of(1L, 3L, "open", 10L, "user1@example.com", 1L))
                .get();

        assertThat(idsOfCustomer(1L)).containsExactlyInAnyOrder(5L, 9L, 13L, 17L);
        assertThat(idsOfCustomer(3L)).contains(1L);
    }

    @Test
    void testDelete() throws Exception {
        table.newUpsertWriter().delete(order(2)).get();

        QueryResult count = table.execute(Query.builder().aggregate(Aggregate.countStar()).build());
        assertThat(longs(count, 0)).containsExactly(ORDER_COUNT - 1L);
        assertThat(idsOfCustomer(2L)).containsExactlyInAnyOrder(6L, 10L, 14L, 18L);
    }

    @Test
    void testExplainAnalyze() {
        Query query =
                Query.builder()
                        .select("status")
                        .aggregate(Aggregate.countStar())
                        .groupBy("status")
                        .build();

        QueryResult result = table.execute(query);

        assertThat(result.getOperatorStats().get(result.getPlan().getRoot().getId()).getActRows())
                .isEqualTo(2);
        assertThat(result.explainAnalyze())
                .contains("actRows", "execution info", "IndexReader_3", "loops:");
        assertThat(table.explain(query)).contains("HashAgg_2").doesNotContain("actRows");
    }

    @Test
    void testInvalidQuery() {
        assertThatThrownBy(() -> table.execute(Query.builder().select("price").build()))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("price");
    }

    private List<Long> idsOfCustomer(long customer) {
        return longs(
                table.execute(
                        Query.builder()
                                .select("id")
                                .where(Filter.equal("customer", customer))
                                .build()),
                0);
    }

    private long keysScanned(Query query) {
        return table.execute(query).getExecutionStats().getKeysScanned();
    }

    private static List<Long> longs(QueryResult result, int pos) {
        List<Long> values = new ArrayList<>();
        for (InternalRow row : result.getRows()) {
            values.add(row.getLong(pos));
        }
        return values;
    }

    private static Map<String, Long> countsByStatus(QueryResult result) {
        Map<String, Long> counts = new HashMap<>();
        for (InternalRow row : result.getRows()) {
            counts.put(row.getString(0), row.getLong(1));
        }
        return counts;
    }
}
