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

import org.strata.aggregate.AggMode;
import org.strata.client.plan.node.HashAggNode;
import org.strata.client.plan.node.IndexLookUpNode;
import org.strata.client.plan.node.PlanNode;
import org.strata.client.plan.node.ReaderNode;
import org.strata.client.plan.node.TaskType;
import org.strata.client.query.Aggregate;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.TableInfo;
import org.strata.predicate.RangeCondition;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.client.testutils.TestTables.index;
import static org.strata.client.testutils.TestTables.ordersInfo;

/** Tests for {@link PlanChooser}. */
class PlanChooserTest {

    private final TableInfo tableInfo = ordersInfo();
    private final PlanChooser chooser = new PlanChooser(tableInfo, new Configuration());

    @Test
    void testCoveringIndexIsReadWithoutLookups() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id", "status")
                                .where(Filter.equal("customer", 1L))
                                .build());

        assertThat(plan.getAccessPath().getKind()).isEqualTo(AccessPath.Kind.INDEX_ONLY);
        assertThat(plan.getAccessPath().getIndexInfo().getIndexName())
                .isEqualTo("idx_customer_status");
        assertThat(collect(plan.getRoot())).noneMatch(node -> node instanceof IndexLookUpNode);
        assertThat(plan.getRoot().getOutputRowType().getFieldNames())
                .containsExactly("id", "status");
    }

    @Test
    void testNonCoveringIndexIsFollowedByLookups() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.equal("customer", 1L))
                                .build());

        assertThat(plan.getAccessPath().getKind()).isEqualTo(AccessPath.Kind.INDEX_LOOKUP);
        assertThat(collect(plan.getRoot())).anyMatch(node -> node instanceof IndexLookUpNode);
    }

    @Test
    void testResidualFilterRunsAboveTheLookup() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id")
                                .where(Filter.equal("customer", 1L))
                                .where(Filter.between("amount", 100L, null))
                                .build());

        List<PlanNode> nodes = collect(plan.getRoot());
        PlanNode selection =
                nodes.stream()
                        .filter(node -> node.getOperatorName().equals("Selection"))
                        .findFirst()
                        .orElseThrow(AssertionError::new);
        assertThat(selection.getTaskType()).isEqualTo(TaskType.ROOT);
        assertThat(selection.getChildren().get(0)).isInstanceOf(IndexLookUpNode.class);
    }

    @Test
    void testFilterOnIndexedColumnIsPushedIntoTheIndexScan() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id")
                                .where(Filter.equal("customer", 2L))
                                .where(Filter.between("status", "a", "m"))
                                .build());

        assertThat(plan.getAccessPath().getIndexInfo().getIndexName())
                .isEqualTo("idx_customer_status");
        assertThat(plan.getAccessPath().getKeyFilters()).hasSize(2);
        assertThat(collect(plan.getRoot()))
                .noneMatch(node -> node.getOperatorName().equals("Selection"));
    }

    @Test
    void testDecomposableAggregationIsPushedDown() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("status")
                                .aggregate(Aggregate.countStar())
                                .aggregate(Aggregate.max("id"))
                                .groupBy("status")
                                .build());

        assertThat(plan.isAggregationPushedDown()).isTrue();
        assertThat(plan.getAccessPath().getIndexInfo().getIndexName()).isEqualTo("idx_status");
        List<HashAggNode> aggs = new ArrayList<>();
        for (PlanNode node : collect(plan.getRoot())) {
            if (node instanceof HashAggNode) {
                aggs.add((HashAggNode) node);
            }
        }
        assertThat(aggs).hasSize(2);
        assertThat(aggs.get(0).getMode()).isEqualTo(AggMode.FINAL);
        assertThat(aggs.get(0).getTaskType()).isEqualTo(TaskType.ROOT);
        assertThat(aggs.get(1).getMode()).isEqualTo(AggMode.PARTIAL);
        assertThat(aggs.get(1).getTaskType()).isEqualTo(TaskType.COP);
        assertThat(aggs.get(0).getChildren().get(0)).isInstanceOf(ReaderNode.class);
    }

    @Test
    void testAggregationOverLookupsIsNotPushedDown() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .aggregate(Aggregate.sum("amount"))
                                .where(Filter.equal("customer", 1L))
                                .build());

        assertThat(plan.isAggregationPushedDown()).isFalse();
        List<PlanNode> aggs = new ArrayList<>();
        for (PlanNode node : collect(plan.getRoot())) {
            if (node instanceof HashAggNode) {
                aggs.add(node);
            }
        }
        assertThat(aggs).hasSize(1);
        assertThat(((HashAggNode) aggs.get(0)).getMode()).isEqualTo(AggMode.COMPLETE);
        assertThat(aggs.get(0).getChildren().get(0)).isInstanceOf(IndexLookUpNode.class);
    }

    @Test
    void testCountDistinctIsNotPushedDown() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder().aggregate(Aggregate.countDistinct("status")).build());

        assertThat(plan.getAccessPath().isCovering()).isTrue();
        assertThat(plan.isAggregationPushedDown()).isFalse();
    }

    @Test
    void testPushdownCanBeDisabled() {
        Configuration conf = new Configuration();
        conf.set(ConfigOptions.COPROCESSOR_AGGREGATION_PUSHDOWN_ENABLED, false);
        PhysicalPlan plan =
                new PlanChooser(tableInfo, conf)
                        .choose(Query.builder().aggregate(Aggregate.countStar()).build());

        assertThat(plan.isAggregationPushedDown()).isFalse();
    }

    @Test
    void testTableIsScannedWhenNoIndexQualifies() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.between("amount", 10L, 50L))
                                .build());

        assertThat(plan.getAccessPath().getKind()).isEqualTo(AccessPath.Kind.TABLE_SCAN);
        assertThat(plan.getAccessPath().isFullScan()).isTrue();
        assertThat(collect(plan.getRoot()))
                .anyMatch(node -> node.getOperatorName().equals("TableFullScan"));
    }

    @Test
    void testHandleRangeBoundsTheTableScan() {
        PhysicalPlan plan =
                chooser.choose(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.between("id", 5L, 8L))
                                .build());

        assertThat(plan.getAccessPath().getKind()).isEqualTo(AccessPath.Kind.TABLE_SCAN);
        assertThat(plan.getAccessPath().getRangeFilter()).isNotNull();
        assertThat(collect(plan.getRoot()))
                .anyMatch(node -> node.getOperatorName().equals("TableRangeScan"));
    }

    @Test
    void testHigherMatchScoreWins() {
        AccessPath path =
                chooser.chooseAccessPath(
                        Query.builder()
                                .select("id")
                                .where(Filter.equal("customer", 1L))
                                .where(Filter.equal("status", "open"))
                                .build());

        assertThat(path.getIndexInfo().getIndexName()).isEqualTo("idx_customer_status");
        assertThat(path.getMatchScore()).isEqualTo(2.0);
    }

    @Test
    void testCoveringIndexWithFewerColumnsWinsWhenNothingMatches() {
        AccessPath path =
                chooser.chooseAccessPath(Query.builder().aggregate(Aggregate.countStar()).build());

        // uk_email and idx_status tie on every criterion, uk_email is declared first
        assertThat(path.getKind()).isEqualTo(AccessPath.Kind.INDEX_ONLY);
        assertThat(path.getIndexInfo().getIndexName()).isEqualTo("uk_email");
    }

    @Test
    void testCompareRanksScoreThenCoveringThenWidth() {
        AccessPath equality =
                AccessPath.index(
                        index(tableInfo, "idx_customer_status"),
                        false,
                        Collections.singletonList(Filter.equal("customer", 1L)),
                        null);
        AccessPath range =
                AccessPath.index(
                        index(tableInfo, "idx_status"),
                        true,
                        Collections.emptyList(),
                        Filter.range(RangeCondition.greaterThan("status", "a")));
        AccessPath narrowCovering =
                AccessPath.index(
                        index(tableInfo, "idx_status"), true, Collections.emptyList(), null);
        AccessPath wideCovering =
                AccessPath.index(
                        index(tableInfo, "idx_customer_status"),
                        true,
                        Collections.emptyList(),
                        null);
        AccessPath wideLookup =
                AccessPath.index(
                        index(tableInfo, "uk_customer_ref"),
                        false,
                        Collections.emptyList(),
                        null);

        assertThat(PlanChooser.compare(equality, range)).isNegative();
        assertThat(PlanChooser.compare(range, narrowCovering)).isNegative();
        assertThat(PlanChooser.compare(wideCovering, wideLookup)).isNegative();
        assertThat(PlanChooser.compare(narrowCovering, wideCovering)).isNegative();
        assertThat(PlanChooser.compare(wideCovering, wideCovering)).isZero();
    }

    @Test
    void testPlansOfTheSameQueryAreIdentical() {
        Query query =
                Query.builder()
                        .select("id", "amount")
                        .where(Filter.equal("customer", 3L))
                        .limit(2)
                        .build();

        assertThat(chooser.choose(query).getAccessPath().toString())
                .isEqualTo(chooser.choose(query).getAccessPath().toString());
        assertThat(collect(chooser.choose(query).getRoot()).toString())
                .isEqualTo(collect(chooser.choose(query).getRoot()).toString());
    }

    /** The nodes of the tree, parents before children. */
    private static List<PlanNode> collect(PlanNode root) {
        List<PlanNode> nodes = new ArrayList<>();
        nodes.add(root);
        for (PlanNode child : root.getChildren()) {
            nodes.addAll(collect(child));
        }
        return nodes;
    }
}
