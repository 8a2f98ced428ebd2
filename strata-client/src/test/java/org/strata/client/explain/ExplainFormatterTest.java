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

package org.strata.client.explain;

import org.strata.client.plan.PlanChooser;
import org.strata.client.plan.node.PlanNode;
import org.strata.client.query.Aggregate;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.config.Configuration;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.client.testutils.TestTables.ordersInfo;

/** Tests for {@link ExplainFormatter}. */
class ExplainFormatterTest {

    private final PlanChooser chooser = new PlanChooser(ordersInfo(), new Configuration());

    @Test
    void testFormatTable() {
        String table =
                ExplainFormatter.formatTable(
                        new String[] {"a", "bb"},
                        Collections.singletonList(new String[] {"xyz", "1"}));

        assertThat(table)
                .isEqualTo(
                        "+-----+----+\n"
                                + "| a   | bb |\n"
                                + "+-----+----+\n"
                                + "| xyz | 1  |\n"
                                + "+-----+----+\n");
    }

    @Test
    void testExplainPushedDownAggregation() {
        PlanNode root =
                chooser.choose(
                                Query.builder()
                                        .select("status")
                                        .aggregate(Aggregate.countStar())
                                        .groupBy("status")
                                        .build())
                        .getRoot();

        List<String> lines = Arrays.asList(ExplainFormatter.explain(root).split("\n"));

        assertThat(lines.get(1)).contains("id", "task", "access object", "operator info");
        assertThat(lines)
                .anySatisfy(
                        line ->
                                assertThat(line)
                                        .contains("HashAgg_4", "root", "mode:final")
                                        .contains("group by:status", "funcs:count(*)"))
                .anySatisfy(line -> assertThat(line).contains("IndexReader_3", "index:HashAgg_2"))
                .anySatisfy(
                        line ->
                                assertThat(line)
                                        .contains("└─HashAgg_2", "cop[storage]", "mode:partial"))
                .anySatisfy(
                        line ->
                                assertThat(line)
                                        .contains("└─IndexFullScan_1")
                                        .contains("table:orders, index:idx_status(status)")
                                        .contains("keep order:false"));
        // every row has the width of the table
        assertThat(lines).allSatisfy(line -> assertThat(line).hasSameSizeAs(lines.get(0)));
    }

    @Test
    void testExplainIndexLookUp() {
        String explain =
                ExplainFormatter.explain(
                        chooser.choose(
                                        Query.builder()
                                                .select("amount")
                                                .where(Filter.equal("customer", 1L))
                                                .build())
                                .getRoot());

        assertThat(explain)
                .contains("└─IndexLookUp_3")
                .contains("  ├─IndexRangeScan_1(Build)")
                .contains("  └─TableRowIDScan_2(Probe)")
                .contains("range:[1,1]")
                .contains("handle lookup");
    }

    @Test
    void testExplainAnalyzeWithoutStats() {
        PlanNode root =
                chooser.choose(
                                Query.builder()
                                        .select("id", "amount")
                                        .where(Filter.between("id", 1L, 5L))
                                        .build())
                        .getRoot();

        String explain = ExplainFormatter.explainAnalyze(root, Collections.emptyMap());

        assertThat(explain)
                .contains("actRows", "execution info")
                .contains("TableRangeScan_1")
                .contains("range:[1,5]")
                .contains("N/A");
    }
}
