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

import org.strata.client.exec.OperatorStats;
import org.strata.client.plan.node.PlanNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a plan tree as a text table in the layout of {@code EXPLAIN} and {@code EXPLAIN
 * ANALYZE} of distributed SQL databases:
 *
 * <pre>
 * +-----------------------+--------------+---------------------------+------------------+
 * | id                    | task         | access object             | operator info    |
 * +-----------------------+--------------+---------------------------+------------------+
 * | HashAgg_4             | root         |                           | mode:final, ...  |
 * | └─IndexReader_3       | root         |                           | index:HashAgg_2  |
 * |   └─HashAgg_2         | cop[storage] |                           | mode:partial ... |
 * |     └─IndexRangeScan_1| cop[storage] | table:orders, index:idx_a | range:[1,1], ... |
 * +-----------------------+--------------+---------------------------+------------------+
 * </pre>
 */
public final class ExplainFormatter {

    private static final String[] EXPLAIN_HEADER = {"id", "task", "access object", "operator info"};

    private static final String[] ANALYZE_HEADER = {
        "id", "actRows", "task", "access object", "execution info", "operator info"
    };

    private ExplainFormatter() {}

    public static String explain(PlanNode root) {
        List<String[]> rows = new ArrayList<>();
        visit(root, "", true, true, "", (node, id) -> rows.add(
                new String[] {
                    id,
                    node.getTaskType().getDisplayName(),
                    node.getAccessObject(),
                    node.getOperatorInfo()
                }));
        return formatTable(EXPLAIN_HEADER, rows);
    }

    /**
     * Renders the plan with the runtime statistics of its operators. Operators of coprocessor
     * tasks carry the statistics summed over all tasks; operators that never ran show zero rows.
     */
    public static String explainAnalyze(PlanNode root, Map<Integer, OperatorStats> stats) {
        List<String[]> rows = new ArrayList<>();
        visit(root, "", true, true, "", (node, id) -> {
            OperatorStats operatorStats = stats.get(node.getId());
            rows.add(
                    new String[] {
                        id,
                        operatorStats == null ? "0" : String.valueOf(operatorStats.getActRows()),
                        node.getTaskType().getDisplayName(),
                        node.getAccessObject(),
                        operatorStats == null ? "N/A" : operatorStats.getExecutionInfo(),
                        node.getOperatorInfo()
                    });
        });
        return formatTable(ANALYZE_HEADER, rows);
    }

    private static void visit(
            PlanNode node,
            String prefix,
            boolean isLast,
            boolean isRoot,
            String label,
            RowEmitter emitter) {
        String id;
        String childPrefix;
        if (isRoot) {
            id = node.getExplainId() + label;
            childPrefix = "";
        } else {
            id = prefix + (isLast ? "└─" : "├─") + node.getExplainId() + label;
            childPrefix = prefix + (isLast ? "  " : "│ ");
        }
        emitter.emit(node, id);
        List<PlanNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            visit(
                    children.get(i),
                    childPrefix,
                    i == children.size() - 1,
                    false,
                    node.getChildLabel(i),
                    emitter);
        }
    }

    static String formatTable(String[] header, List<String[]> rows) {
        int[] widths = new int[header.length];
        for (int i = 0; i < header.length; i++) {
            widths[i] = header[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }
        StringBuilder sb = new StringBuilder();
        appendSeparator(sb, widths);
        appendRow(sb, header, widths);
        appendSeparator(sb, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        appendSeparator(sb, widths);
        return sb.toString();
    }

    private static void appendSeparator(StringBuilder sb, int[] widths) {
        sb.append('+');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, String[] row, int[] widths) {
        sb.append('|');
        for (int i = 0; i < row.length; i++) {
            sb.append(' ').append(row[i]).append(" ".repeat(widths[i] - row[i].length()));
            sb.append(" |");
        }
        sb.append('\n');
    }

    @FunctionalInterface
    private interface RowEmitter {
        void emit(PlanNode node, String id);
    }
}
