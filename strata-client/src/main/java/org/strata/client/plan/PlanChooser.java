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

import org.strata.aggregate.AggCall;
import org.strata.aggregate.AggMode;
import org.strata.client.plan.node.HashAggNode;
import org.strata.client.plan.node.IndexLookUpNode;
import org.strata.client.plan.node.LimitNode;
import org.strata.client.plan.node.PlanNode;
import org.strata.client.plan.node.ProjectionNode;
import org.strata.client.plan.node.ReaderNode;
import org.strata.client.plan.node.ScanNode;
import org.strata.client.plan.node.SelectionNode;
import org.strata.client.plan.node.TaskType;
import org.strata.client.query.Aggregate;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.predicate.FieldPredicate;
import org.strata.predicate.RangeCondition;
import org.strata.predicate.Selection;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.PartialAggregation;
import org.strata.types.DataField;
import org.strata.types.RowType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses how a query runs on a table.
 *
 * <p>Every index yields a candidate path that matches the longest prefix of equality-filtered
 * index columns, followed by at most one range-filtered column. An index is covering when the
 * query references nothing but its columns and the handle; a covering index is read alone, any
 * other index is followed by row lookups. The candidate with the highest match score wins, then a
 * covering one, then the one with fewer columns, then the one declared first. An index that
 * matches no column is only a candidate when it covers the query. The table is scanned only when
 * no index is a candidate.
 *
 * <p>Filters that did not bound the key range are pushed into the coprocessor tasks when the
 * scanned rows carry their column, the rest are checked after the row lookups. An aggregation is
 * computed partially in the coprocessor tasks when pushdown is enabled, no row lookup is needed
 * and every call is decomposable.
 */
public class PlanChooser {

    private static final Logger LOG = LoggerFactory.getLogger(PlanChooser.class);

    private final TableInfo tableInfo;
    private final boolean aggregationPushdownEnabled;
    private final boolean countDistinctRewriteEnabled;

    public PlanChooser(TableInfo tableInfo, Configuration conf) {
        this.tableInfo = tableInfo;
        this.aggregationPushdownEnabled =
                conf.get(ConfigOptions.COPROCESSOR_AGGREGATION_PUSHDOWN_ENABLED);
        this.countDistinctRewriteEnabled =
                conf.get(ConfigOptions.PLANNER_COUNT_DISTINCT_REWRITE_ENABLED);
    }

    public PhysicalPlan choose(Query query) {
        QueryValidator.validate(tableInfo, query);
        Query rewritten =
                countDistinctRewriteEnabled
                        ? CountDistinctRewriter.rewrite(tableInfo, query)
                        : query;
        AccessPath accessPath = chooseAccessPath(rewritten);
        PhysicalPlan plan = new PlanBuilder(query, rewritten, accessPath).build();
        LOG.debug(
                "Chose {} for [{}] on table {}, aggregation pushed down: {}.",
                accessPath,
                rewritten,
                tableInfo.getTablePath(),
                plan.isAggregationPushedDown());
        return plan;
    }

    AccessPath chooseAccessPath(Query query) {
        Set<String> referenced = query.getReferencedColumns();
        AccessPath best = null;
        for (IndexInfo index : tableInfo.getIndexes()) {
            AccessPath candidate = matchIndex(index, query.getFilters(), referenced);
            // ties keep the index declared first
            if (candidate != null && (best == null || compare(candidate, best) < 0)) {
                best = candidate;
            }
        }
        if (best != null) {
            return best;
        }
        List<Filter> handleEqualities = new ArrayList<>(1);
        Filter handleRange = null;
        Filter handleEquality = findFilter(query.getFilters(), tableInfo.getHandleColumn(), true);
        if (handleEquality != null) {
            handleEqualities.add(handleEquality);
        } else {
            handleRange = findFilter(query.getFilters(), tableInfo.getHandleColumn(), false);
        }
        return AccessPath.table(handleEqualities, handleRange);
    }

    private @Nullable AccessPath matchIndex(
            IndexInfo index, List<Filter> filters, Set<String> referenced) {
        List<Filter> equalities = new ArrayList<>();
        Filter range = null;
        for (String column : index.getColumnNames()) {
            Filter equality = findFilter(filters, column, true);
            if (equality != null) {
                equalities.add(equality);
                continue;
            }
            range = findFilter(filters, column, false);
            break;
        }

        Set<String> available = new HashSet<>(index.getColumnNames());
        available.add(tableInfo.getHandleColumn());
        boolean covering = available.containsAll(referenced);
        if (equalities.isEmpty() && range == null && !covering) {
            return null;
        }
        return AccessPath.index(index, covering, equalities, range);
    }

    /** Negative when {@code a} is preferred over {@code b}. */
    static int compare(AccessPath a, AccessPath b) {
        int cmp = Double.compare(b.getMatchScore(), a.getMatchScore());
        if (cmp != 0) {
            return cmp;
        }
        cmp = Boolean.compare(b.isCovering(), a.isCovering());
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(
                a.getIndexInfo().getColumnNames().size(), b.getIndexInfo().getColumnNames().size());
    }

    private static @Nullable Filter findFilter(
            List<Filter> filters, String column, boolean equality) {
        for (Filter filter : filters) {
            if (filter.getColumn().equals(column) && filter.isEquality() == equality) {
                return filter;
            }
        }
        return null;
    }

    /** Builds the operator tree of one access path. */
    private final class PlanBuilder {

        private final Query query;
        private final Query rewritten;
        private final AccessPath accessPath;
        private final RowType tableRowType;
        private int nextId = 1;

        private PlanBuilder(Query query, Query rewritten, AccessPath accessPath) {
            this.query = query;
            this.rewritten = rewritten;
            this.accessPath = accessPath;
            this.tableRowType = tableInfo.getRowType();
        }

        private PhysicalPlan build() {
            List<Object> equalValues = new ArrayList<>();
            for (Filter filter : accessPath.getEqualityFilters()) {
                equalValues.add(filter.getValue());
            }
            Filter rangeFilter = accessPath.getRangeFilter();
            RangeCondition range = rangeFilter == null ? null : rangeFilter.getRangeCondition();

            CopTask task;
            ScanNode scan;
            IndexInfo index = accessPath.getIndexInfo();
            if (index != null) {
                List<KeyRange> ranges =
                        KeyRangeBuilder.indexRanges(tableInfo, index, equalValues, range);
                task = CopTask.indexScan(index, ranges);
                scan =
                        new ScanNode(
                                nextId++,
                                accessPath.isFullScan()
                                        ? ScanNode.Kind.INDEX_FULL_SCAN
                                        : ScanNode.Kind.INDEX_RANGE_SCAN,
                                task.getScanRowType(),
                                tableInfo,
                                index,
                                KeyRangeBuilder.describe(equalValues, range, true));
            } else {
                Long handle = equalValues.isEmpty() ? null : (Long) equalValues.get(0);
                List<KeyRange> ranges =
                        KeyRangeBuilder.tableRanges(tableInfo.getTableId(), handle, range);
                task = CopTask.tableScan(tableRowType, ranges);
                scan =
                        new ScanNode(
                                nextId++,
                                accessPath.isFullScan()
                                        ? ScanNode.Kind.TABLE_FULL_SCAN
                                        : ScanNode.Kind.TABLE_RANGE_SCAN,
                                tableRowType,
                                tableInfo,
                                null,
                                KeyRangeBuilder.describe(equalValues, range, false));
            }
            RowType scanRowType = task.getScanRowType();

            // filters bounding the key range are not checked again
            List<Filter> remaining = new ArrayList<>(rewritten.getFilters());
            for (Filter keyFilter : accessPath.getKeyFilters()) {
                remaining.remove(keyFilter);
            }
            List<FieldPredicate> pushed = new ArrayList<>();
            List<FieldPredicate> residual = new ArrayList<>();
            for (Filter filter : remaining) {
                int scanIndex = scanRowType.getFieldIndex(filter.getColumn());
                if (scanIndex >= 0) {
                    pushed.add(filter.bind(scanIndex));
                } else {
                    residual.add(filter.bind(tableRowType.getFieldIndex(filter.getColumn())));
                }
            }

            PlanNode copTop = scan;
            if (!pushed.isEmpty()) {
                Selection selection = Selection.of(pushed);
                task = task.withSelection(selection);
                copTop = new SelectionNode(nextId++, TaskType.COP, selection, copTop);
            }

            boolean lookup = accessPath.getKind() == AccessPath.Kind.INDEX_LOOKUP;
            if (rewritten.hasAggregation()) {
                return buildAggregation(task, copTop, scanRowType, lookup, residual);
            }

            Integer limit = rewritten.getLimit();
            if (limit != null && residual.isEmpty()) {
                task = task.withLimit(limit);
                copTop = new LimitNode(nextId++, TaskType.COP, limit, copTop);
            }
            PlanNode root = lookup ? lookUp(task, copTop) : new ReaderNode(nextId++, task, copTop);
            if (!residual.isEmpty()) {
                root = new SelectionNode(nextId++, TaskType.ROOT, Selection.of(residual), root);
            }
            if (limit != null) {
                root = new LimitNode(nextId++, TaskType.ROOT, limit, root);
            }
            RowType inputRowType = root.getOutputRowType();
            List<String> selected = rewritten.getSelectedColumns();
            int[] projection = new int[selected.size()];
            for (int i = 0; i < projection.length; i++) {
                projection[i] = inputRowType.getFieldIndex(selected.get(i));
            }
            root = project(root, projection, query.getOutputNames());
            return new PhysicalPlan(query, rewritten, accessPath, false, root);
        }

        private PhysicalPlan buildAggregation(
                CopTask task,
                PlanNode copTop,
                RowType scanRowType,
                boolean lookup,
                List<FieldPredicate> residual) {
            // rewritten calls may coincide, each distinct call is computed once
            List<Aggregate> distinctAggregates = new ArrayList<>();
            for (Aggregate aggregate : rewritten.getAggregates()) {
                if (!distinctAggregates.contains(aggregate)) {
                    distinctAggregates.add(aggregate);
                }
            }
            RowType aggInputRowType = lookup ? tableRowType : scanRowType;
            List<String> groupByColumns = rewritten.getGroupByColumns();
            int[] groupBy = new int[groupByColumns.size()];
            for (int i = 0; i < groupBy.length; i++) {
                groupBy[i] = aggInputRowType.getFieldIndex(groupByColumns.get(i));
            }
            List<AggCall> calls = new ArrayList<>(distinctAggregates.size());
            boolean decomposable = true;
            for (Aggregate aggregate : distinctAggregates) {
                AggCall call = aggregate.bind(aggInputRowType);
                decomposable &= call.getKind().isDecomposable();
                calls.add(call);
            }

            boolean pushDown = aggregationPushdownEnabled && !lookup && decomposable;
            PlanNode root;
            if (pushDown) {
                task = task.withAggregation(new PartialAggregation(groupBy, calls));
                copTop =
                        new HashAggNode(
                                nextId++,
                                TaskType.COP,
                                AggMode.PARTIAL,
                                scanRowType,
                                groupBy,
                                calls,
                                copTop);
                PlanNode reader = new ReaderNode(nextId++, task, copTop);
                root =
                        new HashAggNode(
                                nextId++,
                                TaskType.ROOT,
                                AggMode.FINAL,
                                scanRowType,
                                groupBy,
                                calls,
                                reader);
            } else {
                PlanNode input =
                        lookup ? lookUp(task, copTop) : new ReaderNode(nextId++, task, copTop);
                if (!residual.isEmpty()) {
                    input =
                            new SelectionNode(
                                    nextId++, TaskType.ROOT, Selection.of(residual), input);
                }
                root =
                        new HashAggNode(
                                nextId++,
                                TaskType.ROOT,
                                AggMode.COMPLETE,
                                aggInputRowType,
                                groupBy,
                                calls,
                                input);
            }

            Integer limit = rewritten.getLimit();
            if (limit != null) {
                root = new LimitNode(nextId++, TaskType.ROOT, limit, root);
            }

            // group values come first in the aggregation output, then one value per call
            List<String> selected = rewritten.getSelectedColumns();
            List<Aggregate> aggregates = rewritten.getAggregates();
            int[] projection = new int[selected.size() + aggregates.size()];
            for (int i = 0; i < selected.size(); i++) {
                projection[i] = groupByColumns.indexOf(selected.get(i));
            }
            for (int i = 0; i < aggregates.size(); i++) {
                projection[selected.size() + i] =
                        groupBy.length + distinctAggregates.indexOf(aggregates.get(i));
            }
            root = project(root, projection, query.getOutputNames());
            return new PhysicalPlan(query, rewritten, accessPath, pushDown, root);
        }

        private PlanNode lookUp(CopTask indexTask, PlanNode buildSide) {
            ScanNode probeSide =
                    new ScanNode(
                            nextId++,
                            ScanNode.Kind.TABLE_ROW_ID_SCAN,
                            tableRowType,
                            tableInfo,
                            null,
                            "");
            return new IndexLookUpNode(nextId++, indexTask, tableRowType, buildSide, probeSide);
        }

        private PlanNode project(PlanNode input, int[] fieldIndexes, List<String> names) {
            RowType inputRowType = input.getOutputRowType();
            List<DataField> fields = new ArrayList<>(fieldIndexes.length);
            boolean identity = fieldIndexes.length == inputRowType.getFieldCount();
            for (int i = 0; i < fieldIndexes.length; i++) {
                fields.add(new DataField(names.get(i), inputRowType.getTypeAt(fieldIndexes[i])));
                identity &=
                        fieldIndexes[i] == i
                                && names.get(i).equals(inputRowType.getFieldNames().get(i));
            }
            if (identity) {
                return input;
            }
            return new ProjectionNode(nextId++, fieldIndexes, new RowType(fields), input);
        }
    }
}
