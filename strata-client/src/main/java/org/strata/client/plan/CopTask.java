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

import org.strata.aggregate.HashAggregator;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableBucket;
import org.strata.predicate.Selection;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.PartialAggregation;
import org.strata.rpc.messages.ScanType;
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The part of a plan sent to every bucket of a table: what to scan and what to compute on the
 * scanned rows before returning them. It becomes one {@link CoprocessorRequest} per bucket.
 */
public final class CopTask {

    private final ScanType scanType;
    private final @Nullable IndexInfo indexInfo;
    private final RowType scanRowType;
    private final List<KeyRange> ranges;
    private final Selection selection;
    private final @Nullable Integer limit;
    private final @Nullable PartialAggregation aggregation;

    private CopTask(
            ScanType scanType,
            @Nullable IndexInfo indexInfo,
            RowType scanRowType,
            List<KeyRange> ranges,
            Selection selection,
            @Nullable Integer limit,
            @Nullable PartialAggregation aggregation) {
        this.scanType = scanType;
        this.indexInfo = indexInfo;
        this.scanRowType = scanRowType;
        this.ranges = Collections.unmodifiableList(ranges);
        this.selection = selection;
        this.limit = limit;
        this.aggregation = aggregation;
    }

    public static CopTask tableScan(RowType tableRowType, List<KeyRange> ranges) {
        return new CopTask(
                ScanType.TABLE, null, tableRowType, ranges, Selection.alwaysTrue(), null, null);
    }

    public static CopTask indexScan(IndexInfo indexInfo, List<KeyRange> ranges) {
        return new CopTask(
                ScanType.INDEX,
                indexInfo,
                indexInfo.getIndexRowType(),
                ranges,
                Selection.alwaysTrue(),
                null,
                null);
    }

    public CopTask withSelection(Selection newSelection) {
        return new CopTask(
                scanType, indexInfo, scanRowType, ranges, newSelection, limit, aggregation);
    }

    public CopTask withLimit(int newLimit) {
        return new CopTask(
                scanType, indexInfo, scanRowType, ranges, selection, newLimit, aggregation);
    }

    public CopTask withAggregation(PartialAggregation newAggregation) {
        return new CopTask(
                scanType, indexInfo, scanRowType, ranges, selection, limit, newAggregation);
    }

    public ScanType getScanType() {
        return scanType;
    }

    public @Nullable IndexInfo getIndexInfo() {
        return indexInfo;
    }

    public RowType getScanRowType() {
        return scanRowType;
    }

    public List<KeyRange> getRanges() {
        return ranges;
    }

    public Selection getSelection() {
        return selection;
    }

    public @Nullable Integer getLimit() {
        return limit;
    }

    public @Nullable PartialAggregation getAggregation() {
        return aggregation;
    }

    /** Whether no key can be in range, so no bucket needs to be asked. */
    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /** The row type of the returned rows: scanned rows, or partial rows when aggregating. */
    public RowType getOutputRowType() {
        if (aggregation == null) {
            return scanRowType;
        }
        return HashAggregator.outputRowType(
                scanRowType, aggregation.getGroupByIndexes(), aggregation.getAggCalls());
    }

    public CoprocessorRequest toRequest(TableBucket tableBucket) {
        CoprocessorRequest.Builder builder =
                CoprocessorRequest.builder()
                        .tableBucket(tableBucket)
                        .ranges(ranges)
                        .selection(selection)
                        .limit(limit)
                        .aggregation(aggregation);
        if (scanType == ScanType.INDEX) {
            builder.indexScan(indexInfo.getIndexId(), scanRowType);
        } else {
            builder.tableScan(scanRowType);
        }
        return builder.build();
    }
}
