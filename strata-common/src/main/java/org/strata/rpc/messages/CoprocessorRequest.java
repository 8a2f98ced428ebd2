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

package org.strata.rpc.messages;

import org.strata.metadata.TableBucket;
import org.strata.predicate.Selection;
import org.strata.types.RowType;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.strata.utils.Preconditions.checkArgument;
import static org.strata.utils.Preconditions.checkNotNull;

/**
 * A task for one bucket: scan the key ranges in order, decode each entry into a row of the scan
 * row type, keep the rows passing the selection, and either return them (up to the limit) or
 * aggregate them partially and return the partial rows.
 */
public final class CoprocessorRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TableBucket tableBucket;
    private final ScanType scanType;
    private final long indexId;
    private final RowType scanRowType;
    private final List<KeyRange> ranges;
    private final Selection selection;
    private final @Nullable Integer limit;
    private final @Nullable PartialAggregation aggregation;

    private CoprocessorRequest(Builder builder) {
        this.tableBucket = checkNotNull(builder.tableBucket, "table bucket must be set");
        this.scanType = checkNotNull(builder.scanType, "scan type must be set");
        this.indexId = builder.indexId;
        this.scanRowType = checkNotNull(builder.scanRowType, "scan row type must be set");
        this.ranges = Collections.unmodifiableList(new ArrayList<>(builder.ranges));
        this.selection = builder.selection;
        this.limit = builder.limit;
        this.aggregation = builder.aggregation;
        checkArgument(
                limit == null || aggregation == null,
                "A partial aggregation task cannot carry a limit.");
    }

    public static Builder builder() {
        return new Builder();
    }

    public TableBucket getTableBucket() {
        return tableBucket;
    }

    public ScanType getScanType() {
        return scanType;
    }

    public long getIndexId() {
        return indexId;
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

    /** Builder of {@link CoprocessorRequest}. */
    public static final class Builder {
        private TableBucket tableBucket;
        private ScanType scanType;
        private long indexId = -1L;
        private RowType scanRowType;
        private final List<KeyRange> ranges = new ArrayList<>();
        private Selection selection = Selection.alwaysTrue();
        private @Nullable Integer limit;
        private @Nullable PartialAggregation aggregation;

        public Builder tableBucket(TableBucket tableBucket) {
            this.tableBucket = tableBucket;
            return this;
        }

        public Builder tableScan(RowType tableRowType) {
            this.scanType = ScanType.TABLE;
            this.scanRowType = tableRowType;
            return this;
        }

        public Builder indexScan(long indexId, RowType indexRowType) {
            this.scanType = ScanType.INDEX;
            this.indexId = indexId;
            this.scanRowType = indexRowType;
            return this;
        }

        public Builder ranges(List<KeyRange> ranges) {
            this.ranges.addAll(ranges);
            return this;
        }

        public Builder selection(Selection selection) {
            this.selection = selection;
            return this;
        }

        public Builder limit(@Nullable Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder aggregation(@Nullable PartialAggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public CoprocessorRequest build() {
            return new CoprocessorRequest(this);
        }
    }
}
