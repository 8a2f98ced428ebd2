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

package org.strata.server.coprocessor;

import org.strata.aggregate.AggMode;
import org.strata.aggregate.HashAggregator;
import org.strata.predicate.Selection;
import org.strata.row.InternalRow;
import org.strata.row.encode.RowEncoder;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.PartialAggregation;
import org.strata.rpc.messages.ScanStatistics;
import org.strata.server.kv.KvTablet;
import org.strata.server.kv.rocksdb.RocksDBKv;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes a {@link CoprocessorRequest} on the tablet of its bucket.
 *
 * <p>The ranges are scanned in order. Every entry is decoded into a row of the scan row type and
 * tested against the pushed-down selection. Matching rows are either returned, stopping once the
 * limit is reached, or fed into a partial aggregation whose partial rows are returned instead.
 */
public class CoprocessorHandler {

    public CoprocessorResponse handle(KvTablet tablet, CoprocessorRequest request) {
        long startNanos = System.nanoTime();
        TaskExecution execution = new TaskExecution(request);
        Integer limit = request.getLimit();
        if (limit == null || limit > 0) {
            for (KeyRange range : request.getRanges()) {
                execution.keysScanned += tablet.scan(range, execution);
                if (execution.limitReached()) {
                    break;
                }
            }
        }
        execution.finish();
        ScanStatistics statistics =
                new ScanStatistics(
                        execution.keysScanned,
                        execution.rowsMatched,
                        execution.output.size(),
                        execution.bytesReturned,
                        System.nanoTime() - startNanos);
        return new CoprocessorResponse(execution.output, statistics);
    }

    /** The state of one task, also the visitor of its scans. */
    private static final class TaskExecution implements RocksDBKv.KvVisitor {

        private final ScanRowDecoder decoder;
        private final Selection selection;
        private final @Nullable Integer limit;
        private final @Nullable HashAggregator aggregator;
        private final RowEncoder outputEncoder;
        private final List<byte[]> output = new ArrayList<>();

        private long keysScanned;
        private long rowsMatched;
        private long bytesReturned;

        private TaskExecution(CoprocessorRequest request) {
            this.decoder = ScanRowDecoder.of(request);
            this.selection = request.getSelection();
            this.limit = request.getLimit();
            PartialAggregation aggregation = request.getAggregation();
            if (aggregation == null) {
                this.aggregator = null;
                this.outputEncoder = new RowEncoder(request.getScanRowType());
            } else {
                this.aggregator =
                        new HashAggregator(
                                aggregation.getGroupByIndexes(),
                                aggregation.getAggCalls(),
                                AggMode.PARTIAL);
                this.outputEncoder =
                        new RowEncoder(
                                HashAggregator.outputRowType(
                                        request.getScanRowType(),
                                        aggregation.getGroupByIndexes(),
                                        aggregation.getAggCalls()));
            }
        }

        @Override
        public boolean visit(byte[] key, byte[] value) {
            InternalRow row = decoder.decode(key, value);
            if (!selection.test(row)) {
                return true;
            }
            rowsMatched++;
            if (aggregator != null) {
                aggregator.addRow(row);
                return true;
            }
            emit(row);
            return !limitReached();
        }

        private void emit(InternalRow row) {
            byte[] encoded = outputEncoder.encode(row);
            output.add(encoded);
            bytesReturned += encoded.length;
        }

        private boolean limitReached() {
            return limit != null && output.size() >= limit;
        }

        private void finish() {
            if (aggregator != null) {
                for (InternalRow partialRow : aggregator.getOutput()) {
                    emit(partialRow);
                }
            }
        }
    }
}
