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

package org.strata.client.exec;

import org.strata.client.plan.CopTask;
import org.strata.client.plan.node.IndexLookUpNode;
import org.strata.metadata.TableBucket;
import org.strata.row.InternalRow;
import org.strata.row.decode.RowDecoder;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.utils.concurrent.FutureUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads rows through a non-covering index. The index-side coprocessor tasks return index rows
 * whose last field is the handle. The handles are grouped by bucket, split into batches of
 * {@code client.lookup.batch-size} and looked up with at most {@code client.lookup.concurrency}
 * batches in flight. Handles whose record is gone are skipped.
 */
public class IndexLookUpExecutor extends AbstractExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(IndexLookUpExecutor.class);

    private final IndexLookUpNode lookUpNode;
    private Iterator<InternalRow> rows;

    public IndexLookUpExecutor(ExecutionContext context, IndexLookUpNode lookUpNode) {
        super(context, lookUpNode);
        this.lookUpNode = lookUpNode;
    }

    @Override
    protected void doOpen() {
        CoprocessorDispatcher dispatcher = context.getDispatcher();
        CopTask indexTask = lookUpNode.getIndexTask();
        List<CoprocessorResponse> responses =
                FutureUtils.getUninterruptibly(dispatcher.dispatch(indexTask));

        RowDecoder indexRowDecoder = new RowDecoder(indexTask.getOutputRowType());
        int handlePosition = indexTask.getScanRowType().getFieldCount() - 1;
        CopTaskStats indexStats = new CopTaskStats();
        Map<TableBucket, List<Long>> handlesByBucket = new LinkedHashMap<>();
        for (CoprocessorResponse response : responses) {
            context.getStatsCollector().recordCopTask(response.getStatistics());
            indexStats.add(response);
            for (byte[] indexRow : response.getRows()) {
                long handle = indexRowDecoder.decode(indexRow).getLong(handlePosition);
                handlesByBucket
                        .computeIfAbsent(dispatcher.bucketOf(handle), b -> new ArrayList<>())
                        .add(handle);
            }
        }
        indexStats.recordTo(context, lookUpNode.getBuildNodes());

        List<LookupBatch> batches = new ArrayList<>();
        int batchSize = context.getLookupBatchSize();
        for (Map.Entry<TableBucket, List<Long>> entry : handlesByBucket.entrySet()) {
            LookupBatch batch = null;
            for (long handle : entry.getValue()) {
                if (batch == null || batch.size() >= batchSize) {
                    batch = new LookupBatch(entry.getKey());
                    batches.add(batch);
                }
                batch.addHandle(handle);
            }
        }

        RowDecoder rowDecoder = new RowDecoder(lookUpNode.getOutputRowType());
        List<InternalRow> found = new ArrayList<>();
        Deque<LookupBatch> inFlight = new ArrayDeque<>();
        int concurrency = context.getLookupConcurrency();
        long handles = 0;
        for (LookupBatch batch : batches) {
            if (inFlight.size() >= concurrency) {
                collect(inFlight.poll(), rowDecoder, found);
            }
            dispatcher.lookup(batch);
            inFlight.add(batch);
            handles += batch.size();
        }
        while (!inFlight.isEmpty()) {
            collect(inFlight.poll(), rowDecoder, found);
        }

        OperatorStats probeStats = context.getOperatorStats(lookUpNode.getProbeNode());
        probeStats.addRows(found.size());
        probeStats.addLoops(batches.size());
        stats.putDetail("index_task", indexStats.describe());
        stats.putDetail(
                "table_task",
                "{lookups:"
                        + handles
                        + ", rpc:"
                        + batches.size()
                        + ", concurrency:"
                        + concurrency
                        + "}");
        if (handles > found.size()) {
            LOG.debug(
                    "{} of {} handles of {} had no record.",
                    handles - found.size(),
                    handles,
                    lookUpNode.getExplainId());
        }
        this.rows = found.iterator();
    }

    private void collect(LookupBatch batch, RowDecoder rowDecoder, List<InternalRow> found) {
        List<byte[]> values = FutureUtils.getUninterruptibly(batch.future());
        long rows = 0;
        long bytes = 0;
        for (byte[] value : values) {
            if (value == null) {
                continue;
            }
            found.add(rowDecoder.decode(value));
            rows++;
            bytes += value.length;
        }
        context.getStatsCollector().recordLookup(batch.size(), rows, bytes);
    }

    @Override
    protected @Nullable InternalRow doNext() {
        return rows.hasNext() ? rows.next() : null;
    }
}
