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
import org.strata.client.plan.node.ReaderNode;
import org.strata.row.InternalRow;
import org.strata.row.decode.RowDecoder;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.utils.concurrent.FutureUtils;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Runs the coprocessor task of a table reader or an index reader on every bucket and returns the
 * rows the tasks sent back: scanned rows, or partial aggregation rows.
 */
public class ReaderExecutor extends AbstractExecutor {

    private final ReaderNode readerNode;
    private Iterator<InternalRow> rows;

    public ReaderExecutor(ExecutionContext context, ReaderNode readerNode) {
        super(context, readerNode);
        this.readerNode = readerNode;
    }

    @Override
    protected void doOpen() {
        CopTask task = readerNode.getCopTask();
        List<CoprocessorResponse> responses =
                FutureUtils.getUninterruptibly(context.getDispatcher().dispatch(task));

        RowDecoder decoder = new RowDecoder(task.getOutputRowType());
        CopTaskStats copStats = new CopTaskStats();
        List<InternalRow> decoded = new ArrayList<>();
        for (CoprocessorResponse response : responses) {
            context.getStatsCollector().recordCopTask(response.getStatistics());
            copStats.add(response);
            for (byte[] row : response.getRows()) {
                decoded.add(decoder.decode(row));
            }
        }
        copStats.recordTo(context, readerNode.getCopNodes());
        stats.putDetail("cop_task", copStats.describe());
        this.rows = decoded.iterator();
    }

    @Override
    protected @Nullable InternalRow doNext() {
        return rows.hasNext() ? rows.next() : null;
    }
}
