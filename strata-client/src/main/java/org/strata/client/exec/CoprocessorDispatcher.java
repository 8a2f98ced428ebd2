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

import org.strata.annotation.Internal;
import org.strata.bucketing.HashBucketingFunction;
import org.strata.client.plan.CopTask;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.rpc.gateway.ServerLocator;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.RowMutation;
import org.strata.rpc.messages.WriteRequest;
import org.strata.utils.concurrent.FutureUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Routes the requests of one table to the storage nodes serving its buckets: coprocessor tasks
 * to every bucket, lookups and writes to the bucket of their handles.
 */
@Internal
public class CoprocessorDispatcher {

    private final TableInfo tableInfo;
    private final ServerLocator serverLocator;
    private final HashBucketingFunction bucketingFunction;
    private final int numBuckets;

    public CoprocessorDispatcher(TableInfo tableInfo, ServerLocator serverLocator) {
        this.tableInfo = tableInfo;
        this.serverLocator = serverLocator;
        this.bucketingFunction = new HashBucketingFunction();
        this.numBuckets = tableInfo.getNumBuckets();
    }

    public int getNumBuckets() {
        return numBuckets;
    }

    public TableBucket bucketOf(long handle) {
        return new TableBucket(
                tableInfo.getTableId(), bucketingFunction.bucketing(handle, numBuckets));
    }

    /**
     * Sends the task to every bucket concurrently. A task whose key ranges are all empty is not
     * sent at all.
     */
    public CompletableFuture<List<CoprocessorResponse>> dispatch(CopTask task) {
        if (task.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        List<CompletableFuture<CoprocessorResponse>> futures = new ArrayList<>(numBuckets);
        for (int bucket = 0; bucket < numBuckets; bucket++) {
            TableBucket tableBucket = new TableBucket(tableInfo.getTableId(), bucket);
            futures.add(
                    serverLocator.leaderFor(tableBucket).coprocessor(task.toRequest(tableBucket)));
        }
        return FutureUtils.combineAll(futures);
    }

    /** Sends the batch to the node of its bucket and completes the batch with the result. */
    public CompletableFuture<List<byte[]>> lookup(LookupBatch batch) {
        serverLocator
                .leaderFor(batch.tableBucket())
                .batchGet(batch.toRequest())
                .whenComplete(
                        (response, throwable) -> {
                            if (throwable != null) {
                                batch.completeExceptionally(FutureUtils.stripException(throwable));
                            } else {
                                batch.complete(response.getValues());
                            }
                        });
        return batch.future();
    }

    public CompletableFuture<Void> write(TableBucket tableBucket, List<RowMutation> mutations) {
        return serverLocator
                .leaderFor(tableBucket)
                .write(new WriteRequest(tableBucket, mutations));
    }
}
