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
import org.strata.exception.StrataRuntimeException;
import org.strata.metadata.TableBucket;
import org.strata.rpc.messages.BatchGetRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** A batch of row lookups that are sent to the same bucket together. */
@Internal
public class LookupBatch {

    /** The table bucket that the handles fall into. */
    private final TableBucket tableBucket;

    private final List<Long> handles;
    private final CompletableFuture<List<byte[]>> future;

    public LookupBatch(TableBucket tableBucket) {
        this.tableBucket = tableBucket;
        this.handles = new ArrayList<>();
        this.future = new CompletableFuture<>();
    }

    public void addHandle(long handle) {
        handles.add(handle);
    }

    public List<Long> handles() {
        return handles;
    }

    public int size() {
        return handles.size();
    }

    public TableBucket tableBucket() {
        return tableBucket;
    }

    public BatchGetRequest toRequest() {
        long[] array = new long[handles.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = handles.get(i);
        }
        return new BatchGetRequest(tableBucket, array);
    }

    /** The encoded records in handle order, null for handles without a record. */
    public CompletableFuture<List<byte[]>> future() {
        return future;
    }

    public void complete(List<byte[]> values) {
        if (values.size() != handles.size()) {
            completeExceptionally(
                    new StrataRuntimeException(
                            String.format(
                                    "The number of values returned by the batch get request is not "
                                            + "equal to the number of handles sent. Got %d values, "
                                            + "but expected %d.",
                                    values.size(), handles.size())));
        } else {
            future.complete(values);
        }
    }

    /** Complete the lookups with given exception. */
    public void completeExceptionally(Throwable exception) {
        future.completeExceptionally(exception);
    }
}
