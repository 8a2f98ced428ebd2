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

package org.strata.rpc.gateway;

import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.rpc.messages.BatchGetRequest;
import org.strata.rpc.messages.BatchGetResponse;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.WriteRequest;

import java.util.concurrent.CompletableFuture;

/**
 * The gateway of a storage node. Every call is asynchronous; failures complete the returned
 * future exceptionally.
 */
public interface TabletServerGateway {

    int getServerId();

    /** Creates the tablet of the given bucket of the table, no-op if it exists. */
    CompletableFuture<Void> createTablet(TableInfo tableInfo, int bucket);

    /** Drops the tablet and deletes its data, no-op if it doesn't exist. */
    CompletableFuture<Void> dropTablet(TableBucket tableBucket);

    CompletableFuture<Void> write(WriteRequest request);

    CompletableFuture<BatchGetResponse> batchGet(BatchGetRequest request);

    CompletableFuture<CoprocessorResponse> coprocessor(CoprocessorRequest request);
}
