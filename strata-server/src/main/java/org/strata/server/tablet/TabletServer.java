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

package org.strata.server.tablet;

import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.exception.StorageException;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.rpc.gateway.TabletServerGateway;
import org.strata.rpc.messages.BatchGetRequest;
import org.strata.rpc.messages.BatchGetResponse;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.WriteRequest;
import org.strata.server.coprocessor.CoprocessorHandler;
import org.strata.server.kv.KvTablet;
import org.strata.utils.IOUtils;
import org.strata.utils.concurrent.ExecutorThreadFactory;
import org.strata.utils.concurrent.FutureUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A storage node. It owns the kv tablets of the buckets assigned to it and serves every request
 * of its {@link TabletServerGateway} on its own worker pool.
 */
public class TabletServer implements TabletServerGateway, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TabletServer.class);

    private final int serverId;
    private final File dataDir;
    private final long slowTaskThresholdMs;
    private final ExecutorService workerPool;
    private final CoprocessorHandler coprocessorHandler = new CoprocessorHandler();
    private final Map<TableBucket, KvTablet> tablets = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public TabletServer(int serverId, File dataDir, Configuration conf) {
        this.serverId = serverId;
        this.dataDir = dataDir;
        this.slowTaskThresholdMs = conf.get(ConfigOptions.COPROCESSOR_SLOW_TASK_THRESHOLD);
        int threads = conf.get(ConfigOptions.COPROCESSOR_THREADS);
        this.workerPool =
                Executors.newFixedThreadPool(
                        threads, new ExecutorThreadFactory("tablet-server-" + serverId));
        LOG.info(
                "Started tablet server {} at {} with {} worker threads.",
                serverId,
                dataDir,
                threads);
    }

    @Override
    public int getServerId() {
        return serverId;
    }

    @Override
    public CompletableFuture<Void> createTablet(TableInfo tableInfo, int bucket) {
        TableBucket tableBucket = new TableBucket(tableInfo.getTableId(), bucket);
        return runAsync(
                () -> {
                    tablets.computeIfAbsent(tableBucket, tb -> openTablet(tb, tableInfo));
                    return null;
                });
    }

    private KvTablet openTablet(TableBucket tableBucket, TableInfo tableInfo) {
        File tabletDir =
                new File(
                        dataDir,
                        "table-" + tableBucket.getTableId() + "/bucket-" + tableBucket.getBucket());
        try {
            return KvTablet.create(tableBucket, tableInfo, tabletDir);
        } catch (IOException e) {
            throw new StorageException("Failed to create kv tablet " + tableBucket, e);
        }
    }

    @Override
    public CompletableFuture<Void> dropTablet(TableBucket tableBucket) {
        return runAsync(
                () -> {
                    KvTablet tablet = tablets.remove(tableBucket);
                    if (tablet != null) {
                        try {
                            tablet.drop();
                        } catch (IOException e) {
                            throw new StorageException(
                                    "Failed to drop kv tablet " + tableBucket, e);
                        }
                    }
                    return null;
                });
    }

    @Override
    public CompletableFuture<Void> write(WriteRequest request) {
        return runAsync(
                () -> {
                    getTabletOrThrow(request.getTableBucket()).write(request.getMutations());
                    return null;
                });
    }

    @Override
    public CompletableFuture<BatchGetResponse> batchGet(BatchGetRequest request) {
        return runAsync(
                () ->
                        new BatchGetResponse(
                                getTabletOrThrow(request.getTableBucket())
                                        .getRows(request.getHandles())));
    }

    @Override
    public CompletableFuture<CoprocessorResponse> coprocessor(CoprocessorRequest request) {
        return runAsync(
                () -> {
                    KvTablet tablet = getTabletOrThrow(request.getTableBucket());
                    CoprocessorResponse response = coprocessorHandler.handle(tablet, request);
                    long elapsedMs =
                            TimeUnit.NANOSECONDS.toMillis(
                                    response.getStatistics().getElapsedNanos());
                    if (elapsedMs > slowTaskThresholdMs) {
                        LOG.warn(
                                "Slow coprocessor task on {} took {} ms: {}",
                                request.getTableBucket(),
                                elapsedMs,
                                response.getStatistics());
                    } else {
                        LOG.debug(
                                "Coprocessor task on {} finished: {}",
                                request.getTableBucket(),
                                response.getStatistics());
                    }
                    return response;
                });
    }

    public @Nullable KvTablet getTablet(TableBucket tableBucket) {
        return tablets.get(tableBucket);
    }

    private KvTablet getTabletOrThrow(TableBucket tableBucket) {
        KvTablet tablet = tablets.get(tableBucket);
        if (tablet == null) {
            throw new StorageException(
                    "Tablet " + tableBucket + " is not served by tablet server " + serverId);
        }
        return tablet;
    }

    private <T> CompletableFuture<T> runAsync(Supplier<T> action) {
        if (closed) {
            return FutureUtils.completedExceptionally(
                    new StorageException("Tablet server " + serverId + " is closed."));
        }
        try {
            return CompletableFuture.supplyAsync(action, workerPool);
        } catch (RejectedExecutionException e) {
            return FutureUtils.completedExceptionally(
                    new StorageException("Tablet server " + serverId + " is closed.", e));
        }
    }

    @Override
    public void close() throws Exception {
        if (closed) {
            return;
        }
        closed = true;
        workerPool.shutdown();
        if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
            LOG.warn("Worker pool of tablet server {} did not terminate in time.", serverId);
            workerPool.shutdownNow();
        }
        List<KvTablet> toClose = new ArrayList<>(tablets.values());
        tablets.clear();
        IOUtils.closeAll(toClose);
        LOG.info("Closed tablet server {}.", serverId);
    }
}
