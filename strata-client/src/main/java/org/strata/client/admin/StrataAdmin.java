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

package org.strata.client.admin;

import org.strata.client.metadata.Catalog;
import org.strata.exception.TableNotExistException;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableDescriptor;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;
import org.strata.rpc.gateway.ServerLocator;
import org.strata.utils.concurrent.FutureUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** The default implementation of {@link Admin}. */
public class StrataAdmin implements Admin {

    private static final Logger LOG = LoggerFactory.getLogger(StrataAdmin.class);

    private final Catalog catalog;
    private final ServerLocator serverLocator;

    public StrataAdmin(Catalog catalog, ServerLocator serverLocator) {
        this.catalog = catalog;
        this.serverLocator = serverLocator;
    }

    @Override
    public CompletableFuture<Void> createTable(
            TablePath tablePath, TableDescriptor tableDescriptor, boolean ignoreIfExists) {
        TableInfo tableInfo;
        try {
            tableInfo = catalog.registerTable(tablePath, tableDescriptor, ignoreIfExists);
        } catch (RuntimeException e) {
            return FutureUtils.completedExceptionally(e);
        }
        if (tableInfo == null) {
            return CompletableFuture.completedFuture(null);
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>(tableInfo.getNumBuckets());
        for (int bucket = 0; bucket < tableInfo.getNumBuckets(); bucket++) {
            TableBucket tableBucket = new TableBucket(tableInfo.getTableId(), bucket);
            futures.add(serverLocator.leaderFor(tableBucket).createTablet(tableInfo, bucket));
        }
        return FutureUtils.combineAll(futures)
                .handle(
                        (ignored, throwable) -> {
                            if (throwable != null) {
                                // the table is unusable without all of its tablets
                                catalog.removeTable(tablePath);
                                dropTablets(tableInfo);
                                throw FutureUtils.asCompletionException(throwable);
                            }
                            LOG.info(
                                    "Created table {} with id {}, {} buckets and indexes {}.",
                                    tablePath,
                                    tableInfo.getTableId(),
                                    tableInfo.getNumBuckets(),
                                    tableInfo.getIndexes());
                            return null;
                        });
    }

    @Override
    public CompletableFuture<Void> dropTable(TablePath tablePath, boolean ignoreIfNotExists) {
        TableInfo tableInfo = catalog.removeTable(tablePath);
        if (tableInfo == null) {
            if (ignoreIfNotExists) {
                return CompletableFuture.completedFuture(null);
            }
            return FutureUtils.completedExceptionally(
                    new TableNotExistException("Table " + tablePath + " does not exist."));
        }
        return dropTablets(tableInfo)
                .thenRun(() -> LOG.info("Dropped table {}.", tablePath));
    }

    private CompletableFuture<Void> dropTablets(TableInfo tableInfo) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(tableInfo.getNumBuckets());
        for (int bucket = 0; bucket < tableInfo.getNumBuckets(); bucket++) {
            TableBucket tableBucket = new TableBucket(tableInfo.getTableId(), bucket);
            futures.add(serverLocator.leaderFor(tableBucket).dropTablet(tableBucket));
        }
        return FutureUtils.combineAll(futures).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<TableInfo> getTableInfo(TablePath tablePath) {
        try {
            return CompletableFuture.completedFuture(catalog.getTable(tablePath));
        } catch (TableNotExistException e) {
            return FutureUtils.completedExceptionally(e);
        }
    }

    @Override
    public CompletableFuture<Boolean> tableExists(TablePath tablePath) {
        return CompletableFuture.completedFuture(catalog.tableExists(tablePath));
    }

    @Override
    public CompletableFuture<List<TablePath>> listTables() {
        return CompletableFuture.completedFuture(catalog.listTables());
    }
}
