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

package org.strata.client.metadata;

import org.strata.annotation.Internal;
import org.strata.exception.TableAlreadyExistException;
import org.strata.exception.TableNotExistException;
import org.strata.metadata.IndexDescriptor;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableDescriptor;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The registry of tables known to a client. It assigns table ids and index ids; index ids start
 * at 1 in declaration order.
 */
@Internal
public class Catalog {

    private final Map<TablePath, TableInfo> tables = new ConcurrentHashMap<>();
    private final AtomicLong tableIdGenerator = new AtomicLong();
    private final int defaultBucketNum;

    public Catalog(int defaultBucketNum) {
        this.defaultBucketNum = defaultBucketNum;
    }

    /**
     * Registers a table.
     *
     * @return the registered table, or null if it already existed and {@code ignoreIfExists}
     * @throws TableAlreadyExistException if the table exists and {@code ignoreIfExists} is false
     */
    public @Nullable TableInfo registerTable(
            TablePath tablePath, TableDescriptor descriptor, boolean ignoreIfExists) {
        // ids are only consumed by tables that get registered
        synchronized (tables) {
            if (tables.containsKey(tablePath)) {
                if (ignoreIfExists) {
                    return null;
                }
                throw new TableAlreadyExistException("Table " + tablePath + " already exists.");
            }
            long tableId = tableIdGenerator.incrementAndGet();
            List<IndexInfo> indexes = new ArrayList<>();
            long indexId = 1;
            for (IndexDescriptor index : descriptor.getIndexes()) {
                indexes.add(
                        new IndexInfo(
                                indexId++,
                                index,
                                descriptor.getRowType(),
                                descriptor.getHandleColumn()));
            }
            int numBuckets = descriptor.getBucketCount().orElse(defaultBucketNum);
            TableInfo tableInfo =
                    new TableInfo(tablePath, tableId, descriptor, numBuckets, indexes);
            tables.put(tablePath, tableInfo);
            return tableInfo;
        }
    }

    public TableInfo getTable(TablePath tablePath) {
        TableInfo tableInfo = tables.get(tablePath);
        if (tableInfo == null) {
            throw new TableNotExistException("Table " + tablePath + " does not exist.");
        }
        return tableInfo;
    }

    public boolean tableExists(TablePath tablePath) {
        return tables.containsKey(tablePath);
    }

    public @Nullable TableInfo removeTable(TablePath tablePath) {
        return tables.remove(tablePath);
    }

    public List<TablePath> listTables() {
        return new ArrayList<>(tables.keySet());
    }
}
