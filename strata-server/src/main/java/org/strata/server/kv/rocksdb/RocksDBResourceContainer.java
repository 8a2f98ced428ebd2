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

package org.strata.server.kv.rocksdb;

import org.strata.utils.IOUtils;

import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.WriteOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * The container of the RocksDB options of one kv instance. Every option object is a native
 * resource, so the container tracks them and releases them on {@link #close()}.
 */
public final class RocksDBResourceContainer implements AutoCloseable {

    private static final int BLOOM_FILTER_BITS_PER_KEY = 10;

    private final List<AutoCloseable> handlesToClose = new ArrayList<>();

    public DBOptions getDbOptions() {
        DBOptions options =
                new DBOptions()
                        .setCreateIfMissing(true)
                        .setCreateMissingColumnFamilies(true)
                        .setUseFsync(false)
                        .setMaxOpenFiles(-1)
                        .setInfoLogLevel(InfoLogLevel.HEADER_LEVEL);
        handlesToClose.add(options);
        return options;
    }

    public ColumnFamilyOptions getColumnOptions() {
        BloomFilter bloomFilter = new BloomFilter(BLOOM_FILTER_BITS_PER_KEY);
        handlesToClose.add(bloomFilter);
        BlockBasedTableConfig tableConfig =
                new BlockBasedTableConfig().setFilterPolicy(bloomFilter);
        ColumnFamilyOptions options =
                new ColumnFamilyOptions()
                        .setCompactionStyle(CompactionStyle.LEVEL)
                        .setTableFormatConfig(tableConfig);
        handlesToClose.add(options);
        return options;
    }

    /** Write options without write-ahead log, a tablet is rebuilt by rewriting its rows. */
    public WriteOptions getWriteOptions() {
        WriteOptions options = new WriteOptions().setDisableWAL(true);
        handlesToClose.add(options);
        return options;
    }

    @Override
    public void close() {
        // release in reverse order of creation, table configs before the filters they use
        for (int i = handlesToClose.size() - 1; i >= 0; i--) {
            IOUtils.closeQuietly(handlesToClose.get(i));
        }
        handlesToClose.clear();
    }
}
