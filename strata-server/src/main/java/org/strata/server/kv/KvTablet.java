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

package org.strata.server.kv;

import org.strata.exception.StorageException;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.row.InternalRow;
import org.strata.row.decode.RowDecoder;
import org.strata.row.encode.IndexKeyEncoder;
import org.strata.row.encode.RowEncoder;
import org.strata.row.encode.TableCodec;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.RowMutation;
import org.strata.server.kv.rocksdb.RocksDBKv;
import org.strata.server.kv.rocksdb.RocksDBKvBuilder;
import org.strata.server.kv.rocksdb.RocksDBWriteBatchWrapper;
import org.strata.utils.FileUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A kv tablet which presents one bucket of a table. It stores the records of the bucket under
 * record keys and one entry per secondary index under index keys, all in one RocksDB instance.
 */
public final class KvTablet implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KvTablet.class);

    private static final byte[] EMPTY_VALUE = new byte[0];

    private final TableBucket tableBucket;
    private final TableInfo tableInfo;
    private final File kvTabletDir;
    private final RocksDBKv rocksDBKv;
    private final RowEncoder rowEncoder;
    private final RowDecoder rowDecoder;
    private final List<IndexKeyEncoder> indexKeyEncoders;
    private final int handleIndex;

    // writes read the previous version of a row, so they must not interleave
    private final Lock kvLock = new ReentrantLock();

    private final AtomicLong keysScanned = new AtomicLong();
    private final AtomicLong rowsWritten = new AtomicLong();

    private KvTablet(
            TableBucket tableBucket, TableInfo tableInfo, File kvTabletDir, RocksDBKv rocksDBKv) {
        this.tableBucket = tableBucket;
        this.tableInfo = tableInfo;
        this.kvTabletDir = kvTabletDir;
        this.rocksDBKv = rocksDBKv;
        this.rowEncoder = new RowEncoder(tableInfo.getRowType());
        this.rowDecoder = new RowDecoder(tableInfo.getRowType());
        this.handleIndex = tableInfo.getHandleIndex();
        List<IndexKeyEncoder> encoders = new ArrayList<>();
        for (IndexInfo indexInfo : tableInfo.getIndexes()) {
            encoders.add(new IndexKeyEncoder(tableInfo, indexInfo));
        }
        this.indexKeyEncoders = Collections.unmodifiableList(encoders);
    }

    public static KvTablet create(TableBucket tableBucket, TableInfo tableInfo, File kvTabletDir)
            throws IOException {
        RocksDBKv rocksDBKv = new RocksDBKvBuilder(kvTabletDir).build();
        LOG.info(
                "Created kv tablet for {} of table {} at {}.",
                tableBucket,
                tableInfo.getTablePath(),
                kvTabletDir);
        return new KvTablet(tableBucket, tableInfo, kvTabletDir, rocksDBKv);
    }

    public TableBucket getTableBucket() {
        return tableBucket;
    }

    public TableInfo getTableInfo() {
        return tableInfo;
    }

    public File getKvTabletDir() {
        return kvTabletDir;
    }

    public void putRow(InternalRow row) {
        if (row.isNullAt(handleIndex)) {
            throw new IllegalArgumentException("Handle field cannot be null");
        }
        write(
                Collections.singletonList(
                        RowMutation.upsert(row.getLong(handleIndex), rowEncoder.encode(row))));
    }

    public void deleteRow(long handle) {
        write(Collections.singletonList(RowMutation.delete(handle)));
    }

    /**
     * Applies the mutations in order in one atomic write batch. An upsert writes the record and
     * one key per index, and removes the index keys of the previous version of the row.
     */
    public void write(List<RowMutation> mutations) {
        kvLock.lock();
        try (RocksDBWriteBatchWrapper batch = rocksDBKv.newWriteBatch()) {
            // rows already touched by this batch, null for deleted
            Map<Long, InternalRow> pending = new HashMap<>();
            for (RowMutation mutation : mutations) {
                long handle = mutation.getHandle();
                byte[] recordKey = TableCodec.recordKey(tableInfo.getTableId(), handle);
                InternalRow oldRow =
                        pending.containsKey(handle) ? pending.get(handle) : readRow(recordKey);
                if (oldRow != null) {
                    for (IndexKeyEncoder encoder : indexKeyEncoders) {
                        batch.delete(encoder.encodeKey(oldRow));
                    }
                }
                if (mutation.isDelete()) {
                    batch.delete(recordKey);
                    pending.put(handle, null);
                } else {
                    byte[] value = mutation.getValue();
                    InternalRow newRow = rowDecoder.decode(value);
                    if (newRow.isNullAt(handleIndex) || newRow.getLong(handleIndex) != handle) {
                        throw new IllegalArgumentException(
                                "Row does not carry the handle " + handle + " of its mutation");
                    }
                    batch.put(recordKey, value);
                    for (IndexKeyEncoder encoder : indexKeyEncoders) {
                        batch.put(encoder.encodeKey(newRow), EMPTY_VALUE);
                    }
                    pending.put(handle, newRow);
                }
            }
            batch.flush();
            rowsWritten.addAndGet(mutations.size());
        } catch (IOException e) {
            throw new StorageException("Failed to write to kv tablet " + tableBucket, e);
        } finally {
            kvLock.unlock();
        }
    }

    private @Nullable InternalRow readRow(byte[] recordKey) throws IOException {
        byte[] value = rocksDBKv.get(recordKey);
        return value == null ? null : rowDecoder.decode(value);
    }

    /** Returns the encoded records of the handles, null where a handle has no record. */
    public List<byte[]> getRows(long[] handles) {
        List<byte[]> keys = new ArrayList<>(handles.length);
        for (long handle : handles) {
            keys.add(TableCodec.recordKey(tableInfo.getTableId(), handle));
        }
        try {
            return rocksDBKv.multiGet(keys);
        } catch (IOException e) {
            throw new StorageException("Failed to read rows from kv tablet " + tableBucket, e);
        }
    }

    /** Visits the entries of the range in key order and returns the number of keys visited. */
    public long scan(KeyRange range, RocksDBKv.KvVisitor visitor) {
        if (range.isEmpty()) {
            return 0;
        }
        long visited = rocksDBKv.rangeScan(range.getStart(), range.getEnd(), visitor);
        keysScanned.addAndGet(visited);
        return visited;
    }

    /** Keys visited by all scans of this tablet since it was opened. */
    public long getKeysScanned() {
        return keysScanned.get();
    }

    public long getRowsWritten() {
        return rowsWritten.get();
    }

    /** Closes the tablet and deletes its data. */
    public void drop() throws IOException {
        close();
        FileUtils.deleteDirectory(kvTabletDir);
        LOG.info("Dropped kv tablet {} at {}.", tableBucket, kvTabletDir);
    }

    @Override
    public void close() throws IOException {
        kvLock.lock();
        try {
            rocksDBKv.close();
        } finally {
            kvLock.unlock();
        }
    }
}
