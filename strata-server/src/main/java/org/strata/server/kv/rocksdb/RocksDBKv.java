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

import org.strata.server.utils.ResourceGuard;
import org.strata.utils.BytesUtils;
import org.strata.utils.IOUtils;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Byte-level access to the RocksDB instance of one bucket. Every call holds a lease of the
 * resource guard, so {@link #close()} waits for running reads, writes and scans before it releases
 * the native handles. Calls fail with {@link IllegalStateException} once closing has begun; RocksDB
 * errors surface as {@link IOException}.
 */
public class RocksDBKv implements AutoCloseable {

    private final RocksDBResourceContainer resources;
    private final WriteOptions writeOptions;

    /** Opened with the db and closed before it. */
    private final ColumnFamilyHandle columnFamily;

    protected final RocksDB db;

    private final ResourceGuard rocksDBResourceGuard = new ResourceGuard();

    private volatile boolean closed;

    public RocksDBKv(
            RocksDBResourceContainer resources, RocksDB db, ColumnFamilyHandle columnFamily) {
        this.resources = resources;
        this.db = db;
        this.columnFamily = columnFamily;
        this.writeOptions = resources.getWriteOptions();
    }

    /** The batch holds a lease until it is closed. */
    public RocksDBWriteBatchWrapper newWriteBatch() {
        return new RocksDBWriteBatchWrapper(db, columnFamily, writeOptions, acquireLease());
    }

    public @Nullable byte[] get(byte[] key) throws IOException {
        try (ResourceGuard.Lease ignored = acquireLease()) {
            return db.get(columnFamily, key);
        } catch (RocksDBException e) {
            throw new IOException("Failed to read a key from RocksDB.", e);
        }
    }

    /** Values in the order of {@code keys}, null where a key is absent. */
    public List<byte[]> multiGet(List<byte[]> keys) throws IOException {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        try (ResourceGuard.Lease ignored = acquireLease()) {
            return db.multiGetAsList(Collections.nCopies(keys.size(), columnFamily), keys);
        } catch (RocksDBException e) {
            throw new IOException("Failed to read " + keys.size() + " keys from RocksDB.", e);
        }
    }

    public void put(byte[] key, byte[] value) throws IOException {
        try (ResourceGuard.Lease ignored = acquireLease()) {
            db.put(columnFamily, writeOptions, key, value);
        } catch (RocksDBException e) {
            throw new IOException("Failed to write a key to RocksDB.", e);
        }
    }

    public void delete(byte[] key) throws IOException {
        try (ResourceGuard.Lease ignored = acquireLease()) {
            db.delete(columnFamily, writeOptions, key);
        } catch (RocksDBException e) {
            throw new IOException("Failed to delete a key from RocksDB.", e);
        }
    }

    /** Returns the values of every key starting with {@code prefix}, in key order. */
    public List<byte[]> prefixLookup(byte[] prefix) {
        List<byte[]> values = new ArrayList<>();
        rangeScan(
                prefix,
                BytesUtils.prefixNext(prefix),
                (key, value) -> {
                    values.add(value);
                    return true;
                });
        return values;
    }

    /**
     * Visits the entries of {@code [start, end)} in key order.
     *
     * @param start the inclusive lower bound
     * @param end the exclusive upper bound, null for no upper bound
     * @param visitor called for every entry, returns false to stop the scan
     * @return the number of entries visited
     */
    public long rangeScan(byte[] start, @Nullable byte[] end, KvVisitor visitor) {
        long visited = 0;
        try (ResourceGuard.Lease ignored = acquireLease();
                ReadOptions readOptions = new ReadOptions();
                RocksIterator it = db.newIterator(columnFamily, readOptions)) {
            for (it.seek(start); it.isValid(); it.next()) {
                byte[] key = it.key();
                if (end != null && BytesUtils.compare(key, end) >= 0) {
                    break;
                }
                visited++;
                if (!visitor.visit(key, it.value())) {
                    break;
                }
            }
        }
        return visited;
    }

    /**
     * Rejects new calls, waits until the running ones have released their leases, then closes
     * the column family handle before the db.
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        rocksDBResourceGuard.close();
        columnFamily.close();
        try {
            db.closeE();
        } catch (RocksDBException e) {
            throw new IOException("Failed to close RocksDB.", e);
        } finally {
            IOUtils.closeQuietly(resources);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private ResourceGuard.Lease acquireLease() {
        try {
            return rocksDBResourceGuard.acquireResource();
        } catch (IOException e) {
            throw new IllegalStateException("RocksDB of this bucket is already closed.", e);
        }
    }

    /** Callback of {@link #rangeScan}. */
    @FunctionalInterface
    public interface KvVisitor {
        /** Returns false to stop the scan after this entry. */
        boolean visit(byte[] key, byte[] value);
    }
}
