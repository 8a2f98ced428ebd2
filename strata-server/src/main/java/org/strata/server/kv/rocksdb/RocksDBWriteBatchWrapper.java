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

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;

/** Collects puts and deletes and applies them to RocksDB atomically on {@link #flush()}. */
public class RocksDBWriteBatchWrapper implements AutoCloseable {

    private final RocksDB db;
    private final ColumnFamilyHandle columnFamilyHandle;
    private final WriteOptions writeOptions;
    private final WriteBatch batch;
    private final ResourceGuard.Lease lease;

    RocksDBWriteBatchWrapper(
            RocksDB db,
            ColumnFamilyHandle columnFamilyHandle,
            WriteOptions writeOptions,
            ResourceGuard.Lease lease) {
        this.db = db;
        this.columnFamilyHandle = columnFamilyHandle;
        this.writeOptions = writeOptions;
        this.lease = lease;
        this.batch = new WriteBatch();
    }

    public void put(byte[] key, byte[] value) throws IOException {
        try {
            batch.put(columnFamilyHandle, key, value);
        } catch (RocksDBException e) {
            throw new IOException("Failed to stage a put in the write batch.", e);
        }
    }

    public void delete(byte[] key) throws IOException {
        try {
            batch.delete(columnFamilyHandle, key);
        } catch (RocksDBException e) {
            throw new IOException("Failed to stage a delete in the write batch.", e);
        }
    }

    public int count() {
        return batch.count();
    }

    public void flush() throws IOException {
        if (batch.count() == 0) {
            return;
        }
        try {
            db.write(writeOptions, batch);
            batch.clear();
        } catch (RocksDBException e) {
            throw new IOException("Failed to commit the write batch.", e);
        }
    }

    @Override
    public void close() {
        try {
            batch.close();
        } finally {
            lease.close();
        }
    }
}
