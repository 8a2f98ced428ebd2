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

import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Opens the RocksDB instance of a tablet in its directory. */
public class RocksDBKvBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RocksDBKvBuilder.class);

    static {
        RocksDB.loadLibrary();
    }

    private final File instanceBasePath;

    public RocksDBKvBuilder(File instanceBasePath) {
        this.instanceBasePath = instanceBasePath;
    }

    public RocksDBKv build() throws IOException {
        if (!instanceBasePath.exists() && !instanceBasePath.mkdirs()) {
            throw new IOException("Could not create RocksDB data directory " + instanceBasePath);
        }
        RocksDBResourceContainer optionsContainer = new RocksDBResourceContainer();
        List<ColumnFamilyHandle> columnFamilyHandles = new ArrayList<>(1);
        try {
            ColumnFamilyDescriptor defaultDescriptor =
                    new ColumnFamilyDescriptor(
                            RocksDB.DEFAULT_COLUMN_FAMILY, optionsContainer.getColumnOptions());
            RocksDB db =
                    RocksDB.open(
                            optionsContainer.getDbOptions(),
                            instanceBasePath.getAbsolutePath(),
                            Collections.singletonList(defaultDescriptor),
                            columnFamilyHandles);
            LOG.debug("Opened RocksDB instance at {}.", instanceBasePath);
            return new RocksDBKv(optionsContainer, db, columnFamilyHandles.get(0));
        } catch (RocksDBException e) {
            columnFamilyHandles.forEach(IOUtils::closeQuietly);
            optionsContainer.close();
            throw new IOException("Error while opening RocksDB instance at " + instanceBasePath, e);
        }
    }
}
