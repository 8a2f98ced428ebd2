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

package org.strata.client;

import org.strata.annotation.PublicEvolving;
import org.strata.client.admin.Admin;
import org.strata.client.admin.StrataAdmin;
import org.strata.client.metadata.Catalog;
import org.strata.client.table.StrataTable;
import org.strata.client.table.Table;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;
import org.strata.rpc.gateway.ServerLocator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry point of the computing tier. A client keeps the catalog of the tables it created and
 * reaches the storage nodes through a {@link ServerLocator}.
 *
 * <pre>{@code
 * try (LocalCluster cluster = LocalCluster.start(conf);
 *         StrataClient client = StrataClient.create(conf, cluster)) {
 *     client.getAdmin().createTable(path, descriptor, false).get();
 *     Table table = client.getTable(path);
 *     QueryResult result = table.execute(query);
 * }
 * }</pre>
 */
@PublicEvolving
public class StrataClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StrataClient.class);

    private final Configuration conf;
    private final ServerLocator serverLocator;
    private final Catalog catalog;
    private final Admin admin;

    private volatile boolean closed;

    private StrataClient(Configuration conf, ServerLocator serverLocator) {
        this.conf = conf;
        this.serverLocator = serverLocator;
        this.catalog = new Catalog(conf.get(ConfigOptions.TABLE_DEFAULT_BUCKET_NUM));
        this.admin = new StrataAdmin(catalog, serverLocator);
    }

    public static StrataClient create(Configuration conf, ServerLocator serverLocator) {
        StrataClient client = new StrataClient(conf, serverLocator);
        LOG.info(
                "Created client for {} tablet servers.",
                serverLocator.getTabletServers().size());
        return client;
    }

    public Admin getAdmin() {
        checkNotClosed();
        return admin;
    }

    /**
     * Gets the table to write to and query.
     *
     * @throws org.strata.exception.TableNotExistException if the table was never created
     */
    public Table getTable(TablePath tablePath) {
        checkNotClosed();
        TableInfo tableInfo = catalog.getTable(tablePath);
        return new StrataTable(tableInfo, serverLocator, conf);
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("The client is already closed.");
        }
    }

    /** Closes the client. The storage nodes keep running; they are owned by the caller. */
    @Override
    public void close() {
        closed = true;
    }
}
