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

package org.strata.server.cluster;

import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.TableBucket;
import org.strata.rpc.gateway.ServerLocator;
import org.strata.rpc.gateway.TabletServerGateway;
import org.strata.server.tablet.TabletServer;
import org.strata.utils.IOUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.strata.utils.Preconditions.checkArgument;

/**
 * A cluster of in-process {@link TabletServer}s sharing one data directory. Bucket {@code b} of
 * every table is served by server {@code b mod n}.
 */
public final class LocalCluster implements ServerLocator, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LocalCluster.class);

    private final List<TabletServer> tabletServers;

    private LocalCluster(List<TabletServer> tabletServers) {
        this.tabletServers = Collections.unmodifiableList(tabletServers);
    }

    /** Starts {@code cluster.tablet-servers} servers under {@code data.dir}. */
    public static LocalCluster start(Configuration conf) {
        String dataDir = conf.getOptional(ConfigOptions.DATA_DIR);
        checkArgument(
                dataDir != null,
                "%s must be set to start a cluster.",
                ConfigOptions.DATA_DIR.key());
        int numServers = conf.get(ConfigOptions.CLUSTER_TABLET_SERVERS);
        checkArgument(numServers > 0, "The cluster needs at least one tablet server.");

        List<TabletServer> servers = new ArrayList<>(numServers);
        for (int i = 0; i < numServers; i++) {
            servers.add(new TabletServer(i, new File(dataDir, "tablet-server-" + i), conf));
        }
        LOG.info("Started local cluster with {} tablet servers at {}.", numServers, dataDir);
        return new LocalCluster(servers);
    }

    @Override
    public List<TabletServerGateway> getTabletServers() {
        return Collections.unmodifiableList(tabletServers);
    }

    @Override
    public TabletServerGateway leaderFor(TableBucket tableBucket) {
        return getTabletServer(tableBucket);
    }

    public TabletServer getTabletServer(TableBucket tableBucket) {
        return tabletServers.get(tableBucket.getBucket() % tabletServers.size());
    }

    @Override
    public void close() {
        for (TabletServer server : tabletServers) {
            IOUtils.closeQuietly(server);
        }
        LOG.info("Closed local cluster.");
    }
}
