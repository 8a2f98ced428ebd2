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

package org.strata.client.exec;

import org.strata.client.plan.AccessPath;
import org.strata.client.query.ExecutionStats;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.client.query.QueryResult;
import org.strata.client.table.StrataTable;
import org.strata.client.testutils.ClientTestBase;
import org.strata.config.ConfigOptions;
import org.strata.config.Configuration;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.row.InternalRow;
import org.strata.rpc.gateway.ServerLocator;
import org.strata.rpc.gateway.TabletServerGateway;
import org.strata.rpc.messages.BatchGetRequest;
import org.strata.rpc.messages.BatchGetResponse;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.WriteRequest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.client.testutils.TestTables.ORDERS_PATH;

/** Tests for {@link IndexLookUpExecutor}. */
class IndexLookUpExecutorTest extends ClientTestBase {

    private static final int CONCURRENCY = 2;

    /** Orders of customer 1 whose record disappears between the index scan and the lookup. */
    private static final Set<Long> VANISHED = new HashSet<>(Arrays.asList(5L, 13L));

    private ScheduledExecutorService delayer;
    private SlowLookupLocator locator;
    private TableInfo tableInfo;

    @BeforeEach
    void setUp() throws Exception {
        writeOrders();
        tableInfo = client.getAdmin().getTableInfo(ORDERS_PATH).get();
        delayer = Executors.newSingleThreadScheduledExecutor();
        locator = new SlowLookupLocator(cluster, delayer);
    }

    @AfterEach
    void tearDown() {
        delayer.shutdownNow();
    }

    @Test
    void testVanishedHandlesAreSkipped() {
        QueryResult result = execute(256);

        assertThat(result.getPlan().getAccessPath().getKind())
                .isEqualTo(AccessPath.Kind.INDEX_LOOKUP);
        assertThat(amountsById(result))
                .containsOnly(Map.entry(1L, 10L), Map.entry(9L, 90L), Map.entry(17L, 170L));
        ExecutionStats stats = result.getExecutionStats();
        // every handle of the index is requested, found or not
        assertThat(stats.getRowLookups()).isEqualTo(5);
        assertThat(stats.getLookupRoundTrips()).isEqualTo(locator.batchGets.get());
    }

    @Test
    void testInFlightBatchesAreCapped() {
        QueryResult result = execute(1);

        assertThat(amountsById(result)).containsOnlyKeys(1L, 9L, 17L);
        assertThat(locator.batchGets.get()).isEqualTo(5);
        assertThat(result.getExecutionStats().getLookupRoundTrips()).isEqualTo(5);
        assertThat(result.getExecutionStats().getRowLookups()).isEqualTo(5);
        assertThat(locator.maxInFlight.get()).isEqualTo(CONCURRENCY);
        assertThat(locator.inFlight.get()).isZero();
    }

    private QueryResult execute(int batchSize) {
        Configuration lookupConf = new Configuration(conf);
        lookupConf.set(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE, batchSize);
        lookupConf.set(ConfigOptions.CLIENT_LOOKUP_CONCURRENCY, CONCURRENCY);
        return new StrataTable(tableInfo, locator, lookupConf)
                .execute(
                        Query.builder()
                                .select("id", "amount")
                                .where(Filter.equal("customer", 1L))
                                .build());
    }

    private static Map<Long, Long> amountsById(QueryResult result) {
        Map<Long, Long> amounts = new HashMap<>();
        for (InternalRow row : result.getRows()) {
            amounts.put(row.getLong(0), row.getLong(1));
        }
        return amounts;
    }

    /**
     * Delays every batch get, drops the records of {@link #VANISHED} from its response and tracks
     * how many batch gets are outstanding at once.
     */
    private static final class SlowLookupLocator implements ServerLocator {

        private final ServerLocator delegate;
        private final ScheduledExecutorService delayer;
        private final AtomicInteger batchGets = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        SlowLookupLocator(ServerLocator delegate, ScheduledExecutorService delayer) {
            this.delegate = delegate;
            this.delayer = delayer;
        }

        @Override
        public List<TabletServerGateway> getTabletServers() {
            return delegate.getTabletServers().stream()
                    .map(SlowLookupGateway::new)
                    .collect(Collectors.toList());
        }

        @Override
        public TabletServerGateway leaderFor(TableBucket tableBucket) {
            return new SlowLookupGateway(delegate.leaderFor(tableBucket));
        }

        private final class SlowLookupGateway implements TabletServerGateway {

            private final TabletServerGateway server;

            SlowLookupGateway(TabletServerGateway server) {
                this.server = server;
            }

            @Override
            public int getServerId() {
                return server.getServerId();
            }

            @Override
            public CompletableFuture<Void> createTablet(TableInfo tableInfo, int bucket) {
                return server.createTablet(tableInfo, bucket);
            }

            @Override
            public CompletableFuture<Void> dropTablet(TableBucket tableBucket) {
                return server.dropTablet(tableBucket);
            }

            @Override
            public CompletableFuture<Void> write(WriteRequest request) {
                return server.write(request);
            }

            @Override
            public CompletableFuture<CoprocessorResponse> coprocessor(
                    CoprocessorRequest request) {
                return server.coprocessor(request);
            }

            @Override
            public CompletableFuture<BatchGetResponse> batchGet(BatchGetRequest request) {
                batchGets.incrementAndGet();
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                CompletableFuture<BatchGetResponse> delayed = new CompletableFuture<>();
                server.batchGet(request)
                        .whenComplete(
                                (response, throwable) ->
                                        delayer.schedule(
                                                () -> {
                                                    inFlight.decrementAndGet();
                                                    if (throwable != null) {
                                                        delayed.completeExceptionally(throwable);
                                                    } else {
                                                        delayed.complete(
                                                                dropVanished(request, response));
                                                    }
                                                },
                                                50,
                                                TimeUnit.MILLISECONDS));
                return delayed;
            }

            private BatchGetResponse dropVanished(
                    BatchGetRequest request, BatchGetResponse response) {
                long[] handles = request.getHandles();
                List<byte[]> values = new ArrayList<>(response.getValues());
                for (int i = 0; i < handles.length; i++) {
                    if (VANISHED.contains(handles[i])) {
                        values.set(i, null);
                    }
                }
                return new BatchGetResponse(values);
            }
        }
    }
}
