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

import org.strata.metadata.IndexInfo;
import org.strata.row.GenericRow;
import org.strata.row.InternalRow;
import org.strata.row.decode.IndexKeyDecoder;
import org.strata.row.decode.RowDecoder;
import org.strata.row.encode.RowEncoder;
import org.strata.row.encode.TableCodec;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.RowMutation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.server.testutils.TestData.ROW_TYPE;
import static org.strata.server.testutils.TestData.TABLE_BUCKET;
import static org.strata.server.testutils.TestData.TABLE_ID;
import static org.strata.server.testutils.TestData.TABLE_INFO;

/** Tests for {@link KvTablet}. */
class KvTabletTest {

    @TempDir File tempDir;

    private KvTablet kvTablet;

    @BeforeEach
    void setUp() throws Exception {
        kvTablet = KvTablet.create(TABLE_BUCKET, TABLE_INFO, new File(tempDir, "bucket-0"));
    }

    @AfterEach
    void tearDown() throws Exception {
        kvTablet.close();
    }

    @Test
    void testPutRowWritesRecordAndIndexEntries() {
        kvTablet.putRow(GenericRow.of(1L, "Berlin", 30L, "alice"));
        kvTablet.putRow(GenericRow.of(2L, "Paris", 25L, "bob"));

        assertThat(decodeRows(kvTablet.getRows(new long[] {2L, 3L, 1L})))
                .containsExactly(
                        GenericRow.of(2L, "Paris", 25L, "bob"),
                        null,
                        GenericRow.of(1L, "Berlin", 30L, "alice"));
        assertThat(indexEntries(0))
                .containsExactly(GenericRow.of("Berlin", 30L, 1L), GenericRow.of("Paris", 25L, 2L));
        assertThat(indexEntries(1))
                .containsExactly(GenericRow.of("alice", 1L), GenericRow.of("bob", 2L));
        assertThat(kvTablet.getRowsWritten()).isEqualTo(2);
    }

    @Test
    void testUpdateRemovesStaleIndexEntries() {
        kvTablet.putRow(GenericRow.of(1L, "Berlin", 30L, "alice"));
        kvTablet.putRow(GenericRow.of(1L, "Rome", 31L, "alice"));

        assertThat(indexEntries(0)).containsExactly(GenericRow.of("Rome", 31L, 1L));
        assertThat(indexEntries(1)).containsExactly(GenericRow.of("alice", 1L));
    }

    @Test
    void testDeleteRowRemovesIndexEntries() {
        kvTablet.putRow(GenericRow.of(1L, "Berlin", 30L, "alice"));
        kvTablet.deleteRow(1L);
        kvTablet.deleteRow(42L);

        assertThat(kvTablet.getRows(new long[] {1L})).hasSize(1).containsOnlyNulls();
        assertThat(indexEntries(0)).isEmpty();
        assertThat(indexEntries(1)).isEmpty();
    }

    @Test
    void testMutationsOfOneBatchSeeEachOther() {
        RowEncoder encoder = new RowEncoder(ROW_TYPE);
        kvTablet.write(
                Arrays.asList(
                        RowMutation.upsert(1L, encoder.encode(GenericRow.of(1L, "A", 1L, "x"))),
                        RowMutation.upsert(1L, encoder.encode(GenericRow.of(1L, "B", 2L, "y"))),
                        RowMutation.upsert(2L, encoder.encode(GenericRow.of(2L, "C", 3L, "z"))),
                        RowMutation.delete(2L)));

        assertThat(indexEntries(0)).containsExactly(GenericRow.of("B", 2L, 1L));
        assertThat(indexEntries(1)).containsExactly(GenericRow.of("y", 1L));
    }

    @Test
    void testNullIndexColumns() {
        kvTablet.putRow(GenericRow.of(3L, null, null, null));
        assertThat(indexEntries(0)).containsExactly(GenericRow.of(null, null, 3L));
    }

    @Test
    void testMutationMustCarryItsHandle() {
        byte[] value = new RowEncoder(ROW_TYPE).encode(GenericRow.of(1L, "A", 1L, "x"));
        assertThatThrownBy(() -> kvTablet.write(Arrays.asList(RowMutation.upsert(2L, value))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("handle 2");
        assertThat(kvTablet.getRows(new long[] {1L, 2L})).containsOnlyNulls();
    }

    @Test
    void testScanCountsVisitedKeys() {
        for (long i = 0; i < 10; i++) {
            kvTablet.putRow(GenericRow.of(i, "c" + i, i, "n" + i));
        }
        List<Long> handles = new ArrayList<>();
        long visited =
                kvTablet.scan(
                        new KeyRange(
                                TableCodec.recordKey(TABLE_ID, 3L),
                                TableCodec.recordKey(TABLE_ID, 7L)),
                        (key, value) -> {
                            handles.add(TableCodec.decodeRecordHandle(key));
                            return true;
                        });
        assertThat(handles).containsExactly(3L, 4L, 5L, 6L);
        assertThat(visited).isEqualTo(4);
        assertThat(kvTablet.getKeysScanned()).isEqualTo(4);

        KeyRange empty =
                new KeyRange(
                        TableCodec.recordKey(TABLE_ID, 7L), TableCodec.recordKey(TABLE_ID, 3L));
        assertThat(kvTablet.scan(empty, (key, value) -> true)).isZero();
    }

    @Test
    void testDropDeletesData() throws Exception {
        kvTablet.putRow(GenericRow.of(1L, "Berlin", 30L, "alice"));
        File dir = kvTablet.getKvTabletDir();
        assertThat(dir).exists();
        kvTablet.drop();
        assertThat(dir).doesNotExist();
    }

    @Test
    void testDropWaitsForRunningScan() throws Exception {
        for (long i = 0; i < 5; i++) {
            kvTablet.putRow(GenericRow.of(i, "c" + i, i, "n" + i));
        }
        File dir = kvTablet.getKvTabletDir();
        CountDownLatch scanStarted = new CountDownLatch(1);
        CountDownLatch resumeScan = new CountDownLatch(1);
        Callable<Long> scanTask =
                () ->
                        kvTablet.scan(
                                KeyRange.prefix(TableCodec.recordPrefix(TABLE_ID)),
                                (key, value) -> {
                                    scanStarted.countDown();
                                    await(resumeScan);
                                    return true;
                                });
        Callable<Void> dropTask =
                () -> {
                    kvTablet.drop();
                    return null;
                };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Long> scan = executor.submit(scanTask);
            assertThat(scanStarted.await(10, TimeUnit.SECONDS)).isTrue();

            Future<Void> drop = executor.submit(dropTask);
            Thread.sleep(200);
            assertThat(drop.isDone()).isFalse();
            assertThat(dir).exists();

            resumeScan.countDown();
            assertThat(scan.get(10, TimeUnit.SECONDS)).isEqualTo(5L);
            drop.get(10, TimeUnit.SECONDS);
        } finally {
            resumeScan.countDown();
            executor.shutdownNow();
        }

        assertThat(dir).doesNotExist();
        assertThatThrownBy(() -> kvTablet.getRows(new long[] {1L}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already closed");
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Timed out waiting for the test to resume.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private List<InternalRow> indexEntries(int indexPosition) {
        IndexInfo index = TABLE_INFO.getIndexes().get(indexPosition);
        IndexKeyDecoder decoder = new IndexKeyDecoder(index.getIndexRowType());
        List<InternalRow> entries = new ArrayList<>();
        kvTablet.scan(
                KeyRange.prefix(TableCodec.indexPrefix(TABLE_ID, index.getIndexId())),
                (key, value) -> {
                    entries.add(decoder.decode(key));
                    return true;
                });
        return entries;
    }

    private static List<InternalRow> decodeRows(List<byte[]> values) {
        RowDecoder decoder = new RowDecoder(ROW_TYPE);
        List<InternalRow> rows = new ArrayList<>();
        for (byte[] value : values) {
            rows.add(value == null ? null : decoder.decode(value));
        }
        return rows;
    }
}
