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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RocksDBKv}. */
class RocksDBKvTest {

    @TempDir File tempDir;

    private RocksDBKv rocksDBKv;

    @BeforeEach
    void setUp() throws Exception {
        rocksDBKv = new RocksDBKvBuilder(new File(tempDir, "kv")).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        rocksDBKv.close();
    }

    @Test
    void testPutGetDelete() throws Exception {
        rocksDBKv.put(bytes("k1"), bytes("v1"));
        assertThat(rocksDBKv.get(bytes("k1"))).isEqualTo(bytes("v1"));

        rocksDBKv.delete(bytes("k1"));
        assertThat(rocksDBKv.get(bytes("k1"))).isNull();
    }

    @Test
    void testMultiGetKeepsOrderAndMisses() throws Exception {
        rocksDBKv.put(bytes("a"), bytes("1"));
        rocksDBKv.put(bytes("c"), bytes("3"));

        List<byte[]> values = rocksDBKv.multiGet(Arrays.asList(bytes("c"), bytes("b"), bytes("a")));
        assertThat(values).hasSize(3);
        assertThat(values.get(0)).isEqualTo(bytes("3"));
        assertThat(values.get(1)).isNull();
        assertThat(values.get(2)).isEqualTo(bytes("1"));
    }

    @Test
    void testWriteBatchIsAppliedOnFlush() throws Exception {
        try (RocksDBWriteBatchWrapper batch = rocksDBKv.newWriteBatch()) {
            batch.put(bytes("x"), bytes("1"));
            batch.put(bytes("y"), bytes("2"));
            batch.delete(bytes("x"));
            assertThat(rocksDBKv.get(bytes("y"))).isNull();
            batch.flush();
        }
        assertThat(rocksDBKv.get(bytes("x"))).isNull();
        assertThat(rocksDBKv.get(bytes("y"))).isEqualTo(bytes("2"));
    }

    @Test
    void testRangeScan() throws Exception {
        for (String key : new String[] {"a1", "a2", "a3", "b1", "b2"}) {
            rocksDBKv.put(bytes(key), bytes("v-" + key));
        }

        List<String> visited = new ArrayList<>();
        long count =
                rocksDBKv.rangeScan(
                        bytes("a2"),
                        bytes("b2"),
                        (key, value) -> {
                            visited.add(new String(key, StandardCharsets.UTF_8));
                            return true;
                        });
        assertThat(visited).containsExactly("a2", "a3", "b1");
        assertThat(count).isEqualTo(3);

        // unbounded end, stopped by the visitor
        visited.clear();
        count =
                rocksDBKv.rangeScan(
                        bytes("a3"),
                        null,
                        (key, value) -> {
                            visited.add(new String(key, StandardCharsets.UTF_8));
                            return visited.size() < 2;
                        });
        assertThat(visited).containsExactly("a3", "b1");
        assertThat(count).isEqualTo(2);
    }

    @Test
    void testPrefixLookup() throws Exception {
        rocksDBKv.put(bytes("p1"), bytes("1"));
        rocksDBKv.put(bytes("p2"), bytes("2"));
        rocksDBKv.put(bytes("q1"), bytes("3"));

        List<byte[]> values = rocksDBKv.prefixLookup(bytes("p"));
        assertThat(values).hasSize(2);
        assertThat(values.get(1)).isEqualTo(bytes("2"));
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        rocksDBKv.close();
        rocksDBKv.close();
        assertThat(rocksDBKv.isClosed()).isTrue();
        assertThatThrownBy(() -> rocksDBKv.rangeScan(bytes("a"), null, (k, v) -> true))
                .isInstanceOf(IllegalStateException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
