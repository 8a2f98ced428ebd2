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

package org.strata.client.admin;

import org.strata.client.testutils.ClientTestBase;
import org.strata.exception.TableAlreadyExistException;
import org.strata.exception.TableNotExistException;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.client.testutils.TestTables.ORDERS_PATH;
import static org.strata.client.testutils.TestTables.ordersDescriptor;

/** Tests for {@link StrataAdmin}. */
class StrataAdminTest extends ClientTestBase {

    private static final TablePath ARCHIVE = TablePath.of("test_db", "orders_archive");

    @Test
    void testCreateTable() throws Exception {
        Admin admin = client.getAdmin();
        admin.createTable(ARCHIVE, ordersDescriptor(2), false).get();

        TableInfo archive = admin.getTableInfo(ARCHIVE).get();
        TableInfo orders = admin.getTableInfo(ORDERS_PATH).get();
        assertThat(archive.getNumBuckets()).isEqualTo(2);
        assertThat(archive.getTableId()).isNotEqualTo(orders.getTableId());
        assertThat(archive.getIndexes().stream().map(IndexInfo::getIndexName))
                .containsExactly(
                        "idx_customer_status", "uk_email", "idx_status", "uk_customer_ref");
        assertThat(admin.listTables().get()).containsExactlyInAnyOrder(ORDERS_PATH, ARCHIVE);
        assertThat(admin.tableExists(ARCHIVE).get()).isTrue();
    }

    @Test
    void testCreateExistingTable() throws Exception {
        Admin admin = client.getAdmin();
        TableInfo before = admin.getTableInfo(ORDERS_PATH).get();

        assertThatThrownBy(
                        () -> admin.createTable(ORDERS_PATH, ordersDescriptor(1), false).get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TableAlreadyExistException.class);
        admin.createTable(ORDERS_PATH, ordersDescriptor(1), true).get();

        assertThat(admin.getTableInfo(ORDERS_PATH).get()).isSameAs(before);
    }

    @Test
    void testDropTable() throws Exception {
        Admin admin = client.getAdmin();
        admin.dropTable(ORDERS_PATH, false).get();

        assertThat(admin.tableExists(ORDERS_PATH).get()).isFalse();
        assertThatThrownBy(() -> admin.getTableInfo(ORDERS_PATH).get())
                .hasCauseInstanceOf(TableNotExistException.class);
        assertThatThrownBy(() -> client.getTable(ORDERS_PATH))
                .isInstanceOf(TableNotExistException.class);
        assertThatThrownBy(() -> admin.dropTable(ORDERS_PATH, false).get())
                .hasCauseInstanceOf(TableNotExistException.class);
        admin.dropTable(ORDERS_PATH, true).get();
    }

    @Test
    void testClosedClientRejectsCalls() {
        client.close();

        assertThatThrownBy(() -> client.getAdmin())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
        assertThatThrownBy(() -> client.getTable(ORDERS_PATH))
                .isInstanceOf(IllegalStateException.class);
    }
}
