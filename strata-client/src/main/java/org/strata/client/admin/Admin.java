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

import org.strata.annotation.PublicEvolving;
import org.strata.exception.TableAlreadyExistException;
import org.strata.exception.TableNotExistException;
import org.strata.metadata.TableDescriptor;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** The administrative client of Strata: creates, drops and describes tables. */
@PublicEvolving
public interface Admin {

    /**
     * Creates a table and its tablets on the storage nodes.
     *
     * <p>The following exceptions can be anticipated when calling {@code get()} on returned future.
     *
     * <ul>
     *   <li>{@link TableAlreadyExistException} if the table already exists and {@code
     *       ignoreIfExists} is false.
     * </ul>
     */
    CompletableFuture<Void> createTable(
            TablePath tablePath, TableDescriptor tableDescriptor, boolean ignoreIfExists);

    /**
     * Drops a table and deletes the data of its tablets.
     *
     * <ul>
     *   <li>{@link TableNotExistException} if the table does not exist and {@code
     *       ignoreIfNotExists} is false.
     * </ul>
     */
    CompletableFuture<Void> dropTable(TablePath tablePath, boolean ignoreIfNotExists);

    /** Get the table info of the given table asynchronously. */
    CompletableFuture<TableInfo> getTableInfo(TablePath tablePath);

    CompletableFuture<Boolean> tableExists(TablePath tablePath);

    CompletableFuture<List<TablePath>> listTables();
}
