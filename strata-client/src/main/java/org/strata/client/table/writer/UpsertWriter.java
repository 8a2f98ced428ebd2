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

package org.strata.client.table.writer;

import org.strata.annotation.PublicEvolving;
import org.strata.row.InternalRow;

import java.util.concurrent.CompletableFuture;

/** The writer to upsert and delete rows of a table. */
@PublicEvolving
public interface UpsertWriter {

    /**
     * Inserts the row if no row has its handle, or replaces the row that has.
     *
     * @param row the row to upsert, with a value for every column of the table.
     * @return A {@link CompletableFuture} completed when the row and its index entries are
     *     written, or completed with a {@link org.strata.exception.DuplicateKeyException} if
     *     another row holds one of its unique index keys.
     */
    CompletableFuture<UpsertResult> upsert(InternalRow row);

    /**
     * Deletes the row with the handle of the given row, along with its index entries. Deleting
     * a row that does not exist succeeds.
     *
     * @param row the row to delete, only its handle is read.
     */
    CompletableFuture<DeleteResult> delete(InternalRow row);

    /** Waits until every write issued so far is done. */
    void flush();
}
