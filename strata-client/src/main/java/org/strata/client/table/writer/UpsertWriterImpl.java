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

import org.strata.client.exec.CoprocessorDispatcher;
import org.strata.client.plan.CopTask;
import org.strata.exception.DuplicateKeyException;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableInfo;
import org.strata.row.GenericRow;
import org.strata.row.InternalRow;
import org.strata.row.decode.RowDecoder;
import org.strata.row.encode.IndexKeyEncoder;
import org.strata.row.encode.RowEncoder;
import org.strata.rpc.messages.CoprocessorResponse;
import org.strata.rpc.messages.KeyRange;
import org.strata.rpc.messages.RowMutation;
import org.strata.types.DataType;
import org.strata.types.RowType;
import org.strata.utils.concurrent.FutureUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * The writer to write rows to a table. Writes of one writer are applied in the order they were
 * issued, each after the unique keys of its row were checked against all buckets.
 */
public class UpsertWriterImpl implements UpsertWriter {
    private static final UpsertResult UPSERT_SUCCESS = new UpsertResult();
    private static final DeleteResult DELETE_SUCCESS = new DeleteResult();

    private final TableInfo tableInfo;
    private final RowType rowType;
    private final int handleIndex;
    private final CoprocessorDispatcher dispatcher;
    private final RowEncoder rowEncoder;
    private final List<UniqueKeyCheck> uniqueKeyChecks;

    private CompletableFuture<?> lastWrite = CompletableFuture.completedFuture(null);

    public UpsertWriterImpl(TableInfo tableInfo, CoprocessorDispatcher dispatcher) {
        this.tableInfo = tableInfo;
        this.rowType = tableInfo.getRowType();
        this.handleIndex = tableInfo.getHandleIndex();
        this.dispatcher = dispatcher;
        this.rowEncoder = new RowEncoder(rowType);
        this.uniqueKeyChecks = new ArrayList<>();
        for (IndexInfo index : tableInfo.getIndexes()) {
            if (index.isUnique()) {
                uniqueKeyChecks.add(new UniqueKeyCheck(index));
            }
        }
    }

    /**
     * Inserts the row into the table if no row has its handle, or replaces the row if one does.
     *
     * @param row the row to upsert.
     * @return A {@link CompletableFuture} that always returns the same result when complete
     *     normally.
     */
    @Override
    public CompletableFuture<UpsertResult> upsert(InternalRow row) {
        checkRow(row);
        long handle = row.getLong(handleIndex);
        byte[] value = rowEncoder.encode(row);
        InternalRow snapshot = copy(row);
        return enqueue(
                () ->
                        checkUniqueKeys(snapshot, handle)
                                .thenCompose(
                                        ignored ->
                                                dispatcher.write(
                                                        dispatcher.bucketOf(handle),
                                                        Collections.singletonList(
                                                                RowMutation.upsert(
                                                                        handle, value))))
                                .thenApply(ignored -> UPSERT_SUCCESS));
    }

    /**
     * Deletes the row with the handle of the input row.
     *
     * @param row the row to delete, it must contain the handle.
     * @return A {@link CompletableFuture} that always returns the same result when complete
     *     normally.
     */
    @Override
    public CompletableFuture<DeleteResult> delete(InternalRow row) {
        checkFieldCount(row);
        if (row.isNullAt(handleIndex)) {
            throw new IllegalArgumentException(
                    "The handle column " + tableInfo.getHandleColumn() + " must not be null.");
        }
        long handle = row.getLong(handleIndex);
        TableBucket tableBucket = dispatcher.bucketOf(handle);
        return enqueue(
                () ->
                        dispatcher
                                .write(
                                        tableBucket,
                                        Collections.singletonList(RowMutation.delete(handle)))
                                .thenApply(ignored -> DELETE_SUCCESS));
    }

    @Override
    public void flush() {
        CompletableFuture<?> pending;
        synchronized (this) {
            pending = lastWrite;
        }
        // failed writes are reported through their own futures
        FutureUtils.getUninterruptibly(pending.handle((result, throwable) -> null));
    }

    private synchronized <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> write) {
        CompletableFuture<T> result =
                lastWrite.handle((ignored, throwable) -> null).thenCompose(ignored -> write.get());
        lastWrite = result;
        return result;
    }

    private void checkFieldCount(InternalRow row) {
        if (row.getFieldCount() != rowType.getFieldCount()) {
            throw new IllegalArgumentException(
                    "The field count of the row does not match the table schema. "
                            + "Expected: "
                            + rowType.getFieldCount()
                            + ", Actual: "
                            + row.getFieldCount());
        }
    }

    private void checkRow(InternalRow row) {
        checkFieldCount(row);
        for (int i = 0; i < rowType.getFieldCount(); i++) {
            DataType type = rowType.getTypeAt(i);
            Object value = row.getField(i);
            if (value == null && !type.isNullable()) {
                throw new IllegalArgumentException(
                        String.format(
                                "Column %s is NOT NULL, but the row has a null value for it.",
                                rowType.getFieldNames().get(i)));
            }
            if (!type.accepts(value)) {
                throw new IllegalArgumentException(
                        String.format(
                                "Column %s of type %s does not accept the value %s.",
                                rowType.getFieldNames().get(i), type, value));
            }
        }
    }

    private static InternalRow copy(InternalRow row) {
        GenericRow copy = new GenericRow(row.getFieldCount());
        for (int i = 0; i < row.getFieldCount(); i++) {
            copy.setField(i, row.getField(i));
        }
        return copy;
    }

    private CompletableFuture<Void> checkUniqueKeys(InternalRow row, long handle) {
        if (uniqueKeyChecks.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<Void>> checks = new ArrayList<>(uniqueKeyChecks.size());
        for (UniqueKeyCheck check : uniqueKeyChecks) {
            checks.add(check.check(row, handle));
        }
        return FutureUtils.combineAll(checks).thenApply(ignored -> null);
    }

    /** Looks up the entries of one unique index holding the unique key of a row. */
    private final class UniqueKeyCheck {
        private final IndexInfo index;
        private final IndexKeyEncoder keyEncoder;
        private final RowDecoder entryDecoder;
        private final int entryHandleIndex;

        UniqueKeyCheck(IndexInfo index) {
            this.index = index;
            this.keyEncoder = new IndexKeyEncoder(tableInfo, index);
            this.entryDecoder = new RowDecoder(index.getIndexRowType());
            this.entryHandleIndex = index.getIndexRowType().getFieldCount() - 1;
        }

        CompletableFuture<Void> check(InternalRow row, long handle) {
            int[] positions = index.getColumnPositions();
            Object[] uniqueKey = new Object[positions.length];
            for (int i = 0; i < positions.length; i++) {
                uniqueKey[i] = row.getField(positions[i]);
                if (uniqueKey[i] == null) {
                    // NULL never equals another key
                    return CompletableFuture.completedFuture(null);
                }
            }
            // one entry may be the row's own, so two are enough to find another one
            CopTask task =
                    CopTask.indexScan(
                                    index,
                                    Collections.singletonList(
                                            KeyRange.prefix(keyEncoder.encodePrefix(uniqueKey))))
                            .withLimit(2);
            return dispatcher
                    .dispatch(task)
                    .thenAccept(responses -> checkEntries(responses, uniqueKey, handle));
        }

        private void checkEntries(
                List<CoprocessorResponse> responses, Object[] uniqueKey, long handle) {
            for (CoprocessorResponse response : responses) {
                for (byte[] entry : response.getRows()) {
                    long existing = entryDecoder.decode(entry).getLong(entryHandleIndex);
                    if (existing != handle) {
                        throw new DuplicateKeyException(
                                String.format(
                                        "Duplicate entry %s for unique index %s of table %s, "
                                                + "already held by the row with handle %d.",
                                        Arrays.toString(uniqueKey),
                                        index.getIndexName(),
                                        tableInfo.getTablePath(),
                                        existing));
                    }
                }
            }
        }
    }
}
