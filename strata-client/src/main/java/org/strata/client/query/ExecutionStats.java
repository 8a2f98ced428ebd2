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

package org.strata.client.query;

import org.strata.annotation.PublicEvolving;
import org.strata.rpc.messages.ScanStatistics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/** What running a query cost on both tiers. */
@PublicEvolving
public final class ExecutionStats {

    private final long keysScanned;
    private final long rowsTransferred;
    private final long bytesTransferred;
    private final long rowLookups;
    private final long lookupRoundTrips;
    private final long copTasks;
    private final long elapsedNanos;

    public ExecutionStats(
            long keysScanned,
            long rowsTransferred,
            long bytesTransferred,
            long rowLookups,
            long lookupRoundTrips,
            long copTasks,
            long elapsedNanos) {
        this.keysScanned = keysScanned;
        this.rowsTransferred = rowsTransferred;
        this.bytesTransferred = bytesTransferred;
        this.rowLookups = rowLookups;
        this.lookupRoundTrips = lookupRoundTrips;
        this.copTasks = copTasks;
        this.elapsedNanos = elapsedNanos;
    }

    /** Keys visited by the storage tier, index and record keys alike. */
    public long getKeysScanned() {
        return keysScanned;
    }

    /** Rows sent from the storage tier to the computing tier, raw or partial. */
    public long getRowsTransferred() {
        return rowsTransferred;
    }

    public long getBytesTransferred() {
        return bytesTransferred;
    }

    /** Handles resolved by row lookups. Zero for a query that never left its index. */
    public long getRowLookups() {
        return rowLookups;
    }

    public long getLookupRoundTrips() {
        return lookupRoundTrips;
    }

    public long getCopTasks() {
        return copTasks;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public long getElapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    }

    @Override
    public String toString() {
        return "ExecutionStats{keysScanned="
                + keysScanned
                + ", rowsTransferred="
                + rowsTransferred
                + ", bytesTransferred="
                + bytesTransferred
                + ", rowLookups="
                + rowLookups
                + ", lookupRoundTrips="
                + lookupRoundTrips
                + ", copTasks="
                + copTasks
                + ", elapsedNanos="
                + elapsedNanos
                + '}';
    }

    /** Accumulates the stats of a running query; safe to update from several threads. */
    public static final class Collector {
        private final long startNanos = System.nanoTime();
        private final AtomicLong keysScanned = new AtomicLong();
        private final AtomicLong rowsTransferred = new AtomicLong();
        private final AtomicLong bytesTransferred = new AtomicLong();
        private final AtomicLong rowLookups = new AtomicLong();
        private final AtomicLong lookupRoundTrips = new AtomicLong();
        private final AtomicLong copTasks = new AtomicLong();

        public void recordCopTask(ScanStatistics statistics) {
            copTasks.incrementAndGet();
            keysScanned.addAndGet(statistics.getKeysScanned());
            rowsTransferred.addAndGet(statistics.getRowsReturned());
            bytesTransferred.addAndGet(statistics.getBytesReturned());
        }

        public void recordLookup(int handles, long rowsFound, long bytes) {
            lookupRoundTrips.incrementAndGet();
            rowLookups.addAndGet(handles);
            keysScanned.addAndGet(handles);
            rowsTransferred.addAndGet(rowsFound);
            bytesTransferred.addAndGet(bytes);
        }

        public ExecutionStats finish() {
            return new ExecutionStats(
                    keysScanned.get(),
                    rowsTransferred.get(),
                    bytesTransferred.get(),
                    rowLookups.get(),
                    lookupRoundTrips.get(),
                    copTasks.get(),
                    System.nanoTime() - startNanos);
        }
    }
}
