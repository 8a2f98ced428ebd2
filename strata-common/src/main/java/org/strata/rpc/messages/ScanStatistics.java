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

package org.strata.rpc.messages;

import java.io.Serializable;

/** What a coprocessor task did on the storage tier. */
public final class ScanStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long keysScanned;
    private final long rowsMatched;
    private final long rowsReturned;
    private final long bytesReturned;
    private final long elapsedNanos;

    public ScanStatistics(
            long keysScanned,
            long rowsMatched,
            long rowsReturned,
            long bytesReturned,
            long elapsedNanos) {
        this.keysScanned = keysScanned;
        this.rowsMatched = rowsMatched;
        this.rowsReturned = rowsReturned;
        this.bytesReturned = bytesReturned;
        this.elapsedNanos = elapsedNanos;
    }

    /** Keys visited by the storage iterator. */
    public long getKeysScanned() {
        return keysScanned;
    }

    /** Rows that passed the pushed-down selection. */
    public long getRowsMatched() {
        return rowsMatched;
    }

    /** Rows (raw or partial) sent back to the computing tier. */
    public long getRowsReturned() {
        return rowsReturned;
    }

    public long getBytesReturned() {
        return bytesReturned;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    @Override
    public String toString() {
        return "ScanStatistics{keysScanned="
                + keysScanned
                + ", rowsMatched="
                + rowsMatched
                + ", rowsReturned="
                + rowsReturned
                + ", bytesReturned="
                + bytesReturned
                + ", elapsedNanos="
                + elapsedNanos
                + '}';
    }
}
