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

package org.strata.metadata;

import org.strata.annotation.PublicEvolving;

import java.io.Serializable;
import java.util.Objects;

/** A bucket of a table, the unit of data placement on the storage tier. */
@PublicEvolving
public class TableBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long tableId;
    private final int bucket;

    public TableBucket(long tableId, int bucket) {
        this.tableId = tableId;
        this.bucket = bucket;
    }

    public long getTableId() {
        return tableId;
    }

    public int getBucket() {
        return bucket;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableBucket that = (TableBucket) o;
        return tableId == that.tableId && bucket == that.bucket;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, bucket);
    }

    @Override
    public String toString() {
        return "TableBucket{tableId=" + tableId + ", bucket=" + bucket + '}';
    }
}
