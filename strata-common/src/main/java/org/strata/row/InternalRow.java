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

package org.strata.row;

import org.strata.annotation.PublicEvolving;

import javax.annotation.Nullable;

/** A row of positional values, the unit of data exchanged between the tiers. */
@PublicEvolving
public interface InternalRow {

    int getFieldCount();

    boolean isNullAt(int pos);

    @Nullable
    Object getField(int pos);

    long getLong(int pos);

    String getString(int pos);

    /** Accessor for the field at a fixed position, see {@link #createFieldGetter(int)}. */
    interface FieldGetter {
        @Nullable
        Object getFieldOrNull(InternalRow row);
    }

    static FieldGetter createFieldGetter(int fieldPos) {
        return row -> row.isNullAt(fieldPos) ? null : row.getField(fieldPos);
    }
}
