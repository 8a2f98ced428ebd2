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

import java.util.Arrays;

/**
 * An {@link InternalRow} backed by an object array. BIGINT fields hold {@link Long}s and STRING
 * fields hold {@link String}s.
 */
@PublicEvolving
public final class GenericRow implements InternalRow {

    private final Object[] fields;

    public GenericRow(int arity) {
        this.fields = new Object[arity];
    }

    public static GenericRow of(Object... values) {
        GenericRow row = new GenericRow(values.length);
        System.arraycopy(values, 0, row.fields, 0, values.length);
        return row;
    }

    public void setField(int pos, @Nullable Object value) {
        fields[pos] = value;
    }

    @Override
    public int getFieldCount() {
        return fields.length;
    }

    @Override
    public boolean isNullAt(int pos) {
        return fields[pos] == null;
    }

    @Override
    public @Nullable Object getField(int pos) {
        return fields[pos];
    }

    @Override
    public long getLong(int pos) {
        return (Long) fields[pos];
    }

    @Override
    public String getString(int pos) {
        return (String) fields[pos];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenericRow)) {
            return false;
        }
        return Arrays.equals(fields, ((GenericRow) o).fields);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < fields.length; i++) {
            if (i != 0) {
                sb.append(",");
            }
            sb.append(fields[i]);
        }
        return sb.append(")").toString();
    }
}
