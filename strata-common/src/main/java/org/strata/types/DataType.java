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

package org.strata.types;

import org.strata.annotation.PublicEvolving;
import org.strata.utils.StringUtils;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

/** Describes the logical type of a value: its {@link DataTypeRoot} and whether it may be null. */
@PublicEvolving
public final class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DataTypeRoot typeRoot;
    private final boolean isNullable;

    DataType(DataTypeRoot typeRoot, boolean isNullable) {
        this.typeRoot = Objects.requireNonNull(typeRoot);
        this.isNullable = isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean isNullable() {
        return isNullable;
    }

    /** Returns a copy of this type with the given nullability. */
    public DataType copy(boolean isNullable) {
        return new DataType(typeRoot, isNullable);
    }

    /**
     * Returns whether the given value is a valid instance of this type. A STRING value must be
     * well-formed UTF-16, it must not contain unpaired surrogates.
     */
    public boolean accepts(@Nullable Object value) {
        if (value == null) {
            return isNullable;
        }
        if (!typeRoot.getJavaClass().isInstance(value)) {
            return false;
        }
        return typeRoot != DataTypeRoot.STRING || StringUtils.isWellFormed((String) value);
    }

    public String asSummaryString() {
        return isNullable ? typeRoot.name() : typeRoot.name() + " NOT NULL";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeRoot, isNullable);
    }

    @Override
    public String toString() {
        return asSummaryString();
    }
}
