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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Ordered, named fields of a row. Field names are unique. */
@PublicEvolving
public final class RowType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<DataField> fields;

    public RowType(List<DataField> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        Set<String> names = new HashSet<>();
        for (DataField field : fields) {
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException(
                        "Field names must be unique, found duplicate: " + field.getName());
            }
        }
    }

    public static RowType of(DataType[] types, String[] names) {
        if (types.length != names.length) {
            throw new IllegalArgumentException("Types and names must have the same length.");
        }
        List<DataField> fields = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) {
            fields.add(new DataField(names[i], types[i]));
        }
        return new RowType(fields);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public int getFieldCount() {
        return fields.size();
    }

    public List<String> getFieldNames() {
        return fields.stream().map(DataField::getName).collect(Collectors.toList());
    }

    public List<DataType> getChildren() {
        return fields.stream().map(DataField::getType).collect(Collectors.toList());
    }

    public DataType getTypeAt(int i) {
        return fields.get(i).getType();
    }

    /** Returns the position of the field with the given name, or -1 if there is none. */
    public int getFieldIndex(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    /** Returns a row type of the given fields, in the given order. */
    public RowType project(List<String> names) {
        List<DataField> projected = new ArrayList<>(names.size());
        for (String name : names) {
            int index = getFieldIndex(name);
            if (index < 0) {
                throw new IllegalArgumentException(
                        "Field " + name + " does not exist in " + getFieldNames());
            }
            projected.add(fields.get(index));
        }
        return new RowType(projected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((RowType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ROW<"
                + fields.stream().map(DataField::toString).collect(Collectors.joining(", "))
                + ">";
    }
}
