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

/** A database name and a table name, identifying a table. */
@PublicEvolving
public class TablePath implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String databaseName;
    private final String tableName;

    public TablePath(String databaseName, String tableName) {
        this.databaseName = Objects.requireNonNull(databaseName, "database name cannot be null");
        this.tableName = Objects.requireNonNull(tableName, "table name cannot be null");
    }

    public static TablePath of(String databaseName, String tableName) {
        return new TablePath(databaseName, tableName);
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TablePath that = (TablePath) o;
        return databaseName.equals(that.databaseName) && tableName.equals(that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseName, tableName);
    }

    @Override
    public String toString() {
        return databaseName + "." + tableName;
    }
}
