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

import java.util.Arrays;

/** Factory methods of the supported {@link DataType}s. All returned types are nullable. */
@PublicEvolving
public class DataTypes {

    private DataTypes() {}

    public static DataType BIGINT() {
        return new DataType(DataTypeRoot.BIGINT, true);
    }

    public static DataType STRING() {
        return new DataType(DataTypeRoot.STRING, true);
    }

    public static DataField FIELD(String name, DataType type) {
        return new DataField(name, type);
    }

    public static RowType ROW(DataField... fields) {
        return new RowType(Arrays.asList(fields));
    }
}
