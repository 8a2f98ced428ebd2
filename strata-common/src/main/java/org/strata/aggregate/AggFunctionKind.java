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

package org.strata.aggregate;

import org.strata.annotation.PublicEvolving;

/** The supported aggregate functions. */
@PublicEvolving
public enum AggFunctionKind {
    COUNT("count", true),
    COUNT_DISTINCT("count", false),
    SUM("sum", true),
    MIN("min", true),
    MAX("max", true);

    private final String sqlName;
    private final boolean decomposable;

    AggFunctionKind(String sqlName, boolean decomposable) {
        this.sqlName = sqlName;
        this.decomposable = decomposable;
    }

    public String getSqlName() {
        return sqlName;
    }

    /**
     * Whether the function can be split into a partial phase on the storage tier and a final
     * phase merging the partial states. Deduplication needs every value in one place, so a
     * distinct count is not decomposable.
     */
    public boolean isDecomposable() {
        return decomposable;
    }
}
