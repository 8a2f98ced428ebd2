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

/** The root of a {@link DataType}, without nullability. */
@PublicEvolving
public enum DataTypeRoot {
    /** 8-byte signed integer, stored as {@link Long}. */
    BIGINT(Long.class),

    /** Variable-length character string, stored as {@link String}. */
    STRING(String.class);

    private final Class<?> javaClass;

    DataTypeRoot(Class<?> javaClass) {
        this.javaClass = javaClass;
    }

    public Class<?> getJavaClass() {
        return javaClass;
    }
}
