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

import javax.annotation.Nullable;

/**
 * The state of one aggregate call for one group.
 *
 * <p>A partial accumulator consumes raw values with {@link #add(Object)} and emits {@link
 * #partial()}; a final accumulator consumes partial states with {@link #merge(Object)}; both emit
 * the final value with {@link #result()}.
 */
public interface Accumulator {

    /** Adds an input value; {@code null} is a SQL NULL (or any row, for {@code COUNT(*)}). */
    void add(@Nullable Object value);

    /** Merges a partial state produced by {@link #partial()} of another accumulator. */
    void merge(@Nullable Object partialState);

    @Nullable
    Object partial();

    @Nullable
    Object result();
}
