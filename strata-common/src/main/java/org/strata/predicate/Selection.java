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

package org.strata.predicate;

import org.strata.row.InternalRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** A conjunction of {@link FieldPredicate}s. An empty selection accepts every row. */
public final class Selection implements Predicate {

    private static final long serialVersionUID = 1L;

    private static final Selection ALWAYS_TRUE = new Selection(Collections.emptyList());

    private final List<FieldPredicate> conditions;

    private Selection(List<FieldPredicate> conditions) {
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public static Selection of(List<FieldPredicate> conditions) {
        return conditions.isEmpty() ? ALWAYS_TRUE : new Selection(conditions);
    }

    public static Selection alwaysTrue() {
        return ALWAYS_TRUE;
    }

    @Override
    public boolean test(InternalRow row) {
        for (FieldPredicate condition : conditions) {
            if (!condition.test(row)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return conditions.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
