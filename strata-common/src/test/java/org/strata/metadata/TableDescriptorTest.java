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

import org.strata.types.DataTypes;
import org.strata.types.RowType;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link TableDescriptor}. */
class TableDescriptorTest {

    private static final RowType ROW_TYPE =
            DataTypes.ROW(
                    DataTypes.FIELD("id", DataTypes.BIGINT().copy(false)),
                    DataTypes.FIELD("a", DataTypes.BIGINT()),
                    DataTypes.FIELD("b", DataTypes.STRING()));

    @Test
    void testBuild() {
        TableDescriptor descriptor =
                TableDescriptor.builder()
                        .schema(ROW_TYPE)
                        .handle("id")
                        .index(IndexDescriptor.of("idx_a_b", "a", "b"))
                        .index(IndexDescriptor.unique("uk_b", "b"))
                        .distributedBy(3)
                        .comment("orders")
                        .build();

        assertThat(descriptor.getHandleColumn()).isEqualTo("id");
        assertThat(descriptor.getIndexes()).hasSize(2);
        assertThat(descriptor.getIndexes().get(1).isUnique()).isTrue();
        assertThat(descriptor.getBucketCount()).hasValue(3);
        assertThat(descriptor.getComment()).hasValue("orders");
    }

    @Test
    void testHandleMustBeNonNullBigint() {
        assertThatThrownBy(() -> TableDescriptor.builder().schema(ROW_TYPE).handle("a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BIGINT NOT NULL");
        assertThatThrownBy(() -> TableDescriptor.builder().schema(ROW_TYPE).handle("x").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void testInvalidIndexes() {
        assertThatThrownBy(
                        () ->
                                TableDescriptor.builder()
                                        .schema(ROW_TYPE)
                                        .handle("id")
                                        .index(IndexDescriptor.of("idx", "a"))
                                        .index(IndexDescriptor.of("idx", "b"))
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate index name");
        assertThatThrownBy(
                        () ->
                                TableDescriptor.builder()
                                        .schema(ROW_TYPE)
                                        .handle("id")
                                        .index(IndexDescriptor.of("idx", "a", "c"))
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Column c of index idx does not exist");
        assertThatThrownBy(
                        () ->
                                TableDescriptor.builder()
                                        .schema(ROW_TYPE)
                                        .handle("id")
                                        .index(IndexDescriptor.of("idx", "a", "a"))
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("appears twice");
    }

    @Test
    void testBucketCountMustBePositive() {
        assertThatThrownBy(
                        () ->
                                TableDescriptor.builder()
                                        .schema(ROW_TYPE)
                                        .handle("id")
                                        .distributedBy(0)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
