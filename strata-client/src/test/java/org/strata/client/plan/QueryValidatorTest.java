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

package org.strata.client.plan;

import org.strata.client.query.Aggregate;
import org.strata.client.query.Filter;
import org.strata.client.query.Query;
import org.strata.exception.InvalidQueryException;
import org.strata.metadata.TableInfo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.client.testutils.TestTables.ordersInfo;

/** Tests for {@link QueryValidator}. */
class QueryValidatorTest {

    private final TableInfo tableInfo = ordersInfo();

    @Test
    void testValidQueries() {
        assertThatCode(
                        () ->
                                QueryValidator.validate(
                                        tableInfo,
                                        Query.builder()
                                                .select("id", "status")
                                                .where(Filter.equal("customer", 1L))
                                                .where(Filter.between("amount", 10L, null))
                                                .limit(0)
                                                .build()))
                .doesNotThrowAnyException();
        assertThatCode(
                        () ->
                                QueryValidator.validate(
                                        tableInfo,
                                        Query.builder()
                                                .select("status")
                                                .aggregate(Aggregate.sum("amount"))
                                                .aggregate(Aggregate.countDistinct("email"))
                                                .groupBy("status")
                                                .build()))
                .doesNotThrowAnyException();
    }

    @Test
    void testQueryWithoutOutput() {
        assertInvalid(Query.builder().build(), "must project columns or aggregate");
    }

    @Test
    void testUnknownColumn() {
        assertInvalid(
                Query.builder().select("id", "price").build(),
                "Column price does not exist in table test_db.orders");
        assertInvalid(
                Query.builder().select("id").where(Filter.equal("zip", 1L)).build(),
                "Column zip does not exist");
    }

    @Test
    void testDuplicates() {
        assertInvalid(Query.builder().select("id", "id").build(), "Duplicate projected column");
        assertInvalid(
                Query.builder()
                        .aggregate(Aggregate.countStar())
                        .aggregate(Aggregate.countStar())
                        .build(),
                "Duplicate aggregate call");
    }

    @Test
    void testFilterValueOfWrongType() {
        assertInvalid(
                Query.builder().select("id").where(Filter.equal("customer", "one")).build(),
                "compares column of type");
        assertInvalid(
                Query.builder().select("id").where(Filter.between("status", 1L, null)).build(),
                "compares column of type");
        assertInvalid(
                Query.builder().select("id").where(Filter.equal("email", "\uD800a")).build(),
                "compares column of type");
    }

    @Test
    void testSumOfString() {
        assertInvalid(
                Query.builder().aggregate(Aggregate.sum("status")).build(), "Cannot apply");
    }

    @Test
    void testProjectedColumnMustBeGrouped() {
        assertInvalid(
                Query.builder()
                        .select("status", "customer")
                        .aggregate(Aggregate.countStar())
                        .groupBy("status")
                        .build(),
                "Projected column customer must be a group by column");
    }

    @Test
    void testNegativeLimit() {
        assertInvalid(Query.builder().select("id").limit(-1).build(), "Limit must not be negative");
    }

    private void assertInvalid(Query query, String message) {
        assertThatThrownBy(() -> QueryValidator.validate(tableInfo, query))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining(message);
    }
}
