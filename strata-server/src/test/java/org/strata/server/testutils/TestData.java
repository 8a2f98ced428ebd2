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

package org.strata.server.testutils;

import org.strata.metadata.IndexDescriptor;
import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableBucket;
import org.strata.metadata.TableDescriptor;
import org.strata.metadata.TableInfo;
import org.strata.metadata.TablePath;
import org.strata.types.DataTypes;
import org.strata.types.RowType;

import java.util.Arrays;

/** A people table shared by the storage tests. */
public final class TestData {

    public static final long TABLE_ID = 150001L;

    public static final RowType ROW_TYPE =
            DataTypes.ROW(
                    DataTypes.FIELD("id", DataTypes.BIGINT().copy(false)),
                    DataTypes.FIELD("city", DataTypes.STRING()),
                    DataTypes.FIELD("age", DataTypes.BIGINT()),
                    DataTypes.FIELD("name", DataTypes.STRING()));

    public static final IndexDescriptor IDX_CITY_AGE =
            IndexDescriptor.of("idx_city_age", "city", "age");

    public static final IndexDescriptor UK_NAME = IndexDescriptor.unique("uk_name", "name");

    public static final TableInfo TABLE_INFO =
            new TableInfo(
                    TablePath.of("test_db", "people"),
                    TABLE_ID,
                    TableDescriptor.builder()
                            .schema(ROW_TYPE)
                            .handle("id")
                            .index(IDX_CITY_AGE)
                            .index(UK_NAME)
                            .distributedBy(1)
                            .build(),
                    1,
                    Arrays.asList(
                            new IndexInfo(1L, IDX_CITY_AGE, ROW_TYPE, "id"),
                            new IndexInfo(2L, UK_NAME, ROW_TYPE, "id")));

    public static final TableBucket TABLE_BUCKET = new TableBucket(TABLE_ID, 0);

    private TestData() {}
}
