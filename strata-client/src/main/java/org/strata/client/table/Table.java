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

package org.strata.client.table;

import org.strata.annotation.PublicEvolving;
import org.strata.client.query.Query;
import org.strata.client.query.QueryResult;
import org.strata.client.table.writer.UpsertWriter;
import org.strata.metadata.TableInfo;

/**
 * Used to write rows to and query a table. Queries are planned on the computing tier and run
 * as coprocessor tasks on the buckets of the table.
 */
@PublicEvolving
public interface Table {

    TableInfo getTableInfo();

    /** Creates a writer to upsert and delete rows of this table. */
    UpsertWriter newUpsertWriter();

    /**
     * Plans and runs the query, blocking until all rows are gathered.
     *
     * @throws org.strata.exception.InvalidQueryException if the query does not fit the table
     */
    QueryResult execute(Query query);

    /** Plans the query without running it and renders the plan tree. */
    String explain(Query query);

    /** Runs the query and renders the plan tree with the runtime statistics of each operator. */
    String explainAnalyze(Query query);
}
