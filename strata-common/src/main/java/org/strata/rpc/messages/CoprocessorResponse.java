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

package org.strata.rpc.messages;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * The encoded rows a coprocessor task returns: scanned rows of the scan row type, or partial
 * aggregation rows when the task aggregated.
 */
public final class CoprocessorResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<byte[]> rows;
    private final ScanStatistics statistics;

    public CoprocessorResponse(List<byte[]> rows, ScanStatistics statistics) {
        this.rows = Collections.unmodifiableList(rows);
        this.statistics = statistics;
    }

    public List<byte[]> getRows() {
        return rows;
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }
}
