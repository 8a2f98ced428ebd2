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

package org.strata.server.coprocessor;

import org.strata.row.InternalRow;
import org.strata.row.decode.IndexKeyDecoder;
import org.strata.row.decode.RowDecoder;
import org.strata.rpc.messages.CoprocessorRequest;
import org.strata.types.RowType;

/**
 * Decodes a scanned key-value entry into a row of the scan row type. A table scan decodes the
 * record value, an index scan decodes the index key and never looks at the value.
 */
public interface ScanRowDecoder {

    InternalRow decode(byte[] key, byte[] value);

    static ScanRowDecoder of(CoprocessorRequest request) {
        RowType scanRowType = request.getScanRowType();
        switch (request.getScanType()) {
            case TABLE:
                RowDecoder rowDecoder = new RowDecoder(scanRowType);
                return (key, value) -> rowDecoder.decode(value);
            case INDEX:
                IndexKeyDecoder indexKeyDecoder = new IndexKeyDecoder(scanRowType);
                return (key, value) -> indexKeyDecoder.decode(key);
            default:
                throw new IllegalArgumentException("Unknown scan type " + request.getScanType());
        }
    }
}
