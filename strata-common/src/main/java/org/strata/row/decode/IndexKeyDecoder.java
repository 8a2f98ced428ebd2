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

package org.strata.row.decode;

import org.strata.row.GenericRow;
import org.strata.row.encode.OrderedCodec;
import org.strata.row.encode.TableCodec;
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;

/**
 * Decodes an index key back into a row of the index row type: the index columns followed by the
 * handle. This is what lets an index-only scan answer a query without reading the record.
 */
public class IndexKeyDecoder {

    private final DataTypeRoot[] types;

    public IndexKeyDecoder(RowType indexRowType) {
        this.types = new DataTypeRoot[indexRowType.getFieldCount()];
        for (int i = 0; i < types.length; i++) {
            types[i] = indexRowType.getTypeAt(i).getTypeRoot();
        }
    }

    public GenericRow decode(byte[] indexKey) {
        OrderedCodec.Reader reader =
                new OrderedCodec.Reader(indexKey, TableCodec.INDEX_PREFIX_LENGTH);
        GenericRow row = new GenericRow(types.length);
        for (int i = 0; i < types.length; i++) {
            row.setField(i, reader.readDatum(types[i]));
        }
        if (reader.hasRemaining()) {
            throw new IllegalArgumentException(
                    "Index key has "
                            + (indexKey.length - reader.position())
                            + " trailing bytes");
        }
        return row;
    }
}
