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

package org.strata.row.encode;

import org.strata.metadata.IndexInfo;
import org.strata.metadata.TableInfo;
import org.strata.row.InternalRow;
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;

import java.io.ByteArrayOutputStream;

/**
 * Encodes the index key of a table row: the index prefix, one ordered datum per index column and
 * the handle. Index columns may be null, the handle may not.
 */
public class IndexKeyEncoder implements KeyEncoder {

    private final byte[] indexPrefix;
    private final InternalRow.FieldGetter[] fieldGetters;
    private final DataTypeRoot[] fieldTypes;
    private final int handleIndex;

    public IndexKeyEncoder(TableInfo tableInfo, IndexInfo indexInfo) {
        this.indexPrefix = TableCodec.indexPrefix(tableInfo.getTableId(), indexInfo.getIndexId());
        this.handleIndex = tableInfo.getHandleIndex();

        RowType rowType = tableInfo.getRowType();
        int[] positions = indexInfo.getColumnPositions();
        this.fieldGetters = new InternalRow.FieldGetter[positions.length];
        this.fieldTypes = new DataTypeRoot[positions.length];
        for (int i = 0; i < positions.length; i++) {
            fieldGetters[i] = InternalRow.createFieldGetter(positions[i]);
            fieldTypes[i] = rowType.getTypeAt(positions[i]).getTypeRoot();
        }
    }

    @Override
    public byte[] encodeKey(InternalRow row) {
        if (row.isNullAt(handleIndex)) {
            throw new IllegalArgumentException("Handle field cannot be null");
        }
        ByteArrayOutputStream keyStream = new ByteArrayOutputStream(indexPrefix.length + 32);
        keyStream.writeBytes(indexPrefix);
        for (int i = 0; i < fieldGetters.length; i++) {
            OrderedCodec.writeDatum(keyStream, fieldGetters[i].getFieldOrNull(row), fieldTypes[i]);
        }
        OrderedCodec.writeDatum(keyStream, row.getLong(handleIndex), DataTypeRoot.BIGINT);
        return keyStream.toByteArray();
    }

    /**
     * Encodes the index prefix followed by the given leading column values, the start of every
     * key whose leading index columns equal the values.
     */
    public byte[] encodePrefix(Object... leadingValues) {
        if (leadingValues.length > fieldTypes.length) {
            throw new IllegalArgumentException(
                    "Index has "
                            + fieldTypes.length
                            + " columns, but got "
                            + leadingValues.length
                            + " values");
        }
        ByteArrayOutputStream keyStream = new ByteArrayOutputStream(indexPrefix.length + 32);
        keyStream.writeBytes(indexPrefix);
        for (int i = 0; i < leadingValues.length; i++) {
            OrderedCodec.writeDatum(keyStream, leadingValues[i], fieldTypes[i]);
        }
        return keyStream.toByteArray();
    }
}
