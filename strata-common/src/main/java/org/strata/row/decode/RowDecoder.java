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
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/** Decodes rows written by {@link org.strata.row.encode.RowEncoder}. */
public class RowDecoder {

    private final DataTypeRoot[] types;

    public RowDecoder(RowType rowType) {
        this.types = new DataTypeRoot[rowType.getFieldCount()];
        for (int i = 0; i < types.length; i++) {
            types[i] = rowType.getTypeAt(i).getTypeRoot();
        }
    }

    public GenericRow decode(byte[] valueBytes) {
        ByteBuffer buffer = ByteBuffer.wrap(valueBytes);
        int fieldCount = buffer.getInt();
        if (fieldCount != types.length) {
            throw new IllegalArgumentException(
                    "Expected " + types.length + " fields, but the value has " + fieldCount);
        }
        byte[] bitmap = new byte[(fieldCount + 7) / 8];
        buffer.get(bitmap);

        GenericRow row = new GenericRow(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            if ((bitmap[i >> 3] & (1 << (i & 7))) != 0) {
                continue;
            }
            if (types[i] == DataTypeRoot.BIGINT) {
                row.setField(i, buffer.getLong());
            } else {
                byte[] bytes = new byte[buffer.getInt()];
                buffer.get(bytes);
                row.setField(i, new String(bytes, StandardCharsets.UTF_8));
            }
        }
        return row;
    }
}
