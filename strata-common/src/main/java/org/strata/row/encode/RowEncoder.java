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

import org.strata.row.InternalRow;
import org.strata.types.DataTypeRoot;
import org.strata.types.RowType;
import org.strata.utils.StringUtils;

import java.nio.ByteBuffer;

/**
 * Encodes rows into the compact value format used for records and for rows transferred between
 * the tiers.
 *
 * <pre>
 * int fieldCount | null bitmap (ceil(fieldCount / 8) bytes) | fields...
 * BIGINT: 8 bytes, STRING: int length + UTF-8 bytes, null fields are omitted
 * </pre>
 */
public class RowEncoder {

    private final DataTypeRoot[] types;

    public RowEncoder(RowType rowType) {
        this.types = new DataTypeRoot[rowType.getFieldCount()];
        for (int i = 0; i < types.length; i++) {
            types[i] = rowType.getTypeAt(i).getTypeRoot();
        }
    }

    public byte[] encode(InternalRow row) {
        if (row.getFieldCount() != types.length) {
            throw new IllegalArgumentException(
                    "Expected "
                            + types.length
                            + " fields, but the row has "
                            + row.getFieldCount());
        }
        int bitmapSize = nullBitmapSize(types.length);
        byte[][] strings = new byte[types.length][];
        int size = 4 + bitmapSize;
        for (int i = 0; i < types.length; i++) {
            if (row.isNullAt(i)) {
                continue;
            }
            if (types[i] == DataTypeRoot.BIGINT) {
                size += 8;
            } else {
                strings[i] = StringUtils.toUtf8(row.getString(i));
                size += 4 + strings[i].length;
            }
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.putInt(types.length);
        byte[] bitmap = new byte[bitmapSize];
        for (int i = 0; i < types.length; i++) {
            if (row.isNullAt(i)) {
                bitmap[i >> 3] |= (byte) (1 << (i & 7));
            }
        }
        buffer.put(bitmap);
        for (int i = 0; i < types.length; i++) {
            if (row.isNullAt(i)) {
                continue;
            }
            if (types[i] == DataTypeRoot.BIGINT) {
                buffer.putLong(row.getLong(i));
            } else {
                buffer.putInt(strings[i].length);
                buffer.put(strings[i]);
            }
        }
        return buffer.array();
    }

    static int nullBitmapSize(int fieldCount) {
        return (fieldCount + 7) / 8;
    }
}
