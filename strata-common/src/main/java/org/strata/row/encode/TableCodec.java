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

import org.strata.annotation.Internal;

import java.nio.charset.StandardCharsets;

/**
 * Layout of the keys a table occupies in a bucket.
 *
 * <pre>
 * record key: 't' tableId "_r" handle              -> encoded row
 * index key:  't' tableId "_i" indexId datum... handle -> empty
 * </pre>
 *
 * <p>Table and index ids and the record handle are written with {@link
 * OrderedCodec#serializeLong(long)}; the index columns and the trailing handle of an index key
 * are flagged datums.
 */
@Internal
public class TableCodec {

    private static final byte TABLE_PREFIX = 't';
    private static final byte[] RECORD_PREFIX_SEP = "_r".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] INDEX_PREFIX_SEP = "_i".getBytes(StandardCharsets.US_ASCII);

    /** 't' + 8 bytes table id + 2 bytes separator. */
    public static final int RECORD_PREFIX_LENGTH = 1 + 8 + 2;

    /** Record prefix + 8 bytes index id. */
    public static final int INDEX_PREFIX_LENGTH = RECORD_PREFIX_LENGTH + 8;

    public static final int RECORD_KEY_LENGTH = RECORD_PREFIX_LENGTH + 8;

    private TableCodec() {}

    public static byte[] recordPrefix(long tableId) {
        return tablePrefix(tableId, RECORD_PREFIX_SEP, RECORD_PREFIX_LENGTH);
    }

    public static byte[] recordKey(long tableId, long handle) {
        byte[] key = new byte[RECORD_KEY_LENGTH];
        byte[] prefix = recordPrefix(tableId);
        System.arraycopy(prefix, 0, key, 0, prefix.length);
        System.arraycopy(OrderedCodec.serializeLong(handle), 0, key, prefix.length, 8);
        return key;
    }

    public static long decodeRecordHandle(byte[] recordKey) {
        if (recordKey.length != RECORD_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Invalid record key length " + recordKey.length);
        }
        return OrderedCodec.deserializeLong(recordKey, RECORD_PREFIX_LENGTH);
    }

    public static byte[] indexPrefix(long tableId, long indexId) {
        byte[] key = tablePrefix(tableId, INDEX_PREFIX_SEP, INDEX_PREFIX_LENGTH);
        System.arraycopy(OrderedCodec.serializeLong(indexId), 0, key, RECORD_PREFIX_LENGTH, 8);
        return key;
    }

    private static byte[] tablePrefix(long tableId, byte[] separator, int length) {
        byte[] key = new byte[length];
        key[0] = TABLE_PREFIX;
        System.arraycopy(OrderedCodec.serializeLong(tableId), 0, key, 1, 8);
        System.arraycopy(separator, 0, key, 9, 2);
        return key;
    }
}
