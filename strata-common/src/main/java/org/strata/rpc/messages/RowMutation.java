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

import javax.annotation.Nullable;

import java.io.Serializable;

/** An upsert (with the encoded row) or a delete of the row with the given handle. */
public final class RowMutation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long handle;
    private final @Nullable byte[] value;

    private RowMutation(long handle, @Nullable byte[] value) {
        this.handle = handle;
        this.value = value;
    }

    public static RowMutation upsert(long handle, byte[] value) {
        return new RowMutation(handle, value);
    }

    public static RowMutation delete(long handle) {
        return new RowMutation(handle, null);
    }

    public long getHandle() {
        return handle;
    }

    public boolean isDelete() {
        return value == null;
    }

    /** The encoded row, null for a delete. */
    public @Nullable byte[] getValue() {
        return value;
    }
}
