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

package org.strata.bucketing;

/** An interface to assign a bucket according to the bucket key byte array. */
public interface BucketingFunction {

    /**
     * Assigns a bucket in {@code [0, numBuckets)} for the given bucket key bytes.
     *
     * @param bucketKey the bucket key bytes
     * @param numBuckets the number of buckets
     */
    int bucketing(byte[] bucketKey, int numBuckets);

    static BucketingFunction of() {
        return new HashBucketingFunction();
    }
}
