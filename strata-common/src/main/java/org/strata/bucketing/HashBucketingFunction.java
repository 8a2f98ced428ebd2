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

import org.strata.row.encode.OrderedCodec;

/** Murmur3 (32 bit, seed 42) hash of the bucket key, modulo the number of buckets. */
public class HashBucketingFunction implements BucketingFunction {

    private static final int SEED = 42;
    private static final int C1 = 0xcc9e2d51;
    private static final int C2 = 0x1b873593;

    @Override
    public int bucketing(byte[] bucketKey, int numBuckets) {
        if (numBuckets <= 0) {
            throw new IllegalArgumentException("Number of buckets must be positive: " + numBuckets);
        }
        return Math.abs(hashBytes(bucketKey) % numBuckets);
    }

    /** Bucket of a row identified by its handle. */
    public int bucketing(long handle, int numBuckets) {
        return bucketing(OrderedCodec.serializeLong(handle), numBuckets);
    }

    static int hashBytes(byte[] bytes) {
        int h1 = SEED;
        int length = bytes.length;
        int roundedEnd = length & 0xfffffffc;
        for (int i = 0; i < roundedEnd; i += 4) {
            int k1 =
                    (bytes[i] & 0xff)
                            | ((bytes[i + 1] & 0xff) << 8)
                            | ((bytes[i + 2] & 0xff) << 16)
                            | (bytes[i + 3] << 24);
            h1 = mixH1(h1, mixK1(k1));
        }
        int k1 = 0;
        switch (length & 0x03) {
            case 3:
                k1 = (bytes[roundedEnd + 2] & 0xff) << 16;
                // fall through
            case 2:
                k1 |= (bytes[roundedEnd + 1] & 0xff) << 8;
                // fall through
            case 1:
                k1 |= bytes[roundedEnd] & 0xff;
                h1 ^= mixK1(k1);
                break;
            default:
        }
        return fmix(h1, length);
    }

    private static int mixK1(int k1) {
        k1 *= C1;
        k1 = Integer.rotateLeft(k1, 15);
        k1 *= C2;
        return k1;
    }

    private static int mixH1(int h1, int k1) {
        h1 ^= k1;
        h1 = Integer.rotateLeft(h1, 13);
        h1 = h1 * 5 + 0xe6546b64;
        return h1;
    }

    private static int fmix(int h1, int length) {
        h1 ^= length;
        h1 ^= h1 >>> 16;
        h1 *= 0x85ebca6b;
        h1 ^= h1 >>> 13;
        h1 *= 0xc2b2ae35;
        h1 ^= h1 >>> 16;
        return h1;
    }
}
