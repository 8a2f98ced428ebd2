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

package org.strata.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link BytesUtils}. */
class BytesUtilsTest {

    @Test
    void testPrefixNext() {
        assertThat(BytesUtils.prefixNext(new byte[] {1, 2})).containsExactly(1, 3);
        assertThat(BytesUtils.prefixNext(new byte[] {1, (byte) 0xFF})).containsExactly(2);
        assertThat(BytesUtils.prefixNext(new byte[] {(byte) 0x7F})).containsExactly((byte) 0x80);
        assertThat(BytesUtils.prefixNext(new byte[] {(byte) 0xFF, (byte) 0xFF})).isNull();
        assertThat(BytesUtils.prefixNext(new byte[0])).isNull();
    }

    @Test
    void testPrefixNextIsGreaterThanEveryExtension() {
        byte[] prefix = {5, (byte) 0xFE};
        byte[] next = BytesUtils.prefixNext(prefix);
        assertThat(next).isNotNull();
        byte[] longest = {5, (byte) 0xFE, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
        assertThat(BytesUtils.compare(longest, next)).isNegative();
        assertThat(BytesUtils.compare(prefix, next)).isNegative();
    }

    @Test
    void testCompareIsUnsigned() {
        assertThat(BytesUtils.compare(new byte[] {1}, new byte[] {(byte) 0x80})).isNegative();
        assertThat(BytesUtils.compare(new byte[] {1, 2}, new byte[] {1})).isPositive();
        assertThat(BytesUtils.compare(new byte[] {1, 2}, new byte[] {1, 2})).isZero();
    }

    @Test
    void testPrefixEquals() {
        assertThat(BytesUtils.prefixEquals(new byte[] {1, 2}, new byte[] {1, 2, 3})).isTrue();
        assertThat(BytesUtils.prefixEquals(new byte[] {1, 3}, new byte[] {1, 2, 3})).isFalse();
        assertThat(BytesUtils.prefixEquals(new byte[] {1, 2, 3}, new byte[] {1, 2})).isFalse();
    }
}
