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

import org.strata.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link StringUtils}. */
class StringUtilsTest {

    @Test
    void testIsWellFormed() {
        assertThat(StringUtils.isWellFormed("")).isTrue();
        assertThat(StringUtils.isWellFormed("plain ascii")).isTrue();
        assertThat(StringUtils.isWellFormed("中文")).isTrue();
        assertThat(StringUtils.isWellFormed("a😀b")).isTrue();

        assertThat(StringUtils.isWellFormed("\uD800a")).isFalse();
        assertThat(StringUtils.isWellFormed("a\uDBFF")).isFalse();
        assertThat(StringUtils.isWellFormed("\uDC00a")).isFalse();
        assertThat(StringUtils.isWellFormed("\uDE00\uD83D")).isFalse();
    }

    @Test
    void testToUtf8() {
        String s = "aé😀";
        assertThat(StringUtils.toUtf8(s)).isEqualTo(s.getBytes(StandardCharsets.UTF_8));
        assertThat(StringUtils.toUtf8("")).isEmpty();
    }

    @Test
    void testDistinctUnpairedSurrogatesAreNotConflated() {
        // the lenient JDK encoder maps both to "?a"
        assertThat("\uD800a".getBytes(StandardCharsets.UTF_8))
                .isEqualTo("\uDBFFa".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> StringUtils.toUtf8("\uD800a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unpaired surrogate");
        assertThatThrownBy(() -> StringUtils.toUtf8("\uDBFFa"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStringTypeRejectsUnpairedSurrogates() {
        assertThat(DataTypes.STRING().accepts("😀")).isTrue();
        assertThat(DataTypes.STRING().accepts("\uD800a")).isFalse();
        assertThat(DataTypes.STRING().accepts(null)).isTrue();
        assertThat(DataTypes.BIGINT().accepts("\uD800a")).isFalse();
    }
}
