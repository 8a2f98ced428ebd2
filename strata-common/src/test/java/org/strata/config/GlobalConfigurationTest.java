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

package org.strata.config;

import org.strata.exception.StrataRuntimeException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link GlobalConfiguration}. */
class GlobalConfigurationTest {

    @TempDir File tmpDir;

    @Test
    void testLoadConfiguration() throws Exception {
        File confFile = new File(tmpDir, GlobalConfiguration.STRATA_CONF_FILENAME);
        Files.write(
                confFile.toPath(),
                Arrays.asList(
                        "# storage",
                        "data.dir: /tmp/strata-data",
                        "coprocessor.threads: 8 # more threads",
                        "",
                        "coprocessor.aggregation-pushdown.enabled: false",
                        "invalid line",
                        "client.lookup.batch-size:"),
                StandardCharsets.UTF_8);

        Configuration conf = GlobalConfiguration.loadConfiguration(tmpDir.getAbsolutePath());

        assertThat(conf.get(ConfigOptions.DATA_DIR)).isEqualTo("/tmp/strata-data");
        assertThat(conf.get(ConfigOptions.COPROCESSOR_THREADS)).isEqualTo(8);
        assertThat(conf.get(ConfigOptions.COPROCESSOR_AGGREGATION_PUSHDOWN_ENABLED)).isFalse();
        assertThat(conf.contains(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE)).isFalse();
        assertThat(conf.get(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE))
                .isEqualTo(ConfigOptions.CLIENT_LOOKUP_BATCH_SIZE.defaultValue());
    }

    @Test
    void testMissingDirectoryOrFile() {
        File missing = new File(tmpDir, "missing");
        assertThatThrownBy(() -> GlobalConfiguration.loadConfiguration(missing.getAbsolutePath()))
                .isInstanceOf(StrataRuntimeException.class)
                .hasMessageContaining("does not describe an existing directory");
        assertThatThrownBy(() -> GlobalConfiguration.loadConfiguration(tmpDir.getAbsolutePath()))
                .isInstanceOf(StrataRuntimeException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void testUnparsableValue() {
        Configuration conf = new Configuration();
        conf.setString(ConfigOptions.COPROCESSOR_THREADS.key(), "many");
        assertThatThrownBy(() -> conf.get(ConfigOptions.COPROCESSOR_THREADS))
                .isInstanceOf(StrataRuntimeException.class)
                .hasMessageContaining("coprocessor.threads");
    }
}
