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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** Global configuration object for Strata, loaded from {@code strata.yaml}. */
public final class GlobalConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalConfiguration.class);

    public static final String STRATA_CONF_FILENAME = "strata.yaml";

    private GlobalConfiguration() {}

    /**
     * Loads the configuration files from the specified directory.
     *
     * @param configDir the directory which contains the {@code strata.yaml}
     * @return The configuration loaded from the file.
     */
    public static Configuration loadConfiguration(String configDir) {
        File confDirFile = new File(configDir);
        if (!confDirFile.exists()) {
            throw new StrataRuntimeException(
                    "The given configuration directory name '"
                            + configDir
                            + "' ("
                            + confDirFile.getAbsolutePath()
                            + ") does not describe an existing directory.");
        }
        File yamlConfigFile = new File(confDirFile, STRATA_CONF_FILENAME);
        if (!yamlConfigFile.exists()) {
            throw new StrataRuntimeException(
                    "The configuration file '"
                            + STRATA_CONF_FILENAME
                            + "' ("
                            + yamlConfigFile.getAbsolutePath()
                            + ") does not exist.");
        }
        return loadYAMLResource(yamlConfigFile);
    }

    /**
     * Loads a flat YAML file: every line is a {@code key: value} pair, {@code #} starts a comment
     * and nested structures are not supported.
     */
    private static Configuration loadYAMLResource(File file) {
        Configuration config = new Configuration();
        try (BufferedReader reader =
                Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String[] comments = line.split("#", 2);
                String conf = comments[0].trim();
                if (conf.isEmpty()) {
                    continue;
                }
                String[] kv = conf.split(": ", 2);
                if (kv.length == 1) {
                    LOG.warn(
                            "Error while trying to split key and value in configuration file "
                                    + "{}:{}: \"{}\"",
                            file,
                            lineNo,
                            line);
                    continue;
                }
                String key = kv[0].trim();
                String value = kv[1].trim();
                if (key.isEmpty() || value.isEmpty()) {
                    LOG.warn(
                            "Error after splitting key and value in configuration file "
                                    + "{}:{}: \"{}\"",
                            file,
                            lineNo,
                            line);
                    continue;
                }
                LOG.info("Loading configuration property: {}, {}", key, value);
                config.setString(key, value);
            }
        } catch (IOException e) {
            throw new StrataRuntimeException("Error parsing YAML configuration " + file, e);
        }
        return config;
    }
}
