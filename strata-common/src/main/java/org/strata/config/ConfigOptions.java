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

import org.strata.annotation.PublicEvolving;

import static org.strata.utils.Preconditions.checkNotNull;

/**
 * Config options for Strata, and the builder to create them.
 *
 * <pre>{@code
 * ConfigOption<Integer> threads = ConfigOptions.key("coprocessor.threads")
 *     .intType()
 *     .defaultValue(4)
 *     .withDescription("...");
 * }</pre>
 */
@PublicEvolving
public class ConfigOptions {

    // ------------------------------------------------------------------------
    //  Cluster
    // ------------------------------------------------------------------------

    public static final ConfigOption<String> DATA_DIR =
            key("data.dir")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "The directory under which every tablet server keeps the RocksDB "
                                    + "instances of its buckets.");

    public static final ConfigOption<Integer> CLUSTER_TABLET_SERVERS =
            key("cluster.tablet-servers")
                    .intType()
                    .defaultValue(3)
                    .withDescription("The number of storage nodes started by a local cluster.");

    public static final ConfigOption<Integer> TABLE_DEFAULT_BUCKET_NUM =
            key("table.default.bucket-num")
                    .intType()
                    .defaultValue(4)
                    .withDescription(
                            "The number of buckets of a table that doesn't declare its own.");

    // ------------------------------------------------------------------------
    //  Coprocessor
    // ------------------------------------------------------------------------

    public static final ConfigOption<Integer> COPROCESSOR_THREADS =
            key("coprocessor.threads")
                    .intType()
                    .defaultValue(4)
                    .withDescription(
                            "The number of worker threads a tablet server uses to run "
                                    + "coprocessor tasks, batch gets and writes.");

    public static final ConfigOption<Boolean> COPROCESSOR_AGGREGATION_PUSHDOWN_ENABLED =
            key("coprocessor.aggregation-pushdown.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether decomposable aggregations are computed partially on the "
                                    + "storage tier so that only partial results are transferred.");

    public static final ConfigOption<Long> COPROCESSOR_SLOW_TASK_THRESHOLD =
            key("coprocessor.slow-task-threshold")
                    .longType()
                    .defaultValue(500L)
                    .withDescription(
                            "Coprocessor tasks running longer than this many milliseconds are "
                                    + "logged as slow.");

    // ------------------------------------------------------------------------
    //  Client
    // ------------------------------------------------------------------------

    public static final ConfigOption<Integer> CLIENT_LOOKUP_BATCH_SIZE =
            key("client.lookup.batch-size")
                    .intType()
                    .defaultValue(256)
                    .withDescription(
                            "The maximum number of handles sent to a bucket in one row lookup "
                                    + "request.");

    public static final ConfigOption<Integer> CLIENT_LOOKUP_CONCURRENCY =
            key("client.lookup.concurrency")
                    .intType()
                    .defaultValue(4)
                    .withDescription(
                            "The maximum number of row lookup requests a query keeps in flight.");

    public static final ConfigOption<Boolean> PLANNER_COUNT_DISTINCT_REWRITE_ENABLED =
            key("planner.count-distinct-rewrite.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether COUNT(DISTINCT c) is rewritten to COUNT(c) when a unique "
                                    + "index and the equality predicates of the query guarantee "
                                    + "that the values of c are distinct.");

    /**
     * Starts building a new {@link ConfigOption}.
     *
     * @param key The key for the config option.
     * @return The builder for the config option with the given key.
     */
    public static OptionBuilder key(String key) {
        checkNotNull(key, "key must not be null");
        return new OptionBuilder(key);
    }

    /** The option builder is used to create a {@link ConfigOption}. */
    public static final class OptionBuilder {
        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        public TypedConfigOptionBuilder<Boolean> booleanType() {
            return new TypedConfigOptionBuilder<>(key, Boolean.class);
        }

        public TypedConfigOptionBuilder<Integer> intType() {
            return new TypedConfigOptionBuilder<>(key, Integer.class);
        }

        public TypedConfigOptionBuilder<Long> longType() {
            return new TypedConfigOptionBuilder<>(key, Long.class);
        }

        public TypedConfigOptionBuilder<String> stringType() {
            return new TypedConfigOptionBuilder<>(key, String.class);
        }
    }

    /**
     * Builder for {@link ConfigOption} with a defined atomic type.
     *
     * @param <T> atomic type of the option
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, value, "");
        }

        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, clazz, null, "");
        }
    }

    private ConfigOptions() {}
}
