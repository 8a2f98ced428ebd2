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

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * A {@code ConfigOption} describes a configuration parameter. It encapsulates the configuration
 * key, the value type, a default value and a description.
 *
 * <p>{@code ConfigOptions} are built via the {@link ConfigOptions} class. Once created, a config
 * option is immutable.
 *
 * @param <T> The type of value associated with the configuration option.
 */
@PublicEvolving
public class ConfigOption<T> {

    private final String key;
    private final Class<T> clazz;
    private final @Nullable T defaultValue;
    private final String description;

    ConfigOption(String key, Class<T> clazz, @Nullable T defaultValue, String description) {
        this.key = Objects.requireNonNull(key);
        this.clazz = Objects.requireNonNull(clazz);
        this.defaultValue = defaultValue;
        this.description = description;
    }

    /** Creates a new config option, using this option's key and type and the given description. */
    public ConfigOption<T> withDescription(String description) {
        return new ConfigOption<>(key, clazz, defaultValue, description);
    }

    public String key() {
        return key;
    }

    public @Nullable T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    Class<T> getClazz() {
        return clazz;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConfigOption<?> that = (ConfigOption<?>) o;
        return key.equals(that.key)
                && clazz.equals(that.clazz)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, clazz, defaultValue);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
