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
import org.strata.exception.StrataRuntimeException;

import javax.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Lightweight configuration object which stores key/value pairs. Values set as strings (for
 * example when loaded from a file) are converted to the type of the {@link ConfigOption} when
 * read.
 */
@PublicEvolving
public class Configuration {

    private final HashMap<String, Object> confData;

    public Configuration() {
        this.confData = new HashMap<>();
    }

    public Configuration(Configuration other) {
        this.confData = new HashMap<>(other.confData);
    }

    public <T> T get(ConfigOption<T> option) {
        T value = getOptional(option);
        return value != null ? value : option.defaultValue();
    }

    public @Nullable <T> T getOptional(ConfigOption<T> option) {
        Object raw;
        synchronized (confData) {
            raw = confData.get(option.key());
        }
        if (raw == null) {
            return null;
        }
        try {
            return convert(raw, option.getClazz());
        } catch (IllegalArgumentException e) {
            throw new StrataRuntimeException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.", raw, option.key()),
                    e);
        }
    }

    public <T> Configuration set(ConfigOption<T> option, T value) {
        synchronized (confData) {
            confData.put(option.key(), value);
        }
        return this;
    }

    public void setString(String key, String value) {
        synchronized (confData) {
            confData.put(key, value);
        }
    }

    public boolean contains(ConfigOption<?> option) {
        synchronized (confData) {
            return confData.containsKey(option.key());
        }
    }

    public Map<String, String> toMap() {
        synchronized (confData) {
            Map<String, String> map = new HashMap<>(confData.size());
            confData.forEach((k, v) -> map.put(k, String.valueOf(v)));
            return map;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T convert(Object raw, Class<T> clazz) {
        if (clazz.isInstance(raw)) {
            return (T) raw;
        }
        String value = raw.toString().trim();
        if (clazz == Integer.class) {
            return (T) Integer.valueOf(value);
        } else if (clazz == Long.class) {
            return (T) Long.valueOf(value);
        } else if (clazz == Boolean.class) {
            if (value.equalsIgnoreCase("true")) {
                return (T) Boolean.TRUE;
            } else if (value.equalsIgnoreCase("false")) {
                return (T) Boolean.FALSE;
            }
            throw new IllegalArgumentException("Not a boolean: " + value);
        } else if (clazz == String.class) {
            return (T) value;
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
