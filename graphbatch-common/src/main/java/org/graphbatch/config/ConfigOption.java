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

package org.graphbatch.config;

import org.graphbatch.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Objects;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * A {@code ConfigOption} describes a configuration parameter. It encapsulates the configuration
 * key, the value type, an optional default value and a description.
 *
 * <p>{@code ConfigOptions} are built via the {@link ConfigBuilder} class. Once created, a config
 * option is immutable.
 *
 * @param <T> The type of value associated with the configuration option.
 */
@PublicEvolving
public class ConfigOption<T> {

    static final String EMPTY_DESCRIPTION = "";

    private final String key;

    @Nullable private final T defaultValue;

    private final String description;

    /**
     * Type of the value that this ConfigOption describes. For a list option this is the type of
     * the list elements.
     */
    private final Class<?> clazz;

    private final boolean isList;

    ConfigOption(
            String key,
            Class<?> clazz,
            String description,
            @Nullable T defaultValue,
            boolean isList) {
        this.key = checkNotNull(key);
        this.description = checkNotNull(description);
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
        this.isList = isList;
    }

    /**
     * Creates a new config option, using this option's key and default value, and adding the given
     * description.
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue, isList);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Nullable
    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    Class<?> getClazz() {
        return clazz;
    }

    boolean isList() {
        return isList;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && this.isList == that.isList
                    && this.clazz == that.clazz
                    && Objects.equals(this.defaultValue, that.defaultValue);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
