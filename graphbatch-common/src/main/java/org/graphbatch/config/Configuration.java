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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.graphbatch.config.ConfigurationUtils.convertToString;
import static org.graphbatch.config.ConfigurationUtils.convertValue;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values set through a typed
 * {@link ConfigOption} are stored as is, values set as strings are parsed lazily into the option's
 * type on access.
 */
@ThreadSafe
@PublicEvolving
public class Configuration {

    private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

    /** Stores the concrete key/value pairs of this configuration object. */
    @GuardedBy("confData")
    private final HashMap<String, Object> confData;

    /** Creates a new empty configuration. */
    public Configuration() {
        this.confData = new HashMap<>();
    }

    /**
     * Creates a new configuration with the copy of the given configuration.
     *
     * @param other The configuration to copy the entries from.
     */
    public Configuration(Configuration other) {
        synchronized (other.confData) {
            this.confData = new HashMap<>(other.confData);
        }
    }

    /** Creates a new configuration that is initialized with the options of the given map. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        map.forEach(configuration::setString);
        return configuration;
    }

    // --------------------------------------------------------------------------------------------

    /**
     * Returns the value associated with the given config option as a string.
     *
     * @param configOption The configuration option
     * @return the (default) value associated with the given config option
     */
    public String getString(ConfigOption<String> configOption) {
        return get(configOption);
    }

    /**
     * Adds the given key/value pair to the configuration object. The value is parsed into the
     * option's type when it is read.
     */
    public void setString(String key, String value) {
        setValueInternal(key, value);
    }

    public int getInt(ConfigOption<Integer> configOption) {
        return get(configOption);
    }

    public long getLong(ConfigOption<Long> configOption) {
        return get(configOption);
    }

    public boolean getBoolean(ConfigOption<Boolean> configOption) {
        return get(configOption);
    }

    public double getDouble(ConfigOption<Double> configOption) {
        return get(configOption);
    }

    /**
     * Please check the java doc of {@link #getRawValueFromOption(ConfigOption)}. If no keys are
     * found in {@link Configuration}, default value of the given option will return. Please make
     * sure there will be at least one value available. Otherwise, a NPE will be thrown by Java
     * when the value is used.
     */
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value of the given option, or empty if the option was never set. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<Object> rawValue = getRawValueFromOption(option);
        try {
            return rawValue.map(v -> convertValue(v, option));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.map(Object::toString).orElse(""), option.key()),
                    e);
        }
    }

    /**
     * Checks whether there is an entry for the given config option.
     *
     * @param configOption The configuration option
     * @return <tt>true</tt> if a valid (current or deprecated) key of the config option is stored,
     *     <tt>false</tt> otherwise
     */
    public boolean contains(ConfigOption<?> configOption) {
        synchronized (confData) {
            return confData.containsKey(configOption.key());
        }
    }

    /**
     * Sets the value of the given option.
     *
     * @param option The option to set
     * @param value The value for the option
     * @return this configuration object
     */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        setValueInternal(option.key(), value);
        return this;
    }

    /** Removes the given option, returning whether it was present. */
    public boolean removeConfig(ConfigOption<?> configOption) {
        synchronized (confData) {
            return confData.remove(configOption.key()) != null;
        }
    }

    /** Converts the configuration into a flat string map. */
    public Map<String, String> toMap() {
        synchronized (confData) {
            Map<String, String> ret = new HashMap<>(confData.size());
            for (Map.Entry<String, Object> entry : confData.entrySet()) {
                ret.put(entry.getKey(), convertToString(entry.getValue()));
            }
            return ret;
        }
    }

    // --------------------------------------------------------------------------------------------

    private <T> void setValueInternal(String key, T value) {
        checkNotNull(key, "Key must not be null.");
        checkNotNull(value, "Value must not be null.");
        synchronized (confData) {
            Object previous = confData.put(key, value);
            if (previous != null && LOG.isDebugEnabled()) {
                LOG.debug("Overriding configuration key '{}'.", key);
            }
        }
    }

    /**
     * Returns the raw value of the given option. The raw value is either the typed object set via
     * {@link #set(ConfigOption, Object)} or the string set via {@link #setString(String, String)}.
     */
    private Optional<Object> getRawValueFromOption(ConfigOption<?> configOption) {
        synchronized (confData) {
            return Optional.ofNullable(confData.get(configOption.key()));
        }
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
