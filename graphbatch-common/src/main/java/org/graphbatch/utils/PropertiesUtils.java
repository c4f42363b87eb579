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

package org.graphbatch.utils;

import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/** Utility class for properties related helper functions. */
public class PropertiesUtils {

    /**
     * Extracts the properties with the given prefix and removes the prefix from the keys.
     *
     * @param originalMap The original map
     * @param prefix The prefix to filter the keys
     */
    public static <V> Map<String, V> extractAndRemovePrefix(
            Map<String, V> originalMap, String prefix) {
        return originalMap.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .filter(entry -> entry.getKey().length() > prefix.length())
                .collect(
                        Collectors.toMap(
                                entry -> entry.getKey().substring(prefix.length()),
                                Map.Entry::getValue));
    }

    /** Copies the given map into a new {@link Properties} object, skipping {@code null} values. */
    public static Properties toProperties(Map<String, ?> map) {
        Properties properties = new Properties();
        map.forEach(
                (key, value) -> {
                    if (value != null) {
                        properties.put(key, value);
                    }
                });
        return properties;
    }

    // Make sure that we cannot instantiate this class
    private PropertiesUtils() {}
}
