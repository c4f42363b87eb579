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

import org.graphbatch.annotation.Internal;
import org.graphbatch.utils.TimeUtils;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Utilities to convert raw configuration values into the type of a {@link ConfigOption}. */
@Internal
class ConfigurationUtils {

    static final String LIST_SEPARATOR = ",";

    @SuppressWarnings("unchecked")
    static <T> T convertValue(Object rawValue, ConfigOption<T> option) {
        if (option.isList()) {
            return (T) convertToList(rawValue, option.getClazz());
        }
        return (T) convertValue(rawValue, option.getClazz());
    }

    static List<Object> convertToList(Object rawValue, Class<?> atomicClass) {
        List<Object> result = new ArrayList<>();
        if (rawValue instanceof Collection) {
            for (Object element : (Collection<?>) rawValue) {
                result.add(convertValue(element, atomicClass));
            }
            return result;
        }
        String string = rawValue.toString();
        if (StringUtils.isBlank(string)) {
            return result;
        }
        for (String element : string.split(LIST_SEPARATOR)) {
            result.add(convertValue(element.trim(), atomicClass));
        }
        return result;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object convertValue(Object rawValue, Class<?> clazz) {
        if (clazz.isInstance(rawValue)) {
            return rawValue;
        }
        String string = rawValue.toString().trim();
        if (Integer.class.equals(clazz)) {
            return Integer.parseInt(string);
        } else if (Long.class.equals(clazz)) {
            return Long.parseLong(string);
        } else if (Double.class.equals(clazz)) {
            return Double.parseDouble(string);
        } else if (Boolean.class.equals(clazz)) {
            return convertToBoolean(string);
        } else if (String.class.equals(clazz)) {
            return rawValue.toString();
        } else if (Duration.class.equals(clazz)) {
            return TimeUtils.parseDuration(string);
        } else if (clazz.isEnum()) {
            return Enum.valueOf((Class<Enum>) clazz, string.toUpperCase(Locale.ROOT));
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    static String convertToString(Object value) {
        if (value instanceof String) {
            return (String) value;
        } else if (value instanceof Duration) {
            return TimeUtils.formatWithHighestUnit((Duration) value);
        } else if (value instanceof Collection) {
            return ((Collection<?>) value)
                    .stream()
                    .map(ConfigurationUtils::convertToString)
                    .collect(Collectors.joining(LIST_SEPARATOR));
        } else if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    private static boolean convertToBoolean(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(
                        String.format(
                                "Unrecognized option for boolean: %s. Expected either true or false(case insensitive)",
                                value));
        }
    }

    private ConfigurationUtils() {}
}
