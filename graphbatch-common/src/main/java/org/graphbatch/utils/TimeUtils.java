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

import org.graphbatch.annotation.Internal;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

import static org.graphbatch.utils.Preconditions.checkArgument;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/** Collection of time related utilities. */
@Internal
public class TimeUtils {

    /**
     * Parse the given string to a java {@link Duration}. The string is in format "{length
     * value}{time unit label}", e.g. "123ms", "321 s". If no time unit label is specified, it will
     * be considered as milliseconds.
     *
     * <p>Supported time unit labels are: ns, us, ms, s, min, h and d.
     *
     * @param text string to parse.
     */
    public static Duration parseDuration(String text) {
        checkNotNull(text);
        final String trimmed = text.trim();
        checkArgument(!trimmed.isEmpty(), "argument is an empty- or whitespace-only string");

        final int len = trimmed.length();
        int pos = 0;
        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unitLabel = trimmed.substring(pos).trim().toLowerCase(Locale.US);

        if (number.isEmpty()) {
            throw new NumberFormatException("text does not start with a number");
        }

        final long value;
        try {
            value = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be re represented as 64bit number (numeric overflow).");
        }

        if (unitLabel.isEmpty()) {
            return Duration.of(value, ChronoUnit.MILLIS);
        }
        return Duration.of(value, toChronoUnit(unitLabel, text));
    }

    /** Pretty prints the duration using the highest unit that represents it exactly. */
    public static String formatWithHighestUnit(Duration duration) {
        long nanos = duration.toNanos();
        String[] labels = {"d", "h", "min", "s", "ms", "us"};
        long[] factors = {
            86_400_000_000_000L, 3_600_000_000_000L, 60_000_000_000L, 1_000_000_000L, 1_000_000L,
            1_000L
        };
        for (int i = 0; i < labels.length; i++) {
            if (nanos != 0 && nanos % factors[i] == 0) {
                return (nanos / factors[i]) + " " + labels[i];
            }
        }
        return nanos + " ns";
    }

    private static ChronoUnit toChronoUnit(String unitLabel, String text) {
        switch (unitLabel) {
            case "ns":
                return ChronoUnit.NANOS;
            case "us":
                return ChronoUnit.MICROS;
            case "ms":
                return ChronoUnit.MILLIS;
            case "s":
                return ChronoUnit.SECONDS;
            case "min":
                return ChronoUnit.MINUTES;
            case "h":
                return ChronoUnit.HOURS;
            case "d":
                return ChronoUnit.DAYS;
            default:
                throw new IllegalArgumentException(
                        "Time interval unit label '"
                                + unitLabel
                                + "' does not match any of the recognized units: ns, us, ms, s, min, h, d");
        }
    }

    private TimeUtils() {}
}
