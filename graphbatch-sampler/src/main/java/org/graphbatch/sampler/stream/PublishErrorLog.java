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

package org.graphbatch.sampler.stream;

import org.graphbatch.annotation.Internal;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Accumulates the publish and close failures of one streaming invocation. */
@ThreadSafe
@Internal
public class PublishErrorLog {

    @GuardedBy("this")
    private final TreeMap<Integer, String> publishFailures = new TreeMap<>();

    @GuardedBy("this")
    private final List<String> closeFailures = new ArrayList<>();

    public synchronized void recordPublishFailure(int batchId, Throwable cause) {
        publishFailures.merge(batchId, describe(cause), (a, b) -> a + "; " + b);
    }

    public synchronized void recordCloseFailure(Throwable cause) {
        closeFailures.add(describe(cause));
    }

    public synchronized SortedMap<Integer, String> publishFailures() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(publishFailures));
    }

    public synchronized boolean isEmpty() {
        return publishFailures.isEmpty() && closeFailures.isEmpty();
    }

    /**
     * Renders the failures, one per line and ordered by batch id, with the close failures last.
     *
     * @return the report, or an empty string if nothing failed
     */
    public synchronized String report() {
        StringBuilder report = new StringBuilder();
        for (Map.Entry<Integer, String> failure : publishFailures.entrySet()) {
            report.append("Failed to publish batch ")
                    .append(failure.getKey())
                    .append(": ")
                    .append(failure.getValue())
                    .append('\n');
        }
        for (String failure : closeFailures) {
            report.append("Failed to close the publisher: ").append(failure).append('\n');
        }
        return report.toString();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null ? cause.getClass().getName() : message;
    }
}
