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

package org.graphbatch.sampler.split;

import org.graphbatch.annotation.PublicEvolving;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The outcome of a split: a status message and the number of entities per bucket. */
@PublicEvolving
public final class SplitResult {

    private final String status;
    private final Map<String, Long> bucketCounts;
    private final long unassigned;

    public SplitResult(String status, Map<String, Long> bucketCounts, long unassigned) {
        this.status = status;
        this.bucketCounts = Collections.unmodifiableMap(new LinkedHashMap<>(bucketCounts));
        this.unassigned = unassigned;
    }

    public String status() {
        return status;
    }

    /** Number of entities per bucket, in the order of the ratios. */
    public Map<String, Long> bucketCounts() {
        return bucketCounts;
    }

    public long unassigned() {
        return unassigned;
    }

    @Override
    public String toString() {
        return "SplitResult{" + status + ", buckets=" + bucketCounts + ", unassigned=" + unassigned + '}';
    }
}
