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

import org.graphbatch.annotation.PublicEvolving;

/** Summary of a streaming invocation. */
@PublicEvolving
public final class StreamReport {

    /** Tag of the aggregated error report in the invocation output. */
    public static final String KAFKA_ERROR_TAG = "kafkaError";

    private final int attempted;
    private final int published;
    private final String kafkaError;

    public StreamReport(int attempted, int published, String kafkaError) {
        this.attempted = attempted;
        this.published = published;
        this.kafkaError = kafkaError;
    }

    public int attempted() {
        return attempted;
    }

    public int published() {
        return published;
    }

    /** The aggregated publish and close failures, empty if everything succeeded. */
    public String kafkaError() {
        return kafkaError;
    }

    public boolean isSuccess() {
        return kafkaError.isEmpty();
    }

    @Override
    public String toString() {
        return "StreamReport{attempted="
                + attempted
                + ", published="
                + published
                + ", "
                + KAFKA_ERROR_TAG
                + "='"
                + kafkaError
                + "'}";
    }
}
