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

package org.graphbatch.sampler.loader;

import org.graphbatch.annotation.PublicEvolving;
import org.graphbatch.sampler.stream.StreamReport;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The output of one {@link BatchLoader#load} call: the batch payloads when streaming is disabled,
 * or the {@link StreamReport} of the streamed batches otherwise.
 */
@PublicEvolving
public final class LoadResult {

    private final int numBatches;
    private final List<BatchPayload> payloads;
    @Nullable private final StreamReport streamReport;

    private LoadResult(
            int numBatches, List<BatchPayload> payloads, @Nullable StreamReport streamReport) {
        this.numBatches = numBatches;
        this.payloads = payloads;
        this.streamReport = streamReport;
    }

    static LoadResult direct(List<BatchPayload> payloads) {
        return new LoadResult(payloads.size(), payloads, null);
    }

    static LoadResult streamed(int numBatches, StreamReport report) {
        return new LoadResult(numBatches, Collections.emptyList(), report);
    }

    public int numBatches() {
        return numBatches;
    }

    /** The payloads, in batch id order. Empty for streamed invocations. */
    public List<BatchPayload> payloads() {
        return payloads;
    }

    public boolean isStreamed() {
        return streamReport != null;
    }

    @Nullable
    public StreamReport streamReport() {
        return streamReport;
    }

    /** The aggregated broker error report, empty if streaming succeeded or was disabled. */
    public String kafkaError() {
        return streamReport == null ? "" : streamReport.kafkaError();
    }
}
