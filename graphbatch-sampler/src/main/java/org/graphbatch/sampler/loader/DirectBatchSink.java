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

import org.graphbatch.annotation.Internal;
import org.graphbatch.sampler.batch.Batch;
import org.graphbatch.sampler.batch.BatchSink;
import org.graphbatch.sampler.serialize.BatchSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Serializes every batch and keeps the payloads to be returned to the caller. */
@Internal
class DirectBatchSink implements BatchSink {

    private final BatchSerializer serializer;
    private final List<BatchPayload> payloads = new ArrayList<>();

    DirectBatchSink(BatchSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public void accept(Batch batch) {
        payloads.add(new BatchPayload(batch.batchId(), serializer.tag(), serializer.serialize(batch)));
    }

    List<BatchPayload> payloads() {
        return Collections.unmodifiableList(payloads);
    }
}
