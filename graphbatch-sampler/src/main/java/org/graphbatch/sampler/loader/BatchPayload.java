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

/** The serialized payload of one batch, returned directly when streaming is disabled. */
@PublicEvolving
public final class BatchPayload {

    private final int batchId;
    private final String tag;
    private final String payload;

    public BatchPayload(int batchId, String tag, String payload) {
        this.batchId = batchId;
        this.tag = tag;
        this.payload = payload;
    }

    public int batchId() {
        return batchId;
    }

    /** {@code vertex_batch} or {@code edge_batch}. */
    public String tag() {
        return tag;
    }

    public String payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "BatchPayload{" + tag + "_" + batchId + ", " + payload.length() + " chars}";
    }
}
