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

package org.graphbatch.kafka;

import org.graphbatch.annotation.Internal;

import static org.graphbatch.utils.Preconditions.checkArgument;

/** Routes batch {@code i} to partition {@code i mod numPartitions} of the topic. */
@Internal
public final class BatchPartitioner {

    private final int numPartitions;

    public BatchPartitioner(int numPartitions) {
        checkArgument(
                numPartitions > 0,
                "The number of partitions must be positive, but is %s.",
                numPartitions);
        this.numPartitions = numPartitions;
    }

    public int partition(int batchId) {
        return Math.floorMod(batchId, numPartitions);
    }

    public int numPartitions() {
        return numPartitions;
    }
}
