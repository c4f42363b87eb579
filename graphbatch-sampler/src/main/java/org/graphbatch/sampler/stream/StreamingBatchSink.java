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
import org.graphbatch.exception.BatchPublishException;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.sampler.batch.Batch;
import org.graphbatch.sampler.batch.BatchSink;
import org.graphbatch.sampler.serialize.BatchSerializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.graphbatch.utils.Preconditions.checkNotNull;
import static org.graphbatch.utils.Preconditions.checkState;

/**
 * Streams every batch to an opened {@link BatchPublisher}.
 *
 * <p>A batch that fails to publish does not stop the batching loop: the failure is recorded in the
 * {@link PublishErrorLog} and the next batch is attempted. {@link #finish(Duration)} always closes
 * the publisher and returns the aggregated failures.
 */
@Internal
public class StreamingBatchSink implements BatchSink {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingBatchSink.class);

    private final BatchPublisher publisher;
    private final BatchSerializer serializer;
    private final PublishErrorLog errorLog = new PublishErrorLog();

    private int attempted;
    private int published;
    private boolean finished;

    public StreamingBatchSink(BatchPublisher publisher, BatchSerializer serializer) {
        this.publisher = checkNotNull(publisher);
        this.serializer = checkNotNull(serializer);
    }

    @Override
    public void accept(Batch batch) {
        checkState(!finished, "The sink is already finished.");
        attempted++;
        String key = batch.key();
        try {
            publisher.publish(batch.batchId(), key, serializer.serialize(batch));
            published++;
            LOG.debug("Published {} with {} entities.", key, batch.size());
        } catch (BatchPublishException e) {
            LOG.warn("Failed to publish {}, continuing with the next batch.", key, e);
            errorLog.recordPublishFailure(batch.batchId(), e);
        }
    }

    /** Closes the publisher and reports the outcome of all batches. */
    public StreamReport finish(Duration closeTimeout) {
        checkState(!finished, "The sink is already finished.");
        finished = true;
        try {
            publisher.close(closeTimeout);
        } catch (GraphBatchException | RuntimeException e) {
            LOG.error("Failed to close the batch publisher.", e);
            errorLog.recordCloseFailure(e);
        }
        String report = errorLog.report();
        LOG.info(
                "Streamed {} of {} batches{}.",
                published,
                attempted,
                report.isEmpty() ? "" : ", with failures");
        return new StreamReport(attempted, published, report);
    }

    public PublishErrorLog errorLog() {
        return errorLog;
    }
}
