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
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.exception.PublisherOpenException;
import org.graphbatch.sampler.batch.BatchRequest;
import org.graphbatch.sampler.batch.ConsumedMarker;
import org.graphbatch.sampler.batch.EntityBatcher;
import org.graphbatch.sampler.serialize.BatchSerializer;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.GraphStore;
import org.graphbatch.sampler.stream.BatchPublisher;
import org.graphbatch.sampler.stream.BatchPublisherFactory;
import org.graphbatch.sampler.stream.StreamReport;
import org.graphbatch.sampler.stream.StreamingBatchSink;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.Collection;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Entry point of the batch engine. A loader divides the entities of a {@link GraphStore} into
 * batches and either returns the serialized batches or streams them to a broker, depending on
 * whether {@link ConfigOptions#KAFKA_BOOTSTRAP_SERVERS} is set.
 *
 * <pre>{@code
 * BatchLoader loader = new BatchLoader(store, conf, null);
 * LoadResult result =
 *         loader.load(
 *                 BatchRequest.builder(EntityKind.VERTEX, conf)
 *                         .types("Person")
 *                         .attributes("age", "is_train")
 *                         .numBatches(10)
 *                         .build());
 * }</pre>
 */
@PublicEvolving
public class BatchLoader implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchLoader.class);

    private final GraphStore store;
    private final Configuration conf;
    @Nullable private final BatchPublisherFactory publisherFactory;
    private final ConsumedMarker marker;
    private final EntityBatcher batcher;

    public BatchLoader(
            GraphStore store, Configuration conf, @Nullable BatchPublisherFactory publisherFactory) {
        this.store = checkNotNull(store);
        this.conf = new Configuration(checkNotNull(conf));
        this.publisherFactory = publisherFactory;
        this.marker = new ConsumedMarker(store, conf.get(ConfigOptions.BATCH_CONSUMED_ATTRIBUTE));
        this.batcher =
                new EntityBatcher(
                        store, marker, conf.get(ConfigOptions.BATCH_CONSUMED_MARKER_MODE));
    }

    /**
     * Produces the batches of the request.
     *
     * @throws IllegalConfigurationException if the request cannot be served, before any batch is
     *     produced
     * @throws PublisherOpenException if streaming is enabled and the broker cannot be reached
     */
    public LoadResult load(BatchRequest request) throws PublisherOpenException {
        BatchSerializer serializer = BatchSerializer.forRequest(store, request);
        if (!isStreaming()) {
            LOG.info("Loading {}.", request);
            DirectBatchSink sink = new DirectBatchSink(serializer);
            batcher.run(request, sink);
            return LoadResult.direct(sink.payloads());
        }
        if (publisherFactory == null) {
            throw new IllegalConfigurationException(
                    "Streaming to '%s' is configured, but no publisher is available.",
                    conf.get(ConfigOptions.KAFKA_BOOTSTRAP_SERVERS));
        }

        BatchPublisher publisher = publisherFactory.create(conf);
        publisher.open();
        LOG.info("Streaming {}.", request);
        StreamingBatchSink sink = new StreamingBatchSink(publisher, serializer);
        Duration closeTimeout = conf.get(ConfigOptions.KAFKA_CLOSE_TIMEOUT);
        int numBatches;
        try {
            numBatches = batcher.run(request, sink);
        } catch (RuntimeException e) {
            sink.finish(closeTimeout);
            throw e;
        }
        StreamReport report = sink.finish(closeTimeout);
        if (!report.isSuccess()) {
            LOG.warn("Streaming finished with failures:\n{}", report.kafkaError());
        }
        return LoadResult.streamed(numBatches, report);
    }

    /** Clears the consumed marker of the given types, so the next call starts a new division. */
    public void reset(EntityKind kind, Collection<String> types) {
        marker.reset(kind, types);
    }

    /** Releases the resources of the publisher factory, e.g. deletes the broker topic. */
    @Override
    public void close() throws GraphBatchException {
        if (publisherFactory != null) {
            publisherFactory.close();
        }
    }

    public boolean isStreaming() {
        return StringUtils.isNotBlank(conf.get(ConfigOptions.KAFKA_BOOTSTRAP_SERVERS));
    }
}
