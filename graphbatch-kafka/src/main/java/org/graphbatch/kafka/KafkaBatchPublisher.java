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
import org.graphbatch.annotation.VisibleForTesting;
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.BatchPublishException;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.PublisherOpenException;
import org.graphbatch.sampler.stream.BatchPublisher;
import org.graphbatch.sampler.stream.PublisherState;
import org.graphbatch.utils.TimeUtils;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static org.graphbatch.utils.Preconditions.checkNotNull;
import static org.graphbatch.utils.Preconditions.checkState;

/**
 * Streams batch payloads to a Kafka topic. Every batch is sent to the partition chosen by the
 * {@link BatchPartitioner} and waited for until the broker acknowledges it or {@link
 * ConfigOptions#KAFKA_ACK_TIMEOUT} passes.
 */
@NotThreadSafe
@Internal
public class KafkaBatchPublisher implements BatchPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaBatchPublisher.class);

    private final String topic;
    private final Properties producerProperties;
    private final Function<Properties, Producer<String, String>> producerFactory;
    @Nullable private final KafkaTopicManager topicManager;
    private final BatchPartitioner partitioner;
    private final Duration ackTimeout;

    private PublisherState state = PublisherState.UNINITIALIZED;
    @Nullable private Producer<String, String> producer;

    public KafkaBatchPublisher(
            Configuration conf,
            String topic,
            Function<Properties, Producer<String, String>> producerFactory,
            @Nullable KafkaTopicManager topicManager) {
        this.topic = checkNotNull(topic);
        this.producerProperties = KafkaProducerConfigs.producerProperties(conf);
        this.producerFactory = checkNotNull(producerFactory);
        this.topicManager = topicManager;
        this.partitioner = new BatchPartitioner(conf.get(ConfigOptions.KAFKA_TOPIC_PARTITIONS));
        this.ackTimeout = conf.get(ConfigOptions.KAFKA_ACK_TIMEOUT);
    }

    @Override
    public void open() throws PublisherOpenException {
        checkState(
                state == PublisherState.UNINITIALIZED,
                "The publisher can only be opened once, but is %s.",
                state);
        try {
            if (topicManager != null) {
                topicManager.ensureTopic();
            }
            producer = producerFactory.apply(producerProperties);
        } catch (GraphBatchException | KafkaException e) {
            throw new PublisherOpenException(
                    "Failed to open the Kafka publisher for topic " + topic + ".", e);
        }
        state = PublisherState.OPEN;
        LOG.info(
                "Opened Kafka publisher for topic {} with {} partitions.",
                topic,
                partitioner.numPartitions());
    }

    @Override
    public void publish(int batchId, String key, String payload) throws BatchPublishException {
        checkState(state == PublisherState.OPEN, "The publisher is %s, not OPEN.", state);
        int partition = partitioner.partition(batchId);
        ProducerRecord<String, String> record =
                new ProducerRecord<>(topic, partition, key, payload);
        try {
            RecordMetadata metadata =
                    producer.send(record).get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Batch {} acknowledged at {}-{}@{}.", key, topic, partition, metadata.offset());
        } catch (ExecutionException e) {
            throw new BatchPublishException(
                    batchId, "Failed to publish " + key + ": " + describe(e.getCause()), e.getCause());
        } catch (TimeoutException e) {
            throw new BatchPublishException(
                    batchId,
                    "No acknowledgement for "
                            + key
                            + " within "
                            + TimeUtils.formatWithHighestUnit(ackTimeout)
                            + ".",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchPublishException(batchId, "Interrupted while publishing " + key + ".", e);
        } catch (KafkaException e) {
            throw new BatchPublishException(
                    batchId, "Failed to publish " + key + ": " + describe(e), e);
        }
    }

    @Override
    public void close(Duration timeout) throws GraphBatchException {
        if (state == PublisherState.CLOSED) {
            return;
        }
        state = PublisherState.CLOSED;
        if (producer == null) {
            return;
        }
        LOG.info("Closing Kafka publisher for topic {}.", topic);
        try {
            // sends still in flight are flushed by close within the timeout
            producer.close(timeout);
        } catch (KafkaException e) {
            throw new GraphBatchException("Failed to close the Kafka producer.", e);
        }
    }

    @Override
    public PublisherState state() {
        return state;
    }

    @VisibleForTesting
    String topic() {
        return topic;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
