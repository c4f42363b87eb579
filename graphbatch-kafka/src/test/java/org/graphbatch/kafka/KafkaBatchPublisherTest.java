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

import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.BatchPublishException;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.PublisherOpenException;
import org.graphbatch.sampler.batch.Batch;
import org.graphbatch.sampler.batch.BatchRequest;
import org.graphbatch.sampler.serialize.BatchSerializer;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.InMemoryGraphStore;
import org.graphbatch.sampler.stream.PublisherState;
import org.graphbatch.sampler.stream.StreamReport;
import org.graphbatch.sampler.stream.StreamingBatchSink;

import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link KafkaBatchPublisher}. */
class KafkaBatchPublisherTest {

    private static final String TOPIC = "loader_topic";

    private Configuration conf;
    private FailingMockProducer producer;
    private TestingTopicAdmin admin;

    @BeforeEach
    void setup() {
        conf = new Configuration();
        conf.set(ConfigOptions.KAFKA_BOOTSTRAP_SERVERS, "localhost:9092");
        conf.set(ConfigOptions.KAFKA_TOPIC_PARTITIONS, 3);
        producer = new FailingMockProducer();
        admin = new TestingTopicAdmin();
    }

    @Test
    void testPublishRoutesByBatchId() throws Exception {
        KafkaBatchPublisher publisher = publisher();
        assertThat(publisher.state()).isEqualTo(PublisherState.UNINITIALIZED);
        publisher.open();
        assertThat(publisher.state()).isEqualTo(PublisherState.OPEN);
        assertThat(admin.topics).containsKey(TOPIC);

        for (int batchId = 0; batchId < 5; batchId++) {
            publisher.publish(batchId, "vertex_batch_" + batchId, "payload" + batchId);
        }
        publisher.close(Duration.ofSeconds(1));

        List<ProducerRecord<String, String>> history = producer.history();
        assertThat(history).extracting(ProducerRecord::topic).containsOnly(TOPIC);
        assertThat(history).extracting(ProducerRecord::partition).containsExactly(0, 1, 2, 0, 1);
        assertThat(history)
                .extracting(ProducerRecord::key)
                .containsExactly(
                        "vertex_batch_0",
                        "vertex_batch_1",
                        "vertex_batch_2",
                        "vertex_batch_3",
                        "vertex_batch_4");
        assertThat(producer.closed()).isTrue();
        assertThat(publisher.state()).isEqualTo(PublisherState.CLOSED);
    }

    @Test
    void testProducerPropertiesArePassed() throws Exception {
        AtomicReference<Properties> captured = new AtomicReference<>();
        KafkaBatchPublisher publisher =
                new KafkaBatchPublisher(
                        conf,
                        TOPIC,
                        props -> {
                            captured.set(props);
                            return producer;
                        },
                        null);
        publisher.open();

        assertThat(captured.get()).containsEntry("bootstrap.servers", "localhost:9092");
        assertThat(admin.existsCalls).isZero();
    }

    @Test
    void testFailedSendIsReportedPerBatch() throws Exception {
        producer.failingKeys.add("vertex_batch_1");
        KafkaBatchPublisher publisher = publisher();
        publisher.open();

        publisher.publish(0, "vertex_batch_0", "a");
        assertThatThrownBy(() -> publisher.publish(1, "vertex_batch_1", "b"))
                .isInstanceOf(BatchPublishException.class)
                .hasMessageContaining("vertex_batch_1")
                .hasCauseInstanceOf(NetworkException.class)
                .satisfies(
                        e -> assertThat(((BatchPublishException) e).getBatchId()).isEqualTo(1));
        publisher.publish(2, "vertex_batch_2", "c");

        assertThat(producer.history())
                .extracting(ProducerRecord::key)
                .containsExactly("vertex_batch_0", "vertex_batch_2");
    }

    @Test
    void testStreamingFiveBatchesWithOneFailure() throws Exception {
        producer.failingKeys.add("vertex_batch_2");
        KafkaBatchPublisher publisher = publisher();
        publisher.open();
        StreamingBatchSink sink = new StreamingBatchSink(publisher, serializer());

        for (int batchId = 0; batchId < 5; batchId++) {
            EntityRef entity = EntityRef.vertex("Person", batchId, "p" + batchId);
            sink.accept(
                    new Batch(batchId, EntityKind.VERTEX, Collections.singletonList(entity)));
        }
        StreamReport report = sink.finish(Duration.ofSeconds(1));

        assertThat(producer.attemptedKeys)
                .containsExactly(
                        "vertex_batch_0",
                        "vertex_batch_1",
                        "vertex_batch_2",
                        "vertex_batch_3",
                        "vertex_batch_4");
        assertThat(report.kafkaError())
                .contains("batch 2")
                .doesNotContain("batch 0", "batch 1", "batch 3", "batch 4");
        assertThat(producer.closed()).isTrue();
    }

    @Test
    void testOpenFailsWhenTopicCannotBeCreated() {
        admin.unreachable = true;
        KafkaBatchPublisher publisher = publisher();

        assertThatThrownBy(publisher::open)
                .isInstanceOf(PublisherOpenException.class)
                .hasMessageContaining(TOPIC);
        assertThat(publisher.state()).isEqualTo(PublisherState.UNINITIALIZED);
    }

    @Test
    void testOpenFailsWhenProducerCannotBeCreated() {
        KafkaBatchPublisher publisher =
                new KafkaBatchPublisher(
                        conf,
                        TOPIC,
                        props -> {
                            throw new KafkaException("Failed to construct kafka producer");
                        },
                        null);

        assertThatThrownBy(publisher::open).isInstanceOf(PublisherOpenException.class);
    }

    @Test
    void testCloseFailure() throws Exception {
        producer.failOnClose = true;
        KafkaBatchPublisher publisher = publisher();
        publisher.open();

        assertThatThrownBy(() -> publisher.close(Duration.ofSeconds(1)))
                .isInstanceOf(GraphBatchException.class);
        // closing twice is a no-op
        publisher.close(Duration.ofSeconds(1));
        assertThatThrownBy(() -> publisher.publish(0, "vertex_batch_0", "a"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCloseDoesNotDependOnUnboundedFlush() throws Exception {
        producer.failOnFlush = true;
        KafkaBatchPublisher publisher = publisher();
        publisher.open();
        publisher.publish(0, "vertex_batch_0", "a");

        publisher.close(Duration.ofSeconds(1));

        assertThat(producer.closed()).isTrue();
        assertThat(publisher.state()).isEqualTo(PublisherState.CLOSED);
    }

    @Test
    void testBatchPartitioner() {
        BatchPartitioner partitioner = new BatchPartitioner(4);
        List<Integer> partitions =
                Arrays.asList(0, 3, 4, 9, 12).stream()
                        .map(partitioner::partition)
                        .collect(Collectors.toList());
        assertThat(partitions).containsExactly(0, 3, 0, 1, 0);
        assertThatThrownBy(() -> new BatchPartitioner(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private KafkaBatchPublisher publisher() {
        return new KafkaBatchPublisher(
                conf, TOPIC, props -> producer, new KafkaTopicManager(admin, conf, TOPIC));
    }

    private static BatchSerializer serializer() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.createType(EntityKind.VERTEX, "Person", Collections.<String, AttributeType>emptyMap());
        for (int i = 0; i < 5; i++) {
            store.addVertex("Person", i, "p" + i, Collections.emptyMap());
        }
        BatchRequest request =
                BatchRequest.builder(EntityKind.VERTEX, new Configuration()).types("Person").build();
        return BatchSerializer.forRequest(store, request);
    }

    /** A {@link MockProducer} that fails the sends of chosen keys. */
    private static class FailingMockProducer extends MockProducer<String, String> {

        private final Set<String> failingKeys = new HashSet<>();
        private final List<String> attemptedKeys = new ArrayList<>();
        private boolean failOnClose;
        private boolean failOnFlush;

        FailingMockProducer() {
            super(true, new StringSerializer(), new StringSerializer());
        }

        @Override
        public synchronized Future<RecordMetadata> send(
                ProducerRecord<String, String> record, Callback callback) {
            attemptedKeys.add(record.key());
            if (failingKeys.contains(record.key())) {
                CompletableFuture<RecordMetadata> failed = new CompletableFuture<>();
                failed.completeExceptionally(new NetworkException("Connection to broker lost."));
                return failed;
            }
            return super.send(record, callback);
        }

        @Override
        public synchronized void flush() {
            if (failOnFlush) {
                throw new KafkaException("Failed to flush the producer.");
            }
            super.flush();
        }

        @Override
        public synchronized void close(Duration timeout) {
            if (failOnClose) {
                throw new KafkaException("Failed to close the producer.");
            }
            super.close(timeout);
        }
    }
}
