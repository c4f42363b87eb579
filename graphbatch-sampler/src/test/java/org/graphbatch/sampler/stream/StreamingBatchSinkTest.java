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

import org.graphbatch.config.Configuration;
import org.graphbatch.sampler.batch.Batch;
import org.graphbatch.sampler.batch.BatchRequest;
import org.graphbatch.sampler.serialize.BatchSerializer;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.InMemoryGraphStore;
import org.graphbatch.sampler.store.TestingGraphs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.graphbatch.sampler.store.TestingGraphs.PERSON;

/** Tests for {@link StreamingBatchSink}. */
class StreamingBatchSinkTest {

    private BatchSerializer serializer;

    @BeforeEach
    void setup() {
        InMemoryGraphStore store = TestingGraphs.people(5);
        serializer =
                BatchSerializer.forRequest(
                        store,
                        BatchRequest.builder(EntityKind.VERTEX, new Configuration())
                                .types(PERSON)
                                .attributes("age")
                                .build());
    }

    @Test
    void testFailedBatchDoesNotStopTheLoop() throws Exception {
        TestingBatchPublisher publisher = new TestingBatchPublisher().failOn(2);
        publisher.open();
        StreamingBatchSink sink = new StreamingBatchSink(publisher, serializer);

        for (int batchId = 0; batchId < 5; batchId++) {
            sink.accept(batch(batchId));
        }
        StreamReport report = sink.finish(Duration.ofSeconds(1));

        assertThat(publisher.attempted()).containsExactly(0, 1, 2, 3, 4);
        assertThat(publisher.published().keySet())
                .containsExactly("vertex_batch_0", "vertex_batch_1", "vertex_batch_3", "vertex_batch_4");
        assertThat(publisher.closeAttempts()).isEqualTo(1);
        assertThat(report.attempted()).isEqualTo(5);
        assertThat(report.published()).isEqualTo(4);
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.kafkaError())
                .contains("batch 2")
                .contains("vertex_batch_2")
                .doesNotContain("batch 0", "batch 1", "batch 3", "batch 4");
        assertThat(sink.errorLog().publishFailures()).containsOnlyKeys(2);
    }

    @Test
    void testSuccessfulStreamHasEmptyReport() throws Exception {
        TestingBatchPublisher publisher = new TestingBatchPublisher();
        publisher.open();
        StreamingBatchSink sink = new StreamingBatchSink(publisher, serializer);
        sink.accept(batch(0));
        sink.accept(batch(1));

        StreamReport report = sink.finish(Duration.ofSeconds(1));
        assertThat(report.kafkaError()).isEmpty();
        assertThat(report.isSuccess()).isTrue();
        assertThat(publisher.published()).containsEntry("vertex_batch_0", "p0|20\n");
        assertThat(publisher.state()).isEqualTo(PublisherState.CLOSED);
    }

    @Test
    void testCloseFailureIsReported() throws Exception {
        TestingBatchPublisher publisher = new TestingBatchPublisher().failOn(0).failOnClose();
        publisher.open();
        StreamingBatchSink sink = new StreamingBatchSink(publisher, serializer);
        sink.accept(batch(0));

        StreamReport report = sink.finish(Duration.ofSeconds(1));
        assertThat(report.kafkaError())
                .startsWith("Failed to publish batch 0")
                .contains("Failed to close the publisher: Simulated close failure.");
        assertThatThrownBy(() -> sink.accept(batch(1))).isInstanceOf(IllegalStateException.class);
    }

    private static Batch batch(int batchId) {
        return new Batch(
                batchId,
                EntityKind.VERTEX,
                Collections.singletonList(EntityRef.vertex(PERSON, batchId, "p" + batchId)));
    }
}
