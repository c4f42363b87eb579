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
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.IllegalConfigurationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link KafkaTopicManager}. */
class KafkaTopicManagerTest {

    private TestingTopicAdmin admin;
    private Configuration conf;

    @BeforeEach
    void setup() {
        admin = new TestingTopicAdmin();
        conf = new Configuration();
    }

    @Test
    void testCreateAndDeleteTopic() throws Exception {
        conf.set(ConfigOptions.KAFKA_TOPIC_PARTITIONS, 4);
        conf.set(ConfigOptions.KAFKA_TOPIC_RETENTION, Duration.ofMinutes(5));
        conf.set(ConfigOptions.KAFKA_MAX_MESSAGE_SIZE, 1024);
        KafkaTopicManager manager = new KafkaTopicManager(admin, conf, "batches");

        manager.ensureTopic();
        manager.ensureTopic();

        assertThat(admin.existsCalls).isEqualTo(1);
        assertThat(admin.partitions).containsEntry("batches", 4);
        assertThat(admin.topics.get("batches"))
                .containsEntry("retention.ms", "300000")
                .containsEntry("max.message.bytes", "1024");

        manager.close();
        assertThat(admin.deleted).containsExactly("batches");
        assertThat(admin.closed).isTrue();
    }

    @Test
    void testExistingTopicIsKept() throws Exception {
        conf.set(ConfigOptions.KAFKA_TOPIC_AUTO_DELETE, false);
        admin.topics.put("batches", null);
        KafkaTopicManager manager = new KafkaTopicManager(admin, conf, "batches");

        manager.ensureTopic();
        manager.close();

        assertThat(admin.partitions).doesNotContainKey("batches");
        assertThat(admin.deleted).isEmpty();
        assertThat(admin.closed).isTrue();
    }

    @Test
    void testNoAutoCreate() throws Exception {
        conf.set(ConfigOptions.KAFKA_TOPIC_AUTO_CREATE, false);
        new KafkaTopicManager(admin, conf, "batches").ensureTopic();

        assertThat(admin.existsCalls).isZero();
        assertThat(admin.topics).isEmpty();
    }

    @Test
    void testTopicNotEnsuredIsNotDeleted() throws Exception {
        KafkaTopicManager manager = new KafkaTopicManager(admin, conf, "never_created");
        manager.close();

        assertThat(admin.deleted).isEmpty();
        assertThat(admin.closed).isTrue();
    }

    @Test
    void testFailedDeleteStillClosesAdmin() throws Exception {
        KafkaTopicManager manager = new KafkaTopicManager(admin, conf, "batches");
        manager.ensureTopic();
        // removed behind the manager's back
        admin.topics.remove("batches");

        assertThatThrownBy(manager::close).isInstanceOf(GraphBatchException.class);
        assertThat(admin.closed).isTrue();
    }

    @Test
    void testInvalidPartitions() {
        conf.set(ConfigOptions.KAFKA_TOPIC_PARTITIONS, 0);
        assertThatThrownBy(() -> new KafkaTopicManager(admin, conf, "batches"))
                .isInstanceOf(IllegalConfigurationException.class);
    }
}
