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
import org.graphbatch.exception.GraphBatchException;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

/** {@link TopicAdmin} backed by a Kafka {@link Admin} client. */
@Internal
public class KafkaTopicAdmin implements TopicAdmin {

    private final Admin admin;

    public KafkaTopicAdmin(Properties properties) {
        this(Admin.create(properties));
    }

    KafkaTopicAdmin(Admin admin) {
        this.admin = admin;
    }

    @Override
    public boolean topicExists(String topic) throws GraphBatchException {
        return get(admin.listTopics().names(), "list topics").contains(topic);
    }

    @Override
    public void createTopic(
            String topic, int partitions, short replicationFactor, Map<String, String> configs)
            throws GraphBatchException {
        NewTopic newTopic = new NewTopic(topic, partitions, replicationFactor).configs(configs);
        get(admin.createTopics(Collections.singleton(newTopic)).all(), "create topic " + topic);
    }

    @Override
    public void deleteTopic(String topic) throws GraphBatchException {
        get(admin.deleteTopics(Collections.singleton(topic)).all(), "delete topic " + topic);
    }

    @Override
    public void close(Duration timeout) {
        admin.close(timeout);
    }

    private static <T> T get(KafkaFuture<T> future, String operation) throws GraphBatchException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new GraphBatchException("Failed to " + operation + ".", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphBatchException("Interrupted while trying to " + operation + ".", e);
        }
    }
}
