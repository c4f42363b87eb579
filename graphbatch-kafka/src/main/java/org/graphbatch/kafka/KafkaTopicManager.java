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
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.IllegalConfigurationException;

import org.apache.kafka.common.config.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Creates the batch topic when it is missing and deletes it when the streaming session ends, as
 * configured by {@link ConfigOptions#KAFKA_TOPIC_AUTO_CREATE} and {@link
 * ConfigOptions#KAFKA_TOPIC_AUTO_DELETE}.
 */
@ThreadSafe
@Internal
public class KafkaTopicManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicManager.class);

    private final TopicAdmin admin;
    private final String topic;
    private final int partitions;
    private final short replicationFactor;
    private final Duration retention;
    private final int maxMessageSize;
    private final boolean autoCreate;
    private final boolean autoDelete;
    private final Duration closeTimeout;

    @GuardedBy("this")
    private boolean ensured;

    @GuardedBy("this")
    private boolean closed;

    public KafkaTopicManager(TopicAdmin admin, Configuration conf, String topic) {
        this.admin = checkNotNull(admin);
        this.topic = checkNotNull(topic);
        this.partitions = conf.get(ConfigOptions.KAFKA_TOPIC_PARTITIONS);
        int replicationFactor = conf.get(ConfigOptions.KAFKA_TOPIC_REPLICATION_FACTOR);
        if (partitions <= 0) {
            throw new IllegalConfigurationException(
                    "The number of topic partitions must be positive, but is %s.", partitions);
        }
        if (replicationFactor <= 0 || replicationFactor > Short.MAX_VALUE) {
            throw new IllegalConfigurationException(
                    "Invalid topic replication factor %s.", replicationFactor);
        }
        this.replicationFactor = (short) replicationFactor;
        this.retention = conf.get(ConfigOptions.KAFKA_TOPIC_RETENTION);
        this.maxMessageSize = conf.get(ConfigOptions.KAFKA_MAX_MESSAGE_SIZE);
        this.autoCreate = conf.get(ConfigOptions.KAFKA_TOPIC_AUTO_CREATE);
        this.autoDelete = conf.get(ConfigOptions.KAFKA_TOPIC_AUTO_DELETE);
        this.closeTimeout = conf.get(ConfigOptions.KAFKA_CLOSE_TIMEOUT);
    }

    /** Creates the topic if it does not exist yet. Only the first call talks to the broker. */
    public synchronized void ensureTopic() throws GraphBatchException {
        if (ensured || !autoCreate) {
            return;
        }
        if (admin.topicExists(topic)) {
            LOG.info("Topic {} already exists.", topic);
        } else {
            Map<String, String> configs = new HashMap<>();
            configs.put(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retention.toMillis()));
            configs.put(TopicConfig.MAX_MESSAGE_BYTES_CONFIG, String.valueOf(maxMessageSize));
            admin.createTopic(topic, partitions, replicationFactor, configs);
            LOG.info(
                    "Created topic {} with {} partitions and replication factor {}.",
                    topic,
                    partitions,
                    replicationFactor);
        }
        ensured = true;
    }

    /** Deletes the ensured topic if configured to, and releases the admin client. */
    @Override
    public synchronized void close() throws GraphBatchException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (autoDelete && ensured) {
                admin.deleteTopic(topic);
                LOG.info("Deleted topic {}.", topic);
            }
        } finally {
            admin.close(closeTimeout);
        }
    }

    public String topic() {
        return topic;
    }

    public int partitions() {
        return partitions;
    }
}
