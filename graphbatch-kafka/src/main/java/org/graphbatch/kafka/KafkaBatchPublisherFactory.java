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

import org.graphbatch.annotation.PublicEvolving;
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.sampler.stream.BatchPublisher;
import org.graphbatch.sampler.stream.BatchPublisherFactory;

import org.apache.commons.lang3.RandomStringUtils;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Creates {@link KafkaBatchPublisher}s that share one topic for the lifetime of the factory.
 *
 * <p>The topic is {@link ConfigOptions#KAFKA_TOPIC}, or {@code <loader-id>_topic} when no topic is
 * set. It is created by the first publisher that is opened and deleted when the factory is closed.
 */
@ThreadSafe
@PublicEvolving
public class KafkaBatchPublisherFactory implements BatchPublisherFactory {

    private final Function<Properties, Producer<String, String>> producerFactory;
    private final Function<Properties, TopicAdmin> adminFactory;
    private final String generatedLoaderId;

    @GuardedBy("this")
    private final Map<String, KafkaTopicManager> topicManagers = new LinkedHashMap<>();

    public KafkaBatchPublisherFactory() {
        this(KafkaProducer::new, KafkaTopicAdmin::new);
    }

    public KafkaBatchPublisherFactory(
            Function<Properties, Producer<String, String>> producerFactory,
            Function<Properties, TopicAdmin> adminFactory) {
        this.producerFactory = checkNotNull(producerFactory);
        this.adminFactory = checkNotNull(adminFactory);
        this.generatedLoaderId = "graphbatch_" + RandomStringUtils.randomAlphanumeric(8).toLowerCase();
    }

    @Override
    public synchronized BatchPublisher create(Configuration conf) {
        String topic = topic(conf);
        KafkaTopicManager topicManager =
                topicManagers.computeIfAbsent(
                        topic,
                        t ->
                                new KafkaTopicManager(
                                        adminFactory.apply(
                                                KafkaProducerConfigs.adminProperties(conf)),
                                        conf,
                                        t));
        return new KafkaBatchPublisher(conf, topic, producerFactory, topicManager);
    }

    /** Resolves the topic the batches of the given configuration are streamed to. */
    public String topic(Configuration conf) {
        return conf.getOptional(ConfigOptions.KAFKA_TOPIC)
                .orElseGet(
                        () ->
                                conf.getOptional(ConfigOptions.KAFKA_LOADER_ID)
                                                .orElse(generatedLoaderId)
                                        + "_topic");
    }

    /**
     * Ends the streaming session, deleting the topics if configured to. All topic managers are
     * closed, the first failure is rethrown with the others suppressed.
     */
    @Override
    public synchronized void close() throws GraphBatchException {
        GraphBatchException failure = null;
        for (KafkaTopicManager manager : topicManagers.values()) {
            try {
                manager.close();
            } catch (GraphBatchException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        topicManagers.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
