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

package org.graphbatch.config;

import org.graphbatch.annotation.PublicEvolving;

import java.time.Duration;
import java.util.List;

import static org.graphbatch.config.ConfigBuilder.key;

/** Config options for batch sampling, data splitting, anchor selection and Kafka streaming. */
@PublicEvolving
public class ConfigOptions {

    // ------------------------------------------------------------------------
    //  Batch Options
    // ------------------------------------------------------------------------

    public static final ConfigOption<Integer> BATCH_NUM_BATCHES =
            key("batch.num-batches")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "The number of batches to divide the eligible entities into. If "
                                    + "'batch.size' is set and this option is not, the number of "
                                    + "batches is derived from the number of eligible entities.");

    public static final ConfigOption<Integer> BATCH_SIZE =
            key("batch.size")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "The number of entities in each batch. Defaults to the number of "
                                    + "eligible entities divided by 'batch.num-batches', rounded up.");

    public static final ConfigOption<Boolean> BATCH_SHUFFLE =
            key("batch.shuffle")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to draw batches in random order. Without shuffling, batches "
                                    + "contain entities in ascending ordinal id order.");

    public static final ConfigOption<Long> BATCH_SHUFFLE_SEED =
            key("batch.shuffle.seed")
                    .longType()
                    .noDefaultValue()
                    .withDescription(
                            "Seed of the shuffle draws. Shuffles without a seed are not reproducible.");

    public static final ConfigOption<String> BATCH_FILTER_BY =
            key("batch.filter-by")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Name of a boolean attribute. Only entities whose attribute is true "
                                    + "are eligible; entities without the attribute are excluded.");

    public static final ConfigOption<Integer> BATCH_NUM_HEAP_INSERTS =
            key("batch.num-heap-inserts")
                    .intType()
                    .defaultValue(10)
                    .withDescription(
                            "The number of partial passes used to select each batch. Every pass "
                                    + "keeps at most 'batch size' entities in its heap, which "
                                    + "bounds the peak memory of a selection.");

    public static final ConfigOption<String> BATCH_DELIMITER =
            key("batch.delimiter")
                    .stringType()
                    .defaultValue("|")
                    .withDescription("The delimiter between fields of a serialized entity.");

    public static final ConfigOption<String> BATCH_CONSUMED_ATTRIBUTE =
            key("batch.consumed-attribute")
                    .stringType()
                    .defaultValue("batch_consumed")
                    .withDescription(
                            "Name of the boolean attribute that marks entities already emitted "
                                    + "in a batch of the current division.");

    public static final ConfigOption<ConsumedMarkerMode> BATCH_CONSUMED_MARKER_MODE =
            key("batch.consumed-marker.mode")
                    .enumType(ConsumedMarkerMode.class)
                    .defaultValue(ConsumedMarkerMode.PER_INVOCATION)
                    .withDescription(
                            "Whether each call that divides all entities into batches starts "
                                    + "from a cleared consumed marker (PER_INVOCATION), or "
                                    + "continues where the previous call stopped (SHARED).");

    // ------------------------------------------------------------------------
    //  Split Options
    // ------------------------------------------------------------------------

    public static final ConfigOption<Long> SPLIT_RANDOM_SEED =
            key("split.random-seed")
                    .longType()
                    .defaultValue(42L)
                    .withDescription("Seed of the per-entity draws used by the random splitters.");

    // ------------------------------------------------------------------------
    //  Anchor Options
    // ------------------------------------------------------------------------

    public static final ConfigOption<Double> ANCHOR_PERCENTAGE =
            key("anchor.percentage")
                    .doubleType()
                    .defaultValue(0.01)
                    .withDescription("The fraction of eligible target entities to select as anchors.");

    public static final ConfigOption<String> ANCHOR_ATTRIBUTE =
            key("anchor.attribute")
                    .stringType()
                    .defaultValue("is_anchor")
                    .withDescription("Name of the boolean attribute that flags anchors.");

    public static final ConfigOption<Long> ANCHOR_RANDOM_SEED =
            key("anchor.random-seed")
                    .longType()
                    .defaultValue(42L)
                    .withDescription("Seed of the deterministic anchor scores.");

    public static final ConfigOption<List<String>> ANCHOR_TARGET_TYPES =
            key("anchor.target-types")
                    .stringType()
                    .asList()
                    .defaultValues()
                    .withDescription(
                            "Entity types whose entities compete for the anchor quota. Entities "
                                    + "of any other type are always selected. Empty means every "
                                    + "type is a target type.");

    // ------------------------------------------------------------------------
    //  Kafka Options
    // ------------------------------------------------------------------------

    public static final ConfigOption<String> KAFKA_BOOTSTRAP_SERVERS =
            key("kafka.bootstrap-servers")
                    .stringType()
                    .defaultValue("")
                    .withDescription(
                            "Address of the Kafka brokers. When empty, batches are returned "
                                    + "directly instead of being streamed.");

    public static final ConfigOption<String> KAFKA_LOADER_ID =
            key("kafka.loader-id")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Identifier of the loader, used to derive the default topic name. "
                                    + "A random identifier is generated when not set.");

    public static final ConfigOption<String> KAFKA_TOPIC =
            key("kafka.topic")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("The topic to stream batches to. Defaults to '<loader-id>_topic'.");

    public static final ConfigOption<Integer> KAFKA_TOPIC_PARTITIONS =
            key("kafka.topic.partitions")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "The number of partitions of the topic. Batch i is routed to "
                                    + "partition i mod partitions.");

    public static final ConfigOption<Integer> KAFKA_TOPIC_REPLICATION_FACTOR =
            key("kafka.topic.replication-factor")
                    .intType()
                    .defaultValue(1)
                    .withDescription("The replication factor used when the topic is created.");

    public static final ConfigOption<Duration> KAFKA_TOPIC_RETENTION =
            key("kafka.topic.retention")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(60))
                    .withDescription("The retention time used when the topic is created.");

    public static final ConfigOption<Boolean> KAFKA_TOPIC_AUTO_CREATE =
            key("kafka.topic.auto-create")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription("Whether to create the topic on open when it does not exist.");

    public static final ConfigOption<Boolean> KAFKA_TOPIC_AUTO_DELETE =
            key("kafka.topic.auto-delete")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription("Whether to delete the topic created by the publisher on close.");

    public static final ConfigOption<Integer> KAFKA_MAX_MESSAGE_SIZE =
            key("kafka.max-message-size")
                    .intType()
                    .defaultValue(104857600)
                    .withDescription(
                            "The maximum size in bytes of one batch message. It sizes the "
                                    + "producer buffer and the topic's 'max.message.bytes'.");

    public static final ConfigOption<Duration> KAFKA_ACK_TIMEOUT =
            key("kafka.ack-timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(300))
                    .withDescription("How long to wait for the broker to acknowledge one batch.");

    public static final ConfigOption<Duration> KAFKA_CLOSE_TIMEOUT =
            key("kafka.close-timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(30))
                    .withDescription("How long to wait for pending sends when closing the producer.");

    public static final ConfigOption<String> KAFKA_SECURITY_PROTOCOL =
            key("kafka.security.protocol")
                    .stringType()
                    .defaultValue("PLAINTEXT")
                    .withDescription(
                            "Protocol used to communicate with brokers. One of PLAINTEXT, "
                                    + "SASL_PLAINTEXT, SASL_SSL and SSL.");

    public static final ConfigOption<String> KAFKA_SASL_MECHANISM =
            key("kafka.sasl.mechanism")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("SASL mechanism, either PLAIN or GSSAPI.");

    public static final ConfigOption<String> KAFKA_SASL_USERNAME =
            key("kafka.sasl.username").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SASL_PASSWORD =
            key("kafka.sasl.password").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SASL_KERBEROS_SERVICE_NAME =
            key("kafka.sasl.kerberos.service-name").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SASL_KERBEROS_KEYTAB =
            key("kafka.sasl.kerberos.keytab").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SASL_KERBEROS_PRINCIPAL =
            key("kafka.sasl.kerberos.principal").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SSL_CA_LOCATION =
            key("kafka.ssl.ca-location").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SSL_CERTIFICATE_LOCATION =
            key("kafka.ssl.certificate-location").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SSL_KEY_LOCATION =
            key("kafka.ssl.key-location").stringType().noDefaultValue();

    public static final ConfigOption<String> KAFKA_SSL_KEY_PASSWORD =
            key("kafka.ssl.key-password").stringType().noDefaultValue();

    public static final ConfigOption<Boolean> KAFKA_SSL_CHECK_HOSTNAME =
            key("kafka.ssl.check-hostname")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Whether to verify the broker host name against its certificate.");

    /** Prefix of options copied verbatim into the Kafka producer properties. */
    public static final String KAFKA_PROPERTIES_PREFIX = "kafka.properties.";

    // ------------------------------------------------------------------------
    //  Enum Options
    // ------------------------------------------------------------------------

    /** Lifetime of the consumed marker between calls. */
    public enum ConsumedMarkerMode {
        PER_INVOCATION,
        SHARED
    }

    private ConfigOptions() {}
}
