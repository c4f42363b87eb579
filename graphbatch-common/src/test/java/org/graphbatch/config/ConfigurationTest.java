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

import org.graphbatch.config.ConfigOptions.ConsumedMarkerMode;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Configuration}. */
class ConfigurationTest {

    @Test
    void testFromMap() {
        Map<String, String> map = new HashMap<>();
        map.put(ConfigOptions.BATCH_NUM_BATCHES.key(), "12");
        map.put(ConfigOptions.BATCH_SHUFFLE.key(), "TRUE");
        map.put(ConfigOptions.BATCH_SHUFFLE_SEED.key(), "7");
        map.put(ConfigOptions.ANCHOR_PERCENTAGE.key(), "0.25");
        map.put(ConfigOptions.ANCHOR_TARGET_TYPES.key(), "Paper, Author");
        map.put(ConfigOptions.KAFKA_ACK_TIMEOUT.key(), "2 min");
        map.put(ConfigOptions.BATCH_CONSUMED_MARKER_MODE.key(), "shared");
        Configuration conf = Configuration.fromMap(map);

        assertThat(conf.getInt(ConfigOptions.BATCH_NUM_BATCHES)).isEqualTo(12);
        assertThat(conf.getBoolean(ConfigOptions.BATCH_SHUFFLE)).isTrue();
        assertThat(conf.getOptional(ConfigOptions.BATCH_SHUFFLE_SEED)).hasValue(7L);
        assertThat(conf.getDouble(ConfigOptions.ANCHOR_PERCENTAGE)).isEqualTo(0.25);
        assertThat(conf.get(ConfigOptions.ANCHOR_TARGET_TYPES))
                .isEqualTo(Arrays.asList("Paper", "Author"));
        assertThat(conf.get(ConfigOptions.KAFKA_ACK_TIMEOUT)).isEqualTo(Duration.ofMinutes(2));
        assertThat(conf.get(ConfigOptions.BATCH_CONSUMED_MARKER_MODE))
                .isEqualTo(ConsumedMarkerMode.SHARED);
    }

    @Test
    void testFromDefault() {
        Configuration conf = new Configuration();

        assertThat(conf.getInt(ConfigOptions.BATCH_NUM_BATCHES)).isEqualTo(1);
        assertThat(conf.getOptional(ConfigOptions.BATCH_SIZE)).isEmpty();
        assertThat(conf.getInt(ConfigOptions.BATCH_NUM_HEAP_INSERTS)).isEqualTo(10);
        assertThat(conf.getString(ConfigOptions.BATCH_DELIMITER)).isEqualTo("|");
        assertThat(conf.getLong(ConfigOptions.SPLIT_RANDOM_SEED)).isEqualTo(42L);
        assertThat(conf.get(ConfigOptions.ANCHOR_TARGET_TYPES)).isEqualTo(Collections.emptyList());
        assertThat(conf.getString(ConfigOptions.KAFKA_BOOTSTRAP_SERVERS)).isEmpty();
        assertThat(conf.get(ConfigOptions.KAFKA_TOPIC_RETENTION))
                .isEqualTo(Duration.ofSeconds(60));
        assertThat(conf.get(ConfigOptions.BATCH_CONSUMED_MARKER_MODE))
                .isEqualTo(ConsumedMarkerMode.PER_INVOCATION);
        assertThat(conf.contains(ConfigOptions.BATCH_NUM_BATCHES)).isFalse();
    }

    @Test
    void testSetAndRemove() {
        Configuration conf = new Configuration();
        conf.set(ConfigOptions.BATCH_SIZE, 64);
        assertThat(conf.contains(ConfigOptions.BATCH_SIZE)).isTrue();
        assertThat(conf.getOptional(ConfigOptions.BATCH_SIZE)).hasValue(64);

        Configuration copy = new Configuration(conf);
        assertThat(conf.removeConfig(ConfigOptions.BATCH_SIZE)).isTrue();
        assertThat(conf.getOptional(ConfigOptions.BATCH_SIZE)).isEmpty();
        assertThat(copy.getOptional(ConfigOptions.BATCH_SIZE)).hasValue(64);
    }

    @Test
    void testToMap() {
        Configuration conf = new Configuration();
        conf.set(ConfigOptions.KAFKA_CLOSE_TIMEOUT, Duration.ofSeconds(90));
        conf.set(ConfigOptions.ANCHOR_TARGET_TYPES, Arrays.asList("a", "b"));
        conf.setString("kafka.properties.linger.ms", "5");

        Map<String, String> map = conf.toMap();
        assertThat(map)
                .containsEntry(ConfigOptions.ANCHOR_TARGET_TYPES.key(), "a,b")
                .containsEntry("kafka.properties.linger.ms", "5");
        assertThat(Configuration.fromMap(map).get(ConfigOptions.KAFKA_CLOSE_TIMEOUT))
                .isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void testInvalidValue() {
        Configuration conf = new Configuration();
        conf.setString(ConfigOptions.BATCH_NUM_HEAP_INSERTS.key(), "ten");

        assertThatThrownBy(() -> conf.get(ConfigOptions.BATCH_NUM_HEAP_INSERTS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigOptions.BATCH_NUM_HEAP_INSERTS.key());
    }
}
