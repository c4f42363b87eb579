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

package org.graphbatch.sampler.split;

import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.sampler.filter.PredicateFilter;
import org.graphbatch.sampler.score.DeterministicScorer;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.InMemoryGraphStore;
import org.graphbatch.sampler.store.TestingGraphs;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.graphbatch.sampler.store.TestingGraphs.PERSON;

/** Tests for {@link RandomSplitter}. */
class RandomSplitterTest {

    private final InMemoryGraphStore store = TestingGraphs.people(500);
    private final Configuration conf = new Configuration();

    @Test
    void testEveryEntityInAtMostOneBucket() {
        SplitResult result =
                RandomSplitter.vertexSplitter(store, conf, ratios("train", 0.6, "valid", 0.2, "test", 0.1))
                        .run();

        assertThat(result.status()).isEqualTo("Vertex split finished successfully.");
        assertThat(result.bucketCounts().keySet()).containsExactly("train", "valid", "test");
        long assigned = result.bucketCounts().values().stream().mapToLong(Long::longValue).sum();
        assertThat(assigned + result.unassigned()).isEqualTo(500);

        SplitAssigner assigner =
                new SplitAssigner(
                        Arrays.asList(
                                new SplitRatio("train", 0.6),
                                new SplitRatio("valid", 0.2),
                                new SplitRatio("test", 0.1)));
        store.scan(EntityKind.VERTEX, Collections.singleton(PERSON))
                .forEach(
                        entity -> {
                            List<String> flagged =
                                    Arrays.asList("train", "valid", "test").stream()
                                            .filter(b -> PredicateFilter.isTrue(store, entity, b))
                                            .collect(Collectors.toList());
                            String expected =
                                    assigner.assign(DeterministicScorer.score(entity.id(), 42L));
                            if (expected == null) {
                                assertThat(flagged).isEmpty();
                            } else {
                                assertThat(flagged).containsExactly(expected);
                            }
                        });
    }

    @Test
    void testSplitIsReproducible() {
        RandomSplitter splitter = RandomSplitter.vertexSplitter(store, conf, ratios("train", 0.5));
        splitter.run();
        Set<Long> first = flagged("train");
        splitter.run();
        assertThat(flagged("train")).isEqualTo(first);

        conf.set(ConfigOptions.SPLIT_RANDOM_SEED, 7L);
        RandomSplitter.vertexSplitter(store, conf, ratios("train", 0.5)).run();
        assertThat(flagged("train")).isNotEqualTo(first);
    }

    @Test
    void testOverrideRatios() {
        RandomSplitter splitter = RandomSplitter.vertexSplitter(store, conf, ratios("train", 0.9));
        SplitResult result = splitter.run(ratios("train", 0.0));

        assertThat(result.bucketCounts()).containsEntry("train", 0L);
        assertThat(result.unassigned()).isEqualTo(500);
        assertThat(flagged("train")).isEmpty();
        assertThat(splitter.ratios()).containsExactly(new SplitRatio("train", 0.9));
    }

    @Test
    void testEdgeSplitter() {
        store.createType(EntityKind.EDGE, "Knows", Collections.emptyMap());
        for (int i = 0; i < 10; i++) {
            store.addEdge("Knows", "p" + i, "p" + (i + 1), Collections.emptyMap());
        }
        SplitResult result = RandomSplitter.edgeSplitter(store, conf, ratios("train", 1.0)).run();

        assertThat(result.status()).isEqualTo("Edge split finished successfully.");
        assertThat(result.bucketCounts()).containsEntry("train", 10L);
    }

    @Test
    void testInvalidRatios() {
        assertThatThrownBy(() -> RandomSplitter.validate(Collections.emptyMap()))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("at least one");
        Map<String, Double> four = ratios("a", 0.1, "b", 0.1, "c", 0.1);
        four.put("d", 0.1);
        assertThatThrownBy(() -> RandomSplitter.validate(four))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("at most 3");
        assertThatThrownBy(() -> RandomSplitter.validate(ratios("a", 1.5)))
                .isInstanceOf(IllegalConfigurationException.class);
        assertThatThrownBy(() -> RandomSplitter.validate(ratios("a", -0.1)))
                .isInstanceOf(IllegalConfigurationException.class);
        assertThatThrownBy(() -> RandomSplitter.validate(ratios("a", 0.6, "b", 0.5)))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("sum");
    }

    private Set<Long> flagged(String bucket) {
        return new PredicateFilter(store, bucket)
                .filter(store.scan(EntityKind.VERTEX, Collections.singleton(PERSON)))
                .map(EntityRef::id)
                .collect(Collectors.toSet());
    }

    private static Map<String, Double> ratios(Object... bucketsAndRatios) {
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (int i = 0; i < bucketsAndRatios.length; i += 2) {
            ratios.put((String) bucketsAndRatios[i], (Double) bucketsAndRatios[i + 1]);
        }
        return ratios;
    }
}
