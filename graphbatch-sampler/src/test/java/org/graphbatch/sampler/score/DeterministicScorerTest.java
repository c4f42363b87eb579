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

package org.graphbatch.sampler.score;

import org.graphbatch.sampler.store.EntityRef;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link DeterministicScorer}. */
class DeterministicScorerTest {

    @Test
    void testKnownValues() {
        assertThat(DeterministicScorer.score(0, 0)).isEqualTo(0.012345);
        assertThat(DeterministicScorer.score(1, 0)).isEqualTo(0.52759);
        assertThat(DeterministicScorer.score(0, 42)).isEqualTo(0.496027);
        assertThat(DeterministicScorer.score(7, 42)).isEqualTo(0.16815);
    }

    @Test
    void testSameInputSameScore() {
        for (long id = 0; id < 1_000; id++) {
            assertThat(DeterministicScorer.score(id, 42)).isEqualTo(DeterministicScorer.score(id, 42));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, 42L, -1L, Long.MAX_VALUE, Long.MIN_VALUE})
    void testScoreInUnitInterval(long seed) {
        LongStream.range(0, 10_000)
                .forEach(
                        id ->
                                assertThat(DeterministicScorer.score(id, seed))
                                        .isGreaterThanOrEqualTo(0.0)
                                        .isLessThan(1.0));
        assertThat(DeterministicScorer.score(Long.MAX_VALUE, seed)).isBetween(0.0, 1.0);
    }

    @Test
    void testInputsAreReducedModuloMod() {
        assertThat(DeterministicScorer.score(5, -1))
                .isEqualTo(DeterministicScorer.score(5, DeterministicScorer.MOD - 1));
        assertThat(DeterministicScorer.score(DeterministicScorer.MOD + 3, 42))
                .isEqualTo(DeterministicScorer.score(3, 42));
    }

    @Test
    void testParallelEvaluationMatchesSequential() {
        List<Double> sequential =
                LongStream.range(0, 5_000)
                        .mapToObj(id -> DeterministicScorer.score(id, 7))
                        .collect(Collectors.toList());
        List<Double> parallel =
                LongStream.range(0, 5_000)
                        .parallel()
                        .mapToObj(id -> DeterministicScorer.score(id, 7))
                        .collect(Collectors.toList());
        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void testShuffleScorer() {
        EntityRef entity = EntityRef.vertex("Person", 3, "p3");
        EntityScorer unseeded = EntityScorer.shuffle(null);
        assertThat(unseeded.score(entity)).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);

        EntityScorer seeded = EntityScorer.shuffle(11L);
        EntityScorer sameSeed = EntityScorer.shuffle(11L);
        assertThat(seeded.score(entity))
                .isEqualTo(seeded.score(entity))
                .isEqualTo(sameSeed.score(entity))
                .isGreaterThanOrEqualTo(0.0)
                .isLessThan(1.0);
        assertThat(EntityScorer.ordinal().score(entity)).isEqualTo(3.0);
    }

    @Test
    void testSeededShuffleDependsOnIdOnly() {
        EntityScorer seeded = EntityScorer.shuffle(11L);
        List<Double> forward =
                LongStream.range(0, 100)
                        .mapToObj(id -> seeded.score(EntityRef.vertex("Person", id, "p" + id)))
                        .collect(Collectors.toList());
        List<Double> backward = new ArrayList<>();
        for (long id = 99; id >= 0; id--) {
            backward.add(0, seeded.score(EntityRef.vertex("Person", id, "p" + id)));
        }

        assertThat(backward).isEqualTo(forward);
        assertThat(new HashSet<>(forward)).hasSizeGreaterThan(90);
    }
}
