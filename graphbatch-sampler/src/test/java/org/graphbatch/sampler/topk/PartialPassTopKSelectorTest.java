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

package org.graphbatch.sampler.topk;

import org.graphbatch.sampler.score.ScoredEntity;
import org.graphbatch.sampler.store.EntityRef;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link PartialPassTopKSelector}. */
class PartialPassTopKSelectorTest {

    private static final double[] SCORES = {0.9, 0.15, 0.7, 0.05, 0.6, 0.35, 0.8, 0.2, 0.45, 0.1};

    @Test
    void testSinglePassSelectsLowestScores() {
        List<ScoredEntity> selected = new PartialPassTopKSelector(1).select(() -> candidates().parallelStream(), 3);

        assertThat(ids(selected)).containsExactly(3L, 9L, 1L);
    }

    @Test
    void testEveryPassKeepsItsLowestScores() {
        PartialPassTopKSelector selector = new PartialPassTopKSelector(5);
        List<ScoredEntity> selected = selector.select(() -> candidates().parallelStream(), 3);
        Set<Long> selectedIds = selected.stream().map(s -> s.entity().id()).collect(Collectors.toSet());

        assertThat(selected).hasSize(3);
        for (int pass = 0; pass < selector.numPasses(); pass++) {
            final int p = pass;
            List<ScoredEntity> inPass =
                    candidates().stream()
                            .filter(s -> selector.passOf(s.entity().id()) == p)
                            .collect(Collectors.toList());
            double maxSelected =
                    inPass.stream()
                            .filter(s -> selectedIds.contains(s.entity().id()))
                            .mapToDouble(ScoredEntity::score)
                            .max()
                            .orElse(Double.NEGATIVE_INFINITY);
            inPass.stream()
                    .filter(s -> !selectedIds.contains(s.entity().id()))
                    .forEach(s -> assertThat(s.score()).isGreaterThanOrEqualTo(maxSelected));
        }
        // the merged per-pass heaps hold the global lowest scores
        assertThat(ids(selected)).containsExactly(3L, 9L, 1L);
    }

    @Test
    void testSelectionLargerThanCandidates() {
        List<ScoredEntity> selected = new PartialPassTopKSelector(4).select(() -> candidates().stream(), 50);
        assertThat(selected).hasSize(SCORES.length);
        assertThat(new PartialPassTopKSelector(4).select(() -> candidates().stream(), 0)).isEmpty();
    }

    @Test
    void testTiesAreBrokenById() {
        List<ScoredEntity> tied = new ArrayList<>();
        for (long id = 9; id >= 0; id--) {
            tied.add(new ScoredEntity(EntityRef.vertex("Person", id, "p" + id), 0.5));
        }
        List<ScoredEntity> selected = new PartialPassTopKSelector(3).select(tied::parallelStream, 4);
        assertThat(ids(selected)).containsExactly(0L, 1L, 2L, 3L);
    }

    @Test
    void testInvalidNumberOfPasses() {
        assertThatThrownBy(() -> new PartialPassTopKSelector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<ScoredEntity> candidates() {
        List<ScoredEntity> candidates = new ArrayList<>();
        for (int id = 0; id < SCORES.length; id++) {
            candidates.add(new ScoredEntity(EntityRef.vertex("Person", id, "p" + id), SCORES[id]));
        }
        return candidates;
    }

    private static List<Long> ids(List<ScoredEntity> selected) {
        return selected.stream().map(s -> s.entity().id()).collect(Collectors.toList());
    }
}
