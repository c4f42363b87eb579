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

import org.graphbatch.annotation.Internal;
import org.graphbatch.sampler.score.ScoredEntity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.graphbatch.utils.Preconditions.checkArgument;

/**
 * Selects the {@code k} lowest scored entities in several partial passes.
 *
 * <p>Pass {@code p} only looks at the entities with {@code id mod numPasses == p} and keeps at most
 * {@code k} of them in a bounded heap. The per-pass heaps are then merged into a final heap that
 * is bounded by {@code k} as well. No heap ever holds more than {@code k} entities, at the cost of
 * scanning the candidates once per pass.
 *
 * <p>Every entity of the final selection is among the {@code k} lowest of its own pass, and no
 * entity left out of a pass scores lower than an entity that pass kept.
 */
@Internal
public class PartialPassTopKSelector {

    private static final Logger LOG = LoggerFactory.getLogger(PartialPassTopKSelector.class);

    private final int numPasses;

    public PartialPassTopKSelector(int numPasses) {
        checkArgument(numPasses > 0, "The number of passes must be positive, but is %s.", numPasses);
        this.numPasses = numPasses;
    }

    /**
     * Selects the {@code k} lowest scored candidates.
     *
     * @param candidates supplies a fresh (possibly parallel) stream of the candidates for each pass
     * @param k the number of entities to select
     * @return the selected entities in ascending score order
     */
    public List<ScoredEntity> select(Supplier<Stream<ScoredEntity>> candidates, int k) {
        BoundedTopK<ScoredEntity> merged = new BoundedTopK<>(k, ScoredEntity.ASCENDING);
        if (k == 0) {
            return merged.toSortedList();
        }
        for (int pass = 0; pass < numPasses; pass++) {
            BoundedTopK<ScoredEntity> passHeap = selectPass(candidates.get(), k, pass);
            LOG.trace("Pass {} of {} kept {} entities.", pass, numPasses, passHeap.size());
            merged.merge(passHeap);
        }
        return merged.toSortedList();
    }

    /** Runs one partial pass and returns its bounded heap. */
    BoundedTopK<ScoredEntity> selectPass(Stream<ScoredEntity> candidates, int k, int pass) {
        return candidates
                .filter(scored -> passOf(scored.entity().id()) == pass)
                .collect(BoundedTopK.collector(k, ScoredEntity.ASCENDING));
    }

    int passOf(long id) {
        return (int) Math.floorMod(id, (long) numPasses);
    }

    public int numPasses() {
        return numPasses;
    }
}
