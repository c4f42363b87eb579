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

import org.graphbatch.annotation.Internal;
import org.graphbatch.sampler.store.EntityRef;

import javax.annotation.Nullable;

/**
 * Assigns the score by which the batcher orders entities, lowest first. Implementations are
 * evaluated concurrently on unordered partitions and must return the same score for the same
 * entity during one invocation.
 */
@Internal
@FunctionalInterface
public interface EntityScorer {

    double score(EntityRef entity);

    default ScoredEntity scored(EntityRef entity) {
        return new ScoredEntity(entity, score(entity));
    }

    /** Scores entities by their ordinal id, which yields id-ascending batches. */
    static EntityScorer ordinal() {
        return entity -> (double) entity.id();
    }

    /**
     * Scores entities by a uniform random draw made once per entity and kept for the lifetime of
     * the returned scorer.
     *
     * @param seed the seed of the draws, or {@code null} for draws that are not reproducible
     */
    static EntityScorer shuffle(@Nullable Long seed) {
        return new ShuffleScorer(seed);
    }
}
