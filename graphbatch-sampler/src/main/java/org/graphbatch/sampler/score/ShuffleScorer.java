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
import javax.annotation.concurrent.ThreadSafe;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Scores every entity with a uniform random draw. Nothing is kept per entity: a seeded draw is a
 * pure function of the seed and the id, an unseeded draw is made anew on every call.
 */
@ThreadSafe
@Internal
final class ShuffleScorer implements EntityScorer {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    @Nullable private final Long seed;

    ShuffleScorer(@Nullable Long seed) {
        this.seed = seed;
    }

    @Override
    public double score(EntityRef entity) {
        long id = entity.id();
        if (seed == null) {
            return ThreadLocalRandom.current().nextDouble();
        }
        // seeded draws only depend on the id, not on the order in which entities are visited
        return new SplittableRandom(seed * GOLDEN_GAMMA + id).nextDouble();
    }
}
