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

import org.graphbatch.annotation.PublicEvolving;

/**
 * Maps an ordinal id and a seed to a reproducible pseudo-random value in {@code [0, 1)}.
 *
 * <p>The score is a pure function of {@code (id, seed)}, so workers that evaluate disjoint
 * partitions of the entities in any order compute identical scores. It is a multiplicative
 * congruential step {@code x = (id * MULT + INC + MULT * seed) mod MOD}, of which the lowest
 * {@code DIGIT_MOD} residue is scaled into {@code [0, 1)}.
 *
 * <p>The constants are part of {@link #VERSION}. Changing them changes every split and anchor
 * selection computed from a seed, so they must only change together with the version.
 */
@PublicEvolving
public final class DeterministicScorer {

    public static final int VERSION = 1;

    static final long MULT = 1103515245L;
    static final long INC = 12345L;
    static final long MOD = 1L << 31;
    static final long DIGIT_MOD = 1_000_000L;

    /**
     * Returns the score of the given ordinal id under the given seed.
     *
     * @param id the stable ordinal id assigned by the store, not a re-derived index
     * @param seed the global seed
     * @return a value in {@code [0, 1)}
     */
    public static double score(long id, long seed) {
        // reduce first, (MOD - 1) * MULT still fits into a long
        long reducedId = Math.floorMod(id, MOD);
        long reducedSeed = Math.floorMod(seed, MOD);
        long x = (reducedId * MULT % MOD + INC + reducedSeed * MULT % MOD) % MOD;
        return (double) (x % DIGIT_MOD) / DIGIT_MOD;
    }

    private DeterministicScorer() {}
}
