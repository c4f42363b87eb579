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

import org.graphbatch.annotation.Internal;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assigns a uniform draw in {@code [0, 1)} to at most one of an ordered list of buckets.
 *
 * <p>The buckets are walked in order while their ratios are accumulated, and the draw lands in the
 * first bucket whose cumulative upper bound exceeds it. A draw at or above the sum of all ratios
 * lands in no bucket. Ratios are not re-normalized: if they sum up to more than 1, the excess is
 * unreachable. Callers validate the ratios.
 */
@Internal
public final class SplitAssigner {

    private final List<SplitRatio> ratios;
    private final double[] upperBounds;

    public SplitAssigner(List<SplitRatio> ratios) {
        this.ratios = Collections.unmodifiableList(new ArrayList<>(ratios));
        this.upperBounds = new double[ratios.size()];
        double cumulative = 0.0;
        for (int i = 0; i < ratios.size(); i++) {
            cumulative += ratios.get(i).ratio();
            upperBounds[i] = cumulative;
        }
    }

    /**
     * Returns the index of the bucket the draw lands in.
     *
     * @return the bucket index, or {@code -1} if the draw lands in no bucket
     */
    public int assignIndex(double draw) {
        for (int i = 0; i < upperBounds.length; i++) {
            if (draw < upperBounds[i]) {
                return i;
            }
        }
        return -1;
    }

    /** Returns the name of the bucket the draw lands in, or {@code null} if none. */
    @Nullable
    public String assign(double draw) {
        int index = assignIndex(draw);
        return index < 0 ? null : ratios.get(index).bucket();
    }

    public List<SplitRatio> ratios() {
        return ratios;
    }
}
