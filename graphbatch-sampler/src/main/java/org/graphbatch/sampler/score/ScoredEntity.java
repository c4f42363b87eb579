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

import java.util.Comparator;

/** An entity paired with its score, only alive while a selection is computed. */
@Internal
public final class ScoredEntity {

    /** Orders by ascending score, ties are broken by ascending ordinal id. */
    public static final Comparator<ScoredEntity> ASCENDING =
            Comparator.comparingDouble(ScoredEntity::score)
                    .thenComparingLong(scored -> scored.entity().id());

    private final EntityRef entity;
    private final double score;

    public ScoredEntity(EntityRef entity, double score) {
        this.entity = entity;
        this.score = score;
    }

    public EntityRef entity() {
        return entity;
    }

    public double score() {
        return score;
    }

    @Override
    public String toString() {
        return "ScoredEntity{" + entity + ", score=" + score + '}';
    }
}
