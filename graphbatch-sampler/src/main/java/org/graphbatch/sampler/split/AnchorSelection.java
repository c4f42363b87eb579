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

import org.graphbatch.annotation.PublicEvolving;

import java.util.Collections;
import java.util.List;

/** The entities flagged by one anchor selection. */
@PublicEvolving
public final class AnchorSelection {

    private final List<Long> anchorIds;
    private final int quota;
    private final long forced;

    AnchorSelection(List<Long> anchorIds, int quota, long forced) {
        this.anchorIds = Collections.unmodifiableList(anchorIds);
        this.quota = quota;
        this.forced = forced;
    }

    /** Ordinal ids of all flagged entities, ascending. */
    public List<Long> anchorIds() {
        return anchorIds;
    }

    /** Number of target type entities selected by score. */
    public int quota() {
        return quota;
    }

    /** Number of entities outside the target types that were flagged unconditionally. */
    public long forced() {
        return forced;
    }

    @Override
    public String toString() {
        return "AnchorSelection{anchors="
                + anchorIds.size()
                + ", quota="
                + quota
                + ", forced="
                + forced
                + '}';
    }
}
