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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link SplitAssigner}. */
class SplitAssignerTest {

    private final SplitAssigner assigner =
            new SplitAssigner(
                    Arrays.asList(
                            new SplitRatio("train", 0.5),
                            new SplitRatio("valid", 0.3),
                            new SplitRatio("test", 0.1)));

    @Test
    void testCumulativeThresholds() {
        assertThat(assigner.assign(0.1)).isEqualTo("train");
        assertThat(assigner.assign(0.55)).isEqualTo("valid");
        assertThat(assigner.assign(0.85)).isEqualTo("test");
        assertThat(assigner.assign(0.95)).isNull();
        assertThat(assigner.assignIndex(0.95)).isEqualTo(-1);
    }

    @Test
    void testBoundsAreExclusive() {
        assertThat(assigner.assign(0.0)).isEqualTo("train");
        assertThat(assigner.assign(0.5)).isEqualTo("valid");
        assertThat(assigner.assign(0.9)).isNull();
    }

    @Test
    void testRatiosAreNotNormalized() {
        SplitAssigner overfull =
                new SplitAssigner(
                        Arrays.asList(new SplitRatio("a", 0.8), new SplitRatio("b", 0.7)));
        assertThat(overfull.assign(0.79)).isEqualTo("a");
        assertThat(overfull.assign(0.99)).isEqualTo("b");

        SplitAssigner empty = new SplitAssigner(Collections.emptyList());
        assertThat(empty.assign(0.0)).isNull();
    }
}
