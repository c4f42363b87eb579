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

package org.graphbatch.sampler.store;

import org.graphbatch.annotation.PublicEvolving;

/** Whether an entity is a vertex or an edge of the graph. */
@PublicEvolving
public enum EntityKind {
    VERTEX("vertex"),
    EDGE("edge");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    /** The lower case label used in payload tags and message keys, e.g. {@code vertex_batch}. */
    public String label() {
        return label;
    }

    public String batchTag() {
        return label + "_batch";
    }
}
