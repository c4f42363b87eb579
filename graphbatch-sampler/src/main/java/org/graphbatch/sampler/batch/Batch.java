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

package org.graphbatch.sampler.batch;

import org.graphbatch.annotation.PublicEvolving;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.graphbatch.utils.Preconditions.checkArgument;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/** One batch of entities and its 0-based sequence number. The order of the entities is irrelevant. */
@PublicEvolving
public final class Batch {

    private final int batchId;
    private final EntityKind kind;
    private final List<EntityRef> entities;

    public Batch(int batchId, EntityKind kind, List<EntityRef> entities) {
        checkArgument(batchId >= 0, "Batch id must not be negative, but is %s.", batchId);
        this.batchId = batchId;
        this.kind = checkNotNull(kind);
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
    }

    public int batchId() {
        return batchId;
    }

    public EntityKind kind() {
        return kind;
    }

    public List<EntityRef> entities() {
        return entities;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /** The message key of this batch, e.g. {@code vertex_batch_3}. */
    public String key() {
        return kind.batchTag() + "_" + batchId;
    }

    @Override
    public String toString() {
        return "Batch{" + key() + ", size=" + entities.size() + '}';
    }
}
