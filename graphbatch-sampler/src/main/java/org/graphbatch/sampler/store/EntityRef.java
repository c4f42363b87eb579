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

import javax.annotation.Nullable;

import java.util.Objects;

import static org.graphbatch.utils.Preconditions.checkArgument;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * An opaque reference to a vertex or an edge in the graph store. The ordinal id is assigned by
 * the store and is stable within one traversal; two references are equal if they have the same
 * kind and ordinal id.
 *
 * <p>A vertex reference carries its primary id, an edge reference carries the primary ids of its
 * source and target vertices.
 */
@PublicEvolving
public final class EntityRef {

    private final EntityKind kind;
    private final String type;
    private final long id;
    private final String primaryId;
    @Nullable private final String sourceId;
    @Nullable private final String targetId;

    private EntityRef(
            EntityKind kind,
            String type,
            long id,
            String primaryId,
            @Nullable String sourceId,
            @Nullable String targetId) {
        checkArgument(id >= 0, "Ordinal id must not be negative, but is %s.", id);
        this.kind = checkNotNull(kind);
        this.type = checkNotNull(type, "type must not be null");
        this.id = id;
        this.primaryId = checkNotNull(primaryId, "primaryId must not be null");
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public static EntityRef vertex(String type, long id, String primaryId) {
        return new EntityRef(EntityKind.VERTEX, type, id, primaryId, null, null);
    }

    /** Creates an edge reference, its primary id is {@code source->target}. */
    public static EntityRef edge(String type, long id, String sourceId, String targetId) {
        checkNotNull(sourceId, "sourceId must not be null");
        checkNotNull(targetId, "targetId must not be null");
        return new EntityRef(
                EntityKind.EDGE, type, id, sourceId + "->" + targetId, sourceId, targetId);
    }

    public EntityKind kind() {
        return kind;
    }

    public String type() {
        return type;
    }

    /** The ordinal id assigned by the store. */
    public long id() {
        return id;
    }

    public String primaryId() {
        return primaryId;
    }

    /** The primary id of the source vertex, only set for edges. */
    @Nullable
    public String sourceId() {
        return sourceId;
    }

    /** The primary id of the target vertex, only set for edges. */
    @Nullable
    public String targetId() {
        return targetId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EntityRef that = (EntityRef) o;
        return id == that.id && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind.label() + "{type=" + type + ", id=" + id + ", primaryId=" + primaryId + '}';
    }
}
