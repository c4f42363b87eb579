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
import org.graphbatch.exception.AttributeAccessException;

import javax.annotation.concurrent.ThreadSafe;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import static org.graphbatch.utils.Preconditions.checkArgument;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * A {@link GraphStore} that keeps the whole graph in memory. Scans are evaluated as parallel
 * streams by default, which exercises the same unordered, partitioned evaluation that a
 * distributed graph engine performs.
 */
@ThreadSafe
@PublicEvolving
public class InMemoryGraphStore implements GraphStore {

    private final boolean parallelScan;
    private final Map<EntityKind, Map<String, Map<String, AttributeType>>> schema;
    private final Map<EntityKind, Map<Long, StoredEntity>> entities;
    private final AtomicLong nextId = new AtomicLong();

    public InMemoryGraphStore() {
        this(true);
    }

    public InMemoryGraphStore(boolean parallelScan) {
        this.parallelScan = parallelScan;
        this.schema = new EnumMap<>(EntityKind.class);
        this.entities = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            schema.put(kind, new ConcurrentHashMap<>());
            entities.put(kind, new ConcurrentHashMap<>());
        }
    }

    // ------------------------------------------------------------------------
    //  Building the graph
    // ------------------------------------------------------------------------

    /** Declares an entity type with the given attributes. */
    public InMemoryGraphStore createType(
            EntityKind kind, String type, Map<String, AttributeType> attributes) {
        Map<String, AttributeType> previous =
                schema.get(kind).putIfAbsent(type, new ConcurrentHashMap<>(attributes));
        checkArgument(previous == null, "The %s type '%s' already exists.", kind.label(), type);
        return this;
    }

    /** Adds a vertex with the next free ordinal id. */
    public EntityRef addVertex(String type, String primaryId, Map<String, Object> attributes) {
        return addVertex(type, nextId.getAndIncrement(), primaryId, attributes);
    }

    /** Adds a vertex with the given ordinal id. */
    public EntityRef addVertex(
            String type, long id, String primaryId, Map<String, Object> attributes) {
        return add(EntityRef.vertex(type, id, primaryId), attributes);
    }

    /** Adds an edge with the next free ordinal id. */
    public EntityRef addEdge(
            String type, String sourceId, String targetId, Map<String, Object> attributes) {
        return add(EntityRef.edge(type, nextId.getAndIncrement(), sourceId, targetId), attributes);
    }

    private EntityRef add(EntityRef ref, Map<String, Object> attributes) {
        checkArgument(
                schema.get(ref.kind()).containsKey(ref.type()),
                "Unknown %s type '%s'.",
                ref.kind().label(),
                ref.type());
        StoredEntity stored = new StoredEntity(ref);
        StoredEntity previous = entities.get(ref.kind()).putIfAbsent(ref.id(), stored);
        checkArgument(previous == null, "Ordinal id %s is already taken.", ref.id());
        nextId.accumulateAndGet(ref.id() + 1, Math::max);
        attributes.forEach(stored::set);
        return ref;
    }

    // ------------------------------------------------------------------------
    //  GraphStore
    // ------------------------------------------------------------------------

    @Override
    public Set<String> types(EntityKind kind) {
        return Collections.unmodifiableSet(new HashSet<>(schema.get(kind).keySet()));
    }

    @Override
    public Map<String, AttributeType> attributeTypes(EntityKind kind, String type) {
        Map<String, AttributeType> attributes = schema.get(kind).get(type);
        if (attributes == null) {
            throw new IllegalArgumentException(
                    String.format("Unknown %s type '%s'.", kind.label(), type));
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public void addAttribute(
            EntityKind kind, Collection<String> types, String name, AttributeType attributeType) {
        for (String type : types) {
            Map<String, AttributeType> attributes = schema.get(kind).get(type);
            if (attributes == null) {
                throw new IllegalArgumentException(
                        String.format("Unknown %s type '%s'.", kind.label(), type));
            }
            AttributeType existing = attributes.putIfAbsent(name, attributeType);
            checkArgument(
                    existing == null || existing == attributeType,
                    "Attribute '%s' of type '%s' is already declared as %s.",
                    name,
                    type,
                    existing);
        }
    }

    @Override
    public Stream<EntityRef> scan(EntityKind kind, Collection<String> types) {
        Set<String> wanted = new HashSet<>(types);
        Collection<StoredEntity> values = entities.get(kind).values();
        Stream<StoredEntity> stream = parallelScan ? values.parallelStream() : values.stream();
        return stream.map(StoredEntity::ref).filter(ref -> wanted.contains(ref.type()));
    }

    @Override
    public AttributeAccessor attributes(EntityRef entity) {
        StoredEntity stored = entities.get(entity.kind()).get(entity.id());
        if (stored == null) {
            throw new AttributeAccessException("Entity " + entity + " does not exist.");
        }
        return stored;
    }

    public long size(EntityKind kind) {
        return entities.get(kind).size();
    }

    // ------------------------------------------------------------------------

    private final class StoredEntity implements AttributeAccessor {

        private final EntityRef ref;
        private final Map<String, Object> values = new ConcurrentHashMap<>();

        private StoredEntity(EntityRef ref) {
            this.ref = ref;
        }

        private EntityRef ref() {
            return ref;
        }

        @Override
        public Object get(String name, AttributeType expectedType) {
            AttributeType declared = declaredType(name);
            if (declared != expectedType) {
                throw new AttributeAccessException(
                        String.format(
                                "Attribute '%s' of %s is %s, not %s.",
                                name, ref, declared, expectedType));
            }
            Object value = values.get(name);
            if (value == null) {
                throw new AttributeAccessException(
                        String.format("Attribute '%s' of %s has no value.", name, ref));
            }
            return value;
        }

        @Override
        public void set(String name, Object value) {
            checkNotNull(value, "Attribute values must not be null.");
            AttributeType declared = declaredType(name);
            if (!declared.accepts(value)) {
                throw new AttributeAccessException(
                        String.format(
                                "Attribute '%s' of %s is %s and does not accept %s.",
                                name, ref, declared, value.getClass().getSimpleName()));
            }
            values.put(name, value);
        }

        private AttributeType declaredType(String name) {
            AttributeType declared = schema.get(ref.kind()).get(ref.type()).get(name);
            if (declared == null) {
                throw new AttributeAccessException(
                        String.format(
                                "The %s type '%s' has no attribute '%s'.",
                                ref.kind().label(), ref.type(), name));
            }
            return declared;
        }
    }
}
