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

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The graph store the sampler runs against. The store owns the entities and evaluates scans in
 * whatever parallel fashion it supports; the sampler only combines the scanned entities with
 * order-independent operations, so a scan may return a parallel stream without ordering
 * guarantees.
 */
@PublicEvolving
public interface GraphStore {

    /** Returns the entity types of the given kind known to the store. */
    Set<String> types(EntityKind kind);

    /**
     * Returns the declared attributes of an entity type.
     *
     * @throws IllegalArgumentException if the type is unknown
     */
    Map<String, AttributeType> attributeTypes(EntityKind kind, String type);

    /**
     * Declares a new attribute on the given entity types. Entities that exist already do not get a
     * value for the attribute until it is set.
     */
    void addAttribute(
            EntityKind kind, Collection<String> types, String name, AttributeType attributeType);

    /**
     * Streams the entities of the given kind whose type is one of the given types. The returned
     * stream may be parallel and unordered. A new scan is evaluated on every call, it reflects the
     * state of the store at the time of the call.
     */
    Stream<EntityRef> scan(EntityKind kind, Collection<String> types);

    /** Returns the attribute accessor of the given entity. */
    AttributeAccessor attributes(EntityRef entity);
}
