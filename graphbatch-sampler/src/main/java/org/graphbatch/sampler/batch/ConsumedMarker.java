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

import org.graphbatch.annotation.Internal;
import org.graphbatch.sampler.filter.PredicateFilter;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * The boolean attribute that marks an entity as emitted in a batch of the current division of the
 * full entity set. An entity without a value for the attribute counts as not consumed.
 *
 * <p>Within one batching loop the marker of an entity is written at most once, and it is never
 * read by the pass that writes it.
 */
@Internal
public class ConsumedMarker {

    private static final Logger LOG = LoggerFactory.getLogger(ConsumedMarker.class);

    private final GraphStore store;
    private final String attributeName;

    public ConsumedMarker(GraphStore store, String attributeName) {
        this.store = checkNotNull(store);
        this.attributeName = checkNotNull(attributeName);
    }

    /** Declares the marker attribute on the given types where it is missing. */
    public void ensureAttribute(EntityKind kind, Collection<String> types) {
        List<String> missing =
                types.stream()
                        .filter(type -> !store.attributeTypes(kind, type).containsKey(attributeName))
                        .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            LOG.info(
                    "Adding consumed marker attribute '{}' to {} types {}.",
                    attributeName,
                    kind.label(),
                    missing);
            store.addAttribute(kind, missing, attributeName, AttributeType.BOOL);
        }
    }

    public boolean isConsumed(EntityRef entity) {
        return PredicateFilter.isTrue(store, entity, attributeName);
    }

    /** Filters out the consumed entities. */
    public Stream<EntityRef> remaining(Stream<EntityRef> entities) {
        return entities.filter(entity -> !isConsumed(entity));
    }

    /** Marks the given entities as consumed. */
    public void mark(Collection<EntityRef> entities) {
        entities.parallelStream()
                .forEach(entity -> store.attributes(entity).set(attributeName, Boolean.TRUE));
    }

    /** Clears the marker of every entity of the given types. */
    public void reset(EntityKind kind, Collection<String> types) {
        ensureAttribute(kind, types);
        store.scan(kind, types)
                .forEach(entity -> store.attributes(entity).set(attributeName, Boolean.FALSE));
        LOG.debug("Reset consumed marker '{}' of {} types {}.", attributeName, kind.label(), types);
    }

    public String attributeName() {
        return attributeName;
    }
}
