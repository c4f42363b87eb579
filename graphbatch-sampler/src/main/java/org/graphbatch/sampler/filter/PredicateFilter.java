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

package org.graphbatch.sampler.filter;

import org.graphbatch.annotation.Internal;
import org.graphbatch.exception.AttributeAccessException;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Keeps the entities whose named boolean attribute is true. Without an attribute name every entity
 * passes. An entity whose attribute is missing or is not a boolean is excluded.
 *
 * <p>The filter only reads attributes and can be evaluated on any number of partitions in
 * parallel.
 */
@Internal
public class PredicateFilter implements Predicate<EntityRef> {

    private static final Logger LOG = LoggerFactory.getLogger(PredicateFilter.class);

    private final GraphStore store;
    @Nullable private final String attributeName;

    public PredicateFilter(GraphStore store, @Nullable String attributeName) {
        this.store = checkNotNull(store);
        this.attributeName = attributeName;
    }

    /** A filter that lets every entity pass. */
    public static PredicateFilter none(GraphStore store) {
        return new PredicateFilter(store, null);
    }

    @Override
    public boolean test(EntityRef entity) {
        if (attributeName == null) {
            return true;
        }
        return isTrue(store, entity, attributeName);
    }

    public Stream<EntityRef> filter(Stream<EntityRef> candidates) {
        return attributeName == null ? candidates : candidates.filter(this);
    }

    @Nullable
    public String attributeName() {
        return attributeName;
    }

    /**
     * Reads a boolean attribute, treating a missing or mistyped attribute as false.
     *
     * @return whether the attribute exists, is a boolean and is true
     */
    public static boolean isTrue(GraphStore store, EntityRef entity, String attributeName) {
        try {
            return Boolean.TRUE.equals(
                    store.attributes(entity).get(attributeName, AttributeType.BOOL));
        } catch (AttributeAccessException e) {
            LOG.debug("Treating {} as false for '{}': {}", entity, attributeName, e.getMessage());
            return false;
        }
    }
}
