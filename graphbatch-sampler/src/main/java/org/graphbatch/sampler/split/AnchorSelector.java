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
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.sampler.filter.PredicateFilter;
import org.graphbatch.sampler.score.DeterministicScorer;
import org.graphbatch.sampler.score.ScoredEntity;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;
import org.graphbatch.sampler.topk.BoundedTopK;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Flags a reproducible quota of entities as anchors.
 *
 * <p>Of the eligible entities of the target types, the {@code round(count * percentage)} ones with
 * the lowest {@link DeterministicScorer} score are selected in a single bounded top-k pass.
 * Eligible entities of any other type are selected unconditionally. The anchor attribute is set to
 * true for the selected entities and to false for every other entity of the requested types.
 */
@PublicEvolving
public class AnchorSelector {

    private static final Logger LOG = LoggerFactory.getLogger(AnchorSelector.class);

    private final GraphStore store;
    private final double percentage;
    private final String attributeName;
    private final long seed;
    private final Set<String> targetTypes;

    public AnchorSelector(GraphStore store, Configuration conf) {
        this.store = checkNotNull(store);
        this.percentage = conf.get(ConfigOptions.ANCHOR_PERCENTAGE);
        this.attributeName = conf.get(ConfigOptions.ANCHOR_ATTRIBUTE);
        this.seed = conf.get(ConfigOptions.ANCHOR_RANDOM_SEED);
        this.targetTypes = new HashSet<>(conf.get(ConfigOptions.ANCHOR_TARGET_TYPES));
        if (percentage < 0 || percentage > 1) {
            throw new IllegalConfigurationException(
                    "Anchor percentage has to be between 0 and 1, but is %s.", percentage);
        }
    }

    /**
     * Selects the anchors among the entities of the given types.
     *
     * @param filterBy name of a boolean attribute the entities must have set, or {@code null}
     */
    public AnchorSelection select(
            EntityKind kind, Collection<String> types, @Nullable String filterBy) {
        ensureAttribute(kind, types);
        PredicateFilter filter = new PredicateFilter(store, filterBy);

        long targetCount = filter.filter(store.scan(kind, types)).filter(this::isTarget).count();
        int quota = (int) Math.round(targetCount * percentage);

        BoundedTopK<ScoredEntity> heap =
                filter.filter(store.scan(kind, types))
                        .filter(this::isTarget)
                        .map(e -> new ScoredEntity(e, DeterministicScorer.score(e.id(), seed)))
                        .collect(BoundedTopK.collector(quota, ScoredEntity.ASCENDING));
        Set<Long> selected =
                heap.toSortedList().stream()
                        .map(scored -> scored.entity().id())
                        .collect(Collectors.toSet());
        Set<Long> forced =
                filter.filter(store.scan(kind, types))
                        .filter(e -> !isTarget(e))
                        .map(EntityRef::id)
                        .collect(Collectors.toSet());

        store.scan(kind, types)
                .forEach(
                        e -> {
                            boolean anchor =
                                    selected.contains(e.id()) || forced.contains(e.id());
                            store.attributes(e).set(attributeName, anchor);
                        });

        List<Long> anchorIds = new ArrayList<>(selected);
        anchorIds.addAll(forced);
        anchorIds.sort(null);
        LOG.info(
                "Selected {} of {} target {}s as anchors, {} more were forced in.",
                selected.size(),
                targetCount,
                kind.label(),
                forced.size());
        return new AnchorSelection(anchorIds, selected.size(), forced.size());
    }

    /** Lists the ordinal ids of the entities currently flagged as anchors, ascending. */
    public List<Long> anchors(EntityKind kind, Collection<String> types) {
        return new PredicateFilter(store, attributeName)
                .filter(store.scan(kind, types))
                .map(EntityRef::id)
                .sorted()
                .collect(Collectors.toList());
    }

    private boolean isTarget(EntityRef entity) {
        return targetTypes.isEmpty() || targetTypes.contains(entity.type());
    }

    private void ensureAttribute(EntityKind kind, Collection<String> types) {
        List<String> missing = new ArrayList<>();
        for (String type : types) {
            AttributeType existing = store.attributeTypes(kind, type).get(attributeName);
            if (existing == null) {
                missing.add(type);
            } else if (existing != AttributeType.BOOL) {
                throw new IllegalConfigurationException(
                        "Anchor attribute '%s' of %s type '%s' is %s, not BOOL.",
                        attributeName, kind.label(), type, existing);
            }
        }
        if (!missing.isEmpty()) {
            store.addAttribute(kind, missing, attributeName, AttributeType.BOOL);
        }
    }

    public String attributeName() {
        return attributeName;
    }
}
