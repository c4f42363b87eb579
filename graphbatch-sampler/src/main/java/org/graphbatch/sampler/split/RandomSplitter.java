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
import org.graphbatch.sampler.score.DeterministicScorer;
import org.graphbatch.sampler.store.AttributeAccessor;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Splits the vertices or edges of a graph randomly into up to three disjoint buckets, each one
 * stored as a boolean attribute. For example the ratios {@code train=0.8, valid=0.1} flag about 80%
 * of the entities with {@code train}, another 10% with {@code valid} and leave the rest unflagged.
 *
 * <p>The draw of an entity is the {@link DeterministicScorer} score of its ordinal id under the
 * configured {@link ConfigOptions#SPLIT_RANDOM_SEED}, so running the same split twice on the same
 * graph flags the same entities.
 */
@PublicEvolving
public class RandomSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(RandomSplitter.class);

    static final int MAX_BUCKETS = 3;

    private final GraphStore store;
    private final EntityKind kind;
    private final long seed;
    private final List<SplitRatio> ratios;

    public RandomSplitter(
            GraphStore store, EntityKind kind, Configuration conf, Map<String, Double> ratios) {
        this.store = checkNotNull(store);
        this.kind = checkNotNull(kind);
        this.seed = conf.get(ConfigOptions.SPLIT_RANDOM_SEED);
        this.ratios = validate(ratios);
    }

    /** Creates a splitter of all vertices. The ratios are applied in iteration order. */
    public static RandomSplitter vertexSplitter(
            GraphStore store, Configuration conf, Map<String, Double> ratios) {
        return new RandomSplitter(store, EntityKind.VERTEX, conf, ratios);
    }

    /** Creates a splitter of all edges. The ratios are applied in iteration order. */
    public static RandomSplitter edgeSplitter(
            GraphStore store, Configuration conf, Map<String, Double> ratios) {
        return new RandomSplitter(store, EntityKind.EDGE, conf, ratios);
    }

    /** Performs the split with the ratios given at construction. */
    public SplitResult run() {
        return split(ratios);
    }

    /**
     * Performs the split with other ratios than the ones given at construction.
     *
     * @param overrides the ratios to use instead, or an empty map to use the construction ones
     */
    public SplitResult run(Map<String, Double> overrides) {
        return overrides.isEmpty() ? split(ratios) : split(validate(overrides));
    }

    private SplitResult split(List<SplitRatio> ratios) {
        Set<String> types = store.types(kind);
        List<String> buckets = new ArrayList<>();
        for (SplitRatio ratio : ratios) {
            buckets.add(ratio.bucket());
            ensureAttribute(types, ratio.bucket());
        }
        LOG.info("Splitting {}s of types {} into {}.", kind.label(), types, ratios);

        SplitAssigner assigner = new SplitAssigner(ratios);
        ConcurrentMap<Integer, Long> counts =
                store.scan(kind, types)
                        .map(entity -> assign(entity, assigner, buckets))
                        .collect(
                                Collectors.groupingByConcurrent(
                                        Function.identity(), Collectors.counting()));

        Map<String, Long> bucketCounts = new LinkedHashMap<>();
        for (int i = 0; i < buckets.size(); i++) {
            bucketCounts.put(buckets.get(i), counts.getOrDefault(i, 0L));
        }
        long unassigned = counts.getOrDefault(-1, 0L);
        String status = StringUtils.capitalize(kind.label()) + " split finished successfully.";
        LOG.info("{} Buckets: {}, unassigned: {}.", status, bucketCounts, unassigned);
        return new SplitResult(status, bucketCounts, unassigned);
    }

    private int assign(EntityRef entity, SplitAssigner assigner, List<String> buckets) {
        AttributeAccessor attributes = store.attributes(entity);
        for (String bucket : buckets) {
            attributes.set(bucket, Boolean.FALSE);
        }
        int index = assigner.assignIndex(DeterministicScorer.score(entity.id(), seed));
        if (index >= 0) {
            attributes.set(buckets.get(index), Boolean.TRUE);
        }
        return index;
    }

    private void ensureAttribute(Set<String> types, String bucket) {
        List<String> missing = new ArrayList<>();
        for (String type : types) {
            AttributeType existing = store.attributeTypes(kind, type).get(bucket);
            if (existing == null) {
                missing.add(type);
            } else if (existing != AttributeType.BOOL) {
                throw new IllegalConfigurationException(
                        "Split attribute '%s' of %s type '%s' is %s, not BOOL.",
                        bucket, kind.label(), type, existing);
            }
        }
        if (!missing.isEmpty()) {
            store.addAttribute(kind, missing, bucket, AttributeType.BOOL);
        }
    }

    static List<SplitRatio> validate(Map<String, Double> ratios) {
        if (ratios.isEmpty()) {
            throw new IllegalConfigurationException("Need at least one split ratio.");
        }
        if (ratios.size() > MAX_BUCKETS) {
            throw new IllegalConfigurationException(
                    "Can take at most %s split ratios, but got %s.", MAX_BUCKETS, ratios.size());
        }
        List<SplitRatio> validated = new ArrayList<>();
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : ratios.entrySet()) {
            double ratio = entry.getValue();
            if (ratio < 0 || ratio > 1) {
                throw new IllegalConfigurationException(
                        "Split ratio '%s' has to be between 0 and 1, but is %s.",
                        entry.getKey(), ratio);
            }
            sum += ratio;
            validated.add(new SplitRatio(entry.getKey(), ratio));
        }
        if (sum > 1) {
            throw new IllegalConfigurationException(
                    "The split ratios have to sum up to at most 1, but sum up to %s.", sum);
        }
        return Collections.unmodifiableList(validated);
    }

    public List<SplitRatio> ratios() {
        return ratios;
    }
}
