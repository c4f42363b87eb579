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
import org.graphbatch.config.ConfigOptions.ConsumedMarkerMode;
import org.graphbatch.sampler.filter.PredicateFilter;
import org.graphbatch.sampler.score.EntityScorer;
import org.graphbatch.sampler.score.ScoredEntity;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;
import org.graphbatch.sampler.topk.PartialPassTopKSelector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Divides the eligible entities of a request into disjoint batches.
 *
 * <p>For every batch index the remaining (not consumed) eligible entities are scored, the lowest
 * scored ones are selected by a {@link PartialPassTopKSelector}, marked as consumed and handed to
 * the sink. Batches are produced strictly in increasing id order, since every batch depends on the
 * markers written by the batches before it. Everything within one batch is evaluated on the
 * store's (possibly parallel) scans.
 *
 * <p>A request with an explicit entity set is passed through as a single batch with id 0. Neither
 * the scorer nor the consumed marker are involved then.
 */
@Internal
public class EntityBatcher {

    private static final Logger LOG = LoggerFactory.getLogger(EntityBatcher.class);

    private final GraphStore store;
    private final ConsumedMarker marker;
    private final ConsumedMarkerMode markerMode;

    public EntityBatcher(GraphStore store, ConsumedMarker marker, ConsumedMarkerMode markerMode) {
        this.store = checkNotNull(store);
        this.marker = checkNotNull(marker);
        this.markerMode = checkNotNull(markerMode);
    }

    /**
     * Runs the batching loop of the request.
     *
     * @return the number of batches handed to the sink
     */
    public int run(BatchRequest request, BatchSink sink) {
        if (request.isPassThrough()) {
            LOG.debug(
                    "Passing {} input entities through as a single batch.",
                    request.inputEntities().size());
            sink.accept(new Batch(0, request.kind(), request.inputEntities()));
            return 1;
        }

        marker.ensureAttribute(request.kind(), request.types());
        if (markerMode == ConsumedMarkerMode.PER_INVOCATION) {
            marker.reset(request.kind(), request.types());
        }

        PredicateFilter filter = new PredicateFilter(store, request.filterBy());
        long remaining = remainingEligible(request, filter).count();
        int numBatches = resolveNumBatches(request, remaining);
        int batchSize = resolveBatchSize(request, remaining, numBatches);
        LOG.debug(
                "Dividing {} eligible entities into {} batches of at most {}.",
                remaining,
                numBatches,
                batchSize);

        EntityScorer scorer =
                request.shuffle()
                        ? EntityScorer.shuffle(request.shuffleSeed())
                        : EntityScorer.ordinal();
        PartialPassTopKSelector selector = new PartialPassTopKSelector(request.numHeapInserts());
        for (int batchId = 0; batchId < numBatches; batchId++) {
            List<EntityRef> selected =
                    selector
                            .select(
                                    () -> remainingEligible(request, filter).map(scorer::scored),
                                    batchSize)
                            .stream()
                            .map(ScoredEntity::entity)
                            .collect(Collectors.toList());
            marker.mark(selected);
            sink.accept(new Batch(batchId, request.kind(), selected));
        }
        return numBatches;
    }

    private Stream<EntityRef> remainingEligible(BatchRequest request, PredicateFilter filter) {
        return marker.remaining(filter.filter(store.scan(request.kind(), request.types())));
    }

    /**
     * A batch size takes precedence over the requested number of batches: as many batches are
     * produced as the remaining entities fill, so every eligible entity is emitted.
     */
    static int resolveNumBatches(BatchRequest request, long remaining) {
        Integer batchSize = request.batchSize();
        if (batchSize != null) {
            return (int) ceilDiv(remaining, batchSize);
        }
        return request.numBatches();
    }

    static int resolveBatchSize(BatchRequest request, long remaining, int numBatches) {
        Integer batchSize = request.batchSize();
        if (batchSize != null) {
            return batchSize;
        }
        if (numBatches == 0) {
            return 0;
        }
        return (int) ceilDiv(remaining, numBatches);
    }

    private static long ceilDiv(long dividend, long divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
