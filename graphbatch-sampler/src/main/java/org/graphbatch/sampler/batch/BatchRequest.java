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
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * The parameters of one batching invocation. A request is created by a {@link Builder} that takes
 * its defaults from a {@link Configuration} and validates the combination of parameters before
 * any batch work starts.
 */
@PublicEvolving
public final class BatchRequest {

    private final EntityKind kind;
    private final List<String> types;
    private final Map<String, List<String>> attributes;
    private final boolean perTypeAttributes;
    private final List<EntityRef> inputEntities;
    @Nullable private final Integer batchSize;
    private final int numBatches;
    private final boolean shuffle;
    @Nullable private final Long shuffleSeed;
    @Nullable private final String filterBy;
    private final int numHeapInserts;
    private final String delimiter;

    private BatchRequest(Builder builder) {
        this.kind = builder.kind;
        this.types = Collections.unmodifiableList(new ArrayList<>(builder.types));
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        for (String type : types) {
            List<String> names =
                    builder.perTypeAttributes.containsKey(type)
                            ? builder.perTypeAttributes.get(type)
                            : builder.attributes;
            attributes.put(type, Collections.unmodifiableList(new ArrayList<>(names)));
        }
        this.attributes = Collections.unmodifiableMap(attributes);
        this.perTypeAttributes = !builder.perTypeAttributes.isEmpty();
        this.inputEntities = Collections.unmodifiableList(new ArrayList<>(builder.inputEntities));
        this.batchSize = builder.batchSize;
        this.numBatches = builder.numBatches;
        this.shuffle = builder.shuffle;
        this.shuffleSeed = builder.shuffleSeed;
        this.filterBy = builder.filterBy;
        this.numHeapInserts = builder.numHeapInserts;
        this.delimiter = builder.delimiter;
    }

    public static Builder builder(EntityKind kind, Configuration conf) {
        return new Builder(kind, conf);
    }

    public EntityKind kind() {
        return kind;
    }

    public List<String> types() {
        return types;
    }

    /** The attributes to serialize, per entity type. */
    public Map<String, List<String>> attributes() {
        return attributes;
    }

    /**
     * Whether the output mixes several entity types, in which case every serialized line is
     * prefixed with the entity type.
     */
    public boolean isHeterogeneous() {
        return types.size() > 1 || perTypeAttributes;
    }

    public List<EntityRef> inputEntities() {
        return inputEntities;
    }

    /** Whether an explicit entity set was given, which turns batching into a pass-through. */
    public boolean isPassThrough() {
        return !inputEntities.isEmpty();
    }

    @Nullable
    public Integer batchSize() {
        return batchSize;
    }

    public int numBatches() {
        return numBatches;
    }

    public boolean shuffle() {
        return shuffle;
    }

    @Nullable
    public Long shuffleSeed() {
        return shuffleSeed;
    }

    @Nullable
    public String filterBy() {
        return filterBy;
    }

    public int numHeapInserts() {
        return numHeapInserts;
    }

    public String delimiter() {
        return delimiter;
    }

    @Override
    public String toString() {
        return "BatchRequest{"
                + "kind="
                + kind
                + ", types="
                + types
                + ", inputEntities="
                + inputEntities.size()
                + ", batchSize="
                + batchSize
                + ", numBatches="
                + numBatches
                + ", shuffle="
                + shuffle
                + ", filterBy="
                + filterBy
                + ", numHeapInserts="
                + numHeapInserts
                + '}';
    }

    // ------------------------------------------------------------------------

    /** Builder of {@link BatchRequest}. */
    @PublicEvolving
    public static final class Builder {

        private final EntityKind kind;
        private final LinkedHashSet<String> types = new LinkedHashSet<>();
        private final List<String> attributes = new ArrayList<>();
        private final Map<String, List<String>> perTypeAttributes = new LinkedHashMap<>();
        private final List<EntityRef> inputEntities = new ArrayList<>();
        @Nullable private Integer batchSize;
        private int numBatches;
        private boolean shuffle;
        @Nullable private Long shuffleSeed;
        @Nullable private String filterBy;
        private int numHeapInserts;
        private String delimiter;

        private Builder(EntityKind kind, Configuration conf) {
            this.kind = checkNotNull(kind);
            this.batchSize = conf.getOptional(ConfigOptions.BATCH_SIZE).orElse(null);
            this.numBatches = conf.get(ConfigOptions.BATCH_NUM_BATCHES);
            this.shuffle = conf.get(ConfigOptions.BATCH_SHUFFLE);
            this.shuffleSeed = conf.getOptional(ConfigOptions.BATCH_SHUFFLE_SEED).orElse(null);
            this.filterBy = conf.getOptional(ConfigOptions.BATCH_FILTER_BY).orElse(null);
            this.numHeapInserts = conf.get(ConfigOptions.BATCH_NUM_HEAP_INSERTS);
            this.delimiter = conf.get(ConfigOptions.BATCH_DELIMITER);
        }

        public Builder types(String... types) {
            return types(Arrays.asList(types));
        }

        public Builder types(Collection<String> types) {
            this.types.addAll(types);
            return this;
        }

        /** Attributes serialized for every type without its own attribute list. */
        public Builder attributes(String... attributes) {
            this.attributes.addAll(Arrays.asList(attributes));
            return this;
        }

        /** Attributes serialized for the given type only. This makes the output heterogeneous. */
        public Builder attributes(String type, List<String> attributes) {
            this.perTypeAttributes.put(type, new ArrayList<>(attributes));
            this.types.add(type);
            return this;
        }

        public Builder inputEntities(Collection<EntityRef> entities) {
            this.inputEntities.addAll(entities);
            return this;
        }

        public Builder batchSize(@Nullable Integer batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Number of batches. Ignored when a batch size is set, which determines the count. */
        public Builder numBatches(int numBatches) {
            this.numBatches = numBatches;
            return this;
        }

        public Builder shuffle(boolean shuffle) {
            this.shuffle = shuffle;
            return this;
        }

        public Builder shuffleSeed(@Nullable Long shuffleSeed) {
            this.shuffleSeed = shuffleSeed;
            return this;
        }

        public Builder filterBy(@Nullable String filterBy) {
            this.filterBy = filterBy;
            return this;
        }

        public Builder numHeapInserts(int numHeapInserts) {
            this.numHeapInserts = numHeapInserts;
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Validates the parameters and creates the request.
         *
         * @throws IllegalConfigurationException if the parameters are invalid or conflict
         */
        public BatchRequest build() {
            for (EntityRef entity : inputEntities) {
                if (entity.kind() != kind) {
                    throw new IllegalConfigurationException(
                            "Input entity %s is not a %s.", entity, kind.label());
                }
                types.add(entity.type());
            }
            if (types.isEmpty()) {
                throw new IllegalConfigurationException(
                        "At least one %s type has to be given.", kind.label());
            }
            if (batchSize != null && batchSize <= 0) {
                throw new IllegalConfigurationException(
                        "Batch size must be positive, but is %s.", batchSize);
            }
            if (numBatches < 0) {
                throw new IllegalConfigurationException(
                        "Number of batches must not be negative, but is %s.", numBatches);
            }
            if (numHeapInserts <= 0) {
                throw new IllegalConfigurationException(
                        "Number of heap inserts must be positive, but is %s.", numHeapInserts);
            }
            if (StringUtils.isEmpty(delimiter)) {
                throw new IllegalConfigurationException("The attribute delimiter must not be empty.");
            }
            if (filterBy != null && StringUtils.isBlank(filterBy)) {
                filterBy = null;
            }
            return new BatchRequest(this);
        }
    }
}
