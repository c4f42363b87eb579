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

package org.graphbatch.sampler.serialize;

import org.graphbatch.annotation.Internal;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.sampler.batch.Batch;
import org.graphbatch.sampler.batch.BatchRequest;
import org.graphbatch.sampler.store.AttributeAccessor;
import org.graphbatch.sampler.store.AttributeType;
import org.graphbatch.sampler.store.EntityKind;
import org.graphbatch.sampler.store.EntityRef;
import org.graphbatch.sampler.store.GraphStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Renders a batch into a delimited text payload with one line per entity.
 *
 * <p>A vertex line is {@code [type<d>]id[<d>attr...]}, an edge line is {@code
 * [type<d>]source<d>target[<d>attr...]}, where {@code <d>} is the delimiter and the type prefix is
 * only written for heterogeneous output. Every line ends with a newline. Attribute values are
 * rendered as follows: booleans as {@code 1} or {@code 0}, datetimes as epoch seconds, lists as
 * space separated values and maps as {@code [key:value,key:value]}.
 */
@Internal
public class BatchSerializer {

    private final GraphStore store;
    private final EntityKind kind;
    private final String delimiter;
    private final boolean typePrefix;
    /** Type -> attribute name -> attribute type, in the requested order. */
    private final Map<String, LinkedHashMap<String, AttributeType>> attributes;

    private BatchSerializer(
            GraphStore store,
            EntityKind kind,
            String delimiter,
            boolean typePrefix,
            Map<String, LinkedHashMap<String, AttributeType>> attributes) {
        this.store = store;
        this.kind = kind;
        this.delimiter = delimiter;
        this.typePrefix = typePrefix;
        this.attributes = attributes;
    }

    /**
     * Creates the serializer of a request, validating the requested attributes against the schema
     * of the store.
     *
     * @throws IllegalConfigurationException if an attribute does not exist, or a map attribute is
     *     requested together with the {@code ,} delimiter
     */
    public static BatchSerializer forRequest(GraphStore store, BatchRequest request) {
        checkNotNull(store);
        Map<String, LinkedHashMap<String, AttributeType>> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : request.attributes().entrySet()) {
            String type = entry.getKey();
            Map<String, AttributeType> schema;
            try {
                schema = store.attributeTypes(request.kind(), type);
            } catch (IllegalArgumentException e) {
                throw new IllegalConfigurationException(e.getMessage(), e);
            }
            LinkedHashMap<String, AttributeType> typeAttributes = new LinkedHashMap<>();
            for (String name : entry.getValue()) {
                AttributeType attributeType = schema.get(name);
                if (attributeType == null) {
                    throw new IllegalConfigurationException(
                            "The %s type '%s' has no attribute '%s'.",
                            request.kind().label(), type, name);
                }
                if (attributeType == AttributeType.MAP && ",".equals(request.delimiter())) {
                    throw new IllegalConfigurationException(
                            "Map attribute '%s' of type '%s' cannot be serialized with the ',' delimiter.",
                            name, type);
                }
                typeAttributes.put(name, attributeType);
            }
            resolved.put(type, typeAttributes);
        }
        return new BatchSerializer(
                store,
                request.kind(),
                request.delimiter(),
                request.isHeterogeneous(),
                Collections.unmodifiableMap(resolved));
    }

    /** Tag of the payloads, {@code vertex_batch} or {@code edge_batch}. */
    public String tag() {
        return kind.batchTag();
    }

    public String serialize(Batch batch) {
        StringBuilder payload = new StringBuilder();
        for (EntityRef entity : batch.entities()) {
            appendLine(payload, entity);
        }
        return payload.toString();
    }

    private void appendLine(StringBuilder line, EntityRef entity) {
        if (typePrefix) {
            line.append(entity.type()).append(delimiter);
        }
        if (entity.kind() == EntityKind.EDGE) {
            line.append(entity.sourceId()).append(delimiter).append(entity.targetId());
        } else {
            line.append(entity.primaryId());
        }
        Map<String, AttributeType> typeAttributes = attributes.get(entity.type());
        if (typeAttributes != null && !typeAttributes.isEmpty()) {
            AttributeAccessor accessor = store.attributes(entity);
            for (Map.Entry<String, AttributeType> attribute : typeAttributes.entrySet()) {
                Object value = accessor.get(attribute.getKey(), attribute.getValue());
                line.append(delimiter).append(render(value, attribute.getValue()));
            }
        }
        line.append('\n');
    }

    static String render(Object value, AttributeType type) {
        switch (type) {
            case BOOL:
                return ((Boolean) value) ? "1" : "0";
            case DATETIME:
                return String.valueOf(((Instant) value).getEpochSecond());
            case LIST:
                List<String> elements = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    elements.add(String.valueOf(element));
                }
                return String.join(" ", elements);
            case MAP:
                return ((Map<?, ?>) value)
                        .entrySet().stream()
                        .map(e -> e.getKey() + ":" + e.getValue())
                        .collect(Collectors.joining(",", "[", "]"));
            default:
                return String.valueOf(value);
        }
    }
}
