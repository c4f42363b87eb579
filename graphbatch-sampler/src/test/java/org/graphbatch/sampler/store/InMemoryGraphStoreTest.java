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

import org.graphbatch.exception.AttributeAccessException;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.graphbatch.sampler.store.TestingGraphs.PAPER;
import static org.graphbatch.sampler.store.TestingGraphs.PERSON;

/** Tests for {@link InMemoryGraphStore}. */
class InMemoryGraphStoreTest {

    @Test
    void testScanByType() {
        InMemoryGraphStore store = TestingGraphs.people(5);
        TestingGraphs.addPapers(store, 3);

        assertThat(store.types(EntityKind.VERTEX)).containsExactlyInAnyOrder(PERSON, PAPER);
        assertThat(
                        store.scan(EntityKind.VERTEX, Collections.singleton(PAPER))
                                .map(EntityRef::id)
                                .collect(Collectors.toSet()))
                .containsExactlyInAnyOrder(5L, 6L, 7L);
        assertThat(store.scan(EntityKind.EDGE, Collections.singleton(PERSON))).isEmpty();
        assertThat(store.size(EntityKind.VERTEX)).isEqualTo(8);
    }

    @Test
    void testAttributeAccess() {
        InMemoryGraphStore store = TestingGraphs.people(2);
        EntityRef first = EntityRef.vertex(PERSON, 0, "p0");
        AttributeAccessor attributes = store.attributes(first);

        assertThat(attributes.get("age", AttributeType.INT)).isEqualTo(20L);
        assertThatThrownBy(() -> attributes.get("age", AttributeType.STRING))
                .isInstanceOf(AttributeAccessException.class)
                .hasMessageContaining("INT");
        assertThatThrownBy(() -> attributes.get("unknown", AttributeType.BOOL))
                .isInstanceOf(AttributeAccessException.class)
                .hasMessageContaining("unknown");
        assertThatThrownBy(() -> attributes.set("age", "old"))
                .isInstanceOf(AttributeAccessException.class);

        attributes.set("age", 33);
        assertThat(attributes.get("age", AttributeType.INT)).isEqualTo(33);
    }

    @Test
    void testAddAttribute() {
        InMemoryGraphStore store = TestingGraphs.people(1);
        EntityRef vertex = EntityRef.vertex(PERSON, 0, "p0");
        store.addAttribute(
                EntityKind.VERTEX, Collections.singleton(PERSON), "is_test", AttributeType.BOOL);

        assertThat(store.attributeTypes(EntityKind.VERTEX, PERSON))
                .containsEntry("is_test", AttributeType.BOOL);
        // declared, but no value yet
        assertThatThrownBy(() -> store.attributes(vertex).get("is_test", AttributeType.BOOL))
                .isInstanceOf(AttributeAccessException.class)
                .hasMessageContaining("no value");
        assertThatThrownBy(
                        () ->
                                store.addAttribute(
                                        EntityKind.VERTEX,
                                        Collections.singleton(PERSON),
                                        "is_test",
                                        AttributeType.INT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.attributeTypes(EntityKind.VERTEX, "Unknown"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEdges() {
        InMemoryGraphStore store = TestingGraphs.people(2);
        store.createType(EntityKind.EDGE, "Knows", Collections.emptyMap());
        EntityRef edge = store.addEdge("Knows", "p0", "p1", Collections.emptyMap());

        assertThat(edge.kind()).isEqualTo(EntityKind.EDGE);
        assertThat(edge.id()).isEqualTo(2L);
        assertThat(edge.primaryId()).isEqualTo("p0->p1");
        assertThat(edge.sourceId()).isEqualTo("p0");
        assertThat(edge.targetId()).isEqualTo("p1");
    }
}
