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

/**
 * Reads and writes the named attributes of one entity. Implementations are provided by the graph
 * store backend and must be safe to use from several threads.
 */
@PublicEvolving
public interface AttributeAccessor {

    /**
     * Reads the attribute with the given name.
     *
     * @param name the attribute name
     * @param expectedType the type the caller expects the attribute to have
     * @return the attribute value, never {@code null}
     * @throws AttributeAccessException if the attribute is missing or has another type
     */
    Object get(String name, AttributeType expectedType) throws AttributeAccessException;

    /**
     * Writes the attribute with the given name.
     *
     * @throws AttributeAccessException if the attribute does not exist or does not accept the value
     */
    void set(String name, Object value) throws AttributeAccessException;
}
