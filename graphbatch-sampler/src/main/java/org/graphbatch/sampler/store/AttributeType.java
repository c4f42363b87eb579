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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** The runtime type of an entity attribute. */
@PublicEvolving
public enum AttributeType {
    BOOL(Boolean.class),
    INT(Long.class),
    UINT(Long.class),
    FLOAT(Double.class),
    DOUBLE(Double.class),
    STRING(String.class),
    DATETIME(Instant.class),
    LIST(List.class),
    MAP(Map.class);

    private final Class<?> javaClass;

    AttributeType(Class<?> javaClass) {
        this.javaClass = javaClass;
    }

    /** Whether the given value can be stored in an attribute of this type. */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        switch (this) {
            case INT:
            case UINT:
                return value instanceof Long
                        || value instanceof Integer
                        || value instanceof Short
                        || value instanceof Byte;
            case FLOAT:
            case DOUBLE:
                return value instanceof Number;
            default:
                return javaClass.isInstance(value);
        }
    }
}
