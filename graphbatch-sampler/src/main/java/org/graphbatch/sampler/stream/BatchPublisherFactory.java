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

package org.graphbatch.sampler.stream;

import org.graphbatch.annotation.PublicEvolving;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.GraphBatchException;

/**
 * Creates the {@link BatchPublisher} of each streaming invocation. A factory may hold resources
 * that outlive single invocations, such as the broker topic, which are released on {@link
 * #close()}.
 */
@PublicEvolving
@FunctionalInterface
public interface BatchPublisherFactory extends AutoCloseable {

    BatchPublisher create(Configuration conf);

    @Override
    default void close() throws GraphBatchException {}
}
