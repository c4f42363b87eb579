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
import org.graphbatch.exception.BatchPublishException;
import org.graphbatch.exception.GraphBatchException;
import org.graphbatch.exception.PublisherOpenException;

import java.time.Duration;

/**
 * Owns the connection to a message broker that batch payloads are streamed to.
 *
 * <p>A publisher is opened once, receives any number of {@link #publish} calls and is closed
 * once. It is not reused after {@link #close(Duration)}.
 */
@PublicEvolving
public interface BatchPublisher {

    /**
     * Connects to the broker.
     *
     * @throws PublisherOpenException if the broker cannot be reached, nothing can be published then
     */
    void open() throws PublisherOpenException;

    /**
     * Publishes the payload of one batch and waits for the broker to acknowledge it. The target
     * partition is a function of the batch id.
     *
     * @throws BatchPublishException if this batch could not be published
     */
    void publish(int batchId, String key, String payload) throws BatchPublishException;

    /**
     * Flushes outstanding messages and releases the connection, waiting at most the given timeout.
     *
     * @throws GraphBatchException if the publisher could not be closed cleanly
     */
    void close(Duration timeout) throws GraphBatchException;

    PublisherState state();
}
