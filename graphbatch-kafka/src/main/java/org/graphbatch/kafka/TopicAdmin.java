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

package org.graphbatch.kafka;

import org.graphbatch.annotation.Internal;
import org.graphbatch.exception.GraphBatchException;

import java.time.Duration;
import java.util.Map;

/** The topic operations the streaming publisher needs from the broker. */
@Internal
public interface TopicAdmin extends AutoCloseable {

    boolean topicExists(String topic) throws GraphBatchException;

    void createTopic(String topic, int partitions, short replicationFactor, Map<String, String> configs)
            throws GraphBatchException;

    void deleteTopic(String topic) throws GraphBatchException;

    void close(Duration timeout);

    @Override
    default void close() {
        close(Duration.ofSeconds(30));
    }
}
