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

package org.graphbatch.sampler.topk;

import org.graphbatch.annotation.Internal;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Collector;

import static org.graphbatch.utils.Preconditions.checkArgument;
import static org.graphbatch.utils.Preconditions.checkNotNull;

/**
 * Keeps the {@code capacity} smallest elements offered to it, without sorting all of them.
 *
 * <p>The elements are held in a max-heap of at most {@code capacity} elements: a new element only
 * enters if it is smaller than the largest one kept, which it then replaces. Two instances can be
 * merged, and the merge is commutative and associative, so partial results computed on different
 * partitions can be combined in any order.
 *
 * @param <T> type of the elements
 */
@NotThreadSafe
@Internal
public final class BoundedTopK<T> {

    private final int capacity;
    private final Comparator<? super T> comparator;
    private final PriorityQueue<T> heap;

    public BoundedTopK(int capacity, Comparator<? super T> comparator) {
        checkArgument(capacity >= 0, "Capacity must not be negative, but is %s.", capacity);
        this.capacity = capacity;
        this.comparator = checkNotNull(comparator);
        // the head of the heap is the largest element kept
        this.heap = new PriorityQueue<>(Math.max(1, capacity), comparator.reversed());
    }

    /**
     * Offers an element.
     *
     * @return whether the element is kept
     */
    public boolean offer(T element) {
        if (capacity == 0) {
            return false;
        }
        if (heap.size() < capacity) {
            heap.add(element);
            return true;
        }
        if (comparator.compare(element, heap.peek()) < 0) {
            heap.poll();
            heap.add(element);
            return true;
        }
        return false;
    }

    /** Offers all elements kept by the other instance to this one. */
    public BoundedTopK<T> merge(BoundedTopK<T> other) {
        for (T element : other.heap) {
            offer(element);
        }
        return this;
    }

    public int size() {
        return heap.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Returns the kept elements in ascending order. */
    public List<T> toSortedList() {
        List<T> sorted = new ArrayList<>(heap);
        sorted.sort(comparator);
        return Collections.unmodifiableList(sorted);
    }

    /**
     * A collector that keeps the {@code capacity} smallest elements of a stream. Each partition of
     * a parallel stream fills its own bounded heap, the heaps are then merged.
     */
    public static <T> Collector<T, ?, BoundedTopK<T>> collector(
            int capacity, Comparator<? super T> comparator) {
        return Collector.of(
                () -> new BoundedTopK<T>(capacity, comparator),
                BoundedTopK::offer,
                BoundedTopK::merge,
                Collector.Characteristics.UNORDERED,
                Collector.Characteristics.IDENTITY_FINISH);
    }
}
