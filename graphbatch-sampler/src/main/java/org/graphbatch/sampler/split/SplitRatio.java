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

package org.graphbatch.sampler.split;

import org.graphbatch.annotation.PublicEvolving;

import java.util.Objects;

import static org.graphbatch.utils.Preconditions.checkNotNull;

/** A named bucket and the fraction of the entities it receives. */
@PublicEvolving
public final class SplitRatio {

    private final String bucket;
    private final double ratio;

    public SplitRatio(String bucket, double ratio) {
        this.bucket = checkNotNull(bucket, "bucket must not be null");
        this.ratio = ratio;
    }

    public String bucket() {
        return bucket;
    }

    public double ratio() {
        return ratio;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SplitRatio that = (SplitRatio) o;
        return Double.compare(that.ratio, ratio) == 0 && bucket.equals(that.bucket);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, ratio);
    }

    @Override
    public String toString() {
        return bucket + "=" + ratio;
    }
}
