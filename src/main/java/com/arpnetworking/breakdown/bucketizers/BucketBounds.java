/*
 * Copyright 2017 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.breakdown.bucketizers;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The display bounds {@code [min, max]} of a bucket. The maximum is an
 * approximation; see {@link Bucketizer#maxForIndex(int)}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class BucketBounds {

    /**
     * Public constructor.
     *
     * @param min The minimum value contained in the bucket.
     * @param max The approximate maximum value of the bucket.
     */
    public BucketBounds(final double min, final double max) {
        _min = min;
        _max = max;
    }

    public double getMin() {
        return _min;
    }

    public double getMax() {
        return _max;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BucketBounds)) {
            return false;
        }
        final BucketBounds otherBounds = (BucketBounds) other;
        return Double.compare(_min, otherBounds._min) == 0
                && Double.compare(_max, otherBounds._max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_min, _max);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Min", _min)
                .add("Max", _max)
                .toString();
    }

    private final double _min;
    private final double _max;
}
