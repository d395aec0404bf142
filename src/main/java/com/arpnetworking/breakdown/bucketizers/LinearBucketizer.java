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

/**
 * Buckets of a fixed width {@code step}: bucket {@code i} spans
 * {@code [step * i, step * (i + 1))}. Use {@link BucketizerFactory} for
 * construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class LinearBucketizer extends BaseBucketizer {

    public double getStep() {
        return _step;
    }

    @Override
    public BucketizerType getType() {
        return BucketizerType.LINEAR;
    }

    @Override
    protected long computeIndex(final double value) {
        long ordinal = (long) Math.floor(value / _step);
        if (ordinal > MAX_ORDINAL) {
            return ordinal;
        }
        // The quotient can round across a boundary; the bucket minimum decides.
        if (ordinal > 0 && value < _step * ordinal) {
            --ordinal;
        } else if (value >= _step * (ordinal + 1)) {
            ++ordinal;
        }
        return ordinal;
    }

    @Override
    protected double computeMin(final int ordinal) {
        return _step * ordinal;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LinearBucketizer)) {
            return false;
        }
        final LinearBucketizer otherBucketizer = (LinearBucketizer) other;
        return Double.compare(_step, otherBucketizer._step) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(_step);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Step", _step)
                .toString();
    }

    LinearBucketizer(final double step) {
        if (!Double.isFinite(step) || step <= 0) {
            throw new IllegalArgumentException(String.format("Linear step must be positive and finite; step=%s", step));
        }
        _step = step;
    }

    private final double _step;
}
