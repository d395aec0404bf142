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

import com.google.common.base.Preconditions;

/**
 * Common functionality for {@link Bucketizer} implementations. Subclasses
 * supply the forward and inverse mappings; argument checking, bucket bounds
 * and the sparse distribution merge are shared.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class BaseBucketizer implements Bucketizer {

    @Override
    public final int indexForValue(final double value) {
        Preconditions.checkArgument(
                Double.isFinite(value) && value >= 0,
                "Value must be finite and non-negative; value=%s",
                value);
        final long ordinal = computeIndex(value);
        Preconditions.checkArgument(
                ordinal <= MAX_ORDINAL,
                "Value is beyond the largest bucket; value=%s",
                value);
        return (int) ordinal;
    }

    @Override
    public final boolean canIndex(final double value) {
        return Double.isFinite(value) && value >= 0 && computeIndex(value) <= MAX_ORDINAL;
    }

    @Override
    public final double minForIndex(final int ordinal) {
        Preconditions.checkArgument(ordinal >= 0, "Ordinal must be non-negative; ordinal=%s", ordinal);
        return computeMin(ordinal);
    }

    @Override
    public double maxForIndex(final int ordinal) {
        final double min = minForIndex(ordinal);
        final double nextMin = minForIndex(ordinal + 1);
        final double width = nextMin - min;
        if (width >= 1) {
            return nextMin - 1;
        }
        return nextMin - width / 10;
    }

    @Override
    public BucketBounds boundsForIndex(final int ordinal) {
        return new BucketBounds(minForIndex(ordinal), maxForIndex(ordinal));
    }

    @Override
    public void bucketize(final Distribution distribution, final double value, final double cardinality) {
        Preconditions.checkArgument(
                canIndex(value),
                "Value must be finite, non-negative and within the largest bucket; value=%s",
                value);

        // Entries are sorted by ordinal so the scan stops at the first bucket
        // starting above the value; that is also the insertion point.
        int position = 0;
        for (; position < distribution.size(); ++position) {
            final int ordinal = distribution.getOrdinal(position);
            final double min = minForIndex(ordinal);
            if (value < min) {
                break;
            }
            if (value < minForIndex(ordinal + 1)) {
                distribution.increment(position, cardinality);
                return;
            }
        }

        final int ordinal = indexForValue(value);
        if (position > 0 && distribution.getOrdinal(position - 1) == ordinal) {
            distribution.increment(position - 1, cardinality);
        } else if (position < distribution.size() && distribution.getOrdinal(position) == ordinal) {
            distribution.increment(position, cardinality);
        } else {
            distribution.insert(position, ordinal, cardinality);
        }
    }

    /**
     * Compute the ordinal of the bucket containing a validated value. The
     * result may exceed {@link #MAX_ORDINAL}; callers range check it.
     *
     * @param value The non-negative finite value.
     * @return The bucket ordinal.
     */
    protected abstract long computeIndex(double value);

    /**
     * Compute the minimum value of a validated bucket ordinal.
     *
     * @param ordinal The non-negative ordinal.
     * @return The bucket minimum.
     */
    protected abstract double computeMin(int ordinal);
}
