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
 * Log-linear quantization in the style of DTrace's {@code llquantize}.
 *
 * Magnitude zero spans {@code [0, base)} and magnitude {@code k >= 1} spans
 * {@code [base^k, base^(k+1))}. Each magnitude is divided linearly into
 * {@code min(base^(k+1), nbuckets)} sub-buckets of which the first
 * {@code 1/base} fraction lie below {@code base^k}. Those are already covered
 * at finer resolution by the previous magnitude and are not assigned
 * ordinals. For example, with base 10 and 20 buckets magnitude zero has ten
 * buckets of width one and every later magnitude has 18 unique buckets.
 *
 * Use {@link BucketizerFactory} for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class LogLinearBucketizer extends BaseBucketizer {

    public int getBase() {
        return _base;
    }

    public int getBucketsPerMagnitude() {
        return _nbuckets;
    }

    @Override
    public BucketizerType getType() {
        return BucketizerType.LOG_LINEAR;
    }

    @Override
    protected long computeIndex(final double value) {
        long first = 0;
        double minOrder = 0;
        double maxOrder = _base;
        double unique = uniqueBuckets(orderBuckets(maxOrder), true);
        while (value >= maxOrder) {
            first += (long) unique;
            minOrder = maxOrder;
            maxOrder *= _base;
            unique = uniqueBuckets(orderBuckets(maxOrder), false);
        }
        final double width = maxOrder / orderBuckets(maxOrder);
        final long last = (long) unique - 1;
        long offset = Math.max(0, Math.min((long) Math.floor((value - minOrder) / width), last));
        // The quotient can round across a boundary; the bucket minimum decides.
        while (offset > 0 && value < bucketMin(minOrder, width, offset)) {
            --offset;
        }
        while (offset < last && value >= bucketMin(minOrder, width, offset + 1)) {
            ++offset;
        }
        return first + offset;
    }

    @Override
    protected double computeMin(final int ordinal) {
        long first = 0;
        double minOrder = 0;
        double maxOrder = _base;
        double unique = uniqueBuckets(orderBuckets(maxOrder), true);
        while (ordinal >= first + unique && Double.isFinite(maxOrder)) {
            first += (long) unique;
            minOrder = maxOrder;
            maxOrder *= _base;
            unique = uniqueBuckets(orderBuckets(maxOrder), false);
        }
        return bucketMin(minOrder, maxOrder / orderBuckets(maxOrder), ordinal - first);
    }

    private double orderBuckets(final double maxOrder) {
        return Math.min(maxOrder, _nbuckets);
    }

    private double uniqueBuckets(final double orderBuckets, final boolean firstMagnitude) {
        if (firstMagnitude) {
            return orderBuckets;
        }
        return orderBuckets - orderBuckets / _base;
    }

    private static double bucketMin(final double minOrder, final double width, final long offset) {
        // Zero offset is the magnitude start even when the width overflowed.
        if (offset == 0) {
            return minOrder;
        }
        return minOrder + offset * width;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LogLinearBucketizer)) {
            return false;
        }
        final LogLinearBucketizer otherBucketizer = (LogLinearBucketizer) other;
        return _base == otherBucketizer._base
                && _nbuckets == otherBucketizer._nbuckets;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_base, _nbuckets);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Base", _base)
                .add("Buckets", _nbuckets)
                .toString();
    }

    LogLinearBucketizer(final int base, final int nbuckets) {
        if (base < 2) {
            throw new IllegalArgumentException(String.format("Log-linear base must be at least 2; base=%d", base));
        }
        if (nbuckets <= 0 || nbuckets % base != 0) {
            throw new IllegalArgumentException(String.format(
                    "Log-linear bucket count must be a positive multiple of the base; base=%d, nbuckets=%d",
                    base,
                    nbuckets));
        }
        long power = base;
        while (power % nbuckets != 0) {
            if (power > Long.MAX_VALUE / base) {
                throw new IllegalArgumentException(String.format(
                        "Log-linear bucket count must evenly divide a power of the base; base=%d, nbuckets=%d",
                        base,
                        nbuckets));
            }
            power *= base;
        }
        _base = base;
        _nbuckets = nbuckets;
    }

    private final int _base;
    private final int _nbuckets;
}
