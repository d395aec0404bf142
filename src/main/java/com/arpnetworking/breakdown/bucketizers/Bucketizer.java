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

/**
 * Interface for a quantization strategy. A bucketizer partitions the
 * non-negative reals into contiguous buckets {@code [min(i), min(i + 1))}
 * identified by their ordinal {@code i}. The partition is strictly monotonic
 * and {@code min(0)} is always zero.
 *
 * Instances are immutable once constructed. Use {@link BucketizerFactory}
 * for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface Bucketizer {

    /**
     * Accessor for the type of this bucketizer.
     *
     * @return The {@link BucketizerType}.
     */
    BucketizerType getType();

    /**
     * Compute the ordinal of the bucket containing a value.
     *
     * @param value The non-negative finite value to quantize.
     * @return The ordinal of the bucket containing {@code value}.
     * @throws IllegalArgumentException if the value is negative, not finite
     * or lies beyond the bucket with ordinal {@link #MAX_ORDINAL}.
     */
    int indexForValue(double value);

    /**
     * Whether {@link #indexForValue(double)} accepts a value.
     *
     * @param value The value to check.
     * @return True if the value is finite, non-negative and its bucket ordinal
     * is at most {@link #MAX_ORDINAL}.
     */
    boolean canIndex(double value);

    /**
     * Compute the minimum value contained in a bucket.
     *
     * @param ordinal The non-negative bucket ordinal.
     * @return The minimum value contained in the bucket.
     * @throws IllegalArgumentException if the ordinal is negative.
     */
    double minForIndex(int ordinal);

    /**
     * Compute an approximate maximum value for a bucket. This is derived from
     * the next bucket's minimum and is intended for display only; bucket
     * membership is always decided by {@link #minForIndex(int)}.
     *
     * Where the bucket is at least one unit wide the maximum is one less than
     * the next bucket's minimum. Narrower buckets report the next minimum less
     * one tenth of the bucket width.
     *
     * @param ordinal The non-negative bucket ordinal.
     * @return The approximate maximum value of the bucket.
     */
    double maxForIndex(int ordinal);

    /**
     * Compute the display bounds of a bucket.
     *
     * @param ordinal The non-negative bucket ordinal.
     * @return The {@link BucketBounds} of the bucket.
     */
    BucketBounds boundsForIndex(int ordinal);

    /**
     * Add {@code cardinality} observations of {@code value} to a
     * {@link Distribution}. The distribution is updated in place and remains
     * sorted by ordinal and free of duplicate ordinals.
     *
     * @param distribution The {@link Distribution} to update.
     * @param value The non-negative finite value observed.
     * @param cardinality The number of observations to add.
     * @throws IllegalArgumentException if {@link #canIndex(double)} is false
     * for the value.
     */
    void bucketize(Distribution distribution, double value, double cardinality);

    /**
     * The largest ordinal assigned to a value. One less than
     * {@code Integer.MAX_VALUE} so the following bucket's minimum remains
     * addressable.
     */
    int MAX_ORDINAL = Integer.MAX_VALUE - 1;
}
