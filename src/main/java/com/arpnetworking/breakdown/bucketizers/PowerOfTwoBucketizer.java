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
 * Power-of-two quantization in the style of DTrace's {@code quantize}.
 * Bucket zero spans {@code [0, 1)} and bucket {@code i >= 1} spans
 * {@code [2^(i-1), 2^i)}. Use {@link BucketizerFactory} for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class PowerOfTwoBucketizer extends BaseBucketizer {

    @Override
    public BucketizerType getType() {
        return BucketizerType.POWER_OF_TWO;
    }

    @Override
    protected long computeIndex(final double value) {
        if (value < 1) {
            return 0;
        }
        int ordinal = 1;
        double threshold = 1;
        while (threshold * 2 <= value) {
            threshold *= 2;
            ++ordinal;
        }
        return ordinal;
    }

    @Override
    protected double computeMin(final int ordinal) {
        if (ordinal == 0) {
            return 0;
        }
        return Math.scalb(1.0, ordinal - 1);
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof PowerOfTwoBucketizer;
    }

    @Override
    public int hashCode() {
        return PowerOfTwoBucketizer.class.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).toString();
    }

    PowerOfTwoBucketizer() { }
}
