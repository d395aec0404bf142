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
package com.arpnetworking.breakdown.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.google.common.base.Enums;

import java.util.Locale;

/**
 * How quantized dimensions appear in flattened rows.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum QuantizedPresentation {

    /**
     * The bucket ordinal as an {@link Integer}.
     */
    ORDINAL,

    /**
     * The bucket's {@link com.arpnetworking.breakdown.bucketizers.BucketBounds}.
     */
    BOUNDS;

    /**
     * Look up a presentation by name, ignoring case.
     *
     * @param name The presentation name.
     * @return The matching {@link QuantizedPresentation}.
     * @throws IllegalArgumentException if no presentation matches.
     */
    @JsonCreator
    public static QuantizedPresentation fromName(final String name) {
        return Enums.getIfPresent(QuantizedPresentation.class, name.toUpperCase(Locale.ROOT)).toJavaUtil()
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Unknown quantized presentation; name=%s, expected one of ORDINAL or BOUNDS",
                        name)));
    }
}
