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
package com.arpnetworking.breakdown.model;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;

/**
 * Snapshot of an aggregator's counters.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class AggregatorStats {

    /**
     * Public constructor.
     *
     * @param inputs The number of data points seen.
     * @param parsed The number of numeric parses attempted on string values.
     * @param nonNumericErrors The number of data points rejected for a non-numeric quantized field.
     */
    public AggregatorStats(final long inputs, final long parsed, final long nonNumericErrors) {
        _inputs = inputs;
        _parsed = parsed;
        _nonNumericErrors = nonNumericErrors;
    }

    public long getInputs() {
        return _inputs;
    }

    public long getParsed() {
        return _parsed;
    }

    public long getNonNumericErrors() {
        return _nonNumericErrors;
    }

    /**
     * The counters keyed by their reporting names: {@code ninputs},
     * {@code nparsed} and {@code nerr_nonnumeric}.
     *
     * @return The counters by name.
     */
    public ImmutableMap<String, Long> toMap() {
        return ImmutableMap.of(
                "ninputs", _inputs,
                "nparsed", _parsed,
                "nerr_nonnumeric", _nonNumericErrors);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final AggregatorStats other = (AggregatorStats) object;

        return _inputs == other._inputs
                && _parsed == other._parsed
                && _nonNumericErrors == other._nonNumericErrors;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_inputs, _parsed, _nonNumericErrors);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Inputs", _inputs)
                .add("Parsed", _parsed)
                .add("NonNumericErrors", _nonNumericErrors)
                .toString();
    }

    private final long _inputs;
    private final long _parsed;
    private final long _nonNumericErrors;
}
