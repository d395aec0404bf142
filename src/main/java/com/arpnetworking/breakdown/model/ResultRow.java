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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One row of a flattened aggregation: a value per decomposition field, in
 * decomposition order, followed by the aggregated sum.
 *
 * Discrete dimensions hold the field's normalized value, or null where the
 * field was absent. Quantized dimensions hold an {@link Integer} ordinal or a
 * {@link com.arpnetworking.breakdown.bucketizers.BucketBounds}, depending on
 * the presentation selected when flattening.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class ResultRow {

    /**
     * Create a row.
     *
     * @param value The aggregated sum.
     * @param dimensions The dimension values in decomposition order.
     * @return A new {@link ResultRow}.
     */
    public static ResultRow of(final double value, final Object... dimensions) {
        return new ResultRow(Arrays.asList(dimensions), value);
    }

    /**
     * Public constructor.
     *
     * @param dimensions The dimension values in decomposition order.
     * @param value The aggregated sum.
     */
    public ResultRow(final List<?> dimensions, final double value) {
        _dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        _value = value;
    }

    /**
     * Accessor for the dimension values. Elements may be null.
     *
     * @return The unmodifiable dimension values in decomposition order.
     */
    public List<Object> getDimensions() {
        return _dimensions;
    }

    /**
     * Accessor for a single dimension value.
     *
     * @param index The zero-based decomposition index.
     * @return The dimension value.
     */
    @Nullable
    public Object getDimension(final int index) {
        return _dimensions.get(index);
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ResultRow other = (ResultRow) object;

        return Double.compare(_value, other._value) == 0
                && Objects.equal(_dimensions, other._dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_dimensions, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Dimensions", _dimensions)
                .add("Value", _value)
                .toString();
    }

    private final List<Object> _dimensions;
    private final double _value;
}
