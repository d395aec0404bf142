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

import com.arpnetworking.breakdown.bucketizers.Bucketizer;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One decomposition field: its dotted path and, for quantized fields, the
 * {@link Bucketizer} grouping its values.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class Dimension {

    /**
     * Resolve a decomposition list against a bucketizer map. A field is
     * quantized if and only if it has an entry in the map.
     *
     * @param decompositions The field names in decomposition order.
     * @param bucketizers The bucketizers by field name.
     * @return The dimensions in decomposition order.
     */
    public static ImmutableList<Dimension> resolve(
            final List<String> decompositions,
            final Map<String, Bucketizer> bucketizers) {
        final ImmutableList.Builder<Dimension> dimensions = ImmutableList.builder();
        for (final String field : decompositions) {
            dimensions.add(new Dimension(field, Optional.ofNullable(bucketizers.get(field))));
        }
        return dimensions.build();
    }

    public String getField() {
        return _field;
    }

    public Optional<Bucketizer> getBucketizer() {
        return _bucketizer;
    }

    public boolean isQuantized() {
        return _bucketizer.isPresent();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Dimension other = (Dimension) object;

        return Objects.equal(_field, other._field)
                && Objects.equal(_bucketizer, other._bucketizer);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_field, _bucketizer);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Field", _field)
                .add("Bucketizer", _bucketizer)
                .toString();
    }

    Dimension(final String field, final Optional<Bucketizer> bucketizer) {
        _field = field;
        _bucketizer = bucketizer;
    }

    private final String _field;
    private final Optional<Bucketizer> _bucketizer;
}
