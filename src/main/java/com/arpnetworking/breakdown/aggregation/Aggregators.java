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
import com.arpnetworking.breakdown.model.DataPoint;
import com.arpnetworking.breakdown.model.ResultRow;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Batch aggregation of a fixed collection of data points.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Aggregators {

    /**
     * Sum all data points into a single row.
     *
     * @param dataPoints The data points.
     * @return A single row holding the total.
     */
    public static ImmutableList<ResultRow> aggregate(final Iterable<DataPoint> dataPoints) {
        return aggregate(dataPoints, ImmutableList.of(), ImmutableMap.of());
    }

    /**
     * Sum data points broken out by discrete fields.
     *
     * @param dataPoints The data points.
     * @param decompositions The decomposition fields in nesting order.
     * @return The flattened rows.
     */
    public static ImmutableList<ResultRow> aggregate(
            final Iterable<DataPoint> dataPoints,
            final List<String> decompositions) {
        return aggregate(dataPoints, decompositions, ImmutableMap.of());
    }

    /**
     * Sum data points broken out by fields. Equivalent to building an
     * {@link Aggregator}, passing every data point to it, flushing it and
     * reading its result.
     *
     * @param dataPoints The data points.
     * @param decompositions The decomposition fields in nesting order.
     * @param bucketizers The bucketizers of the quantized fields.
     * @return The flattened rows, with quantized dimensions as ordinals.
     */
    public static ImmutableList<ResultRow> aggregate(
            final Iterable<DataPoint> dataPoints,
            final List<String> decompositions,
            final Map<String, Bucketizer> bucketizers) {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.copyOf(decompositions))
                .setBucketizers(ImmutableMap.copyOf(bucketizers))
                .build();
        for (final DataPoint dataPoint : dataPoints) {
            aggregator.accept(dataPoint);
        }
        aggregator.flush();
        return aggregator.result();
    }

    private Aggregators() {}
}
