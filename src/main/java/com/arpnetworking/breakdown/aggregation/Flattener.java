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
import com.arpnetworking.breakdown.bucketizers.Distribution;
import com.arpnetworking.breakdown.model.BreakdownKey;
import com.arpnetworking.breakdown.model.DataPoint;
import com.arpnetworking.breakdown.model.ResultRow;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an aggregation tree into one {@link ResultRow} per leaf.
 *
 * Rows are produced depth first. At each level discrete keys are visited in
 * the order they were first seen and quantized keys in ascending ordinal
 * order, so the output is deterministic for a given arrival order and the
 * number of rows always equals the number of distinct key tuples observed.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Flattener {

    /**
     * Expand one ordinal column of flattened rows into bucket bounds.
     *
     * @param bucketizer The {@link Bucketizer} that produced the ordinals.
     * @param rows The rows to expand.
     * @param column The zero-based index of the ordinal dimension.
     * @return New rows with the column replaced by its
     * {@link com.arpnetworking.breakdown.bucketizers.BucketBounds}.
     * @throws IllegalArgumentException if a row does not hold an ordinal in the column.
     */
    public static ImmutableList<ResultRow> ordinalToBounds(
            final Bucketizer bucketizer,
            final List<ResultRow> rows,
            final int column) {
        final ImmutableList.Builder<ResultRow> expanded = ImmutableList.builderWithExpectedSize(rows.size());
        for (final ResultRow row : rows) {
            final Object ordinal = row.getDimension(column);
            if (!(ordinal instanceof Integer)) {
                throw new IllegalArgumentException(String.format(
                        "Column does not hold a bucket ordinal; column=%d, row=%s",
                        column,
                        row));
            }
            final List<Object> dimensions = new ArrayList<>(row.getDimensions());
            dimensions.set(column, bucketizer.boundsForIndex((Integer) ordinal));
            expanded.add(new ResultRow(dimensions, row.getValue()));
        }
        return expanded.build();
    }

    /**
     * Flatten a tree.
     *
     * @param tree The tree to read.
     * @param presentation How quantized dimensions appear in the rows.
     * @return The rows.
     */
    static ImmutableList<ResultRow> flatten(final AggregationTree tree, final QuantizedPresentation presentation) {
        final ImmutableList.Builder<ResultRow> rows = ImmutableList.builder();
        final ImmutableList<Dimension> dimensions = tree.getDimensions();
        walk(tree.getRoot(), 0, new Object[dimensions.size()], dimensions, presentation, rows);
        return rows.build();
    }

    /**
     * Flatten a tree into data points, one per row. Quantized fields take
     * the minimum of their bucket, which discards the bucket width but allows
     * the points to be aggregated again with a coarser bucketizer. Discrete
     * fields keep their values and absent discrete fields stay absent. Field
     * names are used verbatim as keys.
     *
     * @param tree The tree to read.
     * @return The data points.
     */
    static ImmutableList<DataPoint> toDataPoints(final AggregationTree tree) {
        final ImmutableList<Dimension> dimensions = tree.getDimensions();
        final ImmutableList.Builder<DataPoint> points = ImmutableList.builder();
        for (final ResultRow row : flatten(tree, QuantizedPresentation.ORDINAL)) {
            final Map<String, Object> fields = new LinkedHashMap<>();
            for (int i = 0; i < dimensions.size(); ++i) {
                final Dimension dimension = dimensions.get(i);
                final Object dimensionValue = row.getDimension(i);
                if (dimension.isQuantized()) {
                    fields.put(dimension.getField(), dimension.getBucketizer().get().minForIndex((Integer) dimensionValue));
                } else if (dimensionValue != null) {
                    fields.put(dimension.getField(), dimensionValue);
                }
            }
            points.add(new DataPoint.Builder()
                    .setFields(ImmutableMap.copyOf(fields))
                    .setValue(row.getValue())
                    .build());
        }
        return points.build();
    }

    private static void walk(
            final AggregationTree.Node node,
            final int level,
            final Object[] path,
            final ImmutableList<Dimension> dimensions,
            final QuantizedPresentation presentation,
            final ImmutableList.Builder<ResultRow> rows) {
        if (node instanceof AggregationTree.LeafNode) {
            rows.add(new ResultRow(Arrays.asList(path), ((AggregationTree.LeafNode) node).getSum()));
        } else if (node instanceof AggregationTree.DistributionNode) {
            final Distribution distribution = ((AggregationTree.DistributionNode) node).getDistribution();
            for (int i = 0; i < distribution.size(); ++i) {
                path[level] = presentOrdinal(dimensions.get(level), distribution.getOrdinal(i), presentation);
                rows.add(new ResultRow(Arrays.asList(path), distribution.getCount(i)));
            }
        } else {
            final Dimension dimension = dimensions.get(level);
            for (final Map.Entry<BreakdownKey, AggregationTree.Node> child
                    : ((AggregationTree.BranchNode) node).getChildren().entrySet()) {
                final BreakdownKey key = child.getKey();
                if (key.isOrdinal()) {
                    path[level] = presentOrdinal(dimension, key.getOrdinal(), presentation);
                } else {
                    path[level] = key.getValue();
                }
                walk(child.getValue(), level + 1, path, dimensions, presentation, rows);
            }
        }
    }

    private static Object presentOrdinal(
            final Dimension dimension,
            final int ordinal,
            final QuantizedPresentation presentation) {
        if (presentation == QuantizedPresentation.BOUNDS) {
            return dimension.getBucketizer().get().boundsForIndex(ordinal);
        }
        return ordinal;
    }

    private Flattener() {}
}
