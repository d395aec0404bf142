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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Nested accumulator for the cross product of decomposition fields. Level
 * {@code i} of the tree is keyed by the value of decomposition field
 * {@code i}; leaves hold running sums. Nodes are created on first use and
 * never removed.
 *
 * Discrete levels keep their keys in first-seen order. Quantized levels keep
 * their keys in ascending ordinal order, and a quantized last level is held
 * as a sparse {@link Distribution}.
 *
 * This class is not thread safe.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
final class AggregationTree {

    AggregationTree(final ImmutableList<Dimension> dimensions) {
        _dimensions = dimensions;
        _root = createNode(0);
    }

    /**
     * Add a value along the path described by one resolved value per level.
     * Discrete levels take the extracted field value (possibly null);
     * quantized levels take the field value as a non-negative finite
     * {@link Double}.
     *
     * @param levelValues The resolved values in decomposition order.
     * @param value The value to add.
     */
    void add(final List<?> levelValues, final double value) {
        Preconditions.checkArgument(
                levelValues.size() == _dimensions.size(),
                "Expected one value per dimension; expected=%s, actual=%s",
                _dimensions.size(),
                levelValues.size());
        Node node = _root;
        for (int level = 0; level < _dimensions.size(); ++level) {
            final Dimension dimension = _dimensions.get(level);
            final Object levelValue = levelValues.get(level);
            if (node instanceof DistributionNode) {
                final Bucketizer bucketizer = dimension.getBucketizer().get();
                bucketizer.bucketize(((DistributionNode) node).getDistribution(), (Double) levelValue, value);
                return;
            }

            final BreakdownKey key;
            if (dimension.isQuantized()) {
                key = BreakdownKey.ordinal(dimension.getBucketizer().get().indexForValue((Double) levelValue));
            } else {
                key = BreakdownKey.discrete(levelValue);
            }
            final int childLevel = level + 1;
            node = ((BranchNode) node).getOrCreateChild(key, () -> createNode(childLevel));
        }
        ((LeafNode) node).add(value);
    }

    ImmutableList<Dimension> getDimensions() {
        return _dimensions;
    }

    Node getRoot() {
        return _root;
    }

    private Node createNode(final int level) {
        if (level == _dimensions.size()) {
            return new LeafNode();
        }
        final Dimension dimension = _dimensions.get(level);
        if (dimension.isQuantized()) {
            if (level == _dimensions.size() - 1) {
                return new DistributionNode();
            }
            return new BranchNode(new TreeMap<>(ORDINAL_ORDER));
        }
        return new BranchNode(new LinkedHashMap<>());
    }

    private final ImmutableList<Dimension> _dimensions;
    private final Node _root;

    private static final Comparator<BreakdownKey> ORDINAL_ORDER = Comparator.comparingInt(BreakdownKey::getOrdinal);

    /**
     * A node of the tree.
     */
    abstract static class Node {}

    /**
     * A running sum at the full depth of the tree.
     */
    static final class LeafNode extends Node {

        double getSum() {
            return _sum;
        }

        void add(final double value) {
            _sum += value;
        }

        private double _sum = 0;
    }

    /**
     * An intermediate level mapping keys to child nodes.
     */
    static final class BranchNode extends Node {

        Map<BreakdownKey, Node> getChildren() {
            return Collections.unmodifiableMap(_children);
        }

        Node getOrCreateChild(final BreakdownKey key, final Supplier<Node> supplier) {
            Node child = _children.get(key);
            if (child == null) {
                child = supplier.get();
                _children.put(key, child);
            }
            return child;
        }

        BranchNode(final Map<BreakdownKey, Node> children) {
            _children = children;
        }

        private final Map<BreakdownKey, Node> _children;
    }

    /**
     * A quantized last level: bucket ordinals mapped to running sums.
     */
    static final class DistributionNode extends Node {

        Distribution getDistribution() {
            return _distribution;
        }

        private final Distribution _distribution = new Distribution();
    }
}
