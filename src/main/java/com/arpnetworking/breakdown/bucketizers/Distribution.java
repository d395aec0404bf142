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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A sparse histogram: an ascending, duplicate-free list of
 * {@code (ordinal, count)} pairs. Only ordinals that received at least one
 * observation are present, so the size is bounded by the number of distinct
 * buckets touched rather than by the number of observations.
 *
 * Instances are mutated only through {@link Bucketizer#bucketize(Distribution, double, double)}.
 * This class is not thread safe.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Distribution {

    /**
     * Public constructor for an empty distribution.
     */
    public Distribution() {}

    public int size() {
        return _ordinals.size();
    }

    /**
     * Accessor for the ordinal at a position.
     *
     * @param position The zero-based position in ascending ordinal order.
     * @return The bucket ordinal.
     */
    public int getOrdinal(final int position) {
        return _ordinals.getInt(position);
    }

    /**
     * Accessor for the count at a position.
     *
     * @param position The zero-based position in ascending ordinal order.
     * @return The accumulated count of the bucket.
     */
    public double getCount(final int position) {
        return _counts.getDouble(position);
    }

    /**
     * Snapshot the entries in ascending ordinal order.
     *
     * @return The entries.
     */
    public ImmutableList<Entry> getEntries() {
        final ImmutableList.Builder<Entry> entries = ImmutableList.builderWithExpectedSize(size());
        for (int i = 0; i < size(); ++i) {
            entries.add(new Entry(_ordinals.getInt(i), _counts.getDouble(i)));
        }
        return entries.build();
    }

    void increment(final int position, final double cardinality) {
        _counts.set(position, _counts.getDouble(position) + cardinality);
    }

    void insert(final int position, final int ordinal, final double cardinality) {
        _ordinals.add(position, ordinal);
        _counts.add(position, cardinality);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Distribution)) {
            return false;
        }
        final Distribution otherDistribution = (Distribution) other;
        return _ordinals.equals(otherDistribution._ordinals)
                && _counts.equals(otherDistribution._counts);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_ordinals, _counts);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Entries", getEntries())
                .toString();
    }

    private final IntArrayList _ordinals = new IntArrayList();
    private final DoubleArrayList _counts = new DoubleArrayList();

    /**
     * A single {@code (ordinal, count)} pair of a {@link Distribution}.
     */
    public static final class Entry {

        /**
         * Public constructor.
         *
         * @param ordinal The bucket ordinal.
         * @param count The accumulated count.
         */
        public Entry(final int ordinal, final double count) {
            _ordinal = ordinal;
            _count = count;
        }

        public int getOrdinal() {
            return _ordinal;
        }

        public double getCount() {
            return _count;
        }

        @Override
        public boolean equals(final Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Entry)) {
                return false;
            }
            final Entry otherEntry = (Entry) other;
            return _ordinal == otherEntry._ordinal
                    && Double.compare(_count, otherEntry._count) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(_ordinal, _count);
        }

        @Override
        public String toString() {
            return "[" + _ordinal + ", " + _count + "]";
        }

        private final int _ordinal;
        private final double _count;
    }
}
