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

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Tests for the {@link Distribution} class and the merge performed by
 * {@link BaseBucketizer#bucketize(Distribution, double, double)}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class DistributionTest {

    @Test
    public void empty() {
        final Distribution distribution = new Distribution();
        Assert.assertEquals(0, distribution.size());
        Assert.assertEquals(ImmutableList.of(), distribution.getEntries());
    }

    @Test
    public void orderIndependent() {
        final List<Double> values = new ArrayList<>();
        for (int i = 0; i < 500; ++i) {
            values.add((double) RANDOM.nextInt(100000));
            values.add(RANDOM.nextDouble() * 1000);
        }
        for (final Bucketizer bucketizer : BUCKETIZERS) {
            final Distribution expected = new Distribution();
            for (final Double value : values) {
                bucketizer.bucketize(expected, value, 1);
            }
            final List<Double> shuffled = new ArrayList<>(values);
            Collections.shuffle(shuffled, RANDOM);
            final Distribution actual = new Distribution();
            for (final Double value : shuffled) {
                bucketizer.bucketize(actual, value, 1);
            }
            Assert.assertEquals(bucketizer.toString(), expected, actual);
        }
    }

    @Test
    public void strictlyAscending() {
        for (final Bucketizer bucketizer : BUCKETIZERS) {
            final Distribution distribution = new Distribution();
            for (int i = 0; i < 300; ++i) {
                bucketizer.bucketize(distribution, RANDOM.nextInt(50000), 1);
            }
            double total = 0;
            for (int i = 0; i < distribution.size(); ++i) {
                if (i > 0) {
                    Assert.assertTrue(distribution.getOrdinal(i - 1) < distribution.getOrdinal(i));
                }
                Assert.assertTrue(distribution.getCount(i) > 0);
                total += distribution.getCount(i);
            }
            Assert.assertEquals(300d, total, 0d);
        }
    }

    @Test
    public void fractionalCardinality() {
        final Distribution distribution = new Distribution();
        BY_TEN.bucketize(distribution, 5, 0.25);
        BY_TEN.bucketize(distribution, 7, 0.5);
        Assert.assertEquals(ImmutableList.of(new Distribution.Entry(0, 0.75)), distribution.getEntries());
    }

    @Test
    public void insertBetween() {
        final Distribution distribution = new Distribution();
        BY_TEN.bucketize(distribution, 5, 1);
        BY_TEN.bucketize(distribution, 95, 1);
        BY_TEN.bucketize(distribution, 45, 1);
        BY_TEN.bucketize(distribution, 1000, 1);
        Assert.assertEquals(
                ImmutableList.of(
                        new Distribution.Entry(0, 1),
                        new Distribution.Entry(4, 1),
                        new Distribution.Entry(9, 1),
                        new Distribution.Entry(100, 1)),
                distribution.getEntries());
    }

    @Test
    public void entryToString() {
        Assert.assertEquals("[3, 2.0]", new Distribution.Entry(3, 2).toString());
    }

    private static final Random RANDOM = new Random(20170601L);
    private static final Bucketizer BY_TEN = BucketizerFactory.createLinear(10);
    private static final ImmutableList<Bucketizer> BUCKETIZERS = ImmutableList.of(
            BY_TEN,
            BucketizerFactory.createLinear(7),
            BucketizerFactory.createLinear(0.1),
            BucketizerFactory.createLogLinear(10, 20),
            BucketizerFactory.createLogLinear(10, 40),
            BucketizerFactory.createLogLinear(2, 4),
            BucketizerFactory.createPowerOfTwo());
}
