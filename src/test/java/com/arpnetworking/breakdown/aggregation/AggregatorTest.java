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

import com.arpnetworking.breakdown.bucketizers.BucketBounds;
import com.arpnetworking.breakdown.bucketizers.Bucketizer;
import com.arpnetworking.breakdown.bucketizers.BucketizerFactory;
import com.arpnetworking.breakdown.model.AggregatorStats;
import com.arpnetworking.breakdown.model.DataPoint;
import com.arpnetworking.breakdown.model.ResultRow;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Tests for the {@link Aggregator} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class AggregatorTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void scalarTotal() {
        final Aggregator aggregator = createAggregator(ImmutableList.of(), ImmutableMap.of());
        TestBeanFactory.createCityPopulations().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(ImmutableList.of(ResultRow.of(2137000)), aggregator.result());
    }

    @Test
    public void scalarTotalWithoutInput() {
        final Aggregator aggregator = createAggregator(ImmutableList.of(), ImmutableMap.of());
        aggregator.flush();
        Assert.assertEquals(ImmutableList.of(ResultRow.of(0)), aggregator.result());
    }

    @Test
    public void noRowsWithoutInput() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state"), ImmutableMap.of());
        aggregator.flush();
        Assert.assertTrue(aggregator.result().isEmpty());
    }

    @Test
    public void byState() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state"), ImmutableMap.of());
        TestBeanFactory.createCityPopulations().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(972000, "MA"),
                        ResultRow.of(505000, "CA"),
                        ResultRow.of(660000, "OR")),
                aggregator.result());
    }

    @Test
    public void byCity() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("city"), ImmutableMap.of());
        TestBeanFactory.createCityPopulations().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(213000, "Springfield"),
                        ResultRow.of(636000, "Boston"),
                        ResultRow.of(183000, "Worcestor"),
                        ResultRow.of(505000, "Fresno"),
                        ResultRow.of(600000, "Portland")),
                aggregator.result());
    }

    @Test
    public void byStateAndCity() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state", "city"), ImmutableMap.of());
        TestBeanFactory.createCityPopulations().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(153000, "MA", "Springfield"),
                        ResultRow.of(636000, "MA", "Boston"),
                        ResultRow.of(183000, "MA", "Worcestor"),
                        ResultRow.of(505000, "CA", "Fresno"),
                        ResultRow.of(60000, "OR", "Springfield"),
                        ResultRow.of(600000, "OR", "Portland")),
                aggregator.result());
    }

    @Test
    public void byNestedField() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("data.state"), ImmutableMap.of());
        for (final DataPoint dataPoint : TestBeanFactory.createCityPopulations()) {
            aggregator.accept(TestBeanFactory.createDataPoint(
                    dataPoint.getValue(),
                    "data",
                    ImmutableMap.of("state", dataPoint.getFields().get("state"))));
        }
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(972000, "MA"),
                        ResultRow.of(505000, "CA"),
                        ResultRow.of(660000, "OR")),
                aggregator.result());
    }

    @Test
    public void absentDiscreteField() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state"), ImmutableMap.of());
        aggregator.accept(TestBeanFactory.createDataPoint(1, "state", "MA"));
        aggregator.accept(TestBeanFactory.createDataPoint(2));
        aggregator.accept(TestBeanFactory.createDataPoint(4));
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(ResultRow.of(1, "MA"), ResultRow.of(6, (Object) null)),
                aggregator.result());
    }

    @Test
    public void discreteNumbersGroupByValue() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("port"), ImmutableMap.of());
        aggregator.accept(TestBeanFactory.createDataPoint(1, "port", 80));
        aggregator.accept(TestBeanFactory.createDataPoint(1, "port", 80.0));
        aggregator.accept(TestBeanFactory.createDataPoint(1, "port", "80"));
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(ResultRow.of(2, 80L), ResultRow.of(1, "80")),
                aggregator.result());
    }

    @Test
    public void bucketized() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("util"), ImmutableMap.of("util", BY_TEN));
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(2, 0),
                        ResultRow.of(1, 1),
                        ResultRow.of(1, 3),
                        ResultRow.of(1, 5),
                        ResultRow.of(2, 8),
                        ResultRow.of(1, 9)),
                aggregator.result());
    }

    @Test
    public void bucketizedAsBounds() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("util"))
                .setBucketizers(ImmutableMap.of("util", BY_TEN))
                .setQuantizedPresentation(QuantizedPresentation.BOUNDS)
                .build();
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        final ImmutableList<ResultRow> expected = ImmutableList.of(
                ResultRow.of(2, new BucketBounds(0, 9)),
                ResultRow.of(1, new BucketBounds(10, 19)),
                ResultRow.of(1, new BucketBounds(30, 39)),
                ResultRow.of(1, new BucketBounds(50, 59)),
                ResultRow.of(2, new BucketBounds(80, 89)),
                ResultRow.of(1, new BucketBounds(90, 99)));
        Assert.assertEquals(expected, aggregator.result());
        Assert.assertEquals(
                expected,
                Flattener.ordinalToBounds(BY_TEN, aggregator.result(QuantizedPresentation.ORDINAL), 0));
    }

    @Test
    public void discreteThenBucketized() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("host", "util"), ImmutableMap.of("util", BY_TEN));
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(1, "host1", 1),
                        ResultRow.of(1, "host1", 8),
                        ResultRow.of(1, "host2", 3),
                        ResultRow.of(1, "host2", 5),
                        ResultRow.of(1, "host3", 0),
                        ResultRow.of(1, "host3", 8),
                        ResultRow.of(1, "host4", 0),
                        ResultRow.of(1, "host4", 9)),
                aggregator.result());
    }

    @Test
    public void otherDiscreteThenBucketized() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("cpu", "util"), ImmutableMap.of("util", BY_TEN));
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(1, "cpu0", 3),
                        ResultRow.of(2, "cpu0", 8),
                        ResultRow.of(1, "cpu0", 9),
                        ResultRow.of(2, "cpu1", 0),
                        ResultRow.of(1, "cpu1", 1),
                        ResultRow.of(1, "cpu1", 5)),
                aggregator.result());
    }

    @Test
    public void bucketizedThenDiscrete() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("util", "cpu"), ImmutableMap.of("util", BY_TEN));
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(
                ImmutableList.of(
                        ResultRow.of(2, 0, "cpu1"),
                        ResultRow.of(1, 1, "cpu1"),
                        ResultRow.of(1, 3, "cpu0"),
                        ResultRow.of(1, 5, "cpu1"),
                        ResultRow.of(2, 8, "cpu0"),
                        ResultRow.of(1, 9, "cpu0")),
                aggregator.result());
    }

    @Test(expected = IllegalArgumentException.class)
    public void requireQuantizedLast() {
        new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("util", "cpu"))
                .setBucketizers(ImmutableMap.of("util", BY_TEN))
                .setRequireQuantizedLast(true)
                .build();
    }

    @Test
    public void requireQuantizedLastAccepted() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("cpu", "util"))
                .setBucketizers(ImmutableMap.of("util", BY_TEN))
                .setRequireQuantizedLast(true)
                .build();
        TestBeanFactory.createCpuUtilization().forEach(aggregator::accept);
        aggregator.flush();
        Assert.assertEquals(6, aggregator.result().size());
    }

    @Test
    public void nonNumericValue() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("pop"))
                .setBucketizers(ImmutableMap.of("pop", BucketizerFactory.createLinear(100000)))
                .setInvalidRecordListener(_listener)
                .build();
        final DataPoint bogus = TestBeanFactory.createDataPoint(1, "city", "Springfield", "pop", "bogus!");
        aggregator.accept(TestBeanFactory.createDataPoint(1, "city", "Boston", "pop", 636000));
        aggregator.accept(bogus);
        aggregator.accept(TestBeanFactory.createDataPoint(1, "city", "Springfield", "pop", 153000));
        aggregator.flush();

        Assert.assertEquals(ImmutableList.of(ResultRow.of(1, 1), ResultRow.of(1, 6)), aggregator.result());
        Assert.assertEquals(new AggregatorStats(3, 1, 1), aggregator.getStats());

        final ArgumentCaptor<InvalidFieldValueException> captor = ArgumentCaptor.forClass(InvalidFieldValueException.class);
        Mockito.verify(_listener).onInvalidRecord(Mockito.eq(bogus), captor.capture(), Mockito.eq(2L));
        Mockito.verifyNoMoreInteractions(_listener);
        Assert.assertEquals("value for field \"pop\" is not a number", captor.getValue().getMessage());
        Assert.assertEquals("pop", captor.getValue().getField());
        Assert.assertEquals(InvalidFieldValueException.Reason.NON_NUMERIC, captor.getValue().getReason());
    }

    @Test
    public void numericStringsAreParsed() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("latency"))
                .setBucketizers(ImmutableMap.of("latency", BY_TEN))
                .setInvalidRecordListener(_listener)
                .build();
        aggregator.accept(TestBeanFactory.createDataPoint(1, "latency", " 15 "));
        aggregator.accept(TestBeanFactory.createDataPoint(1, "latency", "12.5"));
        aggregator.flush();
        Assert.assertEquals(ImmutableList.of(ResultRow.of(2, 1)), aggregator.result());
        Assert.assertEquals(new AggregatorStats(2, 2, 0), aggregator.getStats());
        Mockito.verifyNoInteractions(_listener);
    }

    @Test
    public void absentQuantizedField() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("latency"))
                .setBucketizers(ImmutableMap.of("latency", BY_TEN))
                .setInvalidRecordListener(_listener)
                .build();
        final DataPoint missing = TestBeanFactory.createDataPoint(1, "host", "host1");
        aggregator.accept(missing);
        aggregator.flush();
        Assert.assertTrue(aggregator.result().isEmpty());
        Assert.assertEquals(new AggregatorStats(1, 0, 1), aggregator.getStats());
        Mockito.verify(_listener).onInvalidRecord(
                Mockito.eq(missing),
                Mockito.any(InvalidFieldValueException.class),
                Mockito.eq(1L));
    }

    @Test
    public void negativeQuantizedValue() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("latency"))
                .setBucketizers(ImmutableMap.of("latency", BY_TEN))
                .setInvalidRecordListener(_listener)
                .build();
        final DataPoint negative = TestBeanFactory.createDataPoint(1, "latency", -5);
        aggregator.accept(negative);
        aggregator.flush();
        Assert.assertTrue(aggregator.result().isEmpty());
        Assert.assertEquals(new AggregatorStats(1, 0, 0), aggregator.getStats());

        final ArgumentCaptor<InvalidFieldValueException> captor = ArgumentCaptor.forClass(InvalidFieldValueException.class);
        Mockito.verify(_listener).onInvalidRecord(Mockito.eq(negative), captor.capture(), Mockito.eq(1L));
        Assert.assertEquals(InvalidFieldValueException.Reason.NEGATIVE, captor.getValue().getReason());
        Assert.assertEquals("value for field \"latency\" is negative", captor.getValue().getMessage());
    }

    @Test
    public void quantizedValueBeyondLargestBucket() {
        final Aggregator aggregator = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("bytes"))
                .setBucketizers(ImmutableMap.of("bytes", BucketizerFactory.createLinear(1)))
                .setInvalidRecordListener(_listener)
                .build();
        final DataPoint threeBillion = TestBeanFactory.createDataPoint(1, "bytes", 3e9);
        final DataPoint fiveBillion = TestBeanFactory.createDataPoint(1, "bytes", 5e9);
        aggregator.accept(TestBeanFactory.createDataPoint(1, "bytes", 7));
        aggregator.accept(threeBillion);
        aggregator.accept(fiveBillion);
        aggregator.accept(TestBeanFactory.createDataPoint(2, "bytes", 2e9));
        aggregator.flush();

        Assert.assertEquals(
                ImmutableList.of(ResultRow.of(1, 7), ResultRow.of(2, 2000000000)),
                aggregator.result());
        Assert.assertEquals(new AggregatorStats(4, 0, 0), aggregator.getStats());

        final ArgumentCaptor<InvalidFieldValueException> captor = ArgumentCaptor.forClass(InvalidFieldValueException.class);
        Mockito.verify(_listener).onInvalidRecord(Mockito.eq(threeBillion), captor.capture(), Mockito.eq(2L));
        Mockito.verify(_listener).onInvalidRecord(Mockito.eq(fiveBillion), captor.capture(), Mockito.eq(3L));
        Mockito.verifyNoMoreInteractions(_listener);
        for (final InvalidFieldValueException error : captor.getAllValues()) {
            Assert.assertEquals(InvalidFieldValueException.Reason.OUT_OF_RANGE, error.getReason());
            Assert.assertEquals("value for field \"bytes\" is beyond the largest bucket", error.getMessage());
        }
    }

    @Test
    public void drainPointsReaggregate() {
        final Aggregator fine = new Aggregator.Builder()
                .setDecompositions(ImmutableList.of("host", "util"))
                .setBucketizers(ImmutableMap.of("util", BY_TEN))
                .setResultsAsPoints(true)
                .build();
        TestBeanFactory.createCpuUtilization().forEach(fine::accept);
        fine.flush();
        final ImmutableList<DataPoint> points = fine.drainPoints();
        Assert.assertEquals(8, points.size());
        Assert.assertEquals("host1", points.get(0).getFields().get("host"));
        Assert.assertEquals(10d, points.get(0).getFields().get("util"));
        Assert.assertEquals(points, fine.drainPoints());

        final Aggregator coarse = createAggregator(
                ImmutableList.of("util"),
                ImmutableMap.of("util", BucketizerFactory.createLinear(50)));
        points.forEach(coarse::accept);
        coarse.flush();
        Assert.assertEquals(ImmutableList.of(ResultRow.of(4, 0), ResultRow.of(4, 1)), coarse.result());
    }

    @Test(expected = IllegalStateException.class)
    public void drainPointsNotConfigured() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state"), ImmutableMap.of());
        aggregator.flush();
        aggregator.drainPoints();
    }

    @Test
    public void acceptAfterFlush() {
        final Aggregator aggregator = createAggregator(ImmutableList.of("state"), ImmutableMap.of());
        aggregator.ingest(TestBeanFactory.createDataPoint(1, "state", "MA"));
        aggregator.flush();
        Assert.assertTrue(aggregator.isFlushed());
        try {
            aggregator.accept(TestBeanFactory.createDataPoint(1, "state", "CA"));
            Assert.fail("Expected exception");
        } catch (final IllegalStateException e) {
            // Expected
        }
        Assert.assertEquals(ImmutableList.of(ResultRow.of(1, "MA")), aggregator.result());
    }

    @Test(expected = IllegalStateException.class)
    public void flushTwice() {
        final Aggregator aggregator = createAggregator(ImmutableList.of(), ImmutableMap.of());
        aggregator.flush();
        aggregator.flush();
    }

    @Test
    public void rowCountMatchesDistinctTuples() {
        final Random random = new Random(8675309L);
        final Aggregator aggregator = createAggregator(
                ImmutableList.of("host", "region", "latency"),
                ImmutableMap.of("latency", BucketizerFactory.createLogLinear(10, 20)));
        final Bucketizer latencyBucketizer = aggregator.getBucketizers().get("latency");
        final Set<List<Object>> tuples = Sets.newHashSet();
        double total = 0;
        for (int i = 0; i < 2000; ++i) {
            final String host = "host" + random.nextInt(5);
            final String region = "region" + random.nextInt(3);
            final int latency = random.nextInt(5000);
            final double value = random.nextInt(10) + 1;
            tuples.add(ImmutableList.of(host, region, latencyBucketizer.indexForValue(latency)));
            total += value;
            aggregator.accept(TestBeanFactory.createDataPoint(value, "host", host, "region", region, "latency", latency));
        }
        aggregator.flush();

        final ImmutableList<ResultRow> rows = aggregator.result();
        Assert.assertEquals(tuples.size(), rows.size());
        double sum = 0;
        for (final ResultRow row : rows) {
            Assert.assertTrue(tuples.contains(row.getDimensions()));
            sum += row.getValue();
        }
        Assert.assertEquals(total, sum, 0d);
    }

    private static Aggregator createAggregator(
            final ImmutableList<String> decompositions,
            final ImmutableMap<String, Bucketizer> bucketizers) {
        return new Aggregator.Builder()
                .setDecompositions(decompositions)
                .setBucketizers(bucketizers)
                .build();
    }

    @Mock
    private InvalidRecordListener _listener;
    private AutoCloseable _openMocks;

    private static final Bucketizer BY_TEN = BucketizerFactory.createLinear(10);
}
