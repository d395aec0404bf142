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
import com.arpnetworking.breakdown.model.AggregatorStats;
import com.arpnetworking.breakdown.model.DataPoint;
import com.arpnetworking.breakdown.model.ResultRow;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.utility.FieldPaths;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import net.sf.oval.constraint.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sums data points broken out by an ordered list of decomposition fields.
 * Fields with an entry in the bucketizer map are quantized into buckets; all
 * other fields are grouped by exact value.
 *
 * A data point whose quantized field is absent, non-numeric, negative or
 * beyond the largest bucket is excluded from all sums and reported to the
 * {@link InvalidRecordListener}; aggregation continues with the next data
 * point. Configuration errors fail construction.
 *
 * Memory use is bounded by the number of distinct key tuples observed. This
 * class is not thread safe; callers feed it from a single loop and call
 * {@link #flush()} once after the last data point.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Aggregator implements DataPointSink {

    @Override
    public void accept(final DataPoint dataPoint) {
        if (_flushed) {
            throw new IllegalStateException("Aggregator has been flushed");
        }
        final long recordIndex = ++_inputs;

        final List<Object> levelValues = new ArrayList<>(_dimensions.size());
        for (final Dimension dimension : _dimensions) {
            final Optional<Object> fieldValue = FieldPaths.pluck(dataPoint.getFields(), dimension.getField());
            if (!dimension.isQuantized()) {
                levelValues.add(fieldValue.orElse(null));
                continue;
            }

            final Optional<Double> number = toNumber(fieldValue);
            if (!number.isPresent()) {
                ++_nonNumericErrors;
                reject(dataPoint, InvalidFieldValueException.notANumber(dimension.getField(), fieldValue.orElse(null)), recordIndex);
                return;
            }
            if (number.get() < 0) {
                reject(dataPoint, InvalidFieldValueException.negative(dimension.getField(), fieldValue.get()), recordIndex);
                return;
            }
            if (!dimension.getBucketizer().get().canIndex(number.get())) {
                reject(dataPoint, InvalidFieldValueException.outOfRange(dimension.getField(), fieldValue.get()), recordIndex);
                return;
            }
            levelValues.add(number.get());
        }

        _tree.add(levelValues, dataPoint.getValue());
    }

    /**
     * Alias of {@link #accept(DataPoint)}.
     *
     * @param dataPoint The data point.
     */
    public void ingest(final DataPoint dataPoint) {
        accept(dataPoint);
    }

    @Override
    public void flush() {
        if (_flushed) {
            throw new IllegalStateException("Aggregator has already been flushed");
        }
        _flushed = true;
        LOGGER.debug()
                .setMessage("Aggregator flushed")
                .addData("aggregator", this)
                .addData("stats", getStats())
                .log();
    }

    public boolean isFlushed() {
        return _flushed;
    }

    /**
     * Snapshot the counters.
     *
     * @return The {@link AggregatorStats}.
     */
    public AggregatorStats getStats() {
        return new AggregatorStats(_inputs, _parsed, _nonNumericErrors);
    }

    /**
     * Flatten the current sums using the configured presentation. With no
     * decomposition fields this is a single row holding the total.
     *
     * @return The rows.
     */
    public ImmutableList<ResultRow> result() {
        return result(_quantizedPresentation);
    }

    /**
     * Flatten the current sums.
     *
     * @param presentation How quantized dimensions appear in the rows.
     * @return The rows.
     */
    public ImmutableList<ResultRow> result(final QuantizedPresentation presentation) {
        return Flattener.flatten(_tree, presentation);
    }

    /**
     * Re-synthesize the current sums as data points, one per row, with each
     * quantized field set to the minimum of its bucket. The tree is not
     * modified.
     *
     * @return The data points.
     * @throws IllegalStateException if the aggregator was not built with results as points.
     */
    public ImmutableList<DataPoint> drainPoints() {
        if (!_resultsAsPoints) {
            throw new IllegalStateException("Aggregator is not configured for results as points");
        }
        return Flattener.toDataPoints(_tree);
    }

    public ImmutableList<String> getDecompositions() {
        return _decompositions;
    }

    public ImmutableMap<String, Bucketizer> getBucketizers() {
        return _bucketizers;
    }

    public boolean isResultsAsPoints() {
        return _resultsAsPoints;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Decompositions", _decompositions)
                .add("Bucketizers", _bucketizers)
                .add("ResultsAsPoints", _resultsAsPoints)
                .add("QuantizedPresentation", _quantizedPresentation)
                .add("Flushed", _flushed)
                .toString();
    }

    private Optional<Double> toNumber(final Optional<Object> fieldValue) {
        if (!fieldValue.isPresent()) {
            return Optional.empty();
        }
        final Object value = fieldValue.get();
        final Double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            ++_parsed;
            number = Doubles.tryParse(((String) value).trim());
        } else {
            number = null;
        }
        if (number == null || !Double.isFinite(number)) {
            return Optional.empty();
        }
        return Optional.of(number);
    }

    private void reject(final DataPoint dataPoint, final InvalidFieldValueException error, final long recordIndex) {
        LOGGER.debug()
                .setMessage("Rejected data point")
                .addData("dataPoint", dataPoint)
                .addData("recordIndex", recordIndex)
                .addData("reason", error.getReason())
                .setThrowable(error)
                .log();
        _invalidRecordListener.onInvalidRecord(dataPoint, error, recordIndex);
    }

    private Aggregator(final Builder builder) {
        _decompositions = builder._decompositions;
        _bucketizers = builder._bucketizers;
        _resultsAsPoints = builder._resultsAsPoints;
        _quantizedPresentation = builder._quantizedPresentation;
        _invalidRecordListener = builder._invalidRecordListener;
        _dimensions = Dimension.resolve(_decompositions, _bucketizers);

        if (builder._requireQuantizedLast) {
            checkQuantizedLast(_dimensions);
        }
        for (final String field : _bucketizers.keySet()) {
            if (!_decompositions.contains(field)) {
                LOGGER.debug()
                        .setMessage("Bucketizer configured for field not in decompositions")
                        .addData("field", field)
                        .log();
            }
        }

        _tree = new AggregationTree(_dimensions);
        LOGGER.debug()
                .setMessage("Aggregator created")
                .addData("aggregator", this)
                .log();
    }

    private static void checkQuantizedLast(final ImmutableList<Dimension> dimensions) {
        Optional<Dimension> firstQuantized = Optional.empty();
        for (final Dimension dimension : dimensions) {
            if (dimension.isQuantized()) {
                if (!firstQuantized.isPresent()) {
                    firstQuantized = Optional.of(dimension);
                }
            } else if (firstQuantized.isPresent()) {
                final IllegalArgumentException error = new IllegalArgumentException(String.format(
                        "bucketized breakdowns must be last, but found discrete breakdown \"%s\" after bucketized breakdown \"%s\"",
                        dimension.getField(),
                        firstQuantized.get().getField()));
                LOGGER.error()
                        .setMessage("Invalid aggregator configuration")
                        .addData("dimensions", dimensions)
                        .setThrowable(error)
                        .log();
                throw error;
            }
        }
    }

    private final ImmutableList<String> _decompositions;
    private final ImmutableMap<String, Bucketizer> _bucketizers;
    private final boolean _resultsAsPoints;
    private final QuantizedPresentation _quantizedPresentation;
    private final InvalidRecordListener _invalidRecordListener;
    private final ImmutableList<Dimension> _dimensions;
    private final AggregationTree _tree;

    private long _inputs = 0;
    private long _parsed = 0;
    private long _nonNumericErrors = 0;
    private boolean _flushed = false;

    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);
    private static final InvalidRecordListener LOGGING_LISTENER = (dataPoint, error, recordIndex) ->
            LOGGER.warn()
                    .setMessage("Invalid data point")
                    .addData("dataPoint", dataPoint)
                    .addData("recordIndex", recordIndex)
                    .addData("error", error.getMessage())
                    .log();

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Aggregator}.
     */
    public static final class Builder extends OvalBuilder<Aggregator> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Aggregator::new);
        }

        /**
         * Set the decomposition fields in nesting order. Optional. Cannot be
         * null. Defaults to none, which aggregates a single sum.
         *
         * @param value The decomposition fields.
         * @return This {@link Builder} instance.
         */
        public Builder setDecompositions(final ImmutableList<String> value) {
            _decompositions = value;
            return this;
        }

        /**
         * Set the bucketizers by field name. Optional. Cannot be null.
         * Defaults to none, which makes every field discrete.
         *
         * @param value The bucketizers.
         * @return This {@link Builder} instance.
         */
        public Builder setBucketizers(final ImmutableMap<String, Bucketizer> value) {
            _bucketizers = value;
            return this;
        }

        /**
         * Set whether results are drained as data points. Optional. Cannot be
         * null. Defaults to false.
         *
         * @param value Whether results are drained as data points.
         * @return This {@link Builder} instance.
         */
        public Builder setResultsAsPoints(final Boolean value) {
            _resultsAsPoints = value;
            return this;
        }

        /**
         * Set how quantized dimensions appear in {@link Aggregator#result()}.
         * Optional. Cannot be null. Defaults to {@link QuantizedPresentation#ORDINAL}.
         *
         * @param value The presentation.
         * @return This {@link Builder} instance.
         */
        public Builder setQuantizedPresentation(final QuantizedPresentation value) {
            _quantizedPresentation = value;
            return this;
        }

        /**
         * Set whether discrete fields are forbidden after the first quantized
         * field. Optional. Cannot be null. Defaults to false.
         *
         * @param value Whether quantized fields must be last.
         * @return This {@link Builder} instance.
         */
        public Builder setRequireQuantizedLast(final Boolean value) {
            _requireQuantizedLast = value;
            return this;
        }

        /**
         * Set the listener for rejected data points. Optional. Cannot be null.
         * Defaults to logging a warning.
         *
         * @param value The listener.
         * @return This {@link Builder} instance.
         */
        public Builder setInvalidRecordListener(final InvalidRecordListener value) {
            _invalidRecordListener = value;
            return this;
        }

        @NotNull
        private ImmutableList<String> _decompositions = ImmutableList.of();
        @NotNull
        private ImmutableMap<String, Bucketizer> _bucketizers = ImmutableMap.of();
        @NotNull
        private Boolean _resultsAsPoints = false;
        @NotNull
        private QuantizedPresentation _quantizedPresentation = QuantizedPresentation.ORDINAL;
        @NotNull
        private Boolean _requireQuantizedLast = false;
        @NotNull
        private InvalidRecordListener _invalidRecordListener = LOGGING_LISTENER;
    }
}
