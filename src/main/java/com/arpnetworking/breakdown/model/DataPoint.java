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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * An observation with labeled fields and a numeric value to be summed. Field
 * values are scalars (strings, numbers, booleans) or nested maps of the same,
 * addressed by dotted paths.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class DataPoint {

    public ImmutableMap<String, Object> getFields() {
        return _fields;
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

        final DataPoint other = (DataPoint) object;

        return Double.compare(_value, other._value) == 0
                && Objects.equal(_fields, other._fields);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_fields, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Fields", _fields)
                .add("Value", _value)
                .toString();
    }

    private DataPoint(final Builder builder) {
        _fields = builder._fields;
        _value = builder._value;
    }

    private final ImmutableMap<String, Object> _fields;
    private final double _value;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DataPoint}.
     */
    public static final class Builder extends OvalBuilder<DataPoint> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DataPoint::new);
        }

        /**
         * Set the fields. Optional. Cannot be null. Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The fields.
         * @return This {@link Builder} instance.
         */
        public Builder setFields(final ImmutableMap<String, Object> value) {
            _fields = value;
            return this;
        }

        /**
         * Set the value. Required. Cannot be null. Must be finite.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final Double value) {
            _value = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateValue(final Double value) {
            return Double.isFinite(value);
        }

        @NotNull
        private ImmutableMap<String, Object> _fields = ImmutableMap.of();
        @NotNull
        @ValidateWithMethod(methodName = "validateValue", parameterType = Double.class)
        private Double _value;
    }
}
