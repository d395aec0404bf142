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

import java.math.BigInteger;
import javax.annotation.Nullable;

/**
 * The key of one level of an aggregation tree. A key is either the typed value
 * of a discrete field or the bucket ordinal of a quantized field; the two kinds
 * never compare equal, so a discrete value of {@code 5} and ordinal {@code 5}
 * remain distinct.
 *
 * Discrete numeric values are normalized so that the same number grouped
 * from different boxed types shares one key: integral values become
 * {@link Long} and all others {@link Double}. Strings are never coerced to
 * numbers.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class BreakdownKey {

    /**
     * Create a key for a discrete field value.
     *
     * @param value The extracted field value; null when the field is absent.
     * @return A new discrete {@link BreakdownKey}.
     */
    public static BreakdownKey discrete(@Nullable final Object value) {
        return new BreakdownKey(Kind.DISCRETE, normalize(value), 0);
    }

    /**
     * Create a key for a bucket ordinal.
     *
     * @param ordinal The non-negative bucket ordinal.
     * @return A new ordinal {@link BreakdownKey}.
     */
    public static BreakdownKey ordinal(final int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException(String.format("Ordinal must be non-negative; ordinal=%d", ordinal));
        }
        return new BreakdownKey(Kind.ORDINAL, null, ordinal);
    }

    public boolean isOrdinal() {
        return _kind == Kind.ORDINAL;
    }

    /**
     * Accessor for the discrete value.
     *
     * @return The normalized discrete value; null if the field was absent.
     * @throws IllegalStateException if this is an ordinal key.
     */
    @Nullable
    public Object getValue() {
        if (_kind != Kind.DISCRETE) {
            throw new IllegalStateException("Ordinal keys have no discrete value");
        }
        return _value;
    }

    /**
     * Accessor for the bucket ordinal.
     *
     * @return The bucket ordinal.
     * @throws IllegalStateException if this is a discrete key.
     */
    public int getOrdinal() {
        if (_kind != Kind.ORDINAL) {
            throw new IllegalStateException("Discrete keys have no ordinal");
        }
        return _ordinal;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final BreakdownKey other = (BreakdownKey) object;

        return _kind == other._kind
                && _ordinal == other._ordinal
                && Objects.equal(_value, other._value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_kind, _value, _ordinal);
    }

    @Override
    public String toString() {
        final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this)
                .add("Kind", _kind);
        if (_kind == Kind.ORDINAL) {
            helper.add("Ordinal", _ordinal);
        } else {
            helper.add("Value", _value);
        }
        return helper.toString();
    }

    @Nullable
    private static Object normalize(@Nullable final Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            final BigInteger bigInteger = (BigInteger) value;
            return bigInteger.bitLength() < Long.SIZE ? (Object) bigInteger.longValue() : (Object) bigInteger.doubleValue();
        }
        final double doubleValue = ((Number) value).doubleValue();
        if (Double.isFinite(doubleValue)
                && doubleValue == Math.rint(doubleValue)
                && Math.abs(doubleValue) <= MAX_EXACT_INTEGRAL_DOUBLE) {
            return (long) doubleValue;
        }
        return doubleValue;
    }

    private BreakdownKey(final Kind kind, @Nullable final Object value, final int ordinal) {
        _kind = kind;
        _value = value;
        _ordinal = ordinal;
    }

    private final Kind _kind;
    @Nullable
    private final Object _value;
    private final int _ordinal;

    private static final double MAX_EXACT_INTEGRAL_DOUBLE = 9007199254740992d;

    private enum Kind {
        /**
         * The exact value of a discrete field.
         */
        DISCRETE,
        /**
         * The bucket ordinal of a quantized field.
         */
        ORDINAL
    }
}
