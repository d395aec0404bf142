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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Describes why a data point's quantized field could not be bucketized. The
 * data point is excluded from the aggregation; processing continues with the
 * next one.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class InvalidFieldValueException extends Exception {

    /**
     * Create an exception for a value that is not a finite number.
     *
     * @param field The decomposition field.
     * @param value The extracted value; null if the field was absent.
     * @return A new {@link InvalidFieldValueException}.
     */
    public static InvalidFieldValueException notANumber(final String field, @Nullable final Object value) {
        return new InvalidFieldValueException(
                String.format("value for field \"%s\" is not a number", field),
                field,
                value,
                Reason.NON_NUMERIC);
    }

    /**
     * Create an exception for a numeric value below zero.
     *
     * @param field The decomposition field.
     * @param value The extracted value.
     * @return A new {@link InvalidFieldValueException}.
     */
    public static InvalidFieldValueException negative(final String field, final Object value) {
        return new InvalidFieldValueException(
                String.format("value for field \"%s\" is negative", field),
                field,
                value,
                Reason.NEGATIVE);
    }

    /**
     * Create an exception for a value whose bucket ordinal exceeds
     * {@link com.arpnetworking.breakdown.bucketizers.Bucketizer#MAX_ORDINAL}.
     *
     * @param field The decomposition field.
     * @param value The extracted value.
     * @return A new {@link InvalidFieldValueException}.
     */
    public static InvalidFieldValueException outOfRange(final String field, final Object value) {
        return new InvalidFieldValueException(
                String.format("value for field \"%s\" is beyond the largest bucket", field),
                field,
                value,
                Reason.OUT_OF_RANGE);
    }

    public String getField() {
        return _field;
    }

    public Optional<Object> getFieldValue() {
        return Optional.ofNullable(_value);
    }

    public Reason getReason() {
        return _reason;
    }

    private InvalidFieldValueException(
            final String message,
            final String field,
            @Nullable final Object value,
            final Reason reason) {
        super(message);
        _field = field;
        _value = value;
        _reason = reason;
    }

    private final String _field;
    @Nullable
    private final transient Object _value;
    private final Reason _reason;

    private static final long serialVersionUID = 4076209153881265212L;

    /**
     * Why the value was rejected.
     */
    public enum Reason {
        /**
         * The value is absent, not a number, a string that does not parse as a
         * number, or not finite.
         */
        NON_NUMERIC,
        /**
         * The value is a number below zero, for which no bucket exists.
         */
        NEGATIVE,
        /**
         * The value is too large for the field's bucketizer to assign an ordinal.
         */
        OUT_OF_RANGE
    }
}
