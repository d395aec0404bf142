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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;

import java.util.Map;

/**
 * Creates bucketizers.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BucketizerFactory {

    /**
     * Create a linear bucketizer.
     *
     * @param step The positive bucket width.
     * @return A new {@link Bucketizer}.
     */
    public static Bucketizer createLinear(final double step) {
        return new LinearBucketizer(step);
    }

    /**
     * Create a log-linear bucketizer.
     *
     * @param base The base of each order of magnitude; at least 2.
     * @param nbuckets The number of linear buckets per order of magnitude;
     * a multiple of {@code base} that evenly divides some power of {@code base}.
     * @return A new {@link Bucketizer}.
     */
    public static Bucketizer createLogLinear(final int base, final int nbuckets) {
        return new LogLinearBucketizer(base, nbuckets);
    }

    /**
     * Get the power-of-two bucketizer.
     *
     * @return The {@link Bucketizer}.
     */
    public static Bucketizer createPowerOfTwo() {
        return POWER_OF_TWO;
    }

    /**
     * Create a bucketizer from a type and its numeric parameters. Linear
     * bucketizers require {@code step}; log-linear bucketizers require
     * {@code base} and {@code nbuckets}.
     *
     * @param type The {@link BucketizerType}.
     * @param parameters The parameters by name.
     * @return A new {@link Bucketizer}.
     * @throws IllegalArgumentException if a parameter is missing or invalid.
     */
    public static Bucketizer create(final BucketizerType type, final Map<String, ? extends Number> parameters) {
        try {
            switch (type) {
                case LINEAR:
                    return createLinear(requireParameter(type, parameters, "step").doubleValue());
                case LOG_LINEAR:
                    return createLogLinear(
                            requireIntegralParameter(type, parameters, "base"),
                            requireIntegralParameter(type, parameters, "nbuckets"));
                case POWER_OF_TWO:
                    return createPowerOfTwo();
                default:
                    throw new IllegalArgumentException(String.format("Unsupported bucketizer type; type=%s", type));
            }
        } catch (final IllegalArgumentException e) {
            LOGGER.error()
                    .setMessage("Invalid bucketizer configuration")
                    .addData("type", type)
                    .addData("parameters", parameters)
                    .setThrowable(e)
                    .log();
            throw e;
        }
    }

    private static Number requireParameter(
            final BucketizerType type,
            final Map<String, ? extends Number> parameters,
            final String name) {
        final Number value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException(String.format(
                    "Missing bucketizer parameter; type=%s, parameter=%s",
                    type.getName(),
                    name));
        }
        return value;
    }

    private static int requireIntegralParameter(
            final BucketizerType type,
            final Map<String, ? extends Number> parameters,
            final String name) {
        final double value = requireParameter(type, parameters, name).doubleValue();
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(String.format(
                    "Bucketizer parameter must be an integer; type=%s, parameter=%s, value=%s",
                    type.getName(),
                    name,
                    value));
        }
        return (int) value;
    }

    private BucketizerFactory() {}

    private static final Bucketizer POWER_OF_TWO = new PowerOfTwoBucketizer();
    private static final Logger LOGGER = LoggerFactory.getLogger(BucketizerFactory.class);
}
