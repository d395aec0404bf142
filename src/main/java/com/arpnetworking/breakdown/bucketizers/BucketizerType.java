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

import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of supported quantization strategies.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public enum BucketizerType {

    /**
     * Buckets of a fixed width.
     */
    LINEAR("linear", ImmutableSet.of("lin")),

    /**
     * Each order of magnitude of a base is divided into linear sub-buckets.
     */
    LOG_LINEAR("loglinear", ImmutableSet.of("log-linear", "llquantize")),

    /**
     * Buckets bounded by consecutive powers of two.
     */
    POWER_OF_TWO("p2", ImmutableSet.of("poweroftwo", "power-of-two", "quantize"));

    /**
     * Accessor for the canonical configuration name.
     *
     * @return The canonical name.
     */
    public String getName() {
        return _name;
    }

    /**
     * Accessor for the alternative configuration names.
     *
     * @return The aliases.
     */
    public ImmutableSet<String> getAliases() {
        return _aliases;
    }

    /**
     * Look up a type by canonical name or alias. Case insensitive.
     *
     * @param name The name to look up.
     * @return The matching {@link BucketizerType} if any.
     */
    public static Optional<BucketizerType> tryFromName(final String name) {
        final String normalized = name.toLowerCase(Locale.ROOT);
        for (final BucketizerType type : values()) {
            if (type._name.equals(normalized) || type._aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Look up a type by canonical name or alias. Case insensitive.
     *
     * @param name The name to look up.
     * @return The matching {@link BucketizerType}.
     * @throws IllegalArgumentException if no type matches.
     */
    public static BucketizerType fromName(final String name) {
        return tryFromName(name).orElseThrow(
                () -> new IllegalArgumentException(String.format("Invalid bucketizer type; name=%s", name)));
    }

    BucketizerType(final String name, final ImmutableSet<String> aliases) {
        _name = name;
        _aliases = aliases;
    }

    private final String _name;
    private final ImmutableSet<String> _aliases;
}
