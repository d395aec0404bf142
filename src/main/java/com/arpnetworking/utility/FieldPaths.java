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
package com.arpnetworking.utility;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves dotted field paths against nested maps.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class FieldPaths {

    /**
     * Look up a possibly nested value. The path is first tried verbatim as a
     * key, so keys that themselves contain dots are found. Otherwise the path
     * is split at its first dot and the remainder resolved against the nested
     * map named by the prefix.
     *
     * @param fields The fields to search.
     * @param path The dotted path.
     * @return The value if present.
     */
    public static Optional<Object> pluck(final Map<String, ?> fields, final String path) {
        if (fields.containsKey(path)) {
            return Optional.ofNullable(fields.get(path));
        }
        final int separator = path.indexOf('.');
        if (separator < 0) {
            return Optional.empty();
        }
        final Object child = fields.get(path.substring(0, separator));
        if (!(child instanceof Map)) {
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        final Map<String, ?> nested = (Map<String, ?>) child;
        return pluck(nested, path.substring(separator + 1));
    }

    private FieldPaths() {}
}
