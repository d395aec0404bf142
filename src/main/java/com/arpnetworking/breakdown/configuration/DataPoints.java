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
package com.arpnetworking.breakdown.configuration;

import com.arpnetworking.breakdown.model.DataPoint;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Parses data points from JSON. A data point is an object of the form
 * {@code {"fields": {...}, "value": 15}}; a document may hold a single data
 * point or an array of them. Null field values are treated as absent.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class DataPoints {

    /**
     * Parse one data point or an array of data points.
     *
     * @param json The JSON document.
     * @return The data points in document order.
     * @throws IOException if the document is not valid JSON.
     * @throws IllegalArgumentException if a data point is malformed.
     */
    public static ImmutableList<DataPoint> fromJson(final String json) throws IOException {
        final JsonNode root = OBJECT_MAPPER.readTree(json);
        if (root == null || root.isMissingNode()) {
            return ImmutableList.of();
        }
        if (root.isArray()) {
            final ImmutableList.Builder<DataPoint> dataPoints = ImmutableList.builder();
            for (final JsonNode node : root) {
                dataPoints.add(fromJsonNode(node));
            }
            return dataPoints.build();
        }
        return ImmutableList.of(fromJsonNode(root));
    }

    /**
     * Convert a parsed JSON object to a data point.
     *
     * @param node The JSON object.
     * @return The {@link DataPoint}.
     * @throws IllegalArgumentException if the value is absent or not a number, or the fields are not an object.
     */
    public static DataPoint fromJsonNode(final JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(String.format("Data point must be an object; node=%s", node));
        }
        final JsonNode value = node.get("value");
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException(String.format("Data point value must be a number; node=%s", node));
        }
        final JsonNode fields = node.get("fields");
        final ImmutableMap<String, Object> fieldValues;
        if (fields == null || fields.isNull()) {
            fieldValues = ImmutableMap.of();
        } else if (fields.isObject()) {
            fieldValues = toMap(fields);
        } else {
            throw new IllegalArgumentException(String.format("Data point fields must be an object; node=%s", node));
        }
        return new DataPoint.Builder()
                .setFields(fieldValues)
                .setValue(value.doubleValue())
                .build();
    }

    private static ImmutableMap<String, Object> toMap(final JsonNode node) {
        final ImmutableMap.Builder<String, Object> map = ImmutableMap.builder();
        final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            final Map.Entry<String, JsonNode> entry = iterator.next();
            final Object value = toValue(entry.getValue());
            if (value != null) {
                map.put(entry.getKey(), value);
            }
        }
        return map.build();
    }

    @Nullable
    private static Object toValue(final JsonNode node) {
        if (node.isObject()) {
            return toMap(node);
        } else if (node.isArray()) {
            final ImmutableList.Builder<Object> list = ImmutableList.builder();
            for (final JsonNode element : node) {
                final Object value = toValue(element);
                if (value != null) {
                    list.add(value);
                }
            }
            return list.build();
        } else if (node.isNumber()) {
            return node.numberValue();
        } else if (node.isBoolean()) {
            return node.booleanValue();
        } else if (node.isTextual()) {
            return node.textValue();
        }
        return null;
    }

    private DataPoints() {}

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
}
