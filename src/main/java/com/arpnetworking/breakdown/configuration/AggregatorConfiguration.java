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

import com.arpnetworking.breakdown.aggregation.Aggregator;
import com.arpnetworking.breakdown.aggregation.InvalidRecordListener;
import com.arpnetworking.breakdown.aggregation.QuantizedPresentation;
import com.arpnetworking.breakdown.bucketizers.Bucketizer;
import com.arpnetworking.breakdown.bucketizers.BucketizerFactory;
import com.arpnetworking.breakdown.bucketizers.BucketizerType;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotNull;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

/**
 * Representation of aggregator configuration. The JSON form is:
 *
 * <pre>
 * {
 *   "decomps": ["host", "latency"],
 *   "bucketizers": {
 *     "latency": {"type": "loglinear", "base": 10, "nbuckets": 20}
 *   },
 *   "resultsAsPoints": false,
 *   "quantizedPresentation": "ORDINAL",
 *   "requireQuantizedLast": false
 * }
 * </pre>
 *
 * Every key is optional and unknown keys are logged and ignored. Documents
 * are bound onto {@link Builder}; malformed values fail with a Jackson
 * {@link JsonMappingException} and constraint violations with an OVal
 * exception wrapped by Jackson.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class AggregatorConfiguration {

    /**
     * Create an {@link ObjectMapper} for aggregator configuration.
     *
     * @return An {@link ObjectMapper} for aggregator configuration.
     */
    public static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = ObjectMapperFactory.createInstance();
        objectMapper.registerModule(new SimpleModule().addDeserializer(Bucketizer.class, new BucketizerDeserializer()));
        objectMapper.addHandler(new UnknownKeyHandler());
        return objectMapper;
    }

    /**
     * Parse configuration from a JSON string.
     *
     * @param json The JSON document.
     * @return The {@link AggregatorConfiguration}.
     * @throws IOException if the document is not valid JSON or the configuration is invalid.
     */
    public static AggregatorConfiguration fromJson(final String json) throws IOException {
        return OBJECT_MAPPER.readValue(json, AggregatorConfiguration.class);
    }

    /**
     * Parse configuration from a JSON stream.
     *
     * @param stream The stream holding the JSON document.
     * @return The {@link AggregatorConfiguration}.
     * @throws IOException if the stream cannot be read, is not valid JSON or
     * the configuration is invalid.
     */
    public static AggregatorConfiguration fromJson(final InputStream stream) throws IOException {
        return OBJECT_MAPPER.readValue(stream, AggregatorConfiguration.class);
    }

    /**
     * Parse configuration from a JSON file.
     *
     * @param file The file holding the JSON document.
     * @return The {@link AggregatorConfiguration}.
     * @throws IOException if the file cannot be read, is not valid JSON or the
     * configuration is invalid.
     */
    public static AggregatorConfiguration fromFile(final File file) throws IOException {
        return OBJECT_MAPPER.readValue(file, AggregatorConfiguration.class);
    }

    /**
     * Convert a parsed JSON object to configuration.
     *
     * @param root The JSON object.
     * @return The {@link AggregatorConfiguration}.
     * @throws IOException if the configuration is invalid.
     */
    public static AggregatorConfiguration fromJsonNode(final JsonNode root) throws IOException {
        return OBJECT_MAPPER.treeToValue(root, AggregatorConfiguration.class);
    }

    public ImmutableList<String> getDecompositions() {
        return _decompositions;
    }

    public ImmutableMap<String, Bucketizer> getBucketizers() {
        return _bucketizers;
    }

    public boolean getResultsAsPoints() {
        return _resultsAsPoints;
    }

    public QuantizedPresentation getQuantizedPresentation() {
        return _quantizedPresentation;
    }

    public boolean getRequireQuantizedLast() {
        return _requireQuantizedLast;
    }

    /**
     * Create an aggregator that logs rejected data points.
     *
     * @return A new {@link Aggregator}.
     */
    public Aggregator createAggregator() {
        return createAggregatorBuilder().build();
    }

    /**
     * Create an aggregator reporting rejected data points to a listener.
     *
     * @param listener The {@link InvalidRecordListener}.
     * @return A new {@link Aggregator}.
     */
    public Aggregator createAggregator(final InvalidRecordListener listener) {
        return createAggregatorBuilder()
                .setInvalidRecordListener(listener)
                .build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Decompositions", _decompositions)
                .add("Bucketizers", _bucketizers)
                .add("ResultsAsPoints", _resultsAsPoints)
                .add("QuantizedPresentation", _quantizedPresentation)
                .add("RequireQuantizedLast", _requireQuantizedLast)
                .toString();
    }

    private Aggregator.Builder createAggregatorBuilder() {
        return new Aggregator.Builder()
                .setDecompositions(_decompositions)
                .setBucketizers(_bucketizers)
                .setResultsAsPoints(_resultsAsPoints)
                .setQuantizedPresentation(_quantizedPresentation)
                .setRequireQuantizedLast(_requireQuantizedLast);
    }

    private AggregatorConfiguration(final Builder builder) {
        _decompositions = builder._decompositions;
        _bucketizers = builder._bucketizers;
        _resultsAsPoints = builder._resultsAsPoints;
        _quantizedPresentation = builder._quantizedPresentation;
        _requireQuantizedLast = builder._requireQuantizedLast;
    }

    private final ImmutableList<String> _decompositions;
    private final ImmutableMap<String, Bucketizer> _bucketizers;
    private final boolean _resultsAsPoints;
    private final QuantizedPresentation _quantizedPresentation;
    private final boolean _requireQuantizedLast;

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();
    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatorConfiguration.class);

    private static final class BucketizerDeserializer extends JsonDeserializer<Bucketizer> {
        @Override
        public Bucketizer deserialize(
                final JsonParser parser,
                final DeserializationContext context) throws IOException {
            final JsonNode node = parser.readValueAsTree();
            if (!node.isObject() || !node.path("type").isTextual()) {
                throw JsonMappingException.from(parser, String.format("Bucketizer must be an object with a type; node=%s", node));
            }
            final ImmutableMap.Builder<String, Number> parameters = ImmutableMap.builder();
            final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            while (iterator.hasNext()) {
                final Map.Entry<String, JsonNode> entry = iterator.next();
                if ("type".equals(entry.getKey())) {
                    continue;
                }
                if (!entry.getValue().isNumber() || !PARAMETERS.contains(entry.getKey())) {
                    throw JsonMappingException.from(
                            parser,
                            String.format("Invalid bucketizer parameter; parameter=%s, node=%s", entry.getKey(), node));
                }
                parameters.put(entry.getKey(), entry.getValue().numberValue());
            }
            try {
                return BucketizerFactory.create(BucketizerType.fromName(node.get("type").textValue()), parameters.build());
            } catch (final IllegalArgumentException e) {
                throw JsonMappingException.from(parser, e.getMessage(), e);
            }
        }

        private static final ImmutableSet<String> PARAMETERS = ImmutableSet.of("step", "base", "nbuckets");
    }

    private static final class UnknownKeyHandler extends DeserializationProblemHandler {
        @Override
        public boolean handleUnknownProperty(
                final DeserializationContext context,
                final JsonParser parser,
                final JsonDeserializer<?> deserializer,
                final Object beanOrClass,
                final String propertyName) throws IOException {
            LOGGER.warn()
                    .setMessage("Ignoring unknown configuration key")
                    .addData("key", propertyName)
                    .log();
            parser.skipChildren();
            return true;
        }
    }

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AggregatorConfiguration}.
     */
    public static final class Builder extends OvalBuilder<AggregatorConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AggregatorConfiguration::new);
        }

        /**
         * Set the decomposition fields. Optional. Cannot be null. Defaults to none.
         *
         * @param value The decomposition fields.
         * @return This {@link Builder} instance.
         */
        @JsonProperty("decomps")
        public Builder setDecompositions(final ImmutableList<String> value) {
            _decompositions = value;
            return this;
        }

        /**
         * Set the bucketizers by field name. Optional. Cannot be null. Defaults to none.
         *
         * @param value The bucketizers.
         * @return This {@link Builder} instance.
         */
        public Builder setBucketizers(final ImmutableMap<String, Bucketizer> value) {
            _bucketizers = value;
            return this;
        }

        /**
         * Set whether results are drained as data points. Optional. Cannot be null. Defaults to false.
         *
         * @param value Whether results are drained as data points.
         * @return This {@link Builder} instance.
         */
        public Builder setResultsAsPoints(final Boolean value) {
            _resultsAsPoints = value;
            return this;
        }

        /**
         * Set how quantized dimensions appear in results. Optional. Cannot be
         * null. Defaults to {@link QuantizedPresentation#ORDINAL}.
         *
         * @param value The presentation.
         * @return This {@link Builder} instance.
         */
        public Builder setQuantizedPresentation(final QuantizedPresentation value) {
            _quantizedPresentation = value;
            return this;
        }

        /**
         * Set whether quantized fields must follow all discrete fields.
         * Optional. Cannot be null. Defaults to false.
         *
         * @param value Whether quantized fields must be last.
         * @return This {@link Builder} instance.
         */
        public Builder setRequireQuantizedLast(final Boolean value) {
            _requireQuantizedLast = value;
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
    }
}
