/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.mediagate.registry;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map.Entry;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import com.linecorp.mediagate.common.MediaType;

/**
 * Reads a {@link MediaTypeRegistry} from a JSON document such as:
 * <pre>{@code
 * {
 *   "entries": [
 *     {
 *       "type": "audio/ogg",
 *       "legacy": true,
 *       "parameters": {
 *         "codecs": { "kind": "exact", "values": [ "opus" ], "caseInsensitive": true }
 *       }
 *     },
 *     { "type": "audio/opus", "legacy": true }
 *   ]
 * }
 * }</pre>
 *
 * <p>{@code kind} is one of {@code "exact"} (exactly one value), {@code "oneOf"} (one or more values) and
 * {@code "anyToken"} (no values). {@code legacy}, {@code parameters} and {@code caseInsensitive} are
 * optional and default to {@code false}, no parameters and {@code false}.
 */
public final class MediaTypeRegistryLoader {

    private static final Logger logger = LoggerFactory.getLogger(MediaTypeRegistryLoader.class);

    private static final ObjectMapper mapper =
            new ObjectMapper().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    /**
     * Loads a {@link MediaTypeRegistry} from the specified file.
     *
     * @throws IOException if failed to read the file or it is not a valid JSON document
     * @throws IllegalArgumentException if the document does not describe a valid registry
     */
    public static MediaTypeRegistry load(Path path) throws IOException {
        requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            final MediaTypeRegistry registry = load(in);
            logger.info("Loaded {} media type registry entries from: {}", registry.size(), path);
            return registry;
        }
    }

    /**
     * Loads a {@link MediaTypeRegistry} from the specified {@link InputStream}. The stream is not closed.
     *
     * @throws IOException if failed to read the stream or it is not a valid JSON document
     * @throws IllegalArgumentException if the document does not describe a valid registry
     */
    public static MediaTypeRegistry load(InputStream in) throws IOException {
        requireNonNull(in, "in");
        return toRegistry(mapper.readTree(in));
    }

    /**
     * Loads a {@link MediaTypeRegistry} from the specified JSON string.
     *
     * @throws IllegalArgumentException if the string is not a valid JSON document or does not describe
     *                                  a valid registry
     */
    public static MediaTypeRegistry load(String json) {
        requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("malformed media type registry: " + e.getMessage(), e);
        }
        return toRegistry(root);
    }

    private static MediaTypeRegistry toRegistry(@Nullable JsonNode root) {
        checkArgument(root != null && root.isObject(), "a media type registry must be an object.");
        final JsonNode entries = root.get("entries");
        checkArgument(entries != null && entries.isArray(), "'entries' must be an array.");

        final MediaTypeRegistryBuilder builder = MediaTypeRegistry.builder();
        for (JsonNode entry : entries) {
            builder.add(toEntry(entry));
        }
        return builder.build();
    }

    private static RegistryEntry toEntry(JsonNode node) {
        checkArgument(node.isObject(), "an entry must be an object: %s", node);
        final JsonNode type = node.get("type");
        checkArgument(type != null && type.isTextual(), "'type' must be a string: %s", node);
        final MediaType mediaType = MediaType.parse(type.textValue());

        final boolean legacy = booleanField(node, "legacy");

        final JsonNode parameters = node.get("parameters");
        if (parameters == null || parameters.isNull()) {
            return RegistryEntry.of(mediaType, ParameterPolicy.none(), legacy);
        }
        checkArgument(parameters.isObject(), "'parameters' of %s must be an object.", mediaType);

        final ParameterPolicy.Builder policy = ParameterPolicy.builder();
        for (final Iterator<Entry<String, JsonNode>> i = parameters.fields(); i.hasNext();) {
            final Entry<String, JsonNode> e = i.next();
            policy.add(e.getKey(), toConstraint(mediaType, e.getKey(), e.getValue()));
        }
        return RegistryEntry.of(mediaType, policy.build(), legacy);
    }

    private static ValueConstraint toConstraint(MediaType mediaType, String name, JsonNode node) {
        checkArgument(node.isObject(), "parameter '%s' of %s must be an object.", name, mediaType);
        final JsonNode kind = node.get("kind");
        checkArgument(kind != null && kind.isTextual(),
                      "'kind' of parameter '%s' of %s must be a string.", name, mediaType);
        final boolean caseInsensitive = booleanField(node, "caseInsensitive");
        final ImmutableList<String> values = stringValues(mediaType, name, node.get("values"));

        switch (kind.textValue()) {
            case "exact":
                checkArgument(values.size() == 1,
                              "parameter '%s' of %s: 'exact' requires exactly one value (found: %s)",
                              name, mediaType, values);
                return caseInsensitive ? ValueConstraint.exactIgnoreCase(values.get(0))
                                       : ValueConstraint.exact(values.get(0));
            case "oneOf":
                checkArgument(!values.isEmpty(), "parameter '%s' of %s: 'oneOf' requires at least one value",
                              name, mediaType);
                return ValueConstraint.oneOf(values, caseInsensitive);
            case "anyToken":
                checkArgument(values.isEmpty(), "parameter '%s' of %s: 'anyToken' does not take values",
                              name, mediaType);
                return caseInsensitive ? ValueConstraint.anyTokenIgnoreCase() : ValueConstraint.anyToken();
            default:
                throw new IllegalArgumentException(
                        "unknown kind of parameter '" + name + "' of " + mediaType + ": " + kind.textValue() +
                        " (expected: exact, oneOf or anyToken)");
        }
    }

    private static ImmutableList<String> stringValues(MediaType mediaType, String name,
                                                      @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return ImmutableList.of();
        }
        checkArgument(node.isArray(), "'values' of parameter '%s' of %s must be an array.", name, mediaType);
        final ImmutableList.Builder<String> builder = ImmutableList.builderWithExpectedSize(node.size());
        for (JsonNode value : node) {
            checkArgument(value.isTextual(), "'values' of parameter '%s' of %s contains %s (%s); " +
                                             "only strings are allowed.",
                          name, mediaType, value.getNodeType(), value);
            builder.add(value.textValue());
        }
        return builder.build();
    }

    private static boolean booleanField(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        checkArgument(value.isBoolean(), "'%s' must be a boolean: %s", field, node);
        return value.booleanValue();
    }

    private MediaTypeRegistryLoader() {}
}
