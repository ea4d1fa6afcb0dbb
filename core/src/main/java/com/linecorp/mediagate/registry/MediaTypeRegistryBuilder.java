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

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableSortedMap;

import com.linecorp.mediagate.common.MediaType;

/**
 * Builds a {@link MediaTypeRegistry}.
 *
 * <pre>{@code
 * MediaTypeRegistry registry =
 *         MediaTypeRegistry.builder()
 *                          .add("audio/ogg", ParameterPolicy.of("codecs",
 *                                                               ValueConstraint.exactIgnoreCase("opus")))
 *                          .addLegacy("audio/opus")
 *                          .build();
 * }</pre>
 */
public final class MediaTypeRegistryBuilder {

    private final Map<MediaType, RegistryEntry> entries = new LinkedHashMap<>();

    MediaTypeRegistryBuilder() {}

    /**
     * Adds a media type which allows no parameters.
     *
     * @param mediaType a {@code type/subtype} string
     */
    public MediaTypeRegistryBuilder add(String mediaType) {
        return add(mediaType, ParameterPolicy.none());
    }

    /**
     * Adds a media type which allows the parameters of the specified {@link ParameterPolicy}.
     *
     * @param mediaType a {@code type/subtype} string
     */
    public MediaTypeRegistryBuilder add(String mediaType, ParameterPolicy policy) {
        requireNonNull(mediaType, "mediaType");
        return add(RegistryEntry.of(MediaType.parse(mediaType), policy, false));
    }

    /**
     * Adds a legacy media type which allows no parameters.
     *
     * @param mediaType a {@code type/subtype} string
     */
    public MediaTypeRegistryBuilder addLegacy(String mediaType) {
        return addLegacy(mediaType, ParameterPolicy.none());
    }

    /**
     * Adds a legacy media type which allows the parameters of the specified {@link ParameterPolicy}.
     *
     * @param mediaType a {@code type/subtype} string
     */
    public MediaTypeRegistryBuilder addLegacy(String mediaType, ParameterPolicy policy) {
        requireNonNull(mediaType, "mediaType");
        return add(RegistryEntry.of(MediaType.parse(mediaType), policy, true));
    }

    /**
     * Adds the specified {@link RegistryEntry}.
     *
     * @throws IllegalArgumentException if an entry of the same {@link MediaType} was added already
     */
    public MediaTypeRegistryBuilder add(RegistryEntry entry) {
        requireNonNull(entry, "entry");
        final RegistryEntry old = entries.putIfAbsent(entry.mediaType(), entry);
        checkArgument(old == null, "duplicate media type: %s", entry.mediaType());
        return this;
    }

    /**
     * Returns a newly-created {@link MediaTypeRegistry}.
     */
    public MediaTypeRegistry build() {
        if (entries.isEmpty()) {
            return MediaTypeRegistry.empty();
        }
        return new MediaTypeRegistry(ImmutableSortedMap.copyOf(entries));
    }
}
