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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSortedMap;

import com.linecorp.mediagate.common.MediaType;

/**
 * An immutable table of the {@link MediaType}s which may be used with parameters, and the parameters
 * each of them allows.
 *
 * <p>A registry is assembled once, usually at startup, and then shared by any number of threads without
 * synchronization. Use {@link #ofDefault()} for the compiled-in table, {@link #builder()} to assemble one
 * in code, or {@link MediaTypeRegistryLoader} to read one from a JSON document.
 */
public final class MediaTypeRegistry {

    private static final MediaTypeRegistry EMPTY = new MediaTypeRegistry(ImmutableSortedMap.of());

    /**
     * Returns the compiled-in registry.
     */
    public static MediaTypeRegistry ofDefault() {
        return DefaultMediaTypeRegistry.INSTANCE;
    }

    /**
     * Returns the registry without any entries. Every media type with parameters is rejected by it.
     */
    public static MediaTypeRegistry empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link MediaTypeRegistryBuilder}.
     */
    public static MediaTypeRegistryBuilder builder() {
        return new MediaTypeRegistryBuilder();
    }

    private final ImmutableSortedMap<MediaType, RegistryEntry> entries;

    MediaTypeRegistry(ImmutableSortedMap<MediaType, RegistryEntry> entries) {
        this.entries = entries;
    }

    /**
     * Returns the {@link RegistryEntry} of the specified {@link MediaType}, or {@code null} if the media type
     * is not registered.
     */
    @Nullable
    public RegistryEntry lookup(MediaType mediaType) {
        requireNonNull(mediaType, "mediaType");
        return entries.get(mediaType);
    }

    /**
     * Returns all entries sorted by {@link MediaType}.
     */
    public Collection<RegistryEntry> entries() {
        return entries.values();
    }

    /**
     * Returns the {@link MediaType}s of the entries marked as legacy, sorted.
     */
    public List<MediaType> legacyTypes() {
        return entries.values().stream()
                      .filter(RegistryEntry::isLegacy)
                      .map(RegistryEntry::mediaType)
                      .collect(toImmutableList());
    }

    /**
     * Returns the number of entries.
     */
    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return this == obj ||
               obj instanceof MediaTypeRegistry && entries.equals(((MediaTypeRegistry) obj).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "MediaTypeRegistry" + entries.values();
    }
}
