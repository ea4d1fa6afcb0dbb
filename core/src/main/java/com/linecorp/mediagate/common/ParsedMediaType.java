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
package com.linecorp.mediagate.common;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A {@link MediaType} with its parameters in the order they appeared in the input. Parameter names are
 * unique within one instance.
 */
public final class ParsedMediaType {

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if two parameters have the same name
     */
    public static ParsedMediaType of(MediaType mediaType, Iterable<MediaTypeParameter> parameters) {
        requireNonNull(mediaType, "mediaType");
        requireNonNull(parameters, "parameters");
        final ImmutableList<MediaTypeParameter> copy = ImmutableList.copyOf(parameters);
        if (copy.size() > 1) {
            final Set<String> names = new HashSet<>();
            for (MediaTypeParameter p : copy) {
                checkArgument(names.add(p.name()), "duplicate parameter: %s", p.name());
            }
        }
        return new ParsedMediaType(mediaType, copy);
    }

    /**
     * Creates a new instance without parameters.
     */
    public static ParsedMediaType of(MediaType mediaType) {
        return new ParsedMediaType(requireNonNull(mediaType, "mediaType"), ImmutableList.of());
    }

    private final MediaType mediaType;
    private final ImmutableList<MediaTypeParameter> parameters;

    // The parameter names must be unique already.
    ParsedMediaType(MediaType mediaType, ImmutableList<MediaTypeParameter> parameters) {
        this.mediaType = mediaType;
        this.parameters = parameters;
    }

    /**
     * Returns the {@code type/subtype} part.
     */
    public MediaType mediaType() {
        return mediaType;
    }

    /**
     * Returns the lowercase top-level type.
     */
    public String type() {
        return mediaType.type();
    }

    /**
     * Returns the lowercase subtype.
     */
    public String subtype() {
        return mediaType.subtype();
    }

    /**
     * Returns the parameters in the order they appeared.
     */
    public List<MediaTypeParameter> parameters() {
        return parameters;
    }

    /**
     * Returns whether at least one parameter is present.
     */
    public boolean hasParameters() {
        return !parameters.isEmpty();
    }

    /**
     * Returns the parameter with the specified name, compared case-insensitively, or {@code null} if
     * absent.
     */
    @Nullable
    public MediaTypeParameter parameter(String name) {
        requireNonNull(name, "name");
        final String lowerCased = Ascii.toLowerCase(name);
        for (MediaTypeParameter p : parameters) {
            if (p.name().equals(lowerCased)) {
                return p;
            }
        }
        return null;
    }

    /**
     * Returns a new instance with the same {@link MediaType} and the specified parameters.
     *
     * @throws IllegalArgumentException if two parameters have the same name
     */
    public ParsedMediaType withParameters(Iterable<MediaTypeParameter> parameters) {
        return of(mediaType, parameters);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParsedMediaType)) {
            return false;
        }
        final ParsedMediaType that = (ParsedMediaType) obj;
        return mediaType.equals(that.mediaType) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return mediaType.hashCode() * 31 + parameters.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("mediaType", mediaType)
                          .add("parameters", parameters)
                          .toString();
    }
}
