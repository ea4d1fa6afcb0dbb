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

import javax.annotation.Nullable;

import com.google.common.base.Ascii;

/**
 * The {@code type/subtype} pair of a media type, without parameters. Both parts are normalized to
 * lowercase, so two instances are equal when their parts are equal ignoring ASCII case.
 *
 * <pre>{@code
 * MediaType.of("Audio", "OGG").toString(); // "audio/ogg"
 * MediaType.parse("image/jpeg").subtype(); // "jpeg"
 * }</pre>
 */
public final class MediaType implements Comparable<MediaType> {

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if {@code type} or {@code subtype} is empty or contains a character
     *                                  other than letters, digits and {@code !#$&-^_.+}
     */
    public static MediaType of(String type, String subtype) {
        requireNonNull(type, "type");
        requireNonNull(subtype, "subtype");
        return new MediaType(normalizeName(type, "type"), normalizeName(subtype, "subtype"));
    }

    /**
     * Parses a {@code type/subtype} string. Parameters are not allowed.
     *
     * @throws IllegalArgumentException if the input is not parsable or has parameters
     */
    public static MediaType parse(String input) {
        requireNonNull(input, "input");
        final ParsedMediaType parsed = MediaTypeTokenizer.tokenize(input);
        checkArgument(!parsed.hasParameters(), "input: %s (expected: type/subtype without parameters)",
                      input);
        return parsed.mediaType();
    }

    private static String normalizeName(String name, String what) {
        checkArgument(MediaTypeGrammar.isName(name), "%s: '%s' (expected: a non-empty token)", what, name);
        return Ascii.toLowerCase(name);
    }

    private final String type;
    private final String subtype;

    // Both parts must be normalized already.
    MediaType(String type, String subtype) {
        this.type = type;
        this.subtype = subtype;
    }

    /**
     * Returns the top-level type, e.g. {@code "audio"}.
     */
    public String type() {
        return type;
    }

    /**
     * Returns the subtype, e.g. {@code "ogg"}.
     */
    public String subtype() {
        return subtype;
    }

    @Override
    public int compareTo(MediaType o) {
        final int res = type.compareTo(o.type);
        if (res != 0) {
            return res;
        }
        return subtype.compareTo(o.subtype);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MediaType)) {
            return false;
        }
        final MediaType that = (MediaType) obj;
        return type.equals(that.type) && subtype.equals(that.subtype);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + subtype.hashCode();
    }

    /**
     * Returns {@code type/subtype}.
     */
    @Override
    public String toString() {
        return type + '/' + subtype;
    }
}
