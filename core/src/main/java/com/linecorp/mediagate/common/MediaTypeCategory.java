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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/**
 * Whether the content described by a media type is text or binary. Only the {@code type/subtype} part
 * matters; parameters such as {@code codecs} or {@code charset} never change the category.
 */
public enum MediaTypeCategory {
    /**
     * Textual content, stored as UTF-8.
     */
    TEXT,
    /**
     * Binary content, exchanged as a hexadecimal string.
     */
    BINARY;

    private static final ImmutableSet<String> TEXTUAL_APPLICATION_SUBTYPES = ImmutableSet.of(
            "xml",
            "javascript",
            "json",
            "manifest+json",
            "x-python-code",
            "x-sh",
            "x-csh",
            "x-tex",
            "x-latex");

    private static final CharMatcher OPTIONAL_WHITE_SPACE = CharMatcher.anyOf(" \t\r\n");

    /**
     * Returns the category of the specified {@link MediaType}.
     */
    public static MediaTypeCategory of(MediaType mediaType) {
        requireNonNull(mediaType, "mediaType");
        return of(mediaType.type(), mediaType.subtype());
    }

    /**
     * Returns the category of the specified media type string. Anything after the first {@code ';'} is
     * ignored and the rest is not validated, so this method never fails for a non-null input.
     */
    public static MediaTypeCategory of(String mediaType) {
        requireNonNull(mediaType, "mediaType");
        final int semicolonIndex = mediaType.indexOf(';');
        final String base = Ascii.toLowerCase(OPTIONAL_WHITE_SPACE.trimFrom(
                semicolonIndex < 0 ? mediaType : mediaType.substring(0, semicolonIndex)));
        final int slashIndex = base.indexOf('/');
        if (slashIndex < 0) {
            return BINARY;
        }
        return of(base.substring(0, slashIndex), base.substring(slashIndex + 1));
    }

    private static MediaTypeCategory of(String type, String subtype) {
        if ("text".equals(type) || "message".equals(type) || subtype.endsWith("+xml")) {
            return TEXT;
        }
        if ("application".equals(type) && TEXTUAL_APPLICATION_SUBTYPES.contains(subtype)) {
            return TEXT;
        }
        return BINARY;
    }
}
