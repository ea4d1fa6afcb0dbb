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
package com.linecorp.mediagate.validation;

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Ascii;
import com.google.common.io.BaseEncoding;

import com.linecorp.mediagate.common.MediaTypeCategory;

/**
 * Converts the description of an asset between the string submitted by a user and the bytes embedded in
 * the transaction data, depending on the {@link MediaTypeCategory} of its media type.
 * Textual content is exchanged as is and stored as UTF-8. Binary content is exchanged as a hexadecimal
 * string.
 */
public final class DescriptionContent {

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    /**
     * Converts the specified content into the bytes to embed.
     *
     * @throws IllegalArgumentException if the media type is binary and the content is not a valid
     *                                  hexadecimal string
     */
    public static byte[] toBytes(String content, String mediaType) {
        requireNonNull(content, "content");
        requireNonNull(mediaType, "mediaType");
        if (MediaTypeCategory.of(mediaType) == MediaTypeCategory.TEXT) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return HEX.decode(Ascii.toLowerCase(content));
        } catch (IllegalArgumentException e) {
            // The cause is the DecodingException which describes the bad character.
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("not a hexadecimal string: " + cause.getMessage(), e);
        }
    }

    /**
     * Converts the specified embedded bytes back into the content.
     */
    public static String toContent(byte[] bytes, String mediaType) {
        requireNonNull(bytes, "bytes");
        requireNonNull(mediaType, "mediaType");
        if (MediaTypeCategory.of(mediaType) == MediaTypeCategory.TEXT) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return HEX.encode(bytes);
    }

    private DescriptionContent() {}
}
