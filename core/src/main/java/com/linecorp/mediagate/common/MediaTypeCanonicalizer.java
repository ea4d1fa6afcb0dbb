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

import java.util.Comparator;
import java.util.List;

/**
 * Renders a {@link ParsedMediaType} into its canonical form:
 * <pre>{@code
 * type "/" subtype *( ";" name "=" value )
 * }</pre>
 * with the parameters sorted by name, no whitespace, and a value quoted only if it is empty or contains
 * a character which is not allowed in a token, such as {@code ;}, {@code "} or whitespace.
 *
 * <p>The output depends only on the given {@link ParsedMediaType}; parameter order, the default locale
 * and the platform do not affect it. Case folding of parameter values is the job of the registry's
 * parameter policy, so the values are written as they are.
 */
public final class MediaTypeCanonicalizer {

    private static final Comparator<MediaTypeParameter> BY_NAME =
            Comparator.comparing(MediaTypeParameter::name);

    /**
     * Returns the canonical form of the specified {@link ParsedMediaType}.
     */
    public static String canonicalize(ParsedMediaType parsed) {
        requireNonNull(parsed, "parsed");
        final MediaType mediaType = parsed.mediaType();
        final List<MediaTypeParameter> parameters = parsed.parameters();
        final StringBuilder builder = new StringBuilder(32).append(mediaType.type())
                                                           .append('/')
                                                           .append(mediaType.subtype());
        if (parameters.isEmpty()) {
            return builder.toString();
        }

        parameters.stream().sorted(BY_NAME).forEach(p -> {
            builder.append(';').append(p.name()).append('=');
            final String value = p.value();
            if (MediaTypeGrammar.isToken(value)) {
                builder.append(value);
            } else {
                appendEscapedAndQuoted(builder, value);
            }
        });
        return builder.toString();
    }

    private static void appendEscapedAndQuoted(StringBuilder builder, String value) {
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char ch = value.charAt(i);
            if (ch == '\\' || ch == '"') {
                builder.append('\\');
            }
            builder.append(ch);
        }
        builder.append('"');
    }

    private MediaTypeCanonicalizer() {}
}
