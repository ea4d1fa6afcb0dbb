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

import static com.linecorp.mediagate.common.MediaTypeGrammar.NAME_MATCHER;
import static com.linecorp.mediagate.common.MediaTypeGrammar.OPTIONAL_WHITE_SPACE;
import static com.linecorp.mediagate.common.MediaTypeGrammar.QUOTED_TEXT_MATCHER;
import static com.linecorp.mediagate.common.MediaTypeGrammar.TOKEN_MATCHER;
import static com.linecorp.mediagate.common.MediaTypeGrammar.VALUE_CHAR_MATCHER;
import static java.util.Objects.requireNonNull;

import java.util.HashSet;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;

/**
 * Splits a media type string into its type, subtype and parameters.
 *
 * <p>The accepted grammar is:
 * <pre>{@code
 * media-type = type "/" subtype *( OWS ";" OWS parameter )
 * parameter  = attribute "=" ( token / quoted-string )
 * OWS        = *( SP / HTAB )
 * }</pre>
 * where {@code type}, {@code subtype} and {@code attribute} consist of letters, digits and
 * {@code !#$&-^_.+}. A backslash inside a quoted string escapes the character that follows it.
 * Nothing else, including leading or trailing whitespace, is tolerated.
 */
public final class MediaTypeTokenizer {

    // Forked from the Tokenizer of Guava's MediaType at 261ac7afbf04dce2bd7e20a2085338e1f9a857d8

    /**
     * The maximum length of an input in UTF-8 bytes.
     */
    public static final int MAX_LENGTH = 255;

    /**
     * Tokenizes the specified input.
     *
     * @throws MediaTypeRejectedException if the input is too long, malformed or has a duplicate parameter
     */
    public static ParsedMediaType tokenize(String input) {
        requireNonNull(input, "input");
        checkLength(input);

        final Tokenizer tokenizer = new Tokenizer(input);
        final String type = tokenizer.consumeToken(NAME_MATCHER, "type");
        tokenizer.consumeCharacter('/');
        final String subtype = tokenizer.consumeToken(NAME_MATCHER, "subtype");

        final ImmutableList.Builder<MediaTypeParameter> parameters = ImmutableList.builder();
        final Set<String> names = new HashSet<>(4);
        while (tokenizer.hasMore()) {
            tokenizer.consumeTokenIfPresent(OPTIONAL_WHITE_SPACE);
            tokenizer.consumeCharacter(';');
            tokenizer.consumeTokenIfPresent(OPTIONAL_WHITE_SPACE);
            final String attribute = tokenizer.consumeToken(NAME_MATCHER, "parameter name");
            final String name = Ascii.toLowerCase(attribute);
            if (!names.add(name)) {
                // Parameter names are reported in lower case, as the policy evaluator does.
                throw new MediaTypeRejectedException(
                        RejectReason.DUPLICATE_PARAMETER, name,
                        "duplicate parameter '" + attribute + "' in '" + input + '\'');
            }
            tokenizer.consumeCharacter('=');
            final String value;
            if (tokenizer.hasMore() && tokenizer.previewChar() == '"') {
                value = tokenizer.consumeQuotedString();
            } else {
                value = tokenizer.consumeToken(TOKEN_MATCHER, "parameter value");
            }
            parameters.add(new MediaTypeParameter(name, value));
        }

        return new ParsedMediaType(new MediaType(Ascii.toLowerCase(type), Ascii.toLowerCase(subtype)),
                                   parameters.build());
    }

    private static void checkLength(String input) {
        // A UTF-8 sequence is never shorter than its UTF-16 counterpart.
        if (input.length() > MAX_LENGTH) {
            throw tooLong(input.length());
        }
        final int encodedLength;
        try {
            encodedLength = Utf8.encodedLength(input);
        } catch (IllegalArgumentException e) {
            throw new MediaTypeRejectedException(RejectReason.PARSE_ERROR, null,
                                                 "unpaired surrogate in '" + input + '\'');
        }
        if (encodedLength > MAX_LENGTH) {
            throw tooLong(encodedLength);
        }
    }

    private static MediaTypeRejectedException tooLong(int length) {
        return new MediaTypeRejectedException(
                RejectReason.TOO_LONG, null,
                "media type too long: " + length + " bytes (expected: <= " + MAX_LENGTH + ')');
    }

    private static final class Tokenizer {
        final String input;
        int position;

        Tokenizer(String input) {
            this.input = input;
        }

        String consumeTokenIfPresent(CharMatcher matcher) {
            final int startPosition = position;
            final int end = matcher.negate().indexIn(input, startPosition);
            position = end < 0 ? input.length() : end;
            return input.substring(startPosition, position);
        }

        String consumeToken(CharMatcher matcher, String what) {
            final int startPosition = position;
            final String token = consumeTokenIfPresent(matcher);
            if (position == startPosition) {
                if (hasMore()) {
                    throw illegalCharacter(what);
                }
                throw parseError(what + " missing", null);
            }
            return token;
        }

        void consumeCharacter(char c) {
            if (!hasMore()) {
                throw parseError("'" + c + "' expected at the end", null);
            }
            if (previewChar() != c) {
                throw parseError("'" + c + "' expected but found '" + previewChar() + "' at index " +
                                 position, String.valueOf(previewChar()));
            }
            position++;
        }

        String consumeQuotedString() {
            final int startPosition = position;
            consumeCharacter('"');
            final StringBuilder valueBuilder = new StringBuilder();
            for (;;) {
                if (!hasMore()) {
                    throw parseError("unterminated quoted value", input.substring(startPosition));
                }
                final char c = previewChar();
                if (c == '"') {
                    position++;
                    return valueBuilder.toString();
                }
                if (c == '\\') {
                    position++;
                    if (!hasMore()) {
                        throw parseError("unterminated quoted value", input.substring(startPosition));
                    }
                    if (!VALUE_CHAR_MATCHER.matches(previewChar())) {
                        throw illegalCharacter("quoted value");
                    }
                    valueBuilder.append(previewChar());
                    position++;
                } else if (QUOTED_TEXT_MATCHER.matches(c)) {
                    valueBuilder.append(c);
                    position++;
                } else {
                    throw illegalCharacter("quoted value");
                }
            }
        }

        char previewChar() {
            return input.charAt(position);
        }

        boolean hasMore() {
            return position < input.length();
        }

        MediaTypeRejectedException illegalCharacter(String what) {
            final char c = previewChar();
            return parseError("illegal character '" + c + "' in " + what + " at index " + position,
                              String.valueOf(c));
        }

        MediaTypeRejectedException parseError(String message, @Nullable String token) {
            return new MediaTypeRejectedException(RejectReason.PARSE_ERROR, token,
                                                  message + " in '" + input + '\'');
        }
    }

    private MediaTypeTokenizer() {}
}
