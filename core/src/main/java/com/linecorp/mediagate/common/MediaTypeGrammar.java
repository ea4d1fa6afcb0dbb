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

import static com.google.common.base.CharMatcher.ascii;
import static com.google.common.base.CharMatcher.javaIsoControl;

import com.google.common.base.CharMatcher;

/**
 * Character classes of the media type grammar accepted by {@link MediaTypeTokenizer}.
 *
 * <p>Every class is ASCII-only, so membership never depends on the default locale or on the
 * Unicode tables of the running JVM.
 */
public final class MediaTypeGrammar {

    /**
     * Matcher for type, subtype and parameter attributes. Restricted to letters, digits and
     * {@code !#$&-^_.+}.
     */
    static final CharMatcher NAME_MATCHER =
            CharMatcher.inRange('a', 'z')
                       .or(CharMatcher.inRange('A', 'Z'))
                       .or(CharMatcher.inRange('0', '9'))
                       .or(CharMatcher.anyOf("!#$&-^_.+"))
                       .precomputed();

    /** Matcher for a parameter value which does not need quoting. */
    static final CharMatcher TOKEN_MATCHER =
            ascii().and(javaIsoControl().negate())
                   .and(CharMatcher.isNot(' '))
                   .and(CharMatcher.noneOf("()<>@,;:\\\"/[]?="))
                   .precomputed();

    /** Matcher for a character that may appear in a parameter value, quoted or escaped. */
    static final CharMatcher VALUE_CHAR_MATCHER =
            CharMatcher.inRange(' ', '~').or(CharMatcher.is('\t')).precomputed();

    /** Matcher for an unescaped character inside a quoted string. */
    static final CharMatcher QUOTED_TEXT_MATCHER =
            VALUE_CHAR_MATCHER.and(CharMatcher.noneOf("\"\\")).precomputed();

    static final CharMatcher OPTIONAL_WHITE_SPACE = CharMatcher.anyOf(" \t");

    /**
     * Returns {@code true} if the specified string is a valid type, subtype or parameter attribute.
     */
    public static boolean isName(CharSequence value) {
        return value.length() != 0 && NAME_MATCHER.matchesAllOf(value);
    }

    /**
     * Returns {@code true} if the specified string is a non-empty token which can be written as a parameter
     * value without quotes.
     */
    public static boolean isToken(CharSequence value) {
        return value.length() != 0 && TOKEN_MATCHER.matchesAllOf(value);
    }

    /**
     * Returns {@code true} if the specified string consists only of characters a parameter value may carry,
     * i.e. visible ASCII, space and horizontal tab.
     */
    public static boolean isValue(CharSequence value) {
        return VALUE_CHAR_MATCHER.matchesAllOf(value);
    }

    private MediaTypeGrammar() {}
}
