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
 * A {@code name=value} parameter of a media type. The name is normalized to lowercase. The value is kept
 * as it was given, unquoted and unescaped.
 */
public final class MediaTypeParameter {

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if {@code name} is not a valid attribute or {@code value} contains
     *                                  a character other than visible ASCII, space and horizontal tab
     */
    public static MediaTypeParameter of(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        checkArgument(MediaTypeGrammar.isName(name), "name: '%s' (expected: a non-empty token)", name);
        checkArgument(MediaTypeGrammar.isValue(value),
                      "value: '%s' (expected: visible ASCII, space or tab)", value);
        return new MediaTypeParameter(Ascii.toLowerCase(name), value);
    }

    private final String name;
    private final String value;

    // The name must be normalized and both parts validated already.
    MediaTypeParameter(String name, String value) {
        this.name = name;
        this.value = value;
    }

    /**
     * Returns the lowercase name of this parameter.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the value of this parameter.
     */
    public String value() {
        return value;
    }

    /**
     * Returns a new parameter with the same name and the specified value.
     */
    public MediaTypeParameter withValue(String value) {
        requireNonNull(value, "value");
        if (this.value.equals(value)) {
            return this;
        }
        checkArgument(MediaTypeGrammar.isValue(value),
                      "value: '%s' (expected: visible ASCII, space or tab)", value);
        return new MediaTypeParameter(name, value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MediaTypeParameter)) {
            return false;
        }
        final MediaTypeParameter that = (MediaTypeParameter) obj;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return name + '=' + value;
    }
}
