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

import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import com.linecorp.mediagate.common.MediaTypeGrammar;

/**
 * The values a parameter of a {@link RegistryEntry} accepts.
 *
 * <p>A case-insensitive constraint compares values after ASCII lowercasing and normalizes an accepted
 * value to lowercase. A case-sensitive constraint compares byte-for-byte and keeps the value as it is.
 *
 * <pre>{@code
 * ValueConstraint codecs = ValueConstraint.exactIgnoreCase("opus");
 * codecs.normalize("OPUS"); // "opus"
 * codecs.normalize("vorbis"); // null
 * }</pre>
 */
public final class ValueConstraint {

    /**
     * The kind of a {@link ValueConstraint}.
     */
    public enum Kind {
        /**
         * Accepts a single value.
         */
        EXACT,
        /**
         * Accepts one of the enumerated values.
         */
        ONE_OF,
        /**
         * Accepts any non-empty token.
         */
        ANY_TOKEN
    }

    private static final ValueConstraint ANY_TOKEN = new ValueConstraint(Kind.ANY_TOKEN, ImmutableSet.of(),
                                                                         false);
    private static final ValueConstraint ANY_TOKEN_IGNORE_CASE =
            new ValueConstraint(Kind.ANY_TOKEN, ImmutableSet.of(), true);

    /**
     * Returns a case-sensitive constraint which accepts only the specified value.
     */
    public static ValueConstraint exact(String value) {
        return new ValueConstraint(Kind.EXACT, ImmutableSet.of(validate(value)), false);
    }

    /**
     * Returns a case-insensitive constraint which accepts only the specified value.
     */
    public static ValueConstraint exactIgnoreCase(String value) {
        return new ValueConstraint(Kind.EXACT, ImmutableSet.of(Ascii.toLowerCase(validate(value))), true);
    }

    /**
     * Returns a case-sensitive constraint which accepts one of the specified values.
     */
    public static ValueConstraint oneOf(String... values) {
        requireNonNull(values, "values");
        return oneOf(ImmutableSet.copyOf(values), false);
    }

    /**
     * Returns a case-insensitive constraint which accepts one of the specified values.
     */
    public static ValueConstraint oneOfIgnoreCase(String... values) {
        requireNonNull(values, "values");
        return oneOf(ImmutableSet.copyOf(values), true);
    }

    /**
     * Returns a constraint which accepts one of the specified values.
     */
    public static ValueConstraint oneOf(Iterable<String> values, boolean caseInsensitive) {
        requireNonNull(values, "values");
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String value : values) {
            validate(value);
            builder.add(caseInsensitive ? Ascii.toLowerCase(value) : value);
        }
        final ImmutableSet<String> normalized = builder.build();
        checkArgument(!normalized.isEmpty(), "values is empty.");
        return new ValueConstraint(Kind.ONE_OF, normalized, caseInsensitive);
    }

    /**
     * Returns a case-sensitive constraint which accepts any non-empty token.
     */
    public static ValueConstraint anyToken() {
        return ANY_TOKEN;
    }

    /**
     * Returns a case-insensitive constraint which accepts any non-empty token and normalizes it to
     * lowercase.
     */
    public static ValueConstraint anyTokenIgnoreCase() {
        return ANY_TOKEN_IGNORE_CASE;
    }

    private static String validate(String value) {
        requireNonNull(value, "value");
        checkArgument(MediaTypeGrammar.isValue(value),
                      "value: '%s' (expected: visible ASCII, space or tab)", value);
        return value;
    }

    private final Kind kind;
    private final ImmutableSet<String> values;
    private final boolean caseInsensitive;

    private ValueConstraint(Kind kind, ImmutableSet<String> values, boolean caseInsensitive) {
        this.kind = kind;
        this.values = values;
        this.caseInsensitive = caseInsensitive;
    }

    /**
     * Returns the {@link Kind} of this constraint.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the accepted values, lowercased if this constraint is case-insensitive. Empty for
     * {@link Kind#ANY_TOKEN}.
     */
    public Set<String> values() {
        return values;
    }

    /**
     * Returns whether this constraint compares values ignoring ASCII case.
     */
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Returns the canonical form of the specified value if this constraint accepts it, or {@code null}
     * otherwise.
     */
    @Nullable
    public String normalize(String value) {
        requireNonNull(value, "value");
        final String normalized = caseInsensitive ? Ascii.toLowerCase(value) : value;
        switch (kind) {
            case EXACT:
            case ONE_OF:
                return values.contains(normalized) ? normalized : null;
            case ANY_TOKEN:
                return MediaTypeGrammar.isToken(normalized) ? normalized : null;
            default:
                throw new Error("unknown kind: " + kind);
        }
    }

    /**
     * Returns whether this constraint accepts the specified value.
     */
    public boolean accepts(String value) {
        return normalize(value) != null;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ValueConstraint)) {
            return false;
        }
        final ValueConstraint that = (ValueConstraint) obj;
        return kind == that.kind && caseInsensitive == that.caseInsensitive && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + values.hashCode()) * 31 + Boolean.hashCode(caseInsensitive);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("kind", kind)
                          .add("values", values.isEmpty() ? null : values)
                          .add("caseInsensitive", caseInsensitive)
                          .toString();
    }
}
