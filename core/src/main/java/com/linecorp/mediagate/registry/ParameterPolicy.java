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

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSortedMap;

import com.linecorp.mediagate.common.MediaTypeGrammar;

/**
 * The parameters a {@link RegistryEntry} allows, each with the {@link ValueConstraint} its value must
 * satisfy. A parameter which is not listed is not allowed.
 */
public final class ParameterPolicy {

    private static final ParameterPolicy NONE = new ParameterPolicy(ImmutableSortedMap.of());

    /**
     * Returns the policy which allows no parameters at all.
     */
    public static ParameterPolicy none() {
        return NONE;
    }

    /**
     * Returns the policy which allows only the specified parameter.
     */
    public static ParameterPolicy of(String name, ValueConstraint constraint) {
        return builder().add(name, constraint).build();
    }

    /**
     * Returns a new {@link Builder}.
     */
    public static Builder builder() {
        return new Builder();
    }

    private final ImmutableSortedMap<String, ValueConstraint> constraints;

    private ParameterPolicy(ImmutableSortedMap<String, ValueConstraint> constraints) {
        this.constraints = constraints;
    }

    /**
     * Returns the {@link ValueConstraint} of the specified parameter, or {@code null} if the parameter is
     * not allowed. The name is compared case-insensitively.
     */
    @Nullable
    public ValueConstraint constraint(String name) {
        requireNonNull(name, "name");
        return constraints.get(Ascii.toLowerCase(name));
    }

    /**
     * Returns the lowercase names of the allowed parameters in ascending order.
     */
    public Set<String> names() {
        return constraints.keySet();
    }

    /**
     * Returns the allowed parameters and their constraints, sorted by name.
     */
    public Map<String, ValueConstraint> constraints() {
        return constraints;
    }

    /**
     * Returns whether this policy allows no parameters.
     */
    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return this == obj ||
               obj instanceof ParameterPolicy && constraints.equals(((ParameterPolicy) obj).constraints);
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        return constraints.toString();
    }

    /**
     * Builds a {@link ParameterPolicy}.
     */
    public static final class Builder {

        private final ImmutableSortedMap.Builder<String, ValueConstraint> constraints =
                ImmutableSortedMap.naturalOrder();

        private Builder() {}

        /**
         * Allows the parameter with the specified name whose value satisfies the specified
         * {@link ValueConstraint}.
         */
        public Builder add(String name, ValueConstraint constraint) {
            requireNonNull(name, "name");
            requireNonNull(constraint, "constraint");
            checkArgument(MediaTypeGrammar.isName(name), "name: '%s' (expected: a non-empty token)", name);
            constraints.put(Ascii.toLowerCase(name), constraint);
            return this;
        }

        /**
         * Returns a newly-created {@link ParameterPolicy}.
         *
         * @throws IllegalArgumentException if the same parameter was added more than once
         */
        public ParameterPolicy build() {
            final ImmutableSortedMap<String, ValueConstraint> built = constraints.buildOrThrow();
            return built.isEmpty() ? NONE : new ParameterPolicy(built);
        }
    }
}
