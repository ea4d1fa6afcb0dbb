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

import static java.util.Objects.requireNonNull;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.linecorp.mediagate.common.MediaTypeParameter;
import com.linecorp.mediagate.common.MediaTypeRejectedException;
import com.linecorp.mediagate.common.ParsedMediaType;
import com.linecorp.mediagate.common.RejectReason;

/**
 * Checks the parameters of a {@link ParsedMediaType} against a {@link MediaTypeRegistry}.
 *
 * <ul>
 *   <li>A media type without parameters is accepted whether or not it is registered, so that every media
 *       type accepted before parameter support keeps being accepted.</li>
 *   <li>A media type with parameters is accepted only if it is registered, all of its parameters are
 *       allowed by the {@link ParameterPolicy}, and all values satisfy their {@link ValueConstraint}.
 *       A single offending parameter rejects the whole media type; nothing is silently dropped.</li>
 * </ul>
 */
public final class ParameterPolicyEvaluator {

    /**
     * Evaluates the specified {@link ParsedMediaType}.
     *
     * @return the accepted {@link ParsedMediaType} whose parameter values are normalized by their
     *         {@link ValueConstraint}s
     * @throws MediaTypeRejectedException if the registry does not accept the parameters
     */
    public static ParsedMediaType evaluate(ParsedMediaType parsed, MediaTypeRegistry registry) {
        requireNonNull(parsed, "parsed");
        requireNonNull(registry, "registry");

        final List<MediaTypeParameter> parameters = parsed.parameters();
        if (parameters.isEmpty()) {
            return parsed;
        }

        final RegistryEntry entry = registry.lookup(parsed.mediaType());
        if (entry == null) {
            throw new MediaTypeRejectedException(
                    RejectReason.UNREGISTERED_TYPE_WITH_PARAMETERS, parsed.mediaType().toString(),
                    "parameters are not allowed for an unregistered media type: " + parsed.mediaType());
        }

        final ParameterPolicy policy = entry.policy();
        boolean normalized = false;
        final ImmutableList.Builder<MediaTypeParameter> builder =
                ImmutableList.builderWithExpectedSize(parameters.size());
        for (MediaTypeParameter p : parameters) {
            final ValueConstraint constraint = policy.constraint(p.name());
            if (constraint == null) {
                throw new MediaTypeRejectedException(
                        RejectReason.DISALLOWED_PARAMETER, p.name(),
                        "parameter '" + p.name() + "' is not allowed for " + parsed.mediaType() +
                        " (expected: " + policy.names() + ')');
            }
            final String value = constraint.normalize(p.value());
            if (value == null) {
                throw new MediaTypeRejectedException(
                        RejectReason.INVALID_PARAMETER_VALUE, p.value(),
                        "invalid value of parameter '" + p.name() + "' for " + parsed.mediaType() + ": '" +
                        p.value() + "' (expected: " + constraint + ')');
            }
            final MediaTypeParameter accepted = p.withValue(value);
            normalized |= accepted != p;
            builder.add(accepted);
        }

        return normalized ? parsed.withParameters(builder.build()) : parsed;
    }

    private ParameterPolicyEvaluator() {}
}
