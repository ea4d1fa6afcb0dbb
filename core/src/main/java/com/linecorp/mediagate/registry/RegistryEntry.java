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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.linecorp.mediagate.common.MediaType;

/**
 * A {@link MediaType} known to a {@link MediaTypeRegistry} and the {@link ParameterPolicy} which applies
 * when it is used with parameters.
 *
 * <p>The {@code legacy} flag marks a media type which was accepted, without parameters, before parameter
 * support existed. It is kept for auditing the historical acceptance set; it does not change any verdict,
 * because a media type without parameters is accepted whether or not it is registered.
 */
public final class RegistryEntry {

    /**
     * Creates a new instance.
     */
    public static RegistryEntry of(MediaType mediaType, ParameterPolicy policy, boolean legacy) {
        return new RegistryEntry(requireNonNull(mediaType, "mediaType"),
                                 requireNonNull(policy, "policy"), legacy);
    }

    private final MediaType mediaType;
    private final ParameterPolicy policy;
    private final boolean legacy;

    private RegistryEntry(MediaType mediaType, ParameterPolicy policy, boolean legacy) {
        this.mediaType = mediaType;
        this.policy = policy;
        this.legacy = legacy;
    }

    /**
     * Returns the {@link MediaType} this entry is keyed by.
     */
    public MediaType mediaType() {
        return mediaType;
    }

    /**
     * Returns the {@link ParameterPolicy}.
     */
    public ParameterPolicy policy() {
        return policy;
    }

    /**
     * Returns whether this media type was accepted before parameter support existed.
     */
    public boolean isLegacy() {
        return legacy;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RegistryEntry)) {
            return false;
        }
        final RegistryEntry that = (RegistryEntry) obj;
        return legacy == that.legacy && mediaType.equals(that.mediaType) && policy.equals(that.policy);
    }

    @Override
    public int hashCode() {
        return (mediaType.hashCode() * 31 + policy.hashCode()) * 31 + Boolean.hashCode(legacy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("mediaType", mediaType)
                          .add("policy", policy)
                          .add("legacy", legacy)
                          .toString();
    }
}
