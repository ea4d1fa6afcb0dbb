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

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Checks a media type and the content it describes before they are composed into an issuance, and reports
 * every problem found rather than stopping at the first one.
 */
public final class ContentChecker {

    private static final String DEFAULT_MEDIA_TYPE = "text/plain";

    /**
     * Returns a new {@link ContentChecker} which validates media types with the specified
     * {@link MediaTypeValidator}.
     */
    public static ContentChecker of(MediaTypeValidator validator) {
        return new ContentChecker(requireNonNull(validator, "validator"));
    }

    private final MediaTypeValidator validator;

    private ContentChecker(MediaTypeValidator validator) {
        this.validator = validator;
    }

    /**
     * Checks the specified media type and content.
     *
     * @param mediaType the media type, or {@code null} or an empty string for {@code text/plain}
     * @return the problems found, or an empty list if none
     */
    public List<String> check(@Nullable String mediaType, String content) {
        requireNonNull(content, "content");
        final String effectiveMediaType = Strings.isNullOrEmpty(mediaType) ? DEFAULT_MEDIA_TYPE : mediaType;

        final ImmutableList.Builder<String> problems = ImmutableList.builder();
        if (validator.validate(effectiveMediaType).isRejected()) {
            problems.add("Invalid mime type: " + effectiveMediaType);
        }
        try {
            DescriptionContent.toBytes(content, effectiveMediaType);
        } catch (IllegalArgumentException e) {
            problems.add("Error converting description to bytes: " + e.getMessage());
        }
        return problems.build();
    }
}
