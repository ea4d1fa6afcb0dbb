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

/**
 * The reason why a media type was rejected. Every reason is terminal; validating the same input again
 * always yields the same reason.
 */
public enum RejectReason {
    /**
     * The input is longer than {@value MediaTypeTokenizer#MAX_LENGTH} bytes in UTF-8.
     */
    TOO_LONG,
    /**
     * The input does not follow the media type grammar.
     */
    PARSE_ERROR,
    /**
     * The same parameter attribute appears more than once, compared case-insensitively.
     */
    DUPLICATE_PARAMETER,
    /**
     * The type and subtype have no registry entry, but parameters were specified.
     */
    UNREGISTERED_TYPE_WITH_PARAMETERS,
    /**
     * A parameter attribute is not allowed by the registry entry.
     */
    DISALLOWED_PARAMETER,
    /**
     * A parameter value does not satisfy the constraint of the registry entry.
     */
    INVALID_PARAMETER_VALUE
}
