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

import static com.linecorp.mediagate.registry.ValueConstraint.exactIgnoreCase;
import static com.linecorp.mediagate.registry.ValueConstraint.oneOfIgnoreCase;

/**
 * The compiled-in registry. Any change to this table changes which media types with parameters are
 * accepted, and therefore the indexed data of every node, so it must be rolled out as a protocol change.
 */
final class DefaultMediaTypeRegistry {

    private static final String CODECS = "codecs";
    private static final String CHARSET = "charset";

    static final MediaTypeRegistry INSTANCE =
            MediaTypeRegistry.builder()
                             // Registered with the media type table before parameter support.
                             .addLegacy("application/ogg")
                             .addLegacy("audio/flac")
                             .addLegacy("audio/mp4")
                             .addLegacy("audio/ogg", ParameterPolicy.of(CODECS, exactIgnoreCase("opus")))
                             .addLegacy("audio/opus")
                             .addLegacy("audio/webm",
                                        ParameterPolicy.of(CODECS, oneOfIgnoreCase("opus", "vorbis")))
                             .addLegacy("video/mp4")
                             .addLegacy("video/ogg")
                             .addLegacy("video/webm")
                             // Textual content is always stored as UTF-8.
                             .add("application/json", ParameterPolicy.of(CHARSET, exactIgnoreCase("utf-8")))
                             .add("text/plain",
                                  ParameterPolicy.of(CHARSET, oneOfIgnoreCase("utf-8", "us-ascii")))
                             .build();

    private DefaultMediaTypeRegistry() {}
}
