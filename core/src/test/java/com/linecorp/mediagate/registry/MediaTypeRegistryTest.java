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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

import com.google.common.testing.EqualsTester;

import com.linecorp.mediagate.common.MediaType;

class MediaTypeRegistryTest {

    @Test
    void defaultLegacyTypes() {
        assertThat(MediaTypeRegistry.ofDefault().legacyTypes())
                .extracting(MediaType::toString)
                .containsExactly("application/ogg", "audio/flac", "audio/mp4", "audio/ogg", "audio/opus",
                                 "audio/webm", "video/mp4", "video/ogg", "video/webm");
    }

    @Test
    void defaultPolicies() {
        final MediaTypeRegistry registry = MediaTypeRegistry.ofDefault();
        assertThat(registry.size()).isEqualTo(11);

        final RegistryEntry ogg = registry.lookup(MediaType.of("audio", "ogg"));
        assertThat(ogg).isNotNull();
        assertThat(ogg.isLegacy()).isTrue();
        assertThat(ogg.policy().constraints())
                .containsExactly(entry("codecs", ValueConstraint.exactIgnoreCase("opus")));

        final RegistryEntry webm = registry.lookup(MediaType.of("audio", "webm"));
        assertThat(webm.policy().constraint("CODECS"))
                .isEqualTo(ValueConstraint.oneOfIgnoreCase("opus", "vorbis"));

        final RegistryEntry plainText = registry.lookup(MediaType.of("text", "plain"));
        assertThat(plainText.isLegacy()).isFalse();
        assertThat(plainText.policy().names()).containsExactly("charset");

        assertThat(registry.lookup(MediaType.of("video", "mp4")).policy().isEmpty()).isTrue();
        assertThat(registry.lookup(MediaType.of("image", "jpeg"))).isNull();
    }

    @Test
    void entriesAreSorted() {
        final MediaTypeRegistry registry = MediaTypeRegistry.builder()
                                                            .add("video/webm")
                                                            .addLegacy("audio/ogg")
                                                            .add("audio/flac")
                                                            .build();
        assertThat(registry.entries()).extracting(e -> e.mediaType().toString())
                                      .containsExactly("audio/flac", "audio/ogg", "video/webm");
        assertThat(registry.legacyTypes()).containsExactly(MediaType.of("audio", "ogg"));
    }

    @Test
    void lookupIgnoresCaseOfRegisteredType() {
        final MediaTypeRegistry registry = MediaTypeRegistry.builder().add("Audio/OGG").build();
        assertThat(registry.lookup(MediaType.of("audio", "ogg"))).isNotNull();
    }

    @Test
    void duplicateMediaType() {
        assertThatThrownBy(() -> MediaTypeRegistry.builder().add("audio/ogg").addLegacy("AUDIO/ogg"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate media type: audio/ogg");
    }

    @Test
    void invalidMediaType() {
        assertThatThrownBy(() -> MediaTypeRegistry.builder().add("audio/ogg;codecs=opus"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MediaTypeRegistry.builder().add("audio/*"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyBuilder() {
        assertThat(MediaTypeRegistry.builder().build()).isSameAs(MediaTypeRegistry.empty());
        assertThat(MediaTypeRegistry.empty().size()).isZero();
    }

    @Test
    void parameterPolicy() {
        final ParameterPolicy policy = ParameterPolicy.builder()
                                                      .add("Rate", ValueConstraint.anyToken())
                                                      .add("codecs", ValueConstraint.exact("opus"))
                                                      .build();
        assertThat(policy.names()).containsExactly("codecs", "rate");
        assertThat(policy.constraint("RATE")).isSameAs(ValueConstraint.anyToken());
        assertThat(policy.constraint("channels")).isNull();

        assertThat(ParameterPolicy.builder().build()).isSameAs(ParameterPolicy.none());
        assertThat(ParameterPolicy.none().isEmpty()).isTrue();
    }

    @Test
    void parameterPolicyRejectsDuplicates() {
        assertThatThrownBy(() -> ParameterPolicy.builder()
                                                .add("codecs", ValueConstraint.exact("opus"))
                                                .add("CODECS", ValueConstraint.exact("vorbis"))
                                                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParameterPolicy.of("co decs", ValueConstraint.anyToken()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(MediaTypeRegistry.builder().addLegacy("audio/ogg").build(),
                                  MediaTypeRegistry.builder().addLegacy("AUDIO/OGG").build())
                .addEqualityGroup(MediaTypeRegistry.builder().add("audio/ogg").build())
                .addEqualityGroup(MediaTypeRegistry.builder()
                                                   .addLegacy("audio/ogg",
                                                              ParameterPolicy.of("codecs",
                                                                                 ValueConstraint.anyToken()))
                                                   .build())
                .addEqualityGroup(MediaTypeRegistry.empty())
                .testEquals();
    }
}
