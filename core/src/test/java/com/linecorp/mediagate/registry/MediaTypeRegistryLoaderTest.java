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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.linecorp.mediagate.common.MediaType;

class MediaTypeRegistryLoaderTest {

    private static final String DEFAULT_TABLE_JSON =
            '{' +
            "  \"entries\": [" +
            "    { \"type\": \"application/ogg\", \"legacy\": true }," +
            "    { \"type\": \"audio/flac\", \"legacy\": true }," +
            "    { \"type\": \"audio/mp4\", \"legacy\": true }," +
            "    { \"type\": \"audio/ogg\", \"legacy\": true, \"parameters\": {" +
            "        \"codecs\": { \"kind\": \"exact\", \"values\": [\"opus\"]," +
            "                    \"caseInsensitive\": true } } }," +
            "    { \"type\": \"audio/opus\", \"legacy\": true }," +
            "    { \"type\": \"audio/webm\", \"legacy\": true, \"parameters\": {" +
            "        \"codecs\": { \"kind\": \"oneOf\", \"values\": [\"opus\", \"vorbis\"]," +
            "                    \"caseInsensitive\": true } } }," +
            "    { \"type\": \"video/mp4\", \"legacy\": true }," +
            "    { \"type\": \"video/ogg\", \"legacy\": true }," +
            "    { \"type\": \"video/webm\", \"legacy\": true }," +
            "    { \"type\": \"application/json\", \"parameters\": {" +
            "        \"charset\": { \"kind\": \"exact\", \"values\": [\"utf-8\"]," +
            "                     \"caseInsensitive\": true } } }," +
            "    { \"type\": \"text/plain\", \"parameters\": {" +
            "        \"charset\": { \"kind\": \"oneOf\", \"values\": [\"utf-8\", \"us-ascii\"]," +
            "                     \"caseInsensitive\": true } } }" +
            "  ]" +
            '}';

    @Test
    void loadResource() throws IOException {
        final MediaTypeRegistry registry;
        try (InputStream in = MediaTypeRegistryLoaderTest.class.getResourceAsStream(
                "/registry/test-registry.json")) {
            assertThat(in).isNotNull();
            registry = MediaTypeRegistryLoader.load(in);
        }

        assertThat(registry.size()).isEqualTo(4);
        assertThat(registry.legacyTypes()).containsExactly(MediaType.of("audio", "ogg"),
                                                           MediaType.of("audio", "opus"),
                                                           MediaType.of("video", "mp4"));

        assertThat(registry.lookup(MediaType.of("audio", "ogg")).policy().constraint("codecs"))
                .isEqualTo(ValueConstraint.oneOfIgnoreCase("opus", "vorbis", "flac"));
        final ParameterPolicy mp4 = registry.lookup(MediaType.of("video", "mp4")).policy();
        assertThat(mp4.constraint("codecs")).isSameAs(ValueConstraint.anyToken());
        assertThat(mp4.constraint("profiles")).isEqualTo(ValueConstraint.exact("isom"));

        final RegistryEntry plainText = registry.lookup(MediaType.of("text", "plain"));
        assertThat(plainText.isLegacy()).isFalse();
        assertThat(plainText.policy().constraint("charset"))
                .isEqualTo(ValueConstraint.exactIgnoreCase("utf-8"));
    }

    @Test
    void compiledInTableRoundTrip() {
        assertThat(MediaTypeRegistryLoader.load(DEFAULT_TABLE_JSON)).isEqualTo(MediaTypeRegistry.ofDefault());
    }

    @Test
    void loadFile(@TempDir Path tempDir) throws IOException {
        final Path file = tempDir.resolve("registry.json");
        Files.write(file, "{ \"entries\": [ { \"type\": \"audio/flac\" } ] }".getBytes(StandardCharsets.UTF_8));
        final MediaTypeRegistry registry = MediaTypeRegistryLoader.load(file);
        assertThat(registry.entries()).containsExactly(
                RegistryEntry.of(MediaType.of("audio", "flac"), ParameterPolicy.none(), false));
    }

    @Test
    void loadMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> MediaTypeRegistryLoader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void emptyEntries() {
        assertThat(MediaTypeRegistryLoader.load("{\"entries\":[]}")).isSameAs(MediaTypeRegistry.empty());
    }

    @Test
    void malformedJson() {
        assertThatThrownBy(() -> MediaTypeRegistryLoader.load("{\"entries\": ["))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("malformed media type registry:")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[]",
            "{}",
            "{\"entries\": {}}",
            "{\"entries\": [1]}",
            "{\"entries\": [{}]}",
            "{\"entries\": [{\"type\": 1}]}",
            "{\"entries\": [{\"type\": \"audio\"}]}",
            "{\"entries\": [{\"type\": \"audio/ogg;codecs=opus\"}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"legacy\": \"yes\"}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\"}, {\"type\": \"Audio/Ogg\"}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": []}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": \"opus\"}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": {}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": {\"kind\": \"regex\"}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": {\"kind\": \"exact\"}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": " +
            "{\"kind\": \"exact\", \"values\": [\"opus\", \"vorbis\"]}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": " +
            "{\"kind\": \"oneOf\", \"values\": []}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": " +
            "{\"kind\": \"anyToken\", \"values\": [\"opus\"]}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": {\"codecs\": " +
            "{\"kind\": \"oneOf\", \"values\": [\"opus\", 1]}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": " +
            "{\"co decs\": {\"kind\": \"anyToken\"}}}]}",
            "{\"entries\": [{\"type\": \"audio/ogg\", \"parameters\": " +
            "{\"codecs\": {\"kind\": \"anyToken\"}, \"CODECS\": {\"kind\": \"anyToken\"}}}]}"
    })
    void invalidRegistry(String json) {
        assertThatThrownBy(() -> MediaTypeRegistryLoader.load(json))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateJsonKeys() {
        assertThatThrownBy(() -> MediaTypeRegistryLoader.load(
                "{\"entries\": [{\"type\": \"audio/ogg\", \"type\": \"audio/opus\"}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("malformed media type registry:");
    }
}
