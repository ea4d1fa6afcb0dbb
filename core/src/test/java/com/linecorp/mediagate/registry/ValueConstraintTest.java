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

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.testing.EqualsTester;

import com.linecorp.mediagate.registry.ValueConstraint.Kind;

class ValueConstraintTest {

    @Test
    void exact() {
        final ValueConstraint constraint = ValueConstraint.exact("Opus");
        assertThat(constraint.kind()).isSameAs(Kind.EXACT);
        assertThat(constraint.isCaseInsensitive()).isFalse();
        assertThat(constraint.normalize("Opus")).isEqualTo("Opus");
        assertThat(constraint.normalize("opus")).isNull();
        assertThat(constraint.accepts("OPUS")).isFalse();
    }

    @Test
    void exactIgnoreCase() {
        final ValueConstraint constraint = ValueConstraint.exactIgnoreCase("Opus");
        assertThat(constraint.values()).containsExactly("opus");
        assertThat(constraint.normalize("OPUS")).isEqualTo("opus");
        assertThat(constraint.normalize("opus")).isEqualTo("opus");
        assertThat(constraint.normalize("vorbis")).isNull();
    }

    @Test
    void oneOf() {
        final ValueConstraint constraint = ValueConstraint.oneOf("opus", "vorbis");
        assertThat(constraint.kind()).isSameAs(Kind.ONE_OF);
        assertThat(constraint.accepts("opus")).isTrue();
        assertThat(constraint.accepts("vorbis")).isTrue();
        assertThat(constraint.accepts("Vorbis")).isFalse();
        assertThat(constraint.accepts("flac")).isFalse();
    }

    @Test
    void oneOfIgnoreCase() {
        final ValueConstraint constraint = ValueConstraint.oneOfIgnoreCase("UTF-8", "us-ascii");
        assertThat(constraint.values()).containsExactly("utf-8", "us-ascii");
        assertThat(constraint.normalize("US-ASCII")).isEqualTo("us-ascii");
        assertThat(constraint.normalize("utf-16")).isNull();
    }

    @Test
    void oneOfRequiresValues() {
        assertThatThrownBy(() -> ValueConstraint.oneOf()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueConstraint.oneOf(ImmutableList.of(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidValue() {
        assertThatThrownBy(() -> ValueConstraint.exact("ö")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueConstraint.oneOf("opus", "a\nb"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void anyToken() {
        final ValueConstraint constraint = ValueConstraint.anyToken();
        assertThat(constraint.kind()).isSameAs(Kind.ANY_TOKEN);
        assertThat(constraint.values()).isEmpty();
        assertThat(constraint.normalize("mp4a.40.2")).isEqualTo("mp4a.40.2");
        assertThat(constraint.normalize("AVC1")).isEqualTo("AVC1");
        assertThat(constraint.normalize("")).isNull();
        assertThat(constraint.normalize("avc1, mp4a")).isNull();

        assertThat(ValueConstraint.anyTokenIgnoreCase().normalize("AVC1")).isEqualTo("avc1");
    }

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(ValueConstraint.exact("opus"), ValueConstraint.exact("opus"))
                .addEqualityGroup(ValueConstraint.exactIgnoreCase("opus"),
                                  ValueConstraint.exactIgnoreCase("OPUS"))
                .addEqualityGroup(ValueConstraint.oneOf("opus"))
                .addEqualityGroup(ValueConstraint.oneOf("opus", "vorbis"),
                                  ValueConstraint.oneOf("vorbis", "opus"))
                .addEqualityGroup(ValueConstraint.anyToken())
                .addEqualityGroup(ValueConstraint.anyTokenIgnoreCase())
                .testEquals();
    }

    @Test
    void testToString() {
        assertThat(ValueConstraint.oneOfIgnoreCase("opus", "vorbis"))
                .hasToString("ValueConstraint{kind=ONE_OF, values=[opus, vorbis], caseInsensitive=true}");
        assertThat(ValueConstraint.anyToken())
                .hasToString("ValueConstraint{kind=ANY_TOKEN, caseInsensitive=false}");
    }
}
