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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.google.common.testing.EqualsTester;

import com.linecorp.mediagate.common.MediaTypeRejectedException;
import com.linecorp.mediagate.common.RejectReason;

class ValidationResultTest {

    @Test
    void accepted() {
        final ValidationResult result = ValidationResult.accepted("audio/ogg;codecs=opus");
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.isRejected()).isFalse();
        assertThat(result.canonical()).isEqualTo("audio/ogg;codecs=opus");
        assertThat(result.rejectReason()).isNull();
        assertThat(result.offendingToken()).isNull();
        assertThat(result.detail()).isNull();
        assertThat(result).hasToString("Accepted(audio/ogg;codecs=opus)");

        assertThatThrownBy(() -> ValidationResult.accepted("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptedNone() {
        final ValidationResult result = ValidationResult.acceptedNone();
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.canonical()).isNull();
        assertThat(result).hasToString("Accepted(none)");
    }

    @Test
    void rejected() {
        final ValidationResult result = ValidationResult.rejected(
                new MediaTypeRejectedException(RejectReason.DISALLOWED_PARAMETER, "rate", "not allowed"));
        assertThat(result.isAccepted()).isFalse();
        assertThat(result.isRejected()).isTrue();
        assertThat(result.canonical()).isNull();
        assertThat(result.rejectReason()).isSameAs(RejectReason.DISALLOWED_PARAMETER);
        assertThat(result.offendingToken()).isEqualTo("rate");
        assertThat(result.detail()).isEqualTo("not allowed");
        assertThat(result).hasToString(
                "Rejected{reason=DISALLOWED_PARAMETER, offendingToken=rate, detail=not allowed}");

        assertThatThrownBy(result::canonicalOrThrow)
                .isInstanceOf(MediaTypeRejectedException.class)
                .hasMessage("not allowed");
    }

    @Test
    void rejectedWithoutOffendingToken() {
        final ValidationResult result = ValidationResult.rejected(RejectReason.TOO_LONG, null, "too long");
        assertThat(result.offendingToken()).isNull();
        assertThat(result).hasToString("Rejected{reason=TOO_LONG, detail=too long}");
    }

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(ValidationResult.acceptedNone())
                .addEqualityGroup(ValidationResult.accepted("image/jpeg"),
                                  ValidationResult.accepted("image/jpeg"))
                .addEqualityGroup(ValidationResult.accepted("image/png"))
                .addEqualityGroup(ValidationResult.rejected(RejectReason.TOO_LONG, null, "too long"),
                                  ValidationResult.rejected(new MediaTypeRejectedException(
                                          RejectReason.TOO_LONG, null, "too long")))
                .addEqualityGroup(ValidationResult.rejected(RejectReason.PARSE_ERROR, null, "too long"))
                .addEqualityGroup(ValidationResult.rejected(RejectReason.PARSE_ERROR, "x", "too long"))
                .testEquals();
    }
}
