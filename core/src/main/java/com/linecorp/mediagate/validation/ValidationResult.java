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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.linecorp.mediagate.common.MediaTypeRejectedException;
import com.linecorp.mediagate.common.RejectReason;

/**
 * The result of {@link MediaTypeValidator#validate(String)}: either accepted, with the canonical media type
 * or without one when none was declared, or rejected with a {@link RejectReason}.
 */
public final class ValidationResult {

    private static final ValidationResult ACCEPTED_NONE = new ValidationResult(null, null, null, null);

    /**
     * Returns the result which accepts an empty input, i.e. no media type declared.
     */
    public static ValidationResult acceptedNone() {
        return ACCEPTED_NONE;
    }

    /**
     * Returns the result which accepts the specified canonical media type.
     */
    public static ValidationResult accepted(String canonical) {
        requireNonNull(canonical, "canonical");
        checkArgument(!canonical.isEmpty(), "canonical is empty.");
        return new ValidationResult(canonical, null, null, null);
    }

    /**
     * Returns the result which rejects the input for the specified reason.
     */
    public static ValidationResult rejected(RejectReason reason, @Nullable String offendingToken,
                                            String detail) {
        requireNonNull(reason, "reason");
        requireNonNull(detail, "detail");
        return new ValidationResult(null, reason, offendingToken, detail);
    }

    /**
     * Returns the result which rejects the input for the reason of the specified
     * {@link MediaTypeRejectedException}.
     */
    public static ValidationResult rejected(MediaTypeRejectedException cause) {
        requireNonNull(cause, "cause");
        return rejected(cause.reason(), cause.offendingToken(), cause.getMessage());
    }

    @Nullable
    private final String canonical;
    @Nullable
    private final RejectReason rejectReason;
    @Nullable
    private final String offendingToken;
    @Nullable
    private final String detail;

    private ValidationResult(@Nullable String canonical, @Nullable RejectReason rejectReason,
                             @Nullable String offendingToken, @Nullable String detail) {
        this.canonical = canonical;
        this.rejectReason = rejectReason;
        this.offendingToken = offendingToken;
        this.detail = detail;
    }

    /**
     * Returns whether the input was accepted.
     */
    public boolean isAccepted() {
        return rejectReason == null;
    }

    /**
     * Returns whether the input was rejected.
     */
    public boolean isRejected() {
        return rejectReason != null;
    }

    /**
     * Returns the canonical media type, or {@code null} if the input was rejected or declared no media type.
     */
    @Nullable
    public String canonical() {
        return canonical;
    }

    /**
     * Returns the {@link RejectReason}, or {@code null} if the input was accepted.
     */
    @Nullable
    public RejectReason rejectReason() {
        return rejectReason;
    }

    /**
     * Returns the part of the input which caused the rejection, or {@code null} if the input was accepted or
     * the rejection is not attributable to a single token.
     */
    @Nullable
    public String offendingToken() {
        return offendingToken;
    }

    /**
     * Returns the human-readable description of the rejection, or {@code null} if the input was accepted.
     */
    @Nullable
    public String detail() {
        return detail;
    }

    /**
     * Returns the canonical media type, or {@code null} if no media type was declared.
     *
     * @throws MediaTypeRejectedException if the input was rejected
     */
    @Nullable
    public String canonicalOrThrow() {
        if (rejectReason != null) {
            assert detail != null;
            throw new MediaTypeRejectedException(rejectReason, offendingToken, detail);
        }
        return canonical;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ValidationResult)) {
            return false;
        }
        final ValidationResult that = (ValidationResult) obj;
        return Objects.equals(canonical, that.canonical) &&
               rejectReason == that.rejectReason &&
               Objects.equals(offendingToken, that.offendingToken) &&
               Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonical, rejectReason, offendingToken, detail);
    }

    @Override
    public String toString() {
        if (rejectReason == null) {
            return canonical != null ? "Accepted(" + canonical + ')' : "Accepted(none)";
        }
        return MoreObjects.toStringHelper("Rejected").omitNullValues()
                          .add("reason", rejectReason)
                          .add("offendingToken", offendingToken)
                          .add("detail", detail)
                          .toString();
    }
}
