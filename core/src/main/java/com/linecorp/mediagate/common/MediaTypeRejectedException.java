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

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

/**
 * An {@link IllegalArgumentException} raised when a media type is rejected by the tokenizer or by the
 * parameter policy of a registry.
 *
 * <p>The stack trace is filled only when {@link Flags#verboseExceptions()} is enabled, because rejections
 * are expected while validating untrusted input.
 */
public final class MediaTypeRejectedException extends IllegalArgumentException {

    private static final long serialVersionUID = -3160215845104427466L;

    private final RejectReason reason;

    @Nullable
    private final String offendingToken;

    /**
     * Creates a new instance.
     *
     * @param reason the {@link RejectReason}
     * @param offendingToken the part of the input which caused the rejection, if known
     * @param message the detail message
     */
    public MediaTypeRejectedException(RejectReason reason, @Nullable String offendingToken,
                                      String message) {
        super(requireNonNull(message, "message"));
        this.reason = requireNonNull(reason, "reason");
        this.offendingToken = offendingToken;
    }

    /**
     * Returns the {@link RejectReason}.
     */
    public RejectReason reason() {
        return reason;
    }

    /**
     * Returns the part of the input which caused the rejection, or {@code null} if the rejection is not
     * attributable to a single token, e.g. {@link RejectReason#TOO_LONG}.
     */
    @Nullable
    public String offendingToken() {
        return offendingToken;
    }

    @Override
    public Throwable fillInStackTrace() {
        if (Flags.verboseExceptions()) {
            super.fillInStackTrace();
        }
        return this;
    }
}
