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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Suppliers;

import com.linecorp.mediagate.common.Flags;
import com.linecorp.mediagate.common.MediaTypeCanonicalizer;
import com.linecorp.mediagate.common.MediaTypeRejectedException;
import com.linecorp.mediagate.common.MediaTypeTokenizer;
import com.linecorp.mediagate.common.ParsedMediaType;
import com.linecorp.mediagate.registry.MediaTypeRegistry;
import com.linecorp.mediagate.registry.MediaTypeRegistryLoader;
import com.linecorp.mediagate.registry.ParameterPolicyEvaluator;

/**
 * Validates a raw media type string and returns its canonical form. This is the only entry point the
 * issuance composer and the chain indexer should use, so that both reach the same verdict for the same
 * input.
 *
 * <pre>{@code
 * MediaTypeValidator validator = MediaTypeValidator.of(MediaTypeRegistry.ofDefault());
 * validator.validate("audio/ogg;codecs=OPUS").canonical(); // "audio/ogg;codecs=opus"
 * validator.validate("image/jpeg").canonical(); // "image/jpeg"
 * validator.validate("").canonical(); // null, i.e. no media type
 * validator.validate("audio/ogg;codecs=opus;x=1").rejectReason(); // DISALLOWED_PARAMETER
 * }</pre>
 *
 * <p>{@link #validate(String)} is a pure function of its input and the {@link MediaTypeRegistry} given at
 * construction. It performs no I/O, keeps no state between calls and may be called from any number of
 * threads concurrently.
 */
public final class MediaTypeValidator {

    private static final Logger logger = LoggerFactory.getLogger(MediaTypeValidator.class);

    private static final Supplier<MediaTypeValidator> defaultValidator =
            Suppliers.memoize(() -> new MediaTypeValidator(defaultRegistry()));

    /**
     * Returns a new validator which evaluates parameters against the specified {@link MediaTypeRegistry}.
     */
    public static MediaTypeValidator of(MediaTypeRegistry registry) {
        return new MediaTypeValidator(requireNonNull(registry, "registry"));
    }

    /**
     * Returns the validator which uses the registry at {@link Flags#registryPath()}, or the compiled-in
     * registry if the flag is not set. The registry is loaded on first use, and a failed load is retried
     * on the next call.
     *
     * @throws UncheckedIOException if failed to read the registry at {@link Flags#registryPath()}
     */
    public static MediaTypeValidator ofDefault() {
        return defaultValidator.get();
    }

    private static MediaTypeRegistry defaultRegistry() {
        return defaultRegistry(Flags.registryPath());
    }

    @VisibleForTesting
    static MediaTypeRegistry defaultRegistry(@Nullable Path path) {
        if (path == null) {
            return MediaTypeRegistry.ofDefault();
        }
        try {
            return MediaTypeRegistryLoader.load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load the media type registry: " + path, e);
        }
    }

    private final MediaTypeRegistry registry;

    private MediaTypeValidator(MediaTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Returns the {@link MediaTypeRegistry} of this validator.
     */
    public MediaTypeRegistry registry() {
        return registry;
    }

    /**
     * Validates the specified media type string.
     *
     * @param raw the media type string as submitted or as embedded in the transaction data. An empty string
     *            means no media type was declared and is always accepted.
     */
    public ValidationResult validate(String raw) {
        requireNonNull(raw, "raw");
        if (raw.isEmpty()) {
            return ValidationResult.acceptedNone();
        }

        try {
            final ParsedMediaType parsed = MediaTypeTokenizer.tokenize(raw);
            final ParsedMediaType accepted = ParameterPolicyEvaluator.evaluate(parsed, registry);
            return ValidationResult.accepted(MediaTypeCanonicalizer.canonicalize(accepted));
        } catch (MediaTypeRejectedException e) {
            logger.debug("Rejected a media type: {}, {}", e.reason(), e.getMessage());
            return ValidationResult.rejected(e);
        }
    }

    @Override
    public String toString() {
        return "MediaTypeValidator(" + registry.size() + " registry entries)";
    }
}
