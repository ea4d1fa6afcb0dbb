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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;

/**
 * The system properties that affect the behavior of this library. Every property is read once when this
 * class is initialized.
 *
 * <p>A malformed value is logged at {@code WARN} level and the default is used instead.
 *
 * <p>None of the flags changes the verdict a given registry gives for a given input; they only control
 * diagnostics and where the default registry comes from.
 *
 * <ul>
 *   <li>{@code -Dcom.linecorp.mediagate.verboseExceptions=true} - fills the stack trace of
 *       {@link MediaTypeRejectedException}. Default: {@code false}</li>
 *   <li>{@code -Dcom.linecorp.mediagate.registryPath=<path>} - the JSON document the default validator
 *       loads its registry from. Default: the compiled-in registry</li>
 * </ul>
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.mediagate.";

    private static final boolean VERBOSE_EXCEPTIONS = getBoolean("verboseExceptions", false);

    @Nullable
    private static final Path REGISTRY_PATH = getAndParse("registryPath", Paths::get);

    static {
        if (VERBOSE_EXCEPTIONS) {
            logger.info("verboseExceptions: {}", VERBOSE_EXCEPTIONS);
        }
        if (REGISTRY_PATH != null) {
            logger.info("Using the media type registry at: {}", REGISTRY_PATH);
        }
    }

    /**
     * Returns whether to fill the stack trace of a {@link MediaTypeRejectedException}.
     */
    public static boolean verboseExceptions() {
        return VERBOSE_EXCEPTIONS;
    }

    /**
     * Returns the path of the JSON registry document the default validator uses, or {@code null} to use
     * the compiled-in registry.
     */
    @Nullable
    public static Path registryPath() {
        return REGISTRY_PATH;
    }

    private static boolean getBoolean(String name, boolean defaultValue) {
        return parseBoolean(name, System.getProperty(PREFIX + name), defaultValue);
    }

    @VisibleForTesting
    static boolean parseBoolean(String name, @Nullable String value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return strictlyParseBoolean(Ascii.toLowerCase(value));
        } catch (Exception e) {
            logger.warn("{}: ({}, {})", PREFIX + name, value, e.getMessage());
            return defaultValue;
        }
    }

    private static boolean strictlyParseBoolean(String val) {
        if (!val.equals(Boolean.TRUE.toString()) && !val.equals(Boolean.FALSE.toString())) {
            throw new IllegalArgumentException(String.format("%s not in \"true\" or \"false\"", val));
        }
        return Boolean.parseBoolean(val);
    }

    @Nullable
    private static <T> T getAndParse(String name, Function<String, T> parser) {
        return parse(name, System.getProperty(PREFIX + name), parser);
    }

    @Nullable
    @VisibleForTesting
    static <T> T parse(String name, @Nullable String value, Function<String, T> parser) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (Exception e) {
            logger.warn("{}: ({}, {})", PREFIX + name, value, e.getMessage());
            return null;
        }
    }

    private Flags() {}
}
