/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.eudcc.common.hcert;

import tools.jackson.databind.ObjectMapper;

/**
 * Configuration of {@link HealthCertificateDecoder}.
 *
 * @param prefix                transport prefix stripped before Base45 decoding, empty to disable
 * @param maxInputLength        longest accepted input in characters
 * @param maxDecompressedLength largest accepted inflated payload in bytes
 * @param objectMapper          mapper used to bind the claims, {@code null} for the strict default
 */
public record DecoderOptions(
        String prefix,
        Integer maxInputLength,
        Integer maxDecompressedLength,
        ObjectMapper objectMapper
) {
    public static final String DEFAULT_PREFIX = "HC1:";
    /** A version 40 QR code holds at most 4296 alphanumeric characters */
    public static final int DEFAULT_MAX_INPUT_LENGTH = 16 * 1024;
    public static final int DEFAULT_MAX_DECOMPRESSED_LENGTH = 64 * 1024;

    public DecoderOptions {
        if (maxInputLength != null && maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive");
        }
        if (maxDecompressedLength != null && maxDecompressedLength <= 0) {
            throw new IllegalArgumentException("maxDecompressedLength must be positive");
        }
    }

    public static DecoderOptions defaults() {
        return new DecoderOptions(null, null, null, null);
    }

    public String prefix() {
        return prefix != null ? prefix : DEFAULT_PREFIX;
    }

    public int resolvedMaxInputLength() {
        return maxInputLength != null ? maxInputLength : DEFAULT_MAX_INPUT_LENGTH;
    }

    public int resolvedMaxDecompressedLength() {
        return maxDecompressedLength != null ? maxDecompressedLength : DEFAULT_MAX_DECOMPRESSED_LENGTH;
    }

    public DecoderOptions withPrefix(String prefix) {
        return new DecoderOptions(prefix, maxInputLength, maxDecompressedLength, objectMapper);
    }

    public DecoderOptions withMaxInputLength(int maxInputLength) {
        return new DecoderOptions(prefix, maxInputLength, maxDecompressedLength, objectMapper);
    }

    public DecoderOptions withMaxDecompressedLength(int maxDecompressedLength) {
        return new DecoderOptions(prefix, maxInputLength, maxDecompressedLength, objectMapper);
    }

    public DecoderOptions withObjectMapper(ObjectMapper objectMapper) {
        return new DecoderOptions(prefix, maxInputLength, maxDecompressedLength, objectMapper);
    }
}
