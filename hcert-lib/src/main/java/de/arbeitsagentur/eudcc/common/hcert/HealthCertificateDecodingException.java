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

import de.arbeitsagentur.eudcc.common.util.HexUtils;

/**
 * Failure of one stage of the HCERT decode pipeline.
 * <p>
 * The {@link Kind} names the stage. Envelope shape errors additionally carry a
 * {@link CborProcessingError}; {@link Kind#MALFORMED_CBOR} carries the bytes that did not yield an item.
 */
public class HealthCertificateDecodingException extends Exception {

    public enum Kind {
        /** Input rejected before decoding because it exceeds the configured length */
        INPUT_TOO_LARGE,
        BASE45,
        /** ZLIB header present but the stream could not be inflated */
        DECOMPRESSION,
        CBOR,
        MALFORMED_CBOR,
        CBOR_PROCESSING,
        COSE_PAYLOAD,
        PAYLOAD_CONVERSION,
        SCHEMA
    }

    private final Kind kind;
    private final CborProcessingError processingError;
    private final byte[] offendingBytes;

    private HealthCertificateDecodingException(Kind kind,
                                               String message,
                                               Throwable cause,
                                               CborProcessingError processingError,
                                               byte[] offendingBytes) {
        super(message, cause);
        this.kind = kind;
        this.processingError = processingError;
        this.offendingBytes = offendingBytes;
    }

    public static HealthCertificateDecodingException inputTooLarge(int length, int maxLength) {
        return new HealthCertificateDecodingException(Kind.INPUT_TOO_LARGE,
                "Input of " + length + " characters exceeds the limit of " + maxLength, null, null, null);
    }

    public static HealthCertificateDecodingException base45(Throwable cause) {
        return new HealthCertificateDecodingException(Kind.BASE45,
                "Base45 decoding failed: " + cause.getMessage(), cause, null, null);
    }

    public static HealthCertificateDecodingException decompression(Throwable cause) {
        return new HealthCertificateDecodingException(Kind.DECOMPRESSION,
                "ZLIB decompression failed: " + cause.getMessage(), cause, null, null);
    }

    public static HealthCertificateDecodingException cbor(Throwable cause) {
        return new HealthCertificateDecodingException(Kind.CBOR,
                "CBOR decoding failed: " + cause.getMessage(), cause, null, null);
    }

    public static HealthCertificateDecodingException malformedCbor(byte[] data) {
        byte[] copy = data == null ? new byte[0] : data.clone();
        return new HealthCertificateDecodingException(Kind.MALFORMED_CBOR,
                "No CBOR item in data: " + HexUtils.preview(copy), null, null, copy);
    }

    public static HealthCertificateDecodingException cborProcessing(CborProcessingError error) {
        return new HealthCertificateDecodingException(Kind.CBOR_PROCESSING,
                "Not a COSE_Sign1 structure: " + error, null, error, null);
    }

    /**
     * @param cause the parser failure, or {@code null} when the payload held no CBOR item
     */
    public static HealthCertificateDecodingException cosePayload(Throwable cause) {
        String message = cause == null
                ? "COSE payload contains no CBOR item"
                : "COSE payload CBOR decoding failed: " + cause.getMessage();
        return new HealthCertificateDecodingException(Kind.COSE_PAYLOAD, message, cause, null, null);
    }

    /**
     * @param cause the conversion failure, or {@code null} when the payload is not a CBOR map
     */
    public static HealthCertificateDecodingException payloadConversion(Throwable cause) {
        String message = cause == null
                ? "COSE payload is not a CBOR map"
                : "COSE payload could not be converted: " + cause.getMessage();
        return new HealthCertificateDecodingException(Kind.PAYLOAD_CONVERSION, message, cause, null, null);
    }

    public static HealthCertificateDecodingException schema(Throwable cause) {
        return new HealthCertificateDecodingException(Kind.SCHEMA,
                "Certificate claims do not match the schema: " + cause.getMessage(), cause, null, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Envelope shape error, only set for {@link Kind#CBOR_PROCESSING}.
     */
    public CborProcessingError processingError() {
        return processingError;
    }

    /**
     * Bytes that did not contain a CBOR item, only set for {@link Kind#MALFORMED_CBOR}.
     */
    public byte[] offendingBytes() {
        return offendingBytes == null ? null : offendingBytes.clone();
    }
}
