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

import com.upokecenter.cbor.CBOREncodeOptions;
import com.upokecenter.cbor.CBORException;
import com.upokecenter.cbor.CBORObject;
import de.arbeitsagentur.eudcc.common.model.CryptographicEnvelope;
import de.arbeitsagentur.eudcc.common.model.HealthCertificate;
import de.arbeitsagentur.eudcc.common.model.HealthCertificateClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.zip.DataFormatException;

/**
 * Decodes HCERT strings ({@code HC1:} + Base45 + optional ZLIB + COSE_Sign1 + CBOR claims) into
 * {@link HealthCertificate}s.
 * <p>
 * Stages run strictly in order and the first failing stage ends the decode; no partial certificate is
 * ever returned. The issuer signature is not checked: use the returned
 * {@link HealthCertificate#cryptographicEnvelope()} with a verifier and the issuer's public key.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class HealthCertificateDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(HealthCertificateDecoder.class);
    // duplicate map keys keep the last value; data after the first item is rejected
    private static final CBOREncodeOptions CBOR_OPTIONS = new CBOREncodeOptions("allowduplicatekeys=true");

    private final DecoderOptions options;
    private final CoseEnvelopeExtractor envelopeExtractor;
    private final HealthCertificateMaterializer materializer;

    public HealthCertificateDecoder() {
        this(DecoderOptions.defaults());
    }

    public HealthCertificateDecoder(DecoderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.envelopeExtractor = new CoseEnvelopeExtractor();
        this.materializer = new HealthCertificateMaterializer(options.objectMapper() != null
                ? options.objectMapper()
                : HealthCertificateMaterializer.defaultObjectMapper());
    }

    /**
     * Decodes an HCERT string. The prefix is optional; the returned certificate keeps the input exactly
     * as given.
     */
    public DecodingResult decode(String base45EncodedString) {
        Objects.requireNonNull(base45EncodedString, "base45EncodedString");
        try {
            HealthCertificate certificate = decodeCertificate(base45EncodedString);
            LOG.debug("[HCERT] Decoded {} certificate issued by {}", certificate.contentType(), certificate.issuer());
            return DecodingResult.success(certificate);
        } catch (HealthCertificateDecodingException e) {
            LOG.debug("[HCERT] Decoding failed in stage {}: {}", e.kind(), e.getMessage());
            return DecodingResult.failure(e);
        }
    }

    /**
     * Decodes the UTF-8 bytes of an HCERT string, e.g. the raw content of a scanned QR code.
     */
    public DecodingResult decode(byte[] base45EncodedData) {
        Objects.requireNonNull(base45EncodedData, "base45EncodedData");
        return decode(new String(base45EncodedData, StandardCharsets.UTF_8));
    }

    private HealthCertificate decodeCertificate(String input) throws HealthCertificateDecodingException {
        if (input.length() > options.resolvedMaxInputLength()) {
            throw HealthCertificateDecodingException.inputTooLarge(input.length(), options.resolvedMaxInputLength());
        }
        byte[] transport = decodeBase45(stripPrefix(input));
        byte[] coseBytes = decompress(transport);
        CBORObject cose = decodeCbor(coseBytes);
        CryptographicEnvelope envelope = envelopeExtractor.extract(cose);
        CBORObject claimsItem = decodePayload(envelope.payload());
        HealthCertificateClaims claims = materializer.materialize(claimsItem);
        return HealthCertificate.of(claims, envelope, input);
    }

    String stripPrefix(String input) {
        String prefix = options.prefix();
        if (!prefix.isEmpty() && input.startsWith(prefix)) {
            return input.substring(prefix.length());
        }
        return input;
    }

    private byte[] decodeBase45(String text) throws HealthCertificateDecodingException {
        try {
            return Base45.decode(text);
        } catch (IllegalArgumentException e) {
            throw HealthCertificateDecodingException.base45(e);
        }
    }

    private byte[] decompress(byte[] data) throws HealthCertificateDecodingException {
        try {
            return HcertCompression.inflateIfCompressed(data, options.resolvedMaxDecompressedLength());
        } catch (DataFormatException e) {
            throw HealthCertificateDecodingException.decompression(e);
        }
    }

    private CBORObject decodeCbor(byte[] data) throws HealthCertificateDecodingException {
        if (data.length == 0) {
            throw HealthCertificateDecodingException.malformedCbor(data);
        }
        CBORObject item;
        try {
            item = CBORObject.DecodeFromBytes(data, CBOR_OPTIONS);
        } catch (CBORException e) {
            throw HealthCertificateDecodingException.cbor(e);
        }
        if (item == null) {
            throw HealthCertificateDecodingException.malformedCbor(data);
        }
        return item;
    }

    private CBORObject decodePayload(byte[] payload) throws HealthCertificateDecodingException {
        if (payload.length == 0) {
            throw HealthCertificateDecodingException.cosePayload(null);
        }
        CBORObject item;
        try {
            item = CBORObject.DecodeFromBytes(payload, CBOR_OPTIONS);
        } catch (CBORException e) {
            throw HealthCertificateDecodingException.cosePayload(e);
        }
        if (item == null) {
            throw HealthCertificateDecodingException.cosePayload(null);
        }
        return item;
    }
}
