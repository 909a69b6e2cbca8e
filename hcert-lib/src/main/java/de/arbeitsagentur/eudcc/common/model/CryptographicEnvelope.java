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
package de.arbeitsagentur.eudcc.common.model;

import com.upokecenter.cbor.CBORException;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The COSE_Sign1 structure a health certificate was shipped in.
 * <p>
 * Exposes everything an external verifier needs: the protected header and payload that were signed,
 * the signature, and the {@code Sig_structure} that has to be checked against the issuer's key.
 * Signature verification itself is not performed here.
 */
public final class CryptographicEnvelope {
    /** CBOR tag of an untagged-by-context COSE_Sign1 message (RFC 9052) */
    public static final int COSE_SIGN1_TAG = 18;
    private static final int HEADER_ALG = 1;
    private static final int HEADER_KID = 4;
    private static final String SIGNATURE1_CONTEXT = "Signature1";

    private final byte[] protectedHeader;
    private final Map<CborBytes, CborBytes> unprotectedHeader;
    private final byte[] payload;
    private final byte[] signature;

    public CryptographicEnvelope(byte[] protectedHeader,
                                 Map<CborBytes, CborBytes> unprotectedHeader,
                                 byte[] payload,
                                 byte[] signature) {
        this.protectedHeader = Objects.requireNonNull(protectedHeader, "protectedHeader").clone();
        this.unprotectedHeader = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(unprotectedHeader, "unprotectedHeader")));
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.signature = Objects.requireNonNull(signature, "signature").clone();
    }

    public byte[] protectedHeader() {
        return protectedHeader.clone();
    }

    /**
     * Unprotected header entries as encoded key to encoded value, in the order the CBOR decoder reported them.
     */
    public Map<CborBytes, CborBytes> unprotectedHeader() {
        return unprotectedHeader;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public byte[] signature() {
        return signature.clone();
    }

    /**
     * COSE algorithm identifier (header label 1), protected header first.
     */
    public Optional<Integer> algorithm() {
        return headerValue(HEADER_ALG)
                .filter(value -> value.getType() == CBORType.Integer && value.CanValueFitInInt32())
                .map(CBORObject::AsInt32Value);
    }

    /**
     * Key identifier (header label 4), protected header first.
     */
    public Optional<byte[]> keyIdentifier() {
        return headerValue(HEADER_KID)
                .filter(value -> value.getType() == CBORType.ByteString)
                .map(CBORObject::GetByteString);
    }

    /**
     * The encoded {@code Sig_structure} for a COSE_Sign1 message without external AAD:
     * {@code ["Signature1", protected, h'', payload]}.
     */
    public byte[] signatureStructure() {
        CBORObject structure = CBORObject.NewArray();
        structure.Add(SIGNATURE1_CONTEXT);
        structure.Add(CBORObject.FromObject(protectedHeader));
        structure.Add(CBORObject.FromObject(new byte[0]));
        structure.Add(CBORObject.FromObject(payload));
        return structure.EncodeToBytes();
    }

    /**
     * Re-encodes the envelope as a tagged COSE_Sign1 item.
     */
    public byte[] encode() {
        CBORObject unprotected = CBORObject.NewMap();
        for (Map.Entry<CborBytes, CborBytes> entry : unprotectedHeader.entrySet()) {
            unprotected.set(entry.getKey().decode(), entry.getValue().decode());
        }
        CBORObject message = CBORObject.NewArray();
        message.Add(CBORObject.FromObject(protectedHeader));
        message.Add(unprotected);
        message.Add(CBORObject.FromObject(payload));
        message.Add(CBORObject.FromObject(signature));
        return CBORObject.FromObjectAndTag(message, COSE_SIGN1_TAG).EncodeToBytes();
    }

    private Optional<CBORObject> headerValue(int label) {
        CBORObject key = CBORObject.FromObject(label);
        CBORObject protectedMap = decodeProtectedHeader();
        if (protectedMap != null && protectedMap.ContainsKey(key)) {
            return Optional.of(protectedMap.get(key));
        }
        CborBytes value = unprotectedHeader.get(CborBytes.encode(key));
        return value == null ? Optional.empty() : Optional.of(value.decode());
    }

    private CBORObject decodeProtectedHeader() {
        // an empty bstr stands for an empty header map
        if (protectedHeader.length == 0) {
            return null;
        }
        try {
            CBORObject decoded = CBORObject.DecodeFromBytes(protectedHeader);
            return decoded.getType() == CBORType.Map ? decoded : null;
        } catch (CBORException e) {
            return null;
        }
    }
}
