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

import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;
import de.arbeitsagentur.eudcc.common.model.CborBytes;
import de.arbeitsagentur.eudcc.common.model.CryptographicEnvelope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Matches a decoded CBOR item against the COSE_Sign1 layout
 * {@code Tag([protected: bstr, unprotected: map, payload: bstr, signature: bstr])}.
 * <p>
 * The tag number itself is not checked. Positions are checked in order and the first mismatch is reported.
 */
public class CoseEnvelopeExtractor {
    private static final int PROTECTED_INDEX = 0;
    private static final int UNPROTECTED_INDEX = 1;
    private static final int PAYLOAD_INDEX = 2;
    private static final int SIGNATURE_INDEX = 3;

    public CryptographicEnvelope extract(CBORObject cbor) throws HealthCertificateDecodingException {
        if (cbor == null || !cbor.isTagged() || cbor.getType() != CBORType.Array) {
            throw HealthCertificateDecodingException.cborProcessing(CborProcessingError.CONTENT_MISSING);
        }
        CBORObject contents = cbor.Untag();
        byte[] protectedHeader = byteString(contents, PROTECTED_INDEX, CborProcessingError.PROTECTED_PARAMETER_MISSING);
        Map<CborBytes, CborBytes> unprotectedHeader = encodedMap(contents, UNPROTECTED_INDEX);
        byte[] payload = byteString(contents, PAYLOAD_INDEX, CborProcessingError.PAYLOAD_PARAMETER_MISSING);
        byte[] signature = byteString(contents, SIGNATURE_INDEX, CborProcessingError.SIGNATURE_PARAMETER_MISSING);
        return new CryptographicEnvelope(protectedHeader, unprotectedHeader, payload, signature);
    }

    private byte[] byteString(CBORObject contents, int index, CborProcessingError missing)
            throws HealthCertificateDecodingException {
        CBORObject element = element(contents, index);
        if (element == null || element.getType() != CBORType.ByteString) {
            throw HealthCertificateDecodingException.cborProcessing(missing);
        }
        return element.GetByteString();
    }

    private Map<CborBytes, CborBytes> encodedMap(CBORObject contents, int index)
            throws HealthCertificateDecodingException {
        CBORObject element = element(contents, index);
        if (element == null || element.getType() != CBORType.Map) {
            throw HealthCertificateDecodingException.cborProcessing(CborProcessingError.UNPROTECTED_PARAMETER_MISSING);
        }
        Map<CborBytes, CborBytes> encoded = new LinkedHashMap<>();
        for (CBORObject key : element.getKeys()) {
            // keys equal by encoding replace earlier entries
            encoded.put(CborBytes.encode(key), CborBytes.encode(element.get(key)));
        }
        return encoded;
    }

    private CBORObject element(CBORObject contents, int index) {
        return index < contents.size() ? contents.get(index) : null;
    }
}
