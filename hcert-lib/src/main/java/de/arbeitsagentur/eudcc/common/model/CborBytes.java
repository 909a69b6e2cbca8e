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

import com.upokecenter.cbor.CBORObject;
import de.arbeitsagentur.eudcc.common.util.HexUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * An encoded CBOR data item kept as raw bytes.
 * <p>
 * Equality is defined by the exact encoding, so two items with the same value but a different
 * encoding (e.g. non-canonical integer width) are distinct.
 */
public final class CborBytes {
    private final byte[] encoded;

    private CborBytes(byte[] encoded) {
        this.encoded = encoded;
    }

    public static CborBytes of(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        return new CborBytes(encoded.clone());
    }

    public static CborBytes encode(CBORObject item) {
        Objects.requireNonNull(item, "item");
        return new CborBytes(item.EncodeToBytes());
    }

    public byte[] bytes() {
        return encoded.clone();
    }

    public int length() {
        return encoded.length;
    }

    /**
     * Decodes the stored encoding back into a CBOR item.
     *
     * @throws com.upokecenter.cbor.CBORException if the bytes are not a single well-formed item
     */
    public CBORObject decode() {
        return CBORObject.DecodeFromBytes(encoded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CborBytes other && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return HexUtils.encode(encoded);
    }
}
