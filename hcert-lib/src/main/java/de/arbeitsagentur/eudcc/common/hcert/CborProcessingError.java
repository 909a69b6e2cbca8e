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

/**
 * Reasons a decoded CBOR item does not have the shape of a COSE_Sign1 message.
 * Listed in the order the positions are checked.
 */
public enum CborProcessingError {
    /** The item is not a tagged array */
    CONTENT_MISSING,
    /** Position 0 is absent or not a byte string */
    PROTECTED_PARAMETER_MISSING,
    /** Position 1 is absent or not a map */
    UNPROTECTED_PARAMETER_MISSING,
    /** Position 2 is absent or not a byte string */
    PAYLOAD_PARAMETER_MISSING,
    /** Position 3 is absent or not a byte string */
    SIGNATURE_PARAMETER_MISSING
}
