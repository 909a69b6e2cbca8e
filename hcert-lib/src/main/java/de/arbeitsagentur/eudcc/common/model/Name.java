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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Holder name as printed ({@code fn}, {@code gn}) and in ICAO 9303 transliteration ({@code fnt}, {@code gnt}).
 */
public record Name(
        @JsonProperty("fn") String familyName,
        @JsonProperty(value = "fnt", required = true) String standardizedFamilyName,
        @JsonProperty("gn") String givenName,
        @JsonProperty("gnt") String standardizedGivenName
) {
    public Name {
        if (standardizedFamilyName == null || standardizedFamilyName.isBlank()) {
            throw new IllegalArgumentException("Standardized family name (fnt) is required");
        }
    }
}
