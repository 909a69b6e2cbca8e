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

import java.time.LocalDate;
import java.util.Objects;

public record Recovery(
        @JsonProperty(value = "tg", required = true) String diseaseAgentTargeted,
        @JsonProperty(value = "fr", required = true) LocalDate firstPositiveTestResult,
        @JsonProperty(value = "co", required = true) String country,
        @JsonProperty(value = "is", required = true) String certificateIssuer,
        @JsonProperty(value = "df", required = true) LocalDate validFrom,
        @JsonProperty(value = "du", required = true) LocalDate validUntil,
        @JsonProperty(value = "ci", required = true) String certificateIdentifier
) implements CertificateContent {
    public Recovery {
        Objects.requireNonNull(diseaseAgentTargeted, "tg");
        Objects.requireNonNull(firstPositiveTestResult, "fr");
        Objects.requireNonNull(country, "co");
        Objects.requireNonNull(certificateIssuer, "is");
        Objects.requireNonNull(validFrom, "df");
        Objects.requireNonNull(validUntil, "du");
        Objects.requireNonNull(certificateIdentifier, "ci");
        if (validUntil.isBefore(validFrom)) {
            throw new IllegalArgumentException("Recovery validity ends before it starts");
        }
    }

    @Override
    public ContentType type() {
        return ContentType.RECOVERY;
    }
}
