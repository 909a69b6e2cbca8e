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

public record Vaccination(
        @JsonProperty(value = "tg", required = true) String diseaseAgentTargeted,
        @JsonProperty(value = "vp", required = true) String vaccineOrProphylaxis,
        @JsonProperty(value = "mp", required = true) String medicinalProduct,
        @JsonProperty(value = "ma", required = true) String marketingAuthorizationHolder,
        @JsonProperty(value = "dn", required = true) int doseNumber,
        @JsonProperty(value = "sd", required = true) int totalSeriesOfDoses,
        @JsonProperty(value = "dt", required = true) LocalDate dateOfVaccination,
        @JsonProperty(value = "co", required = true) String country,
        @JsonProperty(value = "is", required = true) String certificateIssuer,
        @JsonProperty(value = "ci", required = true) String certificateIdentifier
) implements CertificateContent {
    public Vaccination {
        Objects.requireNonNull(diseaseAgentTargeted, "tg");
        Objects.requireNonNull(vaccineOrProphylaxis, "vp");
        Objects.requireNonNull(medicinalProduct, "mp");
        Objects.requireNonNull(marketingAuthorizationHolder, "ma");
        Objects.requireNonNull(dateOfVaccination, "dt");
        Objects.requireNonNull(country, "co");
        Objects.requireNonNull(certificateIssuer, "is");
        Objects.requireNonNull(certificateIdentifier, "ci");
        if (doseNumber < 1 || totalSeriesOfDoses < 1) {
            throw new IllegalArgumentException("Dose number and total series of doses must be positive");
        }
    }

    @Override
    public ContentType type() {
        return ContentType.VACCINATION;
    }

    public boolean isSeriesComplete() {
        return doseNumber >= totalSeriesOfDoses;
    }
}
