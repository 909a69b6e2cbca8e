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

import java.time.OffsetDateTime;
import java.util.Objects;

public record TestResult(
        @JsonProperty(value = "tg", required = true) String diseaseAgentTargeted,
        @JsonProperty(value = "tt", required = true) String testType,
        @JsonProperty("nm") String testName,
        @JsonProperty("ma") String testDeviceIdentifier,
        @JsonProperty(value = "sc", required = true) OffsetDateTime sampleCollectedAt,
        @JsonProperty(value = "tr", required = true) String testResult,
        @JsonProperty("tc") String testingCentre,
        @JsonProperty(value = "co", required = true) String country,
        @JsonProperty(value = "is", required = true) String certificateIssuer,
        @JsonProperty(value = "ci", required = true) String certificateIdentifier
) implements CertificateContent {
    /** SNOMED CT "Not detected" */
    public static final String RESULT_NOT_DETECTED = "260415000";
    /** SNOMED CT "Detected" */
    public static final String RESULT_DETECTED = "260373001";
    /** LOINC nucleic acid amplification test */
    public static final String TYPE_NAAT = "LP6464-4";
    /** LOINC rapid antigen test */
    public static final String TYPE_RAPID_ANTIGEN = "LP217198-3";

    public TestResult {
        Objects.requireNonNull(diseaseAgentTargeted, "tg");
        Objects.requireNonNull(testType, "tt");
        Objects.requireNonNull(sampleCollectedAt, "sc");
        Objects.requireNonNull(testResult, "tr");
        Objects.requireNonNull(country, "co");
        Objects.requireNonNull(certificateIssuer, "is");
        Objects.requireNonNull(certificateIdentifier, "ci");
    }

    @Override
    public ContentType type() {
        return ContentType.TEST;
    }

    public boolean isNegative() {
        return RESULT_NOT_DETECTED.equals(testResult);
    }
}
