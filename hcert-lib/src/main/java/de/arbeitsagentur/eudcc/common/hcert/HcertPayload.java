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

import com.fasterxml.jackson.annotation.JsonProperty;
import de.arbeitsagentur.eudcc.common.model.CertificateContent;
import de.arbeitsagentur.eudcc.common.model.DateOfBirth;
import de.arbeitsagentur.eudcc.common.model.HealthCertificateClaims;
import de.arbeitsagentur.eudcc.common.model.Name;
import de.arbeitsagentur.eudcc.common.model.Recovery;
import de.arbeitsagentur.eudcc.common.model.TestResult;
import de.arbeitsagentur.eudcc.common.model.Vaccination;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * CWT claim set of an HCERT as it appears after converting the CBOR payload to JSON.
 * Integer claim keys are kept in their decimal form ({@code 1} iss, {@code 4} exp, {@code 6} iat,
 * {@code -260} hcert).
 */
record HcertPayload(
        @JsonProperty(value = "1", required = true) String issuer,
        @JsonProperty(value = "6", required = true) long issuedAt,
        @JsonProperty(value = "4", required = true) long expiresAt,
        @JsonProperty(value = "-260", required = true) HcertContainer hcert
) {
    HcertPayload {
        requirePresent(issuer, "1");
        requirePresent(hcert, "-260");
    }

    HealthCertificateClaims toClaims() {
        DigitalCovidCertificate dcc = hcert.dcc();
        return new HealthCertificateClaims(
                issuer,
                Instant.ofEpochSecond(issuedAt),
                Instant.ofEpochSecond(expiresAt),
                dcc.schemaVersion(),
                dcc.dateOfBirth(),
                dcc.name(),
                dcc.content());
    }

    record HcertContainer(
            @JsonProperty(value = "1", required = true) DigitalCovidCertificate dcc
    ) {
        HcertContainer {
            requirePresent(dcc, "1");
        }
    }

    record DigitalCovidCertificate(
            @JsonProperty(value = "ver", required = true) String schemaVersion,
            @JsonProperty(value = "nam", required = true) Name name,
            @JsonProperty(value = "dob", required = true) DateOfBirth dateOfBirth,
            @JsonProperty("v") List<Vaccination> vaccinations,
            @JsonProperty("t") List<TestResult> tests,
            @JsonProperty("r") List<Recovery> recoveries
    ) {
        DigitalCovidCertificate {
            requirePresent(schemaVersion, "ver");
            requirePresent(name, "nam");
            requirePresent(dateOfBirth, "dob");
            int entries = size(vaccinations) + size(tests) + size(recoveries);
            if (entries != 1) {
                throw new IllegalArgumentException(
                        "Exactly one vaccination, test or recovery entry expected, found " + entries);
            }
            if (firstEntry(vaccinations, tests, recoveries) == null) {
                throw new IllegalArgumentException("Vaccination, test or recovery entry must not be null");
            }
        }

        CertificateContent content() {
            return firstEntry(vaccinations, tests, recoveries);
        }

        private static CertificateContent firstEntry(List<? extends CertificateContent> vaccinations,
                                                     List<? extends CertificateContent> tests,
                                                     List<? extends CertificateContent> recoveries) {
            List<CertificateContent> all = new ArrayList<>(1);
            if (vaccinations != null) {
                all.addAll(vaccinations);
            }
            if (tests != null) {
                all.addAll(tests);
            }
            if (recoveries != null) {
                all.addAll(recoveries);
            }
            return all.get(0);
        }

        private static int size(List<?> list) {
            return list == null ? 0 : list.size();
        }
    }

    private static void requirePresent(Object value, String claim) {
        if (value == null) {
            throw new IllegalArgumentException("Claim '" + claim + "' must not be null");
        }
    }
}
