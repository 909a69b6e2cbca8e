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

import java.time.Instant;
import java.util.Objects;

/**
 * The signed claims of a health certificate, without its transport representation.
 */
public record HealthCertificateClaims(
        String issuer,
        Instant issuedAt,
        Instant expiresAt,
        String schemaVersion,
        DateOfBirth dateOfBirth,
        Name name,
        CertificateContent content
) {
    public HealthCertificateClaims {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(schemaVersion, "schemaVersion");
        Objects.requireNonNull(dateOfBirth, "dateOfBirth");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
    }
}
