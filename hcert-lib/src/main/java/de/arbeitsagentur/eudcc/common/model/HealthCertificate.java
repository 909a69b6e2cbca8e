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
 * A decoded EU Digital COVID Certificate.
 * <p>
 * Instances are always complete: besides the claims they carry the COSE envelope the claims were
 * signed in and the exact text the certificate was decoded from (including its {@code HC1:} prefix).
 */
public record HealthCertificate(
        String issuer,
        Instant issuedAt,
        Instant expiresAt,
        String schemaVersion,
        DateOfBirth dateOfBirth,
        Name name,
        CertificateContent content,
        CryptographicEnvelope cryptographicEnvelope,
        String base45Representation
) {
    public HealthCertificate {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(schemaVersion, "schemaVersion");
        Objects.requireNonNull(dateOfBirth, "dateOfBirth");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(cryptographicEnvelope, "cryptographicEnvelope");
        Objects.requireNonNull(base45Representation, "base45Representation");
    }

    public static HealthCertificate of(HealthCertificateClaims claims,
                                       CryptographicEnvelope envelope,
                                       String base45Representation) {
        return new HealthCertificate(
                claims.issuer(),
                claims.issuedAt(),
                claims.expiresAt(),
                claims.schemaVersion(),
                claims.dateOfBirth(),
                claims.name(),
                claims.content(),
                envelope,
                base45Representation);
    }

    public HealthCertificateClaims claims() {
        return new HealthCertificateClaims(issuer, issuedAt, expiresAt, schemaVersion, dateOfBirth, name, content);
    }

    public ContentType contentType() {
        return content.type();
    }

    /**
     * The content as the requested type, or {@code null} if the certificate carries a different kind.
     */
    public <T extends CertificateContent> T contentAs(Class<T> type) {
        return type.isInstance(content) ? type.cast(content) : null;
    }
}
