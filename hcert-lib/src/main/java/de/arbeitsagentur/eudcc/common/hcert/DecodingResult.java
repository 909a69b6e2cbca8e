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

import de.arbeitsagentur.eudcc.common.model.HealthCertificate;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one HCERT string: either a complete certificate or the error of the first stage
 * that failed. Never both.
 */
public final class DecodingResult {
    private final HealthCertificate certificate;
    private final HealthCertificateDecodingException error;

    private DecodingResult(HealthCertificate certificate, HealthCertificateDecodingException error) {
        this.certificate = certificate;
        this.error = error;
    }

    public static DecodingResult success(HealthCertificate certificate) {
        return new DecodingResult(Objects.requireNonNull(certificate, "certificate"), null);
    }

    public static DecodingResult failure(HealthCertificateDecodingException error) {
        return new DecodingResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return certificate != null;
    }

    public Optional<HealthCertificate> certificate() {
        return Optional.ofNullable(certificate);
    }

    public Optional<HealthCertificateDecodingException> error() {
        return Optional.ofNullable(error);
    }

    public HealthCertificate orElseThrow() throws HealthCertificateDecodingException {
        if (error != null) {
            throw error;
        }
        return certificate;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "DecodingResult[success, issuer=" + certificate.issuer() + "]"
                : "DecodingResult[failure, kind=" + error.kind() + ", message=" + error.getMessage() + "]";
    }
}
