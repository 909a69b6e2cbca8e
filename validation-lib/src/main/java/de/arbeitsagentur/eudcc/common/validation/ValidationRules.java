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
package de.arbeitsagentur.eudcc.common.validation;

import de.arbeitsagentur.eudcc.common.model.ContentType;
import de.arbeitsagentur.eudcc.common.model.HealthCertificate;
import de.arbeitsagentur.eudcc.common.model.Recovery;
import de.arbeitsagentur.eudcc.common.model.TestResult;
import de.arbeitsagentur.eudcc.common.model.Vaccination;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Predefined rules for EU Digital COVID Certificates.
 * <p>
 * Time-dependent rules read "now" from the given {@link Clock}; content rules are not satisfied by
 * certificates of another content type.
 */
public final class ValidationRules {
    /** Maximum age of a NAAT (PCR) sample */
    public static final Duration DEFAULT_NAAT_MAX_AGE = Duration.ofHours(72);
    /** Maximum age of a rapid antigen sample */
    public static final Duration DEFAULT_RAPID_ANTIGEN_MAX_AGE = Duration.ofHours(48);

    private ValidationRules() {
    }

    public static ValidationRule isVaccination() {
        return ValidationRule.of("isVaccination", certificate -> certificate.contentType() == ContentType.VACCINATION);
    }

    public static ValidationRule isTest() {
        return ValidationRule.of("isTest", certificate -> certificate.contentType() == ContentType.TEST);
    }

    public static ValidationRule isRecovery() {
        return ValidationRule.of("isRecovery", certificate -> certificate.contentType() == ContentType.RECOVERY);
    }

    public static ValidationRule isIssuedBy(String issuer) {
        Objects.requireNonNull(issuer, "issuer");
        return ValidationRule.of("isIssuedBy(" + issuer + ")", certificate -> issuer.equals(certificate.issuer()));
    }

    public static ValidationRule isIssuedInPast(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isIssuedInPast", certificate -> !certificate.issuedAt().isAfter(clock.instant()));
    }

    public static ValidationRule isNotExpired(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isNotExpired", certificate -> clock.instant().isBefore(certificate.expiresAt()));
    }

    /**
     * The last dose of the vaccination series has been given.
     */
    public static ValidationRule isFullyImmunized() {
        return ValidationRule.of("isFullyImmunized", certificate -> {
            Vaccination vaccination = certificate.contentAs(Vaccination.class);
            return vaccination != null && vaccination.isSeriesComplete();
        });
    }

    /**
     * At least {@code minimumAge} has passed since the (UTC) start of the vaccination day.
     */
    public static ValidationRule isVaccinationOlderThan(Duration minimumAge, Clock clock) {
        Objects.requireNonNull(minimumAge, "minimumAge");
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isVaccinationOlderThan(" + minimumAge + ")", certificate -> {
            Vaccination vaccination = certificate.contentAs(Vaccination.class);
            return vaccination != null
                    && !startOfDay(vaccination.dateOfVaccination()).plus(minimumAge).isAfter(clock.instant());
        });
    }

    public static ValidationRule isTestedNegative() {
        return ValidationRule.of("isTestedNegative", certificate -> {
            TestResult test = certificate.contentAs(TestResult.class);
            return test != null && test.isNegative();
        });
    }

    /**
     * The sample was taken no longer ago than allowed for its test type and not in the future.
     */
    public static ValidationRule isTestWithinMaxAge(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isTestWithinMaxAge", certificate -> {
            TestResult test = certificate.contentAs(TestResult.class);
            return test != null && isSampleWithin(test, maxAge(test), clock);
        });
    }

    public static ValidationRule isTestWithinMaxAge(Duration maxAge, Clock clock) {
        Objects.requireNonNull(maxAge, "maxAge");
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isTestWithinMaxAge(" + maxAge + ")", certificate -> {
            TestResult test = certificate.contentAs(TestResult.class);
            return test != null && isSampleWithin(test, maxAge, clock);
        });
    }

    /**
     * Today (UTC) lies within the recovery certificate's validity period, both ends inclusive.
     */
    public static ValidationRule isRecoveryValid(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return ValidationRule.of("isRecoveryValid", certificate -> {
            Recovery recovery = certificate.contentAs(Recovery.class);
            if (recovery == null) {
                return false;
            }
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            return !today.isBefore(recovery.validFrom()) && !today.isAfter(recovery.validUntil());
        });
    }

    public static ValidationRule defaultRule() {
        return defaultRule(Clock.systemUTC());
    }

    /**
     * The certificate is issued and not expired, and its content is acceptable: a completed vaccination
     * series, a recent negative test or a currently valid recovery.
     */
    public static ValidationRule defaultRule(Clock clock) {
        ValidationRule contentIsAcceptable = ValidationRule.when(isVaccination(),
                isFullyImmunized(),
                ValidationRule.when(isTest(),
                        isTestedNegative().and(isTestWithinMaxAge(clock)),
                        ValidationRule.when(isRecovery(),
                                isRecoveryValid(clock),
                                ValidationRule.constant(false))));
        return isIssuedInPast(clock)
                .and(isNotExpired(clock))
                .and(contentIsAcceptable);
    }

    private static Duration maxAge(TestResult test) {
        return TestResult.TYPE_RAPID_ANTIGEN.equals(test.testType())
                ? DEFAULT_RAPID_ANTIGEN_MAX_AGE
                : DEFAULT_NAAT_MAX_AGE;
    }

    private static boolean isSampleWithin(TestResult test, Duration maxAge, Clock clock) {
        Instant sampledAt = test.sampleCollectedAt().toInstant();
        Instant now = clock.instant();
        return !sampledAt.isAfter(now) && !sampledAt.plus(maxAge).isBefore(now);
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
