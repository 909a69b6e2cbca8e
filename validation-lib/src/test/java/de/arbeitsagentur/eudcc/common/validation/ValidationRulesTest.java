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

import de.arbeitsagentur.eudcc.common.model.HealthCertificate;
import de.arbeitsagentur.eudcc.common.model.Recovery;
import de.arbeitsagentur.eudcc.common.model.TestResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.CLOCK;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.NOW;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.TODAY;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.certificate;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.recovery;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.test;
import static de.arbeitsagentur.eudcc.common.validation.CertificateFixtures.vaccination;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationRulesTest {

    @Nested
    class ContentType {

        @Test
        void matchesExactlyOneContentRule() {
            HealthCertificate vaccinated = CertificateFixtures.fullyVaccinated();
            HealthCertificate tested = certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED, NOW));
            HealthCertificate recovered = certificate(recovery(TODAY.minusDays(10), TODAY.plusDays(100)));

            assertThat(ValidationRules.isVaccination().test(vaccinated)).isTrue();
            assertThat(ValidationRules.isTest().test(vaccinated)).isFalse();
            assertThat(ValidationRules.isTest().test(tested)).isTrue();
            assertThat(ValidationRules.isRecovery().test(tested)).isFalse();
            assertThat(ValidationRules.isRecovery().test(recovered)).isTrue();
        }

        @Test
        void contentRulesFailOnOtherContentTypes() {
            HealthCertificate tested = certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED, NOW));

            assertThat(ValidationRules.isFullyImmunized().test(tested)).isFalse();
            assertThat(ValidationRules.isRecoveryValid(CLOCK).test(tested)).isFalse();
            assertThat(ValidationRules.isTestedNegative().test(CertificateFixtures.fullyVaccinated())).isFalse();
        }
    }

    @Nested
    class Validity {

        @Test
        void issuedInPastAllowsNow() {
            assertThat(ValidationRules.isIssuedInPast(CLOCK).test(certificate(vaccination(2, 2, TODAY), NOW, NOW.plusSeconds(60))))
                    .isTrue();
            assertThat(ValidationRules.isIssuedInPast(CLOCK).test(certificate(vaccination(2, 2, TODAY), NOW.plusSeconds(1), NOW.plusSeconds(60))))
                    .isFalse();
        }

        @Test
        void expiresAtTheExpiryInstant() {
            HealthCertificate expiringNow = certificate(vaccination(2, 2, TODAY), NOW.minusSeconds(60), NOW);
            HealthCertificate expiringLater = certificate(vaccination(2, 2, TODAY), NOW.minusSeconds(60), NOW.plusSeconds(1));

            assertThat(ValidationRules.isNotExpired(CLOCK).test(expiringNow)).isFalse();
            assertThat(ValidationRules.isNotExpired(CLOCK).test(expiringLater)).isTrue();
        }

        @Test
        void matchesIssuer() {
            assertThat(ValidationRules.isIssuedBy("AT").test(CertificateFixtures.fullyVaccinated())).isTrue();
            assertThat(ValidationRules.isIssuedBy("DE").test(CertificateFixtures.fullyVaccinated())).isFalse();
        }
    }

    @Nested
    class Vaccinations {

        @ParameterizedTest
        @CsvSource({"1,2,false", "2,2,true", "3,2,true", "1,1,true"})
        void fullyImmunizedWhenSeriesIsComplete(int doseNumber, int totalSeriesOfDoses, boolean expected) {
            HealthCertificate certificate = certificate(vaccination(doseNumber, totalSeriesOfDoses, TODAY));

            assertThat(ValidationRules.isFullyImmunized().test(certificate)).isEqualTo(expected);
        }

        @Test
        void comparesVaccinationAge() {
            ValidationRule rule = ValidationRules.isVaccinationOlderThan(Duration.ofDays(14), CLOCK);

            assertThat(rule.test(certificate(vaccination(2, 2, TODAY.minusDays(15))))).isTrue();
            assertThat(rule.test(certificate(vaccination(2, 2, TODAY.minusDays(13))))).isFalse();
            assertThat(rule.tag()).isEqualTo("isVaccinationOlderThan(PT336H)");
        }
    }

    @Nested
    class Tests {

        @Test
        void negativeOnlyWhenNotDetected() {
            HealthCertificate negative = certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED, NOW));
            HealthCertificate positive = certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_DETECTED, NOW));

            assertThat(ValidationRules.isTestedNegative().test(negative)).isTrue();
            assertThat(ValidationRules.isTestedNegative().test(positive)).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "LP6464-4, 71, true",
                "LP6464-4, 73, false",
                "LP217198-3, 47, true",
                "LP217198-3, 49, false",
                "OTHER, 71, true"
        })
        void limitsSampleAgeByTestType(String type, long hoursAgo, boolean expected) {
            HealthCertificate certificate = certificate(
                    test(type, TestResult.RESULT_NOT_DETECTED, NOW.minus(Duration.ofHours(hoursAgo))));

            assertThat(ValidationRules.isTestWithinMaxAge(CLOCK).test(certificate)).isEqualTo(expected);
        }

        @Test
        void rejectsSamplesFromTheFuture() {
            HealthCertificate certificate = certificate(
                    test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED, NOW.plusSeconds(3600)));

            assertThat(ValidationRules.isTestWithinMaxAge(CLOCK).test(certificate)).isFalse();
        }

        @Test
        void acceptsCustomMaxAge() {
            HealthCertificate certificate = certificate(
                    test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED, NOW.minus(Duration.ofHours(30))));

            assertThat(ValidationRules.isTestWithinMaxAge(Duration.ofHours(24), CLOCK).test(certificate)).isFalse();
            assertThat(ValidationRules.isTestWithinMaxAge(Duration.ofHours(36), CLOCK).test(certificate)).isTrue();
        }

        @Test
        void sampleTimeIsRequired() {
            assertThatThrownBy(() -> new TestResult("840539006", TestResult.TYPE_NAAT, null, "1232", null,
                    TestResult.RESULT_NOT_DETECTED, "Testing centre Vienna 1", "AT", "Ministry of Health, Austria",
                    "URN:UVCI:01:AT:71EE2559DE38C6BF7304FB65A1A451EC#3"))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("sc");
        }
    }

    @Nested
    class Recoveries {

        @Test
        void validWithinInclusivePeriod() {
            ValidationRule rule = ValidationRules.isRecoveryValid(CLOCK);

            assertThat(rule.test(certificate(recovery(TODAY, TODAY)))).isTrue();
            assertThat(rule.test(certificate(recovery(TODAY.minusDays(100), TODAY.minusDays(1))))).isFalse();
            assertThat(rule.test(certificate(recovery(TODAY.plusDays(1), TODAY.plusDays(100))))).isFalse();
        }

        @Test
        void validityDatesAreRequired() {
            assertThatThrownBy(() -> new Recovery("840539006", TODAY.minusDays(20), "AT",
                    "Ministry of Health, Austria", null, TODAY, "URN:UVCI:01:AT:858CC18CFCF5965EF82F60E493349AA5#K"))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("df");
            assertThatThrownBy(() -> new Recovery("840539006", TODAY.minusDays(20), "AT",
                    "Ministry of Health, Austria", TODAY, null, "URN:UVCI:01:AT:858CC18CFCF5965EF82F60E493349AA5#K"))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("du");
        }
    }

    @Nested
    class DefaultRule {
        private final ValidationRule rule = ValidationRules.defaultRule(CLOCK);

        @Test
        void acceptsEveryAcceptableContentType() {
            assertThat(rule.test(CertificateFixtures.fullyVaccinated())).isTrue();
            assertThat(rule.test(certificate(test(TestResult.TYPE_RAPID_ANTIGEN, TestResult.RESULT_NOT_DETECTED,
                    NOW.minus(Duration.ofHours(5)))))).isTrue();
            assertThat(rule.test(certificate(recovery(TODAY.minusDays(10), TODAY.plusDays(170))))).isTrue();
        }

        @Test
        void reportsTheFailingCondition() {
            assertThat(rule.evaluate(certificate(vaccination(1, 2, TODAY))).unsatisfiedRule().tag())
                    .isEqualTo("isFullyImmunized");
            assertThat(rule.evaluate(certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_DETECTED, NOW)))
                    .unsatisfiedRule().tag()).isEqualTo("isTestedNegative");
            assertThat(rule.evaluate(certificate(test(TestResult.TYPE_NAAT, TestResult.RESULT_NOT_DETECTED,
                    NOW.minus(Duration.ofDays(4))))).unsatisfiedRule().tag()).isEqualTo("isTestWithinMaxAge");
            assertThat(rule.evaluate(certificate(recovery(TODAY.minusDays(200), TODAY.minusDays(20))))
                    .unsatisfiedRule().tag()).isEqualTo("isRecoveryValid");
        }

        @Test
        void checksValidityBeforeContent() {
            HealthCertificate expiredAndIncomplete = certificate(vaccination(1, 2, TODAY),
                    NOW.minus(Duration.ofDays(400)), NOW.minus(Duration.ofDays(35)));
            HealthCertificate notYetIssued = certificate(vaccination(2, 2, TODAY),
                    NOW.plus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(365)));

            assertThat(rule.evaluate(expiredAndIncomplete).unsatisfiedRule().tag()).isEqualTo("isNotExpired");
            assertThat(rule.evaluate(notYetIssued).unsatisfiedRule().tag()).isEqualTo("isIssuedInPast");
        }
    }
}
