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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Evaluates decoded certificates against a {@link ValidationRule}.
 * <p>
 * Validation does not check the issuer signature; verify the certificate's cryptographic envelope
 * before relying on a valid result.
 */
public class HealthCertificateValidator {
    private static final Logger LOG = LoggerFactory.getLogger(HealthCertificateValidator.class);

    private final ValidationRule defaultRule;

    public HealthCertificateValidator() {
        this(Clock.systemUTC());
    }

    public HealthCertificateValidator(Clock clock) {
        this(ValidationRules.defaultRule(clock));
    }

    public HealthCertificateValidator(ValidationRule defaultRule) {
        this.defaultRule = Objects.requireNonNull(defaultRule, "defaultRule");
    }

    public ValidationRule defaultRule() {
        return defaultRule;
    }

    public ValidationResult validate(HealthCertificate certificate) {
        return validate(certificate, defaultRule);
    }

    public ValidationResult validate(HealthCertificate certificate, ValidationRule rule) {
        Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(rule, "rule");
        ValidationRule.Evaluation evaluation = rule.evaluate(certificate);
        if (evaluation.satisfied()) {
            LOG.debug("[Validation] {} certificate from {} satisfies {}",
                    certificate.contentType(), certificate.issuer(), rule.tag());
            return ValidationResult.valid();
        }
        ValidationFailure failure = new ValidationFailure(evaluation.unsatisfiedRule());
        LOG.info("[Validation] {} certificate from {} failed: {}",
                certificate.contentType(), certificate.issuer(), failure.reason());
        return ValidationResult.invalid(failure);
    }
}
