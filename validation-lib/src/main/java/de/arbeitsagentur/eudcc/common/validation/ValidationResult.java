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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating one certificate: valid, or invalid with the rule that was not satisfied.
 */
public final class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(null);

    private final ValidationFailure failure;

    private ValidationResult(ValidationFailure failure) {
        this.failure = failure;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(ValidationFailure failure) {
        return new ValidationResult(Objects.requireNonNull(failure, "failure"));
    }

    public boolean isValid() {
        return failure == null;
    }

    public Optional<ValidationFailure> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid]" : "ValidationResult[invalid, reason=" + failure.reason() + "]";
    }
}
