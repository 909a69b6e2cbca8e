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

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A tagged predicate over a {@link HealthCertificate}.
 * <p>
 * Rules form a tree of {@link Leaf} predicates joined by {@link And}, {@link Or}, {@link Not} and
 * {@link Conditional}. Evaluating the tree yields the rule that made it fail, so a failed composite
 * reports the concrete condition instead of itself. Rules are immutable and can be shared freely.
 */
public interface ValidationRule {

    /**
     * Human-readable identifier, reported as the failure reason.
     */
    String tag();

    Evaluation evaluate(HealthCertificate certificate);

    default boolean test(HealthCertificate certificate) {
        return evaluate(certificate).satisfied();
    }

    default ValidationRule and(ValidationRule other) {
        return new And(this, other);
    }

    default ValidationRule or(ValidationRule other) {
        return new Or(this, other);
    }

    default ValidationRule negate() {
        return new Not(this);
    }

    static ValidationRule of(String tag, Predicate<HealthCertificate> predicate) {
        return new Leaf(tag, predicate);
    }

    static ValidationRule constant(boolean value) {
        return new Leaf(String.valueOf(value), certificate -> value);
    }

    static ValidationRule not(ValidationRule rule) {
        return new Not(rule);
    }

    /**
     * Evaluates {@code then} if {@code condition} holds, {@code otherwise} if not.
     */
    static ValidationRule when(ValidationRule condition, ValidationRule then, ValidationRule otherwise) {
        return new Conditional(condition, then, otherwise);
    }

    /**
     * Outcome of one evaluation. {@code unsatisfiedRule} is {@code null} exactly when the rule held.
     */
    record Evaluation(boolean satisfied, ValidationRule unsatisfiedRule) {
        private static final Evaluation SATISFIED = new Evaluation(true, null);

        public Evaluation {
            if (satisfied == (unsatisfiedRule != null)) {
                throw new IllegalArgumentException("An unsatisfied evaluation must name the unsatisfied rule, and only then");
            }
        }

        public static Evaluation passed() {
            return SATISFIED;
        }

        public static Evaluation failed(ValidationRule rule) {
            return new Evaluation(false, Objects.requireNonNull(rule, "rule"));
        }
    }

    record Leaf(String tag, Predicate<HealthCertificate> predicate) implements ValidationRule {
        public Leaf {
            requireTag(tag);
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public Evaluation evaluate(HealthCertificate certificate) {
            return predicate.test(certificate) ? Evaluation.passed() : Evaluation.failed(this);
        }

        @Override
        public String toString() {
            return tag;
        }
    }

    /**
     * Short-circuit conjunction; a failure is attributed to the first operand that failed.
     */
    record And(ValidationRule left, ValidationRule right) implements ValidationRule {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String tag() {
            return "(" + left.tag() + " && " + right.tag() + ")";
        }

        @Override
        public Evaluation evaluate(HealthCertificate certificate) {
            Evaluation first = left.evaluate(certificate);
            if (!first.satisfied()) {
                return first;
            }
            return right.evaluate(certificate);
        }

        @Override
        public String toString() {
            return tag();
        }
    }

    /**
     * Short-circuit disjunction; when both operands fail the left operand's failure is reported.
     */
    record Or(ValidationRule left, ValidationRule right) implements ValidationRule {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String tag() {
            return "(" + left.tag() + " || " + right.tag() + ")";
        }

        @Override
        public Evaluation evaluate(HealthCertificate certificate) {
            Evaluation first = left.evaluate(certificate);
            if (first.satisfied() || right.evaluate(certificate).satisfied()) {
                return Evaluation.passed();
            }
            return first;
        }

        @Override
        public String toString() {
            return tag();
        }
    }

    /**
     * Negation. A satisfied inner rule has no failing leaf, so the negation reports itself.
     */
    record Not(ValidationRule inner) implements ValidationRule {
        public Not {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String tag() {
            return "!" + inner.tag();
        }

        @Override
        public Evaluation evaluate(HealthCertificate certificate) {
            return inner.evaluate(certificate).satisfied() ? Evaluation.failed(this) : Evaluation.passed();
        }

        @Override
        public String toString() {
            return tag();
        }
    }

    record Conditional(ValidationRule condition, ValidationRule then, ValidationRule otherwise)
            implements ValidationRule {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }

        @Override
        public String tag() {
            return "(" + condition.tag() + " ? " + then.tag() + " : " + otherwise.tag() + ")";
        }

        @Override
        public Evaluation evaluate(HealthCertificate certificate) {
            return condition.evaluate(certificate).satisfied()
                    ? then.evaluate(certificate)
                    : otherwise.evaluate(certificate);
        }

        @Override
        public String toString() {
            return tag();
        }
    }

    private static void requireTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("Validation rule tag must not be blank");
        }
    }
}
