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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date of birth with the precision allowed by the DCC schema: {@code YYYY-MM-DD}, {@code YYYY-MM},
 * {@code YYYY} or empty when unknown.
 */
public final class DateOfBirth {
    private static final Pattern FORMAT = Pattern.compile("^(?:(\\d{4})(?:-(\\d{2})(?:-(\\d{2}))?)?)?$");

    private final String value;
    private final Integer year;
    private final Integer month;
    private final Integer day;

    private DateOfBirth(String value, Integer year, Integer month, Integer day) {
        this.value = value;
        this.year = year;
        this.month = month;
        this.day = day;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DateOfBirth parse(String value) {
        Objects.requireNonNull(value, "value");
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed date of birth: '" + value + "'");
        }
        Integer year = matcher.group(1) != null ? Integer.valueOf(matcher.group(1)) : null;
        Integer month = matcher.group(2) != null ? Integer.valueOf(matcher.group(2)) : null;
        Integer day = matcher.group(3) != null ? Integer.valueOf(matcher.group(3)) : null;
        try {
            if (day != null) {
                LocalDate.of(year, month, day);
            } else if (month != null) {
                YearMonth.of(year, month);
            }
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Malformed date of birth: '" + value + "'", e);
        }
        return new DateOfBirth(value, year, month, day);
    }

    public boolean isUnknown() {
        return year == null;
    }

    public Optional<Integer> year() {
        return Optional.ofNullable(year);
    }

    public Optional<Integer> month() {
        return Optional.ofNullable(month);
    }

    /**
     * The full date, only when day precision is present.
     */
    public Optional<LocalDate> toLocalDate() {
        if (day == null) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.of(year, month, day));
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DateOfBirth other && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
