package me.golemcore.reminder.domain.trigger;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.BitSet;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Year field of a cron trigger. Spring's {@code CronExpression} has no year
 * field, so years are matched separately over {@value #MIN_YEAR}..{@value #MAX_YEAR}.
 *
 * <p>
 * Accepts {@code *}, single years, ranges {@code a-b}, lists and steps
 * ({@code *}{@code /n}, {@code a-b/n}, {@code a/n}).
 */
final class YearField {

    static final int MIN_YEAR = 1970;
    static final int MAX_YEAR = 2099;

    private final BitSet years;

    private YearField(BitSet years) {
        this.years = years;
    }

    static YearField parse(String expression) {
        BitSet bits = new BitSet(MAX_YEAR - MIN_YEAR + 1);
        String normalized = expression == null ? "*" : expression.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            normalized = "*";
        }
        for (String part : normalized.split(",")) {
            parsePart(part.trim(), bits);
        }
        return new YearField(bits);
    }

    boolean matches(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR && years.get(year - MIN_YEAR);
    }

    /**
     * Smallest matching year strictly greater than {@code year}.
     */
    OptionalInt nextAfter(int year) {
        int from = Math.max(year + 1, MIN_YEAR) - MIN_YEAR;
        if (from > MAX_YEAR - MIN_YEAR) {
            return OptionalInt.empty();
        }
        int index = years.nextSetBit(from);
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(index + MIN_YEAR);
    }

    boolean isEmpty() {
        return years.isEmpty();
    }

    private static void parsePart(String part, BitSet bits) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("Empty year expression");
        }
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseNumber(part.substring(slash + 1));
            if (step <= 0) {
                throw new IllegalArgumentException("Year step must be positive: " + part);
            }
        }

        int low;
        int high;
        if ("*".equals(range)) {
            low = MIN_YEAR;
            high = MAX_YEAR;
        } else if (range.contains("-")) {
            String[] bounds = range.split("-", 2);
            low = parseYear(bounds[0]);
            high = parseYear(bounds[1]);
        } else {
            low = parseYear(range);
            high = slash >= 0 ? MAX_YEAR : low;
        }
        if (high < low) {
            throw new IllegalArgumentException("Year range is reversed: " + part);
        }
        for (int year = low; year <= high; year += step) {
            bits.set(year - MIN_YEAR);
        }
    }

    private static int parseYear(String value) {
        int year = parseNumber(value);
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException(
                    "Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ": " + value);
        }
        return year;
    }

    private static int parseNumber(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid year expression: " + value, e);
        }
    }
}
