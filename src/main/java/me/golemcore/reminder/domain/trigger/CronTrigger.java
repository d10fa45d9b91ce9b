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

import lombok.Builder;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Fires on instants matching every field expression, evaluated in
 * {@code timezone} and clipped to {@code [start, end]}.
 *
 * <p>
 * Field syntax is Spring's cron syntax per field; {@code dayOfWeek} uses
 * {@code 0}/{@code 7} for Sunday and accepts {@code MON..SUN}. A {@code null}
 * field means "any", except that fields less significant than the most
 * significant field given default to their minimum: {@code minute=30} fires at
 * {@code hh:30:00} only, {@code hour=14} at {@code 14:00:00}. Order of
 * significance: year, month, day, dayOfWeek, hour, minute, second;
 * {@code dayOfWeek} itself never defaults to a fixed value.
 *
 * <p>
 * An expression that can never match (day 31 of February) makes
 * {@link #next(Instant)} return {@code null}; that is a valid state, not an
 * error.
 */
@Builder(toBuilder = true)
public record CronTrigger(
        String second,
        String minute,
        String hour,
        String day,
        String month,
        String dayOfWeek,
        String year,
        Instant start,
        Instant end,
        String timezone,
        Duration jitter) implements Trigger {

    public static final String TYPE = "cron";

    private static final int MAX_YEAR_JUMPS = YearField.MAX_YEAR - YearField.MIN_YEAR + 1;
    private static final String ANY = "*";
    private static final String[] FIELD_MINIMUMS = { ANY, "1", "1", ANY, "0", "0", "0" };

    public CronTrigger {
        Objects.requireNonNull(timezone, "timezone must not be null");
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Cron end " + end + " is before start " + start);
        }
        if (jitter != null && jitter.isNegative()) {
            throw new IllegalArgumentException("Jitter must not be negative: " + jitter);
        }
        String[] fields = effectiveFields(year, month, day, dayOfWeek, hour, minute, second);
        CronExpression.parse(toSpringExpression(fields));
        YearField.parse(fields[0]);
    }

    @Override
    public Instant next(Instant now) {
        ZoneId zone = ZoneId.of(timezone);
        String[] fields = effectiveFields(year, month, day, dayOfWeek, hour, minute, second);
        CronExpression expression = CronExpression.parse(toSpringExpression(fields));
        YearField years = YearField.parse(fields[0]);
        if (years.isEmpty()) {
            return null;
        }

        Instant from = start != null && start.isAfter(now) ? start.minusNanos(1) : now;
        ZonedDateTime cursor = from.atZone(zone);
        for (int attempt = 0; attempt < MAX_YEAR_JUMPS; attempt++) {
            ZonedDateTime candidate = expression.next(cursor);
            if (candidate == null) {
                return null;
            }
            Instant instant = candidate.toInstant();
            if (end != null && instant.isAfter(end)) {
                return null;
            }
            if (years.matches(candidate.getYear())) {
                return instant;
            }
            OptionalInt nextYear = years.nextAfter(candidate.getYear());
            if (nextYear.isEmpty()) {
                return null;
            }
            cursor = LocalDate.of(nextYear.getAsInt(), 1, 1).atStartOfDay(zone).minusNanos(1);
        }
        return null;
    }

    /**
     * Six-field Spring expression ({@code second minute hour day month dayOfWeek})
     * after defaults are applied.
     */
    public String toSpringExpression() {
        return toSpringExpression(effectiveFields(year, month, day, dayOfWeek, hour, minute, second));
    }

    @Override
    public String describe() {
        String[] fields = effectiveFields(year, month, day, dayOfWeek, hour, minute, second);
        String expression = toSpringExpression(fields);
        if (!ANY.equals(fields[0])) {
            expression += " " + fields[0];
        }
        return "cron " + expression + " (" + timezone + ")";
    }

    private static String[] effectiveFields(String... values) {
        String[] result = new String[values.length];
        boolean seen = false;
        for (int i = 0; i < values.length; i++) {
            String value = values[i];
            if (value != null && !value.isBlank()) {
                result[i] = value.trim();
                seen = true;
            } else {
                result[i] = seen ? FIELD_MINIMUMS[i] : ANY;
            }
        }
        return result;
    }

    // fields: year, month, day, dayOfWeek, hour, minute, second
    private static String toSpringExpression(String[] fields) {
        return String.join(" ", fields[6], fields[5], fields[4], fields[2], fields[1], fields[3]);
    }
}
