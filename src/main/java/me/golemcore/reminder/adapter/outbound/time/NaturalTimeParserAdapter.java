package me.golemcore.reminder.adapter.outbound.time;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.port.outbound.TimeParserPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the time expressions users type when creating reminders.
 *
 * <p>
 * Accepted forms, evaluated in the workspace timezone:
 * <ul>
 * <li>{@code now}</li>
 * <li>ISO-8601 date-times, with or without offset
 * ({@code 2026-05-01T09:30:00+02:00}, {@code 2026-05-01T09:30})</li>
 * <li>{@code yyyy-MM-dd HH:mm} and {@code yyyy-MM-dd HH:mm:ss}</li>
 * <li>{@code HH:mm}: today, or tomorrow if that time has passed</li>
 * <li>{@code tomorrow} and {@code tomorrow HH:mm}</li>
 * <li>relative amounts: {@code in 5 minutes}, {@code 2 hours},
 * {@code 1 day 3 hours from now}, {@code 1h30m}</li>
 * </ul>
 * Anything else is reported as unparseable.
 */
@Component
@Slf4j
public class NaturalTimeParserAdapter implements TimeParserPort {

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd[' ']['T']HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .toFormatter(Locale.ROOT);
    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");
    private static final Pattern TOMORROW = Pattern.compile("tomorrow(?:\\s+(?:at\\s+)?(\\d{1,2}):(\\d{2}))?");
    private static final Pattern RELATIVE_PART = Pattern.compile("\\G\\s*(\\d+)\\s*([a-z]+)\\s*(?:,|and)?");
    private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
            Map.entry("s", ChronoUnit.SECONDS), Map.entry("sec", ChronoUnit.SECONDS),
            Map.entry("secs", ChronoUnit.SECONDS), Map.entry("second", ChronoUnit.SECONDS),
            Map.entry("seconds", ChronoUnit.SECONDS),
            Map.entry("m", ChronoUnit.MINUTES), Map.entry("min", ChronoUnit.MINUTES),
            Map.entry("mins", ChronoUnit.MINUTES), Map.entry("minute", ChronoUnit.MINUTES),
            Map.entry("minutes", ChronoUnit.MINUTES),
            Map.entry("h", ChronoUnit.HOURS), Map.entry("hr", ChronoUnit.HOURS),
            Map.entry("hrs", ChronoUnit.HOURS), Map.entry("hour", ChronoUnit.HOURS),
            Map.entry("hours", ChronoUnit.HOURS),
            Map.entry("d", ChronoUnit.DAYS), Map.entry("day", ChronoUnit.DAYS),
            Map.entry("days", ChronoUnit.DAYS),
            Map.entry("w", ChronoUnit.WEEKS), Map.entry("week", ChronoUnit.WEEKS),
            Map.entry("weeks", ChronoUnit.WEEKS));

    private final Clock clock;

    public NaturalTimeParserAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Instant> parse(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String input = text.trim().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        if ("now".equals(input)) {
            return Optional.of(now);
        }
        try {
            Optional<Instant> absolute = parseAbsolute(text.trim(), zone);
            if (absolute.isPresent()) {
                return absolute;
            }
            Optional<Instant> dayRelative = parseDayRelative(input, zone, now);
            if (dayRelative.isPresent()) {
                return dayRelative;
            }
            return parseRelative(input, now);
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            log.debug("[TimeParser] Rejected '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Instant> parseAbsolute(String input, ZoneId zone) {
        try {
            return Optional.of(OffsetDateTime.parse(input).toInstant());
        } catch (DateTimeParseException e) {
            // not an offset date-time
        }
        try {
            return Optional.of(ZonedDateTime.parse(input).toInstant());
        } catch (DateTimeParseException e) {
            // not a zoned date-time
        }
        try {
            return Optional.of(LocalDateTime.parse(input, LOCAL_DATE_TIME).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseDayRelative(String input, ZoneId zone, Instant now) {
        ZonedDateTime localNow = now.atZone(zone);

        Matcher clock = CLOCK_TIME.matcher(input);
        if (clock.matches()) {
            LocalTime time = LocalTime.of(Integer.parseInt(clock.group(1)), Integer.parseInt(clock.group(2)));
            ZonedDateTime today = localNow.toLocalDate().atTime(time).atZone(zone);
            return Optional.of((today.toInstant().isAfter(now) ? today : today.plusDays(1)).toInstant());
        }

        Matcher tomorrow = TOMORROW.matcher(input);
        if (tomorrow.matches()) {
            if (tomorrow.group(1) == null) {
                return Optional.of(localNow.plusDays(1).toInstant());
            }
            LocalDate date = localNow.toLocalDate().plusDays(1);
            LocalTime time = LocalTime.of(Integer.parseInt(tomorrow.group(1)), Integer.parseInt(tomorrow.group(2)));
            return Optional.of(date.atTime(time).atZone(zone).toInstant());
        }
        return Optional.empty();
    }

    private Optional<Instant> parseRelative(String input, Instant now) {
        String body = input;
        if (body.startsWith("in ")) {
            body = body.substring(3);
        }
        if (body.endsWith(" from now")) {
            body = body.substring(0, body.length() - " from now".length());
        }
        body = body.trim();
        if (body.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = RELATIVE_PART.matcher(body);
        Duration total = Duration.ZERO;
        int end = 0;
        while (matcher.find()) {
            ChronoUnit unit = UNITS.get(matcher.group(2));
            if (unit == null) {
                return Optional.empty();
            }
            total = total.plus(unit.getDuration().multipliedBy(Long.parseLong(matcher.group(1))));
            end = matcher.end();
        }
        if (end != body.length() || total.isZero()) {
            return Optional.empty();
        }
        return Optional.of(now.plus(total));
    }
}
