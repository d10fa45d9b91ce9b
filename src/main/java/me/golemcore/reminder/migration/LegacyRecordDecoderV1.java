package me.golemcore.reminder.migration;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.reminder.domain.trigger.CronTrigger;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.OneShotTrigger;
import me.golemcore.reminder.domain.trigger.Trigger;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decoder for version 1 records of the legacy job store.
 *
 * <p>
 * A record looks like:
 *
 * <pre>
 * {
 *   "version": 1,
 *   "id": "d552452a0d664fdf8f02160e9b36330d",
 *   "func": "discord_reminder_bot.main:send_to_discord",
 *   "name": "send_to_discord",
 *   "kwargs": {"channel_id": 8696, "message": "Feed the cat", "author_id": 1264},
 *   "trigger": {"type": "cron", "hour": "14", "minute": "0", "timezone": "Europe/Stockholm"},
 *   "next_run_time": "2025-11-02T14:00:00+01:00"
 * }
 * </pre>
 *
 * <p>
 * Direct message records carry {@code user_id} and {@code guild_id} in
 * {@code kwargs} instead of {@code channel_id}. Trigger types are
 * {@code date} ({@code run_date}), {@code interval} ({@code weeks},
 * {@code days}, {@code hours}, {@code minutes}, {@code seconds},
 * {@code start_date}, {@code end_date}) and {@code cron}. Cron
 * {@code day_of_week} numbers count from Monday = 0 and are rewritten as day
 * names; the {@code week} field has no equivalent and makes the record
 * undecodable.
 */
@Component
public class LegacyRecordDecoderV1 implements LegacyRecordDecoder {

    private static final String[] DAY_NAMES = { "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN" };

    @Override
    public int version() {
        return 1;
    }

    @Override
    public LegacyDecodeResult decode(JsonNode node, ZoneId fallbackZone, Instant now) {
        String id = text(node, "id");
        if (id == null) {
            return LegacyDecodeResult.failure(null, "missing id");
        }
        try {
            JsonNode kwargs = node.path("kwargs");
            String message = text(kwargs, "message");
            if (message == null) {
                return LegacyDecodeResult.failure(id, "missing kwargs.message");
            }
            String channelId = text(kwargs, "channel_id");
            String userId = text(kwargs, "user_id");
            String guildId = text(kwargs, "guild_id");
            if (channelId == null && userId == null) {
                return LegacyDecodeResult.failure(id, "kwargs has neither channel_id nor user_id");
            }
            if (userId != null && guildId == null) {
                return LegacyDecodeResult.failure(id, "direct message record without guild_id");
            }

            JsonNode triggerNode = node.path("trigger");
            ZoneId zone = zone(triggerNode, fallbackZone);
            Instant nextRunTime = instant(text(node, "next_run_time"), zone);
            Trigger trigger = trigger(triggerNode, zone, nextRunTime, now);

            return LegacyDecodeResult.success(new LegacyRecord(id, trigger, nextRunTime,
                    userId != null ? null : channelId, userId, guildId, text(kwargs, "author_id"), message));
        } catch (IllegalArgumentException | DateTimeException e) {
            return LegacyDecodeResult.failure(id, e.getMessage());
        }
    }

    private Trigger trigger(JsonNode node, ZoneId zone, Instant nextRunTime, Instant now) {
        String type = text(node, "type");
        if (type == null) {
            throw new IllegalArgumentException("missing trigger type");
        }
        return switch (type) {
        case "date" -> {
            Instant runDate = instant(text(node, "run_date"), zone);
            if (runDate == null) {
                throw new IllegalArgumentException("date trigger without run_date");
            }
            yield new OneShotTrigger(runDate);
        }
        case "interval" -> interval(node, zone, nextRunTime, now);
        case "cron" -> cron(node, zone);
        default -> throw new IllegalArgumentException("unknown trigger type: " + type);
        };
    }

    private IntervalTrigger interval(JsonNode node, ZoneId zone, Instant nextRunTime, Instant now) {
        Duration period = Duration.ofDays(7L * node.path("weeks").asLong(0))
                .plusDays(node.path("days").asLong(0))
                .plusHours(node.path("hours").asLong(0))
                .plusMinutes(node.path("minutes").asLong(0))
                .plusSeconds(node.path("seconds").asLong(0));
        Instant start = instant(text(node, "start_date"), zone);
        if (start == null) {
            start = nextRunTime != null ? nextRunTime : now;
        }
        return IntervalTrigger.builder()
                .period(period)
                .start(start)
                .end(instant(text(node, "end_date"), zone))
                .jitter(jitter(node))
                .build();
    }

    private CronTrigger cron(JsonNode node, ZoneId zone) {
        String week = text(node, "week");
        if (week != null && !"*".equals(week)) {
            throw new IllegalArgumentException("cron week field is not supported: " + week);
        }
        String day = text(node, "day");
        if (day != null && "last".equalsIgnoreCase(day)) {
            day = "L";
        }
        return CronTrigger.builder()
                .year(text(node, "year"))
                .month(text(node, "month"))
                .day(day)
                .dayOfWeek(dayOfWeek(text(node, "day_of_week")))
                .hour(text(node, "hour"))
                .minute(text(node, "minute"))
                .second(text(node, "second"))
                .start(instant(text(node, "start_date"), zone))
                .end(instant(text(node, "end_date"), zone))
                .timezone(zone.getId())
                .jitter(jitter(node))
                .build();
    }

    /**
     * Rewrite a day-of-week expression counting from Monday = 0 into day names,
     * so that it no longer depends on the numbering convention.
     */
    static String dayOfWeek(String expression) {
        if (expression == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : expression.split(",")) {
            String[] stepSplit = part.trim().split("/", 2);
            String base = stepSplit[0];
            String converted;
            if ("*".equals(base)) {
                converted = base;
            } else {
                String[] bounds = base.split("-", 2);
                converted = dayName(bounds[0]) + (bounds.length > 1 ? "-" + dayName(bounds[1]) : "");
            }
            parts.add(stepSplit.length > 1 ? converted + "/" + stepSplit[1] : converted);
        }
        return String.join(",", parts);
    }

    private static String dayName(String token) {
        String value = token.trim().toUpperCase(Locale.ROOT);
        if (value.matches("\\d+")) {
            int index = Integer.parseInt(value);
            if (index > 6) {
                throw new IllegalArgumentException("day_of_week out of range: " + token);
            }
            return DAY_NAMES[index];
        }
        for (String name : DAY_NAMES) {
            if (name.equals(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("unsupported day_of_week: " + token);
    }

    private static ZoneId zone(JsonNode trigger, ZoneId fallbackZone) {
        String timezone = text(trigger, "timezone");
        if (timezone == null) {
            return fallbackZone;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown timezone: " + timezone, e);
        }
    }

    private static Duration jitter(JsonNode node) {
        JsonNode jitter = node.get("jitter");
        if (jitter == null || jitter.isNull()) {
            return null;
        }
        return Duration.ofSeconds(jitter.asLong());
    }

    static Instant instant(String value, ZoneId zone) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(normalized).atZone(zone).toInstant();
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("unreadable timestamp: " + value, inner);
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
