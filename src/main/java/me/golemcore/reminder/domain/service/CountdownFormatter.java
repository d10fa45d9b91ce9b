package me.golemcore.reminder.domain.service;

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
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.trigger.DurationFormat;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders how long until a reminder fires.
 *
 * <p>
 * Two forms are available: the chat platform's relative timestamp token
 * ({@code <t:1700000000:R>}), which clients render in the reader's locale, and
 * a decomposed text form ({@code 1 day, 2 minutes}) for plain-text surfaces and
 * logs. Both return {@value #PAUSED} for a job without a next fire instant.
 */
@Service
@Slf4j
public class CountdownFormatter {

    public static final String PAUSED = "Paused";

    private static final long SECONDS_PER_MINUTE = 60;
    private static final long SECONDS_PER_HOUR = 3600;
    private static final long SECONDS_PER_DAY = 86400;

    private final Clock clock;

    public CountdownFormatter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Relative timestamp token for the job's next fire instant.
     */
    public String relative(ReminderJob job) {
        Instant next = nextOrNull(job);
        if (next == null) {
            return PAUSED;
        }
        return "<t:" + next.getEpochSecond() + ":R>";
    }

    /**
     * Days, hours and minutes until the job fires, zero parts omitted. Falls back
     * to seconds when less than a minute is left.
     */
    public String countdown(ReminderJob job) {
        Instant next = nextOrNull(job);
        if (next == null) {
            return PAUSED;
        }
        return countdown(Duration.between(clock.instant(), next));
    }

    /**
     * Decomposed form of a duration. Negative durations render as
     * {@code 0 seconds}.
     */
    public String countdown(Duration remaining) {
        long total = Math.max(0, remaining.getSeconds());
        long days = total / SECONDS_PER_DAY;
        long hours = total % SECONDS_PER_DAY / SECONDS_PER_HOUR;
        long minutes = total % SECONDS_PER_HOUR / SECONDS_PER_MINUTE;

        if (days == 0 && hours == 0 && minutes == 0) {
            return plural(total % SECONDS_PER_MINUTE, "second");
        }

        List<String> parts = new ArrayList<>(3);
        if (days > 0) {
            parts.add(plural(days, "day"));
        }
        if (hours > 0) {
            parts.add(plural(hours, "hour"));
        }
        if (minutes > 0) {
            parts.add(plural(minutes, "minute"));
        }
        return String.join(", ", parts);
    }

    /**
     * Compact form such as {@code 1d2h3m4s}, used for interval periods.
     */
    public String humanDuration(Duration duration) {
        return DurationFormat.compact(duration);
    }

    private Instant nextOrNull(ReminderJob job) {
        if (job.isPaused()) {
            return null;
        }
        if (job.getNextFireAt() == null) {
            log.warn("[Reminders] Job {} is not paused but has no next fire time (trigger: {})",
                    job.getId(), job.getTrigger() != null ? job.getTrigger().describe() : "none");
        }
        return job.getNextFireAt();
    }

    private static String plural(long value, String unit) {
        return value + " " + unit + (value == 1 ? "" : "s");
    }
}
