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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every {@code period}, on the grid {@code start + k * period}.
 *
 * <p>
 * {@code start} may be absent while a request is being built; stores anchor it
 * to the creation instant via {@link #anchoredAt(Instant)} so the first fire is
 * one period after creation. Instants past {@code end} are never returned.
 */
@Builder(toBuilder = true)
public record IntervalTrigger(Duration period, Instant start, Instant end, Duration jitter) implements Trigger {

    public static final String TYPE = "interval";

    public IntervalTrigger {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Interval period must be positive: " + period);
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
        if (jitter != null && jitter.isNegative()) {
            throw new IllegalArgumentException("Jitter must not be negative: " + jitter);
        }
    }

    /**
     * Return a copy anchored at {@code instant} unless a start is already set.
     */
    public IntervalTrigger anchoredAt(Instant instant) {
        return start != null ? this : toBuilder().start(instant).build();
    }

    @Override
    public Instant next(Instant now) {
        Instant anchor = start != null ? start : now;
        Instant candidate;
        if (now.isBefore(anchor)) {
            candidate = anchor;
        } else {
            long elapsedPeriods = Duration.between(anchor, now).dividedBy(period);
            candidate = anchor.plus(period.multipliedBy(elapsedPeriods + 1));
        }
        if (end != null && candidate.isAfter(end)) {
            return null;
        }
        return candidate;
    }

    @Override
    public String describe() {
        return "every " + DurationFormat.compact(period);
    }
}
