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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Rule that decides when a reminder fires next.
 *
 * <p>
 * Closed union of three variants:
 * <ul>
 * <li>{@link OneShotTrigger} - fires once at a fixed instant</li>
 * <li>{@link IntervalTrigger} - fires every period, anchored to a start
 * instant</li>
 * <li>{@link CronTrigger} - fires on instants matching cron field expressions
 * in a timezone</li>
 * </ul>
 *
 * <p>
 * {@link #next(Instant)} is a pure function of its argument: calling it again
 * with the same instant returns the same result. Jitter is never part of that
 * computation; it is applied by {@link #withJitter(Instant, Random)} when a job
 * is armed.
 *
 * <p>
 * Serialized with a {@code type} tag ({@code date}, {@code interval},
 * {@code cron}).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OneShotTrigger.class, name = OneShotTrigger.TYPE),
        @JsonSubTypes.Type(value = IntervalTrigger.class, name = IntervalTrigger.TYPE),
        @JsonSubTypes.Type(value = CronTrigger.class, name = CronTrigger.TYPE)
})
public sealed interface Trigger permits OneShotTrigger, IntervalTrigger, CronTrigger {

    /**
     * Compute the next fire instant strictly after {@code now}.
     *
     * @return next fire instant, or {@code null} if the trigger will never fire
     *         again
     */
    Instant next(Instant now);

    /**
     * Upper bound of the random delay added to each armed fire instant, or
     * {@code null} for none.
     */
    default Duration jitter() {
        return null;
    }

    /**
     * Whether this trigger fires at most once.
     */
    @JsonIgnore
    default boolean isOneShot() {
        return false;
    }

    /**
     * Short human description used in listings and logs.
     */
    String describe();

    /**
     * Add a random offset in {@code [0, jitter]} to a computed fire instant.
     */
    default Instant withJitter(Instant fireAt, Random random) {
        Duration bound = jitter();
        if (fireAt == null || bound == null || bound.isZero() || bound.isNegative()) {
            return fireAt;
        }
        long boundMillis = bound.toMillis();
        long offset = (long) (random.nextDouble() * (boundMillis + 1));
        return fireAt.plusMillis(Math.min(offset, boundMillis));
    }
}
