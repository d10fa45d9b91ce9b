package me.golemcore.reminder.scheduler;

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

import me.golemcore.reminder.domain.model.MisfirePolicy;
import me.golemcore.reminder.infrastructure.config.BotProperties;

import java.time.Duration;

/**
 * Firing rules shared by every workspace scheduler.
 *
 * @param policy
 *            what to do with instants older than {@code gracePeriod}
 * @param gracePeriod
 *            how late an instant may fire before it counts as missed
 * @param maxCatchUp
 *            upper bound on due instants examined per job and tick
 * @param sendTimeout
 *            bound on a single message sender call
 */
public record SchedulerOptions(MisfirePolicy policy, Duration gracePeriod, int maxCatchUp, Duration sendTimeout) {

    public SchedulerOptions {
        if (maxCatchUp < 1) {
            throw new IllegalArgumentException("maxCatchUp must be at least 1");
        }
    }

    public static SchedulerOptions from(BotProperties properties) {
        BotProperties.RemindersProperties reminders = properties.getReminders();
        return new SchedulerOptions(
                reminders.getMisfire().getPolicy(),
                Duration.ofSeconds(reminders.getMisfire().getGracePeriodSeconds()),
                reminders.getMisfire().getMaxCatchUp(),
                Duration.ofSeconds(reminders.getDelivery().getTimeoutSeconds()));
    }
}
