package me.golemcore.reminder.domain.model;

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

/**
 * Cron reminder schedule as requested. Unset fields follow the defaulting
 * rules of {@link me.golemcore.reminder.domain.trigger.CronTrigger}.
 */
@Builder
public record CronSchedule(
        String second,
        String minute,
        String hour,
        String day,
        String month,
        String dayOfWeek,
        String year,
        String startText,
        String endText,
        String timezone,
        Duration jitter) {
}
