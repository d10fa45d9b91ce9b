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

import me.golemcore.reminder.domain.trigger.Trigger;

import java.time.Instant;

/**
 * A decoded record of the legacy job store.
 *
 * <p>
 * Channel reminders carry {@code channelId} and no {@code guildId}; direct
 * message reminders carry {@code userId} and {@code guildId}. A {@code null}
 * {@code nextRunTime} marks a paused job.
 */
public record LegacyRecord(
        String id,
        Trigger trigger,
        Instant nextRunTime,
        String channelId,
        String userId,
        String guildId,
        String authorId,
        String message) {

    public boolean isDirectMessage() {
        return userId != null;
    }
}
