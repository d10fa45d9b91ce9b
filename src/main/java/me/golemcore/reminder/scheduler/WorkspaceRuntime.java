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

import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.domain.service.ReminderJobStore;

import java.time.ZoneId;

/**
 * Live state of one workspace: the settings read when it was opened, its
 * resolved timezone, its job store and its scheduler.
 */
public record WorkspaceRuntime(
        String workspaceId,
        WorkspaceSettings settings,
        ZoneId zone,
        ReminderJobStore store,
        WorkspaceScheduler scheduler) {
}
