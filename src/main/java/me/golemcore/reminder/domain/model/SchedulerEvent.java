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

import java.time.Instant;

/**
 * Event sent to the error-report sink by a workspace scheduler.
 */
public sealed interface SchedulerEvent permits SchedulerEvent.JobMissed, SchedulerEvent.JobErrored {

    String workspaceId();

    String jobId();

    /**
     * A scheduled instant was not evaluated within the grace period.
     */
    record JobMissed(String workspaceId, String jobId, Instant scheduledAt) implements SchedulerEvent {
    }

    /**
     * Delivery of a fired job failed.
     */
    record JobErrored(String workspaceId, String jobId, String summary) implements SchedulerEvent {
    }
}
