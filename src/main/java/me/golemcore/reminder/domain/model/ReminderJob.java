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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.reminder.domain.trigger.Trigger;

import java.time.Instant;

/**
 * A scheduled reminder: trigger, delivery payload and current fire state.
 *
 * <p>
 * {@code nextFireAt == null} means the job will not fire: it was paused
 * ({@code paused == true}), or its trigger is exhausted. A one-shot job only
 * stays exhausted in a store when its delivery failed or its instant was
 * missed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReminderJob {

    private String id;
    private Trigger trigger;
    private Instant nextFireAt;
    private boolean paused;
    private DeliveryPayload payload;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastFiredAt;

    @JsonIgnore
    public boolean isDue(Instant now) {
        return !paused && nextFireAt != null && !nextFireAt.isAfter(now);
    }
}
