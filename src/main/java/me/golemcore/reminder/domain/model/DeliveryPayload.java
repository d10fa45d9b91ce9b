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

/**
 * What a reminder delivers and on whose behalf. Closed set of fields;
 * {@code workspaceId} is optional.
 */
@Builder(toBuilder = true)
public record DeliveryPayload(DeliveryTarget target, String message, String authorId, String workspaceId) {

    /**
     * Merge the non-null fields of {@code update} over this payload.
     */
    public DeliveryPayload mergedWith(DeliveryPayload update) {
        if (update == null) {
            return this;
        }
        return new DeliveryPayload(
                update.target() != null ? update.target() : target,
                update.message() != null ? update.message() : message,
                update.authorId() != null ? update.authorId() : authorId,
                update.workspaceId() != null ? update.workspaceId() : workspaceId);
    }
}
