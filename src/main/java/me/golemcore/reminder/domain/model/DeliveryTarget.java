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

/**
 * Where a reminder is delivered: a channel, or a direct message to a user of a
 * workspace. Exactly one of {@code channelId} and {@code userId} is set.
 */
public record DeliveryTarget(String channelId, String userId, String workspaceId) {

    public DeliveryTarget {
        boolean hasChannel = channelId != null && !channelId.isBlank();
        boolean hasUser = userId != null && !userId.isBlank();
        if (hasChannel == hasUser) {
            throw new IllegalArgumentException("Delivery target needs exactly one of channelId or userId");
        }
        if (hasUser && (workspaceId == null || workspaceId.isBlank())) {
            throw new IllegalArgumentException("Direct message target needs a workspaceId");
        }
    }

    public static DeliveryTarget channel(String channelId) {
        return new DeliveryTarget(channelId, null, null);
    }

    public static DeliveryTarget directMessage(String userId, String workspaceId) {
        return new DeliveryTarget(null, userId, workspaceId);
    }

    @JsonIgnore
    public boolean isDirectMessage() {
        return userId != null && !userId.isBlank();
    }

    @Override
    public String toString() {
        return isDirectMessage() ? "user:" + userId + "@" + workspaceId : "channel:" + channelId;
    }
}
