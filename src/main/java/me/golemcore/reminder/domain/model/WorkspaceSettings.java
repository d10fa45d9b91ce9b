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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-workspace configuration, persisted in {@code workspaces/<id>.json}.
 * Read once when the workspace runtime is built.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceSettings {

    private String timezone;

    @Builder.Default
    private boolean enabled = true;

    private boolean adminOnly;

    @Builder.Default
    private List<String> admins = new ArrayList<>();

    /**
     * Whether {@code userId} may create or change reminders in this workspace.
     */
    @JsonIgnore
    public boolean isAllowed(String userId) {
        if (!adminOnly) {
            return true;
        }
        return userId != null && admins != null && admins.contains(userId);
    }
}
