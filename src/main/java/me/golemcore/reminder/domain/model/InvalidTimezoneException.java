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

/**
 * A workspace is configured with a timezone that does not exist. Its runtime
 * refuses to start.
 */
public class InvalidTimezoneException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String workspaceId;
    private final String timezone;

    public InvalidTimezoneException(String workspaceId, String timezone, Throwable cause) {
        super("Workspace " + workspaceId + " has an unknown timezone: " + timezone, cause);
        this.workspaceId = workspaceId;
        this.timezone = timezone;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getTimezone() {
        return timezone;
    }
}
