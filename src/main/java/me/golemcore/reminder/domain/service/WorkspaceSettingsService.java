package me.golemcore.reminder.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.domain.model.ReminderRequestException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.concurrent.CompletionException;

/**
 * Per-workspace settings persisted in {@code workspaces/<workspaceId>.json}.
 * Workspaces without a file get the application defaults.
 */
@Service
@Slf4j
public class WorkspaceSettingsService {

    static final String DIRECTORY = "workspaces";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    public WorkspaceSettingsService(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public WorkspaceSettings getSettings(String workspaceId) {
        requireValidId(workspaceId);
        String json;
        try {
            json = storagePort.getText(DIRECTORY, workspaceId + ".json").join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read settings of workspace " + workspaceId, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            WorkspaceSettings settings = objectMapper.readValue(json, WorkspaceSettings.class);
            if (settings.getTimezone() == null || settings.getTimezone().isBlank()) {
                settings.setTimezone(properties.getReminders().getDefaultTimezone());
            }
            if (settings.getAdmins() == null) {
                settings.setAdmins(new ArrayList<>());
            }
            return settings;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt settings file for workspace " + workspaceId, e);
        }
    }

    /**
     * Validate and persist settings. The workspace runtime must be rebuilt for
     * the new values to apply to scheduling.
     *
     * @throws ReminderRequestException
     *             if the timezone is unknown
     */
    public WorkspaceSettings saveSettings(String workspaceId, WorkspaceSettings settings) {
        requireValidId(workspaceId);
        WorkspaceSettings normalized = settings.toBuilder()
                .timezone(settings.getTimezone() == null || settings.getTimezone().isBlank()
                        ? properties.getReminders().getDefaultTimezone()
                        : settings.getTimezone().trim())
                .admins(settings.getAdmins() != null ? new ArrayList<>(settings.getAdmins()) : new ArrayList<>())
                .build();
        validateTimezone(normalized.getTimezone());

        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(normalized);
            storagePort.putTextAtomic(DIRECTORY, workspaceId + ".json", json, true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings of workspace " + workspaceId, e);
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to save settings of workspace " + workspaceId, e.getCause());
        }
        log.info("[Reminders] Saved settings for workspace {}: timezone={}, enabled={}, adminOnly={}",
                workspaceId, normalized.getTimezone(), normalized.isEnabled(), normalized.isAdminOnly());
        return normalized;
    }

    private WorkspaceSettings defaults() {
        return WorkspaceSettings.builder()
                .timezone(properties.getReminders().getDefaultTimezone())
                .build();
    }

    private static void requireValidId(String workspaceId) {
        if (!ReminderJobStore.isValidWorkspaceId(workspaceId)) {
            throw new IllegalArgumentException("Invalid workspace id: " + workspaceId);
        }
    }

    static void validateTimezone(String timezone) {
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIMEZONE, timezone,
                    "Unknown timezone: " + timezone, e);
        }
    }
}
