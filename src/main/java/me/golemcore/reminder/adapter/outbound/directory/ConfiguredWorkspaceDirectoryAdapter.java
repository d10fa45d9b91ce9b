package me.golemcore.reminder.adapter.outbound.directory;

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

import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.WorkspaceDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves channel owners from
 * {@code bot.reminders.migration.channel-workspaces.<channelId>=<workspaceId>}.
 */
@Component
public class ConfiguredWorkspaceDirectoryAdapter implements WorkspaceDirectoryPort {

    private final BotProperties properties;

    public ConfiguredWorkspaceDirectoryAdapter(BotProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> findWorkspaceForChannel(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        String workspaceId = properties.getReminders().getMigration().getChannelWorkspaces().get(channelId);
        return workspaceId == null || workspaceId.isBlank() ? Optional.empty() : Optional.of(workspaceId.trim());
    }
}
