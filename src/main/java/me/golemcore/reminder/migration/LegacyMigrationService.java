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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.StoragePort;
import me.golemcore.reminder.port.outbound.WorkspaceDirectoryPort;
import me.golemcore.reminder.scheduler.WorkspaceRuntimeRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * One-shot migration of the legacy single job store into per-workspace stores.
 *
 * <p>
 * Every record is decoded by the decoder registered for its {@code version},
 * assigned to a workspace ({@code guild_id}, or the workspace owning its
 * {@code channel_id}) and restored under its original id. Ids already present
 * in the target store are left alone, so a pass can be repeated safely. Records
 * that cannot be decoded or placed are logged and skipped; the batch continues.
 * After a pass the legacy file is renamed to
 * {@code <name>.migrated-<yyyyMMddHHmmss>}, never deleted.
 */
@Service
@Slf4j
public class LegacyMigrationService {

    private static final DateTimeFormatter ARCHIVE_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private final Map<Integer, LegacyRecordDecoder> decoders = new HashMap<>();
    private final StoragePort storagePort;
    private final WorkspaceRuntimeRegistry registry;
    private final WorkspaceDirectoryPort workspaceDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BotProperties properties;

    public LegacyMigrationService(List<LegacyRecordDecoder> decoders, StoragePort storagePort,
            WorkspaceRuntimeRegistry registry, WorkspaceDirectoryPort workspaceDirectory,
            ObjectMapper objectMapper, Clock clock, BotProperties properties) {
        for (LegacyRecordDecoder decoder : decoders) {
            this.decoders.put(decoder.version(), decoder);
        }
        this.storagePort = storagePort;
        this.registry = registry;
        this.workspaceDirectory = workspaceDirectory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Migrate the legacy file if there is one.
     *
     * @return what happened to each record; empty if there was no legacy file
     */
    public MigrationReport migrate() {
        BotProperties.MigrationProperties migration = properties.getReminders().getMigration();
        String directory = migration.getLegacyDirectory();
        String file = migration.getLegacyFile();

        String json;
        try {
            json = storagePort.getText(directory, file).join();
        } catch (CompletionException e) {
            log.error("[Migration] Failed to read legacy store {}/{}: {}", directory, file, e.getMessage());
            return MigrationReport.empty();
        }
        if (json == null) {
            log.debug("[Migration] No legacy store at {}/{}", directory, file);
            return MigrationReport.empty();
        }

        JsonNode records;
        try {
            JsonNode root = objectMapper.readTree(json);
            records = root.isArray() ? root : root.path("jobs");
        } catch (JsonProcessingException e) {
            log.error("[Migration] Legacy store {}/{} is not valid JSON, leaving it in place: {}",
                    directory, file, e.getOriginalMessage());
            return MigrationReport.empty();
        }

        log.info("[Migration] Migrating {} legacy record(s) from {}/{}", records.size(), directory, file);
        List<String> migrated = new ArrayList<>();
        List<String> alreadyPresent = new ArrayList<>();
        List<MigrationReport.SkippedRecord> skipped = new ArrayList<>();
        ZoneId fallbackZone = ZoneId.of(properties.getReminders().getDefaultTimezone());
        Instant now = clock.instant();

        int index = 0;
        for (JsonNode node : records) {
            String label = node.hasNonNull("id") ? node.get("id").asText() : "#" + index;
            index++;
            try {
                migrateRecord(node, fallbackZone, now, migrated, alreadyPresent);
            } catch (MigrationRecordSkipped | IllegalStateException | IllegalArgumentException e) {
                log.warn("[Migration] Skipped legacy record {}: {}", label, e.getMessage());
                skipped.add(new MigrationReport.SkippedRecord(label, e.getMessage()));
            }
        }

        String archivedAs = archive(directory, file, now);
        log.info("[Migration] Done: {} migrated, {} already present, {} skipped",
                migrated.size(), alreadyPresent.size(), skipped.size());
        return new MigrationReport(migrated, alreadyPresent, skipped, archivedAs);
    }

    private void migrateRecord(JsonNode node, ZoneId fallbackZone, Instant now,
            List<String> migrated, List<String> alreadyPresent) {
        int version = node.path("version").asInt(-1);
        LegacyRecordDecoder decoder = decoders.get(version);
        if (decoder == null) {
            throw new MigrationRecordSkipped("unsupported record version " + version);
        }
        LegacyDecodeResult result = decoder.decode(node, fallbackZone, now);
        if (!result.isSuccess()) {
            throw new MigrationRecordSkipped(result.error());
        }

        LegacyRecord legacy = result.record();
        String workspaceId = resolveWorkspace(legacy)
                .orElseThrow(() -> new MigrationRecordSkipped("no workspace owns channel " + legacy.channelId()));

        ReminderJob job = toJob(legacy, workspaceId, now);
        if (registry.runtime(workspaceId).store().restore(job)) {
            migrated.add(legacy.id());
            log.debug("[Migration] Restored {} into workspace {}", legacy.id(), workspaceId);
        } else {
            alreadyPresent.add(legacy.id());
        }
    }

    private Optional<String> resolveWorkspace(LegacyRecord legacy) {
        if (legacy.guildId() != null) {
            return Optional.of(legacy.guildId());
        }
        return workspaceDirectory.findWorkspaceForChannel(legacy.channelId());
    }

    private static ReminderJob toJob(LegacyRecord legacy, String workspaceId, Instant now) {
        DeliveryTarget target = legacy.isDirectMessage()
                ? DeliveryTarget.directMessage(legacy.userId(), workspaceId)
                : DeliveryTarget.channel(legacy.channelId());
        return ReminderJob.builder()
                .id(legacy.id())
                .trigger(legacy.trigger())
                .nextFireAt(legacy.nextRunTime())
                .paused(legacy.nextRunTime() == null)
                .payload(DeliveryPayload.builder()
                        .target(target)
                        .message(legacy.message())
                        .authorId(legacy.authorId())
                        .workspaceId(workspaceId)
                        .build())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private String archive(String directory, String file, Instant now) {
        String archivedAs = file + ".migrated-" + ARCHIVE_SUFFIX.format(now);
        try {
            storagePort.moveObject(directory, file, archivedAs).join();
            log.info("[Migration] Legacy store renamed to {}/{}", directory, archivedAs);
            return archivedAs;
        } catch (CompletionException e) {
            log.error("[Migration] Failed to rename legacy store {}/{}: {}", directory, file, e.getMessage());
            return null;
        }
    }

    /**
     * A legacy record that cannot be migrated.
     */
    static class MigrationRecordSkipped extends RuntimeException {

        private static final long serialVersionUID = 1L;

        MigrationRecordSkipped(String reason) {
            super(reason);
        }
    }
}
