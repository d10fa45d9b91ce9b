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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.domain.model.InvalidTimezoneException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.domain.service.ReminderJobStore;
import me.golemcore.reminder.domain.service.WorkspaceSettingsService;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.ErrorReportPort;
import me.golemcore.reminder.port.outbound.MessageSenderPort;
import me.golemcore.reminder.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the live {@link WorkspaceRuntime} of every workspace.
 *
 * <p>
 * A runtime is built on first use: settings are read once, the timezone is
 * resolved, the job store is opened and a scheduler is attached to it.
 * Construction is idempotent, so concurrent callers for the same workspace
 * share one store. A workspace whose timezone cannot be resolved gets no
 * runtime.
 */
@Component
@Slf4j
public class WorkspaceRuntimeRegistry {

    private final WorkspaceSettingsService settingsService;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MessageSenderPort messageSender;
    private final ErrorReportPort errorReporter;
    private final SchedulerOptions options;
    private final Random random = new Random();
    private final ConcurrentMap<String, WorkspaceRuntime> runtimes = new ConcurrentHashMap<>();

    public WorkspaceRuntimeRegistry(WorkspaceSettingsService settingsService, StoragePort storagePort,
            ObjectMapper objectMapper, Clock clock, MessageSenderPort messageSender,
            ErrorReportPort errorReporter, BotProperties properties) {
        this.settingsService = settingsService;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.messageSender = messageSender;
        this.errorReporter = errorReporter;
        this.options = SchedulerOptions.from(properties);
    }

    /**
     * Return the runtime of a workspace, building it on first use.
     *
     * @throws InvalidTimezoneException
     *             if the workspace timezone is unknown
     * @throws IllegalArgumentException
     *             if the workspace id is not usable as a store name
     */
    public WorkspaceRuntime runtime(String workspaceId) {
        WorkspaceRuntime existing = runtimes.get(workspaceId);
        if (existing != null) {
            return existing;
        }
        return runtimes.computeIfAbsent(workspaceId, id -> build(id, null));
    }

    public Optional<WorkspaceRuntime> find(String workspaceId) {
        return Optional.ofNullable(runtimes.get(workspaceId));
    }

    public List<WorkspaceRuntime> all() {
        return List.copyOf(runtimes.values());
    }

    /**
     * Rebuild a live runtime so that changed settings take effect. The job store
     * and the set of in-flight sends carry over.
     */
    public void reload(String workspaceId) {
        runtimes.computeIfPresent(workspaceId, (id, current) -> build(id, current));
        log.info("[Scheduler] Reloaded runtime for workspace {}", workspaceId);
    }

    /**
     * Open a runtime for every job store on disk so that reminders fire after a
     * restart. Workspaces that cannot be opened are logged and skipped.
     *
     * @return number of runtimes opened
     */
    public int openExisting() {
        List<String> files;
        try {
            files = storagePort.listObjects(ReminderJobStore.DIRECTORY, null).join();
        } catch (CompletionException e) {
            log.error("[Scheduler] Failed to list job stores: {}", e.getMessage());
            return 0;
        }
        int opened = 0;
        for (String file : files) {
            if (!file.endsWith(ReminderJobStore.FILE_SUFFIX)) {
                continue;
            }
            String workspaceId = file.substring(0, file.length() - ReminderJobStore.FILE_SUFFIX.length());
            if (!ReminderJobStore.isValidWorkspaceId(workspaceId)) {
                log.warn("[Scheduler] Ignoring unexpected file in job store directory: {}", file);
                continue;
            }
            try {
                runtime(workspaceId);
                opened++;
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.error("[Scheduler] Failed to open workspace {}: {}", workspaceId, e.getMessage());
            }
        }
        log.info("[Scheduler] Opened {} workspace runtime(s)", opened);
        return opened;
    }

    @PreDestroy
    public void shutdown() {
        int count = runtimes.size();
        runtimes.clear();
        log.info("[Scheduler] Released {} workspace runtime(s)", count);
    }

    private WorkspaceRuntime build(String workspaceId, WorkspaceRuntime previous) {
        WorkspaceSettings settings = settingsService.getSettings(workspaceId);
        ZoneId zone;
        try {
            zone = ZoneId.of(settings.getTimezone());
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(workspaceId, settings.getTimezone(), e);
        }

        ReminderJobStore store = previous != null
                ? previous.store()
                : new ReminderJobStore(workspaceId, storagePort, objectMapper, clock, random);
        Set<String> inFlight = previous != null
                ? previous.scheduler().inFlight()
                : ConcurrentHashMap.newKeySet();
        WorkspaceScheduler scheduler = new WorkspaceScheduler(workspaceId, store, settings.isEnabled(),
                messageSender, errorReporter, clock, options, inFlight);

        if (previous == null) {
            log.info("[Scheduler] Opened workspace {} ({} job(s), timezone {}, {})", workspaceId, store.size(),
                    zone, settings.isEnabled() ? "enabled" : "disabled");
        }
        return new WorkspaceRuntime(workspaceId, settings, zone, store, scheduler);
    }
}
