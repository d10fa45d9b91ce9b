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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.migration.LegacyMigrationService;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single background loop that drives the scheduler of every open workspace.
 *
 * <p>
 * On startup it runs the legacy migration (when enabled), opens a runtime for
 * every job store on disk and then ticks at {@code bot.reminders.tick-interval-seconds}.
 * Send completions are processed on the same thread, so each workspace
 * scheduler only ever sees one thread.
 *
 * <p>
 * Execution is non-reentrant: if a tick is still running, the next one is
 * skipped.
 *
 * @since 1.0
 * @see WorkspaceScheduler
 */
@Component
@Slf4j
public class ReminderTickLoop {

    private final WorkspaceRuntimeRegistry registry;
    private final LegacyMigrationService migrationService;
    private final BotProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;

    public ReminderTickLoop(WorkspaceRuntimeRegistry registry, LegacyMigrationService migrationService,
            BotProperties properties) {
        this.registry = registry;
        this.migrationService = migrationService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (properties.getReminders().getMigration().isEnabled()) {
            try {
                migrationService.migrate();
            } catch (RuntimeException e) { // NOSONAR - startup continues without migration
                log.error("[Scheduler] Legacy migration failed: {}", e.getMessage(), e);
            }
        }
        registry.openExisting();

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-tick-loop");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = Math.max(1, properties.getReminders().getTickIntervalSeconds());
        tickTask = executor.scheduleAtFixedRate(
                this::tick,
                tickIntervalSeconds,
                tickIntervalSeconds,
                TimeUnit.SECONDS);

        log.info("[Scheduler] Started with tick interval: {}s", tickIntervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            int dispatched = 0;
            for (WorkspaceRuntime runtime : registry.all()) {
                try {
                    dispatched += runtime.scheduler().tick(executor);
                } catch (RuntimeException e) { // NOSONAR - one workspace must not stall the others
                    log.error("[Scheduler] Tick failed for workspace {}: {}", runtime.workspaceId(),
                            e.getMessage(), e);
                }
            }
            if (dispatched > 0) {
                log.debug("[Scheduler] Tick dispatched {} job(s)", dispatched);
            }
        } finally {
            executing.set(false);
        }
    }
}
