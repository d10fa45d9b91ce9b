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
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.ImportConflictException;
import me.golemcore.reminder.domain.model.ImportResult;
import me.golemcore.reminder.domain.model.JobsDocument;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.Trigger;
import me.golemcore.reminder.port.outbound.StoragePort;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Durable collection of reminder jobs owned by one workspace, persisted in
 * {@code reminders/<workspaceId>.json} via {@link StoragePort}.
 *
 * <p>
 * All mutations are serialized on the store monitor and written atomically
 * (previous file kept as {@code .bak}) before the new state becomes visible. A
 * failed write leaves the in-memory state untouched and surfaces as
 * {@link IllegalStateException}.
 *
 * <p>
 * Jobs handed out are copies; mutating them has no effect on the store. Lookups
 * of unknown ids return {@link Optional#empty()} or {@code false}, leaving the
 * choice of error to the caller.
 */
@Slf4j
public class ReminderJobStore {

    public static final String DIRECTORY = "reminders";
    public static final String FILE_SUFFIX = ".json";

    private static final Pattern WORKSPACE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final String workspaceId;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Random random;

    private Map<String, ReminderJob> jobs;

    public ReminderJobStore(String workspaceId, StoragePort storagePort, ObjectMapper objectMapper,
            Clock clock, Random random) {
        if (!isValidWorkspaceId(workspaceId)) {
            throw new IllegalArgumentException("Invalid workspace id: " + workspaceId);
        }
        this.workspaceId = workspaceId;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.random = random;
        this.jobs = load();
    }

    public static boolean isValidWorkspaceId(String workspaceId) {
        return workspaceId != null && WORKSPACE_ID.matcher(workspaceId).matches();
    }

    public static String fileName(String workspaceId) {
        return workspaceId + FILE_SUFFIX;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public synchronized Optional<ReminderJob> get(String id) {
        return Optional.ofNullable(jobs.get(id)).map(ReminderJobStore::copy);
    }

    public synchronized List<ReminderJob> list() {
        return jobs.values().stream().map(ReminderJobStore::copy).toList();
    }

    public synchronized int size() {
        return jobs.size();
    }

    /**
     * Add a job under a fresh 32-hex-character id. Interval triggers without a
     * start are anchored to now.
     */
    public synchronized ReminderJob add(Trigger trigger, DeliveryPayload payload) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Instant now = clock.instant();
        Trigger anchored = anchor(trigger, now);

        String id = newId();
        ReminderJob job = ReminderJob.builder()
                .id(id)
                .trigger(anchored)
                .nextFireAt(arm(anchored, now))
                .payload(payload)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);
        updated.put(id, job);
        persist(updated);

        log.info("[Reminders] Added job {} in workspace {}: {}", id, workspaceId, anchored.describe());
        return copy(job);
    }

    public synchronized boolean remove(String id) {
        if (!jobs.containsKey(id)) {
            return false;
        }
        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);
        updated.remove(id);
        persist(updated);
        log.info("[Reminders] Removed job {} from workspace {}", id, workspaceId);
        return true;
    }

    /**
     * Remove a one-shot job after its successful delivery, unless it changed
     * since it fired: re-armed by a reschedule, paused, or given another
     * trigger.
     *
     * @return {@code true} if the job was removed
     */
    public synchronized boolean removeIfConsumed(String id, Trigger firedTrigger) {
        ReminderJob current = jobs.get(id);
        if (current == null || current.isPaused() || current.getNextFireAt() != null
                || !Objects.equals(current.getTrigger(), firedTrigger)) {
            return false;
        }
        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);
        updated.remove(id);
        persist(updated);
        log.info("[Reminders] Removed consumed job {} from workspace {}", id, workspaceId);
        return true;
    }

    /**
     * Clear the next fire instant and keep the trigger.
     */
    public synchronized Optional<ReminderJob> pause(String id) {
        return update(id, job -> {
            job.setPaused(true);
            job.setNextFireAt(null);
            return job;
        });
    }

    /**
     * Recompute the next fire instant from the retained trigger and the current
     * time. Instants missed while paused are skipped. A job whose trigger has no
     * run left (a one-shot in the past, an interval or cron past its end) is
     * returned unchanged and stays paused until it is rescheduled.
     */
    public synchronized Optional<ReminderJob> resume(String id) {
        ReminderJob current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant next = arm(current.getTrigger(), now);
        if (next == null) {
            log.info("[Reminders] Job {} in workspace {} has no future run, left as is", id, workspaceId);
            return Optional.of(copy(current));
        }
        return update(id, job -> {
            job.setPaused(false);
            job.setNextFireAt(next);
            return job;
        });
    }

    /**
     * Replace the trigger and recompute the next fire instant. A paused job is
     * unpaused.
     */
    public synchronized Optional<ReminderJob> reschedule(String id, Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Instant now = clock.instant();
        Trigger anchored = anchor(trigger, now);
        return update(id, job -> {
            if (job.isPaused()) {
                log.info("[Reminders] Job {} unpaused by reschedule", id);
            }
            job.setTrigger(anchored);
            job.setPaused(false);
            job.setNextFireAt(arm(anchored, now));
            return job;
        });
    }

    /**
     * Merge the non-null fields of {@code partial} into the job's payload.
     */
    public synchronized Optional<ReminderJob> modifyPayload(String id, DeliveryPayload partial) {
        return update(id, job -> {
            job.setPayload(job.getPayload() != null ? job.getPayload().mergedWith(partial) : partial);
            return job;
        });
    }

    /**
     * Jobs that are not paused and whose next fire instant is at or before
     * {@code now}.
     */
    public synchronized List<ReminderJob> due(Instant now) {
        return jobs.values().stream()
                .filter(job -> job.isDue(now))
                .map(ReminderJobStore::copy)
                .toList();
    }

    /**
     * Record a fire at {@code firedAt} and re-arm from it. One-shot jobs end up
     * with no next fire instant. Returns empty if the job is gone or was paused
     * in the meantime.
     */
    public synchronized Optional<ReminderJob> advance(String id, Instant firedAt) {
        ReminderJob current = jobs.get(id);
        if (current == null || current.isPaused()) {
            return Optional.empty();
        }
        return update(id, job -> {
            job.setLastFiredAt(firedAt);
            job.setNextFireAt(arm(job.getTrigger(), firedAt));
            return job;
        });
    }

    /**
     * Insert a job under its existing id. Returns {@code false} and leaves the
     * store untouched if that id is already present.
     */
    public synchronized boolean restore(ReminderJob job) {
        Objects.requireNonNull(job.getId(), "job id must not be null");
        if (jobs.containsKey(job.getId())) {
            return false;
        }
        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);
        updated.put(job.getId(), copy(job));
        persist(updated);
        return true;
    }

    /**
     * Serialize every job as a versioned JSON document.
     */
    public synchronized String export() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new JobsDocument(JobsDocument.CURRENT_VERSION, new ArrayList<>(jobs.values())));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export reminders of workspace " + workspaceId, e);
        }
    }

    /**
     * Add the jobs of an exported document. Existing ids are never overwritten:
     * they are reported as skipped when {@code skipExisting} is set, otherwise
     * the whole import is rejected before anything is written. Imported jobs
     * are bound to this workspace, direct-message targets included.
     *
     * @throws IllegalArgumentException
     *             if the document cannot be read
     * @throws ImportConflictException
     *             on an id collision with {@code skipExisting == false}
     */
    public synchronized ImportResult importJobs(String blob, boolean skipExisting) {
        JobsDocument document = parseDocument(blob);

        List<String> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> conflicts = new LinkedHashSet<>();
        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);

        for (ReminderJob job : document.getJobs()) {
            if (job == null || job.getId() == null || job.getTrigger() == null || job.getPayload() == null) {
                throw new IllegalArgumentException("Import document contains an incomplete job");
            }
            if (updated.containsKey(job.getId())) {
                if (jobs.containsKey(job.getId())) {
                    conflicts.add(job.getId());
                }
                skipped.add(job.getId());
                continue;
            }
            updated.put(job.getId(), boundToWorkspace(copy(job)));
            imported.add(job.getId());
        }

        if (!skipExisting && !conflicts.isEmpty()) {
            throw new ImportConflictException(new ArrayList<>(conflicts));
        }
        if (!imported.isEmpty()) {
            persist(updated);
        }
        log.info("[Reminders] Imported {} job(s) into workspace {}, skipped {}",
                imported.size(), workspaceId, skipped.size());
        return new ImportResult(imported, skipped);
    }

    private Optional<ReminderJob> update(String id, UnaryOperator<ReminderJob> mutation) {
        ReminderJob current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        ReminderJob changed = mutation.apply(copy(current));
        changed.setUpdatedAt(clock.instant());

        Map<String, ReminderJob> updated = new LinkedHashMap<>(jobs);
        updated.put(id, changed);
        persist(updated);
        return Optional.of(copy(changed));
    }

    private ReminderJob boundToWorkspace(ReminderJob job) {
        DeliveryPayload payload = job.getPayload();
        DeliveryTarget target = payload.target();
        if (target != null && target.isDirectMessage()) {
            target = DeliveryTarget.directMessage(target.userId(), workspaceId);
        }
        job.setPayload(payload.toBuilder().target(target).workspaceId(workspaceId).build());
        return job;
    }

    private Instant arm(Trigger trigger, Instant now) {
        return trigger.withJitter(trigger.next(now), random);
    }

    private static Trigger anchor(Trigger trigger, Instant now) {
        if (trigger instanceof IntervalTrigger interval) {
            return interval.anchoredAt(now);
        }
        return trigger;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "");
        } while (jobs.containsKey(id));
        return id;
    }

    private JobsDocument parseDocument(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new IllegalArgumentException("Import document is empty");
        }
        JobsDocument document;
        try {
            document = objectMapper.readValue(blob, JobsDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Import document is not valid: " + e.getOriginalMessage(), e);
        }
        if (document.getVersion() > JobsDocument.CURRENT_VERSION) {
            throw new IllegalArgumentException("Unsupported import document version: " + document.getVersion());
        }
        if (document.getJobs() == null) {
            document.setJobs(new ArrayList<>());
        }
        return document;
    }

    private void persist(Map<String, ReminderJob> updated) {
        String json;
        try {
            json = objectMapper.writeValueAsString(
                    new JobsDocument(JobsDocument.CURRENT_VERSION, new ArrayList<>(updated.values())));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reminders of workspace " + workspaceId, e);
        }
        try {
            storagePort.putTextAtomic(DIRECTORY, fileName(workspaceId), json, true).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to persist reminders of workspace " + workspaceId,
                    e.getCause() != null ? e.getCause() : e);
        }
        jobs = updated;
    }

    private Map<String, ReminderJob> load() {
        String json;
        try {
            json = storagePort.getText(DIRECTORY, fileName(workspaceId)).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read reminders of workspace " + workspaceId,
                    e.getCause() != null ? e.getCause() : e);
        }
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        JobsDocument document;
        try {
            document = objectMapper.readValue(json, JobsDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt reminder store for workspace " + workspaceId
                    + " (a .bak copy may be available)", e);
        }
        Map<String, ReminderJob> loaded = new LinkedHashMap<>();
        if (document.getJobs() != null) {
            for (ReminderJob job : document.getJobs()) {
                loaded.put(job.getId(), job);
            }
        }
        log.debug("[Reminders] Loaded {} job(s) for workspace {}", loaded.size(), workspaceId);
        return loaded;
    }

    private static ReminderJob copy(ReminderJob job) {
        return job.toBuilder().build();
    }
}
