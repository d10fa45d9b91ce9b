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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.model.SchedulerEvent;
import me.golemcore.reminder.domain.service.ReminderJobStore;
import me.golemcore.reminder.domain.trigger.Trigger;
import me.golemcore.reminder.port.outbound.ErrorReportPort;
import me.golemcore.reminder.port.outbound.MessageSenderPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fires the due jobs of one workspace.
 *
 * <p>
 * Each tick re-arms a due job in the store first and only then starts the
 * asynchronous send, so a slow or failing sender never makes a job fire twice.
 * Send completions are handed back to the tick loop's executor, where a
 * delivered one-shot job is removed and a failure is reported as
 * {@link SchedulerEvent.JobErrored}. Late instants are reported as
 * {@link SchedulerEvent.JobMissed} and then handled according to the
 * {@link SchedulerOptions#policy() misfire policy}.
 *
 * <p>
 * Not thread-safe: {@link #tick(Executor)} and completion callbacks must run on
 * the same single-threaded executor.
 */
@Slf4j
public class WorkspaceScheduler {

    private final String workspaceId;
    private final ReminderJobStore store;
    private final boolean enabled;
    private final MessageSenderPort messageSender;
    private final ErrorReportPort errorReporter;
    private final Clock clock;
    private final SchedulerOptions options;
    private final Set<String> inFlight;

    public WorkspaceScheduler(String workspaceId, ReminderJobStore store, boolean enabled,
            MessageSenderPort messageSender, ErrorReportPort errorReporter, Clock clock,
            SchedulerOptions options, Set<String> inFlight) {
        this.workspaceId = workspaceId;
        this.store = store;
        this.enabled = enabled;
        this.messageSender = messageSender;
        this.errorReporter = errorReporter;
        this.clock = clock;
        this.options = options;
        this.inFlight = inFlight;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    Set<String> inFlight() {
        return inFlight;
    }

    /**
     * Dispatch every due job that has no send in flight.
     *
     * @param completionExecutor
     *            executor on which send completions are processed
     * @return number of jobs dispatched
     */
    public int tick(Executor completionExecutor) {
        if (!enabled) {
            return 0;
        }
        Instant now = clock.instant();
        int dispatched = 0;
        for (ReminderJob job : store.due(now)) {
            if (inFlight.contains(job.getId())) {
                log.debug("[Scheduler] Job {} still sending, skipped", job.getId());
                continue;
            }
            try {
                if (fire(job, now, completionExecutor)) {
                    dispatched++;
                }
            } catch (RuntimeException e) { // NOSONAR - one broken job must not stop the others
                inFlight.remove(job.getId());
                log.error("[Scheduler] Failed to fire job {} in workspace {}", job.getId(), workspaceId, e);
                report(new SchedulerEvent.JobErrored(workspaceId, job.getId(), summarize(e)));
            }
        }
        return dispatched;
    }

    private boolean fire(ReminderJob job, Instant now, Executor completionExecutor) {
        List<Instant> dueInstants = dueInstants(job, now);
        if (store.advance(job.getId(), now).isEmpty()) {
            log.debug("[Scheduler] Job {} vanished or was paused before firing", job.getId());
            return false;
        }

        List<Instant> late = dueInstants.stream()
                .filter(instant -> Duration.between(instant, now).compareTo(options.gracePeriod()) > 0)
                .toList();
        for (Instant instant : late) {
            log.warn("[Scheduler] Job {} in workspace {} missed its run at {}", job.getId(), workspaceId, instant);
            report(new SchedulerEvent.JobMissed(workspaceId, job.getId(), instant));
        }

        int fireCount = switch (options.policy()) {
        case COALESCE -> 1;
        case FIRE_EACH -> dueInstants.size();
        case SKIP_LATE -> dueInstants.size() > late.size() ? 1 : 0;
        };

        if (fireCount == 0) {
            if (job.getTrigger().isOneShot() && store.removeIfConsumed(job.getId(), job.getTrigger())) {
                log.info("[Scheduler] Dropped missed one-shot job {} in workspace {}", job.getId(), workspaceId);
            }
            return false;
        }

        DeliveryPayload payload = job.getPayload();
        String text = composeMessage(payload);
        inFlight.add(job.getId());

        CompletableFuture<Void> delivery = sendOnce(payload, text);
        for (int i = 1; i < fireCount; i++) {
            delivery = delivery.thenCompose(ignored -> sendOnce(payload, text));
        }
        int attempts = fireCount;
        delivery.whenCompleteAsync((ignored, error) -> onDeliveryComplete(job, attempts, error), completionExecutor);
        log.debug("[Scheduler] Dispatched job {} ({} send(s)) to {}", job.getId(), fireCount, payload.target());
        return true;
    }

    private void onDeliveryComplete(ReminderJob job, int attempts, Throwable error) {
        inFlight.remove(job.getId());
        if (error == null) {
            log.info("[Scheduler] Delivered job {} in workspace {} ({} send(s))", job.getId(), workspaceId, attempts);
            if (job.getTrigger().isOneShot()) {
                try {
                    if (!store.removeIfConsumed(job.getId(), job.getTrigger())) {
                        log.info("[Scheduler] One-shot job {} changed while sending, kept", job.getId());
                    }
                } catch (IllegalStateException e) {
                    log.error("[Scheduler] Failed to remove delivered one-shot job {}", job.getId(), e);
                }
            }
            return;
        }
        Throwable cause = unwrap(error);
        log.warn("[Scheduler] Delivery of job {} in workspace {} failed: {}", job.getId(), workspaceId,
                cause.getMessage());
        report(new SchedulerEvent.JobErrored(workspaceId, job.getId(), summarize(cause)));
    }

    /**
     * Due instants of a job, oldest first, starting at its armed next fire
     * instant and bounded by the catch-up cap.
     */
    private List<Instant> dueInstants(ReminderJob job, Instant now) {
        List<Instant> instants = new ArrayList<>();
        Trigger trigger = job.getTrigger();
        Instant cursor = job.getNextFireAt();
        while (cursor != null && !cursor.isAfter(now) && instants.size() < options.maxCatchUp()) {
            instants.add(cursor);
            cursor = trigger.isOneShot() ? null : trigger.next(cursor);
        }
        return instants;
    }

    private CompletableFuture<Void> sendOnce(DeliveryPayload payload, String text) {
        CompletableFuture<Void> send;
        try {
            send = messageSender.send(payload.target(), text);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send.orTimeout(options.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void report(SchedulerEvent event) {
        try {
            errorReporter.report(event);
        } catch (RuntimeException e) { // NOSONAR - a failing sink must never affect scheduling
            log.error("[Scheduler] Error report sink failed for {}: {}", event, e.getMessage());
        }
    }

    /**
     * Text sent for a payload: channel reminders mention their author on the
     * first line, direct messages carry the bare message.
     */
    static String composeMessage(DeliveryPayload payload) {
        String message = payload.message() != null ? payload.message() : "";
        if (payload.target().isDirectMessage() || payload.authorId() == null || payload.authorId().isBlank()) {
            return message;
        }
        return "<@" + payload.authorId() + ">\n" + message;
    }

    private String summarize(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Delivery timed out after " + options.sendTimeout().toSeconds() + "s";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
