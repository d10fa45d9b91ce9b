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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminder.domain.model.CronSchedule;
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.ImportResult;
import me.golemcore.reminder.domain.model.IntervalSchedule;
import me.golemcore.reminder.domain.model.JobNotFoundException;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.model.ReminderRequest;
import me.golemcore.reminder.domain.model.ReminderRequestException;
import me.golemcore.reminder.domain.model.ReminderView;
import me.golemcore.reminder.domain.model.WorkspaceAccessException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.domain.trigger.CronTrigger;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.OneShotTrigger;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.TimeParserPort;
import me.golemcore.reminder.scheduler.WorkspaceRuntime;
import me.golemcore.reminder.scheduler.WorkspaceRuntimeRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Request-facing reminder operations.
 *
 * <p>
 * Resolves the workspace runtime, turns free-form time input into triggers
 * using the workspace timezone, enforces the workspace's enabled flag and
 * admin allow-list on mutations, and translates missing jobs into
 * {@link JobNotFoundException}. Reads are allowed in disabled workspaces.
 */
@Service
@Slf4j
public class ReminderService {

    private final WorkspaceRuntimeRegistry registry;
    private final TimeParserPort timeParser;
    private final CountdownFormatter countdownFormatter;
    private final BotProperties properties;
    private final Clock clock;

    public ReminderService(WorkspaceRuntimeRegistry registry, TimeParserPort timeParser,
            CountdownFormatter countdownFormatter, BotProperties properties, Clock clock) {
        this.registry = registry;
        this.timeParser = timeParser;
        this.countdownFormatter = countdownFormatter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create a reminder firing once at the parsed time.
     *
     * @throws ReminderRequestException
     *             if the time cannot be parsed or is not in the future
     */
    public ReminderJob createOneShot(String workspaceId, ReminderRequest request, String timeText) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, request.actorId());
        DeliveryPayload payload = payload(workspaceId, request);

        Instant fireAt = parseTime(timeText, runtime.zone());
        if (!fireAt.isAfter(clock.instant())) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIME, timeText,
                    "Time is in the past: " + timeText);
        }

        ReminderJob job = runtime.store().add(new OneShotTrigger(fireAt), payload);
        log.info("[Reminders] {} created one-shot reminder {} in workspace {} for {}",
                request.actorId(), job.getId(), workspaceId, fireAt);
        return job;
    }

    /**
     * Create a reminder firing every {@code schedule.period()}.
     *
     * @throws ReminderRequestException
     *             if the period is below the configured minimum or any time or
     *             timezone argument is invalid
     */
    public ReminderJob createInterval(String workspaceId, ReminderRequest request, IntervalSchedule schedule) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, request.actorId());
        DeliveryPayload payload = payload(workspaceId, request);

        Duration period = schedule.period();
        requireMinimumPeriod(period);

        ZoneId zone = resolveZone(schedule.timezone(), runtime);
        IntervalTrigger trigger;
        try {
            trigger = IntervalTrigger.builder()
                    .period(period)
                    .start(parseOptionalTime(schedule.startText(), zone))
                    .end(parseOptionalTime(schedule.endText(), zone))
                    .jitter(schedule.jitter())
                    .build();
        } catch (ReminderRequestException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL,
                    countdownFormatter.humanDuration(period), e.getMessage(), e);
        }

        ReminderJob job = runtime.store().add(trigger, payload);
        log.info("[Reminders] {} created interval reminder {} in workspace {}: {}",
                request.actorId(), job.getId(), workspaceId, trigger.describe());
        return job;
    }

    /**
     * Create a reminder firing on a cron schedule.
     *
     * @throws ReminderRequestException
     *             if a field expression, time or timezone argument is invalid
     */
    public ReminderJob createCron(String workspaceId, ReminderRequest request, CronSchedule schedule) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, request.actorId());
        DeliveryPayload payload = payload(workspaceId, request);

        ZoneId zone = resolveZone(schedule.timezone(), runtime);
        CronTrigger trigger;
        try {
            trigger = CronTrigger.builder()
                    .second(schedule.second())
                    .minute(schedule.minute())
                    .hour(schedule.hour())
                    .day(schedule.day())
                    .month(schedule.month())
                    .dayOfWeek(schedule.dayOfWeek())
                    .year(schedule.year())
                    .start(parseOptionalTime(schedule.startText(), zone))
                    .end(parseOptionalTime(schedule.endText(), zone))
                    .timezone(zone.getId())
                    .jitter(schedule.jitter())
                    .build();
        } catch (ReminderRequestException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ReminderRequestException(ReminderRequestException.Kind.CRON, describeFields(schedule),
                    "Invalid cron schedule: " + e.getMessage(), e);
        }

        ReminderJob job = runtime.store().add(trigger, payload);
        log.info("[Reminders] {} created cron reminder {} in workspace {}: {}",
                request.actorId(), job.getId(), workspaceId, trigger.describe());
        return job;
    }

    /**
     * All reminders of a workspace, soonest first, paused ones last.
     */
    public List<ReminderView> list(String workspaceId) {
        WorkspaceRuntime runtime = registry.runtime(workspaceId);
        return runtime.store().list().stream()
                .sorted(Comparator.comparing(ReminderJob::getNextFireAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(this::view)
                .toList();
    }

    public ReminderView get(String workspaceId, String jobId) {
        WorkspaceRuntime runtime = registry.runtime(workspaceId);
        return runtime.store().get(jobId)
                .map(this::view)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
    }

    public ReminderJob pause(String workspaceId, String actorId, String jobId) {
        ReminderJob job = mutableRuntime(workspaceId, actorId).store().pause(jobId)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        log.info("[Reminders] {} paused reminder {} in workspace {}", actorId, jobId, workspaceId);
        return job;
    }

    /**
     * Re-arm a paused reminder from now on.
     *
     * @throws ReminderRequestException
     *             if the reminder has no run left and must be rescheduled
     *             instead
     */
    public ReminderJob resume(String workspaceId, String actorId, String jobId) {
        ReminderJob job = mutableRuntime(workspaceId, actorId).store().resume(jobId)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        if (job.getNextFireAt() == null) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIME, job.getTrigger().describe(),
                    "Reminder has no future run left (" + job.getTrigger().describe() + "), reschedule it instead");
        }
        log.info("[Reminders] {} resumed reminder {} in workspace {}, next fire at {}",
                actorId, jobId, workspaceId, job.getNextFireAt());
        return job;
    }

    public void remove(String workspaceId, String actorId, String jobId) {
        if (!mutableRuntime(workspaceId, actorId).store().remove(jobId)) {
            throw new JobNotFoundException(workspaceId, jobId);
        }
        log.info("[Reminders] {} removed reminder {} in workspace {}", actorId, jobId, workspaceId);
    }

    /**
     * Replace the message text, keeping the schedule.
     */
    public ReminderJob modifyMessage(String workspaceId, String actorId, String jobId, String message) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, actorId);
        validateMessage(message);
        return runtime.store()
                .modifyPayload(jobId, DeliveryPayload.builder().message(message).build())
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
    }

    /**
     * Move a one-shot reminder to a new time. A paused reminder is unpaused.
     * Interval and cron reminders are changed through
     * {@link #rescheduleInterval} and {@link #rescheduleCron}.
     *
     * @throws ReminderRequestException
     *             if the job is not a one-shot reminder or the time is invalid
     */
    public ReminderJob reschedule(String workspaceId, String actorId, String jobId, String timeText) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, actorId);
        ReminderJob current = runtime.store().get(jobId)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        if (!current.getTrigger().isOneShot()) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIME, timeText,
                    "Only one-shot reminders can be moved to a new time; change the interval or cron schedule instead");
        }
        Instant fireAt = parseTime(timeText, runtime.zone());
        if (!fireAt.isAfter(clock.instant())) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIME, timeText,
                    "Time is in the past: " + timeText);
        }
        ReminderJob job = runtime.store().reschedule(jobId, new OneShotTrigger(fireAt))
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        log.info("[Reminders] {} moved reminder {} in workspace {} to {}", actorId, jobId, workspaceId, fireAt);
        return job;
    }

    /**
     * Change the schedule of an interval reminder. Only the non-null fields of
     * {@code changes} are applied. A new period without a new start restarts
     * the cadence from now. A paused reminder is unpaused.
     *
     * @throws ReminderRequestException
     *             if the job is not an interval reminder, nothing would change,
     *             or the merged schedule is invalid or has no future run
     */
    public ReminderJob rescheduleInterval(String workspaceId, String actorId, String jobId,
            IntervalSchedule changes) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, actorId);
        ReminderJob current = runtime.store().get(jobId)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        if (!(current.getTrigger() instanceof IntervalTrigger existing)) {
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL, jobId,
                    "Reminder " + jobId + " is not an interval reminder");
        }
        if (changes == null || (changes.period() == null && isBlank(changes.startText())
                && isBlank(changes.endText()) && changes.jitter() == null)) {
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL, null,
                    "Nothing to change: set period, start, end or jitter");
        }

        ZoneId zone = resolveZone(changes.timezone(), runtime);
        IntervalTrigger trigger;
        try {
            IntervalTrigger.IntervalTriggerBuilder builder = existing.toBuilder();
            if (changes.period() != null) {
                requireMinimumPeriod(changes.period());
                builder.period(changes.period()).start(null);
            }
            Instant start = parseOptionalTime(changes.startText(), zone);
            if (start != null) {
                builder.start(start);
            }
            Instant end = parseOptionalTime(changes.endText(), zone);
            if (end != null) {
                builder.end(end);
            }
            if (changes.jitter() != null) {
                builder.jitter(changes.jitter());
            }
            trigger = builder.build();
        } catch (ReminderRequestException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL,
                    countdownFormatter.humanDuration(existing.period()), e.getMessage(), e);
        }
        if (trigger.next(clock.instant()) == null) {
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL, trigger.describe(),
                    "Interval schedule has no future run: " + trigger.describe());
        }

        ReminderJob job = runtime.store().reschedule(jobId, trigger)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        log.info("[Reminders] {} rescheduled interval reminder {} in workspace {}: {}",
                actorId, jobId, workspaceId, trigger.describe());
        return job;
    }

    /**
     * Change the schedule of a cron reminder. Only the non-blank fields of
     * {@code changes} are applied; the rest keep their current expression. A
     * paused reminder is unpaused.
     *
     * @throws ReminderRequestException
     *             if the job is not a cron reminder, nothing would change, or
     *             the merged schedule is invalid or has no future run
     */
    public ReminderJob rescheduleCron(String workspaceId, String actorId, String jobId, CronSchedule changes) {
        WorkspaceRuntime runtime = mutableRuntime(workspaceId, actorId);
        ReminderJob current = runtime.store().get(jobId)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        if (!(current.getTrigger() instanceof CronTrigger existing)) {
            throw new ReminderRequestException(ReminderRequestException.Kind.CRON, jobId,
                    "Reminder " + jobId + " is not a cron reminder");
        }
        if (changes == null || isEmpty(changes)) {
            throw new ReminderRequestException(ReminderRequestException.Kind.CRON, null,
                    "Nothing to change: set at least one cron field, start, end, timezone or jitter");
        }

        ZoneId zone = isBlank(changes.timezone()) ? ZoneId.of(existing.timezone())
                : resolveZone(changes.timezone(), runtime);
        CronTrigger trigger;
        try {
            Instant start = parseOptionalTime(changes.startText(), zone);
            Instant end = parseOptionalTime(changes.endText(), zone);
            trigger = existing.toBuilder()
                    .second(merged(changes.second(), existing.second()))
                    .minute(merged(changes.minute(), existing.minute()))
                    .hour(merged(changes.hour(), existing.hour()))
                    .day(merged(changes.day(), existing.day()))
                    .month(merged(changes.month(), existing.month()))
                    .dayOfWeek(merged(changes.dayOfWeek(), existing.dayOfWeek()))
                    .year(merged(changes.year(), existing.year()))
                    .start(start != null ? start : existing.start())
                    .end(end != null ? end : existing.end())
                    .timezone(zone.getId())
                    .jitter(changes.jitter() != null ? changes.jitter() : existing.jitter())
                    .build();
        } catch (ReminderRequestException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ReminderRequestException(ReminderRequestException.Kind.CRON, describeFields(changes),
                    "Invalid cron schedule: " + e.getMessage(), e);
        }
        if (trigger.next(clock.instant()) == null) {
            throw new ReminderRequestException(ReminderRequestException.Kind.CRON, trigger.describe(),
                    "Cron schedule has no future run: " + trigger.describe());
        }

        ReminderJob job = runtime.store().reschedule(jobId, trigger)
                .orElseThrow(() -> new JobNotFoundException(workspaceId, jobId));
        log.info("[Reminders] {} rescheduled cron reminder {} in workspace {}: {}",
                actorId, jobId, workspaceId, trigger.describe());
        return job;
    }

    public String exportJobs(String workspaceId, String actorId) {
        return mutableRuntime(workspaceId, actorId).store().export();
    }

    public ImportResult importJobs(String workspaceId, String actorId, String blob, boolean skipExisting) {
        return mutableRuntime(workspaceId, actorId).store().importJobs(blob, skipExisting);
    }

    private WorkspaceRuntime mutableRuntime(String workspaceId, String actorId) {
        WorkspaceRuntime runtime = registry.runtime(workspaceId);
        WorkspaceSettings settings = runtime.settings();
        if (!settings.isEnabled()) {
            throw new WorkspaceAccessException("Reminders are disabled in workspace " + workspaceId);
        }
        if (!settings.isAllowed(actorId)) {
            throw new WorkspaceAccessException("Only workspace admins can manage reminders");
        }
        return runtime;
    }

    private ReminderView view(ReminderJob job) {
        return new ReminderView(job, job.getTrigger().describe(),
                countdownFormatter.countdown(job), countdownFormatter.relative(job));
    }

    private static DeliveryPayload payload(String workspaceId, ReminderRequest request) {
        validateMessage(request.message());
        DeliveryTarget target = request.target();
        if (target == null) {
            throw new IllegalArgumentException("Delivery target is required");
        }
        if (target.isDirectMessage()) {
            target = DeliveryTarget.directMessage(target.userId(), workspaceId);
        }
        return DeliveryPayload.builder()
                .target(target)
                .message(request.message())
                .authorId(request.actorId())
                .workspaceId(workspaceId)
                .build();
    }

    private void requireMinimumPeriod(Duration period) {
        Duration minimum = Duration.ofSeconds(properties.getReminders().getMinIntervalSeconds());
        if (period == null || period.compareTo(minimum) < 0) {
            String input = period != null ? countdownFormatter.humanDuration(period) : "none";
            throw new ReminderRequestException(ReminderRequestException.Kind.INTERVAL, input,
                    "Interval must be at least " + countdownFormatter.humanDuration(minimum) + ", got " + input);
        }
    }

    private static void validateMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new ReminderRequestException(ReminderRequestException.Kind.MESSAGE, message,
                    "Reminder message must not be empty");
        }
    }

    private Instant parseTime(String timeText, ZoneId zone) {
        if (timeText == null || timeText.isBlank()) {
            throw new ReminderRequestException(ReminderRequestException.Kind.TIME, timeText, "Time is required");
        }
        return timeParser.parse(timeText, zone)
                .orElseThrow(() -> new ReminderRequestException(ReminderRequestException.Kind.TIME, timeText,
                        "Could not parse time: " + timeText));
    }

    private Instant parseOptionalTime(String timeText, ZoneId zone) {
        if (timeText == null || timeText.isBlank()) {
            return null;
        }
        return parseTime(timeText, zone);
    }

    private static ZoneId resolveZone(String timezone, WorkspaceRuntime runtime) {
        if (timezone == null || timezone.isBlank()) {
            return runtime.zone();
        }
        WorkspaceSettingsService.validateTimezone(timezone.trim());
        return ZoneId.of(timezone.trim());
    }

    private static String describeFields(CronSchedule schedule) {
        return String.join(" ",
                orAny(schedule.second()), orAny(schedule.minute()), orAny(schedule.hour()),
                orAny(schedule.day()), orAny(schedule.month()), orAny(schedule.dayOfWeek()),
                orAny(schedule.year()));
    }

    private static boolean isEmpty(CronSchedule changes) {
        return isBlank(changes.second()) && isBlank(changes.minute()) && isBlank(changes.hour())
                && isBlank(changes.day()) && isBlank(changes.month()) && isBlank(changes.dayOfWeek())
                && isBlank(changes.year()) && isBlank(changes.startText()) && isBlank(changes.endText())
                && isBlank(changes.timezone()) && changes.jitter() == null;
    }

    private static String merged(String change, String current) {
        return isBlank(change) ? current : change.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orAny(String field) {
        return field == null || field.isBlank() ? "?" : field;
    }
}
