package me.golemcore.reminder.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.reminder.domain.model.CronSchedule;
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.ImportResult;
import me.golemcore.reminder.domain.model.IntervalSchedule;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.model.ReminderRequest;
import me.golemcore.reminder.domain.model.ReminderView;
import me.golemcore.reminder.domain.service.ReminderService;
import me.golemcore.reminder.domain.trigger.CronTrigger;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.OneShotTrigger;
import me.golemcore.reminder.domain.trigger.Trigger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reminder endpoints of one workspace.
 *
 * <p>
 * The acting user is taken from the {@value #ACTOR_HEADER} header; the chat
 * gateway in front of this service is responsible for authenticating it.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/reminders")
@RequiredArgsConstructor
public class RemindersController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final ReminderService reminderService;

    @GetMapping
    public Mono<ResponseEntity<List<ReminderDto>>> list(@PathVariable String workspaceId) {
        List<ReminderDto> reminders = reminderService.list(workspaceId).stream()
                .map(RemindersController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(reminders));
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> exportReminders(@PathVariable String workspaceId,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        return Mono.just(ResponseEntity.ok(reminderService.exportJobs(workspaceId, actorId)));
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ImportResponse>> importReminders(@PathVariable String workspaceId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestParam(defaultValue = "true") boolean skipExisting,
            @RequestBody String body) {
        ImportResult result = reminderService.importJobs(workspaceId, actorId, body, skipExisting);
        return Mono.just(ResponseEntity.ok(new ImportResponse(result.imported(), result.skipped())));
    }

    @GetMapping("/{jobId}")
    public Mono<ResponseEntity<ReminderDto>> get(@PathVariable String workspaceId, @PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @PostMapping("/once")
    public Mono<ResponseEntity<ReminderDto>> createOneShot(@PathVariable String workspaceId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody CreateOneShotRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        ReminderJob job = reminderService.createOneShot(workspaceId,
                reminderRequest(workspaceId, actorId, request.channelId(), request.userId(), request.message()),
                request.time());
        return created(workspaceId, job);
    }

    @PostMapping("/interval")
    public Mono<ResponseEntity<ReminderDto>> createInterval(@PathVariable String workspaceId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody CreateIntervalRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Duration period = period(request.weeks(), request.days(), request.hours(), request.minutes(),
                request.seconds());
        IntervalSchedule schedule = new IntervalSchedule(period, request.start(), request.end(),
                request.timezone(), seconds(request.jitterSeconds()));
        ReminderJob job = reminderService.createInterval(workspaceId,
                reminderRequest(workspaceId, actorId, request.channelId(), request.userId(), request.message()),
                schedule);
        return created(workspaceId, job);
    }

    @PostMapping("/cron")
    public Mono<ResponseEntity<ReminderDto>> createCron(@PathVariable String workspaceId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody CreateCronRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        CronSchedule schedule = CronSchedule.builder()
                .second(request.second())
                .minute(request.minute())
                .hour(request.hour())
                .day(request.day())
                .month(request.month())
                .dayOfWeek(request.dayOfWeek())
                .year(request.year())
                .startText(request.start())
                .endText(request.end())
                .timezone(request.timezone())
                .jitter(seconds(request.jitterSeconds()))
                .build();
        ReminderJob job = reminderService.createCron(workspaceId,
                reminderRequest(workspaceId, actorId, request.channelId(), request.userId(), request.message()),
                schedule);
        return created(workspaceId, job);
    }

    @PostMapping("/{jobId}/pause")
    public Mono<ResponseEntity<ReminderDto>> pause(@PathVariable String workspaceId, @PathVariable String jobId,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        reminderService.pause(workspaceId, actorId, jobId);
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @PostMapping("/{jobId}/resume")
    public Mono<ResponseEntity<ReminderDto>> resume(@PathVariable String workspaceId, @PathVariable String jobId,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        reminderService.resume(workspaceId, actorId, jobId);
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @PatchMapping("/{jobId}")
    public Mono<ResponseEntity<ReminderDto>> update(@PathVariable String workspaceId, @PathVariable String jobId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody UpdateReminderRequest request) {
        if (request == null || (request.message() == null && request.time() == null)) {
            throw badRequest("Nothing to update: set message and/or time");
        }
        if (request.message() != null) {
            reminderService.modifyMessage(workspaceId, actorId, jobId, request.message());
        }
        if (request.time() != null) {
            reminderService.reschedule(workspaceId, actorId, jobId, request.time());
        }
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @PatchMapping("/{jobId}/interval")
    public Mono<ResponseEntity<ReminderDto>> rescheduleInterval(@PathVariable String workspaceId,
            @PathVariable String jobId, @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody RescheduleIntervalRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        IntervalSchedule changes = new IntervalSchedule(
                period(request.weeks(), request.days(), request.hours(), request.minutes(), request.seconds()),
                request.start(), request.end(), request.timezone(), seconds(request.jitterSeconds()));
        reminderService.rescheduleInterval(workspaceId, actorId, jobId, changes);
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @PatchMapping("/{jobId}/cron")
    public Mono<ResponseEntity<ReminderDto>> rescheduleCron(@PathVariable String workspaceId,
            @PathVariable String jobId, @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestBody RescheduleCronRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        CronSchedule changes = CronSchedule.builder()
                .second(request.second())
                .minute(request.minute())
                .hour(request.hour())
                .day(request.day())
                .month(request.month())
                .dayOfWeek(request.dayOfWeek())
                .year(request.year())
                .startText(request.start())
                .endText(request.end())
                .timezone(request.timezone())
                .jitter(seconds(request.jitterSeconds()))
                .build();
        reminderService.rescheduleCron(workspaceId, actorId, jobId, changes);
        return Mono.just(ResponseEntity.ok(toDto(reminderService.get(workspaceId, jobId))));
    }

    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<DeleteReminderResponse>> delete(@PathVariable String workspaceId,
            @PathVariable String jobId, @RequestHeader(ACTOR_HEADER) String actorId) {
        reminderService.remove(workspaceId, actorId, jobId);
        return Mono.just(ResponseEntity.ok(new DeleteReminderResponse(jobId)));
    }

    private Mono<ResponseEntity<ReminderDto>> created(String workspaceId, ReminderJob job) {
        ReminderDto body = toDto(reminderService.get(workspaceId, job.getId()));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    private static ReminderRequest reminderRequest(String workspaceId, String actorId, String channelId,
            String userId, String message) {
        boolean hasChannel = channelId != null && !channelId.isBlank();
        boolean hasUser = userId != null && !userId.isBlank();
        if (hasChannel == hasUser) {
            throw badRequest("Exactly one of channelId or userId is required");
        }
        DeliveryTarget target = hasUser
                ? DeliveryTarget.directMessage(userId.trim(), workspaceId)
                : DeliveryTarget.channel(channelId.trim());
        return new ReminderRequest(actorId, target, message);
    }

    private static ReminderDto toDto(ReminderView view) {
        ReminderJob job = view.job();
        DeliveryPayload payload = job.getPayload();
        DeliveryTarget target = payload.target();
        return new ReminderDto(
                job.getId(),
                type(job.getTrigger()),
                view.description(),
                payload.message(),
                target.channelId(),
                target.userId(),
                payload.authorId(),
                job.isPaused(),
                job.getNextFireAt(),
                view.countdown(),
                view.relative(),
                job.getCreatedAt(),
                job.getLastFiredAt());
    }

    private static String type(Trigger trigger) {
        if (trigger instanceof OneShotTrigger) {
            return OneShotTrigger.TYPE;
        }
        if (trigger instanceof IntervalTrigger) {
            return IntervalTrigger.TYPE;
        }
        return CronTrigger.TYPE;
    }

    /**
     * Sum of the given parts, or {@code null} when none is given.
     */
    private static Duration period(Long weeks, Long days, Long hours, Long minutes, Long seconds) {
        if (weeks == null && days == null && hours == null && minutes == null && seconds == null) {
            return null;
        }
        return Duration.ofDays(7L * orZero(weeks))
                .plusDays(orZero(days))
                .plusHours(orZero(hours))
                .plusMinutes(orZero(minutes))
                .plusSeconds(orZero(seconds));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static Duration seconds(Long value) {
        return value != null ? Duration.ofSeconds(value) : null;
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateOneShotRequest(String channelId, String userId, String message, String time) {
    }

    public record CreateIntervalRequest(
            String channelId,
            String userId,
            String message,
            Long weeks,
            Long days,
            Long hours,
            Long minutes,
            Long seconds,
            String start,
            String end,
            String timezone,
            Long jitterSeconds) {
    }

    public record CreateCronRequest(
            String channelId,
            String userId,
            String message,
            String second,
            String minute,
            String hour,
            String day,
            String month,
            String dayOfWeek,
            String year,
            String start,
            String end,
            String timezone,
            Long jitterSeconds) {
    }

    public record UpdateReminderRequest(String message, String time) {
    }

    public record RescheduleIntervalRequest(
            Long weeks,
            Long days,
            Long hours,
            Long minutes,
            Long seconds,
            String start,
            String end,
            String timezone,
            Long jitterSeconds) {
    }

    public record RescheduleCronRequest(
            String second,
            String minute,
            String hour,
            String day,
            String month,
            String dayOfWeek,
            String year,
            String start,
            String end,
            String timezone,
            Long jitterSeconds) {
    }

    public record ReminderDto(
            String id,
            String type,
            String schedule,
            String message,
            String channelId,
            String userId,
            String authorId,
            boolean paused,
            Instant nextFireAt,
            String countdown,
            String relative,
            Instant createdAt,
            Instant lastFiredAt) {
    }

    public record ImportResponse(List<String> imported, List<String> skipped) {
    }

    public record DeleteReminderResponse(String jobId) {
    }
}
