package me.golemcore.reminder.adapter.inbound.web;

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
import me.golemcore.reminder.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.reminder.domain.model.ImportConflictException;
import me.golemcore.reminder.domain.model.InvalidTimezoneException;
import me.golemcore.reminder.domain.model.JobNotFoundException;
import me.golemcore.reminder.domain.model.ReminderRequestException;
import me.golemcore.reminder.domain.model.WorkspaceAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps reminder API exceptions to {@link ApiErrorResponse} bodies.
 */
@ControllerAdvice(basePackages = "me.golemcore.reminder.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ReminderRequestException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleReminderRequest(ReminderRequestException ex) {
        log.warn("[API] Rejected {} input '{}': {}", ex.getKind(), ex.getInput(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getKind().name());
    }

    @ExceptionHandler(InvalidTimezoneException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidTimezone(InvalidTimezoneException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ReminderRequestException.Kind.TIMEZONE.name());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(JobNotFoundException ex) {
        log.debug("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(WorkspaceAccessException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAccess(WorkspaceAccessException ex) {
        log.warn("[API] Forbidden: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage(), null);
    }

    @ExceptionHandler(ImportConflictException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleImportConflict(ImportConflictException ex) {
        log.warn("[API] Import rejected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message, String kind) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .kind(kind)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
