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
import me.golemcore.reminder.domain.model.WorkspaceAccessException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.domain.service.WorkspaceSettingsService;
import me.golemcore.reminder.scheduler.WorkspaceRuntimeRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Workspace settings endpoints. Saving settings rebuilds the workspace runtime
 * so that timezone and enabled flag apply immediately.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/settings")
@RequiredArgsConstructor
public class WorkspaceSettingsController {

    private final WorkspaceSettingsService settingsService;
    private final WorkspaceRuntimeRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<WorkspaceSettings>> getSettings(@PathVariable String workspaceId) {
        return Mono.just(ResponseEntity.ok(settingsService.getSettings(workspaceId)));
    }

    @PutMapping
    public Mono<ResponseEntity<WorkspaceSettings>> updateSettings(@PathVariable String workspaceId,
            @RequestHeader(RemindersController.ACTOR_HEADER) String actorId,
            @RequestBody WorkspaceSettings settings) {
        if (settings == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        WorkspaceSettings current = settingsService.getSettings(workspaceId);
        if (!current.isAllowed(actorId)) {
            throw new WorkspaceAccessException("Only workspace admins can change settings");
        }
        WorkspaceSettings saved = settingsService.saveSettings(workspaceId, settings);
        registry.reload(workspaceId);
        return Mono.just(ResponseEntity.ok(saved));
    }
}
