package me.golemcore.reminder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the reminder bot scheduling engine.
 *
 * <p>
 * Each workspace (chat server) owns an independent job store, timezone and
 * scheduler. A single tick loop drives every workspace scheduler; due jobs are
 * delivered through the configured chat gateway.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → RemindersController, WorkspaceSettingsController
 * Domain Layer       → ReminderService, ReminderJobStore, Triggers
 * Scheduling         → ReminderTickLoop, WorkspaceScheduler
 * Infrastructure     → Storage/Delivery/Webhook/TimeParser Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReminderBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReminderBotApplication.class, args);
    }

}
