package me.golemcore.reminder.infrastructure.config;

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

import lombok.Data;
import me.golemcore.reminder.domain.model.MisfirePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the reminder bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link RemindersProperties} - scheduling, delivery, error reporting and
 * legacy migration</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private RemindersProperties reminders = new RemindersProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/reminders";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== REMINDERS ====================

    @Data
    public static class RemindersProperties {
        private String defaultTimezone = "Europe/Stockholm";
        private int tickIntervalSeconds = 1;
        private int minIntervalSeconds = 30;
        private MisfireProperties misfire = new MisfireProperties();
        private DeliveryProperties delivery = new DeliveryProperties();
        private ErrorWebhookProperties errorWebhook = new ErrorWebhookProperties();
        private MigrationProperties migration = new MigrationProperties();
    }

    @Data
    public static class MisfireProperties {
        private MisfirePolicy policy = MisfirePolicy.COALESCE;
        private int gracePeriodSeconds = 60;
        private int maxCatchUp = 100;
    }

    @Data
    public static class DeliveryProperties {
        private String url = "";
        private String apiKey = "";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class ErrorWebhookProperties {
        private String url = "";
        private String username = "reminder-bot";
    }

    @Data
    public static class MigrationProperties {
        private boolean enabled = true;
        private String legacyDirectory = "legacy";
        private String legacyFile = "jobs.json";
        private Map<String, String> channelWorkspaces = new HashMap<>();
    }
}
