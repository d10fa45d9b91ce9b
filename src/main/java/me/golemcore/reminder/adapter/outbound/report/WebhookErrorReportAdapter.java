package me.golemcore.reminder.adapter.outbound.report;

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
import me.golemcore.reminder.domain.model.SchedulerEvent;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.ErrorReportPort;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Reports scheduler events to the log and, when
 * {@code bot.reminders.error-webhook.url} is set, to a chat webhook as a short
 * text message.
 *
 * <p>
 * Webhook failures are logged and otherwise ignored.
 */
@Component
@Slf4j
public class WebhookErrorReportAdapter implements ErrorReportPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int TIMEOUT_SECONDS = 10;

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookErrorReportAdapter(BotProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public void report(SchedulerEvent event) {
        String text = describe(event);
        log.warn("[ErrorReport] {}", text);

        BotProperties.ErrorWebhookProperties webhook = properties.getReminders().getErrorWebhook();
        if (webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(new WebhookMessage(text, webhook.getUsername()));
        } catch (JsonProcessingException e) {
            log.error("[ErrorReport] Failed to encode webhook message: {}", e.getMessage());
            return;
        }

        Request request = new Request.Builder()
                .url(webhook.getUrl())
                .post(RequestBody.create(body, JSON))
                .build();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("[ErrorReport] Webhook post failed: {}", e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("[ErrorReport] Webhook rejected report: HTTP {}", response.code());
                    }
                }
            }
        });
    }

    static String describe(SchedulerEvent event) {
        if (event instanceof SchedulerEvent.JobMissed missed) {
            return "Job " + missed.jobId() + " was missed! Was scheduled at " + missed.scheduledAt()
                    + " (workspace " + missed.workspaceId() + ")";
        }
        SchedulerEvent.JobErrored errored = (SchedulerEvent.JobErrored) event;
        return "Job " + errored.jobId() + " raised an error (workspace " + errored.workspaceId() + "): "
                + errored.summary();
    }

    record WebhookMessage(String content, String username) {
    }
}
