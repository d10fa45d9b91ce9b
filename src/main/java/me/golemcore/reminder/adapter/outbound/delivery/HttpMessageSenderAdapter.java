package me.golemcore.reminder.adapter.outbound.delivery;

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
import me.golemcore.reminder.domain.model.DeliveryException;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.MessageSenderPort;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delivers reminder texts through the chat gateway's HTTP API.
 *
 * <p>
 * Each message is a {@code POST} of
 * {@code {"channelId", "userId", "workspaceId", "content"}} to
 * {@code bot.reminders.delivery.url}, with a bearer token when
 * {@code bot.reminders.delivery.api-key} is set. Calls are asynchronous
 * ({@link Call#enqueue(Callback)}); the returned future fails with a
 * {@link DeliveryException} whose kind tells timeouts, rejections and
 * unreachable gateways apart.
 */
@Component
@Slf4j
public class HttpMessageSenderAdapter implements MessageSenderPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int HTTP_CLIENT_ERROR = 400;
    private static final int HTTP_SERVER_ERROR = 500;

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpMessageSenderAdapter(BotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getReminders().getDelivery().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<Void> send(DeliveryTarget target, String text) {
        BotProperties.DeliveryProperties delivery = properties.getReminders().getDelivery();
        String url = delivery.getUrl();
        if (url == null || url.isBlank()) {
            return CompletableFuture.failedFuture(new DeliveryException(DeliveryException.Kind.UNREACHABLE,
                    "Delivery endpoint not configured"));
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(
                    new DeliveryRequest(target.channelId(), target.userId(), target.workspaceId(), text));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new DeliveryException(DeliveryException.Kind.UNKNOWN,
                    "Failed to encode message for " + target, e));
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON));
        String apiKey = delivery.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        httpClient.newCall(requestBuilder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                DeliveryException.Kind kind = e instanceof InterruptedIOException
                        ? DeliveryException.Kind.TIMEOUT
                        : DeliveryException.Kind.UNREACHABLE;
                result.completeExceptionally(new DeliveryException(kind,
                        "Delivery to " + target + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        log.debug("[Delivery] Sent {} chars to {}", text.length(), target);
                        result.complete(null);
                        return;
                    }
                    int code = response.code();
                    DeliveryException.Kind kind = code >= HTTP_CLIENT_ERROR && code < HTTP_SERVER_ERROR
                            ? DeliveryException.Kind.REJECTED
                            : DeliveryException.Kind.UNKNOWN;
                    result.completeExceptionally(new DeliveryException(kind,
                            "Delivery to " + target + " failed: HTTP " + code));
                }
            }
        });
        return result;
    }

    record DeliveryRequest(String channelId, String userId, String workspaceId, String content) {
    }
}
