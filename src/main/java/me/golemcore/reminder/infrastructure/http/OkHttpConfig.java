package me.golemcore.reminder.infrastructure.http;

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
import me.golemcore.reminder.infrastructure.config.BotProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for the delivery gateway and the error webhook.
 *
 * <p>
 * Timeouts and pool size come from {@code bot.http.*}. Adapters derive their
 * own client with {@link OkHttpClient#newBuilder()} to set a call timeout, so
 * the connection pool stays shared. Every request carries
 * {@value #USER_AGENT} unless the caller sets its own.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    static final String USER_AGENT = "golemcore-reminders/1.0";

    private final BotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        return buildClient(properties.getHttp());
    }

    static OkHttpClient buildClient(BotProperties.HttpProperties http) {
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                // Gateway posts are not idempotent.
                .retryOnConnectionFailure(false)
                .addInterceptor(userAgent())
                .build();
    }

    private static Interceptor userAgent() {
        return chain -> {
            if (chain.request().header("User-Agent") != null) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder()
                    .header("User-Agent", USER_AGENT)
                    .build());
        };
    }
}
