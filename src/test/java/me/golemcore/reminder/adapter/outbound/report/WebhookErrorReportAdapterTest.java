package me.golemcore.reminder.adapter.outbound.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reminder.domain.model.SchedulerEvent;
import me.golemcore.reminder.infrastructure.config.AutoConfiguration;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class WebhookErrorReportAdapterTest {

    private static final SchedulerEvent MISSED = new SchedulerEvent.JobMissed("guild-1", "abc",
            Instant.parse("2026-02-11T10:00:00Z"));
    private static final SchedulerEvent ERRORED = new SchedulerEvent.JobErrored("guild-1", "abc",
            "DeliveryException: HTTP 403");

    private MockWebServer mockServer;
    private BotProperties properties;
    private ObjectMapper objectMapper;
    private WebhookErrorReportAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        properties = new BotProperties();
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new WebhookErrorReportAdapter(properties, new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldDescribeMissedRun() {
        assertEquals("Job abc was missed! Was scheduled at 2026-02-11T10:00:00Z (workspace guild-1)",
                WebhookErrorReportAdapter.describe(MISSED));
    }

    @Test
    void shouldDescribeFailedDelivery() {
        assertEquals("Job abc raised an error (workspace guild-1): DeliveryException: HTTP 403",
                WebhookErrorReportAdapter.describe(ERRORED));
    }

    @Test
    void shouldPostReportToWebhook() throws Exception {
        properties.getReminders().getErrorWebhook().setUrl(mockServer.url("/webhook").toString());
        properties.getReminders().getErrorWebhook().setUsername("reminders");
        mockServer.enqueue(new MockResponse().setResponseCode(204));

        adapter.report(ERRORED);

        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(WebhookErrorReportAdapter.describe(ERRORED), body.get("content").asText());
        assertEquals("reminders", body.get("username").asText());
    }

    @Test
    void shouldOnlyLogWithoutWebhook() throws Exception {
        adapter.report(MISSED);

        assertNull(mockServer.takeRequest(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldIgnoreWebhookFailures() {
        properties.getReminders().getErrorWebhook().setUrl(mockServer.url("/webhook").toString());
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        assertDoesNotThrow(() -> adapter.report(MISSED));
    }
}
