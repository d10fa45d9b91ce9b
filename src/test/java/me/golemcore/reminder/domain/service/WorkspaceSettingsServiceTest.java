package me.golemcore.reminder.domain.service;

import me.golemcore.reminder.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.reminder.domain.model.ReminderRequestException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.infrastructure.config.AutoConfiguration;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspaceSettingsServiceTest {

    @TempDir
    Path tempDir;

    private WorkspaceSettingsService service;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getReminders().setDefaultTimezone("Europe/Stockholm");
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        service = new WorkspaceSettingsService(storage, AutoConfiguration.objectMapper(), properties);
    }

    @Test
    void shouldReturnDefaultsForUnknownWorkspace() {
        WorkspaceSettings settings = service.getSettings("guild-1");

        assertEquals("Europe/Stockholm", settings.getTimezone());
        assertTrue(settings.isEnabled());
        assertFalse(settings.isAdminOnly());
        assertTrue(settings.getAdmins().isEmpty());
    }

    @Test
    void shouldPersistNormalizedSettings() {
        service.saveSettings("guild-1", WorkspaceSettings.builder()
                .timezone(" America/New_York ")
                .enabled(false)
                .adminOnly(true)
                .admins(List.of("1", "2"))
                .build());

        WorkspaceSettings loaded = service.getSettings("guild-1");

        assertEquals("America/New_York", loaded.getTimezone());
        assertFalse(loaded.isEnabled());
        assertTrue(loaded.isAllowed("2"));
        assertFalse(loaded.isAllowed("3"));
        assertTrue(Files.exists(tempDir.resolve("workspaces").resolve("guild-1.json")));
    }

    @Test
    void shouldRejectUnknownTimezone() {
        WorkspaceSettings settings = WorkspaceSettings.builder().timezone("Mars/Olympus").build();

        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.saveSettings("guild-1", settings));

        assertEquals(ReminderRequestException.Kind.TIMEZONE, e.getKind());
        assertFalse(Files.exists(tempDir.resolve("workspaces").resolve("guild-1.json")));
    }

    @Test
    void shouldFillMissingFieldsFromFile() throws Exception {
        Files.writeString(tempDir.resolve("workspaces").resolve("guild-2.json"),
                "{\"enabled\":true,\"admins\":null}", StandardCharsets.UTF_8);

        WorkspaceSettings settings = service.getSettings("guild-2");

        assertEquals("Europe/Stockholm", settings.getTimezone());
        assertTrue(settings.getAdmins().isEmpty());
    }

    @Test
    void shouldFailOnCorruptFile() throws Exception {
        Files.writeString(tempDir.resolve("workspaces").resolve("guild-3.json"), "{", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> service.getSettings("guild-3"));
    }

    @Test
    void shouldRejectInvalidWorkspaceId() {
        assertThrows(IllegalArgumentException.class, () -> service.getSettings("../etc"));
        assertThrows(IllegalArgumentException.class,
                () -> service.saveSettings("a/b", WorkspaceSettings.builder().build()));
    }
}
