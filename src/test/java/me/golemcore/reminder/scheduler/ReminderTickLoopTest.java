package me.golemcore.reminder.scheduler;

import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.migration.LegacyMigrationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderTickLoopTest {

    private WorkspaceRuntimeRegistry registry;
    private LegacyMigrationService migrationService;
    private BotProperties properties;
    private ReminderTickLoop tickLoop;

    @BeforeEach
    void setUp() {
        registry = mock(WorkspaceRuntimeRegistry.class);
        migrationService = mock(LegacyMigrationService.class);
        properties = new BotProperties();
        properties.getReminders().setTickIntervalSeconds(1);
        tickLoop = new ReminderTickLoop(registry, migrationService, properties);
    }

    @AfterEach
    void tearDown() {
        tickLoop.shutdown();
    }

    @Test
    void shouldMigrateBeforeOpeningStores() {
        tickLoop.init();

        InOrder order = inOrder(migrationService, registry);
        order.verify(migrationService).migrate();
        order.verify(registry).openExisting();
    }

    @Test
    void shouldSkipMigrationWhenDisabled() {
        properties.getReminders().getMigration().setEnabled(false);

        tickLoop.init();

        verify(migrationService, never()).migrate();
        verify(registry).openExisting();
    }

    @Test
    void shouldStartEvenWhenMigrationFails() {
        when(migrationService.migrate()).thenThrow(new IllegalStateException("disk full"));

        tickLoop.init();

        verify(registry).openExisting();
    }

    @Test
    void shouldTickOpenWorkspacesPeriodically() {
        WorkspaceScheduler scheduler = mock(WorkspaceScheduler.class);
        when(registry.all()).thenReturn(List.of(runtime("guild-1", scheduler)));

        tickLoop.init();

        verify(scheduler, timeout(3000).atLeastOnce()).tick(any());
    }

    @Test
    void shouldIsolateFailingWorkspace() {
        WorkspaceScheduler broken = mock(WorkspaceScheduler.class);
        WorkspaceScheduler healthy = mock(WorkspaceScheduler.class);
        when(broken.tick(any())).thenThrow(new IllegalStateException("corrupt"));
        when(registry.all()).thenReturn(List.of(runtime("guild-1", broken), runtime("guild-2", healthy)));

        tickLoop.tick();

        verify(broken).tick(any());
        verify(healthy, atLeastOnce()).tick(any());
    }

    private static WorkspaceRuntime runtime(String workspaceId, WorkspaceScheduler scheduler) {
        return new WorkspaceRuntime(workspaceId, WorkspaceSettings.builder().timezone("UTC").build(),
                ZoneOffset.UTC, null, scheduler);
    }
}
