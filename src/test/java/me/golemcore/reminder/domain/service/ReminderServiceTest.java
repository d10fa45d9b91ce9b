package me.golemcore.reminder.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reminder.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.reminder.adapter.outbound.time.NaturalTimeParserAdapter;
import me.golemcore.reminder.domain.model.CronSchedule;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.ImportResult;
import me.golemcore.reminder.domain.model.IntervalSchedule;
import me.golemcore.reminder.domain.model.JobNotFoundException;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.model.ReminderRequest;
import me.golemcore.reminder.domain.model.ReminderRequestException;
import me.golemcore.reminder.domain.model.ReminderView;
import me.golemcore.reminder.domain.model.WorkspaceAccessException;
import me.golemcore.reminder.domain.model.WorkspaceSettings;
import me.golemcore.reminder.domain.trigger.CronTrigger;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.OneShotTrigger;
import me.golemcore.reminder.infrastructure.config.AutoConfiguration;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.ErrorReportPort;
import me.golemcore.reminder.port.outbound.MessageSenderPort;
import me.golemcore.reminder.scheduler.WorkspaceRuntimeRegistry;
import me.golemcore.reminder.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ReminderServiceTest {

    private static final Instant T0 = Instant.parse("2026-02-11T10:00:00Z");
    private static final String WORKSPACE = "guild-1";
    private static final String AUTHOR = "42";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private WorkspaceSettingsService settingsService;
    private WorkspaceRuntimeRegistry registry;
    private ReminderService service;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getReminders().setDefaultTimezone("Europe/Stockholm");
        properties.getReminders().setMinIntervalSeconds(30);
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(T0);

        settingsService = new WorkspaceSettingsService(storage, objectMapper, properties);
        registry = new WorkspaceRuntimeRegistry(settingsService, storage, objectMapper, clock,
                mock(MessageSenderPort.class), mock(ErrorReportPort.class), properties);
        service = new ReminderService(registry, new NaturalTimeParserAdapter(clock), new CountdownFormatter(clock),
                properties, clock);
    }

    @Test
    void shouldCreateOneShotFromRelativeTime() {
        ReminderJob job = service.createOneShot(WORKSPACE, channelRequest("Feed the cat"), "in 5 minutes");

        OneShotTrigger trigger = assertInstanceOf(OneShotTrigger.class, job.getTrigger());
        assertEquals(T0.plus(Duration.ofMinutes(5)), trigger.fireAt());
        assertEquals(T0.plus(Duration.ofMinutes(5)), job.getNextFireAt());
        assertEquals("Feed the cat", job.getPayload().message());
        assertEquals(AUTHOR, job.getPayload().authorId());
        assertEquals(WORKSPACE, job.getPayload().workspaceId());
        assertEquals("5 minutes", service.get(WORKSPACE, job.getId()).countdown());
    }

    @Test
    void shouldReadWallClockTimesInWorkspaceTimezone() {
        ReminderJob job = service.createOneShot(WORKSPACE, channelRequest("Standup"), "2026-02-12 09:00");

        assertEquals(Instant.parse("2026-02-12T08:00:00Z"), job.getNextFireAt());
    }

    @Test
    void shouldRejectUnparseableTimeWithoutCreatingJob() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createOneShot(WORKSPACE, channelRequest("Feed the cat"), "whenever you like"));

        assertEquals(ReminderRequestException.Kind.TIME, e.getKind());
        assertEquals("whenever you like", e.getInput());
        assertEquals(0, registry.runtime(WORKSPACE).store().size());
    }

    @Test
    void shouldRejectTimeInPast() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createOneShot(WORKSPACE, channelRequest("Too late"), "2026-02-10 09:00"));

        assertEquals(ReminderRequestException.Kind.TIME, e.getKind());
    }

    @Test
    void shouldRejectEmptyMessage() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createOneShot(WORKSPACE, channelRequest("  "), "in 5 minutes"));

        assertEquals(ReminderRequestException.Kind.MESSAGE, e.getKind());
    }

    @Test
    void shouldCreateIntervalAnchoredNow() {
        ReminderJob job = service.createInterval(WORKSPACE, channelRequest("Drink water"),
                new IntervalSchedule(Duration.ofHours(2), null, null, null, null));

        IntervalTrigger trigger = assertInstanceOf(IntervalTrigger.class, job.getTrigger());
        assertEquals(T0, trigger.start());
        assertEquals(T0.plus(Duration.ofHours(2)), job.getNextFireAt());
    }

    @Test
    void shouldRejectIntervalBelowMinimum() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createInterval(WORKSPACE, channelRequest("Spam"),
                        new IntervalSchedule(Duration.ofSeconds(10), null, null, null, null)));

        assertEquals(ReminderRequestException.Kind.INTERVAL, e.getKind());
        assertEquals(0, registry.runtime(WORKSPACE).store().size());
    }

    @Test
    void shouldRejectUnknownTimezoneArgument() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createInterval(WORKSPACE, channelRequest("Drink water"),
                        new IntervalSchedule(Duration.ofHours(1), "tomorrow 08:00", null, "Mars/Olympus", null)));

        assertEquals(ReminderRequestException.Kind.TIMEZONE, e.getKind());
    }

    @Test
    void shouldCreateCronInWorkspaceTimezone() {
        ReminderJob job = service.createCron(WORKSPACE, channelRequest("Daily standup"),
                CronSchedule.builder().hour("9").build());

        CronTrigger trigger = assertInstanceOf(CronTrigger.class, job.getTrigger());
        assertEquals("Europe/Stockholm", trigger.timezone());
        assertEquals(Instant.parse("2026-02-12T08:00:00Z"), job.getNextFireAt());
    }

    @Test
    void shouldRejectInvalidCronField() {
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.createCron(WORKSPACE, channelRequest("Broken"),
                        CronSchedule.builder().minute("61").build()));

        assertEquals(ReminderRequestException.Kind.CRON, e.getKind());
        assertTrue(e.getInput().contains("61"));
    }

    @Test
    void shouldListSoonestFirstAndPausedLast() {
        ReminderJob later = service.createOneShot(WORKSPACE, channelRequest("later"), "in 2 hours");
        ReminderJob paused = service.createOneShot(WORKSPACE, channelRequest("paused"), "in 5 minutes");
        ReminderJob sooner = service.createOneShot(WORKSPACE, channelRequest("sooner"), "in 1 hour");
        service.pause(WORKSPACE, AUTHOR, paused.getId());

        List<ReminderView> views = service.list(WORKSPACE);

        assertEquals(List.of(sooner.getId(), later.getId(), paused.getId()),
                views.stream().map(view -> view.job().getId()).toList());
        assertEquals("1 hour", views.get(0).countdown());
        assertEquals(CountdownFormatter.PAUSED, views.get(2).countdown());
        assertEquals("once at " + T0.plus(Duration.ofHours(1)), views.get(0).description());
    }

    @Test
    void shouldThrowNotFoundForUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> service.get(WORKSPACE, "missing"));
        assertThrows(JobNotFoundException.class, () -> service.pause(WORKSPACE, AUTHOR, "missing"));
        assertThrows(JobNotFoundException.class, () -> service.remove(WORKSPACE, AUTHOR, "missing"));
        assertThrows(JobNotFoundException.class,
                () -> service.modifyMessage(WORKSPACE, AUTHOR, "missing", "text"));
    }

    @Test
    void shouldRestrictMutationsToAdmins() {
        settingsService.saveSettings(WORKSPACE, WorkspaceSettings.builder()
                .adminOnly(true)
                .admins(List.of("1"))
                .build());

        assertThrows(WorkspaceAccessException.class,
                () -> service.createOneShot(WORKSPACE, channelRequest("nope"), "in 5 minutes"));

        ReminderJob job = service.createOneShot(WORKSPACE,
                new ReminderRequest("1", DeliveryTarget.channel("c-1"), "admin reminder"), "in 5 minutes");
        assertEquals("1", job.getPayload().authorId());
        assertEquals(1, service.list(WORKSPACE).size());
    }

    @Test
    void shouldRejectMutationsInDisabledWorkspaceButAllowReads() {
        settingsService.saveSettings(WORKSPACE, WorkspaceSettings.builder().enabled(false).build());

        assertThrows(WorkspaceAccessException.class,
                () -> service.createOneShot(WORKSPACE, channelRequest("nope"), "in 5 minutes"));
        assertTrue(service.list(WORKSPACE).isEmpty());
    }

    @Test
    void shouldPauseAndResume() {
        ReminderJob job = service.createInterval(WORKSPACE, channelRequest("Stretch"),
                new IntervalSchedule(Duration.ofHours(1), null, "2026-02-13 09:00", null, Duration.ofSeconds(30)));
        IntervalTrigger expected = IntervalTrigger.builder()
                .period(Duration.ofHours(1))
                .start(T0)
                .end(Instant.parse("2026-02-13T08:00:00Z"))
                .jitter(Duration.ofSeconds(30))
                .build();

        ReminderJob paused = service.pause(WORKSPACE, AUTHOR, job.getId());
        clock.advance(Duration.ofMinutes(150));
        ReminderJob resumed = service.resume(WORKSPACE, AUTHOR, job.getId());

        assertTrue(paused.isPaused());
        assertEquals(expected, paused.getTrigger());
        assertFalse(resumed.isPaused());
        assertEquals(expected, resumed.getTrigger());
        assertFalse(resumed.getNextFireAt().isBefore(T0.plus(Duration.ofHours(3))));
        assertFalse(resumed.getNextFireAt().isAfter(T0.plus(Duration.ofHours(3)).plusSeconds(30)));
    }

    @Test
    void shouldPauseAndResumeCronKeepingFields() {
        ReminderJob job = service.createCron(WORKSPACE, channelRequest("Review"), CronSchedule.builder()
                .minute("15")
                .hour("9-17/2")
                .dayOfWeek("MON-FRI")
                .endText("2026-06-01 00:00")
                .timezone("Asia/Tokyo")
                .build());
        CronTrigger expected = CronTrigger.builder()
                .minute("15")
                .hour("9-17/2")
                .dayOfWeek("MON-FRI")
                .end(Instant.parse("2026-05-31T15:00:00Z"))
                .timezone("Asia/Tokyo")
                .build();

        ReminderJob paused = service.pause(WORKSPACE, AUTHOR, job.getId());
        clock.advance(Duration.ofDays(2));
        ReminderJob resumed = service.resume(WORKSPACE, AUTHOR, job.getId());

        assertEquals(expected, job.getTrigger());
        assertEquals(expected, paused.getTrigger());
        assertEquals(expected, resumed.getTrigger());
        assertEquals(expected.next(clock.instant()), resumed.getNextFireAt());
    }

    @Test
    void shouldRejectResumeOfExpiredOneShot() {
        ReminderJob job = service.createOneShot(WORKSPACE, channelRequest("missed"), "in 5 minutes");
        service.pause(WORKSPACE, AUTHOR, job.getId());
        clock.advance(Duration.ofMinutes(10));

        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.resume(WORKSPACE, AUTHOR, job.getId()));

        assertEquals(ReminderRequestException.Kind.TIME, e.getKind());
        ReminderView view = service.get(WORKSPACE, job.getId());
        assertTrue(view.job().isPaused());
        assertEquals(CountdownFormatter.PAUSED, view.countdown());
    }

    @Test
    void shouldRescheduleOnlyOneShotJobs() {
        ReminderJob once = service.createOneShot(WORKSPACE, channelRequest("once"), "in 5 minutes");
        ReminderJob interval = service.createInterval(WORKSPACE, channelRequest("repeat"),
                new IntervalSchedule(Duration.ofHours(1), null, null, null, null));
        service.pause(WORKSPACE, AUTHOR, once.getId());

        ReminderJob moved = service.reschedule(WORKSPACE, AUTHOR, once.getId(), "in 30 minutes");
        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.reschedule(WORKSPACE, AUTHOR, interval.getId(), "in 30 minutes"));

        assertFalse(moved.isPaused());
        assertEquals(T0.plus(Duration.ofMinutes(30)), moved.getNextFireAt());
        assertEquals(ReminderRequestException.Kind.TIME, e.getKind());
    }

    @Test
    void shouldRescheduleIntervalPeriodFromNow() {
        ReminderJob job = service.createInterval(WORKSPACE, channelRequest("Drink water"),
                new IntervalSchedule(Duration.ofHours(1), null, "2026-02-12 09:00", null, null));
        clock.advance(Duration.ofMinutes(20));

        ReminderJob moved = service.rescheduleInterval(WORKSPACE, AUTHOR, job.getId(),
                new IntervalSchedule(Duration.ofHours(2), null, null, null, null));

        IntervalTrigger trigger = assertInstanceOf(IntervalTrigger.class, moved.getTrigger());
        assertEquals(Duration.ofHours(2), trigger.period());
        assertEquals(T0.plus(Duration.ofMinutes(20)), trigger.start());
        assertEquals(Instant.parse("2026-02-12T08:00:00Z"), trigger.end());
        assertEquals(T0.plus(Duration.ofMinutes(140)), moved.getNextFireAt());
    }

    @Test
    void shouldRescheduleIntervalStartKeepingPeriod() {
        ReminderJob job = service.createInterval(WORKSPACE, channelRequest("Drink water"),
                new IntervalSchedule(Duration.ofHours(1), null, null, null, null));
        service.pause(WORKSPACE, AUTHOR, job.getId());

        ReminderJob moved = service.rescheduleInterval(WORKSPACE, AUTHOR, job.getId(),
                new IntervalSchedule(null, "2026-02-12 08:00", null, null, null));

        IntervalTrigger trigger = assertInstanceOf(IntervalTrigger.class, moved.getTrigger());
        assertEquals(Duration.ofHours(1), trigger.period());
        assertEquals(Instant.parse("2026-02-12T07:00:00Z"), trigger.start());
        assertFalse(moved.isPaused());
        assertEquals(Instant.parse("2026-02-12T07:00:00Z"), moved.getNextFireAt());
    }

    @Test
    void shouldRejectIntervalRescheduleBelowMinimum() {
        ReminderJob job = service.createInterval(WORKSPACE, channelRequest("Drink water"),
                new IntervalSchedule(Duration.ofHours(1), null, null, null, null));

        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleInterval(WORKSPACE, AUTHOR, job.getId(),
                        new IntervalSchedule(Duration.ofSeconds(5), null, null, null, null)));

        assertEquals(ReminderRequestException.Kind.INTERVAL, e.getKind());
        assertEquals(job.getTrigger(), service.get(WORKSPACE, job.getId()).job().getTrigger());
    }

    @Test
    void shouldRescheduleCronFieldsKeepingOthers() {
        ReminderJob job = service.createCron(WORKSPACE, channelRequest("Standup"), CronSchedule.builder()
                .minute("30")
                .hour("9")
                .dayOfWeek("MON-FRI")
                .timezone("America/New_York")
                .build());
        assertEquals(Instant.parse("2026-02-11T14:30:00Z"), job.getNextFireAt());

        ReminderJob moved = service.rescheduleCron(WORKSPACE, AUTHOR, job.getId(),
                CronSchedule.builder().hour("17").build());

        CronTrigger trigger = assertInstanceOf(CronTrigger.class, moved.getTrigger());
        assertEquals("30", trigger.minute());
        assertEquals("17", trigger.hour());
        assertEquals("MON-FRI", trigger.dayOfWeek());
        assertEquals("America/New_York", trigger.timezone());
        assertEquals(Instant.parse("2026-02-11T22:30:00Z"), moved.getNextFireAt());
    }

    @Test
    void shouldRescheduleCronTimezoneOnly() {
        ReminderJob job = service.createCron(WORKSPACE, channelRequest("Daily standup"),
                CronSchedule.builder().hour("9").build());

        ReminderJob moved = service.rescheduleCron(WORKSPACE, AUTHOR, job.getId(),
                CronSchedule.builder().timezone("UTC").build());

        CronTrigger trigger = assertInstanceOf(CronTrigger.class, moved.getTrigger());
        assertEquals("9", trigger.hour());
        assertEquals("UTC", trigger.timezone());
        assertEquals(Instant.parse("2026-02-12T09:00:00Z"), moved.getNextFireAt());
    }

    @Test
    void shouldRejectCronRescheduleWithoutFutureRun() {
        ReminderJob job = service.createCron(WORKSPACE, channelRequest("Daily standup"),
                CronSchedule.builder().hour("9").build());

        ReminderRequestException e = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleCron(WORKSPACE, AUTHOR, job.getId(),
                        CronSchedule.builder().year("2025").build()));

        assertEquals(ReminderRequestException.Kind.CRON, e.getKind());
        ReminderJob unchanged = service.get(WORKSPACE, job.getId()).job();
        assertEquals(job.getTrigger(), unchanged.getTrigger());
        assertEquals(job.getNextFireAt(), unchanged.getNextFireAt());
    }

    @Test
    void shouldRejectRescheduleOfWrongKindOrWithNothingToChange() {
        ReminderJob once = service.createOneShot(WORKSPACE, channelRequest("once"), "in 5 minutes");
        ReminderJob interval = service.createInterval(WORKSPACE, channelRequest("repeat"),
                new IntervalSchedule(Duration.ofHours(1), null, null, null, null));
        ReminderJob cron = service.createCron(WORKSPACE, channelRequest("daily"),
                CronSchedule.builder().hour("9").build());

        ReminderRequestException notInterval = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleInterval(WORKSPACE, AUTHOR, cron.getId(),
                        new IntervalSchedule(Duration.ofHours(2), null, null, null, null)));
        ReminderRequestException notCron = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleCron(WORKSPACE, AUTHOR, once.getId(),
                        CronSchedule.builder().hour("10").build()));
        ReminderRequestException noInterval = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleInterval(WORKSPACE, AUTHOR, interval.getId(),
                        new IntervalSchedule(null, null, null, null, null)));
        ReminderRequestException noCron = assertThrows(ReminderRequestException.class,
                () -> service.rescheduleCron(WORKSPACE, AUTHOR, cron.getId(), CronSchedule.builder().build()));

        assertEquals(ReminderRequestException.Kind.INTERVAL, notInterval.getKind());
        assertEquals(ReminderRequestException.Kind.CRON, notCron.getKind());
        assertEquals(ReminderRequestException.Kind.INTERVAL, noInterval.getKind());
        assertEquals(ReminderRequestException.Kind.CRON, noCron.getKind());
        assertThrows(JobNotFoundException.class, () -> service.rescheduleCron(WORKSPACE, AUTHOR, "missing",
                CronSchedule.builder().hour("10").build()));
    }

    @Test
    void shouldModifyMessageOnly() {
        ReminderJob job = service.createOneShot(WORKSPACE, channelRequest("old"), "in 5 minutes");

        ReminderJob modified = service.modifyMessage(WORKSPACE, AUTHOR, job.getId(), "new");

        assertEquals("new", modified.getPayload().message());
        assertEquals(job.getNextFireAt(), modified.getNextFireAt());
        assertThrows(ReminderRequestException.class,
                () -> service.modifyMessage(WORKSPACE, AUTHOR, job.getId(), ""));
    }

    @Test
    void shouldRemoveJob() {
        ReminderJob job = service.createOneShot(WORKSPACE, channelRequest("gone"), "in 5 minutes");

        service.remove(WORKSPACE, AUTHOR, job.getId());

        assertThrows(JobNotFoundException.class, () -> service.get(WORKSPACE, job.getId()));
    }

    @Test
    void shouldBindDirectMessagesToWorkspace() {
        ReminderRequest request = new ReminderRequest(AUTHOR, DeliveryTarget.directMessage(AUTHOR, "elsewhere"),
                "private note");

        ReminderJob job = service.createOneShot(WORKSPACE, request, "in 5 minutes");

        assertTrue(job.getPayload().target().isDirectMessage());
        assertEquals(WORKSPACE, job.getPayload().target().workspaceId());
    }

    @Test
    void shouldCopyJobsBetweenWorkspaces() {
        service.createOneShot(WORKSPACE, channelRequest("one"), "in 5 minutes");
        service.createOneShot(WORKSPACE, channelRequest("two"), "in 10 minutes");
        String blob = service.exportJobs(WORKSPACE, AUTHOR);

        ImportResult first = service.importJobs("guild-2", AUTHOR, blob, true);
        ImportResult second = service.importJobs("guild-2", AUTHOR, blob, true);

        assertEquals(2, first.imported().size());
        assertEquals(0, second.imported().size());
        assertEquals(2, second.skipped().size());
        assertEquals(2, service.list("guild-2").size());
    }

    @Test
    void shouldRebindImportedDirectMessagesToImportingWorkspace() {
        ReminderJob job = service.createOneShot(WORKSPACE,
                new ReminderRequest(AUTHOR, DeliveryTarget.directMessage(AUTHOR, WORKSPACE), "private note"),
                "in 5 minutes");
        String blob = service.exportJobs(WORKSPACE, AUTHOR);

        service.importJobs("guild-2", AUTHOR, blob, false);

        ReminderJob imported = service.get("guild-2", job.getId()).job();
        assertEquals("guild-2", imported.getPayload().workspaceId());
        assertEquals(DeliveryTarget.directMessage(AUTHOR, "guild-2"), imported.getPayload().target());
        assertEquals(WORKSPACE, service.get(WORKSPACE, job.getId()).job().getPayload().workspaceId());
    }

    private static ReminderRequest channelRequest(String message) {
        return new ReminderRequest(AUTHOR, DeliveryTarget.channel("c-1"), message);
    }
}
