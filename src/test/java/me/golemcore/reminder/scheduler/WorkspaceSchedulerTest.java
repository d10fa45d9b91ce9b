package me.golemcore.reminder.scheduler;

import me.golemcore.reminder.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.reminder.domain.model.DeliveryException;
import me.golemcore.reminder.domain.model.DeliveryPayload;
import me.golemcore.reminder.domain.model.DeliveryTarget;
import me.golemcore.reminder.domain.model.MisfirePolicy;
import me.golemcore.reminder.domain.model.ReminderJob;
import me.golemcore.reminder.domain.model.SchedulerEvent;
import me.golemcore.reminder.domain.service.ReminderJobStore;
import me.golemcore.reminder.domain.trigger.IntervalTrigger;
import me.golemcore.reminder.domain.trigger.OneShotTrigger;
import me.golemcore.reminder.infrastructure.config.AutoConfiguration;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.ErrorReportPort;
import me.golemcore.reminder.port.outbound.MessageSenderPort;
import me.golemcore.reminder.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkspaceSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-02-11T10:00:00Z");
    private static final String WORKSPACE = "guild-1";
    private static final DeliveryTarget CHANNEL = DeliveryTarget.channel("c-1");
    private static final Executor DIRECT = Runnable::run;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ReminderJobStore store;
    private MessageSenderPort sender;
    private ErrorReportPort reporter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        clock = new MutableClock(T0);
        store = new ReminderJobStore(WORKSPACE, storage, AutoConfiguration.objectMapper(), clock, new Random(1));
        sender = mock(MessageSenderPort.class);
        reporter = mock(ErrorReportPort.class);
        when(sender.send(any(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldDeliverOneShotAndRemoveIt() {
        ReminderJob job = store.add(new OneShotTrigger(T0.plus(Duration.ofMinutes(5))), payload("Feed the cat"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofMinutes(4));
        assertEquals(0, scheduler.tick(DIRECT));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, scheduler.tick(DIRECT));

        verify(sender).send(CHANNEL, "<@42>\nFeed the cat");
        assertTrue(store.get(job.getId()).isEmpty());
        verify(reporter, never()).report(any());
    }

    @Test
    void shouldKeepOneShotRescheduledWhileSending() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        when(sender.send(any(), anyString())).thenReturn(pending);
        ReminderJob job = store.add(new OneShotTrigger(T0.plusSeconds(60)), payload("Feed the cat"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, scheduler.tick(DIRECT));
        store.reschedule(job.getId(), new OneShotTrigger(T0.plus(Duration.ofDays(1))));
        pending.complete(null);

        ReminderJob stored = store.get(job.getId()).orElseThrow();
        assertEquals(new OneShotTrigger(T0.plus(Duration.ofDays(1))), stored.getTrigger());
        assertEquals(T0.plus(Duration.ofDays(1)), stored.getNextFireAt());
        assertTrue(scheduler.inFlight().isEmpty());
    }

    @Test
    void shouldKeepOneShotPausedWhileSending() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        when(sender.send(any(), anyString())).thenReturn(pending);
        ReminderJob job = store.add(new OneShotTrigger(T0.plusSeconds(60)), payload("Feed the cat"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofSeconds(60));
        scheduler.tick(DIRECT);
        store.pause(job.getId());
        pending.complete(null);

        assertTrue(store.get(job.getId()).orElseThrow().isPaused());
    }

    @Test
    void shouldKeepFailedOneShotWithoutNextFire() {
        when(sender.send(any(), anyString())).thenReturn(CompletableFuture.failedFuture(
                new DeliveryException(DeliveryException.Kind.REJECTED, "Missing Access")));
        ReminderJob job = store.add(new OneShotTrigger(T0.plusSeconds(60)), payload("Feed the cat"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofSeconds(60));
        scheduler.tick(DIRECT);
        clock.advance(Duration.ofSeconds(60));
        scheduler.tick(DIRECT);

        ArgumentCaptor<SchedulerEvent> event = ArgumentCaptor.forClass(SchedulerEvent.class);
        verify(reporter).report(event.capture());
        SchedulerEvent.JobErrored errored = (SchedulerEvent.JobErrored) event.getValue();
        assertEquals(job.getId(), errored.jobId());
        assertTrue(errored.summary().contains("Missing Access"));

        ReminderJob stored = store.get(job.getId()).orElseThrow();
        assertNull(stored.getNextFireAt());
        verify(sender, times(1)).send(any(), anyString());
        assertTrue(scheduler.inFlight().isEmpty());
    }

    @Test
    void shouldReArmIntervalAfterFiring() {
        ReminderJob job = store.add(IntervalTrigger.builder().period(Duration.ofMinutes(10)).build(),
                payload("Stretch"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofMinutes(10));
        scheduler.tick(DIRECT);

        ReminderJob stored = store.get(job.getId()).orElseThrow();
        assertEquals(T0.plus(Duration.ofMinutes(20)), stored.getNextFireAt());
        assertEquals(T0.plus(Duration.ofMinutes(10)), stored.getLastFiredAt());
        verify(sender).send(CHANNEL, "<@42>\nStretch");
    }

    @Test
    void shouldSkipJobWhileSendInFlight() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        when(sender.send(any(), anyString())).thenReturn(pending);
        store.add(IntervalTrigger.builder().period(Duration.ofMinutes(1)).build(), payload("Ping"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, scheduler.tick(DIRECT));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(0, scheduler.tick(DIRECT));

        pending.complete(null);
        assertTrue(scheduler.inFlight().isEmpty());
        verify(sender, times(1)).send(any(), anyString());
    }

    @Test
    void shouldReportMissedRunsAndFireOnceWhenCoalescing() {
        ReminderJob job = minuteJob();
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.set(T0.plus(Duration.ofSeconds(630)));
        scheduler.tick(DIRECT);

        List<SchedulerEvent> events = reportedEvents();
        assertEquals(9, events.size());
        assertTrue(events.stream().allMatch(SchedulerEvent.JobMissed.class::isInstance));
        assertEquals(T0.plus(Duration.ofMinutes(1)), ((SchedulerEvent.JobMissed) events.get(0)).scheduledAt());
        verify(sender, times(1)).send(any(), anyString());
        assertEquals(T0.plus(Duration.ofMinutes(11)), store.get(job.getId()).orElseThrow().getNextFireAt());
    }

    @Test
    void shouldFireEachDueInstant() {
        minuteJob();
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.FIRE_EACH);

        clock.set(T0.plus(Duration.ofSeconds(630)));
        scheduler.tick(DIRECT);

        verify(sender, times(10)).send(any(), anyString());
        assertEquals(9, reportedEvents().size());
    }

    @Test
    void shouldFireOnlyTimelyInstantWhenSkippingLate() {
        minuteJob();
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.SKIP_LATE);

        clock.set(T0.plus(Duration.ofSeconds(630)));
        scheduler.tick(DIRECT);

        verify(sender, times(1)).send(any(), anyString());
        assertEquals(9, reportedEvents().size());
    }

    @Test
    void shouldNotFireWhenEveryInstantIsLateAndSkippingLate() {
        ReminderJob job = store.add(IntervalTrigger.builder().period(Duration.ofMinutes(5)).build(),
                payload("Late"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.SKIP_LATE);

        clock.set(T0.plus(Duration.ofMinutes(7)));
        assertEquals(0, scheduler.tick(DIRECT));

        verify(sender, never()).send(any(), anyString());
        verify(reporter).report(new SchedulerEvent.JobMissed(WORKSPACE, job.getId(), T0.plus(Duration.ofMinutes(5))));
        assertEquals(T0.plus(Duration.ofMinutes(10)), store.get(job.getId()).orElseThrow().getNextFireAt());
    }

    @Test
    void shouldDropLateOneShotWhenSkippingLate() {
        ReminderJob job = store.add(new OneShotTrigger(T0.plusSeconds(60)), payload("Too late"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.SKIP_LATE);

        clock.set(T0.plus(Duration.ofMinutes(10)));
        scheduler.tick(DIRECT);

        verify(sender, never()).send(any(), anyString());
        assertTrue(store.get(job.getId()).isEmpty());
    }

    @Test
    void shouldKeepFiringWhenReportSinkFails() {
        doThrow(new IllegalStateException("webhook down")).when(reporter).report(any());
        ReminderJob job = minuteJob();
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.set(T0.plus(Duration.ofSeconds(630)));
        assertEquals(1, scheduler.tick(DIRECT));

        verify(sender).send(any(), anyString());
        assertEquals(T0.plus(Duration.ofMinutes(11)), store.get(job.getId()).orElseThrow().getNextFireAt());
    }

    @Test
    void shouldIsolateSenderThatThrows() {
        when(sender.send(any(), anyString())).thenThrow(new IllegalStateException("boom"));
        ReminderJob first = store.add(new OneShotTrigger(T0.plusSeconds(30)), payload("first"));
        ReminderJob second = store.add(new OneShotTrigger(T0.plusSeconds(30)), payload("second"));
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofSeconds(30));
        assertEquals(2, scheduler.tick(DIRECT));

        verify(reporter).report(new SchedulerEvent.JobErrored(WORKSPACE, first.getId(), "IllegalStateException: boom"));
        verify(reporter).report(new SchedulerEvent.JobErrored(WORKSPACE, second.getId(), "IllegalStateException: boom"));
    }

    @Test
    void shouldReportTimedOutSend() {
        when(sender.send(any(), anyString())).thenReturn(new CompletableFuture<>());
        ReminderJob job = store.add(new OneShotTrigger(T0.plusSeconds(30)), payload("slow"));
        WorkspaceScheduler scheduler = new WorkspaceScheduler(WORKSPACE, store, true, sender, reporter, clock,
                new SchedulerOptions(MisfirePolicy.COALESCE, Duration.ofSeconds(60), 100, Duration.ofSeconds(1)),
                ConcurrentHashMap.newKeySet());

        clock.advance(Duration.ofSeconds(30));
        scheduler.tick(DIRECT);

        verify(reporter, timeout(3000)).report(
                new SchedulerEvent.JobErrored(WORKSPACE, job.getId(), "Delivery timed out after 1s"));
    }

    @Test
    void shouldNotFireInDisabledWorkspace() {
        store.add(new OneShotTrigger(T0.plusSeconds(30)), payload("muted"));
        WorkspaceScheduler scheduler = new WorkspaceScheduler(WORKSPACE, store, false, sender, reporter, clock,
                options(MisfirePolicy.COALESCE), ConcurrentHashMap.newKeySet());

        clock.advance(Duration.ofMinutes(1));

        assertEquals(0, scheduler.tick(DIRECT));
        verify(sender, never()).send(any(), anyString());
        assertEquals(1, store.size());
    }

    @Test
    void shouldSendBareMessageToDirectMessageTarget() {
        DeliveryTarget dm = DeliveryTarget.directMessage("42", WORKSPACE);
        store.add(new OneShotTrigger(T0.plusSeconds(30)), DeliveryPayload.builder()
                .target(dm).message("private").authorId("42").workspaceId(WORKSPACE).build());
        WorkspaceScheduler scheduler = scheduler(MisfirePolicy.COALESCE);

        clock.advance(Duration.ofSeconds(30));
        scheduler.tick(DIRECT);

        verify(sender).send(eq(dm), eq("private"));
    }

    private ReminderJob minuteJob() {
        return store.add(IntervalTrigger.builder().period(Duration.ofMinutes(1)).build(), payload("Every minute"));
    }

    private List<SchedulerEvent> reportedEvents() {
        ArgumentCaptor<SchedulerEvent> captor = ArgumentCaptor.forClass(SchedulerEvent.class);
        verify(reporter, atLeast(0)).report(captor.capture());
        return captor.getAllValues();
    }

    private WorkspaceScheduler scheduler(MisfirePolicy policy) {
        return new WorkspaceScheduler(WORKSPACE, store, true, sender, reporter, clock, options(policy),
                ConcurrentHashMap.newKeySet());
    }

    private static SchedulerOptions options(MisfirePolicy policy) {
        return new SchedulerOptions(policy, Duration.ofSeconds(60), 100, Duration.ofSeconds(10));
    }

    private static DeliveryPayload payload(String message) {
        return DeliveryPayload.builder()
                .target(CHANNEL)
                .message(message)
                .authorId("42")
                .workspaceId(WORKSPACE)
                .build();
    }
}
