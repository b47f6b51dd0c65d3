package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.lane.CommandLaneService;
import me.golemcore.relay.domain.model.CronWakeMode;
import me.golemcore.relay.domain.model.MainSessionWakeRequestedEvent;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MainSessionEventServiceTest {

    private ExecutorService laneExecutor;
    private ScheduledExecutorService timeoutScheduler;
    private CommandLaneService laneService;
    private SystemEventQueue queue;
    private ApplicationEventPublisher publisher;
    private MainSessionEventService service;

    @BeforeEach
    void setUp() {
        laneExecutor = Executors.newCachedThreadPool();
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        laneService = new CommandLaneService(laneExecutor, timeoutScheduler);
        queue = new SystemEventQueue();
        publisher = mock(ApplicationEventPublisher.class);
        service = new MainSessionEventService(laneService, queue, publisher, new RelayProperties());
    }

    @AfterEach
    void tearDown() {
        laneExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
    }

    @Test
    void shouldQueueLineWithoutWakeOnNextHeartbeat() throws Exception {
        assertTrue(service.enqueueSystemEvent("check inbox", CronWakeMode.NEXT_HEARTBEAT, "cron:j1")
                .get(2, TimeUnit.SECONDS));

        assertEquals(List.of("check inbox"), queue.peek("main"));
        verify(publisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldPublishWakeRequestForNowWithJobId() throws Exception {
        service.enqueueSystemEvent("check inbox", CronWakeMode.NOW, "cron:j1").get(2, TimeUnit.SECONDS);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        MainSessionWakeRequestedEvent event = (MainSessionWakeRequestedEvent) captor.getValue();
        assertEquals("main", event.sessionKey());
        assertEquals("j1", event.jobId());
        assertEquals("cron:j1", event.reason());
    }

    @Test
    void shouldLeaveJobIdEmptyForNonCronReason() throws Exception {
        service.enqueueSystemEvent("hello", CronWakeMode.NOW, "manual").get(2, TimeUnit.SECONDS);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        assertNull(((MainSessionWakeRequestedEvent) captor.getValue()).jobId());
    }

    @Test
    void shouldReportDuplicateAsNotQueued() throws Exception {
        service.enqueueSystemEvent("same", CronWakeMode.NEXT_HEARTBEAT, "cron:j1").get(2, TimeUnit.SECONDS);

        assertFalse(service.enqueueSystemEvent("same", CronWakeMode.NEXT_HEARTBEAT, "cron:j1")
                .get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldWaitForLiveTrafficInMainLane() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        laneService.enqueue("main", () -> {
            started.countDown();
            return release.await(2, TimeUnit.SECONDS);
        });
        assertTrue(started.await(2, TimeUnit.SECONDS));

        CompletableFuture<Boolean> pending = service.enqueueSystemEvent("later", CronWakeMode.NEXT_HEARTBEAT, "cron:j1");

        assertFalse(pending.isDone());
        assertEquals(0, queue.size("main"));
        release.countDown();
        assertTrue(pending.get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldDrainMainSessionForBlankKey() throws Exception {
        queue.enqueue("main", "a");
        queue.enqueue("other", "b");

        assertEquals(List.of("a"), service.drain(" ").get(2, TimeUnit.SECONDS));
        assertEquals(List.of("b"), service.drain("other").get(2, TimeUnit.SECONDS));
        assertTrue(service.drain(null).get(2, TimeUnit.SECONDS).isEmpty());
    }
}
