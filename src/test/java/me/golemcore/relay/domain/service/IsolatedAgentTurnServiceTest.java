package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.lane.CommandLaneService;
import me.golemcore.relay.domain.lane.LaneTaskOptions;
import me.golemcore.relay.domain.model.AgentCommandRequest;
import me.golemcore.relay.domain.model.AgentExecutionException;
import me.golemcore.relay.domain.model.AgentRunResult;
import me.golemcore.relay.domain.model.CronDeliveryChannel;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.CronRunStatus;
import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronSessionTarget;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.LaneTimeoutException;
import me.golemcore.relay.domain.model.ReplyPayload;
import me.golemcore.relay.domain.model.ResolvedSession;
import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.AgentCommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IsolatedAgentTurnServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    private SessionStoreService sessionStoreService;
    private DeliveryTargetResolver deliveryTargetResolver;
    private CronDeliveryService deliveryService;
    private CommandLaneService laneService;
    private AgentCommandPort agentCommandPort;
    private RelayProperties properties;
    private IsolatedAgentTurnService service;

    @BeforeEach
    void setUp() throws Exception {
        sessionStoreService = mock(SessionStoreService.class);
        deliveryTargetResolver = mock(DeliveryTargetResolver.class);
        deliveryService = mock(CronDeliveryService.class);
        laneService = mock(CommandLaneService.class);
        agentCommandPort = mock(AgentCommandPort.class);
        properties = new RelayProperties();
        properties.getAgent().setCommand(List.of("agent", "--message", "{{Body}}"));

        when(sessionStoreService.resolveSession(eq("cron:j1"), anyLong())).thenReturn(session(true, false));
        when(deliveryTargetResolver.resolve(any(), any()))
                .thenReturn(new DeliveryTarget(CronDeliveryChannel.TELEGRAM, "42"));
        when(laneService.enqueue(anyString(), any(), any(LaneTaskOptions.class))).thenAnswer(invocation -> {
            Callable<?> task = invocation.getArgument(1);
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        });
        when(agentCommandPort.run(any())).thenReturn(new AgentRunResult(
                List.of(ReplyPayload.text("draft"), ReplyPayload.text(" final answer ")), 10));

        service = new IsolatedAgentTurnService(sessionStoreService, deliveryTargetResolver, deliveryService,
                laneService, agentCommandPort, new MessageTemplateEngine(), properties,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void shouldRunTurnAndSummarizeWithoutDelivery() throws Exception {
        CronRunOutcome outcome = service.runTurn(job(CronPayload.AgentTurn.of("summarize")));

        assertEquals(CronRunOutcome.ok("final answer"), outcome);
        verify(laneService).enqueue(eq("cron"), any(), eq(LaneTaskOptions.timeout(600_000)));
        verifyNoInteractions(deliveryService);
    }

    @Test
    void shouldBuildTemplatingContext() throws Exception {
        CronPayload.AgentTurn turn = new CronPayload.AgentTurn("summarize", "max", 120, null, null, null, null);

        service.runTurn(job(turn));

        ArgumentCaptor<AgentCommandRequest> captor = ArgumentCaptor.forClass(AgentCommandRequest.class);
        verify(agentCommandPort).run(captor.capture());
        AgentCommandRequest request = captor.getValue();
        assertEquals(List.of("agent", "--message", "{{Body}}"), request.command());
        assertEquals(120_000L, request.timeoutMs());
        assertEquals("high", request.thinkLevel());
        assertEquals("[cron:j1 digest] summarize", request.templatingContext().get("Body"));
        assertEquals("[cron:j1 digest] summarize", request.templatingContext().get("BodyStripped"));
        assertEquals("session-1", request.templatingContext().get("SessionId"));
        assertEquals("42", request.templatingContext().get("To"));
        assertEquals("42", request.templatingContext().get("From"));
        assertEquals("Cron", request.templatingContext().get("Surface"));
        assertEquals("true", request.templatingContext().get("IsNewSession"));
        assertEquals("high", request.templatingContext().get("ThinkLevel"));
    }

    @Test
    void shouldFallBackToDefaultThinkingLevel() throws Exception {
        properties.getAgent().setThinkingDefault("med");

        service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        ArgumentCaptor<AgentCommandRequest> captor = ArgumentCaptor.forClass(AgentCommandRequest.class);
        verify(agentCommandPort).run(captor.capture());
        assertEquals("medium", captor.getValue().thinkLevel());
    }

    @Test
    void shouldLeaveThinkLevelEmptyWhenUnknown() throws Exception {
        service.runTurn(job(new CronPayload.AgentTurn("hi", "extreme", null, null, null, null, null)));

        ArgumentCaptor<AgentCommandRequest> captor = ArgumentCaptor.forClass(AgentCommandRequest.class);
        verify(agentCommandPort).run(captor.capture());
        assertNull(captor.getValue().thinkLevel());
        assertEquals("", captor.getValue().templatingContext().get("ThinkLevel"));
    }

    @Test
    void shouldRequireConfiguredCommand() {
        properties.getAgent().setCommand(List.of());

        CronRunOutcome outcome = service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        assertEquals(CronRunStatus.ERROR, outcome.status());
        assertEquals("Configure relay.agent.command before using isolated cron jobs.", outcome.error());
        verifyNoInteractions(laneService);
    }

    @Test
    void shouldRejectSystemEventPayload() {
        CronRunOutcome outcome = service.runTurn(job(new CronPayload.SystemEvent("ping")));

        assertEquals(CronRunStatus.ERROR, outcome.status());
    }

    @Test
    void shouldReportAgentFailure() throws Exception {
        when(agentCommandPort.run(any())).thenThrow(new AgentExecutionException("Agent exited with code 2", 2, null));

        CronRunOutcome outcome = service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        assertEquals(CronRunOutcome.error("Agent exited with code 2"), outcome);
    }

    @Test
    void shouldReportLaneTimeout() {
        when(laneService.enqueue(anyString(), any(), any(LaneTaskOptions.class)))
                .thenReturn(CompletableFuture.failedFuture(new LaneTimeoutException("cron", 600_000)));

        CronRunOutcome outcome = service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        assertEquals("Command in lane 'cron' timed out after 600000 ms", outcome.error());
    }

    @Test
    void shouldMarkSystemSentBeforeRunOnFirstTurnWhenSendingOnce() {
        properties.getSession().setSendSystemOnce(true);

        service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        verify(sessionStoreService).markSystemSent("cron:j1");
    }

    @Test
    void shouldNotMarkSystemSentOnLaterTurns() {
        properties.getSession().setSendSystemOnce(true);
        when(sessionStoreService.resolveSession(eq("cron:j1"), anyLong())).thenReturn(session(false, true));

        service.runTurn(job(CronPayload.AgentTurn.of("hi")));

        verify(sessionStoreService, never()).markSystemSent(anyString());
    }

    @Test
    void shouldDeliverAndRememberRoute() {
        CronRunOutcome outcome = service.runTurn(job(delivering(CronDeliveryChannel.TELEGRAM, false)));

        assertEquals(CronRunOutcome.ok("final answer"), outcome);
        verify(deliveryService).deliver(eq(new DeliveryTarget(CronDeliveryChannel.TELEGRAM, "42")), any());
        verify(sessionStoreService).updateLastRoute("cron:j1", "telegram", "42", NOW);
    }

    @Test
    void shouldFailRunWhenWhatsAppRecipientMissing() {
        when(deliveryTargetResolver.resolve(any(), any()))
                .thenReturn(new DeliveryTarget(CronDeliveryChannel.WHATSAPP, null));

        CronRunOutcome outcome = service.runTurn(job(delivering(CronDeliveryChannel.WHATSAPP, false)));

        assertEquals(CronRunStatus.ERROR, outcome.status());
        assertTrue(outcome.error().contains("recipient"));
        assertEquals("final answer", outcome.summary());
        verifyNoInteractions(deliveryService);
    }

    @Test
    void shouldSkipBestEffortDeliveryWithoutRecipient() {
        when(deliveryTargetResolver.resolve(any(), any()))
                .thenReturn(new DeliveryTarget(CronDeliveryChannel.WHATSAPP, null));

        CronRunOutcome outcome = service.runTurn(job(delivering(CronDeliveryChannel.WHATSAPP, true)));

        assertEquals(CronRunOutcome.skipped("Delivery skipped (no WhatsApp recipient)."), outcome);
        verifyNoInteractions(deliveryService);
    }

    @Test
    void shouldFailRunWhenDeliveryFails() {
        doThrow(new DeliveryException("telegram", "chat not found"))
                .when(deliveryService).deliver(any(), any());

        CronRunOutcome outcome = service.runTurn(job(delivering(CronDeliveryChannel.TELEGRAM, false)));

        assertEquals(CronRunOutcome.error("final answer", "chat not found"), outcome);
        verify(sessionStoreService, never()).updateLastRoute(anyString(), anyString(), anyString(), anyLong());
    }

    @Test
    void shouldKeepRunOkWhenBestEffortDeliveryFails() {
        doThrow(new DeliveryException("telegram", "chat not found"))
                .when(deliveryService).deliver(any(), any());

        CronRunOutcome outcome = service.runTurn(job(delivering(CronDeliveryChannel.TELEGRAM, true)));

        assertEquals(CronRunOutcome.ok("final answer"), outcome);
    }

    @Test
    void shouldComposeBodyWithPrefixAndIntro() {
        properties.getAgent().setBodyPrefix("[{{SessionId}}] ");
        properties.getSession().setSessionIntro("You are on duty.");
        CronJob job = job(CronPayload.AgentTurn.of("check"));

        assertEquals("You are on duty.\n\n[session-1] [cron:j1 digest] check",
                service.composeBody(job, "check", session(true, false), true));
        assertEquals("You are on duty.\n\n[cron:j1 digest] check",
                service.composeBody(job, "check", session(false, true), true));
        assertEquals("You are on duty.\n\n[session-1] [cron:j1 digest] check",
                service.composeBody(job, "check", session(false, true), false));
    }

    @Test
    void shouldDeriveSessionKeyFromJobId() {
        assertEquals("cron:abc", IsolatedAgentTurnService.sessionKey("abc"));
    }

    private static ResolvedSession session(boolean isNew, boolean systemSent) {
        SessionEntry entry = SessionEntry.builder().sessionId("session-1").updatedAt(NOW).build();
        return new ResolvedSession("cron:j1", entry, isNew, systemSent);
    }

    private static CronPayload.AgentTurn delivering(CronDeliveryChannel channel, boolean bestEffort) {
        return new CronPayload.AgentTurn("summarize", null, null, true, channel, null, bestEffort);
    }

    private static CronJob job(CronPayload payload) {
        return CronJob.builder()
                .id("j1")
                .name("digest")
                .enabled(true)
                .schedule(new CronSchedule.Every(60_000, null))
                .sessionTarget(CronSessionTarget.ISOLATED)
                .payload(payload)
                .build();
    }
}
