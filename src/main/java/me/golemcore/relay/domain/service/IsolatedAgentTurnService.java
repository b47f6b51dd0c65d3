package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.lane.CommandLaneService;
import me.golemcore.relay.domain.lane.LaneTaskOptions;
import me.golemcore.relay.domain.model.AgentCommandRequest;
import me.golemcore.relay.domain.model.AgentRunResult;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.ResolvedSession;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.AgentCommandPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs an agent turn for an isolated cron job in its own session and delivers
 * the reply.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>resolve the {@code cron:<jobId>} session and the delivery target</li>
 * <li>compose the body and templating context</li>
 * <li>persist the session, flagging the preamble as sent before the run</li>
 * <li>run the agent in the cron lane with a wall-clock timeout</li>
 * <li>summarize the reply and deliver it outside the lane</li>
 * </ol>
 * Delivery failures turn the run into {@code error} unless the job is marked
 * best-effort.
 */
@Service
@Slf4j
public class IsolatedAgentTurnService {

    static final String SESSION_KEY_PREFIX = "cron:";
    static final String SURFACE = "Cron";

    private final SessionStoreService sessionStoreService;
    private final DeliveryTargetResolver deliveryTargetResolver;
    private final CronDeliveryService deliveryService;
    private final CommandLaneService laneService;
    private final AgentCommandPort agentCommandPort;
    private final MessageTemplateEngine templateEngine;
    private final RelayProperties properties;
    private final Clock clock;

    public IsolatedAgentTurnService(SessionStoreService sessionStoreService,
            DeliveryTargetResolver deliveryTargetResolver,
            CronDeliveryService deliveryService,
            CommandLaneService laneService,
            AgentCommandPort agentCommandPort,
            MessageTemplateEngine templateEngine,
            RelayProperties properties,
            Clock clock) {
        this.sessionStoreService = sessionStoreService;
        this.deliveryTargetResolver = deliveryTargetResolver;
        this.deliveryService = deliveryService;
        this.laneService = laneService;
        this.agentCommandPort = agentCommandPort;
        this.templateEngine = templateEngine;
        this.properties = properties;
        this.clock = clock;
    }

    public static String sessionKey(String jobId) {
        return SESSION_KEY_PREFIX + jobId;
    }

    public CronRunOutcome runTurn(CronJob job) {
        if (!(job.getPayload() instanceof CronPayload.AgentTurn turn)) {
            return CronRunOutcome.error("Isolated cron jobs require an agentTurn payload");
        }
        RelayProperties.AgentProperties agent = properties.getAgent();
        List<String> command = agent.getCommand();
        if (command == null || command.isEmpty()) {
            return CronRunOutcome.error("Configure relay.agent.command before using isolated cron jobs.");
        }

        String sessionKey = sessionKey(job.getId());
        ResolvedSession session = sessionStoreService.resolveSession(sessionKey, clock.millis());
        boolean sendSystemOnce = properties.getSession().isSendSystemOnce();
        boolean firstTurn = session.isFirstTurn();

        String thinkLevel = ThinkLevels.normalize(turn.thinking());
        if (thinkLevel == null) {
            thinkLevel = ThinkLevels.normalize(agent.getThinkingDefault());
        }
        long timeoutMs = resolveTimeoutSeconds(turn, agent) * 1000L;
        DeliveryTarget target = deliveryTargetResolver.resolve(turn.channel(), turn.to());

        String body = composeBody(job, turn.message(), session, sendSystemOnce);
        String route = target.to() != null ? target.to() : "";
        Map<String, String> context = new HashMap<>();
        context.put("Body", body);
        context.put("BodyStripped", body);
        context.put("SessionId", session.sessionId());
        context.put("From", route);
        context.put("To", route);
        context.put("Surface", SURFACE);
        context.put("IsNewSession", String.valueOf(session.isNewSession()));
        context.put("ThinkLevel", thinkLevel != null ? thinkLevel : "");

        if (sendSystemOnce && firstTurn) {
            sessionStoreService.markSystemSent(sessionKey);
        }

        AgentCommandRequest request = new AgentCommandRequest(command, context, timeoutMs, thinkLevel);
        log.info("[Agent] Running cron job {} in session {} (timeout {} ms)", job.getId(), session.sessionId(),
                timeoutMs);
        CompletableFuture<AgentRunResult> future = laneService.enqueue(properties.getCron().getLane(),
                () -> agentCommandPort.run(request), LaneTaskOptions.timeout(timeoutMs));

        AgentRunResult result;
        try {
            result = future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CronRunOutcome.error("Agent turn interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Agent] Cron job {} failed: {}", job.getId(), describe(cause));
            return CronRunOutcome.error(describe(cause));
        }

        String summary = CronRunSummaries.pickSummary(result.payloads());
        if (!turn.deliveryRequested()) {
            return CronRunOutcome.ok(summary);
        }
        return deliver(sessionKey, target, result, summary, turn.bestEffort());
    }

    private CronRunOutcome deliver(String sessionKey, DeliveryTarget target, AgentRunResult result, String summary,
            boolean bestEffort) {
        if (!target.hasRecipient()) {
            log.warn("[Delivery] No {} recipient for {}", target.channel().getDisplayName(), sessionKey);
            return bestEffort
                    ? CronRunOutcome.skipped(CronDeliveryService.skippedSummary(target.channel()))
                    : CronRunOutcome.error(summary, CronDeliveryService.missingRecipientError(target.channel()));
        }
        try {
            deliveryService.deliver(target, result.payloads());
        } catch (DeliveryException e) {
            log.warn("[Delivery] {} delivery for {} failed: {}", target.channel().getDisplayName(), sessionKey,
                    e.getMessage());
            return bestEffort ? CronRunOutcome.ok(summary) : CronRunOutcome.error(summary, e.getMessage());
        }
        sessionStoreService.updateLastRoute(sessionKey, target.channel().getChannelType(), target.to(),
                clock.millis());
        return CronRunOutcome.ok(summary);
    }

    String composeBody(CronJob job, String message, ResolvedSession session, boolean sendSystemOnce) {
        Map<String, String> sessionVars = Map.of("SessionId", session.sessionId());
        String body = ("[cron:" + job.label() + "] " + (message != null ? message : "")).trim();

        String bodyPrefix = templateEngine.render(properties.getAgent().getBodyPrefix(), sessionVars);
        if ((!sendSystemOnce || session.isFirstTurn()) && bodyPrefix != null && !bodyPrefix.isEmpty()) {
            body = bodyPrefix + body;
        }
        String intro = templateEngine.render(properties.getSession().getSessionIntro(), sessionVars);
        if (intro != null && !intro.isEmpty()) {
            body = intro + "\n\n" + body;
        }
        return body;
    }

    private static long resolveTimeoutSeconds(CronPayload.AgentTurn turn, RelayProperties.AgentProperties agent) {
        Integer jobTimeout = turn.timeoutSeconds();
        long seconds = jobTimeout != null && jobTimeout > 0 ? jobTimeout : agent.getTimeoutSeconds();
        return Math.max(seconds, 1);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
