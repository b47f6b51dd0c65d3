package me.golemcore.relay.domain.cron;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CronIsolation;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.CronSessionTarget;
import me.golemcore.relay.domain.service.IsolatedAgentTurnService;
import me.golemcore.relay.domain.service.MainSessionEventService;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Executes one claimed job and classifies the result. Never throws: any
 * failure becomes an {@code error} outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CronJobExecutor {

    private final MainSessionEventService mainSessionEventService;
    private final IsolatedAgentTurnService isolatedAgentTurnService;

    public CronRunOutcome execute(CronJob job) {
        try {
            if (job.getSessionTarget() == CronSessionTarget.MAIN) {
                return runMainJob(job);
            }
            CronRunOutcome outcome = isolatedAgentTurnService.runTurn(job);
            postToMain(job, outcome);
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CronRunOutcome.error("Cron run interrupted");
        } catch (Exception e) { // NOSONAR - a failed run must not take the scheduler down
            log.error("[Cron] Job {} failed", job.label(), e);
            return CronRunOutcome.error(describe(e));
        }
    }

    private CronRunOutcome runMainJob(CronJob job) throws InterruptedException, ExecutionException {
        if (!(job.getPayload() instanceof CronPayload.SystemEvent event)) {
            return CronRunOutcome.error("Main-session cron jobs require a systemEvent payload");
        }
        String text = event.text() != null ? event.text().trim() : "";
        if (text.isEmpty()) {
            return CronRunOutcome.skipped("Empty system event");
        }
        mainSessionEventService.enqueueSystemEvent(text, job.getWakeMode(), reason(job)).get();
        return CronRunOutcome.ok(text);
    }

    private void postToMain(CronJob job, CronRunOutcome outcome) {
        String detail = outcome.summary() != null ? outcome.summary() : outcome.error();
        if (detail == null || detail.isBlank()) {
            return;
        }
        CronIsolation isolation = job.getIsolation() != null ? job.getIsolation() : new CronIsolation(null);
        String text = isolation.resolvePrefix() + ": " + detail;
        mainSessionEventService.enqueueSystemEvent(text, job.getWakeMode(), reason(job))
                .whenComplete((queued, error) -> {
                    if (error != null) {
                        log.warn("[Cron] Failed to post result of {} to the main session: {}", job.label(),
                                describe(error));
                    }
                });
    }

    private static String reason(CronJob job) {
        return "cron:" + job.getId();
    }

    private static String describe(Throwable error) {
        Throwable cause = (error instanceof ExecutionException || error instanceof CompletionException)
                && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
