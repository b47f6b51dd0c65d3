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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronRunAction;
import me.golemcore.relay.domain.model.CronRunLogEntry;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.CronRunStatus;
import me.golemcore.relay.domain.model.CronSchedulerStatus;
import me.golemcore.relay.domain.service.CronJobService;
import me.golemcore.relay.domain.service.CronRunLogService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic loop that dispatches due cron jobs.
 *
 * <p>
 * On startup, running markers left by a previous process are cleared and
 * logged as skipped runs. Each tick then:
 * <ul>
 * <li>selects enabled, idle jobs whose next run is due</li>
 * <li>claims them up to {@code relay.cron.max-concurrent-runs} in-flight
 * runs; the rest stay due for a later tick</li>
 * <li>hands each claimed job to the run executor and returns at once</li>
 * </ul>
 * Completion records the outcome, reschedules the job and appends the run log.
 * Ticks never overlap; a tick that finds the previous one still busy is
 * skipped.
 */
@Component
@Slf4j
public class CronScheduler {

    private final CronJobService jobService;
    private final CronRunLogService runLogService;
    private final CronJobExecutor jobExecutor;
    private final RelayProperties properties;
    private final Clock clock;
    private final ExecutorService runExecutor;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public CronScheduler(CronJobService jobService, CronRunLogService runLogService, CronJobExecutor jobExecutor,
            RelayProperties properties, Clock clock, @Qualifier("cronRunExecutor") ExecutorService runExecutor) {
        this.jobService = jobService;
        this.runLogService = runLogService;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
        this.clock = clock;
        this.runExecutor = runExecutor;
    }

    @PostConstruct
    public void init() {
        reconcileStaleRuns();

        if (!properties.getCron().isEnabled()) {
            log.info("[Cron] Scheduler disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-scheduler");
            t.setDaemon(true);
            return t;
        });

        long tickIntervalMs = Math.max(properties.getCron().getTickIntervalMs(), 100);
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, tickIntervalMs, tickIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("[Cron] Started with tick interval {} ms, max concurrent runs {}", tickIntervalMs, maxConcurrentRuns());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Cron] Shut down");
    }

    void reconcileStaleRuns() {
        List<CronJobService.StaleRun> staleRuns = jobService.reconcileStaleRuns();
        long now = clock.millis();
        for (CronJobService.StaleRun stale : staleRuns) {
            runLogService.append(CronRunLogEntry.builder()
                    .ts(now)
                    .jobId(stale.jobId())
                    .action(CronRunAction.SKIPPED)
                    .status(CronRunStatus.ERROR)
                    .error(CronJobService.STALE_RUN_ERROR)
                    .runAtMs(stale.runningAtMs())
                    .nextRunAtMs(stale.nextRunAtMs())
                    .build());
        }
        if (!staleRuns.isEmpty()) {
            log.warn("[Cron] Recovered {} stale run(s) from a previous process", staleRuns.size());
        }
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Cron] Tick skipped: previous tick still in progress");
            return;
        }
        try {
            List<CronJob> dueJobs = jobService.getDueJobs(clock.millis());
            if (dueJobs.isEmpty()) {
                return;
            }
            log.debug("[Cron] Tick: {} due job(s), {} in flight", dueJobs.size(), inFlight.get());

            for (CronJob job : dueJobs) {
                if (inFlight.get() >= maxConcurrentRuns()) {
                    log.debug("[Cron] Concurrency cap {} reached, deferring remaining due jobs", maxConcurrentRuns());
                    break;
                }
                long startedAt = clock.millis();
                dispatch(jobService.claimDue(job.getId(), startedAt), startedAt);
            }
        } catch (Exception e) { // NOSONAR - keep ticking
            log.error("[Cron] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Run a job immediately, ignoring its due time and the concurrency cap.
     *
     * @return completes with the outcome once the run has been recorded
     * @throws IllegalArgumentException
     *             if the job does not exist
     * @throws IllegalStateException
     *             if the job is already running
     */
    public CompletableFuture<CronRunOutcome> runNow(String jobId) {
        CronJob job = jobService.getJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Cron job not found: " + jobId));
        long startedAt = clock.millis();
        return dispatch(jobService.markRunning(job.getId(), startedAt), startedAt)
                .orElseThrow(() -> new IllegalStateException("Cron job is already running: " + jobId));
    }

    public CronSchedulerStatus status() {
        return new CronSchedulerStatus(
                properties.getCron().isEnabled(),
                jobService.listJobs().size(),
                inFlight.get(),
                maxConcurrentRuns(),
                jobService.nextWakeAtMs());
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    private Optional<CompletableFuture<CronRunOutcome>> dispatch(Optional<CronJob> claimed, long startedAt) {
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        CronJob job = claimed.get();
        inFlight.incrementAndGet();
        runLogService.append(CronRunLogEntry.builder()
                .ts(startedAt)
                .jobId(job.getId())
                .action(CronRunAction.STARTED)
                .runAtMs(startedAt)
                .build());
        log.info("[Cron] Running job {}", job.label());

        CompletableFuture<CronRunOutcome> run;
        try {
            run = CompletableFuture.supplyAsync(() -> jobExecutor.execute(job), runExecutor);
        } catch (RejectedExecutionException e) {
            run = CompletableFuture.completedFuture(CronRunOutcome.error("Cron run rejected: executor shut down"));
        }
        return Optional.of(run
                .exceptionally(error -> CronRunOutcome.error(describe(error)))
                .thenApply(outcome -> complete(job, startedAt, outcome)));
    }

    private CronRunOutcome complete(CronJob job, long startedAt, CronRunOutcome outcome) {
        try {
            Optional<CronJob> updated = jobService.finishRun(job.getId(), startedAt, outcome);
            long finishedAt = clock.millis();
            runLogService.append(CronRunLogEntry.builder()
                    .ts(finishedAt)
                    .jobId(job.getId())
                    .action(CronRunAction.FINISHED)
                    .status(outcome.status())
                    .error(outcome.error())
                    .summary(outcome.summary())
                    .runAtMs(startedAt)
                    .durationMs(Math.max(0, finishedAt - startedAt))
                    .nextRunAtMs(updated.map(value -> value.getState().getNextRunAtMs()).orElse(null))
                    .build());
            log.info("[Cron] Job {} finished: {}{}", job.label(), outcome.status().getValue(),
                    outcome.error() != null ? " (" + outcome.error() + ")" : "");
        } catch (Exception e) { // NOSONAR - the in-flight slot must always be released
            log.error("[Cron] Failed to record result of job {}", job.label(), e);
        } finally {
            inFlight.decrementAndGet();
        }
        return outcome;
    }

    private int maxConcurrentRuns() {
        return Math.max(properties.getCron().getMaxConcurrentRuns(), 1);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
