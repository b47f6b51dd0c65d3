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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronJobState;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.CronRunStatus;
import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronWakeMode;
import me.golemcore.relay.domain.schedule.CronJobValidator;
import me.golemcore.relay.domain.schedule.CronScheduleCalculator;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Owns cron jobs and their run state. Jobs are persisted in
 * {@code cron/jobs.json} via {@link StoragePort} as
 * {@code {"version":1,"jobs":[...]}}.
 *
 * <p>
 * Callers always receive detached copies; state changes go through
 * {@link #markRunning}, {@link #finishRun} and {@link #reconcileStaleRuns}.
 */
@Service
@Slf4j
public class CronJobService {

    static final String CRON_DIR = "cron";
    static final String JOBS_FILE = "jobs.json";
    static final int STORE_VERSION = 1;
    public static final String STALE_RUN_ERROR = "Run interrupted: process stopped while the job was running";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CronScheduleCalculator calculator;
    private final CronJobValidator validator;

    private List<CronJob> jobsCache;

    public CronJobService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            CronScheduleCalculator calculator, CronJobValidator validator) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.calculator = calculator;
        this.validator = validator;
    }

    /**
     * Create a job from a draft. The id, timestamps and run state are assigned
     * here; the draft's {@code enabled} flag is kept.
     *
     * @throws me.golemcore.relay.domain.model.CronValidationException
     *             if the definition is invalid
     */
    public synchronized CronJob createJob(CronJob draft) {
        validator.validate(draft);

        long now = clock.millis();
        CronJob job = draft.toBuilder()
                .id(UUID.randomUUID().toString())
                .createdAtMs(now)
                .updatedAtMs(now)
                .wakeMode(draft.getWakeMode() != null ? draft.getWakeMode() : CronWakeMode.NEXT_HEARTBEAT)
                .state(new CronJobState())
                .build();
        job.getState().setNextRunAtMs(job.isEnabled() ? calculator.nextRun(job.getSchedule(), now) : null);

        List<CronJob> jobs = getJobsLocked();
        jobs.add(job);
        saveJobs(jobs);

        log.info("[CronJobs] Created job {} ({}, {}), next run at {}", job.label(), job.getSessionTarget().getValue(),
                describe(job.getSchedule()), job.getState().getNextRunAtMs());
        return job.copy();
    }

    /**
     * Apply {@code mutator} to a copy of the job, validate the result and
     * replace the stored job. Identity, creation time and run state cannot be
     * changed this way.
     *
     * @throws IllegalArgumentException
     *             if the job does not exist or the result is invalid
     */
    public synchronized CronJob updateJob(String id, Consumer<CronJob> mutator) {
        CronJob current = findLocked(id);
        CronJob updated = current.copy();
        mutator.accept(updated);
        updated.setId(current.getId());
        updated.setCreatedAtMs(current.getCreatedAtMs());
        updated.setState(current.getState().toBuilder().build());
        if (updated.getWakeMode() == null) {
            updated.setWakeMode(current.getWakeMode());
        }
        validator.validate(updated);

        long now = clock.millis();
        updated.setUpdatedAtMs(now);
        boolean scheduleChanged = !Objects.equals(current.getSchedule(), updated.getSchedule());
        if (!updated.isEnabled()) {
            updated.getState().setNextRunAtMs(null);
        } else if (scheduleChanged || !current.isEnabled() || updated.getState().getNextRunAtMs() == null) {
            updated.getState().setNextRunAtMs(calculator.nextRun(updated.getSchedule(), now));
        }

        replaceLocked(updated);
        log.info("[CronJobs] Updated job {}", updated.label());
        return updated.copy();
    }

    public CronJob setEnabled(String id, boolean enabled) {
        return updateJob(id, job -> job.setEnabled(enabled));
    }

    /**
     * @throws IllegalArgumentException
     *             if not found
     */
    public synchronized void deleteJob(String id) {
        List<CronJob> jobs = getJobsLocked();
        boolean removed = jobs.removeIf(job -> job.getId().equals(id));
        if (!removed) {
            throw notFound(id);
        }
        saveJobs(jobs);
        log.info("[CronJobs] Deleted job {}", id);
    }

    public synchronized List<CronJob> listJobs() {
        return getJobsLocked().stream()
                .sorted(Comparator.comparingLong(CronJob::getCreatedAtMs))
                .map(CronJob::copy)
                .toList();
    }

    public synchronized Optional<CronJob> getJob(String id) {
        return getJobsLocked().stream()
                .filter(job -> job.getId().equals(id))
                .findFirst()
                .map(CronJob::copy);
    }

    /**
     * Jobs that are enabled, not running and due at {@code nowMs}, earliest
     * first.
     */
    public synchronized List<CronJob> getDueJobs(long nowMs) {
        return getJobsLocked().stream()
                .filter(CronJob::isEnabled)
                .filter(job -> !job.getState().isRunning())
                .filter(job -> job.getState().getNextRunAtMs() != null && job.getState().getNextRunAtMs() <= nowMs)
                .sorted(Comparator.comparingLong(job -> job.getState().getNextRunAtMs()))
                .map(CronJob::copy)
                .toList();
    }

    /**
     * Claim a job for execution by setting {@code runningAtMs}.
     *
     * @return the claimed job, or empty if it is missing or already running
     */
    public synchronized Optional<CronJob> markRunning(String id, long nowMs) {
        Optional<CronJob> job = getJobsLocked().stream()
                .filter(candidate -> candidate.getId().equals(id))
                .findFirst();
        if (job.isEmpty() || job.get().getState().isRunning()) {
            return Optional.empty();
        }
        return Optional.of(claim(job.get(), nowMs));
    }

    /**
     * Claim a job only if it is still enabled and due at {@code nowMs}. The
     * check and the claim happen under the same lock, so a job disabled or
     * rescheduled after {@link #getDueJobs(long)} is not run.
     *
     * @return the claimed job, or empty if it is missing, running, disabled or
     *         not yet due
     */
    public synchronized Optional<CronJob> claimDue(String id, long nowMs) {
        Optional<CronJob> job = getJobsLocked().stream()
                .filter(candidate -> candidate.getId().equals(id))
                .filter(CronJob::isEnabled)
                .filter(candidate -> !candidate.getState().isRunning())
                .filter(candidate -> candidate.getState().getNextRunAtMs() != null
                        && candidate.getState().getNextRunAtMs() <= nowMs)
                .findFirst();
        return job.map(found -> claim(found, nowMs));
    }

    private CronJob claim(CronJob job, long nowMs) {
        job.getState().setRunningAtMs(nowMs);
        saveJobs(getJobsLocked());
        return job.copy();
    }

    /**
     * Record the outcome of a run and schedule the next one. One-shot
     * {@code at} jobs are disabled after any run.
     *
     * @return the updated job, or empty if it was deleted while running
     */
    public synchronized Optional<CronJob> finishRun(String id, long startedAtMs, CronRunOutcome outcome) {
        Optional<CronJob> found = getJobsLocked().stream()
                .filter(candidate -> candidate.getId().equals(id))
                .findFirst();
        if (found.isEmpty()) {
            log.warn("[CronJobs] Job {} was deleted while running, dropping its result", id);
            return Optional.empty();
        }

        CronJob job = found.get();
        long now = clock.millis();
        CronJobState state = job.getState();
        state.setRunningAtMs(null);
        state.setLastRunAtMs(startedAtMs);
        state.setLastStatus(outcome.status());
        state.setLastError(outcome.error());
        state.setLastDurationMs(Math.max(0, now - startedAtMs));

        if (job.getSchedule() instanceof CronSchedule.At) {
            job.setEnabled(false);
            state.setNextRunAtMs(null);
            log.info("[CronJobs] One-shot job {} finished and was disabled", job.label());
        } else if (job.isEnabled()) {
            // never earlier than one millisecond past the start, so a fast run cannot refire
            state.setNextRunAtMs(calculator.nextRun(job.getSchedule(), Math.max(now, startedAtMs + 1)));
        }

        saveJobs(getJobsLocked());
        return Optional.of(job.copy());
    }

    /**
     * Clear {@code runningAtMs} markers left by a previous process. Such runs
     * are not retried; the job waits for its next due time.
     *
     * @return one entry per cleared marker
     */
    public synchronized List<StaleRun> reconcileStaleRuns() {
        List<StaleRun> stale = new ArrayList<>();
        long now = clock.millis();
        for (CronJob job : getJobsLocked()) {
            CronJobState state = job.getState();
            if (!state.isRunning()) {
                continue;
            }
            long runningAtMs = state.getRunningAtMs();
            state.setRunningAtMs(null);
            state.setLastStatus(CronRunStatus.ERROR);
            state.setLastError(STALE_RUN_ERROR);
            if (job.getSchedule() instanceof CronSchedule.At) {
                job.setEnabled(false);
                state.setNextRunAtMs(null);
            } else if (job.isEnabled() && (state.getNextRunAtMs() == null || state.getNextRunAtMs() <= runningAtMs)) {
                state.setNextRunAtMs(calculator.nextRun(job.getSchedule(), now));
            }
            stale.add(new StaleRun(job.getId(), runningAtMs, state.getNextRunAtMs()));
            log.warn("[CronJobs] Cleared stale running marker of job {} (started at {})", job.label(), runningAtMs);
        }
        if (!stale.isEmpty()) {
            saveJobs(getJobsLocked());
        }
        return stale;
    }

    /**
     * Earliest pending due time across enabled jobs, or null.
     */
    public synchronized Long nextWakeAtMs() {
        return getJobsLocked().stream()
                .filter(CronJob::isEnabled)
                .map(job -> job.getState().getNextRunAtMs())
                .filter(Objects::nonNull)
                .min(Long::compare)
                .orElse(null);
    }

    private List<CronJob> getJobsLocked() {
        if (jobsCache == null) {
            jobsCache = loadJobs();
        }
        return jobsCache;
    }

    private CronJob findLocked(String id) {
        return getJobsLocked().stream()
                .filter(job -> job.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> notFound(id));
    }

    private void replaceLocked(CronJob updated) {
        List<CronJob> jobs = getJobsLocked();
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getId().equals(updated.getId())) {
                jobs.set(i, updated);
                break;
            }
        }
        saveJobs(jobs);
    }

    private static IllegalArgumentException notFound(String id) {
        return new IllegalArgumentException("Cron job not found: " + id);
    }

    private static String describe(CronSchedule schedule) {
        if (schedule instanceof CronSchedule.At at) {
            return "at " + at.atMs();
        }
        if (schedule instanceof CronSchedule.Every every) {
            return "every " + every.everyMs() + "ms";
        }
        CronSchedule.Cron cron = (CronSchedule.Cron) schedule;
        return "cron '" + cron.expr() + "'" + (cron.tz() != null ? " " + cron.tz() : "");
    }

    private void saveJobs(List<CronJob> jobs) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new CronJobStore(STORE_VERSION, jobs));
            storagePort.putTextAtomic(CRON_DIR, JOBS_FILE, json, true).join();
            jobsCache = jobs;
        } catch (Exception e) { // NOSONAR - in-memory state stays authoritative until the next save
            log.error("[CronJobs] Failed to save jobs", e);
        }
    }

    private List<CronJob> loadJobs() {
        try {
            String json = storagePort.getText(CRON_DIR, JOBS_FILE).join();
            if (json != null && !json.isBlank()) {
                CronJobStore store = objectMapper.readValue(json, CronJobStore.class);
                List<CronJob> jobs = new ArrayList<>();
                if (store.jobs() != null) {
                    for (CronJob job : store.jobs()) {
                        if (job.getState() == null) {
                            job.setState(new CronJobState());
                        }
                        jobs.add(job);
                    }
                }
                log.info("[CronJobs] Loaded {} jobs", jobs.size());
                return jobs;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start empty rather than fail startup
            log.warn("[CronJobs] No jobs loaded, store missing or unreadable: {}", e.getMessage());
        }
        return new ArrayList<>();
    }

    /**
     * On-disk shape of {@code cron/jobs.json}.
     */
    public record CronJobStore(int version, List<CronJob> jobs) {
    }

    /**
     * A running marker cleared at startup.
     */
    public record StaleRun(String jobId, long runningAtMs, Long nextRunAtMs) {
    }
}
