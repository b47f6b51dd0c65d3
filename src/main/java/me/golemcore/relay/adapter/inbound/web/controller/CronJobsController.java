package me.golemcore.relay.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.adapter.inbound.web.dto.CronJobRequest;
import me.golemcore.relay.domain.cron.CronScheduler;
import me.golemcore.relay.domain.model.CronDeliveryChannel;
import me.golemcore.relay.domain.model.CronIsolation;
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronRunLogEntry;
import me.golemcore.relay.domain.model.CronRunOutcome;
import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronSchedulerStatus;
import me.golemcore.relay.domain.model.CronSessionTarget;
import me.golemcore.relay.domain.model.CronWakeMode;
import me.golemcore.relay.domain.schedule.CronScheduleParser;
import me.golemcore.relay.domain.service.CronJobService;
import me.golemcore.relay.domain.service.CronRunLogService;
import me.golemcore.relay.domain.service.MainSessionEventService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Control API for cron jobs: CRUD, enable/disable, run-now, run history and
 * scheduler status.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronJobsController {

    private final CronJobService jobService;
    private final CronRunLogService runLogService;
    private final CronScheduler scheduler;
    private final CronScheduleParser scheduleParser;
    private final MainSessionEventService mainSessionEventService;

    @GetMapping("/jobs")
    public Mono<ResponseEntity<List<CronJob>>> listJobs() {
        return Mono.just(ResponseEntity.ok(jobService.listJobs()));
    }

    @GetMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<CronJob>> getJob(@PathVariable String jobId) {
        CronJob job = jobService.getJob(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Cron job not found: " + jobId));
        return Mono.just(ResponseEntity.ok(job));
    }

    @PostMapping("/jobs")
    public Mono<ResponseEntity<CronJob>> createJob(@RequestBody CronJobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        CronSchedule schedule = resolveSchedule(request);
        if (schedule == null) {
            throw badRequest("schedule is required (at, every or cron)");
        }
        CronPayload payload = resolvePayload(request, null);
        CronSessionTarget target = request.getSessionTarget() != null
                ? CronSessionTarget.fromValue(request.getSessionTarget())
                : inferTarget(payload);

        CronJob draft = CronJob.builder()
                .name(trimToNull(request.getName()))
                .enabled(request.getEnabled() == null || request.getEnabled())
                .schedule(schedule)
                .sessionTarget(target)
                .wakeMode(request.getWakeMode() != null ? CronWakeMode.fromValue(request.getWakeMode())
                        : CronWakeMode.NEXT_HEARTBEAT)
                .payload(payload)
                .isolation(request.getPostToMainPrefix() != null
                        ? new CronIsolation(request.getPostToMainPrefix())
                        : null)
                .build();
        CronJob created = jobService.createJob(draft);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PatchMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<CronJob>> updateJob(@PathVariable String jobId, @RequestBody CronJobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        CronSchedule schedule = resolveSchedule(request);
        CronJob updated = jobService.updateJob(jobId, job -> {
            if (request.getName() != null) {
                job.setName(trimToNull(request.getName()));
            }
            if (request.getEnabled() != null) {
                job.setEnabled(request.getEnabled());
            }
            if (request.getSessionTarget() != null) {
                job.setSessionTarget(CronSessionTarget.fromValue(request.getSessionTarget()));
                if (job.getSessionTarget() == CronSessionTarget.MAIN) {
                    // main jobs carry no isolation settings
                    job.setIsolation(null);
                }
            }
            if (request.getWakeMode() != null) {
                job.setWakeMode(CronWakeMode.fromValue(request.getWakeMode()));
            }
            if (schedule != null) {
                job.setSchedule(schedule);
            }
            job.setPayload(resolvePayload(request, job.getPayload()));
            if (request.getPostToMainPrefix() != null) {
                job.setIsolation(new CronIsolation(request.getPostToMainPrefix()));
            }
        });
        return Mono.just(ResponseEntity.ok(updated));
    }

    @DeleteMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<DeleteJobResponse>> deleteJob(@PathVariable String jobId) {
        jobService.deleteJob(jobId);
        return Mono.just(ResponseEntity.ok(new DeleteJobResponse(jobId)));
    }

    @PostMapping("/jobs/{jobId}/enable")
    public Mono<ResponseEntity<CronJob>> enableJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(jobService.setEnabled(jobId, true)));
    }

    @PostMapping("/jobs/{jobId}/disable")
    public Mono<ResponseEntity<CronJob>> disableJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(jobService.setEnabled(jobId, false)));
    }

    @PostMapping("/jobs/{jobId}/run")
    public Mono<ResponseEntity<RunJobResponse>> runJob(@PathVariable String jobId,
            @RequestParam(name = "wait", defaultValue = "false") boolean wait) {
        CompletableFuture<CronRunOutcome> run = scheduler.runNow(jobId);
        if (!wait) {
            return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new RunJobResponse(jobId, "started", null, null)));
        }
        return Mono.fromFuture(run).map(outcome -> ResponseEntity.ok(toRunResponse(jobId, outcome)));
    }

    @GetMapping("/jobs/{jobId}/runs")
    public Mono<ResponseEntity<List<CronRunLogEntry>>> getRuns(@PathVariable String jobId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(runLogService.readRuns(jobId, limit)));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<CronSchedulerStatus>> getStatus() {
        return Mono.just(ResponseEntity.ok(scheduler.status()));
    }

    @PostMapping("/system-events/drain")
    public Mono<ResponseEntity<DrainResponse>> drainSystemEvents(
            @RequestParam(name = "sessionKey", required = false) String sessionKey) {
        return Mono.fromFuture(mainSessionEventService.drain(sessionKey))
                .map(events -> ResponseEntity.ok(new DrainResponse(events)));
    }

    private CronSchedule resolveSchedule(CronJobRequest request) {
        if (request.hasScheduleShorthand()) {
            if (request.getSchedule() != null) {
                throw badRequest("Use either schedule or at/every/cron, not both");
            }
            return scheduleParser.parse(request.getAt(), request.getEvery(), request.getAnchor(), request.getCron(),
                    request.getTz());
        }
        return request.getSchedule();
    }

    private static CronPayload resolvePayload(CronJobRequest request, CronPayload current) {
        if (request.getPayload() != null) {
            return request.getPayload();
        }
        if (request.getSystemEvent() != null) {
            if (request.hasAgentTurnFields()) {
                throw badRequest("Use either systemEvent or message, not both");
            }
            return new CronPayload.SystemEvent(request.getSystemEvent());
        }
        if (!request.hasAgentTurnFields()) {
            return current;
        }

        CronPayload.AgentTurn base = current instanceof CronPayload.AgentTurn turn ? turn : null;
        return new CronPayload.AgentTurn(
                pick(request.getMessage(), base != null ? base.message() : null),
                pick(request.getThinking(), base != null ? base.thinking() : null),
                pick(request.getTimeoutSeconds(), base != null ? base.timeoutSeconds() : null),
                pick(request.getDeliver(), base != null ? base.deliver() : null),
                request.getChannel() != null
                        ? CronDeliveryChannel.fromValue(request.getChannel())
                        : base != null ? base.channel() : null,
                pick(request.getTo(), base != null ? base.to() : null),
                pick(request.getBestEffortDeliver(), base != null ? base.bestEffortDeliver() : null));
    }

    private static CronSessionTarget inferTarget(CronPayload payload) {
        return payload instanceof CronPayload.SystemEvent ? CronSessionTarget.MAIN : CronSessionTarget.ISOLATED;
    }

    private static RunJobResponse toRunResponse(String jobId, CronRunOutcome outcome) {
        return new RunJobResponse(jobId, outcome.status().getValue(), outcome.summary(), outcome.error());
    }

    private static <T> T pick(T requested, T current) {
        return requested != null ? requested : current;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    public record DeleteJobResponse(String jobId) {
    }

    public record RunJobResponse(String jobId, String status, String summary, String error) {
    }

    public record DrainResponse(List<String> events) {
    }
}
