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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CronRunLogEntry;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Append-only run history, one JSONL file per job under
 * {@code cron/runs/<jobId>.jsonl}. History only: scheduling never reads it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronRunLogService {

    static final String RUNS_PREFIX = "runs/";
    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private static final Pattern SAFE_JOB_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    /**
     * Append one entry. Failures are logged and never reach the caller.
     */
    public synchronized void append(CronRunLogEntry entry) {
        try {
            String line = objectMapper.writeValueAsString(entry) + "\n";
            storagePort.appendText(CronJobService.CRON_DIR, runLogPath(entry.getJobId()), line).join();
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - history must not break a run
            log.error("[CronJobs] Failed to append run log entry for job {}: {}", entry.getJobId(), e.getMessage());
        }
    }

    /**
     * The newest {@code limit} entries of a job, oldest first. Malformed lines
     * are skipped.
     *
     * @param limit
     *            null for the default, clamped to 1..500
     */
    public List<CronRunLogEntry> readRuns(String jobId, Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        String content = storagePort.getText(CronJobService.CRON_DIR, runLogPath(jobId)).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<CronRunLogEntry> entries = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, CronRunLogEntry.class));
            } catch (JsonProcessingException e) {
                log.debug("[CronJobs] Skipping malformed run log line for job {}: {}", jobId, e.getOriginalMessage());
            }
        }

        int from = Math.max(0, entries.size() - effectiveLimit);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    static String runLogPath(String jobId) {
        if (jobId == null || !SAFE_JOB_ID.matcher(jobId).matches()) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return RUNS_PREFIX + jobId + ".jsonl";
    }
}
