package me.golemcore.relay.domain.service;

import me.golemcore.relay.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.relay.domain.model.CronRunAction;
import me.golemcore.relay.domain.model.CronRunLogEntry;
import me.golemcore.relay.domain.model.CronRunStatus;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CronRunLogServiceTest {

    @TempDir
    Path tempDir;

    private CronRunLogService service;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        service = new CronRunLogService(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldAppendJsonLinesPerJob() throws Exception {
        service.append(entry("job-1", 1));
        service.append(entry("job-1", 2));
        service.append(entry("job-2", 3));

        List<String> lines = Files.readAllLines(tempDir.resolve("cron/runs/job-1.jsonl"));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"action\":\"finished\""));
        assertTrue(lines.get(0).contains("\"status\":\"ok\""));
        assertEquals(1, service.readRuns("job-2", null).size());
    }

    @Test
    void shouldReturnNewestEntriesOldestFirst() {
        for (int i = 1; i <= 5; i++) {
            service.append(entry("job-1", i));
        }

        List<CronRunLogEntry> runs = service.readRuns("job-1", 2);

        assertEquals(List.of(4L, 5L), runs.stream().map(CronRunLogEntry::getTs).toList());
    }

    @Test
    void shouldClampLimitAndSkipMalformedLines() throws Exception {
        service.append(entry("job-1", 1));
        Files.writeString(tempDir.resolve("cron/runs/job-1.jsonl"), "garbage\n\n",
                StandardOpenOption.APPEND);
        service.append(entry("job-1", 2));

        assertEquals(1, service.readRuns("job-1", 0).size());
        assertEquals(2, service.readRuns("job-1", 10_000).size());
    }

    @Test
    void shouldReturnEmptyHistoryForUnknownJob() {
        assertTrue(service.readRuns("nobody", null).isEmpty());
    }

    @Test
    void shouldRejectUnsafeJobIds() {
        assertThrows(IllegalArgumentException.class, () -> service.readRuns("../jobs", null));
        assertThrows(IllegalArgumentException.class, () -> CronRunLogService.runLogPath(null));
    }

    @Test
    void shouldSwallowStorageFailuresOnAppend() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException("disk full",
                        new IOException("disk full"))));
        CronRunLogService failingService = new CronRunLogService(failing, AutoConfiguration.objectMapper());

        assertDoesNotThrow(() -> failingService.append(entry("job-1", 1)));
    }

    private static CronRunLogEntry entry(String jobId, long ts) {
        return CronRunLogEntry.builder()
                .ts(ts)
                .jobId(jobId)
                .action(CronRunAction.FINISHED)
                .status(CronRunStatus.OK)
                .summary("done")
                .runAtMs(ts)
                .durationMs(5L)
                .build();
    }
}
