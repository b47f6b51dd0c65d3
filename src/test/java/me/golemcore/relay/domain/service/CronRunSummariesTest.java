package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ReplyPayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CronRunSummariesTest {

    @Test
    void shouldPickLastNonBlankPayloadTrimmed() {
        List<ReplyPayload> payloads = List.of(
                ReplyPayload.text("first"),
                ReplyPayload.text(" "),
                ReplyPayload.text(" last "));

        assertEquals("last", CronRunSummaries.pickSummary(payloads));
    }

    @Test
    void shouldSkipTrailingMediaOnlyPayloads() {
        List<ReplyPayload> payloads = List.of(
                ReplyPayload.text("caption"),
                new ReplyPayload(null, "https://example.com/a.png", null));

        assertEquals("caption", CronRunSummaries.pickSummary(payloads));
    }

    @Test
    void shouldTruncateLongSummary() {
        String summary = CronRunSummaries.pickSummary("x".repeat(2001));

        assertEquals(2001, summary.length());
        assertEquals("x".repeat(2000) + "…", summary);
        assertEquals("y".repeat(2000), CronRunSummaries.pickSummary("y".repeat(2000)));
    }

    @Test
    void shouldReturnNullWithoutText() {
        assertNull(CronRunSummaries.pickSummary((List<ReplyPayload>) null));
        assertNull(CronRunSummaries.pickSummary(List.of()));
        assertNull(CronRunSummaries.pickSummary(List.of(ReplyPayload.text("  "))));
        assertNull(CronRunSummaries.pickSummary((String) null));
    }
}
