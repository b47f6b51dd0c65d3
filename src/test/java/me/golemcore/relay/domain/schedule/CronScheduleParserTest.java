package me.golemcore.relay.domain.schedule;

import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronScheduleParserTest {

    private static final long NOW = Instant.parse("2026-01-01T00:00:00Z").toEpochMilli();

    private CronScheduleParser parser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        parser = new CronScheduleParser(new CronScheduleCalculator(clock), clock);
    }

    @Test
    void shouldParseRelativeAt() {
        CronSchedule schedule = parser.parse("+10m", null, null, null, null);

        assertEquals(new CronSchedule.At(NOW + 600_000), schedule);
    }

    @Test
    void shouldParseEpochAndIsoAt() {
        assertEquals(new CronSchedule.At(1_767_225_600_000L),
                parser.parse("1767225600000", null, null, null, null));
        assertEquals(new CronSchedule.At(Instant.parse("2026-01-02T10:00:00Z").toEpochMilli()),
                parser.parse("2026-01-02T10:00:00Z", null, null, null, null));
        assertEquals(new CronSchedule.At(Instant.parse("2026-01-02T08:00:00Z").toEpochMilli()),
                parser.parse("2026-01-02T10:00:00+02:00", null, null, null, null));
    }

    @Test
    void shouldReadLocalDateTimeInGivenZone() {
        CronSchedule schedule = parser.parse("2026-01-02T10:00:00", null, null, null, "Europe/Berlin");

        assertEquals(new CronSchedule.At(Instant.parse("2026-01-02T09:00:00Z").toEpochMilli()), schedule);
    }

    @Test
    void shouldParseEveryWithAnchor() {
        CronSchedule schedule = parser.parse(null, "1h", "2026-01-01T00:30:00Z", null, null);

        assertEquals(new CronSchedule.Every(3_600_000L, NOW + 1_800_000L), schedule);
    }

    @Test
    void shouldParseEveryWithoutAnchor() {
        CronSchedule.Every every = (CronSchedule.Every) parser.parse(null, "15m", null, null, null);

        assertEquals(900_000L, every.everyMs());
        assertNull(every.anchorMs());
    }

    @Test
    void shouldNormalizeCronWhitespace() {
        CronSchedule schedule = parser.parse(null, null, null, " 0  9 * * 1-5 ", " UTC ");

        assertEquals(new CronSchedule.Cron("0 9 * * 1-5", "UTC"), schedule);
    }

    @Test
    void shouldRequireExactlyOneScheduleKind() {
        assertThrows(CronValidationException.class, () -> parser.parse(null, null, null, null, null));
        assertThrows(CronValidationException.class, () -> parser.parse("+1m", "1m", null, null, null));
        assertThrows(CronValidationException.class, () -> parser.parse(" ", null, null, "", null));
    }

    @Test
    void shouldRejectUnparseableTime() {
        assertThrows(CronValidationException.class, () -> parser.parse("tomorrow", null, null, null, null));
    }

    @Test
    void shouldRejectInvalidCron() {
        assertThrows(CronValidationException.class, () -> parser.parse(null, null, null, "0 25 * * *", null));
    }
}
