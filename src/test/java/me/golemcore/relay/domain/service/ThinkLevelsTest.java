package me.golemcore.relay.domain.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ThinkLevelsTest {

    @ParameterizedTest
    @CsvSource({
            "off, off",
            "None, off",
            "on, low",
            "MIN, minimal",
            "low, low",
            "mid, medium",
            "' medium ', medium",
            "max, high",
            "ultra, high"
    })
    void shouldNormalizeAliases(String raw, String expected) {
        assertEquals(expected, ThinkLevels.normalize(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { " ", "extreme", "7" })
    void shouldReturnNullForBlankOrUnknown(String raw) {
        assertNull(ThinkLevels.normalize(raw));
    }
}
