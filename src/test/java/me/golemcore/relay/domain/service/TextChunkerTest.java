package me.golemcore.relay.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextChunkerTest {

    @Test
    void shouldReturnShortTextUnchanged() {
        assertEquals(List.of("hello"), TextChunker.chunk("hello", 10));
    }

    @Test
    void shouldReturnNoChunksForBlankText() {
        assertTrue(TextChunker.chunk("   ", 10).isEmpty());
        assertTrue(TextChunker.chunk(null, 10).isEmpty());
    }

    @Test
    void shouldPreferParagraphBoundary() {
        List<String> chunks = TextChunker.chunk("aaaa bbbb\n\ncccc dddd", 15);

        assertEquals(List.of("aaaa bbbb", "cccc dddd"), chunks);
    }

    @Test
    void shouldFallBackToLineThenWhitespace() {
        assertEquals(List.of("aaaa bbbb", "cccc dddd"), TextChunker.chunk("aaaa bbbb\ncccc dddd", 15));
        assertEquals(List.of("aaaa bbbb cccc", "dddd"), TextChunker.chunk("aaaa bbbb cccc dddd", 15));
    }

    @Test
    void shouldHardSplitWithoutBoundaries() {
        assertEquals(List.of("abcde", "fghij", "k"), TextChunker.chunk("abcdefghijk", 5));
    }

    @Test
    void shouldKeepEveryChunkWithinLimit() {
        String text = "word ".repeat(1000);

        List<String> chunks = TextChunker.chunk(text, 4000);

        assertTrue(chunks.size() > 1);
        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= 4000));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> TextChunker.chunk("x", 0));
    }
}
