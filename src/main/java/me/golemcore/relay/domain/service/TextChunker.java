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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits outbound text to fit per-surface message limits.
 */
public final class TextChunker {

    private TextChunker() {
    }

    /**
     * Split at paragraph, then line, then whitespace boundaries found in the
     * last three quarters of each window; hard split otherwise. Blank input
     * yields no chunks.
     */
    public static List<String> chunk(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                addIfNotBlank(chunks, text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);
            int splitAt = segment.lastIndexOf("\n\n");
            int skip = 2;
            if (splitAt <= maxLength / 4) {
                splitAt = segment.lastIndexOf('\n');
                skip = 1;
            }
            if (splitAt <= maxLength / 4) {
                splitAt = lastWhitespace(segment);
                skip = 1;
            }
            if (splitAt <= maxLength / 4) {
                splitAt = maxLength;
                skip = 0;
            }

            addIfNotBlank(chunks, text.substring(start, start + splitAt));
            start += splitAt + skip;
        }
        return chunks;
    }

    private static int lastWhitespace(String segment) {
        for (int i = segment.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(segment.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static void addIfNotBlank(List<String> chunks, String chunk) {
        if (!chunk.isBlank()) {
            chunks.add(chunk);
        }
    }
}
