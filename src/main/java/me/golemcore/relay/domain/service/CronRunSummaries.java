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

import me.golemcore.relay.domain.model.ReplyPayload;

import java.util.List;

/**
 * Extracts the human-readable summary of an agent run.
 */
public final class CronRunSummaries {

    public static final int MAX_SUMMARY_LENGTH = 2000;
    public static final String ELLIPSIS = "…";

    private CronRunSummaries() {
    }

    /**
     * Last payload with non-blank text, trimmed and capped at
     * {@value #MAX_SUMMARY_LENGTH} characters.
     *
     * @return the summary, or null when no payload carries text
     */
    public static String pickSummary(List<ReplyPayload> payloads) {
        if (payloads == null) {
            return null;
        }
        for (int i = payloads.size() - 1; i >= 0; i--) {
            ReplyPayload payload = payloads.get(i);
            String summary = payload != null ? pickSummary(payload.text()) : null;
            if (summary != null) {
                return summary;
            }
        }
        return null;
    }

    public static String pickSummary(String text) {
        if (text == null) {
            return null;
        }
        String clean = text.trim();
        if (clean.isEmpty()) {
            return null;
        }
        return clean.length() > MAX_SUMMARY_LENGTH
                ? clean.substring(0, MAX_SUMMARY_LENGTH) + ELLIPSIS
                : clean;
    }
}
