package me.golemcore.relay.domain.model;

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

/**
 * Session picked for a turn: reused when fresh, minted otherwise.
 */
public record ResolvedSession(String sessionKey, SessionEntry entry, boolean isNewSession, boolean systemSent) {

    public String sessionId() {
        return entry.getSessionId();
    }

    /**
     * First turn of a logical conversation: new, or the preamble never went out.
     */
    public boolean isFirstTurn() {
        return isNewSession || !systemSent;
    }
}
