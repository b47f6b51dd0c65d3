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
 * A lane task passed its deadline, either still queued or while running.
 */
public class LaneTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String lane;
    private final long timeoutMs;

    public LaneTimeoutException(String lane, long timeoutMs) {
        super("Command in lane '" + lane + "' timed out after " + timeoutMs + " ms");
        this.lane = lane;
        this.timeoutMs = timeoutMs;
    }

    public String getLane() {
        return lane;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
