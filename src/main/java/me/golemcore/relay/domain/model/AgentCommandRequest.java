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

import java.util.List;
import java.util.Map;

/**
 * One invocation of the external agent: argv template, the values used to
 * render it, and the wall-clock budget.
 */
public record AgentCommandRequest(
        List<String> command,
        Map<String, String> templatingContext,
        long timeoutMs,
        String thinkLevel) {

    public AgentCommandRequest {
        command = command != null ? List.copyOf(command) : List.of();
        templatingContext = templatingContext != null ? Map.copyOf(templatingContext) : Map.of();
    }
}
