package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.AgentCommandRequest;
import me.golemcore.relay.domain.model.AgentRunResult;

/**
 * Runs the external conversational agent for one turn.
 *
 * <p>
 * The call blocks the caller until the agent exits. Implementations must
 * honor {@link AgentCommandRequest#timeoutMs()} and must kill the agent
 * when the calling thread is interrupted.
 */
public interface AgentCommandPort {

    /**
     * @throws me.golemcore.relay.domain.model.AgentExecutionException
     *             when the agent cannot be started, fails or times out
     * @throws InterruptedException
     *             when the calling thread was interrupted; the agent has been
     *             killed
     */
    AgentRunResult run(AgentCommandRequest request) throws InterruptedException;
}
