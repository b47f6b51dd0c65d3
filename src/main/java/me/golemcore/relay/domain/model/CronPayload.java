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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a cron job does when it fires. Main-session jobs carry a
 * {@link SystemEvent}, isolated jobs an {@link AgentTurn}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronPayload.SystemEvent.class, name = "systemEvent"),
        @JsonSubTypes.Type(value = CronPayload.AgentTurn.class, name = "agentTurn")
})
public sealed interface CronPayload permits CronPayload.SystemEvent, CronPayload.AgentTurn {

    /**
     * Text injected verbatim into the live main session.
     */
    record SystemEvent(String text) implements CronPayload {
    }

    /**
     * A full agent turn in a disposable session, optionally delivered to an
     * outbound channel.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AgentTurn(
            String message,
            String thinking,
            Integer timeoutSeconds,
            Boolean deliver,
            CronDeliveryChannel channel,
            String to,
            Boolean bestEffortDeliver) implements CronPayload {

        public static AgentTurn of(String message) {
            return new AgentTurn(message, null, null, null, null, null, null);
        }

        public boolean deliveryRequested() {
            return Boolean.TRUE.equals(deliver);
        }

        public boolean bestEffort() {
            return Boolean.TRUE.equals(bestEffortDeliver);
        }
    }
}
