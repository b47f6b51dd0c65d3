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
 * The external agent command could not be started, exited non-zero, timed out
 * or produced unreadable output.
 */
public class AgentExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Integer exitCode;

    public AgentExecutionException(String message) {
        this(message, null, null);
    }

    public AgentExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AgentExecutionException(String message, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
