package me.golemcore.relay.adapter.outbound.agent;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.AgentCommandRequest;
import me.golemcore.relay.domain.model.AgentExecutionException;
import me.golemcore.relay.domain.model.AgentRunResult;
import me.golemcore.relay.domain.model.ReplyPayload;
import me.golemcore.relay.domain.service.MessageTemplateEngine;
import me.golemcore.relay.port.outbound.AgentCommandPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the external agent as a child process.
 *
 * <p>
 * Each element of {@code relay.agent.command} is rendered with the turn's
 * templating context, so {@code {{Body}}} and friends can be passed as
 * arguments. Standard output is the reply:
 * <ul>
 * <li>a JSON object with a {@code payloads} array of
 * {@code {text, mediaUrl, mediaUrls}} items, or with a single {@code text}</li>
 * <li>otherwise plain text; lines of the form {@code MEDIA: <url>} become media
 * attachments</li>
 * </ul>
 * The process is killed when the timeout expires or the calling thread is
 * interrupted.
 */
@Component
@Slf4j
public class CommandAgentAdapter implements AgentCommandPort {

    static final int MAX_OUTPUT_LENGTH = 1_000_000;
    private static final String MEDIA_PREFIX = "MEDIA:";

    private final MessageTemplateEngine templateEngine;
    private final ObjectMapper objectMapper;
    private final ExecutorService outputReader;

    public CommandAgentAdapter(MessageTemplateEngine templateEngine, ObjectMapper objectMapper) {
        this.templateEngine = templateEngine;
        this.objectMapper = objectMapper;
        this.outputReader = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-output-reader");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        outputReader.shutdownNow();
        try {
            if (!outputReader.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Agent] Output reader did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public AgentRunResult run(AgentCommandRequest request) throws InterruptedException {
        List<String> argv = request.command().stream()
                .map(part -> templateEngine.render(part, request.templatingContext()))
                .toList();
        if (argv.isEmpty()) {
            throw new AgentExecutionException("Agent command is empty");
        }

        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        if (request.thinkLevel() != null) {
            pb.environment().put("RELAY_THINK_LEVEL", request.thinkLevel());
        }

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentExecutionException("Failed to start agent '" + argv.get(0) + "': " + e.getMessage(), e);
        }
        log.debug("[Agent] Started {} (pid {})", argv.get(0), process.pid());

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("[Agent] Could not close agent stdin: {}", e.getMessage());
        }
        Future<String> outputFuture = outputReader.submit(() -> readOutput(process));

        try {
            boolean completed = process.waitFor(request.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                throw new AgentExecutionException("Agent timed out after " + request.timeoutMs() + " ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            outputFuture.cancel(true);
            log.info("[Agent] Agent {} killed after interrupt", argv.get(0));
            throw e;
        }

        String output;
        try {
            output = outputFuture.get(1, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new AgentExecutionException("Failed to read agent output: " + e.getMessage(), e);
        }

        long durationMs = System.currentTimeMillis() - startTime;
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new AgentExecutionException("Agent exited with code " + exitCode, exitCode, null);
        }
        log.debug("[Agent] Agent finished in {} ms ({} chars)", durationMs, output.length());
        return new AgentRunResult(parseOutput(output), durationMs);
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    List<ReplyPayload> parseOutput(String output) {
        String trimmed = output != null ? output.trim() : "";
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.startsWith("{")) {
            try {
                JsonNode root = objectMapper.readTree(trimmed);
                JsonNode payloads = root.get("payloads");
                if (payloads != null && payloads.isArray()) {
                    List<ReplyPayload> result = new ArrayList<>();
                    for (JsonNode node : payloads) {
                        result.add(objectMapper.treeToValue(node, ReplyPayload.class));
                    }
                    return result;
                }
                if (root.hasNonNull("text") || root.hasNonNull("mediaUrl") || root.hasNonNull("mediaUrls")) {
                    return List.of(objectMapper.treeToValue(root, ReplyPayload.class));
                }
            } catch (JsonProcessingException e) {
                log.debug("[Agent] Output is not JSON, treating as text: {}", e.getOriginalMessage());
            }
        }
        return List.of(parsePlainText(trimmed));
    }

    private static ReplyPayload parsePlainText(String output) {
        List<String> media = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (String line : output.split("\\R")) {
            String candidate = line.trim();
            if (candidate.regionMatches(true, 0, MEDIA_PREFIX, 0, MEDIA_PREFIX.length())) {
                String url = candidate.substring(MEDIA_PREFIX.length()).trim();
                if (!url.isEmpty()) {
                    media.add(url);
                }
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(line);
        }
        String body = text.toString().trim();
        return new ReplyPayload(body.isEmpty() ? null : body, null, media.isEmpty() ? null : List.copyOf(media));
    }
}
