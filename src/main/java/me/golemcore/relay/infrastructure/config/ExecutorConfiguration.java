package me.golemcore.relay.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools of the cron engine. All threads are daemons.
 *
 * <ul>
 * <li>{@code laneExecutor} - runs lane tasks; a lane occupies at most one
 * thread at a time</li>
 * <li>{@code laneTimeoutScheduler} - fires lane deadlines</li>
 * <li>{@code cronRunExecutor} - drives claimed cron runs so the tick never
 * blocks</li>
 * </ul>
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    private final List<ExecutorService> executors = new ArrayList<>();

    @Bean(name = "laneExecutor")
    public synchronized ExecutorService laneExecutor() {
        return register(Executors.newCachedThreadPool(daemon("command-lane")));
    }

    @Bean(name = "laneTimeoutScheduler")
    public synchronized ScheduledExecutorService laneTimeoutScheduler() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(daemon("lane-timeout"));
        register(scheduler);
        return scheduler;
    }

    @Bean(name = "cronRunExecutor")
    public synchronized ExecutorService cronRunExecutor() {
        return register(Executors.newCachedThreadPool(daemon("cron-run")));
    }

    @PreDestroy
    public synchronized void shutdown() {
        for (ExecutorService executor : executors) {
            executor.shutdownNow();
        }
        for (ExecutorService executor : executors) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[Cron] Executor did not terminate within timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private ExecutorService register(ExecutorService executor) {
        executors.add(executor);
        return executor;
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
