package me.golemcore.relay.domain.lane;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.LaneTimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Lane-serialized command queue.
 *
 * <p>
 * A lane is a named channel that runs at most one task at a time, in FIFO
 * arrival order. Different lanes run concurrently with no ordering between
 * them. Work that touches shared session state goes through the same lane as
 * live traffic for that session.
 * </p>
 * <ul>
 * <li>Cancelling the returned future removes a queued task without running it,
 * or interrupts a running one.</li>
 * <li>A timeout is a deadline counted from enqueue. A task still queued at the
 * deadline is dropped; a running task is interrupted. Either way the future
 * fails with {@link LaneTimeoutException}.</li>
 * <li>The lane is not released until an interrupted task has actually
 * returned.</li>
 * </ul>
 */
@Service
@Slf4j
public class CommandLaneService {

    private final ExecutorService laneExecutor;
    private final ScheduledExecutorService laneTimeoutScheduler;

    private final Map<String, LaneRunner> runners = new ConcurrentHashMap<>();

    public CommandLaneService(@Qualifier("laneExecutor") ExecutorService laneExecutor,
            @Qualifier("laneTimeoutScheduler") ScheduledExecutorService laneTimeoutScheduler) {
        this.laneExecutor = laneExecutor;
        this.laneTimeoutScheduler = laneTimeoutScheduler;
    }

    public <T> CompletableFuture<T> enqueue(String lane, Callable<T> task) {
        return enqueue(lane, task, LaneTaskOptions.NONE);
    }

    public <T> CompletableFuture<T> enqueue(String lane, Callable<T> task, LaneTaskOptions options) {
        Objects.requireNonNull(task, "task");
        String laneName = normalizeLane(lane);
        LaneTask<T> laneTask = new LaneTask<>(laneName, task, options != null ? options : LaneTaskOptions.NONE);

        while (true) {
            LaneRunner runner = runners.computeIfAbsent(laneName, LaneRunner::new);
            if (runner.offer(laneTask)) {
                break;
            }
            // retired between lookup and offer
            runners.remove(laneName, runner);
        }
        return laneTask.result;
    }

    /**
     * Tasks waiting in the lane, excluding the running one.
     */
    public int queuedCount(String lane) {
        LaneRunner runner = runners.get(normalizeLane(lane));
        return runner != null ? runner.queuedCount() : 0;
    }

    public boolean isBusy(String lane) {
        LaneRunner runner = runners.get(normalizeLane(lane));
        return runner != null && runner.isBusy();
    }

    private static String normalizeLane(String lane) {
        return lane == null || lane.isBlank() ? "main" : lane.trim();
    }

    private final class LaneRunner {

        private final String lane;
        private final Object lock = new Object();
        private final Deque<LaneTask<?>> queue = new ArrayDeque<>();

        private LaneTask<?> active;
        private Future<?> activeFuture;
        private boolean retired;

        private LaneRunner(String lane) {
            this.lane = lane;
        }

        boolean offer(LaneTask<?> task) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                queue.addLast(task);
                if (active == null) {
                    startNextLocked();
                } else {
                    log.debug("[Lane] queued task in lane '{}' (waiting: {})", lane, queue.size());
                }
            }
            armDeadline(task);
            task.result.whenComplete((value, error) -> {
                if (task.result.isCancelled()) {
                    onCancelled(task);
                }
            });
            return true;
        }

        int queuedCount() {
            synchronized (lock) {
                return queue.size();
            }
        }

        boolean isBusy() {
            synchronized (lock) {
                return active != null;
            }
        }

        private void armDeadline(LaneTask<?> task) {
            if (!task.options.hasTimeout() || task.result.isDone()) {
                return;
            }
            task.deadline = laneTimeoutScheduler.schedule(() -> onDeadline(task),
                    task.options.timeoutMs(), TimeUnit.MILLISECONDS);
        }

        private void startNextLocked() {
            while (!queue.isEmpty()) {
                LaneTask<?> next = queue.removeFirst();
                if (next.result.isDone()) {
                    continue;
                }
                active = next;
                activeFuture = laneExecutor.submit(() -> run(next));
                return;
            }
        }

        private <T> void run(LaneTask<T> task) {
            try {
                if (task.result.isDone()) {
                    return;
                }
                T value = task.callable.call();
                task.result.complete(value);
            } catch (Exception e) { // NOSONAR - task failures belong to the caller's future
                if (task.timedOut) {
                    task.result.completeExceptionally(new LaneTimeoutException(lane, task.options.timeoutMs()));
                } else {
                    task.result.completeExceptionally(e);
                }
            } finally {
                task.cancelDeadline();
                // Clear any interrupt so it does not leak into the next task on this thread.
                boolean interrupted = Thread.interrupted();
                if (interrupted) {
                    log.debug("[Lane] task in lane '{}' ended after interrupt", lane);
                }
                onTaskFinished(task);
            }
        }

        private void onTaskFinished(LaneTask<?> task) {
            synchronized (lock) {
                if (active == task) {
                    active = null;
                    activeFuture = null;
                }
                startNextLocked();
            }
            evictIfIdle();
        }

        private void onDeadline(LaneTask<?> task) {
            Future<?> toInterrupt = null;
            boolean wasQueued;
            synchronized (lock) {
                wasQueued = queue.remove(task);
                if (!wasQueued && active == task) {
                    task.timedOut = true;
                    toInterrupt = activeFuture;
                }
            }

            if (!wasQueued && toInterrupt == null) {
                return;
            }

            LaneTimeoutException timeout = new LaneTimeoutException(lane, task.options.timeoutMs());
            if (wasQueued) {
                log.warn("[Lane] task in lane '{}' expired after {} ms before it started", lane,
                        task.options.timeoutMs());
                task.result.completeExceptionally(timeout);
                evictIfIdle();
                return;
            }

            log.warn("[Lane] task in lane '{}' timed out after {} ms, interrupting", lane, task.options.timeoutMs());
            task.result.completeExceptionally(timeout);
            toInterrupt.cancel(true);
        }

        private void onCancelled(LaneTask<?> task) {
            task.cancelDeadline();
            Future<?> toInterrupt = null;
            boolean wasQueued;
            synchronized (lock) {
                wasQueued = queue.remove(task);
                if (!wasQueued && active == task) {
                    toInterrupt = activeFuture;
                }
            }
            if (wasQueued) {
                log.debug("[Lane] removed cancelled task from lane '{}'", lane);
                evictIfIdle();
            } else if (toInterrupt != null) {
                log.info("[Lane] cancelling running task in lane '{}'", lane);
                toInterrupt.cancel(true);
            }
        }

        private void evictIfIdle() {
            synchronized (lock) {
                if (retired || active != null || !queue.isEmpty()) {
                    return;
                }
                retired = true;
            }
            if (runners.remove(lane, this)) {
                log.debug("[Lane] evicted idle lane '{}'", lane);
            }
        }
    }

    private static final class LaneTask<T> {

        private final String lane;
        private final Callable<T> callable;
        private final LaneTaskOptions options;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private volatile ScheduledFuture<?> deadline;
        private volatile boolean timedOut;

        private LaneTask(String lane, Callable<T> callable, LaneTaskOptions options) {
            this.lane = lane;
            this.callable = callable;
            this.options = options;
        }

        void cancelDeadline() {
            ScheduledFuture<?> scheduled = deadline;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        @Override
        public String toString() {
            return "LaneTask[" + lane + "]";
        }
    }
}
