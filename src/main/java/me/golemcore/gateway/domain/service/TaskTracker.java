package me.golemcore.gateway.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.TrackedTask;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.metrics.GatewayMetrics;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of fire-and-forget background work (archive writes and similar).
 *
 * <p>
 * A task is registered before it is submitted and leaves the registry when it
 * finishes, fails, or is cancelled before it ever ran. Failures are logged and
 * never reach the spawning code. The registry is a concurrent map, so
 * pipelines of different conversations register and remove tasks without a
 * shared lock.
 *
 * <p>
 * On shutdown all tasks are cancelled and awaited for
 * {@code gateway.tasks.shutdown-timeout}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskTracker {

    private final ExecutorService backgroundTaskExecutor;
    private final GatewayProperties properties;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final Map<Long, TrackedTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Unit of background work.
     */
    @FunctionalInterface
    public interface TrackedWork {
        void run() throws Exception; // NOSONAR - failures are logged by the tracker
    }

    @PostConstruct
    public void init() {
        metrics.bindActiveTasks(this::activeCount);
    }

    /**
     * Schedules work without waiting for it.
     *
     * @return handle of the registered task; if the executor rejects the work the
     *         handle is already cancelled and finished
     */
    public TrackedTask spawn(String name, TrackedWork work) {
        long id = sequence.incrementAndGet();
        TrackedFuture future = new TrackedFuture(id, name, work);
        TrackedTask task = new TrackedTask(id, name, clock.instant(), future, future.finished);
        tasks.put(id, task);
        try {
            backgroundTaskExecutor.execute(future);
        } catch (RejectedExecutionException e) {
            log.warn("[Tasks] Rejected task '{}' (#{}): executor is shut down", name, id);
            future.cancel(false);
        }
        return task;
    }

    public int activeCount() {
        return tasks.size();
    }

    public List<TrackedTask> activeTasks() {
        return new ArrayList<>(tasks.values());
    }

    /**
     * Cancels every registered task and waits until they have left the registry.
     *
     * @return {@code true} if all tasks finished within the timeout
     */
    public boolean cancelAll(Duration timeout) throws InterruptedException {
        List<TrackedTask> snapshot = activeTasks();
        if (snapshot.isEmpty()) {
            return true;
        }
        log.info("[Tasks] Cancelling {} background task(s)", snapshot.size());
        for (TrackedTask task : snapshot) {
            task.cancel();
        }
        return awaitAll(snapshot, timeout);
    }

    /**
     * Waits for the currently registered tasks without cancelling them.
     *
     * @return {@code true} if they all finished within the timeout
     */
    public boolean awaitAll(Duration timeout) throws InterruptedException {
        return awaitAll(activeTasks(), timeout);
    }

    @PreDestroy
    public void shutdown() {
        Duration timeout = properties.getTasks().getShutdownTimeout();
        try {
            if (!cancelAll(timeout)) {
                log.warn("[Tasks] {} task(s) still running after {}", activeCount(), timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Tasks] Interrupted while waiting for background tasks");
        }
    }

    private boolean awaitAll(List<TrackedTask> snapshot, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (TrackedTask task : snapshot) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !task.awaitFinished(Duration.ofNanos(remaining))) {
                return false;
            }
        }
        return true;
    }

    private final class TrackedFuture extends FutureTask<Void> {

        private final long id;
        private final String name;
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicBoolean started = new AtomicBoolean();

        private TrackedFuture(long id, String name, TrackedWork work) {
            super(() -> {
                runLogged(id, name, work);
                return null;
            });
            this.id = id;
            this.name = name;
        }

        @Override
        public void run() {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            try {
                super.run();
            } finally {
                complete();
            }
        }

        @Override
        protected void done() {
            // Cancelled before a worker picked it up: run() will never complete it.
            if (!started.get()) {
                complete();
            }
        }

        private void complete() {
            if (tasks.remove(id) != null) {
                log.debug("[Tasks] Task '{}' (#{}) left the tracker", name, id);
            }
            finished.countDown();
        }
    }

    private static void runLogged(long id, String name, TrackedWork work) throws InterruptedException {
        try {
            work.run();
        } catch (InterruptedException e) {
            log.info("[Tasks] Task '{}' (#{}) interrupted", name, id);
            throw e;
        } catch (Exception e) { // NOSONAR - background failures must not reach the spawner
            log.error("[Tasks] Task '{}' (#{}) failed: {}", name, id, e.getMessage(), e);
        }
    }
}
