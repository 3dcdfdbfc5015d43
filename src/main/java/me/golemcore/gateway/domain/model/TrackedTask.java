package me.golemcore.gateway.domain.model;

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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Handle of a fire-and-forget unit of work registered with the task tracker.
 */
public final class TrackedTask {

    private final long id;
    private final String name;
    private final Instant startedAt;
    private final Future<?> future;
    private final CountDownLatch finished;

    public TrackedTask(long id, String name, Instant startedAt, Future<?> future, CountDownLatch finished) {
        this.id = id;
        this.name = name;
        this.startedAt = startedAt;
        this.future = future;
        this.finished = finished;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * Requests cancellation, interrupting the worker if the task already runs.
     */
    public boolean cancel() {
        return future.cancel(true);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    /**
     * Whether the task left the tracker, either by finishing or by being cancelled
     * before it started.
     */
    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * Waits until the task left the tracker.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "TrackedTask[" + id + ", " + name + "]";
    }
}
