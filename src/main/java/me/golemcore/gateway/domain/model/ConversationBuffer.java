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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Pending events of one conversation waiting for the debounce timer.
 *
 * <p>
 * Mutated only by the buffer manager of its own conversation. Retention is
 * oldest-first: once {@code maxCapacity} events are held, new events are
 * refused and counted in {@link #getOverflowCount()}. A buffer is flushed at
 * most once; after {@link #markFlushed()} it accepts nothing.
 */
public class ConversationBuffer {

    private final String conversationId;
    private final Instant createdAt;
    private final int maxCapacity;
    private final List<InboundEvent> events = new ArrayList<>();

    private int overflowCount;
    private ScheduledFuture<?> timer;
    private boolean flushed;

    public ConversationBuffer(String conversationId, Instant createdAt, int maxCapacity) {
        if (maxCapacity < 1) {
            throw new IllegalArgumentException("maxCapacity must be positive: " + maxCapacity);
        }
        this.conversationId = conversationId;
        this.createdAt = createdAt;
        this.maxCapacity = maxCapacity;
    }

    /**
     * Appends the event if there is room.
     *
     * @return {@code false} when the event was refused and counted as overflow
     */
    public synchronized boolean tryAppend(InboundEvent event) {
        if (flushed) {
            throw new IllegalStateException("Buffer already flushed: " + conversationId);
        }
        if (events.size() >= maxCapacity) {
            overflowCount++;
            return false;
        }
        events.add(event);
        return true;
    }

    /**
     * Replaces the pending timer, cancelling the previous one.
     */
    public synchronized void replaceTimer(ScheduledFuture<?> next) {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = next;
    }

    public synchronized void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    /**
     * Marks the buffer flushed and returns its events ordered by event id. The
     * sort is stable, so events sharing an id keep arrival order.
     */
    public synchronized List<InboundEvent> markFlushed() {
        if (flushed) {
            throw new IllegalStateException("Buffer already flushed: " + conversationId);
        }
        flushed = true;
        timer = null;
        List<InboundEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(InboundEvent::getEventId));
        return ordered;
    }

    public String getConversationId() {
        return conversationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized int getOverflowCount() {
        return overflowCount;
    }

    public synchronized boolean isFlushed() {
        return flushed;
    }

    public synchronized List<InboundEvent> snapshot() {
        return List.copyOf(events);
    }
}
