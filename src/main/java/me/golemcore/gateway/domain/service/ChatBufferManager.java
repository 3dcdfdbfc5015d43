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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.BufferOutcome;
import me.golemcore.gateway.domain.model.BufferStatus;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.CommandInvocation;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.ConversationBuffer;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.ReplyContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.metrics.GatewayMetrics;
import me.golemcore.gateway.port.inbound.InboundEventPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Aggregates bursts of inbound events per conversation.
 *
 * <p>
 * The first event of a conversation creates a {@link ConversationBuffer}. Every
 * accepted event restarts the debounce timer, but the flush deadline never
 * moves past {@code createdAt + maxWait}. When the timer fires the buffer is
 * removed from the registry, turned into a {@link CombinedMessage} and handed
 * to the {@link ConversationDispatcher}, which keeps routing of one
 * conversation serialized.
 *
 * <p>
 * Capacity overflow refuses the new event and keeps everything already
 * buffered; a refused event does not restart the timer. Commands listed in
 * {@code gateway.buffer.bypass-commands} skip aggregation.
 *
 * <p>
 * All registry mutations go through {@link ConcurrentHashMap#compute} and
 * {@link ConcurrentHashMap#remove(Object, Object)}, so an append and a timer
 * flush of the same buffer never interleave and a buffer is flushed at most
 * once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatBufferManager implements InboundEventPort {

    private final GatewayProperties properties;
    private final ConversationDispatcher dispatcher;
    private final ReplyContextService replyContextService;
    private final ScheduledExecutorService bufferScheduler;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final Map<String, ConversationBuffer> buffers = new ConcurrentHashMap<>();

    @Override
    public BufferOutcome onEvent(InboundEvent event) {
        replyContextService.remember(event);

        if (isBypassCommand(event)) {
            log.debug("[Buffer] Bypassing aggregation for command event {} in {}",
                    event.getEventId(), event.getConversationId());
            dispatcher.submit(CombinedMessage.single(event, resolveReply(List.of(event))));
            return BufferOutcome.BYPASSED;
        }

        GatewayProperties.BufferProperties config = properties.getBuffer();
        Instant now = clock.instant();
        AtomicReference<BufferOutcome> outcome = new AtomicReference<>();
        AtomicReference<ConversationBuffer> ready = new AtomicReference<>();

        buffers.compute(event.getConversationId(), (conversationId, existing) -> {
            ConversationBuffer buffer = existing != null
                    ? existing
                    : new ConversationBuffer(conversationId, now, config.getMaxCapacity());
            if (!buffer.tryAppend(event)) {
                outcome.set(BufferOutcome.OVERFLOWED);
                return buffer;
            }

            Instant hardDeadline = buffer.getCreatedAt().plus(config.getMaxWait());
            if (!now.isBefore(hardDeadline)) {
                buffer.cancelTimer();
                ready.set(buffer);
                outcome.set(BufferOutcome.FLUSHED);
                return null;
            }

            Instant deadline = now.plus(config.getDebounce());
            if (deadline.isAfter(hardDeadline)) {
                deadline = hardDeadline;
            }
            try {
                buffer.replaceTimer(schedule(buffer, Duration.between(now, deadline)));
            } catch (RejectedExecutionException e) {
                log.warn("[Buffer] Timer scheduler unavailable, flushing {} immediately", conversationId);
                ready.set(buffer);
                outcome.set(BufferOutcome.FLUSHED);
                return null;
            }
            outcome.set(BufferOutcome.BUFFERED);
            return buffer;
        });

        if (outcome.get() == BufferOutcome.OVERFLOWED) {
            metrics.recordOverflow();
            log.warn("[Buffer] Buffer full for conversation {} ({} events), dropped event {}",
                    event.getConversationId(), config.getMaxCapacity(), event.getEventId());
        }
        ConversationBuffer toFlush = ready.get();
        if (toFlush != null) {
            flush(toFlush);
        }
        return outcome.get();
    }

    @Override
    public int cancelBuffer(String conversationId) {
        ConversationBuffer buffer = buffers.remove(conversationId);
        if (buffer == null) {
            return 0;
        }
        buffer.cancelTimer();
        int discarded = buffer.markFlushed().size();
        log.info("[Buffer] Cancelled buffer of conversation {}: {} event(s) discarded", conversationId, discarded);
        return discarded;
    }

    @Override
    public Optional<BufferStatus> getBufferStatus(String conversationId) {
        ConversationBuffer buffer = buffers.get(conversationId);
        if (buffer == null) {
            return Optional.empty();
        }
        List<InboundEvent> events = buffer.snapshot();
        List<ContentKind> kinds = events.stream().map(InboundEvent::getKind).toList();
        return Optional.of(new BufferStatus(conversationId, events.size(), buffer.getCreatedAt(), kinds,
                buffer.getOverflowCount()));
    }

    public int pendingConversations() {
        return buffers.size();
    }

    @PreDestroy
    public void shutdown() {
        for (String conversationId : List.copyOf(buffers.keySet())) {
            int discarded = cancelBuffer(conversationId);
            if (discarded > 0) {
                log.warn("[Buffer] Shutdown dropped {} pending event(s) of conversation {}", discarded,
                        conversationId);
            }
        }
    }

    private ScheduledFuture<?> schedule(ConversationBuffer buffer, Duration delay) {
        return bufferScheduler.schedule(() -> onTimer(buffer), Math.max(0, delay.toMillis()),
                TimeUnit.MILLISECONDS);
    }

    private void onTimer(ConversationBuffer buffer) {
        try {
            if (buffers.remove(buffer.getConversationId(), buffer)) {
                flush(buffer);
            }
        } catch (Exception e) { // NOSONAR - must not kill the timer thread
            log.error("[Buffer] Flush failed for conversation {}", buffer.getConversationId(), e);
        }
    }

    private void flush(ConversationBuffer buffer) {
        List<InboundEvent> events = buffer.markFlushed();
        InboundEvent first = events.get(0);
        CombinedMessage message = new CombinedMessage(buffer.getConversationId(), first.getSenderId(), events,
                buffer.getOverflowCount(), resolveReply(events));
        log.info("[Buffer] Flushing {} event(s) for conversation {} (overflow={})",
                events.size(), buffer.getConversationId(), buffer.getOverflowCount());
        dispatcher.submit(message);
    }

    private ReplyContext resolveReply(List<InboundEvent> events) {
        return events.stream()
                .filter(event -> event.getReplyToEventId() != null)
                .findFirst()
                .flatMap(event -> replyContextService.resolve(event.getConversationId(),
                        event.getReplyToEventId(), event.getReplyToText()))
                .orElse(null);
    }

    private boolean isBypassCommand(InboundEvent event) {
        if (event.getKind() != ContentKind.COMMAND) {
            return false;
        }
        List<String> bypass = properties.getBuffer().getBypassCommands();
        return CommandInvocation.parse(event.getText())
                .map(command -> bypass.contains(command.name()))
                .orElse(false);
    }
}
