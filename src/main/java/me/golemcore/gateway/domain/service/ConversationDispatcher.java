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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.RoutingOutcome;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs {@link MessageRouter#route(CombinedMessage)} per conversation.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Different conversations are routed in parallel on
 * {@code conversationExecutor}.</li>
 * <li>Messages of one conversation are routed one at a time, in submission
 * order; a message submitted while a route is running waits in the
 * conversation queue.</li>
 * <li>An idle runner retires and is evicted; a retired runner never accepts
 * work, so at most one runner per conversation is ever active.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationDispatcher {

    private final MessageRouter router;
    private final ExecutorService conversationExecutor;

    private final Map<String, ConversationRunner> runners = new ConcurrentHashMap<>();

    public void submit(CombinedMessage message) {
        Objects.requireNonNull(message, "message");
        while (true) {
            ConversationRunner runner = runners.computeIfAbsent(message.getConversationId(),
                    ConversationRunner::new);
            if (runner.offer(message)) {
                return;
            }
        }
    }

    /**
     * Number of conversations with a running or queued route.
     */
    public int activeConversations() {
        return runners.size();
    }

    private final class ConversationRunner {

        private final String conversationId;
        private final Object lock = new Object();
        private final Deque<CombinedMessage> queue = new ArrayDeque<>();

        private boolean running = false;
        private boolean retired = false;

        private ConversationRunner(String conversationId) {
            this.conversationId = conversationId;
        }

        boolean offer(CombinedMessage message) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    queue.addLast(message);
                    log.debug("[Dispatch] Queued message for busy conversation {} (queue={})",
                            conversationId, queue.size());
                    return true;
                }
                running = true;
            }
            startRun(message);
            return true;
        }

        private void startRun(CombinedMessage message) {
            try {
                conversationExecutor.execute(() -> run(message));
            } catch (RejectedExecutionException e) {
                int dropped;
                synchronized (lock) {
                    dropped = queue.size() + 1;
                    queue.clear();
                    running = false;
                    retired = true;
                    runners.remove(conversationId, this);
                }
                log.warn("[Dispatch] Executor rejected work for conversation {}, dropped {} message(s)",
                        conversationId, dropped);
            }
        }

        private void run(CombinedMessage message) {
            try {
                RoutingOutcome outcome = router.route(message);
                log.debug("[Dispatch] Conversation {} routed: {}", conversationId, outcome);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[Dispatch] Routing interrupted: conversation={}", conversationId);
            } catch (CancellationException e) {
                log.info("[Dispatch] Routing cancelled: conversation={}", conversationId);
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                log.error("[Dispatch] Routing failed: conversation={}: {}", conversationId, e.getMessage(), e);
            } finally {
                onRunComplete();
            }
        }

        private void onRunComplete() {
            CombinedMessage next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                    retired = true;
                    runners.remove(conversationId, this);
                    return;
                }
            }
            startRun(next);
        }
    }
}
