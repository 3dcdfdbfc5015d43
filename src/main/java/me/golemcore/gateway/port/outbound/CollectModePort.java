package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.CombinedMessage;

import java.util.List;

/**
 * Collect capture mode: while active, messages are queued instead of routed
 * until a trigger phrase releases the queue.
 */
public interface CollectModePort {

    boolean isCollecting(String conversationId);

    /**
     * Whether the text contains a configured trigger phrase.
     */
    boolean matchesTrigger(String text);

    /**
     * Removes every configured trigger phrase from the text, so the phrase that
     * released the queue does not reach the agent.
     *
     * @return the remaining text, trimmed, {@code null} for {@code null} input
     */
    String stripTriggers(String text);

    /**
     * Appends a message to the collect queue.
     *
     * @return queue size after the append, {@code 0} if the conversation is not
     *         collecting
     */
    int enqueue(String conversationId, CombinedMessage message);

    /**
     * Ends collect mode and returns the queued messages in arrival order.
     */
    List<CombinedMessage> drainAndTrigger(String conversationId);

    /**
     * Enters collect mode.
     *
     * @return {@code false} if the conversation was already collecting
     */
    boolean start(String conversationId);

    /**
     * Leaves collect mode, discarding the queue.
     *
     * @return number of discarded messages
     */
    int stop(String conversationId);

    int queuedCount(String conversationId);
}
