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

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable aggregate produced when a conversation buffer is flushed.
 *
 * <p>
 * Events keep arrival order. The per-kind collections ({@link #images()},
 * {@link #voices()} and so on) are filtered views over {@link #getEvents()};
 * text is derived from every text-bearing event, so captions coexist with the
 * media they belong to.
 */
@Getter
@ToString
public final class CombinedMessage {

    private static final String TEXT_SEPARATOR = " ";

    private final String conversationId;
    private final String senderId;
    private final List<InboundEvent> events;
    private final int overflowCount;
    private final ReplyContext replyContext;
    /**
     * Working scope of the agent command that forwarded this message, or
     * {@code null}.
     */
    private final String agentScope;

    public CombinedMessage(String conversationId, String senderId, List<InboundEvent> events, int overflowCount,
            ReplyContext replyContext) {
        this(conversationId, senderId, events, overflowCount, replyContext, null);
    }

    public CombinedMessage(String conversationId, String senderId, List<InboundEvent> events, int overflowCount,
            ReplyContext replyContext, String agentScope) {
        this.agentScope = agentScope;
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.senderId = senderId;
        this.events = List.copyOf(events);
        this.overflowCount = overflowCount;
        this.replyContext = replyContext;
        if (this.events.isEmpty()) {
            throw new IllegalArgumentException("CombinedMessage requires at least one event");
        }
    }

    /**
     * Wraps one event that bypassed aggregation.
     */
    public static CombinedMessage single(InboundEvent event, ReplyContext replyContext) {
        return new CombinedMessage(event.getConversationId(), event.getSenderId(), List.of(event), 0,
                replyContext);
    }

    /**
     * Copy with other events, keeping sender, overflow, reply context and scope.
     */
    public CombinedMessage withEvents(List<InboundEvent> replacement) {
        return new CombinedMessage(conversationId, senderId, replacement, overflowCount, replyContext, agentScope);
    }

    public CombinedMessage withAgentScope(String scope) {
        return new CombinedMessage(conversationId, senderId, events, overflowCount, replyContext, scope);
    }

    /**
     * Merges several messages of one conversation into a single message, keeping
     * the given order. Overflow counts are summed, the first reply context wins.
     */
    public static CombinedMessage merge(List<CombinedMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        if (messages.size() == 1) {
            return messages.get(0);
        }
        CombinedMessage first = messages.get(0);
        List<InboundEvent> merged = new ArrayList<>();
        int overflow = 0;
        ReplyContext reply = null;
        for (CombinedMessage message : messages) {
            merged.addAll(message.events);
            overflow += message.overflowCount;
            if (reply == null) {
                reply = message.replyContext;
            }
        }
        CombinedMessage last = messages.get(messages.size() - 1);
        return new CombinedMessage(first.conversationId, last.senderId, merged, overflow, reply);
    }

    /**
     * Text of all text-bearing events in arrival order, joined by a single space.
     * Empty when no event carries text.
     */
    public String combinedText() {
        return events.stream()
                .filter(InboundEvent::hasTextContent)
                .map(event -> event.textContent().trim())
                .collect(Collectors.joining(TEXT_SEPARATOR));
    }

    public boolean hasText() {
        return events.stream().anyMatch(InboundEvent::hasTextContent);
    }

    public List<InboundEvent> ofKind(ContentKind kind) {
        return events.stream().filter(event -> event.getKind() == kind).toList();
    }

    public boolean hasKind(ContentKind kind) {
        return events.stream().anyMatch(event -> event.getKind() == kind);
    }

    public List<InboundEvent> images() {
        return ofKind(ContentKind.PHOTO);
    }

    public List<InboundEvent> voices() {
        return ofKind(ContentKind.VOICE);
    }

    public List<InboundEvent> videos() {
        return ofKind(ContentKind.VIDEO);
    }

    public List<InboundEvent> documents() {
        return ofKind(ContentKind.DOCUMENT);
    }

    public List<InboundEvent> commands() {
        return ofKind(ContentKind.COMMAND);
    }

    public List<ContactCard> contacts() {
        return ofKind(ContentKind.CONTACT).stream()
                .map(InboundEvent::getContact)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<PollPayload> polls() {
        return ofKind(ContentKind.POLL).stream()
                .map(InboundEvent::getPoll)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Origin label of the first forwarded event, or {@code null} when nothing
     * was forwarded.
     */
    public String forwardedFrom() {
        return events.stream()
                .filter(InboundEvent::isForwarded)
                .map(InboundEvent::getForwardedFrom)
                .findFirst()
                .orElse(null);
    }

    public InboundEvent firstEvent() {
        return events.get(0);
    }

    public InboundEvent lastEvent() {
        return events.get(events.size() - 1);
    }
}
