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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.ReplyContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers recent events per conversation so replies can be resolved to the
 * text they refer to. Each conversation keeps a bounded LRU of
 * {@code gateway.replies.max-per-conversation} entries, and only the
 * {@code gateway.replies.max-conversations} most recently active conversations
 * are kept.
 */
@Service
@Slf4j
public class ReplyContextService {

    private final GatewayProperties properties;

    private final Map<String, Map<Long, Remembered>> recent;

    public ReplyContextService(GatewayProperties properties) {
        this.properties = properties;
        this.recent = LruMaps.bounded(properties.getReplies().getMaxConversations());
    }

    private record Remembered(String senderId, String text) {
    }

    public void remember(InboundEvent event) {
        String text = describe(event);
        if (text == null) {
            return;
        }
        recent.computeIfAbsent(event.getConversationId(),
                id -> LruMaps.bounded(properties.getReplies().getMaxPerConversation()))
                .put(event.getEventId(), new Remembered(event.getSenderId(), text));
    }

    /**
     * Resolves the replied-to event, falling back to the text delivered by the
     * transport when the event is not remembered.
     */
    public Optional<ReplyContext> resolve(String conversationId, long replyToEventId, String fallbackText) {
        Map<Long, Remembered> entries = recent.get(conversationId);
        if (entries != null) {
            Remembered remembered = entries.get(replyToEventId);
            if (remembered != null) {
                return Optional.of(new ReplyContext(replyToEventId, remembered.senderId(), remembered.text()));
            }
        }
        if (fallbackText != null && !fallbackText.isBlank()) {
            log.debug("Reply target {} not remembered, using transport text", replyToEventId);
            return Optional.of(new ReplyContext(replyToEventId, null, fallbackText));
        }
        return Optional.empty();
    }

    private static String describe(InboundEvent event) {
        if (event.hasTextContent()) {
            return event.textContent();
        }
        if (event.getKind() == ContentKind.TEXT || event.getKind() == ContentKind.COMMAND) {
            return null;
        }
        return "[" + event.getKind().name().toLowerCase(Locale.ROOT) + "]";
    }
}
