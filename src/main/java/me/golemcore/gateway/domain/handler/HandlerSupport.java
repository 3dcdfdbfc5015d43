package me.golemcore.gateway.domain.handler;

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
import me.golemcore.gateway.domain.model.AgentRequest;
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.ReplyContext;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.outbound.AgentPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Prompt composition and agent hand-off shared by the content handlers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HandlerSupport {

    private static final int MAX_REPLY_QUOTE = 500;

    private final AgentPort agentPort;
    private final MessageService messageService;

    /**
     * Builds the agent prompt: reply context first, then the origin of forwarded
     * content, then the given sections, then the combined text of the message.
     */
    public String prompt(CombinedMessage message, String... sections) {
        List<String> parts = new ArrayList<>();
        ReplyContext reply = message.getReplyContext();
        if (reply != null && reply.text() != null && !reply.text().isBlank()) {
            parts.add("[Reply to: \"" + truncate(reply.text().trim(), MAX_REPLY_QUOTE) + "\"]");
        }
        String forwardedFrom = message.forwardedFrom();
        if (forwardedFrom != null) {
            parts.add("Message forwarded from " + forwardedFrom + ":");
        }
        Arrays.stream(sections)
                .filter(Objects::nonNull)
                .filter(section -> !section.isBlank())
                .forEach(parts::add);
        String text = message.combinedText();
        if (!text.isBlank()) {
            parts.add(text);
        }
        return String.join("\n\n", parts);
    }

    public void submit(CombinedMessage message, boolean agentMode, ContentKind source, String prompt,
            List<Attachment> attachments) {
        AgentRequest request = AgentRequest.builder()
                .conversationId(message.getConversationId())
                .senderId(message.getSenderId())
                .prompt(prompt)
                .attachments(attachments)
                .agentMode(agentMode)
                .scope(message.getAgentScope())
                .source(source)
                .build();
        log.debug("[Handler] {} request for {}: {} chars, {} attachment(s)", source,
                message.getConversationId(), prompt.length(), attachments.size());
        agentPort.submit(request);
    }

    public String message(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    /**
     * Joins non-blank notices with newlines, {@code null} when there are none.
     */
    public static String joinNotices(List<String> notices) {
        List<String> present = notices.stream()
                .filter(Objects::nonNull)
                .filter(notice -> !notice.isBlank())
                .distinct()
                .toList();
        return present.isEmpty() ? null : String.join("\n", present);
    }

    /**
     * Result for a handler that processed nothing: the most severe failure
     * status wins, notices are joined.
     */
    public static HandlerResult failureOf(List<HandlerResult> failures) {
        if (failures.isEmpty()) {
            return HandlerResult.skipped();
        }
        boolean anyFailed = failures.stream().anyMatch(result -> result.status() == HandlerResult.Status.FAILED);
        String notice = joinNotices(failures.stream().map(HandlerResult::notice).toList());
        return anyFailed ? HandlerResult.failed(notice) : HandlerResult.rejected(notice);
    }

    /**
     * Rethrows cancellation as {@link InterruptedException} after catching a
     * library exception: either the thread is flagged, or the failure wraps an
     * {@code InterruptedException} that the library caught without restoring the
     * flag (Jaffree does this when FFmpeg is interrupted).
     */
    public static void throwIfInterrupted(Throwable failure) throws InterruptedException {
        InterruptedException wrapped = interruptionIn(failure);
        if (Thread.interrupted() || wrapped != null) {
            InterruptedException cancelled = new InterruptedException("Interrupted while handling media");
            cancelled.initCause(failure);
            throw cancelled;
        }
    }

    /**
     * First {@link InterruptedException} in the cause chain, or {@code null}.
     */
    public static InterruptedException interruptionIn(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof InterruptedException interrupted) {
                return interrupted;
            }
            current = current.getCause();
        }
        return null;
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
