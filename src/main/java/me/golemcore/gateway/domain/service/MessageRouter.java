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
import me.golemcore.gateway.domain.handler.ContentHandler;
import me.golemcore.gateway.domain.handler.SpeechReader;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.CommandInvocation;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.RoutingOutcome;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.infrastructure.metrics.GatewayMetrics;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.port.outbound.AgentModePort;
import me.golemcore.gateway.port.outbound.CollectModePort;
import me.golemcore.gateway.port.outbound.CommandClassifierPort;
import me.golemcore.gateway.port.outbound.NotificationPort;
import me.golemcore.gateway.port.outbound.PersistencePort;
import me.golemcore.gateway.port.outbound.PluginPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Routes one flushed {@link CombinedMessage} to exactly one destination.
 *
 * <p>
 * Priority, first match wins:
 * <ol>
 * <li>plugins ({@link PluginPort})</li>
 * <li>recognized commands ({@link CommandPort})</li>
 * <li>collect mode: trigger phrase releases the queue, anything else is
 * queued</li>
 * <li>content kind: images &gt; voice &gt; video &gt; polls &gt; contacts &gt;
 * documents &gt; text</li>
 * </ol>
 *
 * <p>
 * Every routed message is archived in the background through the
 * {@link TaskTracker}. After routing, a single overflow notice is sent when
 * events were dropped. Unexpected exceptions become a generic notice;
 * interruption and cancellation always propagate.
 */
@Service
@Slf4j
public class MessageRouter {

    private final PluginPort pluginPort;
    private final CommandClassifierPort commandClassifier;
    private final ObjectProvider<CommandPort> commandRouter;
    private final CollectModePort collectMode;
    private final AgentModePort agentMode;
    private final PersistencePort persistencePort;
    private final NotificationPort notificationPort;
    private final TaskTracker taskTracker;
    private final MessageService messageService;
    private final GatewayMetrics metrics;
    private final SpeechReader speechReader;
    private final Map<ContentKind, ContentHandler> handlers = new EnumMap<>(ContentKind.class);

    @SuppressWarnings("java:S107")
    public MessageRouter(PluginPort pluginPort, CommandClassifierPort commandClassifier,
            ObjectProvider<CommandPort> commandRouter, CollectModePort collectMode, AgentModePort agentMode,
            PersistencePort persistencePort, NotificationPort notificationPort, TaskTracker taskTracker,
            MessageService messageService, GatewayMetrics metrics, SpeechReader speechReader,
            List<ContentHandler> contentHandlers) {
        this.pluginPort = pluginPort;
        this.commandClassifier = commandClassifier;
        this.commandRouter = commandRouter;
        this.collectMode = collectMode;
        this.agentMode = agentMode;
        this.persistencePort = persistencePort;
        this.notificationPort = notificationPort;
        this.taskTracker = taskTracker;
        this.messageService = messageService;
        this.metrics = metrics;
        this.speechReader = speechReader;
        for (ContentHandler handler : contentHandlers) {
            ContentHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate content handler for " + handler.kind());
            }
        }
    }

    public RoutingOutcome route(CombinedMessage message) throws InterruptedException {
        String conversationId = message.getConversationId();
        taskTracker.spawn("archive:" + conversationId, () -> persistencePort.persist(message));

        RoutingOutcome outcome;
        try {
            outcome = decide(message);
        } catch (InterruptedException | CancellationException e) {
            throw e;
        } catch (Exception e) { // NOSONAR - any handler failure becomes a generic notice
            log.error("[Router] Failed to process message: conversation={}, sender={}, events={}",
                    conversationId, message.getSenderId(), message.getEvents().size(), e);
            notificationPort.notify(conversationId, messageService.getMessage("router.error.generic"));
            outcome = RoutingOutcome.failed();
        }

        if (message.getOverflowCount() > 0) {
            notificationPort.notify(conversationId,
                    messageService.getMessage("buffer.overflow.notice", message.getOverflowCount()));
        }
        metrics.recordOutcome(outcome);
        log.info("[Router] conversation={} outcome={} detail={}", conversationId, outcome.type(),
                outcome.detail());
        return outcome;
    }

    private RoutingOutcome decide(CombinedMessage message) throws Exception { // NOSONAR
        String conversationId = message.getConversationId();

        if (pluginPort.tryHandle(message)) {
            return RoutingOutcome.pluginHandled();
        }

        Optional<CommandInvocation> command = findCommand(message);
        if (command.isPresent()) {
            return executeCommand(message, command.get());
        }

        if (collectMode.isCollecting(conversationId)) {
            CombinedMessage current = transcribeSpoken(message);
            if (collectMode.matchesTrigger(current.combinedText()) || hasSpokenTrigger(current)) {
                List<CombinedMessage> batch = new ArrayList<>(collectMode.drainAndTrigger(conversationId));
                int queued = batch.size();
                withoutTriggers(current).ifPresent(batch::add);
                log.info("[Router] Collect triggered for {}: {} queued message(s)", conversationId, queued);
                if (batch.isEmpty()) {
                    notificationPort.notify(conversationId, messageService.getMessage("collect.empty"));
                    return RoutingOutcome.empty();
                }
                CombinedMessage merged = CombinedMessage.merge(batch);
                Optional<ContentKind> kind = dispatchContent(merged);
                return kind.map(RoutingOutcome::collectTriggered).orElseGet(RoutingOutcome::empty);
            }
            int queued = collectMode.enqueue(conversationId, current);
            notificationPort.notify(conversationId, messageService.getMessage("collect.queued", queued));
            return RoutingOutcome.collectQueued();
        }

        return dispatchContent(message)
                .map(RoutingOutcome::contentHandled)
                .orElseGet(RoutingOutcome::empty);
    }

    /**
     * Transcribes voice and video items before they are queued, so a trigger
     * phrase can be spoken and the handler later reuses the transcript.
     */
    private CombinedMessage transcribeSpoken(CombinedMessage message) throws InterruptedException {
        boolean spoken = message.getEvents().stream()
                .anyMatch(event -> isSpokenKind(event.getKind()) && !event.hasTranscript());
        if (!spoken || !speechReader.isAvailable()) {
            return message;
        }
        List<InboundEvent> events = new ArrayList<>();
        for (InboundEvent event : message.getEvents()) {
            if (!isSpokenKind(event.getKind()) || event.hasTranscript()) {
                events.add(event);
                continue;
            }
            SpeechReader.Speech speech = speechReader.read(event.getKind(), event);
            if (speech.succeeded()) {
                events.add(event.toBuilder().transcript(speech.transcript()).build());
            } else {
                log.debug("[Router] Collected {} item {} left untranscribed", event.getKind(), event.getEventId());
                events.add(event);
            }
        }
        return message.withEvents(events);
    }

    private boolean hasSpokenTrigger(CombinedMessage message) {
        return message.getEvents().stream()
                .filter(InboundEvent::hasTranscript)
                .anyMatch(event -> collectMode.matchesTrigger(event.getTranscript()));
    }

    /**
     * Copy of the triggering message without its trigger phrases. Events left
     * with nothing to say are dropped; empty when nothing remains.
     */
    private Optional<CombinedMessage> withoutTriggers(CombinedMessage message) {
        List<InboundEvent> events = new ArrayList<>();
        for (InboundEvent event : message.getEvents()) {
            InboundEvent.InboundEventBuilder stripped = event.toBuilder()
                    .text(blankToNull(collectMode.stripTriggers(event.getText())))
                    .caption(blankToNull(collectMode.stripTriggers(event.getCaption())))
                    .transcript(blankToNull(collectMode.stripTriggers(event.getTranscript())));
            InboundEvent candidate = stripped.build();
            boolean emptyText = candidate.getKind() == ContentKind.TEXT && !candidate.hasTextContent();
            boolean emptySpeech = event.hasTranscript() && !candidate.hasTranscript();
            if (!emptyText && !emptySpeech) {
                events.add(candidate);
            }
        }
        return events.isEmpty() ? Optional.empty() : Optional.of(message.withEvents(events));
    }

    private static boolean isSpokenKind(ContentKind kind) {
        return kind == ContentKind.VOICE || kind == ContentKind.VIDEO;
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private Optional<CommandInvocation> findCommand(CombinedMessage message) {
        for (InboundEvent event : message.commands()) {
            Optional<CommandInvocation> command = commandClassifier.classify(event);
            if (command.isPresent()) {
                return command;
            }
        }
        return Optional.empty();
    }

    private RoutingOutcome executeCommand(CombinedMessage message, CommandInvocation command)
            throws InterruptedException, ExecutionException {
        CommandPort router = commandRouter.getObject();
        Map<String, Object> context = Map.of(
                CommandPort.CONTEXT_CONVERSATION_ID, message.getConversationId(),
                CommandPort.CONTEXT_SENDER_ID, message.getSenderId() != null ? message.getSenderId() : "",
                CommandPort.CONTEXT_MESSAGE, message);
        CommandPort.CommandResult result = router.execute(command.name(), command.args(), context).get();
        if (result != null && result.output() != null && !result.output().isBlank()) {
            notificationPort.notify(message.getConversationId(), result.output());
        }
        if (result != null && result.data() instanceof CombinedMessage forwarded) {
            // media sent along with an agent command goes through its regular handler
            dispatchContent(forwarded, true);
        }
        return RoutingOutcome.commandHandled(command.name());
    }

    private Optional<ContentKind> dispatchContent(CombinedMessage message) throws InterruptedException {
        return dispatchContent(message, agentMode.isAgentMode(message.getConversationId()));
    }

    private Optional<ContentKind> dispatchContent(CombinedMessage message, boolean agent)
            throws InterruptedException {
        Optional<ContentKind> selected = selectKind(message);
        if (selected.isEmpty()) {
            log.debug("[Router] Nothing to route for {}", message.getConversationId());
            return Optional.empty();
        }
        ContentKind kind = selected.get();
        ContentHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No content handler for " + kind);
        }
        HandlerResult result = handler.handle(message, agent);
        log.debug("[Router] {} handler finished: {}", kind, result.status());
        if (result.hasNotice()) {
            notificationPort.notify(message.getConversationId(), result.notice());
        }
        return selected;
    }

    static Optional<ContentKind> selectKind(CombinedMessage message) {
        for (ContentKind kind : ContentKind.ROUTING_PRIORITY) {
            if (kind == ContentKind.TEXT) {
                if (message.hasText()) {
                    return Optional.of(ContentKind.TEXT);
                }
            } else if (message.hasKind(kind)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
