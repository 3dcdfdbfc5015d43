package me.golemcore.gateway.adapter.outbound.agent;

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
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.outbound.AgentPort;
import me.golemcore.gateway.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

/**
 * Default agent collaborator: logs the request and acknowledges it in the chat.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingAgentAdapter implements AgentPort {

    private final NotificationPort notificationPort;
    private final MessageService messageService;

    @Override
    public void submit(AgentRequest request) {
        log.info("[Agent] conversation={} source={} agentMode={} scope={} prompt={} chars, {} attachment(s)",
                request.getConversationId(), request.getSource(), request.isAgentMode(), request.getScope(),
                request.getPrompt().length(), request.getAttachments().size());
        notificationPort.notify(request.getConversationId(), messageService.getMessage("agent.accepted",
                request.getAttachments().size()));
    }
}
