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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentModePort;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Agent mode per conversation, defaulting to {@code gateway.agent.default-mode}.
 * Overrides are kept for the {@code gateway.agent.max-conversations} most
 * recently used conversations; an evicted conversation falls back to the
 * default.
 */
@Service
@Slf4j
public class AgentModeService implements AgentModePort {

    private final GatewayProperties properties;

    private final Map<String, Boolean> overrides;

    public AgentModeService(GatewayProperties properties) {
        this.properties = properties;
        this.overrides = LruMaps.bounded(properties.getAgent().getMaxConversations());
    }

    @Override
    public boolean isAgentMode(String conversationId) {
        return overrides.getOrDefault(conversationId, properties.getAgent().isDefaultMode());
    }

    @Override
    public void setAgentMode(String conversationId, boolean enabled) {
        overrides.put(conversationId, enabled);
        log.info("[AgentMode] Agent mode {} for {}", enabled ? "enabled" : "disabled", conversationId);
    }
}
