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
import me.golemcore.gateway.plugin.api.MessagePlugin;
import me.golemcore.gateway.port.outbound.PluginPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Offers each message to the registered {@link MessagePlugin}s in
 * {@code @Order} order. The first plugin that claims the message stops
 * routing. A plugin that throws is logged and treated as not claiming.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PluginRegistry implements PluginPort {

    private final ObjectProvider<MessagePlugin> plugins;

    @Override
    public boolean tryHandle(CombinedMessage message) throws InterruptedException {
        for (MessagePlugin plugin : plugins()) {
            try {
                if (plugin.tryHandle(message)) {
                    log.info("[Plugins] Message of {} handled by plugin '{}'", message.getConversationId(),
                            plugin.getName());
                    return true;
                }
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) { // NOSONAR - a broken plugin must not block routing
                log.error("[Plugins] Plugin '{}' failed for conversation {}: {}", plugin.getName(),
                        message.getConversationId(), e.getMessage(), e);
            }
        }
        return false;
    }

    public List<MessagePlugin> plugins() {
        return plugins.orderedStream().toList();
    }
}
