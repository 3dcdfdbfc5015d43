package me.golemcore.gateway.adapter.inbound.command;

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
import me.golemcore.gateway.domain.model.CommandInvocation;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.port.outbound.CommandClassifierPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recognizes {@code /command@bot args} events whose command is registered with
 * the {@link CommandPort}. Unknown slash commands are not commands; they route
 * as text.
 */
@Component
@RequiredArgsConstructor
public class SlashCommandClassifier implements CommandClassifierPort {

    private final ObjectProvider<CommandPort> commandRouter;

    @Override
    public Optional<CommandInvocation> classify(InboundEvent event) {
        if (event.getKind() != ContentKind.COMMAND) {
            return Optional.empty();
        }
        CommandPort router = commandRouter.getIfAvailable();
        if (router == null) {
            return Optional.empty();
        }
        return CommandInvocation.parse(event.getText())
                .filter(invocation -> router.hasCommand(invocation.name()));
    }
}
