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
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain text: the combined text goes to the agent as is.
 */
@Component
@RequiredArgsConstructor
public class TextContentHandler implements ContentHandler {

    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.TEXT;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) {
        if (!message.hasText()) {
            return HandlerResult.skipped();
        }
        support.submit(message, agentMode, ContentKind.TEXT, support.prompt(message), List.of());
        return HandlerResult.handled();
    }
}
