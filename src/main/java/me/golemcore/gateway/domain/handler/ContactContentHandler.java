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
import me.golemcore.gateway.domain.model.ContactCard;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared contacts are described as text for the agent.
 */
@Component
@RequiredArgsConstructor
public class ContactContentHandler implements ContentHandler {

    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.CONTACT;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) {
        List<ContactCard> contacts = message.contacts();
        if (contacts.isEmpty()) {
            return HandlerResult.skipped();
        }
        String description = contacts.stream()
                .map(ContactContentHandler::describe)
                .collect(Collectors.joining("\n\n"));
        support.submit(message, agentMode, ContentKind.CONTACT, support.prompt(message, description), List.of());
        return HandlerResult.handled();
    }

    static String describe(ContactCard contact) {
        StringBuilder sb = new StringBuilder("👤 Contact: ").append(contact.displayName());
        if (contact.phoneNumber() != null && !contact.phoneNumber().isBlank()) {
            sb.append("\nPhone: ").append(contact.phoneNumber());
        }
        if (contact.userId() != null && !contact.userId().isBlank()) {
            sb.append("\nUser ID: ").append(contact.userId());
        }
        return sb.toString();
    }
}
