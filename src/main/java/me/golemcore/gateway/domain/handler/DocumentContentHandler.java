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
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.service.AssetScope;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Documents are downloaded, validated and attached to the agent request, one
 * asset scope per document. Outside agent mode only the first document is
 * processed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentContentHandler implements ContentHandler {

    private final MediaIntake mediaIntake;
    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.DOCUMENT;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) throws InterruptedException {
        List<InboundEvent> documents = message.documents();
        if (documents.isEmpty()) {
            return HandlerResult.skipped();
        }
        List<InboundEvent> selected = agentMode ? documents : documents.subList(0, 1);

        List<Attachment> attachments = new ArrayList<>();
        List<String> sections = new ArrayList<>();
        List<HandlerResult> failures = new ArrayList<>();
        for (InboundEvent document : selected) {
            String name = document.getMedia().fileName() != null ? document.getMedia().fileName() : "document";
            try (AssetScope scope = mediaIntake.openScope(ContentKind.DOCUMENT, document)) {
                MediaIntake.Intake intake = mediaIntake.fetch(scope, ContentKind.DOCUMENT, document.getMedia());
                if (!intake.accepted()) {
                    failures.add(intake.failure());
                    continue;
                }
                byte[] data = mediaIntake.read(intake.asset());
                attachments.add(Attachment.builder()
                        .type(Attachment.Type.DOCUMENT)
                        .data(data)
                        .filename(name)
                        .mimeType(intake.mimeType())
                        .caption(document.getCaption())
                        .build());
                sections.add("[Attached document: " + name + ", " + data.length + " bytes]");
            } catch (IOException e) {
                log.warn("[Document] Failed to read document {} of {}: {}", document.getEventId(),
                        message.getConversationId(), e.getMessage());
                failures.add(HandlerResult.failed(support.message("media.error.processing")));
            }
        }

        if (attachments.isEmpty()) {
            return HandlerSupport.failureOf(failures);
        }

        support.submit(message, agentMode, ContentKind.DOCUMENT,
                support.prompt(message, String.join("\n", sections)), attachments);

        List<String> notices = new ArrayList<>();
        failures.forEach(failure -> notices.add(failure.notice()));
        if (documents.size() > selected.size()) {
            notices.add(support.message("document.only.first", documents.size()));
        }
        return HandlerResult.handled(HandlerSupport.joinNotices(notices));
    }
}
