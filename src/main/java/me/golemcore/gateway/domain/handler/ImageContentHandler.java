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
 * Images are downloaded, validated and attached to the agent request.
 *
 * <p>
 * Each image gets its own asset scope, so a failure on one image never keeps
 * the files of its siblings around. In agent mode every image of the burst is
 * attached; otherwise only the first one is, and the user is told so.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageContentHandler implements ContentHandler {

    private final MediaIntake mediaIntake;
    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.PHOTO;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) throws InterruptedException {
        List<InboundEvent> images = message.images();
        if (images.isEmpty()) {
            return HandlerResult.skipped();
        }
        List<InboundEvent> selected = agentMode ? images : images.subList(0, 1);

        List<Attachment> attachments = new ArrayList<>();
        List<HandlerResult> failures = new ArrayList<>();
        for (InboundEvent image : selected) {
            try (AssetScope scope = mediaIntake.openScope(ContentKind.PHOTO, image)) {
                MediaIntake.Intake intake = mediaIntake.fetch(scope, ContentKind.PHOTO, image.getMedia());
                if (!intake.accepted()) {
                    failures.add(intake.failure());
                    continue;
                }
                attachments.add(Attachment.builder()
                        .type(Attachment.Type.IMAGE)
                        .data(mediaIntake.read(intake.asset()))
                        .filename(image.getMedia().fileName())
                        .mimeType(intake.mimeType())
                        .caption(image.getCaption())
                        .build());
            } catch (IOException e) {
                log.warn("[Image] Failed to read image {} of {}: {}", image.getEventId(),
                        message.getConversationId(), e.getMessage());
                failures.add(HandlerResult.failed(support.message("media.error.processing")));
            }
        }

        if (attachments.isEmpty()) {
            return HandlerSupport.failureOf(failures);
        }

        String section = attachments.size() == 1
                ? "[Attached image]"
                : "[Attached images: " + attachments.size() + "]";
        support.submit(message, agentMode, ContentKind.PHOTO, support.prompt(message, section), attachments);

        List<String> notices = new ArrayList<>();
        failures.forEach(failure -> notices.add(failure.notice()));
        if (images.size() > selected.size()) {
            notices.add(support.message("image.only.first", images.size()));
        }
        return HandlerResult.handled(HandlerSupport.joinNotices(notices));
    }
}
