package me.golemcore.gateway.domain.model;

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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One raw arrival from the transport, already mapped to a platform-neutral
 * shape.
 *
 * <p>
 * Only the payload fields that match {@link #kind} are populated: {@code text}
 * for text and command events, {@code media} (plus an optional
 * {@code caption}) for photo, voice, video and document events,
 * {@code contact} and {@code poll} for their kinds.
 *
 * <p>
 * {@code eventId} is unique and monotonic within a conversation and is used
 * to restore arrival order at flush time.
 */
@Value
@Builder(toBuilder = true)
public class InboundEvent {

    @NonNull
    String conversationId;
    String senderId;
    long eventId;
    @Builder.Default
    Instant arrivedAt = Instant.now();
    @NonNull
    ContentKind kind;

    String text;
    String caption;
    MediaRef media;
    ContactCard contact;
    PollPayload poll;

    Long replyToEventId;
    /**
     * Text of the replied-to message as delivered by the transport, used when the
     * replied event is not remembered locally.
     */
    String replyToText;

    /**
     * Display name of the original author or chat when the event is a forwarded
     * message, otherwise {@code null}.
     */
    String forwardedFrom;

    /**
     * Speech transcript of a voice or video item, filled in when collect mode
     * transcribed the item before queueing it.
     */
    String transcript;

    /**
     * Text this event contributes to the combined text, or {@code null}. Voice,
     * contact and poll events never contribute.
     */
    public String textContent() {
        if (kind == ContentKind.TEXT || kind == ContentKind.COMMAND) {
            return text;
        }
        if (kind.isCaptioned()) {
            return caption;
        }
        return null;
    }

    public boolean isForwarded() {
        return forwardedFrom != null && !forwardedFrom.isBlank();
    }

    public boolean hasTranscript() {
        return transcript != null && !transcript.isBlank();
    }

    public boolean hasTextContent() {
        String content = textContent();
        return content != null && !content.isBlank();
    }
}
