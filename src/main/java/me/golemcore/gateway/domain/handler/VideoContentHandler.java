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
import me.golemcore.gateway.domain.model.AudioExtractionException;
import me.golemcore.gateway.domain.model.AudioFormat;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.service.AssetScope;
import me.golemcore.gateway.port.outbound.AudioExtractorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Videos are downloaded and validated, their audio track is extracted and,
 * when speech-to-text is configured, transcribed. The agent receives a
 * description of the video plus the transcript; the video itself is never
 * attached. Outside agent mode only the first video is processed. A video
 * transcribed while collect mode queued it is not downloaded again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VideoContentHandler implements ContentHandler {

    private final MediaIntake mediaIntake;
    private final MediaTranscriber transcriber;
    private final AudioExtractorPort audioExtractor;
    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.VIDEO;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) throws InterruptedException {
        List<InboundEvent> videos = message.videos();
        if (videos.isEmpty()) {
            return HandlerResult.skipped();
        }
        List<InboundEvent> selected = agentMode ? videos : videos.subList(0, 1);

        List<String> sections = new ArrayList<>();
        List<HandlerResult> failures = new ArrayList<>();
        for (InboundEvent video : selected) {
            try (AssetScope scope = mediaIntake.openScope(ContentKind.VIDEO, video)) {
                HandlerResult failure = describeOne(scope, video, sections);
                if (failure != null) {
                    failures.add(failure);
                }
            }
        }

        if (sections.isEmpty()) {
            return HandlerSupport.failureOf(failures);
        }

        support.submit(message, agentMode, ContentKind.VIDEO,
                support.prompt(message, String.join("\n\n", sections)), List.of());

        List<String> notices = new ArrayList<>();
        failures.forEach(failure -> notices.add(failure.notice()));
        if (videos.size() > selected.size()) {
            notices.add(support.message("video.only.first", videos.size()));
        }
        return HandlerResult.handled(HandlerSupport.joinNotices(notices));
    }

    private HandlerResult describeOne(AssetScope scope, InboundEvent video, List<String> sections)
            throws InterruptedException {
        String name = video.getMedia().fileName() != null ? video.getMedia().fileName() : "video";
        StringBuilder section = new StringBuilder("[Video: ").append(name).append(']');
        if (video.hasTranscript()) {
            sections.add(section.append("\n[Video audio transcript]: ").append(video.getTranscript()).toString());
            return null;
        }

        MediaIntake.Intake intake = mediaIntake.fetch(scope, ContentKind.VIDEO, video.getMedia());
        if (!intake.accepted()) {
            return intake.failure();
        }
        if (!transcriber.isAvailable()) {
            sections.add(section.toString());
            return null;
        }

        ManagedAsset audio = scope.allocate(AudioFormat.WAV.getExtension());
        try {
            audioExtractor.extractAudio(intake.asset().path(), audio.path());
        } catch (AudioExtractionException e) {
            HandlerSupport.throwIfInterrupted(e);
            log.warn("[Video] Audio extraction failed for {}: {}", scope.owner(), e.getMessage());
            return HandlerResult.failed(support.message("video.error.extraction"));
        }

        MediaTranscriber.Transcript transcript;
        try {
            transcript = transcriber.transcribe(mediaIntake.read(audio), AudioFormat.WAV);
        } catch (IOException e) {
            log.warn("[Video] Failed to read extracted audio for {}: {}", scope.owner(), e.getMessage());
            return HandlerResult.failed(support.message("media.error.processing"));
        }
        if (transcript.succeeded()) {
            section.append("\n[Video audio transcript]: ").append(transcript.text());
        } else {
            log.debug("[Video] No transcript for {}: {}", scope.owner(), transcript.failureKey());
        }
        sections.add(section.toString());
        return null;
    }
}
