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
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.service.AssetScope;
import me.golemcore.gateway.port.outbound.AudioExtractorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Turns one spoken media item into text: download and validation under the
 * policy of the given kind, audio extraction when the content is a video
 * container, then transcription. Every file it creates is released before
 * {@link #read} returns or throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpeechReader {

    private final MediaIntake mediaIntake;
    private final MediaTranscriber transcriber;
    private final AudioExtractorPort audioExtractor;
    private final HandlerSupport support;

    /**
     * Transcript, or the failure to report.
     */
    public record Speech(String transcript, HandlerResult failure) {

        public boolean succeeded() {
            return failure == null;
        }
    }

    public boolean isAvailable() {
        return transcriber.isAvailable();
    }

    public Speech read(ContentKind kind, InboundEvent event) throws InterruptedException {
        try (AssetScope scope = mediaIntake.openScope(kind, event)) {
            return read(scope, kind, event);
        }
    }

    private Speech read(AssetScope scope, ContentKind kind, InboundEvent event) throws InterruptedException {
        MediaIntake.Intake intake = mediaIntake.fetch(scope, kind, event.getMedia());
        if (!intake.accepted()) {
            return new Speech(null, intake.failure());
        }

        ManagedAsset audio = intake.asset();
        AudioFormat format = AudioFormat.fromMimeType(intake.mimeType());
        if (intake.mimeType() != null && intake.mimeType().startsWith("video/")) {
            ManagedAsset extracted = scope.allocate(AudioFormat.WAV.getExtension());
            try {
                audioExtractor.extractAudio(audio.path(), extracted.path());
            } catch (AudioExtractionException e) {
                HandlerSupport.throwIfInterrupted(e);
                log.warn("[Speech] Audio extraction failed for {}: {}", scope.owner(), e.getMessage());
                return failed(kind.getPolicyKey() + ".error.extraction");
            }
            audio = extracted;
            format = AudioFormat.WAV;
        }

        byte[] bytes;
        try {
            bytes = mediaIntake.read(audio);
        } catch (IOException e) {
            log.warn("[Speech] Failed to read audio for {}: {}", scope.owner(), e.getMessage());
            return failed("media.error.processing");
        }

        MediaTranscriber.Transcript transcript = transcriber.transcribe(bytes, format);
        if (!transcript.succeeded()) {
            return failed(transcript.failureKey());
        }
        log.info("[Speech] Transcribed {} ({} chars)", scope.owner(), transcript.text().length());
        return new Speech(transcript.text(), null);
    }

    private Speech failed(String key) {
        return new Speech(null, HandlerResult.failed(support.message(key)));
    }
}
