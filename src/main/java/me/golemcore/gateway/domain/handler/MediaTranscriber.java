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
import me.golemcore.gateway.domain.model.AudioFormat;
import me.golemcore.gateway.port.outbound.TranscriptionPort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Wraps {@link TranscriptionPort} failures into message keys for the voice and
 * video handlers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MediaTranscriber {

    private final TranscriptionPort transcriptionPort;

    /**
     * Transcript text, or the message key explaining why there is none.
     */
    public record Transcript(String text, String failureKey) {

        public boolean succeeded() {
            return failureKey == null;
        }
    }

    public boolean isAvailable() {
        return transcriptionPort.isAvailable();
    }

    public Transcript transcribe(byte[] audio, AudioFormat format) throws InterruptedException {
        if (!transcriptionPort.isAvailable()) {
            return new Transcript(null, "voice.error.unavailable");
        }
        try {
            TranscriptionPort.TranscriptionResult result = transcriptionPort.transcribe(audio, format);
            if (result == null || result.isBlank()) {
                return new Transcript(null, "voice.error.empty");
            }
            return new Transcript(result.text().trim(), null);
        } catch (UncheckedIOException | IllegalStateException e) {
            HandlerSupport.throwIfInterrupted(e);
            log.warn("[Voice] Transcription failed: {}", e.getMessage());
            return new Transcript(null, "voice.error.transcription");
        }
    }
}
