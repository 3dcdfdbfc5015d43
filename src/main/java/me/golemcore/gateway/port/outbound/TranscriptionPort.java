package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.AudioFormat;

/**
 * Speech-to-text service.
 */
public interface TranscriptionPort {

    /**
     * Whether a speech-to-text backend is configured.
     */
    boolean isAvailable();

    /**
     * Transcribes audio bytes.
     *
     * @throws java.io.UncheckedIOException
     *             on network failure
     * @throws IllegalStateException
     *             when the backend rejects the request
     */
    TranscriptionResult transcribe(byte[] audioData, AudioFormat format);

    /**
     * Result of a transcription.
     */
    record TranscriptionResult(String text, String language) {
        public boolean isBlank() {
            return text == null || text.isBlank();
        }
    }
}
