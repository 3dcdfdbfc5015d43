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

/**
 * Audio formats accepted by the transcription port. Each format carries the
 * file extension and MIME type sent to the speech-to-text endpoint.
 */
public enum AudioFormat {
    OGG_OPUS("ogg", "audio/ogg"), MP3("mp3", "audio/mpeg"), WAV("wav", "audio/wav"), M4A("m4a",
            "audio/mp4"), WEBM("webm", "audio/webm");

    private final String extension;
    private final String mimeType;

    AudioFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String getExtension() {
        return extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * Maps a detected audio MIME type to a format, defaulting to OGG Opus which is
     * what chat voice notes use.
     */
    public static AudioFormat fromMimeType(String mimeType) {
        if (mimeType == null) {
            return OGG_OPUS;
        }
        return switch (mimeType) {
        case "audio/mpeg" -> MP3;
        case "audio/wav", "audio/x-wav" -> WAV;
        case "audio/mp4", "audio/m4a", "audio/x-m4a" -> M4A;
        case "audio/webm" -> WEBM;
        default -> OGG_OPUS;
        };
    }
}
