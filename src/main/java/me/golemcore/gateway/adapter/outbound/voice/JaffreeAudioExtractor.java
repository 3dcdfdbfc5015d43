package me.golemcore.gateway.adapter.outbound.voice;

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

import com.github.kokorin.jaffree.JaffreeException;
import com.github.kokorin.jaffree.ffmpeg.FFmpeg;
import com.github.kokorin.jaffree.ffmpeg.UrlInput;
import com.github.kokorin.jaffree.ffmpeg.UrlOutput;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AudioExtractionException;
import me.golemcore.gateway.port.outbound.AudioExtractorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Audio track extraction using Jaffree (FFmpeg Java wrapper).
 *
 * <p>
 * Writes a 16 kHz mono WAV, which is what Whisper-compatible servers expect.
 * Works file to file because the source is already a managed asset on disk and
 * containers such as MP4 are not streamable through a pipe.
 *
 * <p>
 * Requires FFmpeg binary in system PATH.
 */
@Component
@Slf4j
public class JaffreeAudioExtractor implements AudioExtractorPort {

    private static final String SAMPLE_RATE = "16000";

    @Override
    public void extractAudio(Path source, Path target) {
        try {
            FFmpeg.atPath()
                    .addInput(UrlInput.fromPath(source))
                    .setOverwriteOutput(true)
                    .addOutput(UrlOutput.toPath(target)
                            .setFormat("wav")
                            .addArgument("-vn")
                            .addArguments("-ac", "1")
                            .addArguments("-ar", SAMPLE_RATE))
                    .execute();
        } catch (JaffreeException e) {
            if (causedByInterrupt(e)) {
                // Jaffree swallows the interrupt flag when it stops FFmpeg
                Thread.currentThread().interrupt();
            }
            throw new AudioExtractionException("FFmpeg failed to extract audio: " + e.getMessage(), e);
        }

        try {
            if (!Files.exists(target) || Files.size(target) == 0) {
                throw new AudioExtractionException("No audio track in " + source.getFileName());
            }
            log.debug("[Audio] Extracted {} bytes of audio from {}", Files.size(target), source.getFileName());
        } catch (IOException e) {
            throw new AudioExtractionException("Extracted audio is unreadable", e);
        }
    }

    static boolean causedByInterrupt(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }
}
