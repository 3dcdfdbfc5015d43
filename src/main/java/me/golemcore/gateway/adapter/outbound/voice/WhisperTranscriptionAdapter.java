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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AudioFormat;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.TranscriptionPort;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Set;

/**
 * Speech-to-text over the Whisper HTTP API
 * ({@code POST /v1/audio/transcriptions}), served by OpenAI as well as by
 * self-hosted faster-whisper or whisper.cpp.
 *
 * <p>
 * Unavailable while {@code gateway.voice.whisper-url} is blank. Rate limiting
 * and gateway errors are retried with exponential backoff, honoring a numeric
 * {@code Retry-After} header when the server sends one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhisperTranscriptionAdapter implements TranscriptionPort {

    private static final String TRANSCRIPTION_PATH = "/v1/audio/transcriptions";
    private static final int MAX_ATTEMPTS = 3;
    private static final long BASE_BACKOFF_MS = 1000;
    private static final Set<Integer> RETRYABLE_CODES = Set.of(429, 500, 503, 504);

    private final OkHttpClient okHttpClient;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isAvailable() {
        String url = properties.getVoice().getWhisperUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public TranscriptionResult transcribe(byte[] audioData, AudioFormat format) {
        if (!isAvailable()) {
            throw new IllegalStateException("Whisper STT URL is not configured");
        }
        AudioFormat effective = format != null ? format : AudioFormat.OGG_OPUS;
        Request request = buildRequest(audioData, effective);
        log.info("[WhisperSTT] Transcribing {} bytes of {}", audioData.length, effective.getMimeType());

        try {
            return execute(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Whisper STT interrupted", e);
        } catch (IOException e) {
            log.error("[WhisperSTT] Network error: {}", e.getMessage());
            throw new UncheckedIOException("Whisper transcription failed: " + e.getMessage(), e);
        }
    }

    protected String getTranscriptionUrl(String baseUrl) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed + TRANSCRIPTION_PATH;
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    private Request buildRequest(byte[] audioData, AudioFormat format) {
        GatewayProperties.VoiceProperties voice = properties.getVoice();
        MultipartBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "audio." + format.getExtension(),
                        RequestBody.create(audioData, MediaType.parse(format.getMimeType())))
                .addFormDataPart("model", voice.getWhisperModel())
                .addFormDataPart("response_format", "verbose_json")
                .build();

        Request.Builder builder = new Request.Builder()
                .url(getTranscriptionUrl(voice.getWhisperUrl()))
                .post(body);
        String apiKey = voice.getWhisperApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    @SuppressWarnings("PMD.CloseResource") // closed together with the response
    private TranscriptionResult execute(Request request) throws IOException, InterruptedException {
        for (int attempt = 1;; attempt++) {
            long backoffMs;
            try (Response response = okHttpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (response.isSuccessful()) {
                    if (body == null) {
                        throw new IllegalStateException("Whisper STT returned empty body");
                    }
                    return parse(body.string());
                }
                if (!RETRYABLE_CODES.contains(response.code()) || attempt >= MAX_ATTEMPTS) {
                    String detail = body != null ? body.string() : "";
                    throw new IllegalStateException(
                            String.format("Whisper STT error (HTTP %d): %s", response.code(), detail));
                }
                backoffMs = backoffFor(attempt, response.header("Retry-After"));
                log.info("[WhisperSTT] HTTP {} on attempt {}/{}, retrying in {}ms",
                        response.code(), attempt, MAX_ATTEMPTS, backoffMs);
            }
            sleepBeforeRetry(backoffMs);
        }
    }

    private static long backoffFor(int attempt, String retryAfter) {
        if (retryAfter != null) {
            try {
                return Long.parseLong(retryAfter.trim()) * 1000;
            } catch (NumberFormatException e) {
                log.debug("[WhisperSTT] Ignoring non-numeric Retry-After: {}", retryAfter);
            }
        }
        return BASE_BACKOFF_MS << attempt;
    }

    private TranscriptionResult parse(String json) throws IOException {
        WhisperResponse response = objectMapper.readValue(json, WhisperResponse.class);
        String language = response.getLanguage() != null ? response.getLanguage() : "unknown";
        log.info("[WhisperSTT] Transcribed {} chars, language={}",
                response.getText() != null ? response.getText().length() : 0, language);
        return new TranscriptionResult(response.getText(), language);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WhisperResponse {
        private String text;
        private String language;
    }
}
