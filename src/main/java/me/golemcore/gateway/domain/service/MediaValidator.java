package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.domain.model.ValidationResult;
import me.golemcore.gateway.domain.model.ValidationResult.Reason;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates downloaded media against the per-kind policy under
 * {@code gateway.media.policies}.
 *
 * <p>
 * Checks, in order: non-empty, size cap, extension allow-list, magic-byte
 * detection, declared-vs-detected MIME match and the allowed MIME set (with a
 * family prefix fallback for images, audio and video). Never throws; logs
 * carry the reason code and size only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaValidator {

    private static final Map<ContentKind, String> FAMILY_PREFIX = Map.of(
            ContentKind.PHOTO, "image/",
            ContentKind.VOICE, "audio/",
            ContentKind.VIDEO, "video/");

    private static final Map<String, String> MIME_ALIASES = Map.of(
            "image/jpg", "image/jpeg",
            "image/pjpeg", "image/jpeg",
            "audio/x-wav", "audio/wav",
            "audio/wave", "audio/wav",
            "audio/mp3", "audio/mpeg",
            "audio/opus", "audio/ogg",
            "audio/x-m4a", "audio/mp4",
            "audio/m4a", "audio/mp4",
            "application/x-zip-compressed", "application/zip");

    private final GatewayProperties properties;

    /**
     * Policy limit for the given kind, {@code 0} when unlimited or not media.
     */
    public long maxBytes(ContentKind kind) {
        GatewayProperties.MediaPolicy policy = policyFor(kind);
        return policy != null ? policy.getMaxBytes() : 0;
    }

    /**
     * Rejects a reference whose declared size already exceeds the limit, so the
     * file is never downloaded.
     */
    public ValidationResult precheck(ContentKind kind, MediaRef ref) {
        long max = maxBytes(kind);
        if (max > 0 && ref.hasDeclaredSize() && ref.fileSize() > max) {
            log.info("[Validator] {} rejected before download: reason={}, declared={} bytes, limit={}",
                    kind, Reason.TOO_LARGE, ref.fileSize(), max);
            return ValidationResult.rejected(Reason.TOO_LARGE);
        }
        return ValidationResult.valid(null);
    }

    public ValidationResult validate(ContentKind kind, Path file, MediaRef ref) {
        GatewayProperties.MediaPolicy policy = policyFor(kind);
        long size;
        byte[] header;
        try {
            size = Files.size(file);
            header = size > 0 ? MimeSniffer.readHeader(file) : new byte[0];
        } catch (IOException e) {
            log.warn("[Validator] {} unreadable: {}", kind, e.getClass().getSimpleName());
            return ValidationResult.rejected(Reason.UNREADABLE);
        }

        if (size == 0) {
            return reject(kind, Reason.EMPTY, size, null);
        }
        if (policy != null && policy.getMaxBytes() > 0 && size > policy.getMaxBytes()) {
            return reject(kind, Reason.TOO_LARGE, size, null);
        }

        String extension = ref.extension();
        if (policy != null && !extension.isEmpty() && !policy.getAllowedExtensions().isEmpty()
                && !containsIgnoreCase(policy.getAllowedExtensions(), extension)) {
            return reject(kind, Reason.EXTENSION_NOT_ALLOWED, size, null);
        }

        String detected = MimeSniffer.detect(header);
        String declared = normalize(ref.mimeType());

        if (detected == null && kind != ContentKind.DOCUMENT) {
            return reject(kind, Reason.UNRECOGNIZED_TYPE, size, null);
        }
        if (detected != null && declared != null && !compatible(declared, detected)) {
            return reject(kind, Reason.TYPE_MISMATCH, size, detected);
        }

        String effective = detected != null ? detected : declared;
        if (policy != null && !isAllowed(kind, policy, effective)) {
            return reject(kind, Reason.TYPE_NOT_ALLOWED, size, detected);
        }

        log.debug("[Validator] {} accepted: {} bytes", kind, size);
        return ValidationResult.valid(effective);
    }

    private GatewayProperties.MediaPolicy policyFor(ContentKind kind) {
        if (!kind.isMedia()) {
            return null;
        }
        return properties.getMedia().getPolicies().get(kind.getPolicyKey());
    }

    private ValidationResult reject(ContentKind kind, Reason reason, long size, String detected) {
        log.info("[Validator] {} rejected: reason={}, size={} bytes", kind, reason, size);
        return ValidationResult.rejected(reason, detected);
    }

    private static boolean isAllowed(ContentKind kind, GatewayProperties.MediaPolicy policy, String mimeType) {
        if (mimeType == null) {
            return false;
        }
        List<String> allowed = policy.getAllowedMimeTypes();
        if (allowed.isEmpty() || containsIgnoreCase(allowed, mimeType)) {
            return true;
        }
        String prefix = FAMILY_PREFIX.get(kind);
        return prefix != null && mimeType.startsWith(prefix)
                && allowed.stream().anyMatch(type -> type.toLowerCase(Locale.ROOT).startsWith(prefix));
    }

    /**
     * Same type, or same subtype across the audio/video families (an m4a voice
     * note sniffs as mp4, a webm voice note as video/webm).
     */
    private static boolean compatible(String declared, String detected) {
        if (declared.equals(detected)) {
            return true;
        }
        if ("application/octet-stream".equals(declared)) {
            return true;
        }
        if ("application/zip".equals(detected) && isZipContainer(declared)) {
            return true;
        }
        String declaredSubtype = subtype(declared);
        String detectedSubtype = subtype(detected);
        boolean avFamilies = isAudioOrVideo(declared) && isAudioOrVideo(detected);
        return avFamilies && declaredSubtype.equals(detectedSubtype);
    }

    private static boolean isZipContainer(String mimeType) {
        return mimeType.contains("officedocument") || mimeType.contains("opendocument")
                || mimeType.equals("application/epub+zip") || mimeType.equals("application/java-archive");
    }

    private static boolean isAudioOrVideo(String mimeType) {
        return mimeType.startsWith("audio/") || mimeType.startsWith("video/");
    }

    private static String subtype(String mimeType) {
        int slash = mimeType.indexOf('/');
        return slash >= 0 ? mimeType.substring(slash + 1) : mimeType;
    }

    private static String normalize(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return null;
        }
        String lower = mimeType.trim().toLowerCase(Locale.ROOT);
        int parameters = lower.indexOf(';');
        if (parameters >= 0) {
            lower = lower.substring(0, parameters).trim();
        }
        return MIME_ALIASES.getOrDefault(lower, lower);
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        return values.stream().anyMatch(value -> value.equalsIgnoreCase(candidate));
    }
}
