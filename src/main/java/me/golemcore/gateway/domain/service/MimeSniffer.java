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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Detects a MIME type from the leading bytes of a file.
 */
final class MimeSniffer {

    static final int HEADER_LENGTH = 16;

    private MimeSniffer() {
    }

    static byte[] readHeader(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(HEADER_LENGTH);
        }
    }

    /**
     * @return detected MIME type, or {@code null} when no signature matches
     */
    static String detect(byte[] header) {
        if (header == null || header.length < 3) {
            return null;
        }
        if (startsWith(header, 0xFF, 0xD8, 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(header, 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)) {
            return "image/png";
        }
        if (ascii(header, 0, "GIF8")) {
            return "image/gif";
        }
        if (ascii(header, 0, "RIFF") && ascii(header, 8, "WEBP")) {
            return "image/webp";
        }
        if (ascii(header, 0, "RIFF") && ascii(header, 8, "WAVE")) {
            return "audio/wav";
        }
        if (ascii(header, 0, "BM")) {
            return "image/bmp";
        }
        if (ascii(header, 0, "OggS")) {
            return "audio/ogg";
        }
        if (ascii(header, 4, "ftyp")) {
            return detectIsoMedia(header);
        }
        if (startsWith(header, 0x1A, 0x45, 0xDF, 0xA3)) {
            return "video/webm";
        }
        if (ascii(header, 0, "ID3") || startsWith(header, 0xFF, 0xFB) || startsWith(header, 0xFF, 0xF3)
                || startsWith(header, 0xFF, 0xF2)) {
            return "audio/mpeg";
        }
        if (ascii(header, 0, "%PDF")) {
            return "application/pdf";
        }
        if (startsWith(header, 0x50, 0x4B, 0x03, 0x04)) {
            return "application/zip";
        }
        return null;
    }

    private static String detectIsoMedia(byte[] header) {
        if (header.length < 12) {
            return "video/mp4";
        }
        String brand = new String(Arrays.copyOfRange(header, 8, 12), StandardCharsets.US_ASCII);
        return switch (brand) {
        case "M4A ", "M4B " -> "audio/mp4";
        case "qt  " -> "video/quicktime";
        default -> "video/mp4";
        };
    }

    private static boolean startsWith(byte[] data, int... signature) {
        if (data.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((data[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean ascii(byte[] data, int offset, String text) {
        byte[] expected = text.getBytes(StandardCharsets.US_ASCII);
        if (data.length < offset + expected.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (data[offset + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }
}
