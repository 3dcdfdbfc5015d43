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
 * Outcome of media validation. A rejection carries a reason whose message key
 * resolves to a user-safe text; the detected MIME type is kept for internal use
 * only.
 *
 * @param reason
 *            {@code null} when the file is valid
 * @param detectedMimeType
 *            MIME type detected from magic bytes, may be {@code null}
 */
public record ValidationResult(Reason reason, String detectedMimeType) {

    public enum Reason {
        EMPTY("media.rejected.empty"),
        TOO_LARGE("media.rejected.size"),
        EXTENSION_NOT_ALLOWED("media.rejected.extension"),
        UNRECOGNIZED_TYPE("media.rejected.type.unknown"),
        TYPE_MISMATCH("media.rejected.type.mismatch"),
        TYPE_NOT_ALLOWED("media.rejected.type.unsupported"),
        UNREADABLE("media.rejected.unreadable");

        private final String messageKey;

        Reason(String messageKey) {
            this.messageKey = messageKey;
        }

        public String getMessageKey() {
            return messageKey;
        }
    }

    public static ValidationResult valid(String detectedMimeType) {
        return new ValidationResult(null, detectedMimeType);
    }

    public static ValidationResult rejected(Reason reason) {
        return new ValidationResult(reason, null);
    }

    public static ValidationResult rejected(Reason reason, String detectedMimeType) {
        return new ValidationResult(reason, detectedMimeType);
    }

    public boolean isValid() {
        return reason == null;
    }
}
