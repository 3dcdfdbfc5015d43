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

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to a media object held by the transport's media store. Nothing is
 * downloaded until a handler acquires it through the asset lifecycle manager.
 *
 * @param fileId
 *            transport-specific file identifier
 * @param fileName
 *            declared file name, may be {@code null}
 * @param mimeType
 *            declared MIME type, may be {@code null}
 * @param fileSize
 *            declared size in bytes, {@code 0} when unknown
 */
public record MediaRef(String fileId, String fileName, String mimeType, long fileSize) {

    public MediaRef {
        Objects.requireNonNull(fileId, "fileId");
    }

    /**
     * Lower-case extension of the declared file name without the dot, or an empty
     * string when there is none.
     */
    public String extension() {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public boolean hasDeclaredSize() {
        return fileSize > 0;
    }
}
