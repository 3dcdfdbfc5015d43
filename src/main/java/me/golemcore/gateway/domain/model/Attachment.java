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

import lombok.Builder;
import lombok.Value;

/**
 * Validated media handed to the agent. Bytes are held in memory so the temp
 * file backing them can be released before the agent runs.
 */
@Value
@Builder
public class Attachment {

    Type type;
    byte[] data;
    String filename;
    String mimeType;
    String caption;

    public enum Type {
        IMAGE, DOCUMENT, AUDIO
    }

    public int size() {
        return data != null ? data.length : 0;
    }
}
