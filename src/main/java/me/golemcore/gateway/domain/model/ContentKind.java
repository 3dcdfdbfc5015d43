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

import java.util.List;

/**
 * Kind of a single inbound event as reported by the transport.
 */
public enum ContentKind {
    TEXT("text"), PHOTO("image"), VOICE("voice"), VIDEO("video"), DOCUMENT("document"), CONTACT("contact"), POLL(
            "poll"), COMMAND("command");

    /**
     * Content routing order, highest priority first. Commands are resolved
     * before content routing and are not part of this list.
     */
    public static final List<ContentKind> ROUTING_PRIORITY = List.of(PHOTO, VOICE, VIDEO, POLL, CONTACT, DOCUMENT,
            TEXT);

    private final String policyKey;

    ContentKind(String policyKey) {
        this.policyKey = policyKey;
    }

    /**
     * Key of the media policy under {@code gateway.media.policies}.
     */
    public String getPolicyKey() {
        return policyKey;
    }

    public boolean isMedia() {
        return this == PHOTO || this == VOICE || this == VIDEO || this == DOCUMENT;
    }

    /**
     * Whether events of this kind may carry a caption that contributes to the
     * combined text.
     */
    public boolean isCaptioned() {
        return this == PHOTO || this == VIDEO || this == DOCUMENT;
    }
}
