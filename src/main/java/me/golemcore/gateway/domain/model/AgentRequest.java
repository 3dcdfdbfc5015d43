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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Unit of work for the external agent.
 */
@Value
@Builder
public class AgentRequest {

    String conversationId;
    String senderId;
    String prompt;
    @Singular
    List<Attachment> attachments;
    boolean agentMode;
    /**
     * Working scope hint from an agent command ({@code claude}, {@code meta},
     * {@code dev}), {@code null} for regular messages.
     */
    String scope;
    ContentKind source;
}
