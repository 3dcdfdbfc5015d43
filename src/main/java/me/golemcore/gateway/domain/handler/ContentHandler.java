package me.golemcore.gateway.domain.handler;

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

import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;

/**
 * Handler for one content kind. Exactly one handler runs per routed message.
 *
 * <p>
 * Media handlers acquire temp files through an
 * {@link me.golemcore.gateway.domain.service.AssetScope} and must leave none
 * behind when {@link #handle} returns or throws. Validation and transient
 * failures are returned as a {@link HandlerResult} with a user-facing notice;
 * only unexpected exceptions escape. Interruption always propagates, after
 * cleanup.
 */
public interface ContentHandler {

    ContentKind kind();

    /**
     * @param message
     *            routed message, contains at least one event of {@link #kind()}
     * @param agentMode
     *            agent mode of the conversation
     */
    HandlerResult handle(CombinedMessage message, boolean agentMode) throws InterruptedException;
}
