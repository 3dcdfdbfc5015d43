package me.golemcore.gateway.port.inbound;

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

import me.golemcore.gateway.domain.model.BufferOutcome;
import me.golemcore.gateway.domain.model.BufferStatus;
import me.golemcore.gateway.domain.model.InboundEvent;

import java.util.Optional;

/**
 * Push interface through which transport adapters hand inbound events to the
 * gateway. Events of one conversation are aggregated before routing.
 */
public interface InboundEventPort {

    /**
     * Accepts one event. Never blocks on routing and never fails.
     */
    BufferOutcome onEvent(InboundEvent event);

    /**
     * Discards the pending buffer of a conversation without routing it.
     *
     * @return number of discarded events
     */
    int cancelBuffer(String conversationId);

    /**
     * Returns the state of the pending buffer, empty when nothing is buffered.
     */
    Optional<BufferStatus> getBufferStatus(String conversationId);
}
