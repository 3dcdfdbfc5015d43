package me.golemcore.gateway.plugin.api;

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

/**
 * Extension point consulted before commands and content routing. Register an
 * implementation as a Spring bean; use {@code @Order} to control precedence.
 */
public interface MessagePlugin {

    /**
     * Plugin name for logs.
     */
    String getName();

    /**
     * @return {@code true} if the plugin handled the message and routing must
     *         stop
     */
    boolean tryHandle(CombinedMessage message) throws Exception; // NOSONAR - failures are isolated by the registry
}
