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
 * Result of routing one combined message. Not persisted; exists so the
 * priority decision can be observed in logs, metrics and tests.
 *
 * @param type
 *            which routing stage claimed the message
 * @param kind
 *            content kind for {@link Type#CONTENT_HANDLED} and
 *            {@link Type#COLLECT_TRIGGERED}, otherwise {@code null}
 * @param command
 *            command name for {@link Type#COMMAND_HANDLED}, otherwise
 *            {@code null}
 */
public record RoutingOutcome(Type type, ContentKind kind, String command) {

    public enum Type {
        PLUGIN_HANDLED, COMMAND_HANDLED, COLLECT_QUEUED, COLLECT_TRIGGERED, CONTENT_HANDLED, EMPTY, FAILED
    }

    public RoutingOutcome {
        Objects.requireNonNull(type, "type");
    }

    public static RoutingOutcome pluginHandled() {
        return new RoutingOutcome(Type.PLUGIN_HANDLED, null, null);
    }

    public static RoutingOutcome commandHandled(String command) {
        return new RoutingOutcome(Type.COMMAND_HANDLED, null, command);
    }

    public static RoutingOutcome collectQueued() {
        return new RoutingOutcome(Type.COLLECT_QUEUED, null, null);
    }

    public static RoutingOutcome collectTriggered(ContentKind kind) {
        return new RoutingOutcome(Type.COLLECT_TRIGGERED, kind, null);
    }

    public static RoutingOutcome contentHandled(ContentKind kind) {
        return new RoutingOutcome(Type.CONTENT_HANDLED, kind, null);
    }

    public static RoutingOutcome empty() {
        return new RoutingOutcome(Type.EMPTY, null, null);
    }

    public static RoutingOutcome failed() {
        return new RoutingOutcome(Type.FAILED, null, null);
    }

    /**
     * Tag value used for metrics: the content kind, the command name, or
     * {@code none}.
     */
    public String detail() {
        if (kind != null) {
            return kind.name().toLowerCase(Locale.ROOT);
        }
        return command != null ? command : "none";
    }
}
