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
 * Outcome of a content handler invocation.
 *
 * @param status
 *            handler status
 * @param notice
 *            user-visible text to send back, or {@code null}. Never contains
 *            local paths or detected MIME strings.
 */
public record HandlerResult(Status status, String notice) {

    public enum Status {
        /** Payload was handed to the agent. */
        HANDLED,
        /** Media was refused by validation. */
        REJECTED,
        /** Transient or processing failure reported to the user. */
        FAILED,
        /** Nothing to do for this handler. */
        SKIPPED
    }

    public static HandlerResult handled() {
        return new HandlerResult(Status.HANDLED, null);
    }

    public static HandlerResult handled(String notice) {
        return new HandlerResult(Status.HANDLED, notice);
    }

    public static HandlerResult rejected(String notice) {
        return new HandlerResult(Status.REJECTED, notice);
    }

    public static HandlerResult failed(String notice) {
        return new HandlerResult(Status.FAILED, notice);
    }

    public static HandlerResult skipped() {
        return new HandlerResult(Status.SKIPPED, null);
    }

    public boolean hasNotice() {
        return notice != null && !notice.isBlank();
    }
}
