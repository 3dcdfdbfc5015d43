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
 * What happened to an event handed to the buffer manager.
 */
public enum BufferOutcome {
    /** Appended, debounce timer (re)started. */
    BUFFERED,
    /** Refused because the buffer was full; counted as overflow. */
    OVERFLOWED,
    /** Appended and flushed immediately because the absolute cap was reached. */
    FLUSHED,
    /** Delivered on its own without aggregation. */
    BYPASSED
}
