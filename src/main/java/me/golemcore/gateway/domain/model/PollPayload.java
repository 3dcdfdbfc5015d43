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
 * Poll shared into a conversation.
 *
 * @param question
 *            poll question
 * @param options
 *            options in display order
 * @param type
 *            {@code regular} or {@code quiz}
 * @param totalVoterCount
 *            number of users that voted so far
 * @param anonymous
 *            whether votes are anonymous
 */
public record PollPayload(String question, List<Option> options, String type, int totalVoterCount,
        boolean anonymous) {

    public PollPayload {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public record Option(String text, int voterCount) {
    }
}
