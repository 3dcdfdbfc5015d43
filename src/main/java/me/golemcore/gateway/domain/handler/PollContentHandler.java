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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.PollPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Polls are described as text for the agent.
 */
@Component
@RequiredArgsConstructor
public class PollContentHandler implements ContentHandler {

    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.POLL;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) {
        List<PollPayload> polls = message.polls();
        if (polls.isEmpty()) {
            return HandlerResult.skipped();
        }
        String description = polls.stream()
                .map(PollContentHandler::describe)
                .collect(Collectors.joining("\n\n"));
        support.submit(message, agentMode, ContentKind.POLL, support.prompt(message, description), List.of());
        return HandlerResult.handled();
    }

    static String describe(PollPayload poll) {
        StringBuilder sb = new StringBuilder();
        sb.append("📊 Poll: \"").append(poll.question()).append("\"\n");
        sb.append("Type: ").append(poll.type() != null ? poll.type() : "regular");
        if (poll.anonymous()) {
            sb.append(" (anonymous)");
        }
        sb.append("\nTotal votes: ").append(poll.totalVoterCount());
        List<PollPayload.Option> options = poll.options();
        for (int i = 0; i < options.size(); i++) {
            PollPayload.Option option = options.get(i);
            sb.append('\n').append(i + 1).append(". ").append(option.text());
            if (option.voterCount() > 0) {
                sb.append(" (").append(option.voterCount()).append(" votes)");
            }
        }
        return sb.toString();
    }
}
