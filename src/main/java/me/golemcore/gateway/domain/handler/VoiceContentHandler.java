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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Voice notes (and round video notes) are transcribed and the transcript is
 * sent to the agent.
 *
 * <p>
 * Transcription goes through {@link SpeechReader}, which extracts the audio
 * track first when a voice item is a video container and releases every file
 * it created. Items already transcribed while collect mode queued them are not
 * downloaded again. Outside agent mode the transcript is also echoed back to the
 * user.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VoiceContentHandler implements ContentHandler {

    private final SpeechReader speechReader;
    private final HandlerSupport support;

    @Override
    public ContentKind kind() {
        return ContentKind.VOICE;
    }

    @Override
    public HandlerResult handle(CombinedMessage message, boolean agentMode) throws InterruptedException {
        List<InboundEvent> voices = message.voices();
        if (voices.isEmpty()) {
            return HandlerResult.skipped();
        }
        boolean allTranscribed = voices.stream().allMatch(InboundEvent::hasTranscript);
        if (!allTranscribed && !speechReader.isAvailable()) {
            return HandlerResult.failed(support.message("voice.error.unavailable"));
        }

        List<String> transcripts = new ArrayList<>();
        List<HandlerResult> failures = new ArrayList<>();
        for (InboundEvent voice : voices) {
            if (voice.hasTranscript()) {
                transcripts.add(voice.getTranscript());
                continue;
            }
            SpeechReader.Speech speech = speechReader.read(ContentKind.VOICE, voice);
            if (speech.succeeded()) {
                transcripts.add(speech.transcript());
            } else {
                failures.add(speech.failure());
            }
        }

        if (transcripts.isEmpty()) {
            return HandlerSupport.failureOf(failures);
        }

        String joined = String.join("\n", transcripts);
        support.submit(message, agentMode, ContentKind.VOICE,
                support.prompt(message, "[Voice message transcript]: " + joined), List.of());
        log.debug("[Voice] {} transcript(s) for {}", transcripts.size(), message.getConversationId());

        List<String> notices = new ArrayList<>();
        if (!agentMode) {
            notices.add(support.message("voice.transcript", joined));
        }
        failures.forEach(failure -> notices.add(failure.notice()));
        return HandlerResult.handled(HandlerSupport.joinNotices(notices));
    }
}
