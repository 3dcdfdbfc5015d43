package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CollectModePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * In-memory collect mode. A conversation is collecting while it has a queue;
 * the queue holds at most {@code gateway.collect.max-items} messages, later
 * ones are refused. Trigger phrases are matched case-insensitively anywhere in
 * the text and stripped from the message that carried them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectModeService implements CollectModePort {

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t]{2,}");

    private final GatewayProperties properties;

    private final Map<String, List<CombinedMessage>> queues = new ConcurrentHashMap<>();

    @Override
    public boolean isCollecting(String conversationId) {
        return queues.containsKey(conversationId);
    }

    @Override
    public boolean matchesTrigger(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        return properties.getCollect().getTriggerKeywords().stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .anyMatch(keyword -> normalized.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String stripTriggers(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text;
        List<String> keywords = properties.getCollect().getTriggerKeywords().stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        for (String keyword : keywords) {
            Pattern pattern = Pattern.compile(Pattern.quote(keyword.trim()),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            stripped = pattern.matcher(stripped).replaceAll(" ");
        }
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    @Override
    public int enqueue(String conversationId, CombinedMessage message) {
        int maxItems = properties.getCollect().getMaxItems();
        int[] size = new int[1];
        queues.computeIfPresent(conversationId, (id, queue) -> {
            if (queue.size() >= maxItems) {
                log.warn("[Collect] Queue of {} is full ({}), message ignored", id, maxItems);
            } else {
                queue.add(message);
            }
            size[0] = queue.size();
            return queue;
        });
        return size[0];
    }

    @Override
    public List<CombinedMessage> drainAndTrigger(String conversationId) {
        List<CombinedMessage> drained = queues.remove(conversationId);
        if (drained == null) {
            return List.of();
        }
        log.info("[Collect] Released {} collected message(s) of {}", drained.size(), conversationId);
        return List.copyOf(drained);
    }

    @Override
    public boolean start(String conversationId) {
        boolean started = queues.putIfAbsent(conversationId, new ArrayList<>()) == null;
        if (started) {
            log.info("[Collect] Collect mode started for {}", conversationId);
        }
        return started;
    }

    @Override
    public int stop(String conversationId) {
        List<CombinedMessage> discarded = queues.remove(conversationId);
        if (discarded == null) {
            return 0;
        }
        log.info("[Collect] Collect mode stopped for {}, {} message(s) discarded", conversationId,
                discarded.size());
        return discarded.size();
    }

    @Override
    public int queuedCount(String conversationId) {
        int[] size = new int[1];
        queues.computeIfPresent(conversationId, (id, queue) -> {
            size[0] = queue.size();
            return queue;
        });
        return size[0];
    }
}
