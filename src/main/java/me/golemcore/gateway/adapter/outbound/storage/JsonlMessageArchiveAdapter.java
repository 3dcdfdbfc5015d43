package me.golemcore.gateway.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.PersistencePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local filesystem archive of routed messages, one JSON Lines file per
 * conversation under {@code <base-path>/archive/}.
 *
 * <p>
 * Only metadata and text are written; media content never reaches the archive.
 * Appends to the same file are serialized.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlMessageArchiveAdapter implements PersistencePort {

    private static final String ARCHIVE_DIR = "archive";

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();
    private Path archiveDir;

    /**
     * One archived {@link CombinedMessage}.
     */
    public record ArchiveEntry(String conversationId, String senderId, Instant archivedAt, int overflowCount,
            List<EventEntry> events) {
    }

    /**
     * One archived event. Media is described by reference only.
     */
    public record EventEntry(long eventId, ContentKind kind, Instant arrivedAt, String text, String caption,
            String fileName, String mimeType, Long fileSize, Long replyToEventId, String forwardedFrom) {
    }

    @PostConstruct
    public void init() {
        this.archiveDir = GatewayProperties.resolvePath(properties.getStorage().getBasePath()).resolve(ARCHIVE_DIR);
        try {
            Files.createDirectories(archiveDir);
            log.info("Message archive initialized at: {}", archiveDir);
        } catch (IOException e) {
            log.error("Failed to create archive directory", e);
        }
    }

    @Override
    public void persist(CombinedMessage message) throws IOException {
        ArchiveEntry entry = toEntry(message);
        String line = objectMapper.writeValueAsString(entry) + "\n";
        Path file = fileFor(message.getConversationId());
        Object lock = fileLocks.computeIfAbsent(file, key -> new Object());
        synchronized (lock) {
            Files.createDirectories(archiveDir);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        log.debug("[Archive] Appended {} event(s) for {}", entry.events().size(), message.getConversationId());
    }

    /**
     * Reads back every archived entry of a conversation, oldest first.
     */
    public List<ArchiveEntry> read(String conversationId) throws IOException {
        Path file = fileFor(conversationId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<ArchiveEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                entries.add(objectMapper.readValue(line, ArchiveEntry.class));
            }
        }
        return entries;
    }

    Path fileFor(String conversationId) {
        return archiveDir.resolve(sanitize(conversationId) + ".jsonl");
    }

    static String sanitize(String conversationId) {
        String safe = conversationId.replaceAll("[^A-Za-z0-9_-]", "_");
        return safe.isEmpty() ? "_" : safe;
    }

    private ArchiveEntry toEntry(CombinedMessage message) {
        List<EventEntry> events = new ArrayList<>();
        for (InboundEvent event : message.getEvents()) {
            MediaRef media = event.getMedia();
            events.add(new EventEntry(
                    event.getEventId(),
                    event.getKind(),
                    event.getArrivedAt(),
                    event.getText(),
                    event.getCaption(),
                    media != null ? media.fileName() : null,
                    media != null ? media.mimeType() : null,
                    media != null ? media.fileSize() : null,
                    event.getReplyToEventId(),
                    event.getForwardedFrom()));
        }
        return new ArchiveEntry(message.getConversationId(), message.getSenderId(), clock.instant(),
                message.getOverflowCount(), events);
    }
}
