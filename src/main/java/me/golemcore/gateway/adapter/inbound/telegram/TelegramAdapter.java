package me.golemcore.gateway.adapter.inbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.port.inbound.InboundEventPort;
import me.golemcore.gateway.port.outbound.NotificationPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Telegram transport: long-polling inbound, plain-text notices outbound.
 *
 * <p>
 * Authorized messages are mapped by {@link TelegramUpdateMapper} and pushed to
 * the {@link InboundEventPort}. Commands are not executed here, they are
 * buffered and routed like any other event. The port is looked up lazily
 * because the routing side notifies through this adapter. Polling starts only
 * when {@code gateway.channels.telegram.enabled=true} and a token is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, NotificationPort, LongPollingSingleThreadUpdateConsumer {

    static final String CHANNEL_TYPE = "telegram";
    private static final int CHUNK_LENGTH = 3800;
    private static final String[] BOUNDARIES = { "\n\n", "\n" };

    private final GatewayProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ObjectProvider<InboundEventPort> inboundEventPort;
    private final MessageService messageService;

    private volatile TelegramClient telegramClient;
    private volatile boolean running;

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        GatewayProperties.ChannelProperties channel = channel();
        if (!channel.isEnabled()) {
            log.info("[Telegram] Channel disabled");
            return;
        }
        String token = channel.getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, channel will not start");
            return;
        }
        if (channel.getAllowFrom().isEmpty()) {
            log.warn("[Telegram] allow-from is empty, every user is authorized");
        }
        if (telegramClient == null) {
            telegramClient = new OkHttpTelegramClient(token);
        }
        try {
            botsApplication.registerBot(token, this);
            running = true;
            log.info("[Telegram] Long polling started");
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to register bot", e);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            botsApplication.close();
            log.info("[Telegram] Long polling stopped");
        } catch (Exception e) { // NOSONAR - shutdown must not fail
            log.error("[Telegram] Error while stopping", e);
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        Message message = update.getMessage();
        String chatId = message.getChatId().toString();
        String senderId = message.getFrom() != null ? message.getFrom().getId().toString() : null;

        if (!isAuthorized(senderId)) {
            log.warn("[Telegram] Unauthorized sender {} in chat {}", senderId, chatId);
            notify(chatId, messageService.getMessage("security.unauthorized"));
            return;
        }
        TelegramUpdateMapper.toEvent(message).ifPresentOrElse(event -> inboundEventPort.getObject().onEvent(event),
                () -> log.debug("[Telegram] Unsupported message {} in chat {}", message.getMessageId(), chatId));
    }

    @Override
    public boolean isAuthorized(String senderId) {
        List<String> allowFrom = channel().getAllowFrom();
        if (allowFrom == null || allowFrom.isEmpty()) {
            return true;
        }
        return senderId != null && allowFrom.contains(senderId);
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                deliver(chatId, content);
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send message to {}", chatId, e);
                throw new CompletionException(e);
            }
        });
    }

    @Override
    public void notify(String conversationId, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        if (telegramClient == null) {
            log.debug("[Telegram] Client not initialized, notice for {} not sent", conversationId);
            return;
        }
        try {
            deliver(conversationId, text);
        } catch (TelegramApiException | RuntimeException e) {
            log.warn("[Telegram] Failed to send notice to {}: {}", conversationId, e.getMessage());
        }
    }

    private void deliver(String chatId, String content) throws TelegramApiException {
        for (String part : chunk(content, CHUNK_LENGTH)) {
            telegramClient.execute(SendMessage.builder().chatId(chatId).text(part).build());
        }
    }

    /**
     * Cuts text into parts of at most {@code limit} characters, preferring a
     * paragraph break, then a line break, within the last three quarters of each
     * window. The break itself is dropped.
     */
    static List<String> chunk(String text, int limit) {
        List<String> parts = new ArrayList<>();
        String rest = text;
        while (rest.length() > limit) {
            String window = rest.substring(0, limit);
            int cut = limit;
            int skip = 0;
            for (String boundary : BOUNDARIES) {
                int at = window.lastIndexOf(boundary);
                if (at > limit / 4) {
                    cut = at;
                    skip = boundary.length();
                    break;
                }
            }
            parts.add(rest.substring(0, cut));
            rest = rest.substring(cut + skip);
        }
        parts.add(rest);
        return parts;
    }

    private GatewayProperties.ChannelProperties channel() {
        GatewayProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        return channel != null ? channel : new GatewayProperties.ChannelProperties();
    }
}
