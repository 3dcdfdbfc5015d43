package me.golemcore.gateway.adapter.outbound.telegram;

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
import me.golemcore.gateway.domain.model.MediaDownloadException;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.MediaStorePort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads Telegram media through the Bot API: {@code getFile} resolves the
 * file path, then the file endpoint is streamed into the destination.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramMediaStoreAdapter implements MediaStorePort {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String FILE_ENDPOINT = "https://api.telegram.org/file/bot";

    private final OkHttpClient okHttpClient;
    private final GatewayProperties properties;

    private TelegramClient telegramClient;

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public void download(MediaRef ref, Path destination) throws MediaDownloadException, InterruptedException {
        String token = token();
        if (token == null || token.isBlank()) {
            throw new MediaDownloadException("Telegram token not configured");
        }

        String filePath;
        try {
            File file = client(token).execute(new GetFile(ref.fileId()));
            filePath = file.getFilePath();
        } catch (TelegramApiException e) {
            throw new MediaDownloadException("getFile failed: " + e.getMessage(), e);
        }
        if (filePath == null || filePath.isBlank()) {
            throw new MediaDownloadException("File is no longer available");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted before media download");
        }

        Request request = new Request.Builder()
                .url(fileUrl(token, filePath))
                .get()
                .build();
        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new MediaDownloadException("File download failed (HTTP " + response.code() + ")");
            }
            try (InputStream in = body.byteStream()) {
                long copied = Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Telegram] Downloaded {} bytes for file {}", copied, ref.fileId());
            }
        } catch (MediaDownloadException e) {
            throw e;
        } catch (IOException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted during media download");
            }
            throw new MediaDownloadException("File download failed: " + e.getMessage(), e);
        }
    }

    protected String fileUrl(String token, String filePath) {
        return FILE_ENDPOINT + token + "/" + filePath;
    }

    private synchronized TelegramClient client(String token) {
        if (telegramClient == null) {
            telegramClient = new OkHttpTelegramClient(okHttpClient, token);
        }
        return telegramClient;
    }

    private String token() {
        GatewayProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        return channel != null ? channel.getToken() : null;
    }
}
