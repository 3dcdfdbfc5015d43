package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link BufferProperties} - debounce, absolute cap and capacity of
 * conversation buffers</li>
 * <li>{@link MediaProperties} - temp directory and per-kind media policies</li>
 * <li>{@link TasksProperties} and {@link DispatchProperties} - worker
 * pools</li>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private String language = "en";
    private BufferProperties buffer = new BufferProperties();
    private MediaProperties media = new MediaProperties();
    private TasksProperties tasks = new TasksProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private CollectProperties collect = new CollectProperties();
    private AgentProperties agent = new AgentProperties();
    private CommandsProperties commands = new CommandsProperties();
    private RepliesProperties replies = new RepliesProperties();
    private StorageProperties storage = new StorageProperties();
    private VoiceProperties voice = new VoiceProperties();
    private HttpProperties http = new HttpProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();

    @Data
    public static class BufferProperties {
        /** Debounce window D, restarted by every accepted event. */
        private Duration debounce = Duration.ofMillis(2500);
        /** Absolute cap A measured from buffer creation. */
        private Duration maxWait = Duration.ofSeconds(30);
        private int maxCapacity = 10;
        private List<String> bypassCommands = new ArrayList<>(List.of("help", "start", "cancel", "mode"));
    }

    @Data
    public static class MediaProperties {
        private String tempDir = "${java.io.tmpdir}/golemcore-gateway";
        private Map<String, MediaPolicy> policies = new HashMap<>(defaultPolicies());
    }

    @Data
    @NoArgsConstructor
    public static class MediaPolicy {
        private long maxBytes;
        private List<String> allowedMimeTypes = new ArrayList<>();
        private List<String> allowedExtensions = new ArrayList<>();

        public MediaPolicy(long maxBytes, List<String> allowedMimeTypes, List<String> allowedExtensions) {
            this.maxBytes = maxBytes;
            this.allowedMimeTypes = new ArrayList<>(allowedMimeTypes);
            this.allowedExtensions = new ArrayList<>(allowedExtensions);
        }
    }

    @Data
    public static class TasksProperties {
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private int poolSize = 4;
    }

    @Data
    public static class DispatchProperties {
        private int poolSize = 8;
    }

    @Data
    public static class CollectProperties {
        private List<String> triggerKeywords = new ArrayList<>(
                List.of("now respond", "process this", "go ahead", "обработай", "ответь"));
        private int maxItems = 50;
    }

    @Data
    public static class AgentProperties {
        private boolean defaultMode = false;
        private int maxConversations = 10000;
    }

    @Data
    public static class CommandsProperties {
        private List<String> agentCommands = new ArrayList<>(List.of("claude", "meta", "dev"));
    }

    @Data
    public static class RepliesProperties {
        private int maxPerConversation = 200;
        private int maxConversations = 1000;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    @Data
    public static class VoiceProperties {
        private String whisperUrl = "";
        private String whisperApiKey = "";
        private String whisperModel = "whisper-1";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    /**
     * Resolves a configured path, expanding {@code ${user.home}} and
     * {@code ${java.io.tmpdir}} placeholders left in default values.
     */
    public static Path resolvePath(String configured) {
        String expanded = configured
                .replace("${user.home}", System.getProperty("user.home"))
                .replace("${java.io.tmpdir}", System.getProperty("java.io.tmpdir"));
        return Paths.get(expanded).toAbsolutePath().normalize();
    }

    private static Map<String, MediaPolicy> defaultPolicies() {
        Map<String, MediaPolicy> policies = new HashMap<>();
        policies.put("image", new MediaPolicy(6L * 1024 * 1024,
                List.of("image/jpeg", "image/png", "image/webp"),
                List.of("jpg", "jpeg", "png", "webp")));
        policies.put("voice", new MediaPolicy(20L * 1024 * 1024,
                List.of("audio/ogg", "audio/mpeg", "audio/mp4", "audio/wav", "audio/webm", "video/mp4",
                        "video/webm"),
                List.of("ogg", "oga", "opus", "mp3", "m4a", "wav", "webm", "mp4")));
        policies.put("video", new MediaPolicy(50L * 1024 * 1024,
                List.of("video/mp4", "video/webm", "video/quicktime"),
                List.of("mp4", "webm", "mov")));
        policies.put("document", new MediaPolicy(20L * 1024 * 1024,
                List.of("application/pdf", "application/zip", "application/json", "text/plain", "text/csv",
                        "text/markdown", "image/jpeg", "image/png", "image/webp"),
                List.of("pdf", "zip", "json", "txt", "csv", "md", "log", "jpg", "jpeg", "png", "webp")));
        return policies;
    }
}
