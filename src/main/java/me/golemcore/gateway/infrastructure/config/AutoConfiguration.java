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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that starts the gateway on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Applies the configured notice language</li>
 * <li>Logs the effective buffering settings</li>
 * <li>Auto-starts all enabled input channels (Telegram, etc.)</li>
 * </ul>
 *
 * <p>
 * Channels are discovered via dependency injection and started if their
 * corresponding {@code gateway.channels.<type>.enabled} property is true.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final MessageService messageService;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        GatewayProperties.BufferProperties buffer = properties.getBuffer();
        log.info("GolemCore Gateway starting...");
        messageService.setLanguage(properties.getLanguage());
        log.info("Buffer: debounce={}, maxWait={}, maxCapacity={}",
                buffer.getDebounce(), buffer.getMaxWait(), buffer.getMaxCapacity());
        log.info("Media temp dir: {}", GatewayProperties.resolvePath(properties.getMedia().getTempDir()));

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("GolemCore Gateway started successfully");
    }

    private boolean isChannelEnabled(String channelType) {
        GatewayProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
