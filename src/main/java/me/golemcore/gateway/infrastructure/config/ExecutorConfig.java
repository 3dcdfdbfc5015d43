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

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools of the gateway. Beans are injected by name:
 * {@code conversationExecutor} runs routing (one task per conversation at a
 * time), {@code backgroundTaskExecutor} runs tracked fire-and-forget work and
 * {@code bufferScheduler} fires debounce timers.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final GatewayProperties properties;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conversationExecutor() {
        return Executors.newFixedThreadPool(properties.getDispatch().getPoolSize(),
                namedDaemonThreads("gateway-conversation"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backgroundTaskExecutor() {
        return Executors.newFixedThreadPool(properties.getTasks().getPoolSize(),
                namedDaemonThreads("gateway-task"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService bufferScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-buffer-timer");
            t.setDaemon(true);
            return t;
        });
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
