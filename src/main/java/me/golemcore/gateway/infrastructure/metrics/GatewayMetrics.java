package me.golemcore.gateway.infrastructure.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import me.golemcore.gateway.domain.model.RoutingOutcome;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Gateway meters: routing outcomes, buffer overflow, asset cleanup failures
 * and the number of active background tasks.
 */
@Component
public class GatewayMetrics {

    public static final String ROUTING_OUTCOMES = "gateway.routing.outcomes";
    public static final String BUFFER_OVERFLOW = "gateway.buffer.overflow";
    public static final String CLEANUP_FAILURES = "gateway.assets.cleanup.failures";
    public static final String TASKS_ACTIVE = "gateway.tasks.active";

    private final MeterRegistry registry;
    private final Counter overflowCounter;
    private final Counter cleanupFailureCounter;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.overflowCounter = Counter.builder(BUFFER_OVERFLOW)
                .description("Inbound events refused because a conversation buffer was full")
                .register(registry);
        this.cleanupFailureCounter = Counter.builder(CLEANUP_FAILURES)
                .description("Temporary media files that could not be removed")
                .register(registry);
    }

    public void recordOutcome(RoutingOutcome outcome) {
        Counter.builder(ROUTING_OUTCOMES)
                .tag("outcome", outcome.type().name().toLowerCase(Locale.ROOT))
                .tag("kind", outcome.detail())
                .register(registry)
                .increment();
    }

    public void recordOverflow() {
        overflowCounter.increment();
    }

    public void recordCleanupFailure() {
        cleanupFailureCounter.increment();
    }

    public void bindActiveTasks(Supplier<Number> activeCount) {
        Gauge.builder(TASKS_ACTIVE, activeCount)
                .description("Background tasks currently tracked")
                .register(registry);
    }
}
