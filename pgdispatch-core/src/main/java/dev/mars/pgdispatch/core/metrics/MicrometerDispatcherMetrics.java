/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */
package dev.mars.pgdispatch.core.metrics;

import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of DispatcherMetrics.
 *
 * Every meter carries an {@code instance} tag when an instance id is configured, so several
 * dispatchers can share one registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class MicrometerDispatcherMetrics implements DispatcherMetrics {

    private final MeterRegistry registry;
    private final Tags commonTags;
    private final AtomicInteger registeredConnections = new AtomicInteger();

    public MicrometerDispatcherMetrics(MeterRegistry registry) {
        this(registry, null);
    }

    public MicrometerDispatcherMetrics(MeterRegistry registry, String instanceId) {
        this.registry = registry;
        this.commonTags = instanceId != null ? Tags.of("instance", instanceId) : Tags.empty();
        Gauge.builder("pgdispatch.connections.registered", registeredConnections, AtomicInteger::get)
            .tags(commonTags)
            .description("Number of connections currently held in the dispatcher registry")
            .register(registry);
    }

    @Override
    public void incrementCommands(String command) {
        Counter.builder("pgdispatch.commands.total")
            .tags(commonTags)
            .tag("command", command != null ? command : "unknown")
            .description("Total count of dispatched commands by type")
            .register(registry)
            .increment();
    }

    @Override
    public void incrementInvalidConnectionIds() {
        Counter.builder("pgdispatch.invalid.connection.ids.total")
            .tags(commonTags)
            .description("Total count of commands and subscriptions naming an unknown connection id")
            .register(registry)
            .increment();
    }

    @Override
    public void incrementNativeFailures(String operation) {
        Counter.builder("pgdispatch.native.failures.total")
            .tags(commonTags)
            .tag("operation", operation != null ? operation : "unknown")
            .description("Total count of failed native operations by operation")
            .register(registry)
            .increment();
    }

    @Override
    public void incrementConnectionsLost() {
        Counter.builder("pgdispatch.connections.lost.total")
            .tags(commonTags)
            .description("Total count of connections closed by the driver or server")
            .register(registry)
            .increment();
    }

    @Override
    public void incrementListenOperations(String type) {
        Counter.builder("pgdispatch.listen.operations.total")
            .tags(commonTags)
            .tag("type", type != null ? type : "unknown")
            .description("Total count of issued LISTEN and UNLISTEN statements")
            .register(registry)
            .increment();
    }

    @Override
    public void incrementNotifications() {
        Counter.builder("pgdispatch.notifications.total")
            .tags(commonTags)
            .description("Total count of notifications delivered to applications")
            .register(registry)
            .increment();
    }

    @Override
    public void recordRegisteredConnections(int count) {
        registeredConnections.set(count);
    }
}
