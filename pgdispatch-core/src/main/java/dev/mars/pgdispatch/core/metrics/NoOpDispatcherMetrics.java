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

/**
 * No-op implementation of DispatcherMetrics.
 *
 * Used when metrics collection is disabled or when no MeterRegistry is available.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NoOpDispatcherMetrics implements DispatcherMetrics {

    public static final NoOpDispatcherMetrics INSTANCE = new NoOpDispatcherMetrics();

    @Override
    public void incrementCommands(String command) {
        // No-op
    }

    @Override
    public void incrementInvalidConnectionIds() {
        // No-op
    }

    @Override
    public void incrementNativeFailures(String operation) {
        // No-op
    }

    @Override
    public void incrementConnectionsLost() {
        // No-op
    }

    @Override
    public void incrementListenOperations(String type) {
        // No-op
    }

    @Override
    public void incrementNotifications() {
        // No-op
    }

    @Override
    public void recordRegisteredConnections(int count) {
        // No-op
    }
}
