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
package dev.mars.pgdispatch.api.metrics;

/**
 * Metrics interface for the dispatcher.
 *
 * Provides observability into submitted commands, validation failures,
 * native operation failures and LISTEN/NOTIFY traffic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface DispatcherMetrics {

    /**
     * Increment counter for dispatched commands.
     *
     * Metric name: pgdispatch.commands.total
     * Tags: command (e.g., "query")
     *
     * @param command The command name
     */
    void incrementCommands(String command);

    /**
     * Increment counter for commands and subscriptions that referenced an unknown connection id.
     *
     * Metric name: pgdispatch.invalid.connection.ids.total
     */
    void incrementInvalidConnectionIds();

    /**
     * Increment counter for native operations that completed with a failure.
     *
     * Metric name: pgdispatch.native.failures.total
     * Tags: operation (e.g., "connect", "sql", "disconnect")
     *
     * @param operation The failed operation
     */
    void incrementNativeFailures(String operation);

    /**
     * Increment counter for connections closed by the driver or server.
     *
     * Metric name: pgdispatch.connections.lost.total
     */
    void incrementConnectionsLost();

    /**
     * Increment counter for issued LISTEN or UNLISTEN statements.
     *
     * Metric name: pgdispatch.listen.operations.total
     * Tags: type ("listen" or "unlisten")
     *
     * @param type The operation tag
     */
    void incrementListenOperations(String type);

    /**
     * Increment counter for received notifications.
     *
     * Metric name: pgdispatch.notifications.total
     */
    void incrementNotifications();

    /**
     * Record the current number of registered connections.
     *
     * Metric name: pgdispatch.connections.registered
     *
     * @param count The number of connections in the registry
     */
    void recordRegisteredConnections(int count);
}
