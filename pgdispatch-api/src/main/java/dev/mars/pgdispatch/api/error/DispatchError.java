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
package dev.mars.pgdispatch.api.error;

import java.time.Instant;

/**
 * Immutable error record delivered to an application error tagger.
 *
 * @param code         The standard error code (e.g., PGDERR0001)
 * @param connectionId The connection the failed operation referred to
 * @param message      Human-readable error message
 * @param sql          The SQL text of the failed operation, or null when no SQL was involved
 * @param timestamp    When the error was recorded
 */
public record DispatchError(
    String code,
    int connectionId,
    String message,
    String sql,
    Instant timestamp
) {
    /**
     * Message reported for commands that reference an unknown connection.
     */
    public static final String INVALID_CONNECTION_ID_MESSAGE = "Invalid connectionId";

    /**
     * Message reported for commands against a connection whose connect has not completed.
     */
    public static final String NOT_CONNECTED_MESSAGE = "Connection not established";

    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static DispatchError of(String code, int connectionId, String message) {
        return new DispatchError(code, connectionId, message, null, Instant.now());
    }

    /**
     * Creates an error with code, message and SQL text, using current timestamp.
     */
    public static DispatchError of(String code, int connectionId, String message, String sql) {
        return new DispatchError(code, connectionId, message, sql, Instant.now());
    }

    /**
     * Creates an invalid connection id error.
     */
    public static DispatchError invalidConnectionId(int connectionId) {
        return of(DispatchErrorCodes.INVALID_CONNECTION_ID, connectionId, INVALID_CONNECTION_ID_MESSAGE);
    }

    /**
     * Creates an error for a command issued before its connection finished connecting.
     */
    public static DispatchError notConnected(int connectionId) {
        return of(DispatchErrorCodes.NOT_CONNECTED, connectionId, NOT_CONNECTED_MESSAGE);
    }

    /**
     * Creates a connect failure error.
     */
    public static DispatchError connectFailed(int connectionId, String message) {
        return of(DispatchErrorCodes.CONNECT_FAILED, connectionId, message);
    }

    /**
     * Creates a disconnect failure error.
     */
    public static DispatchError disconnectFailed(int connectionId, String message) {
        return of(DispatchErrorCodes.DISCONNECT_FAILED, connectionId, message);
    }

    /**
     * Creates a SQL failure error annotated with the statement that failed.
     */
    public static DispatchError sqlFailed(String code, int connectionId, String sql, String message) {
        return of(code, connectionId, message, sql);
    }

    /**
     * Whether the error carries the SQL text of the failed statement.
     */
    public boolean hasSql() {
        return sql != null;
    }

    /**
     * Message text including the SQL statement when present, for logging and display.
     */
    public String describe() {
        return hasSql() ? message + " [sql: " + sql + "]" : message;
    }
}
