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
package dev.mars.pgdispatch.core.completion;

import dev.mars.pgdispatch.api.driver.ClientHandle;
import dev.mars.pgdispatch.api.driver.CursorHandle;
import dev.mars.pgdispatch.api.driver.ListenChannelHandle;
import dev.mars.pgdispatch.api.subscription.ListenEventType;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Internal event describing the outcome of one native operation.
 *
 * <p>Completions are produced from driver futures and consumed only by the
 * {@link CompletionRouter} on the dispatcher context. They never reach the application
 * directly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface Completion {

    int connectionId();

    record ConnectSucceeded(int connectionId, ClientHandle client, ListenChannelHandle listenChannel)
        implements Completion {
    }

    record ConnectFailed(int connectionId, String message) implements Completion {
    }

    record ConnectionLost(int connectionId, String reason) implements Completion {
    }

    record DisconnectSucceeded(int connectionId) implements Completion {
    }

    record DisconnectFailed(int connectionId, String message) implements Completion {
    }

    record QuerySucceeded(int connectionId, CursorHandle cursor, List<JsonObject> rows) implements Completion {
    }

    record MoreRowsReceived(int connectionId, List<JsonObject> rows) implements Completion {
    }

    record ExecuteSucceeded(int connectionId, int affectedRows) implements Completion {
    }

    /**
     * Failure of a query, continuation or execute statement.
     */
    record SqlFailed(int connectionId, String sql, String message) implements Completion {
    }

    record ListenSucceeded(int connectionId, String channel, ListenEventType type,
                           ListenChannelHandle listenChannel) implements Completion {
    }

    record ListenFailed(int connectionId, String channel, ListenEventType type, String sql, String message)
        implements Completion {
    }

    record NotificationReceived(int connectionId, String channel, String payload) implements Completion {
    }
}
