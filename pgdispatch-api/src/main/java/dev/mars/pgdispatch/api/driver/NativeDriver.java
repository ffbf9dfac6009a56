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
package dev.mars.pgdispatch.api.driver;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Contract the dispatcher requires from the low-level database client.
 *
 * <p>Every operation returns a Vert.x {@link Future} that completes exactly once.
 * The dispatcher never blocks on these futures; it posts their outcome back onto
 * its own context. Handles returned by one driver must only be passed back to the
 * same driver.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface NativeDriver {

    /**
     * Opens a connection.
     *
     * @param timeoutMs Maximum time to wait for the connection to be established
     * @param onConnectionLost Invoked at most once if the connection later closes without a disconnect
     * @return Future completing with the client and listen-channel handles
     */
    Future<ConnectResult> connect(long timeoutMs, String host, int port, String database,
                                  String user, String password, Handler<Throwable> onConnectionLost);

    /**
     * Closes a connection.
     *
     * @param discard true to drop the connection immediately, false to release it gracefully
     */
    Future<Void> disconnect(ClientHandle client, boolean discard, ListenChannelHandle listenChannel);

    /**
     * Starts a query and reads its first batch.
     */
    Future<QueryResult> query(ClientHandle client, String sql, int batchSize, ListenChannelHandle listenChannel);

    /**
     * Reads the next batch from a query cursor. An empty list means the cursor is exhausted.
     */
    Future<List<JsonObject>> moreQueryResults(ClientHandle client, CursorHandle cursor, int batchSize);

    /**
     * Executes a statement.
     *
     * @return Future completing with the number of affected rows
     */
    Future<Integer> executeSql(ClientHandle client, String sql);

    /**
     * Issues a LISTEN statement and routes notifications of the connection to {@code onNotification}.
     */
    Future<ListenChannelHandle> listen(ClientHandle client, String sql, Handler<Notification> onNotification);

    /**
     * Issues an UNLISTEN statement.
     */
    Future<Void> unlisten(ClientHandle client, String sql, ListenChannelHandle listenChannel);
}
