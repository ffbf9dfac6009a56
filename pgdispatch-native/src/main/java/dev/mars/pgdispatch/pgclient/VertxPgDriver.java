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
package dev.mars.pgdispatch.pgclient;

import dev.mars.pgdispatch.api.driver.ClientHandle;
import dev.mars.pgdispatch.api.driver.ConnectResult;
import dev.mars.pgdispatch.api.driver.CursorHandle;
import dev.mars.pgdispatch.api.driver.ListenChannelHandle;
import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.driver.Notification;
import dev.mars.pgdispatch.api.driver.QueryResult;
import dev.mars.pgdispatch.core.config.DispatcherConfig;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.PreparedStatement;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Native driver on the Vert.x reactive PostgreSQL client.
 *
 * <p>Each connect opens a dedicated {@link PgConnection}; the driver keeps no pool. Queries
 * run inside a transaction through a prepared statement cursor so that large result sets are
 * read {@code batchSize} rows at a time. When a cursor is drained it is closed and its
 * transaction committed. Any other statement on the same client (query, execute, LISTEN,
 * UNLISTEN) first closes a cursor that is still open and commits its transaction, so the
 * statement never runs inside it; later continuation calls on that cursor return no rows.
 * Notifications of a connection are routed to the consumer registered by the last
 * LISTEN on it.</p>
 *
 * <p>Rows are returned as {@link JsonObject}s ({@link Row#toJson()}). Handles created by
 * another driver instance are rejected with {@link IllegalArgumentException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class VertxPgDriver implements NativeDriver {
    private static final Logger logger = LoggerFactory.getLogger(VertxPgDriver.class);

    private final Vertx vertx;
    private final boolean sslEnabled;

    public VertxPgDriver(Vertx vertx) {
        this(vertx, DispatcherConfig.defaults());
    }

    public VertxPgDriver(Vertx vertx, DispatcherConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.sslEnabled = Objects.requireNonNull(config, "config cannot be null").isSslEnabled();
    }

    @Override
    public Future<ConnectResult> connect(long timeoutMs, String host, int port, String database, String user,
                                         String password, Handler<Throwable> onConnectionLost) {
        Objects.requireNonNull(onConnectionLost, "onConnectionLost cannot be null");
        String target = user + "@" + host + ":" + port + "/" + database;
        PgConnectOptions options = new PgConnectOptions()
            .setHost(host)
            .setPort(port)
            .setDatabase(database)
            .setUser(user)
            .setPassword(password);
        options.setSslMode(sslEnabled ? SslMode.REQUIRE : SslMode.DISABLE);

        Promise<ConnectResult> promise = Promise.promise();
        long timerId = vertx.setTimer(timeoutMs, id -> {
            if (promise.tryFail(new TimeoutException("Connect to " + target + " timed out after " + timeoutMs + "ms"))) {
                logger.warn("Connect to {} timed out after {}ms", target, timeoutMs);
            }
        });

        PgConnection.connect(vertx, options).onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.failed()) {
                logger.debug("Connect to {} failed: {}", target, ar.cause().getMessage());
                promise.tryFail(ar.cause());
                return;
            }
            VertxClientHandle client = new VertxClientHandle(this, ar.result(), target, onConnectionLost);
            if (promise.tryComplete(new ConnectResult(client, client.listenChannel()))) {
                logger.debug("Connected to {}", target);
            } else {
                logger.warn("Connection to {} established after timeout; closing it", target);
                client.markClosing();
                client.connection().close();
            }
        });
        return promise.future();
    }

    @Override
    public Future<Void> disconnect(ClientHandle client, boolean discard, ListenChannelHandle listenChannel) {
        VertxClientHandle handle;
        try {
            handle = clientOf(client);
            checkListenChannel(handle, listenChannel);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        handle.markClosing();
        if (discard) {
            return handle.connection().close();
        }
        return closeActiveCursor(handle).compose(v -> handle.connection().close());
    }

    @Override
    public Future<QueryResult> query(ClientHandle client, String sql, int batchSize, ListenChannelHandle listenChannel) {
        VertxClientHandle handle;
        try {
            handle = clientOf(client);
            checkListenChannel(handle, listenChannel);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        PgConnection connection = handle.connection();
        return closeActiveCursor(handle)
            .compose(v -> connection.begin())
            .compose(tx -> connection.prepare(sql)
                .recover(err -> tx.rollback().transform(ignored -> Future.<PreparedStatement>failedFuture(err)))
                .compose(statement -> {
                    VertxCursorHandle cursor = new VertxCursorHandle(handle, statement.cursor(), statement, tx);
                    handle.setActiveCursor(cursor);
                    return readBatch(cursor, batchSize).map(rows -> new QueryResult(cursor, rows));
                }));
    }

    @Override
    public Future<List<JsonObject>> moreQueryResults(ClientHandle client, CursorHandle cursor, int batchSize) {
        VertxClientHandle handle;
        VertxCursorHandle cursorHandle;
        try {
            handle = clientOf(client);
            if (!(cursor instanceof VertxCursorHandle vertxCursor) || vertxCursor.client() != handle) {
                throw new IllegalArgumentException("Cursor handle does not belong to this client");
            }
            cursorHandle = vertxCursor;
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return readBatch(cursorHandle, batchSize);
    }

    @Override
    public Future<Integer> executeSql(ClientHandle client, String sql) {
        VertxClientHandle handle;
        try {
            handle = clientOf(client);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return closeActiveCursor(handle)
            .compose(v -> handle.connection().query(sql).execute())
            .map(RowSet::rowCount);
    }

    @Override
    public Future<ListenChannelHandle> listen(ClientHandle client, String sql, Handler<Notification> onNotification) {
        VertxClientHandle handle;
        try {
            handle = clientOf(client);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        VertxListenChannel channel = handle.listenChannel();
        channel.setConsumer(Objects.requireNonNull(onNotification, "onNotification cannot be null"));
        return closeActiveCursor(handle)
            .compose(v -> handle.connection().query(sql).execute())
            .map(rows -> (ListenChannelHandle) channel);
    }

    @Override
    public Future<Void> unlisten(ClientHandle client, String sql, ListenChannelHandle listenChannel) {
        VertxClientHandle handle;
        try {
            handle = clientOf(client);
            checkListenChannel(handle, listenChannel);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return closeActiveCursor(handle)
            .compose(v -> handle.connection().query(sql).execute())
            .mapEmpty();
    }

    private Future<List<JsonObject>> readBatch(VertxCursorHandle cursor, int batchSize) {
        if (cursor.isFinished()) {
            return Future.succeededFuture(List.of());
        }
        return cursor.cursor().read(batchSize).compose(
            rowSet -> {
                List<JsonObject> rows = new ArrayList<>(rowSet.size());
                for (Row row : rowSet) {
                    rows.add(row.toJson());
                }
                if (cursor.cursor().hasMore()) {
                    return Future.succeededFuture(rows);
                }
                return finish(cursor, true).map(v -> rows);
            },
            err -> finish(cursor, false).transform(ignored -> Future.<List<JsonObject>>failedFuture(err)));
    }

    private Future<Void> closeActiveCursor(VertxClientHandle handle) {
        VertxCursorHandle active = handle.activeCursor();
        if (active == null || active.isFinished()) {
            return Future.succeededFuture();
        }
        logger.debug("Closing open cursor on {}", handle.target());
        return finish(active, true)
            .recover(err -> {
                logger.warn("Failed to close open cursor on {}: {}", handle.target(), err.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Closes the cursor and its statement, then commits or rolls back the transaction.
     */
    private Future<Void> finish(VertxCursorHandle cursor, boolean commit) {
        if (!cursor.markFinished()) {
            return Future.succeededFuture();
        }
        cursor.client().clearActiveCursor(cursor);
        return cursor.cursor().close()
            .transform(ignored -> cursor.statement().close())
            .transform(ignored -> commit ? cursor.transaction().commit() : cursor.transaction().rollback());
    }

    private VertxClientHandle clientOf(ClientHandle client) {
        if (!(client instanceof VertxClientHandle handle) || handle.driver() != this) {
            throw new IllegalArgumentException("Client handle was not created by this driver");
        }
        return handle;
    }

    private static void checkListenChannel(VertxClientHandle client, ListenChannelHandle listenChannel) {
        if (listenChannel != null && listenChannel != client.listenChannel()) {
            throw new IllegalArgumentException("Listen channel handle does not belong to this client");
        }
    }
}
