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
package dev.mars.pgdispatch.core.dispatch;

import dev.mars.pgdispatch.api.command.Command;
import dev.mars.pgdispatch.api.command.Connect;
import dev.mars.pgdispatch.api.command.Disconnect;
import dev.mars.pgdispatch.api.command.ExecuteSql;
import dev.mars.pgdispatch.api.command.MoreQueryResults;
import dev.mars.pgdispatch.api.command.Query;
import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.error.DispatchError;
import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.core.completion.Completion;
import dev.mars.pgdispatch.core.completion.CompletionSink;
import dev.mars.pgdispatch.core.registry.ConnectionRegistry;
import dev.mars.pgdispatch.core.registry.ConnectionState;
import dev.mars.pgdispatch.core.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates submitted commands against the registry and issues the matching native call.
 *
 * <p>Before issuing a call the dispatcher records on the connection entry which taggers
 * should interpret the completion, so that the {@link dev.mars.pgdispatch.core.completion.CompletionRouter}
 * can turn it into an application message. Driver outcomes are posted to the
 * {@link CompletionSink}; nothing here waits for them.</p>
 *
 * <p>A command naming an unknown connection id delivers
 * {@code (connectionId, "Invalid connectionId")} to its own error tagger and issues no
 * native call. A command against a registered connection whose connect has not yet
 * completed is rejected the same way with {@code "Connection not established"}.</p>
 *
 * @param <M> The application message type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class CommandDispatcher<M> {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final ConnectionRegistry<M> registry;
    private final NativeDriver driver;
    private final CompletionSink completions;
    private final Outbox<M> outbox;
    private final DispatcherMetrics metrics;
    private final long connectTimeoutMs;

    public CommandDispatcher(ConnectionRegistry<M> registry, NativeDriver driver, CompletionSink completions,
                             Outbox<M> outbox, DispatcherMetrics metrics, long connectTimeoutMs) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.driver = Objects.requireNonNull(driver, "driver cannot be null");
        this.completions = Objects.requireNonNull(completions, "completions cannot be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("Connect timeout must be positive, got: " + connectTimeoutMs);
        }
        this.connectTimeoutMs = connectTimeoutMs;
    }

    /**
     * Handles one command. Must be called on the dispatcher context.
     *
     * @throws DispatcherInvariantException if a continuation finds no active query
     */
    public void dispatch(Command<M> command) {
        Objects.requireNonNull(command, "command cannot be null");
        metrics.incrementCommands(command.name());
        logger.debug("Dispatching {}", command);

        if (command instanceof Connect<M> connect) {
            handleConnect(connect);
        } else if (command instanceof Disconnect<M> disconnect) {
            handleDisconnect(disconnect);
        } else if (command instanceof Query<M> query) {
            handleQuery(query);
        } else if (command instanceof MoreQueryResults<M> more) {
            handleMoreQueryResults(more);
        } else if (command instanceof ExecuteSql<M> execute) {
            handleExecuteSql(execute);
        } else {
            throw new IllegalArgumentException("Unsupported command type: " + command.getClass().getName());
        }
    }

    private void handleConnect(Connect<M> connect) {
        ConnectionState<M> state = registry.register(connect.errorTagger(), connect.connectTagger(),
            connect.connectionLostTagger());
        int connectionId = state.getConnectionId();
        metrics.recordRegisteredConnections(registry.size());
        logger.info("Opening connection {} to {}:{}/{} as user {}", connectionId, connect.host(), connect.port(),
            connect.database(), connect.user());

        driver.connect(connectTimeoutMs, connect.host(), connect.port(), connect.database(), connect.user(),
                connect.password(),
                cause -> completions.post(new Completion.ConnectionLost(connectionId, Failures.messageOf(cause))))
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.ConnectSucceeded(connectionId, ar.result().client(),
                        ar.result().listenChannel()));
                } else {
                    completions.post(new Completion.ConnectFailed(connectionId, Failures.messageOf(ar.cause())));
                }
            });
    }

    private void handleDisconnect(Disconnect<M> disconnect) {
        ConnectionState<M> state = resolveConnected(disconnect.connectionId(), disconnect.errorTagger());
        if (state == null) {
            return;
        }
        int connectionId = state.getConnectionId();
        state.setErrorTagger(disconnect.errorTagger());
        state.setDisconnectTagger(disconnect.disconnectTagger());
        logger.info("Closing connection {} (discard={})", connectionId, disconnect.discard());

        driver.disconnect(state.getClient(), disconnect.discard(), state.getListenChannel())
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.DisconnectSucceeded(connectionId));
                } else {
                    completions.post(new Completion.DisconnectFailed(connectionId, Failures.messageOf(ar.cause())));
                }
            });
    }

    private void handleQuery(Query<M> query) {
        ConnectionState<M> state = resolveConnected(query.connectionId(), query.errorTagger());
        if (state == null) {
            return;
        }
        int connectionId = state.getConnectionId();
        String sql = query.sql();
        state.setErrorTagger(query.errorTagger());
        state.setQueryTagger(query.queryTagger());
        state.setSql(sql);
        state.setBatchSize(query.batchSize());

        driver.query(state.getClient(), sql, query.batchSize(), state.getListenChannel())
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.QuerySucceeded(connectionId, ar.result().cursor(),
                        ar.result().rows()));
                } else {
                    completions.post(new Completion.SqlFailed(connectionId, sql, Failures.messageOf(ar.cause())));
                }
            });
    }

    private void handleMoreQueryResults(MoreQueryResults<M> more) {
        ConnectionState<M> state = resolveConnected(more.connectionId(), more.errorTagger());
        if (state == null) {
            return;
        }
        int connectionId = state.getConnectionId();
        String sql = state.getSql();
        Integer batchSize = state.getBatchSize();
        if (sql == null || batchSize == null || state.getCursor() == null) {
            throw new DispatcherInvariantException(
                "More query results requested with no active query (sql=" + (sql != null)
                    + ", batchSize=" + (batchSize != null) + ", cursor=" + (state.getCursor() != null) + ")",
                connectionId, registry.snapshot());
        }
        state.setErrorTagger(more.errorTagger());
        state.setQueryTagger(more.queryTagger());

        driver.moreQueryResults(state.getClient(), state.getCursor(), batchSize)
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.MoreRowsReceived(connectionId, ar.result()));
                } else {
                    completions.post(new Completion.SqlFailed(connectionId, sql, Failures.messageOf(ar.cause())));
                }
            });
    }

    private void handleExecuteSql(ExecuteSql<M> execute) {
        ConnectionState<M> state = resolveConnected(execute.connectionId(), execute.errorTagger());
        if (state == null) {
            return;
        }
        int connectionId = state.getConnectionId();
        String sql = execute.sql();
        state.setErrorTagger(execute.errorTagger());
        state.setExecuteTagger(execute.executeTagger());
        state.setSql(sql);

        driver.executeSql(state.getClient(), sql)
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.ExecuteSucceeded(connectionId, ar.result()));
                } else {
                    completions.post(new Completion.SqlFailed(connectionId, sql, Failures.messageOf(ar.cause())));
                }
            });
    }

    /**
     * Looks up a connection that has a client handle, reporting to {@code errorTagger} when there is none.
     *
     * @return The connection entry, or null after an error has been reported
     */
    private ConnectionState<M> resolveConnected(int connectionId, ErrorTagger<M> errorTagger) {
        ConnectionState<M> state = registry.find(connectionId).orElse(null);
        if (state == null) {
            logger.debug("Rejecting command for unknown connection {}", connectionId);
            metrics.incrementInvalidConnectionIds();
            outbox.send(errorTagger.onError(DispatchError.invalidConnectionId(connectionId)));
            return null;
        }
        if (!state.isConnected()) {
            logger.debug("Rejecting command for connection {} which is still connecting", connectionId);
            outbox.send(errorTagger.onError(DispatchError.notConnected(connectionId)));
            return null;
        }
        return state;
    }
}
