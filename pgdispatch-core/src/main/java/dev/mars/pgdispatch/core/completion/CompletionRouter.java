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

import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.error.DispatchError;
import dev.mars.pgdispatch.api.error.DispatchErrorCodes;
import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import dev.mars.pgdispatch.api.subscription.ListenEventType;
import dev.mars.pgdispatch.api.tagger.DisconnectTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.ExecuteTagger;
import dev.mars.pgdispatch.api.tagger.ListenTagger;
import dev.mars.pgdispatch.api.tagger.NotificationTagger;
import dev.mars.pgdispatch.api.tagger.QueryTagger;
import dev.mars.pgdispatch.core.dispatch.DispatcherInvariantException;
import dev.mars.pgdispatch.core.dispatch.Outbox;
import dev.mars.pgdispatch.core.registry.ConnectionRegistry;
import dev.mars.pgdispatch.core.registry.ConnectionState;
import dev.mars.pgdispatch.core.registry.ListenerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies completion events to the registry and forwards the resulting application messages.
 *
 * <p>Completions are correlated by connection id only. A completion for a connection that is
 * no longer registered (lost, failed or disconnected in the meantime) is stale: it is logged
 * and dropped and never re-creates the entry. A completion whose connection lacks the tagger
 * that the issuing command should have recorded is a dispatcher defect and raises
 * {@link DispatcherInvariantException}.</p>
 *
 * @param <M> The application message type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class CompletionRouter<M> {
    private static final Logger logger = LoggerFactory.getLogger(CompletionRouter.class);

    private final ConnectionRegistry<M> registry;
    private final NativeDriver driver;
    private final Outbox<M> outbox;
    private final DispatcherMetrics metrics;

    public CompletionRouter(ConnectionRegistry<M> registry, NativeDriver driver, Outbox<M> outbox,
                            DispatcherMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.driver = Objects.requireNonNull(driver, "driver cannot be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Routes one completion. Must be called on the dispatcher context.
     *
     * @throws DispatcherInvariantException if a required tagger was never recorded
     */
    public void route(Completion completion) {
        Objects.requireNonNull(completion, "completion cannot be null");
        ConnectionState<M> state = registry.find(completion.connectionId()).orElse(null);
        if (state == null) {
            dropStale(completion);
            return;
        }

        if (completion instanceof Completion.ConnectSucceeded connected) {
            onConnectSucceeded(state, connected);
        } else if (completion instanceof Completion.ConnectFailed failed) {
            onConnectFailed(state, failed);
        } else if (completion instanceof Completion.ConnectionLost lost) {
            onConnectionLost(state, lost);
        } else if (completion instanceof Completion.DisconnectSucceeded) {
            onDisconnectSucceeded(state);
        } else if (completion instanceof Completion.DisconnectFailed failed) {
            metrics.incrementNativeFailures("disconnect");
            logger.warn("Disconnect of connection {} failed: {}", state.getConnectionId(), failed.message());
            outbox.send(state.getErrorTagger().onError(
                DispatchError.disconnectFailed(state.getConnectionId(), failed.message())));
        } else if (completion instanceof Completion.QuerySucceeded rows) {
            QueryTagger<M> tagger = required(state.getQueryTagger(), "Query completed", state);
            state.setCursor(rows.cursor());
            outbox.send(tagger.onRows(state.getConnectionId(), rows.rows()));
        } else if (completion instanceof Completion.MoreRowsReceived rows) {
            QueryTagger<M> tagger = required(state.getQueryTagger(), "Query continuation completed", state);
            outbox.send(tagger.onRows(state.getConnectionId(), rows.rows()));
        } else if (completion instanceof Completion.ExecuteSucceeded executed) {
            ExecuteTagger<M> tagger = required(state.getExecuteTagger(), "Execute completed", state);
            outbox.send(tagger.onExecuted(state.getConnectionId(), executed.affectedRows()));
        } else if (completion instanceof Completion.SqlFailed failed) {
            metrics.incrementNativeFailures("sql");
            logger.debug("SQL on connection {} failed: {}", state.getConnectionId(), failed.message());
            outbox.send(state.getErrorTagger().onError(DispatchError.sqlFailed(DispatchErrorCodes.SQL_FAILED,
                state.getConnectionId(), failed.sql(), failed.message())));
        } else if (completion instanceof Completion.ListenSucceeded listened) {
            onListenSucceeded(state, listened);
        } else if (completion instanceof Completion.ListenFailed failed) {
            onListenFailed(state, failed);
        } else if (completion instanceof Completion.NotificationReceived notification) {
            NotificationTagger<M> tagger = required(state.getNotificationTagger(), "Notification received", state);
            metrics.incrementNotifications();
            outbox.send(tagger.onNotification(state.getConnectionId(), notification.channel(),
                notification.payload()));
        } else {
            throw new IllegalArgumentException("Unsupported completion type: " + completion.getClass().getName());
        }
    }

    private void onConnectSucceeded(ConnectionState<M> state, Completion.ConnectSucceeded connected) {
        state.setClient(connected.client());
        state.setListenChannel(connected.listenChannel());
        logger.info("Connection {} established", state.getConnectionId());
        outbox.send(state.getConnectTagger().onConnected(state.getConnectionId()));
    }

    private void onConnectFailed(ConnectionState<M> state, Completion.ConnectFailed failed) {
        registry.remove(state.getConnectionId());
        metrics.incrementNativeFailures("connect");
        metrics.recordRegisteredConnections(registry.size());
        logger.warn("Connection {} failed to connect: {}", state.getConnectionId(), failed.message());
        outbox.send(state.getErrorTagger().onError(
            DispatchError.connectFailed(state.getConnectionId(), failed.message())));
    }

    private void onConnectionLost(ConnectionState<M> state, Completion.ConnectionLost lost) {
        registry.remove(state.getConnectionId());
        metrics.incrementConnectionsLost();
        metrics.recordRegisteredConnections(registry.size());
        logger.error("Connection {} lost: {}", state.getConnectionId(), lost.reason());
        outbox.send(state.getConnectionLostTagger().onConnectionLost(state.getConnectionId(), lost.reason()));
    }

    private void onDisconnectSucceeded(ConnectionState<M> state) {
        DisconnectTagger<M> tagger = required(state.getDisconnectTagger(), "Disconnect completed", state);
        registry.remove(state.getConnectionId());
        metrics.recordRegisteredConnections(registry.size());
        logger.info("Connection {} closed", state.getConnectionId());
        outbox.send(tagger.onDisconnected(state.getConnectionId()));
    }

    private void onListenSucceeded(ConnectionState<M> state, Completion.ListenSucceeded listened) {
        ListenTagger<M> tagger;
        if (listened.type() == ListenEventType.LISTEN) {
            tagger = required(state.getListenTagger(), "LISTEN completed", state);
            state.setListenChannel(listened.listenChannel());
        } else {
            tagger = pendingUnlisten(state, listened.channel()).listenTagger();
        }
        logger.debug("Connection {} {} on channel '{}' completed", state.getConnectionId(),
            listened.type().tag(), listened.channel());
        outbox.send(tagger.onListenEvent(state.getConnectionId(), listened.channel(), listened.type()));
    }

    private void onListenFailed(ConnectionState<M> state, Completion.ListenFailed failed) {
        String code;
        ErrorTagger<M> errorTagger;
        if (failed.type() == ListenEventType.LISTEN) {
            registry.dropActiveListener(state.getConnectionId(), failed.channel());
            code = DispatchErrorCodes.LISTEN_FAILED;
            errorTagger = state.getErrorTagger();
        } else {
            code = DispatchErrorCodes.UNLISTEN_FAILED;
            errorTagger = pendingUnlisten(state, failed.channel()).errorTagger();
        }
        metrics.incrementNativeFailures(failed.type().tag());
        logger.warn("{} on channel '{}' failed for connection {}: {}", failed.type(), failed.channel(),
            state.getConnectionId(), failed.message());
        outbox.send(errorTagger.onError(
            DispatchError.sqlFailed(code, state.getConnectionId(), failed.sql(), failed.message())));
    }

    private void dropStale(Completion completion) {
        if (completion instanceof Completion.ConnectSucceeded orphan) {
            logger.warn("Connect completed for connection {} which is no longer registered; closing it",
                orphan.connectionId());
            driver.disconnect(orphan.client(), true, orphan.listenChannel())
                .onFailure(error -> logger.warn("Failed to close orphaned connection {}: {}",
                    orphan.connectionId(), error.getMessage()));
        } else if (completion instanceof Completion.NotificationReceived) {
            logger.debug("Dropping notification for unregistered connection {}", completion.connectionId());
        } else {
            logger.warn("Dropping stale completion {} for unregistered connection {}",
                completion.getClass().getSimpleName(), completion.connectionId());
        }
    }

    private ListenerState<M> pendingUnlisten(ConnectionState<M> state, String channel) {
        return required(state.takePendingUnlisten(channel), "UNLISTEN of '" + channel + "' completed", state);
    }

    private <T> T required(T tagger, String event, ConnectionState<M> state) {
        if (tagger == null) {
            throw new DispatcherInvariantException(event + " but the issuing command recorded no tagger",
                state.getConnectionId(), registry.snapshot());
        }
        return tagger;
    }
}
